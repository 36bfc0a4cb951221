package in.castsync.infrastructure.obs;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Challenge-response for the identify handshake:
 * {@code base64(sha256(base64(sha256(password + salt)) + challenge))}.
 */
public final class ObsAuthenticator {

    public static String authResponse(String password, String salt, String challenge) {
        String secret = base64Sha256(password + salt);
        return base64Sha256(secret + challenge);
    }

    private static String base64Sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private ObsAuthenticator() {}
}
