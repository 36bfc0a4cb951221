package in.castsync.application.service;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Exception thrown when a {@link in.castsync.application.port.output.StreamService} call fails.
 */
public class StreamPersistenceException extends RuntimeException {

    private final String operation;
    private final String commonId;

    public StreamPersistenceException(String operation, String commonId, Throwable cause) {
        super(String.format("[STORE:%s] %s failed: %s", commonId, operation, cause.getMessage()), cause);
        this.operation = operation;
        this.commonId = commonId;
    }

    public String getOperation() {
        return operation;
    }

    public String getCommonId() {
        return commonId;
    }

    /**
     * Wait for a store call, rethrowing its failure unwrapped.
     */
    static <T> T await(CompletableFuture<T> future, String operation, String commonId) {
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            throw new StreamPersistenceException(operation, commonId, cause);
        }
    }
}
