package in.castsync.infrastructure.obs;

/**
 * Frame role tags of the control protocol ({@code "op"} field).
 */
public enum ObsOpCode {
    HELLO(0),
    IDENTIFY(1),
    IDENTIFIED(2),
    EVENT(5),
    REQUEST(6),
    REQUEST_RESPONSE(7);

    private final int code;

    ObsOpCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @return matching opcode, or null for opcodes this client does not speak
     */
    public static ObsOpCode fromCode(int code) {
        for (ObsOpCode op : values()) {
            if (op.code == code) {
                return op;
            }
        }
        return null;
    }
}
