package work.lcod.specdoc.shared;

/**
 * Base of every generation failure. The {@link #code()} is a short, stable identifier reported
 * in run results; the message is meant for humans.
 */
public class SpecDocException extends RuntimeException {
    private final String code;

    public SpecDocException(String code, String message) {
        super(message);
        this.code = code;
    }

    public SpecDocException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
