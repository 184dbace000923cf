package miniredis.error;

/**
 * Base type for every failure the server reports. The message is what a client sees
 * when the error is rendered as a response line.
 */
public class MiniRedisException extends Exception {

    private final ErrorKind kind;

    public MiniRedisException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MiniRedisException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
