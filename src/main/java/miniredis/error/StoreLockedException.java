package miniredis.error;

public class StoreLockedException extends MiniRedisException {

    public StoreLockedException(Throwable cause) {
        super(ErrorKind.STORE_LOCKED, "Store is locked", cause);
    }
}
