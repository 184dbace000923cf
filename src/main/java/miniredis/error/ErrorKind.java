package miniredis.error;

public enum ErrorKind {
    STORE_LOCKED,

    INVALID_COMMAND,
    INVALID_ARGUMENTS,

    STREAM_CLOSED,
    STREAM_NOT_READABLE,
    STREAM_NOT_WRITABLE,
    STREAM_NOT_CONNECTED,
    ADDRESS_NOT_BOUND,

    STREAM_NOT_FLUSHED
}
