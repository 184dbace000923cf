package miniredis.error;

public class AddressNotBoundException extends MiniRedisException {

    public AddressNotBoundException(String address, Throwable cause) {
        super(ErrorKind.ADDRESS_NOT_BOUND, "Address not bound: " + address, cause);
    }
}
