package miniredis.error;

import java.util.List;

public class InvalidArgumentsException extends MiniRedisException {

    private final List<String> arguments;

    public InvalidArgumentsException(List<String> arguments) {
        super(ErrorKind.INVALID_ARGUMENTS, "Invalid arguments: " + arguments);
        this.arguments = List.copyOf(arguments);
    }

    public List<String> arguments() {
        return arguments;
    }
}
