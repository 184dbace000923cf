package miniredis.error;

public class InvalidCommandException extends MiniRedisException {

    private final String command;

    public InvalidCommandException(String command) {
        super(ErrorKind.INVALID_COMMAND, "Invalid command: " + command);
        this.command = command;
    }

    public String command() {
        return command;
    }
}
