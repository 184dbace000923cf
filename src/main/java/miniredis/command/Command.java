package miniredis.command;

import java.util.Arrays;
import java.util.Optional;

public enum Command {
    GET(1),
    SET(2),
    DEL(1);

    private final int arity;

    Command(int arity) {
        this.arity = arity;
    }

    public int arity() {
        return arity;
    }

    /** Looks up an upper-cased command name; unknown names yield empty. */
    public static Optional<Command> lookup(String name) {
        return Arrays.stream(values())
                .filter(command -> command.name().equals(name))
                .findFirst();
    }
}
