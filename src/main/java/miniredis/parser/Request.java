package miniredis.parser;

import java.util.List;

/**
 * One parsed line: the upper-cased command name and its arguments in order.
 */
public record Request(String command, List<String> arguments) {

    public Request {
        arguments = List.copyOf(arguments);
    }

    public int arity() {
        return arguments.size();
    }

    public String argument(int index) {
        return arguments.get(index);
    }
}
