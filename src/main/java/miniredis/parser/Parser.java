package miniredis.parser;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class Parser {

    /**
     * Builds a request from lexer tokens. No tokens means the line carried no command,
     * which callers skip without answering.
     */
    public Optional<Request> parse(List<String> tokens) {
        if (tokens.isEmpty()) {
            return Optional.empty();
        }

        String command = tokens.get(0).toUpperCase(Locale.ROOT);
        return Optional.of(new Request(command, tokens.subList(1, tokens.size())));
    }
}
