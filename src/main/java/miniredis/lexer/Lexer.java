package miniredis.lexer;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

import java.util.List;

public class Lexer {

    private static final Splitter WHITESPACE = Splitter.on(CharMatcher.whitespace())
            .omitEmptyStrings();

    /**
     * Splits a line on runs of whitespace. A null, empty or blank line yields no tokens.
     */
    public List<String> tokenize(String line) {
        if (line == null || line.isBlank()) {
            return List.of();
        }
        return WHITESPACE.splitToList(line);
    }
}
