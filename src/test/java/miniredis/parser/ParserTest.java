package miniredis.parser;

import miniredis.lexer.Lexer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ParserTest {

    private final Lexer lexer = new Lexer();
    private final Parser parser = new Parser();

    private Optional<Request> parse(String line) {
        return parser.parse(lexer.tokenize(line));
    }

    @Test
    void test_parseGet() {
        assertEquals(Optional.of(new Request("GET", List.of("mykey"))), parse("GET mykey"));
    }

    @Test
    void test_parseSet() {
        assertEquals(Optional.of(new Request("SET", List.of("mykey", "myvalue"))), parse("SET mykey myvalue"));
    }

    @Test
    void test_parseDel() {
        assertEquals(Optional.of(new Request("DEL", List.of("mykey"))), parse("DEL mykey"));
    }

    @Test
    void test_commandNameIsUpperCased() {
        assertEquals("GET", parse("get mykey").orElseThrow().command());
        assertEquals("GET", parse("GeT mykey").orElseThrow().command());
    }

    @Test
    void test_argumentsKeepTheirCase() {
        assertEquals(List.of("MyKey", "MyValue"), parse("set MyKey MyValue").orElseThrow().arguments());
    }

    @Test
    void test_unknownCommandStillParses() {
        Request request = parse("foo bar baz").orElseThrow();
        assertEquals("FOO", request.command());
        assertEquals(2, request.arity());
    }

    @Test
    void test_commandWithoutArguments() {
        Request request = parse("GET").orElseThrow();
        assertEquals(0, request.arity());
    }

    @Test
    void test_blankLineHasNoCommand() {
        assertTrue(parse("").isEmpty());
        assertTrue(parse("   ").isEmpty());
    }
}
