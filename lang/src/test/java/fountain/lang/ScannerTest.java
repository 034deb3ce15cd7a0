package fountain.lang;

import static fountain.lang.Token.Type.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class ScannerTest {

    private static List<Token> scan(String source) {
        var scanner = new Scanner(source);
        var tokens = new ArrayList<Token>();
        Token token;
        do {
            token = scanner.nextToken();
            tokens.add(token);
        } while (token.type() != EOF);
        return tokens;
    }

    private static List<Token.Type> types(String source) {
        return scan(source).stream()
            .map(Token::type)
            .collect(Collectors.toList());
    }

    @Test
    void operatorsAndDelimiters() {
        assertEquals(
            List.of(PLUS, MINUS, STAR, SLASH, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
                EQUAL_EQUAL, BANG_EQUAL, EQUAL, PAREN_LEFT, PAREN_RIGHT, BRACE_LEFT, BRACE_RIGHT,
                BRACKET_LEFT, BRACKET_RIGHT, COMMA, DOT, SEMICOLON, EOF),
            types("+ - * / < <= > >= == != = ( ) { } [ ] , . ;"));
    }

    @Test
    void compoundAssignmentOperators() {
        assertEquals(List.of(IDENTIFIER, PLUS_EQUAL, NUMBER, IDENTIFIER, MINUS_EQUAL, NUMBER,
                IDENTIFIER, STAR_EQUAL, NUMBER, IDENTIFIER, SLASH_EQUAL, NUMBER, EOF),
            types("a += 1 b -= 2 c *= 3 d /= 4"));
    }

    @Test
    void keywordsAndIdentifiers() {
        assertEquals(
            List.of(TRUE, FALSE, NIL, PRINT, IF, ELSE, FOR, FN, RETURN, BREAK, CONTINUE,
                ASSERT, AND, OR, NOT, DO, END, EOF),
            types("true false nil print if else for fn return break continue assert and or not do end"));
        assertEquals(List.of(IDENTIFIER, IDENTIFIER, IDENTIFIER, EOF), types("ends _do2 printer"));
    }

    @Test
    void numbers() {
        var tokens = scan("12 3.25 7.");
        assertEquals(new Token(NUMBER, "12", 1, 1), tokens.get(0));
        assertEquals(new Token(NUMBER, "3.25", 1, 4), tokens.get(1));
        // a trailing dot is not part of the number
        assertEquals(new Token(NUMBER, "7", 1, 9), tokens.get(2));
        assertEquals(DOT, tokens.get(3).type());
    }

    @Test
    void stringsInBothQuotes() {
        var tokens = scan("\"it's\" 'say \"hi\"'");
        assertEquals(new Token(STRING, "\"it's\"", 1, 1), tokens.get(0));
        assertEquals(new Token(STRING, "'say \"hi\"'", 1, 8), tokens.get(1));
    }

    @Test
    void commentsRunToEndOfLine() {
        assertEquals(List.of(NUMBER, PLUS, NUMBER, NUMBER, EOF), types("1 + 2 -- three\n4 -- done"));
        assertEquals(List.of(MINUS, MINUS, NUMBER, EOF), types("- - 5"));
    }

    @Test
    void tracksLinesAndColumns() {
        var tokens = scan("x = 1\n  print x\n");
        assertEquals(new Token(IDENTIFIER, "x", 1, 1), tokens.get(0));
        assertEquals(new Token(PRINT, "print", 2, 3), tokens.get(3));
        assertEquals(new Token(IDENTIFIER, "x", 2, 9), tokens.get(4));
        assertEquals(new Token(EOF, "", 3, 1), tokens.get(5));
    }

    @Test
    void eofRepeatsOnceReached() {
        var scanner = new Scanner("a");
        assertEquals(IDENTIFIER, scanner.nextToken().type());
        var eof = scanner.nextToken();
        assertEquals(EOF, eof.type());
        assertEquals(eof, scanner.nextToken());
    }

    @ParameterizedTest
    @ValueSource(strings = {"!", "@", "#", "$", "x ! y"})
    void invalidCharacters(String source) {
        var error = assertThrows(LexError.class, () -> scan(source));
        assertEquals(1, error.getLine());
    }

    @Test
    void invalidCharacterPosition() {
        var error = assertThrows(LexError.class, () -> scan("a = 1\nb = @"));
        assertEquals("invalid character: '@'", error.getMessage());
        assertEquals(2, error.getLine());
        assertEquals(5, error.getColumn());
    }

    @Test
    void unterminatedStringAtEndOfLine() {
        var error = assertThrows(LexError.class, () -> scan("'hello\nworld'"));
        assertEquals("unterminated string: EOL while scanning string literal", error.getMessage());
        assertEquals(1, error.getLine());
    }

    @Test
    void unterminatedStringAtEndOfFile() {
        var error = assertThrows(LexError.class, () -> scan("x = 'hello\""));
        assertEquals("unterminated string: EOF while scanning string literal", error.getMessage());
        assertEquals(5, error.getColumn());
    }

    @Test
    void tokensBeforeAnErrorAreProduced() {
        var scanner = new Scanner("a b @");
        assertEquals(IDENTIFIER, scanner.nextToken().type());
        assertEquals(IDENTIFIER, scanner.nextToken().type());
        assertThrows(LexError.class, scanner::nextToken);
    }
}
