package fountain.lang;

import static fountain.lang.Token.Type.EOF;
import static fountain.lang.Token.Type.IDENTIFIER;
import static fountain.lang.Token.Type.NUMBER;
import static fountain.lang.Token.Type.SEMICOLON;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TokenStreamTest {

    TokenStream stream;

    boolean expectAtEnd;

    private void assertNextToken(Token expect) {
        assertEquals(expectAtEnd, stream.isAtEnd());
        assertEquals(expect, stream.peek());
        assertEquals(expect, stream.advance());
        assertEquals(expect, stream.previous());
    }

    @BeforeEach
    void setUp() {
        var source = "hello;\nworld;42\n";
        stream = new TokenStream(new Scanner(source));
        expectAtEnd = false;
    }

    @Test
    void visible() {
        assertNextToken(new Token(IDENTIFIER, "hello", 1, 1));
        assertNextToken(new Token(SEMICOLON, ";", 1, 6));
        assertNextToken(new Token(IDENTIFIER, "world", 2, 1));
        assertNextToken(new Token(SEMICOLON, ";", 2, 6));
        assertNextToken(new Token(NUMBER, "42", 2, 7));
        expectAtEnd = true;
        assertNextToken(new Token(EOF, "", 3, 1));
        // advancing past the end stays on EOF
        assertNextToken(new Token(EOF, "", 3, 1));
    }

    @Test
    void peekNextLooksOneAhead() {
        assertEquals(new Token(IDENTIFIER, "hello", 1, 1), stream.peek());
        assertEquals(new Token(SEMICOLON, ";", 1, 6), stream.peekNext());
        assertEquals(new Token(IDENTIFIER, "hello", 1, 1), stream.advance());
    }

    @Test
    void resetRewindsToMark() {
        stream.advance();
        var mark = stream.mark();
        stream.advance();
        stream.advance();
        assertEquals(new Token(IDENTIFIER, "world", 2, 1), stream.previous());

        stream.reset(mark);

        assertEquals(new Token(IDENTIFIER, "hello", 1, 1), stream.previous());
        assertEquals(new Token(SEMICOLON, ";", 1, 6), stream.peek());
    }

    @Test
    void scansOnlyWhatIsLookedAt() {
        stream = new TokenStream(new Scanner("a b @"));
        assertEquals(IDENTIFIER, stream.advance().type());
        assertEquals(1, stream.scannedTokens().size());
        assertEquals(IDENTIFIER, stream.advance().type());
        assertThrows(LexError.class, stream::peek);
    }
}
