package fountain.lang;

import static java.util.Map.entry;
import static fountain.lang.Token.Type.*;

import java.util.Map;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Turns source text into tokens, one {@link #nextToken()} call at a time.
 *
 * <p>Whitespace and {@code --} comments are skipped. Once the end of the
 * source is reached every further call returns the same {@code EOF} token.
 * A {@link LexError} leaves the scanner positioned after the offending
 * character; callers are expected to stop there.
 */
@RequiredArgsConstructor
final class Scanner {

    static final Map<String, Token.Type> KEYWORDS = Map.ofEntries(
        entry("and", AND),
        entry("assert", ASSERT),
        entry("break", BREAK),
        entry("continue", CONTINUE),
        entry("do", DO),
        entry("else", ELSE),
        entry("end", END),
        entry("false", FALSE),
        entry("fn", FN),
        entry("for", FOR),
        entry("if", IF),
        entry("nil", NIL),
        entry("not", NOT),
        entry("or", OR),
        entry("print", PRINT),
        entry("return", RETURN),
        entry("true", TRUE));

    private final @NonNull String source;

    private int start = 0;
    private int current = 0;
    private int lineStart = 0;
    private int line = 1;
    private Token eof = null;

    Token nextToken() {
        if (eof != null) {
            return eof;
        }

        while (!isAtEnd()) {
            start = current;
            var token = scanToken();
            if (token != null) {
                return token;
            }
        }

        start = current; // report the correct EOF column
        eof = new Token(EOF, "", line, getColumn());
        return eof;
    }

    private int getColumn() {
        return 1 + start - lineStart;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    /**
     * @return the next token, or {@code null} if only whitespace or a comment was consumed
     */
    private Token scanToken() {
        var c = advance();
        switch (c) {
        case '(':
            return token(PAREN_LEFT);
        case ')':
            return token(PAREN_RIGHT);
        case '{':
            return token(BRACE_LEFT);
        case '}':
            return token(BRACE_RIGHT);
        case '[':
            return token(BRACKET_LEFT);
        case ']':
            return token(BRACKET_RIGHT);
        case ',':
            return token(COMMA);
        case '.':
            return token(DOT);
        case ';':
            return token(SEMICOLON);
        case '+':
            return token(match('=') ? PLUS_EQUAL : PLUS);
        case '*':
            return token(match('=') ? STAR_EQUAL : STAR);
        case '/':
            return token(match('=') ? SLASH_EQUAL : SLASH);
        case '-':
            if (match('-')) {
                while (peek() != '\n' && !isAtEnd()) {
                    advance();
                }
                return null;
            }
            return token(match('=') ? MINUS_EQUAL : MINUS);
        case '=':
            return token(match('=') ? EQUAL_EQUAL : EQUAL);
        case '<':
            return token(match('=') ? LESS_EQUAL : LESS);
        case '>':
            return token(match('=') ? GREATER_EQUAL : GREATER);
        case '!':
            if (match('=')) {
                return token(BANG_EQUAL);
            }
            throw error("invalid character: '!'");

        // whitespace
        case ' ':
        case '\r':
        case '\t':
            return null;

        case '\n':
            line++;
            lineStart = current;
            return null;

        case '"':
        case '\'':
            return string(c);

        default:
            if (isDigit(c)) {
                return number();
            } else if (isAlpha(c)) {
                return identifier();
            }
            throw error("invalid character: '" + c + "'");
        }
    }

    static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z')
            || (c >= 'A' && c <= 'Z')
            || c == '_';
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private Token identifier() {
        while (isAlphaNumeric(peek())) {
            advance();
        }
        var text = source.substring(start, current);
        return token(KEYWORDS.getOrDefault(text, IDENTIFIER));
    }

    private Token number() {
        while (isDigit(peek())) {
            advance();
        }

        if (peek() == '.' && isDigit(peekNext())) {
            // consume the decimal
            advance();

            while (isDigit(peek())) {
                advance();
            }
        }
        return token(NUMBER);
    }

    private Token string(char quote) {
        while (peek() != quote && !isAtEnd()) {
            if (peek() == '\n') {
                throw error("unterminated string: EOL while scanning string literal");
            }
            advance();
        }
        if (isAtEnd()) {
            throw error("unterminated string: EOF while scanning string literal");
        }
        advance(); // closing quote
        return token(STRING);
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd()) {
            return false;
        }
        if (source.charAt(current) != expected) {
            return false;
        }

        current++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) {
            return '\0';
        }
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) {
            return '\0';
        }
        return source.charAt(current + 1);
    }

    private Token token(Token.Type type) {
        var text = source.substring(start, current);
        return new Token(type, text, line, getColumn());
    }

    private LexError error(String msg) {
        return new LexError(msg, line, getColumn());
    }
}
