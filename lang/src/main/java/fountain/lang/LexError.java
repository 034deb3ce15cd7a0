package fountain.lang;

/**
 * Bad character or unterminated literal in the source text.
 */
public class LexError extends FountainException {

    LexError(String message, int line, int column) {
        super(message, line, column);
    }
}
