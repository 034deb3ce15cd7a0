package fountain.lang;

import lombok.Getter;

/**
 * First grammar violation found in a program.
 */
public class ParseError extends FountainException {

    @Getter
    private final boolean atEnd;

    ParseError(Token token, String message) {
        super(message, token);
        this.atEnd = token.type() == Token.Type.EOF;
    }
}
