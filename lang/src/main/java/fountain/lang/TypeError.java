package fountain.lang;

/**
 * Operand of the wrong kind, or a call of something that is not a function.
 */
public class TypeError extends RuntimeErrorException {

    TypeError(Token token, String message) {
        super(token, message);
    }
}
