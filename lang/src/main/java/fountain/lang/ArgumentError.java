package fountain.lang;

/**
 * Arguments of a call do not match the parameters of the callee.
 */
public class ArgumentError extends RuntimeErrorException {

    ArgumentError(Token token, String message) {
        super(token, message);
    }
}
