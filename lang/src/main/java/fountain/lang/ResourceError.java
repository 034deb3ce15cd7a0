package fountain.lang;

/**
 * Recursion went deeper than the interpreter allows.
 */
public class ResourceError extends RuntimeErrorException {

    ResourceError(Token token, String message) {
        super(token, message);
    }

    ResourceError(String message) {
        super(message);
    }
}
