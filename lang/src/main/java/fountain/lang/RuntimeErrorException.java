package fountain.lang;

/**
 * Failure raised while a program executes.
 */
public abstract class RuntimeErrorException extends FountainException {

    RuntimeErrorException(Token token, String message) {
        super(message, token);
    }

    RuntimeErrorException(String message) {
        super(message, 0, 0);
    }
}
