package fountain.lang;

/**
 * {@code break} or {@code continue} outside a loop, or {@code return} outside a function.
 */
public class ControlFlowError extends RuntimeErrorException {

    ControlFlowError(Token token, String message) {
        super(token, message);
    }
}
