package fountain.lang;

import lombok.Getter;

/**
 * An {@code assert} whose condition was falsy.
 */
public class FailedAssertionError extends RuntimeErrorException {

    static final String DEFAULT_MESSAGE = "assertion failed";

    /** The evaluated message expression, or the default message as a string. */
    @Getter
    private final Value payload;

    FailedAssertionError(Token token, Value payload) {
        super(token, Values.stringify(payload));
        this.payload = payload;
    }

    @Override
    public String getKind() {
        return "AssertionError";
    }
}
