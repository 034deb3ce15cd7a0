package fountain.lang;

import lombok.Getter;

/**
 * Read of a name that no enclosing scope binds.
 */
public class UndefinedNameError extends RuntimeErrorException {

    @Getter
    private final String name;

    UndefinedNameError(Token token) {
        super(token, "name '" + token.lexeme() + "' is not defined");
        this.name = token.lexeme();
    }
}
