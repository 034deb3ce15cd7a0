package fountain.lang;

import lombok.NonNull;

/**
 * A declared function parameter; {@code defaultValue} is {@code null} when the parameter is required.
 */
record Parameter(@NonNull Token name, Expr defaultValue) {

    boolean hasDefault() {
        return defaultValue != null;
    }
}
