package fountain.lang;

import lombok.NonNull;

/**
 * One item of a table literal. A {@code null} key means the item is positional
 * and takes the next auto-index.
 */
record TableEntry(Expr key, @NonNull Expr value) {

    boolean isPositional() {
        return key == null;
    }
}
