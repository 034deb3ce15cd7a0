package fountain.lang;

import lombok.NonNull;

/**
 * A {@code name = value} argument of a call.
 */
record NamedArgument(@NonNull Token name, @NonNull Expr value) {}
