package fountain.lang;

import java.util.List;

/**
 * A function value: either a closure declared in fountain code or a {@link Builtin} supplied by the host.
 *
 * <p>Both kinds are called through the same binding rules: positional
 * arguments fill parameters left to right, named arguments fill parameters by
 * name, and unfilled parameters take their defaults.
 */
public sealed interface Callable extends Value permits Closure, Builtin {

    String name();

    List<String> parameterNames();

    @Override
    default String typeName() {
        return "function";
    }
}
