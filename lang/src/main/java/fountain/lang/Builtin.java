package fountain.lang;

import java.util.List;

import lombok.NonNull;

/**
 * A function implemented by the host and injected into the global environment.
 *
 * <p>Every parameter is required. The body receives the bound arguments in
 * parameter order; returning {@code null} is the same as returning {@code nil}.
 */
public final class Builtin implements Callable {

    @FunctionalInterface
    public interface Body {
        Value call(List<Value> arguments);
    }

    private final String name;
    private final List<String> parameterNames;
    private final Body body;

    public Builtin(@NonNull String name, @NonNull List<String> parameterNames, @NonNull Body body) {
        this.name = name;
        this.parameterNames = List.copyOf(parameterNames);
        this.body = body;
    }

    public static Builtin of(String name, Body body, String... parameterNames) {
        return new Builtin(name, List.of(parameterNames), body);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<String> parameterNames() {
        return parameterNames;
    }

    Value call(List<Value> arguments) {
        var result = body.call(arguments);
        return result != null ? result : Value.NIL;
    }

    @Override
    public String toString() {
        return "<built-in function " + name + ">";
    }
}
