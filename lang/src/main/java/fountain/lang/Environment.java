package fountain.lang;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One scope of name bindings, chained to its enclosing scope.
 *
 * <p>There is no declaration keyword: assigning a name updates the nearest
 * scope that binds it, and binds it in this scope when none does.
 */
final class Environment {

    private final Environment enclosing;
    private final Map<String, Value> values = new LinkedHashMap<>();

    Environment() {
        this(null);
    }

    Environment(Environment enclosing) {
        this.enclosing = enclosing;
    }

    /**
     * Binds {@code name} in this scope, shadowing any outer binding.
     */
    void define(String name, Value value) {
        values.put(name, value);
    }

    /**
     * Updates the nearest binding of {@code name}, or defines it here if no scope binds it.
     */
    void assign(String name, Value value) {
        var scope = find(name);
        (scope != null ? scope : this).values.put(name, value);
    }

    /**
     * @throws UndefinedNameError if no scope in the chain binds the name
     */
    Value get(Token name) {
        return lookup(name.lexeme()).orElseThrow(() -> new UndefinedNameError(name));
    }

    Optional<Value> lookup(String name) {
        var scope = find(name);
        return scope != null ? Optional.of(scope.values.get(name)) : Optional.empty();
    }

    private Environment find(String name) {
        var environment = this;
        while (environment != null) {
            if (environment.values.containsKey(name)) {
                return environment;
            }
            environment = environment.enclosing;
        }
        return null;
    }
}
