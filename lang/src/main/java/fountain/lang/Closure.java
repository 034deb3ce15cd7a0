package fountain.lang;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * A user-declared function paired with the environment it was declared in.
 *
 * <p>The environment is shared, not copied: the closure observes later
 * changes to the variables of its declaring scope.
 */
@Getter
@RequiredArgsConstructor
final class Closure implements Callable {

    private final @NonNull Stmt.Function declaration;
    private final @NonNull Environment closure;

    @Override
    public String name() {
        return declaration.name().lexeme();
    }

    @Override
    public List<String> parameterNames() {
        return declaration.params().stream()
            .map(param -> param.name().lexeme())
            .collect(Collectors.toUnmodifiableList());
    }

    List<Parameter> parameters() {
        return declaration.params();
    }

    @Override
    public String toString() {
        return "<function " + name() + ">";
    }
}
