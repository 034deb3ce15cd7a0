package fountain.lang;

/**
 * How a statement finished. {@code break}, {@code continue} and {@code return}
 * travel outward as completions until a loop or call frame consumes them.
 */
sealed interface Completion {

    Completion NORMAL = new Normal();

    default boolean isNormal() {
        return this instanceof Normal;
    }

    record Normal() implements Completion {}

    record Break(Token keyword) implements Completion {}

    record Continue(Token keyword) implements Completion {}

    record Return(Token keyword, Value value) implements Completion {}
}
