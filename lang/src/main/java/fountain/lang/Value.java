package fountain.lang;

import lombok.NonNull;

/**
 * A runtime value of the fountain language.
 *
 * <p>The set of kinds is closed: nil, bool, number, string, table and
 * function. Numbers are always doubles; there is no integer kind and no
 * implicit conversion between numbers and strings.
 */
public sealed interface Value permits Value.Nil, Value.Bool, Value.Num, Value.Str, Table, Callable {

    Nil NIL = new Nil();
    Bool TRUE = new Bool(true);
    Bool FALSE = new Bool(false);

    /**
     * @return the kind name used in error messages, e.g. {@code number}
     */
    String typeName();

    static Bool of(boolean value) {
        return value ? TRUE : FALSE;
    }

    static Num of(double value) {
        return new Num(value);
    }

    static Str of(String value) {
        return new Str(value);
    }

    record Nil() implements Value {

        @Override
        public String typeName() {
            return "nil";
        }

        @Override
        public String toString() {
            return "nil";
        }
    }

    record Bool(boolean value) implements Value {

        @Override
        public String typeName() {
            return "bool";
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    /**
     * A number. Equality follows {@code ==} on doubles, so {@code 0 == -0}
     * and NaN equals nothing, not even itself.
     */
    record Num(double value) implements Value {

        @Override
        public String typeName() {
            return "number";
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Num other && value == other.value;
        }

        @Override
        public int hashCode() {
            // -0.0 and 0.0 are equal, so they must hash alike
            return Double.hashCode(value == 0 ? 0.0 : value);
        }

        @Override
        public String toString() {
            return Values.formatNumber(value);
        }
    }

    record Str(@NonNull String value) implements Value {

        @Override
        public String typeName() {
            return "string";
        }

        @Override
        public String toString() {
            return value;
        }
    }
}
