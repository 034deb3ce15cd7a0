package fountain.lang;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Truthiness, equality and textual rendering of {@link Value}s.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class Values {

    /**
     * Only {@code nil} and {@code false} are falsy; {@code 0} and {@code ""} are truthy.
     */
    static boolean isTruthy(Value value) {
        if (value instanceof Value.Nil) {
            return false;
        }
        if (value instanceof Value.Bool bool) {
            return bool.value();
        }
        return true;
    }

    /**
     * Total equality over all kinds. Values of different kinds are never
     * equal; tables and functions are equal only to themselves.
     */
    static boolean isEqual(Value a, Value b) {
        if (a instanceof Table || a instanceof Callable) {
            return a == b;
        }
        return a.equals(b);
    }

    /**
     * Renders a number as a plain decimal that the lexer reads back as the
     * same double. There is no exponent form.
     */
    static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * Renders a value the way {@code print} shows it: strings raw, everything else as {@link #repr}.
     */
    static String stringify(Value value) {
        if (value instanceof Value.Str str) {
            return str.value();
        }
        return repr(value);
    }

    /**
     * Renders a value as source text where possible, so a printed table
     * literal reads back as an equal table.
     */
    static String repr(Value value) {
        var out = new StringBuilder();
        repr(value, out, Collections.newSetFromMap(new IdentityHashMap<>()));
        return out.toString();
    }

    private static void repr(Value value, StringBuilder out, Set<Table> rendering) {
        if (value instanceof Value.Str str) {
            quote(str.value(), out);
        } else if (value instanceof Table table) {
            reprTable(table, out, rendering);
        } else {
            out.append(value);
        }
    }

    private static void reprTable(Table table, StringBuilder out, Set<Table> rendering) {
        if (!rendering.add(table)) {
            out.append("{...}");
            return;
        }

        out.append('{');
        var positional = true;
        var index = 0;
        var first = true;
        for (var entry : table.entries().entrySet()) {
            if (!first) {
                out.append(", ");
            }
            first = false;

            var key = entry.getKey();
            positional = positional && key.equals(Value.of(index));
            if (positional) {
                index++;
            } else if (key instanceof Value.Str str && isIdentifier(str.value())) {
                out.append(str.value()).append(" = ");
            } else {
                out.append('[');
                repr(key, out, rendering);
                out.append("] = ");
            }
            repr(entry.getValue(), out, rendering);
        }
        out.append('}');

        rendering.remove(table);
    }

    private static void quote(String text, StringBuilder out) {
        var quote = text.indexOf('"') >= 0 ? '\'' : '"';
        out.append(quote).append(text).append(quote);
    }

    static boolean isIdentifier(String text) {
        if (text.isEmpty() || !Scanner.isAlpha(text.charAt(0))) {
            return false;
        }
        for (var i = 1; i < text.length(); i++) {
            if (!Scanner.isAlphaNumeric(text.charAt(i))) {
                return false;
            }
        }
        return !Scanner.KEYWORDS.containsKey(text);
    }
}
