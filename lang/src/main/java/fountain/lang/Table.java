package fountain.lang;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The only composite value: an insertion-ordered mapping from values to values.
 *
 * <p>Tables are shared by reference and compare by identity. Keys compare by
 * value, except tables and functions used as keys, which compare by identity.
 * Reading a missing key yields {@code nil}; writing a missing key appends it.
 * Reference cycles (a table holding itself) are fine, the JVM collector
 * reclaims them once unreachable.
 */
public final class Table implements Value {

    private final Map<Value, Value> entries = new LinkedHashMap<>();

    public Value get(Value key) {
        return entries.getOrDefault(key, Value.NIL);
    }

    /**
     * Stores {@code value} under {@code key}, keeping the position of an existing key.
     *
     * @throws IllegalArgumentException if {@code key} is NaN, which could never be read back
     */
    public void put(Value key, Value value) {
        if (key instanceof Value.Num num && Double.isNaN(num.value())) {
            throw new IllegalArgumentException("table key cannot be nan");
        }
        entries.put(key, value);
    }

    public boolean containsKey(Value key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return a read-only view of the entries in insertion order
     */
    public Map<Value, Value> entries() {
        return Collections.unmodifiableMap(entries);
    }

    @Override
    public String typeName() {
        return "table";
    }

    @Override
    public String toString() {
        return Values.stringify(this);
    }
}
