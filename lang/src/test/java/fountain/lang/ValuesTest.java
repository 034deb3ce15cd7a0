package fountain.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

public class ValuesTest {

    @Test
    void truthiness() {
        assertFalse(Values.isTruthy(Value.NIL));
        assertFalse(Values.isTruthy(Value.FALSE));
        assertTrue(Values.isTruthy(Value.TRUE));
        assertTrue(Values.isTruthy(Value.of(0)));
        assertTrue(Values.isTruthy(Value.of("")));
        assertTrue(Values.isTruthy(new Table()));
    }

    @Test
    void equalityAcrossKinds() {
        assertFalse(Values.isEqual(Value.of(1), Value.of("1")));
        assertFalse(Values.isEqual(Value.NIL, Value.FALSE));
        assertTrue(Values.isEqual(Value.of("a"), Value.of("a")));
        assertTrue(Values.isEqual(Value.of(0.0), Value.of(-0.0)));
        assertFalse(Values.isEqual(Value.of(Double.NaN), Value.of(Double.NaN)));
    }

    @Test
    void tablesAndFunctionsCompareByIdentity() {
        var table = new Table();
        assertTrue(Values.isEqual(table, table));
        assertFalse(Values.isEqual(table, new Table()));

        var body = (Builtin.Body) args -> Value.NIL;
        var f = Builtin.of("f", body);
        assertTrue(Values.isEqual(f, f));
        assertFalse(Values.isEqual(f, Builtin.of("f", body)));
    }

    @Test
    void zeroesHashAlike() {
        assertEquals(Value.of(0.0).hashCode(), Value.of(-0.0).hashCode());
        assertNotEquals(Value.of(Double.NaN), Value.of(Double.NaN));
    }

    @ParameterizedTest
    @CsvSource({
        "3,         3",
        "-3,        -3",
        "2.5,       2.5",
        "0.1,       0.1",
        "-0.0,      0",
        "1e20,      100000000000000000000",
        "1e15,      1000000000000000",
        "0.0001,    0.0001",
        "1.5e-7,    0.00000015",
        "-2.5e-5,   -0.000025",
        "NaN,       nan",
        "Infinity,  inf",
        "-Infinity, -inf",
    })
    void formatNumber(double value, String expected) {
        assertEquals(expected, Values.formatNumber(value));
    }

    @Test
    void stringifyLeavesStringsRaw() {
        assertEquals("it's", Values.stringify(Value.of("it's")));
        assertEquals("\"it's\"", Values.repr(Value.of("it's")));
        assertEquals("'say \"hi\"'", Values.repr(Value.of("say \"hi\"")));
    }

    @Test
    void reprOfTable() {
        var inner = new Table();
        inner.put(Value.of(0), Value.of("x"));

        var table = new Table();
        table.put(Value.of(0), Value.of(1));
        table.put(Value.of(1), inner);
        table.put(Value.of("name"), Value.TRUE);
        table.put(Value.of("if"), Value.of(2));
        table.put(Value.of(3), Value.NIL);

        assertEquals("{1, {\"x\"}, name = true, [\"if\"] = 2, [3] = nil}", Values.repr(table));
    }

    @Test
    void positionalPrefixStopsAtFirstGap() {
        var table = new Table();
        table.put(Value.of(1), Value.of("b"));
        table.put(Value.of(0), Value.of("a"));
        assertEquals("{[1] = \"b\", [0] = \"a\"}", Values.repr(table));
    }

    @Test
    void sharedTableIsNotACycle() {
        var shared = new Table();
        var table = new Table();
        table.put(Value.of(0), shared);
        table.put(Value.of(1), shared);
        assertEquals("{{}, {}}", Values.repr(table));
    }

    @Test
    void cycleThroughTwoTables() {
        var a = new Table();
        var b = new Table();
        a.put(Value.of("b"), b);
        b.put(Value.of("a"), a);
        assertEquals("{b = {a = {...}}}", Values.repr(a));
    }

    @ParameterizedTest
    @ValueSource(strings = {"x", "_private", "snake_case2", "CamelCase"})
    void identifiers(String text) {
        assertTrue(Values.isIdentifier(text));
    }

    @Test
    void nonIdentifiers() {
        for (var text : List.of("", "2x", "a b", "end", "nil", "x-y")) {
            assertFalse(Values.isIdentifier(text), text);
        }
    }
}
