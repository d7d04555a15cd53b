package db.tpch.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class RecordTest {
    @Test
    void valuesAreStoredAndRetrieved() {
        Record r = Record.of(1, "AFRICA", null);
        assertEquals(3, r.arity());
        assertEquals(1, r.get(0));
        assertEquals("AFRICA", r.get(1));
        assertNull(r.get(2));
    }

    @Test
    void copiesItsInput() {
        List<Object> values = new ArrayList<>(List.of(2, "Bob"));
        Record r = new Record(values);
        values.set(1, "Robert");
        assertEquals("Bob", r.get(1));
        assertThrows(UnsupportedOperationException.class, () -> r.getValues().add("x"));
    }

    @Test
    void equalsDifferentInstancesSameValues() {
        Record r1 = Record.of(2, "Bob", null);
        Record r2 = Record.of(2, "Bob", null);
        assertNotSame(r1, r2);
        assertEquals(r1, r2);
        assertEquals(r1.hashCode(), r2.hashCode());
        assertNotEquals(r1, Record.of(2, "Bob", ""));
    }

    @Test
    void keyProjectsPositions() {
        Record r = Record.of(5L, 7L, "x", 9);
        assertEquals(KeyTuple.of(7L, 9L), r.key(new int[] {1, 3}));
        assertEquals(KeyTuple.of(5L), r.key(new int[] {0}));
    }
}
