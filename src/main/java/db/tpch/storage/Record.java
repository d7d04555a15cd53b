package db.tpch.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One row of an entity: column values in schema order. A {@code null} value is an absent
 * attribute and is kept distinct from an empty string.
 */
public final class Record {
    private final List<Object> values;

    public Record(List<?> values) {
        // ArrayList copy: List.copyOf rejects nulls
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static Record of(Object... values) {
        List<Object> list = new ArrayList<>(values.length);
        Collections.addAll(list, values);
        return new Record(list);
    }

    public List<Object> getValues() {
        return values;
    }

    public Object get(int position) {
        return values.get(position);
    }

    public int arity() {
        return values.size();
    }

    // Project the given column positions into one key tuple
    public KeyTuple key(int[] positions) {
        Object[] parts = new Object[positions.length];
        for (int i = 0; i < positions.length; i++) parts[i] = values.get(positions[i]);
        return KeyTuple.of(parts);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
