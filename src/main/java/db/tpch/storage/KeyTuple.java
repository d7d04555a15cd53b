package db.tpch.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tuple-valued key used for primary-key sets and foreign-key lookups. A composite key is one
 * {@code KeyTuple}, so matching it is a single lookup rather than a check per column.
 *
 * <p>Integral parts are widened to {@code Long} so an INTEGER foreign key and a BIGINT target
 * key with the same number compare equal.
 */
public final class KeyTuple {
    private final List<Object> parts;

    private KeyTuple(List<Object> parts) {
        this.parts = parts;
    }

    public static KeyTuple of(Object... parts) {
        List<Object> list = new ArrayList<>(parts.length);
        for (Object p : parts) list.add(normalize(p));
        return new KeyTuple(Collections.unmodifiableList(list));
    }

    public static Object normalize(Object value) {
        if (value instanceof Integer i) return i.longValue();
        if (value instanceof Short s) return s.longValue();
        return value;
    }

    public List<Object> parts() { return parts; }

    public int size() { return parts.size(); }

    public boolean hasNull() { return parts.contains(null); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeyTuple other)) return false;
        return parts.equals(other.parts);
    }

    @Override
    public int hashCode() { return parts.hashCode(); }

    // Single-part keys render as the bare value, composite ones as (a, b)
    @Override
    public String toString() {
        if (parts.size() == 1) return String.valueOf(parts.get(0));
        return parts.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
