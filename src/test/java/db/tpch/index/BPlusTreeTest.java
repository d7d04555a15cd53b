package db.tpch.index;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

public class BPlusTreeTest {
    @Test
    void insertSearchDuplicateKeys() {
        BPlusTree<Long> tree = new BPlusTree<>(4);
        tree.insert(10L, 0);
        tree.insert(10L, 1);
        tree.insert(20L, 5);
        assertEquals(List.of(0, 1), tree.search(10L));
        assertEquals(List.of(5), tree.search(20L));
        assertTrue(tree.search(5L).isEmpty());
        assertEquals(3, tree.size());
    }

    @Test
    void rangeSearchLimits() {
        BPlusTree<Long> tree = new BPlusTree<>(4);
        for (int i = 0; i < 50; i++) tree.insert((long) i, i);
        List<Integer> range = tree.rangeSearch(5L, 12L); // inclusive
        assertEquals(List.of(5, 6, 7, 8, 9, 10, 11, 12), range);
        assertTrue(tree.rangeSearch(12L, 5L).isEmpty());
        assertEquals(List.of(49), tree.rangeSearch(49L, 500L));
    }

    @Test
    void smallestOrderKeepsEveryKeyReachable() {
        BPlusTree<Integer> tree = new BPlusTree<>(3);
        List<Integer> keys = new ArrayList<>();
        for (int i = 0; i < 500; i++) keys.add(i % 137);
        Collections.shuffle(keys, new Random(7));
        for (int rowId = 0; rowId < keys.size(); rowId++) tree.insert(keys.get(rowId), rowId);

        assertEquals(500, tree.size());
        for (int k = 0; k < 137; k++) {
            List<Integer> rows = tree.search(k);
            int expected = k < 500 % 137 ? 4 : 3;
            assertEquals(expected, rows.size(), "key " + k);
            for (int rowId : rows) assertEquals(k, keys.get(rowId));
        }
        assertEquals(500, tree.rangeSearch(0, 136).size());
    }

    @Test
    void dateKeysRangeByCalendar() {
        BPlusTree<LocalDate> tree = new BPlusTree<>(5);
        LocalDate start = LocalDate.of(1995, 1, 1);
        for (int i = 0; i < 60; i++) tree.insert(start.plusDays(i), i);
        List<Integer> january = tree.rangeSearch(start, LocalDate.of(1995, 1, 31));
        assertEquals(31, january.size());
        assertEquals(0, january.get(0));
        assertEquals(30, january.get(30));
    }

    @Test
    void rejectsTinyOrderAndNullKeys() {
        assertThrows(IllegalArgumentException.class, () -> new BPlusTree<Long>(2));
        BPlusTree<Long> tree = new BPlusTree<>(3);
        assertThrows(IllegalArgumentException.class, () -> tree.insert(null, 0));
        assertEquals(3, tree.getOrder());
    }
}
