package db.tpch.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory B+ tree mapping a comparable key to the ids of the rows holding it.
 * Duplicate keys share one leaf entry; row ids keep insertion order.
 */
public class BPlusTree<K extends Comparable<? super K>> {
    private final int order;              // max children per internal node
    private final int maxKeys;            // order - 1
    private final int medianKeyIndex;     // cached median index for splits
    private Node<K> root;
    private int entries;

    public BPlusTree(int order) {
        if (order < 3) {
            throw new IllegalArgumentException("B+ tree order must be >= 3 (got " + order + ")");
        }
        this.order = order;
        this.maxKeys = order - 1;
        this.medianKeyIndex = (order - 1) / 2;
        this.root = new Node<>(true); // start as empty leaf
    }

    public int getOrder() {
        return order;
    }

    // Number of (key, row id) pairs inserted
    public int size() {
        return entries;
    }

    // Search for key - return immutable list of row ids (may be empty)
    public List<Integer> search(K key) {
        Node<K> leaf = findLeaf(key);
        int pos = lowerBound(leaf.keys, key);
        if (pos < leaf.keys.size() && leaf.keys.get(pos).compareTo(key) == 0) {
            return List.copyOf(leaf.values.get(pos));
        }
        return Collections.emptyList();
    }

    // lowerBound: first index with keys[i] >= key (or keys.size() if none).
    private int lowerBound(List<K> keys, K key) {
        int lo = 0, hi = keys.size();
        while (lo < hi) {
            int mid = (lo + hi) / 2;
            if (keys.get(mid).compareTo(key) < 0) lo = mid + 1; else hi = mid;
        }
        return lo;
    }

    // upperBound: first index with keys[i] > key (or keys.size() if none).
    // Used for internal routing: equal keys go right.
    private int upperBound(List<K> keys, K key) {
        int lo = 0, hi = keys.size();
        while (lo < hi) {
            int mid = (lo + hi) / 2;
            if (keys.get(mid).compareTo(key) <= 0) lo = mid + 1; else hi = mid;
        }
        return lo;
    }

    /**
     * Range search: returns all row ids whose key is in [lowInclusive, highInclusive].
     * Keys are visited in ascending order; row ids of a duplicate key keep insertion order.
     */
    public List<Integer> rangeSearch(K lowInclusive, K highInclusive) {
        List<Integer> result = new ArrayList<>();
        if (lowInclusive.compareTo(highInclusive) > 0) return result;
        Node<K> leaf = findLeaf(lowInclusive);

        int pos = lowerBound(leaf.keys, lowInclusive);
        while (leaf != null) {
            for (int i = pos; i < leaf.keys.size(); i++) {
                if (leaf.keys.get(i).compareTo(highInclusive) > 0) return result; // past range
                result.addAll(leaf.values.get(i));
            }
            leaf = leaf.next;
            pos = 0;
        }
        return result;
    }

    // Descend to the leaf that would contain the given key
    private Node<K> findLeaf(K key) {
        Node<K> current = root;
        while (!current.isLeaf) {
            current = current.children.get(upperBound(current.keys, key));
        }
        return current;
    }

    public void insert(K key, int rowId) {
        if (key == null) throw new IllegalArgumentException("B+ tree keys must not be null");
        Node<K> r = root;
        if (r.keys.size() == maxKeys) {
            // root is full, split
            Node<K> newRoot = new Node<>(false);
            newRoot.children.add(r);
            splitChild(newRoot, 0, r);
            root = newRoot;
        }
        insertNonFull(root, key, rowId);
        entries++;
    }

    private void insertNonFull(Node<K> node, K key, int rowId) {
        if (node.isLeaf) {
            leafInsert(node, key, rowId);
        } else {
            int pos = upperBound(node.keys, key);
            Node<K> child = node.children.get(pos);
            if (child.keys.size() == maxKeys) {
                splitChild(node, pos, child);
                if (key.compareTo(node.keys.get(pos)) >= 0) {
                    pos++;
                }
            }
            insertNonFull(node.children.get(pos), key, rowId);
        }
    }

    // Insert at sorted position, or append to the existing key's row id list
    private void leafInsert(Node<K> leaf, K key, int rowId) {
        int pos = lowerBound(leaf.keys, key);
        if (pos < leaf.keys.size() && leaf.keys.get(pos).compareTo(key) == 0) {
            leaf.values.get(pos).add(rowId);
        } else {
            leaf.keys.add(pos, key);
            List<Integer> list = new ArrayList<>();
            list.add(rowId);
            leaf.values.add(pos, list);
        }
    }

    private void splitChild(Node<K> parent, int index, Node<K> child) {
        if (child.isLeaf) {
            splitLeafChild(parent, index, child);
        } else {
            splitInternalChild(parent, index, child);
        }
    }

    // Split a full leaf; left keeps ceil(n/2), first key of the right sibling is promoted
    private void splitLeafChild(Node<K> parent, int index, Node<K> leaf) {
        int total = leaf.keys.size();
        int leftSize = (total + 1) / 2;
        Node<K> sibling = new Node<>(true);

        sibling.keys.addAll(leaf.keys.subList(leftSize, total));
        sibling.values.addAll(leaf.values.subList(leftSize, total));
        leaf.keys.subList(leftSize, total).clear();
        leaf.values.subList(leftSize, total).clear();

        sibling.next = leaf.next;
        leaf.next = sibling;

        parent.keys.add(index, sibling.keys.get(0));
        parent.children.add(index + 1, sibling);
    }

    // Split a full internal node; median moves up, left keeps < median, right keeps > median
    private void splitInternalChild(Node<K> parent, int index, Node<K> internal) {
        int mid = medianKeyIndex;
        K medianKey = internal.keys.get(mid);
        Node<K> sibling = new Node<>(false);

        sibling.keys.addAll(internal.keys.subList(mid + 1, internal.keys.size()));
        sibling.children.addAll(internal.children.subList(mid + 1, internal.children.size()));
        internal.keys.subList(mid, internal.keys.size()).clear();
        internal.children.subList(mid + 1, internal.children.size()).clear();

        parent.keys.add(index, medianKey);
        parent.children.add(index + 1, sibling);
    }

    private static final class Node<K> {
        final boolean isLeaf;
        final List<K> keys;
        final List<Node<K>> children;        // internal nodes only (null for leaves)
        final List<List<Integer>> values;    // leaf nodes only (null for internals)
        Node<K> next;                        // leaf chain

        Node(boolean isLeaf) {
            this.isLeaf = isLeaf;
            this.keys = new ArrayList<>();
            if (isLeaf) {
                this.values = new ArrayList<>();
                this.children = null;
            } else {
                this.children = new ArrayList<>();
                this.values = null;
            }
        }
    }
}
