package com.tyron.cosched.core.heap;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Array-backed binary min-heap.
 * <p>
 * Ordered by {@link Node#sortIndex()} ascending, ties broken by {@link Node#id()} ascending so that
 * nodes with equal keys come out in insertion order.
 * <p>
 * Not thread-safe. Every operation completes before it returns, so a caller re-entering the heap
 * (from code run between two operations) always sees a valid heap.
 */
public final class PriorityHeap<T extends PriorityHeap.Node> {

    /**
     * Something that can be stored in a {@link PriorityHeap}.
     * <p>
     * {@link #sortIndex()} must not change while the node is in a heap.
     */
    public interface Node {

        long sortIndex();

        long id();
    }

    private final ArrayList<T> nodes = new ArrayList<>();

    public void push(T node) {
        Objects.requireNonNull(node, "node");
        nodes.add(node);
        siftUp(node, nodes.size() - 1);
    }

    public @Nullable T peek() {
        return nodes.isEmpty() ? null : nodes.get(0);
    }

    public @Nullable T pop() {
        if (nodes.isEmpty()) {
            return null;
        }
        T first = nodes.get(0);
        T last = nodes.remove(nodes.size() - 1);
        if (!nodes.isEmpty()) {
            nodes.set(0, last);
            siftDown(last, 0);
        }
        return first;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public void clear() {
        nodes.clear();
    }

    /**
     * @return true if some node matches {@code predicate}. The heap is left as it is.
     */
    public boolean anyMatch(Predicate<? super T> predicate) {
        for (T node : nodes) {
            if (predicate.test(node)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Removes every node, in no particular order.
     */
    public List<T> drain() {
        List<T> all = new ArrayList<>(nodes);
        nodes.clear();
        return all;
    }

    /**
     * @return true if every parent sorts before or equal to its children.
     */
    boolean isHeapOrdered() {
        for (int i = 0; i < nodes.size(); i++) {
            int left = 2 * i + 1;
            int right = left + 1;
            if (left < nodes.size() && compare(nodes.get(left), nodes.get(i)) < 0) {
                return false;
            }
            if (right < nodes.size() && compare(nodes.get(right), nodes.get(i)) < 0) {
                return false;
            }
        }
        return true;
    }

    private void siftUp(T node, int index) {
        while (index > 0) {
            int parentIndex = (index - 1) >>> 1;
            T parent = nodes.get(parentIndex);
            if (compare(parent, node) <= 0) {
                return;
            }
            nodes.set(parentIndex, node);
            nodes.set(index, parent);
            index = parentIndex;
        }
    }

    private void siftDown(T node, int index) {
        int length = nodes.size();
        int halfLength = length >>> 1;
        while (index < halfLength) {
            int leftIndex = 2 * index + 1;
            int rightIndex = leftIndex + 1;
            T left = nodes.get(leftIndex);

            if (compare(left, node) < 0) {
                if (rightIndex < length && compare(nodes.get(rightIndex), left) < 0) {
                    nodes.set(index, nodes.get(rightIndex));
                    nodes.set(rightIndex, node);
                    index = rightIndex;
                } else {
                    nodes.set(index, left);
                    nodes.set(leftIndex, node);
                    index = leftIndex;
                }
            } else if (rightIndex < length && compare(nodes.get(rightIndex), node) < 0) {
                nodes.set(index, nodes.get(rightIndex));
                nodes.set(rightIndex, node);
                index = rightIndex;
            } else {
                return;
            }
        }
    }

    private static int compare(Node a, Node b) {
        int diff = Long.compare(a.sortIndex(), b.sortIndex());
        return diff != 0 ? diff : Long.compare(a.id(), b.id());
    }
}
