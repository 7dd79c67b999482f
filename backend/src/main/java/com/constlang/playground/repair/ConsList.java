package com.constlang.playground.repair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable prepend-only list. Siblings in the search tree share every cell they have in
 * common, so deriving a child branch costs one allocation regardless of input length.
 */
final class ConsList<T> {

    private final T head;
    private final ConsList<T> tail;
    private final int size;

    private ConsList(T head, ConsList<T> tail, int size) {
        this.head = head;
        this.tail = tail;
        this.size = size;
    }

    static <T> ConsList<T> empty() {
        return new ConsList<>(null, null, 0);
    }

    ConsList<T> prepend(T value) {
        return new ConsList<>(value, this, size + 1);
    }

    /** Most recently added element, or {@code null} when empty. */
    T last() {
        return head;
    }

    int size() {
        return size;
    }

    /** Elements in insertion order. */
    List<T> toList() {
        List<T> items = new ArrayList<>(size);
        for (ConsList<T> cell = this; cell.size > 0; cell = cell.tail) {
            items.add(cell.head);
        }
        Collections.reverse(items);
        return items;
    }
}
