package com.swarmprobe.core.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

/**
 * Fixed-capacity circular buffer. Appending to a full buffer overwrites the oldest element.
 * <p>
 * Not thread-safe; owners guard access with their own lock.
 *
 * @param <T> element type
 */
public final class RingBuffer<T> {

    private final Object[] elements;
    private int head;
    private int size;

    public RingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.elements = new Object[capacity];
    }

    public void add(T element) {
        int tail = (head + size) % elements.length;
        elements[tail] = element;
        if (size == elements.length) {
            head = (head + 1) % elements.length;
        } else {
            size++;
        }
    }

    @SuppressWarnings("unchecked")
    public T get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("index " + index + " size " + size);
        }
        return (T) elements[(head + index) % elements.length];
    }

    /** The newest element, or null when empty. */
    public T last() {
        return size == 0 ? null : get(size - 1);
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return elements.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public void clear() {
        Arrays.fill(elements, null);
        head = 0;
        size = 0;
    }

    /** Oldest-first copy. */
    public List<T> toList() {
        var copy = new ArrayList<T>(size);
        for (int i = 0; i < size; i++) {
            copy.add(get(i));
        }
        return copy;
    }

    /** Copy of the newest {@code n} elements, oldest first. */
    public List<T> tail(int n) {
        int count = Math.min(n, size);
        var copy = new ArrayList<T>(count);
        for (int i = size - count; i < size; i++) {
            copy.add(get(i));
        }
        return copy;
    }

    public int count(Predicate<? super T> predicate) {
        int matches = 0;
        for (int i = 0; i < size; i++) {
            if (predicate.test(get(i))) {
                matches++;
            }
        }
        return matches;
    }
}
