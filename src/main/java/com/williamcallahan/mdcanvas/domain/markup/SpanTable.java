package com.williamcallahan.mdcanvas.domain.markup;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Growable, position-ordered storage for one kind of span.
 *
 * <p>Tables are sized in two phases: a counting pass estimates how many spans a document holds and
 * {@link #sizedFor} allocates that many plus a small margin; while filling, {@link #add} doubles the
 * backing array on undercount. Growth beyond the configured maximum capacity fails with
 * {@link MarkupAllocationException} so the caller can abandon the whole parse.</p>
 *
 * @param <T> span type
 */
public final class SpanTable<T extends Span> implements Iterable<T> {

    /** Extra slots allocated over a non-zero count. */
    public static final int SAFETY_MARGIN = 2;

    private Object[] spans;
    private int count;
    private final int maxCapacity;

    private SpanTable(int initialCapacity, int maxCapacity) {
        if (initialCapacity < 1) {
            throw new IllegalArgumentException("Initial capacity must be positive: " + initialCapacity);
        }
        if (maxCapacity < initialCapacity) {
            throw new IllegalArgumentException(
                "Maximum capacity " + maxCapacity + " is below initial capacity " + initialCapacity);
        }
        this.spans = new Object[initialCapacity];
        this.maxCapacity = maxCapacity;
    }

    /**
     * Allocates a table for a counted number of spans.
     *
     * @param countedSpans spans found by the counting pass
     * @param fallbackCapacity capacity used when the count is zero
     * @param maxCapacity hard upper bound on growth
     * @param <T> span type
     * @return empty table with {@code countedSpans + SAFETY_MARGIN} or {@code fallbackCapacity} slots
     */
    public static <T extends Span> SpanTable<T> sizedFor(int countedSpans, int fallbackCapacity, int maxCapacity) {
        int initialCapacity = countedSpans > 0 ? countedSpans + SAFETY_MARGIN : fallbackCapacity;
        return new SpanTable<>(Math.min(initialCapacity, maxCapacity), maxCapacity);
    }

    /**
     * Returns an empty table that never grows.
     *
     * @param <T> span type
     * @return empty, full table
     */
    public static <T extends Span> SpanTable<T> empty() {
        return new SpanTable<>(1, 1);
    }

    /**
     * Appends a span, doubling capacity when the table is full.
     *
     * @param span span to append; its start must not precede the previous span's start
     * @return index of the appended span
     * @throws MarkupAllocationException when the table cannot grow
     */
    public int add(T span) {
        if (count > 0 && span.startPos() < get(count - 1).startPos()) {
            throw new IllegalArgumentException(
                "Span starts must be non-decreasing: " + span.startPos() + " after " + get(count - 1).startPos());
        }
        ensureCapacity();
        spans[count] = span;
        return count++;
    }

    /**
     * Replaces the span at an index, used to close line-scoped spans once their end is known.
     *
     * @param index index returned by {@link #add}
     * @param span replacement with the same start position
     */
    public void replace(int index, T span) {
        T existing = get(index);
        if (existing.startPos() != span.startPos()) {
            throw new IllegalArgumentException("Replacement must keep start position " + existing.startPos());
        }
        spans[index] = span;
    }

    /**
     * Returns the span at an index.
     *
     * @param index zero-based index below {@link #size()}
     * @return stored span
     */
    @SuppressWarnings("unchecked")
    public T get(int index) {
        if (index < 0 || index >= count) {
            throw new IndexOutOfBoundsException("Index " + index + " outside table of size " + count);
        }
        return (T) spans[index];
    }

    public int size() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    /**
     * Returns the number of allocated slots.
     */
    public int capacity() {
        return spans.length;
    }

    /**
     * Returns an immutable snapshot of the stored spans in emission order.
     */
    @SuppressWarnings("unchecked")
    public List<T> asList() {
        if (count == 0) {
            return List.of();
        }
        return Collections.unmodifiableList(Arrays.asList((T[]) Arrays.copyOf(spans, count)));
    }

    /**
     * Drops every stored span and the backing storage.
     */
    public void clear() {
        spans = new Object[1];
        count = 0;
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private int cursor;

            @Override
            public boolean hasNext() {
                return cursor < count;
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return get(cursor++);
            }
        };
    }

    private void ensureCapacity() {
        if (count < spans.length) {
            return;
        }
        if (spans.length >= maxCapacity) {
            throw new MarkupAllocationException(
                "Span table reached its maximum capacity of " + maxCapacity);
        }
        int newCapacity = (int) Math.min((long) spans.length * 2, maxCapacity);
        try {
            spans = Arrays.copyOf(spans, newCapacity);
        } catch (OutOfMemoryError allocationError) {
            throw new MarkupAllocationException("Unable to grow span table to " + newCapacity, allocationError);
        }
    }
}
