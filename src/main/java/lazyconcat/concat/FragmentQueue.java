// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lazyconcat.concat;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An ordered queue of pending {@link Fragment}s that keeps track of their total length.
 * <p>
 * Fragments are only ever materialized whole, from the front: a fragment is never split, so materializing may copy
 * more than was asked for, but never cuts through a multi-unit boundary inside a fragment.
 * <p>
 * Internally a growable ring buffer, so pushing to the back and popping from the front are amortized constant time.
 *
 * @param <E> the type of elements
 * @param <S> the fragment source type
 */
public final class FragmentQueue<E, S> {
    /**
     * Initializes a new, empty queue.
     */
    public FragmentQueue() {
        this(ArrayOps.minimumCapacity);
    }

    /**
     * Initializes a new, empty queue presized to hold the given number of fragments without reallocating.
     *
     * @throws IllegalArgumentException if the expected number of fragments is negative
     */
    @SuppressWarnings("unchecked")
    public FragmentQueue(final int expectedFragments) {
        if (expectedFragments < 0) {
            throw new IllegalArgumentException("Negative expected fragment count: " + expectedFragments);
        }
        fragments = (Fragment<E, S>[]) new Fragment<?, ?>[Integer.max(expectedFragments, 1)];
    }

    /**
     * Appends the given fragment at the back of the queue.
     * <p>
     * Complexity: amortized constant time.
     */
    public void push(final @NotNull Fragment<E, S> fragment) {
        Objects.requireNonNull(fragment);
        final var count = size;
        if (count == fragments.length) {
            fragments = ArrayOps.unwrapRing(fragments, head, count, ArrayOps.newCapacity(count, count + 1));
            head = 0;
        }
        fragments[physicalIndex(count)] = fragment;
        size = count + 1;
        totalPendingLength += fragment.length();
    }

    /**
     * Returns the sum of the lengths of all fragments in the queue.
     * <p>
     * Complexity: constant time.
     */
    public long totalPendingLength() {
        return totalPendingLength;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Returns the number of fragments in the queue.
     */
    public int size() {
        return size;
    }

    /**
     * Returns the fragment at the given position, counting from the front of the queue.
     *
     * @throws IndexOutOfBoundsException if the index is not within {@code [0, size())}
     */
    public @NotNull Fragment<E, S> get(final int index) {
        Objects.checkIndex(index, size);
        return fragmentAt(physicalIndex(index));
    }

    /**
     * Moves whole fragments from the front of the queue into the given root buffer, until either the queue is empty
     * or at least {@code targetAdditionalLength} elements were appended by this call.
     * <p>
     * A non-positive target appends nothing.
     *
     * @return the number of elements appended, which may exceed the target
     */
    public long materializeFrontUntil(final @NotNull RootBuffer<E, S, ?, ?> root, final long targetAdditionalLength) {
        long appended = 0;
        int consumed = 0;
        while (appended < targetAdditionalLength && size > 0) {
            // The fragment stays queued until the root has accepted it.
            final var fragment = fragmentAt(head);
            root.append(fragment.source());
            removeFirst();
            appended += fragment.length();
            consumed += 1;
        }
        if (consumed > 0) {
            log.debug("Materialized {} fragment(s), {} element(s), {} fragment(s) still pending", consumed, appended,
                size);
        }
        return appended;
    }

    /**
     * Moves every fragment in the queue into the given root buffer, in order.
     *
     * @return the number of elements appended
     */
    public long materializeAll(final @NotNull RootBuffer<E, S, ?, ?> root) {
        return materializeFrontUntil(root, Long.MAX_VALUE);
    }

    @Override
    public @NotNull String toString() {
        final var builder = new StringBuilder();
        builder.append('[');
        for (int i = 0; i < size; i += 1) {
            if (i != 0) {
                builder.append(", ");
            }
            builder.append(get(i));
        }
        return builder.append(']').toString();
    }

    private void removeFirst() {
        assert size > 0 : "removeFirst called on an empty queue";
        final var index = head;
        final var fragment = fragmentAt(index);
        fragments[index] = null;
        head = (index + 1 == fragments.length) ? 0 : index + 1;
        size -= 1;
        totalPendingLength -= fragment.length();
    }

    @SuppressWarnings("nullness:return") // Slots within [head, head + size) are always filled.
    private @NotNull Fragment<E, S> fragmentAt(final int physicalIndex) {
        final var fragment = fragments[physicalIndex];
        assert fragment != null : "Empty slot inside the live part of the queue";
        return fragment;
    }

    private int physicalIndex(final int logicalIndex) {
        final var index = head + logicalIndex;
        final var capacity = fragments.length;
        return (index >= capacity) ? index - capacity : index;
    }

    private static final Logger log = LoggerFactory.getLogger(FragmentQueue.class);

    private @Nullable Fragment<E, S>[] fragments;
    private int head = 0;
    private int size = 0;
    private long totalPendingLength = 0;
}
