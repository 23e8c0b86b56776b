// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lazyconcat.concat;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.jetbrains.annotations.NotNull;

/**
 * A root buffer for elements of an arbitrary type, backed by a growable array.
 * <p>
 * Fragments are {@link List}s. Sub-list views such as {@code list.subList(2, 10)} make natural non-copying
 * fragments, as long as the underlying list isn't modified while they're pending. {@code null} elements are
 * permitted.
 * <p>
 * Slices are unmodifiable random-access views. Unlike {@link ArrayList#subList(int, int)} they remain usable after
 * more elements are appended.
 *
 * @param <T> the type of elements
 */
public final class ListBuffer<T> implements RootBuffer<T, List<T>, List<T>, List<T>> {
    /**
     * Initializes a new, empty list buffer.
     */
    public ListBuffer() {
        elements = new Object[ArrayOps.minimumCapacity];
    }

    /**
     * Initializes a new list buffer containing the elements of the given list.
     */
    public ListBuffer(final @NotNull List<? extends T> initial) {
        final var array = initial.toArray();
        // toArray may return an array of a narrower runtime type, which would reject later appends.
        elements = Arrays.copyOf(array, Integer.max(array.length, ArrayOps.minimumCapacity), Object[].class);
        length = array.length;
    }

    /**
     * Returns the kind describing {@link List} fragments.
     */
    @SuppressWarnings("unchecked")
    public static <T> @NotNull FragmentKind<T, List<T>> kind() {
        return (FragmentKind<T, List<T>>) Kind.instance;
    }

    @Override
    public @NotNull FragmentKind<T, List<T>> fragmentKind() {
        return kind();
    }

    @Override
    public int length() {
        return length;
    }

    @Override
    public void append(final @NotNull List<T> chunk) {
        final var oldLength = length;
        final var chunkLength = chunk.size();
        final var newLength = oldLength + chunkLength;
        elements = ArrayOps.ensureCapacity(elements, newLength);
        int index = oldLength;
        for (final var element : chunk) {
            elements[index] = element;
            index += 1;
        }
        assert index == newLength : "List size changed during append";
        length = newLength;
    }

    @Override
    @SuppressWarnings("unchecked")
    public T get(final int index) {
        Objects.checkIndex(index, length);
        return (T) elements[index];
    }

    @Override
    public @NotNull List<T> slice(final int from, final int to) {
        Objects.checkFromToIndex(from, to, length);
        return new Slice<>(elements, from, to);
    }

    /**
     * Returns a new mutable list with the contents of this buffer.
     */
    @Override
    public @NotNull List<T> finish() {
        return new ArrayList<>(new Slice<T>(elements, 0, length));
    }

    @Override
    public @NotNull String toString() {
        return new Slice<T>(elements, 0, length).toString();
    }

    private @Nullable Object[] elements;
    private int length = 0;

    private static final class Slice<T> extends AbstractList<T> implements RandomAccess {
        private Slice(final @Nullable Object[] elements, final int from, final int to) {
            this.elements = elements;
            this.from = from;
            this.to = to;
        }

        @Override
        @SuppressWarnings("unchecked")
        public T get(final int index) {
            Objects.checkIndex(index, to - from);
            return (T) elements[from + index];
        }

        @Override
        public int size() {
            return to - from;
        }

        private final @Nullable Object[] elements;
        private final int from;
        private final int to;
    }

    private static final class Kind<T> implements FragmentKind<T, List<T>> {
        @Override
        public int lengthOf(final @NotNull List<T> source) {
            return source.size();
        }

        @Override
        public T elementAt(final @NotNull List<T> source, final int index) {
            return source.get(index);
        }

        @Override
        public @NotNull List<T> copyOf(final @NotNull List<T> source) {
            return Collections.unmodifiableList(new ArrayList<>(source));
        }

        private static final Kind<?> instance = new Kind<>();
    }
}
