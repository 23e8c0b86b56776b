// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lazyconcat.concat;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.jetbrains.annotations.NotNull;

/**
 * A single pending chunk of data awaiting materialization, with its length cached at construction.
 * <p>
 * A fragment created with {@link #of(FragmentKind, Object)} refers to its source directly: the source must not be
 * modified while the fragment is pending. {@link #copyOf(FragmentKind, Object)} captures a private copy instead.
 *
 * @param <E> the type of elements
 * @param <S> the source type
 */
public final class Fragment<E, S> implements Iterable<E> {
    private Fragment(final @NotNull FragmentKind<E, S> kind, final @NotNull S source, final boolean copy) {
        this.kind = kind;
        this.source = source;
        this.length = kind.lengthOf(source);
        this.copy = copy;
    }

    /**
     * Returns a new fragment referring to the given source without copying it.
     *
     * @throws NullPointerException if either argument is {@code null}
     */
    public static <E, S> @NotNull Fragment<E, S> of(final @NotNull FragmentKind<E, S> kind, final @NotNull S source) {
        return new Fragment<>(Objects.requireNonNull(kind), Objects.requireNonNull(source), false);
    }

    /**
     * Returns a new fragment holding a private copy of the given source.
     *
     * @throws NullPointerException if either argument is {@code null}
     */
    public static <E, S> @NotNull Fragment<E, S> copyOf(
        final @NotNull FragmentKind<E, S> kind,
        final @NotNull S source
    ) {
        Objects.requireNonNull(kind);
        return new Fragment<>(kind, kind.copyOf(Objects.requireNonNull(source)), true);
    }

    /**
     * Returns the number of elements in this fragment.
     * <p>
     * Complexity: constant time.
     */
    public int length() {
        return length;
    }

    /**
     * Returns {@code true} iff this fragment holds a private copy of the data it was created from.
     */
    public boolean isCopy() {
        return copy;
    }

    public E elementAt(final int index) {
        Objects.checkIndex(index, length);
        return kind.elementAt(source, index);
    }

    /**
     * Returns a read-only iterator over the elements of this fragment.
     */
    @Override
    public @NotNull Iterator<E> iterator() {
        return new Itr();
    }

    @Override
    public @NotNull String toString() {
        return kind.describe(source);
    }

    @NotNull FragmentKind<E, S> kind() {
        return kind;
    }

    @NotNull S source() {
        return source;
    }

    private final FragmentKind<E, S> kind;
    private final S source;
    private final int length;
    private final boolean copy;

    private final class Itr implements Iterator<E> {
        @Override
        public boolean hasNext() {
            return index < length;
        }

        @Override
        @SuppressFBWarnings(value = "IT_NO_SUCH_ELEMENT", justification = "It can, SpotBugs is just confused")
        public E next() {
            final var idx = index;
            if (idx >= length) {
                throw new NoSuchElementException("No more elements in fragment");
            }
            index = idx + 1;
            return kind.elementAt(source, idx);
        }

        private int index = 0;
    }
}
