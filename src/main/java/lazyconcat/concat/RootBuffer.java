// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lazyconcat.concat;

import org.jetbrains.annotations.NotNull;

/**
 * The contiguous, append-only buffer holding the materialized prefix of a {@link LazyConcat}.
 * <p>
 * Data already appended is never rewritten or removed, so views returned by {@link #slice(int, int)} stay valid for
 * as long as their range does.
 *
 * @param <E> the type of elements
 * @param <S> the type of chunks that can be appended
 * @param <V> the type of read-only slice views
 * @param <R> the type of the finished buffer
 */
public interface RootBuffer<E, S, V, R> {
    /**
     * Returns the kind describing the chunks this buffer accepts.
     */
    @NotNull FragmentKind<E, S> fragmentKind();

    /**
     * Returns the number of elements in this buffer.
     */
    int length();

    /**
     * Appends the entire given chunk at the end of this buffer.
     */
    void append(@NotNull S chunk);

    /**
     * Returns the element at the given index.
     *
     * @throws IndexOutOfBoundsException if the index is not within {@code [0, length())}
     */
    E get(int index);

    /**
     * Returns a read-only view of the elements in {@code [from, to)}.
     *
     * @throws IndexOutOfBoundsException if the range is not within {@code [0, length()]}
     */
    @NotNull V slice(int from, int to);

    /**
     * Returns the buffer contents in their final form. The buffer must not be used afterwards.
     */
    @NotNull R finish();
}
