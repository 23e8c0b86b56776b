// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lazyconcat.concat;

import org.jetbrains.annotations.NotNull;

/**
 * Describes a type of fragment source: how long a source is, how to read its elements and how to take a private
 * copy of it.
 * <p>
 * Implementations are expected to be stateless.
 *
 * @param <E> the type of elements a source consists of
 * @param <S> the fragment source type
 */
public interface FragmentKind<E, S> {
    /**
     * Returns the number of elements in the given source.
     */
    int lengthOf(@NotNull S source);

    /**
     * Returns the element at the given index of the given source.
     *
     * @throws IndexOutOfBoundsException if the index is outside of the source
     */
    E elementAt(@NotNull S source, int index);

    /**
     * Returns a copy of the given source that is unaffected by later changes to the original.
     */
    @NotNull S copyOf(@NotNull S source);

    /**
     * Returns a human-readable rendering of the given source, used by {@code toString()} implementations.
     */
    default @NotNull String describe(final @NotNull S source) {
        return String.valueOf(source);
    }
}
