// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lazyconcat.concat;

import java.util.Arrays;
import org.checkerframework.checker.nullness.qual.Nullable;

final class ArrayOps {
    private ArrayOps() {
    }

    static @Nullable Object[] ensureCapacity(final @Nullable Object[] array, final int minCapacity) {
        checkRequiredLength(minCapacity);
        final var capacity = array.length;
        return (minCapacity <= capacity) ? array : Arrays.copyOf(array, newCapacity(capacity, minCapacity));
    }

    static byte[] ensureCapacity(final byte[] array, final int minCapacity) {
        checkRequiredLength(minCapacity);
        final var capacity = array.length;
        return (minCapacity <= capacity) ? array : Arrays.copyOf(array, newCapacity(capacity, minCapacity));
    }

    // Copies the ring buffer segment starting at head into a new array of the given capacity, unwrapping it so that
    // the first element lands at index 0.
    static <T> @Nullable T[] unwrapRing(final @Nullable T[] ring, final int head, final int size, final int capacity) {
        assert size <= ring.length && capacity >= size;
        final @Nullable T[] newArray = Arrays.copyOf(ring, capacity);
        final var firstPart = Integer.min(size, ring.length - head);
        System.arraycopy(ring, head, newArray, 0, firstPart);
        System.arraycopy(ring, 0, newArray, firstPart, size - firstPart);
        Arrays.fill(newArray, size, capacity, null);
        return newArray;
    }

    static int newCapacity(final int oldCapacity, final int minCapacity) {
        checkRequiredLength(minCapacity);
        // Grow by half, like ArrayList, with a small floor.
        final var grown = oldCapacity + (oldCapacity >> 1);
        final var candidate = Integer.max(Integer.max(grown, minCapacity), minimumCapacity);
        return (candidate < 0 || candidate > maxArrayLength) ? Integer.max(minCapacity, maxArrayLength) : candidate;
    }

    // A negative required length means the int sum of the old length and the appended length overflowed.
    private static void checkRequiredLength(final int minCapacity) {
        if (minCapacity < 0) {
            throw new OutOfMemoryError("Required array length is too large");
        }
    }

    static final int minimumCapacity = 8;
    // Some VMs reserve header words in arrays, so stay a little below Integer.MAX_VALUE.
    private static final int maxArrayLength = Integer.MAX_VALUE - 8;
}
