// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lazyconcat.concat;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * A root buffer for raw bytes, backed by a growable array.
 * <p>
 * Slices are read-only {@link ByteBuffer} views. A view keeps referring to the array that was current when it was
 * taken; since appended bytes are never rewritten, its contents stay correct after the buffer grows.
 */
public final class ByteArrayBuffer implements RootBuffer<Byte, byte[], ByteBuffer, byte[]> {
    /**
     * Initializes a new, empty byte buffer.
     */
    public ByteArrayBuffer() {
        bytes = new byte[ArrayOps.minimumCapacity];
    }

    /**
     * Initializes a new byte buffer containing a copy of the given bytes.
     */
    public ByteArrayBuffer(final byte @NotNull [] initial) {
        bytes = Arrays.copyOf(initial, Integer.max(initial.length, ArrayOps.minimumCapacity));
        length = initial.length;
    }

    /**
     * Returns the kind describing {@code byte[]} fragments.
     */
    public static @NotNull FragmentKind<Byte, byte[]> kind() {
        return Kind.instance;
    }

    @Override
    public @NotNull FragmentKind<Byte, byte[]> fragmentKind() {
        return Kind.instance;
    }

    @Override
    public int length() {
        return length;
    }

    @Override
    public void append(final byte @NotNull [] chunk) {
        final var oldLength = length;
        final var newLength = oldLength + chunk.length;
        bytes = ArrayOps.ensureCapacity(bytes, newLength);
        System.arraycopy(chunk, 0, bytes, oldLength, chunk.length);
        length = newLength;
    }

    @Override
    public Byte get(final int index) {
        Objects.checkIndex(index, length);
        return bytes[index];
    }

    @Override
    public @NotNull ByteBuffer slice(final int from, final int to) {
        Objects.checkFromToIndex(from, to, length);
        return ByteBuffer.wrap(bytes, from, to - from).slice().asReadOnlyBuffer();
    }

    @Override
    public byte @NotNull [] finish() {
        return Arrays.copyOf(bytes, length);
    }

    @Override
    public @NotNull String toString() {
        return Arrays.toString(Arrays.copyOf(bytes, length));
    }

    private byte[] bytes;
    private int length = 0;

    private static final class Kind implements FragmentKind<Byte, byte[]> {
        @Override
        public int lengthOf(final byte @NotNull [] source) {
            return source.length;
        }

        @Override
        public Byte elementAt(final byte @NotNull [] source, final int index) {
            return source[index];
        }

        @Override
        public byte @NotNull [] copyOf(final byte @NotNull [] source) {
            return source.clone();
        }

        @Override
        public @NotNull String describe(final byte @NotNull [] source) {
            return Arrays.toString(source);
        }

        private static final Kind instance = new Kind();
    }
}
