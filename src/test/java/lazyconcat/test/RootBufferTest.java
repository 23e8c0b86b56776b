// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lazyconcat.test;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.List;
import lazyconcat.concat.ByteArrayBuffer;
import lazyconcat.concat.Fragment;
import lazyconcat.concat.ListBuffer;
import lazyconcat.concat.TextBuffer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;

final class RootBufferTest {
    @Test
    void textSlicesAreViews() {
        final var buffer = new TextBuffer("hello");
        final var slice = buffer.slice(1, 4);
        buffer.append(" world");
        assertThat(slice).asString().isEqualTo("ell");
        assertThat(slice.length()).isEqualTo(3);
        assertThat(slice.charAt(0)).isEqualTo('e');
        assertThat(buffer.finish()).isEqualTo("hello world");
    }

    @Test
    void listSlicesSurviveGrowth() {
        final var buffer = new ListBuffer<Integer>();
        buffer.append(List.of(1, 2));
        final var slice = buffer.slice(0, 2);
        for (int i = 0; i < 100; i += 1) {
            buffer.append(List.of(i));
        }
        assertThat(slice).containsExactly(1, 2);
        assertThat(buffer.length()).isEqualTo(102);
        assertThat(buffer.get(101)).isEqualTo(99);
        assertThatExceptionOfType(UnsupportedOperationException.class).isThrownBy(() -> slice.add(3));
        assertThatExceptionOfType(UnsupportedOperationException.class).isThrownBy(() -> slice.set(0, 3));
    }

    @Test
    void listBufferPermitsNulls() {
        final var buffer = new ListBuffer<String>(Arrays.asList("a", null));
        buffer.append(Arrays.asList(null, "b"));
        assertThat(buffer).asString().isEqualTo("[a, null, null, b]");
        assertThat(buffer.finish()).containsExactly("a", null, null, "b");
    }

    @Test
    void listBufferMixesElementTypes() {
        final var buffer = new ListBuffer<Object>(List.of("a"));
        buffer.append(List.of(1, 2.0));
        assertThat(buffer.finish()).containsExactly("a", 1, 2.0);
    }

    @Test
    void appendPastMaximumLengthFailsCleanly() {
        final var buffer = new ListBuffer<String>(List.of("a"));
        // Claims the largest possible size without holding any elements.
        final var huge = new AbstractList<String>() {
            @Override
            public String get(final int index) {
                return "x";
            }

            @Override
            public int size() {
                return Integer.MAX_VALUE;
            }
        };
        assertThatExceptionOfType(OutOfMemoryError.class).isThrownBy(() -> buffer.append(huge));
        assertThat(buffer.length()).isEqualTo(1);
        assertThat(buffer.finish()).containsExactly("a");
    }

    @Test
    void byteSlicesSurviveGrowth() {
        final var buffer = new ByteArrayBuffer(new byte[] {9});
        buffer.append(new byte[] {8, 7});
        final var slice = buffer.slice(1, 3);
        buffer.append(new byte[64]);
        assertThat(slice.isReadOnly()).isTrue();
        assertThat(slice.remaining()).isEqualTo(2);
        assertThat(slice.get(0)).isEqualTo((byte) 8);
        assertThat(buffer.length()).isEqualTo(67);
        assertThat(buffer.finish()).hasSize(67).startsWith((byte) 9, (byte) 8, (byte) 7);
    }

    @Test
    void slicesRejectBadRanges() {
        final var text = new TextBuffer("abc");
        assertThatExceptionOfType(IndexOutOfBoundsException.class).isThrownBy(() -> text.slice(2, 4));
        final var bytes = new ByteArrayBuffer();
        assertThatExceptionOfType(IndexOutOfBoundsException.class).isThrownBy(() -> bytes.slice(0, 1));
        assertThatExceptionOfType(IndexOutOfBoundsException.class).isThrownBy(() -> bytes.get(0));
        final var list = new ListBuffer<String>();
        assertThatExceptionOfType(IndexOutOfBoundsException.class).isThrownBy(() -> list.slice(1, 0));
    }

    @Test
    void fragmentsCacheLengthAndCopyOnRequest() {
        final var source = new byte[] {1, 2, 3};
        final var byReference = Fragment.of(ByteArrayBuffer.kind(), source);
        final var copy = Fragment.copyOf(ByteArrayBuffer.kind(), source);
        source[0] = 42;
        assertThat(byReference.length()).isEqualTo(3);
        assertThat(byReference.isCopy()).isFalse();
        assertThat(copy.isCopy()).isTrue();
        assertThat(byReference).containsExactly((byte) 42, (byte) 2, (byte) 3);
        assertThat(copy).containsExactly((byte) 1, (byte) 2, (byte) 3);
        assertThat(copy).asString().isEqualTo("[1, 2, 3]");
        assertThat(copy.elementAt(2)).isEqualTo((byte) 3);
        assertThatExceptionOfType(IndexOutOfBoundsException.class).isThrownBy(() -> copy.elementAt(3));
    }

    @Test
    void emptyFragmentsAreLegal() {
        final var fragment = Fragment.of(ListBuffer.<String>kind(), List.of());
        assertThat(fragment.length()).isZero();
        assertThat(fragment).isEmpty();
    }
}
