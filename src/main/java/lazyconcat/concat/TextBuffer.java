// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lazyconcat.concat;

import java.nio.CharBuffer;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * A root buffer for text, backed by a {@link StringBuilder}.
 * <p>
 * Fragments are arbitrary {@link CharSequence}s, appended whole, so a surrogate pair inside a fragment is never
 * separated by materialization. Slices are read-only {@link CharBuffer} views that don't copy.
 */
public final class TextBuffer implements RootBuffer<Character, CharSequence, CharSequence, String> {
    /**
     * Initializes a new, empty text buffer.
     */
    public TextBuffer() {
        builder = new StringBuilder();
    }

    /**
     * Initializes a new text buffer containing the given text.
     */
    public TextBuffer(final @NotNull CharSequence initial) {
        builder = new StringBuilder(initial);
    }

    /**
     * Returns the kind describing {@link CharSequence} fragments.
     */
    public static @NotNull FragmentKind<Character, CharSequence> kind() {
        return Kind.instance;
    }

    @Override
    public @NotNull FragmentKind<Character, CharSequence> fragmentKind() {
        return Kind.instance;
    }

    @Override
    public int length() {
        return builder.length();
    }

    @Override
    public void append(final @NotNull CharSequence chunk) {
        builder.append(chunk);
    }

    @Override
    public Character get(final int index) {
        return builder.charAt(index);
    }

    @Override
    public @NotNull CharSequence slice(final int from, final int to) {
        Objects.checkFromToIndex(from, to, builder.length());
        return CharBuffer.wrap(builder, from, to).slice();
    }

    @Override
    public @NotNull String finish() {
        return builder.toString();
    }

    @Override
    public @NotNull String toString() {
        return builder.toString();
    }

    private final StringBuilder builder;

    private static final class Kind implements FragmentKind<Character, CharSequence> {
        @Override
        public int lengthOf(final @NotNull CharSequence source) {
            return source.length();
        }

        @Override
        public Character elementAt(final @NotNull CharSequence source, final int index) {
            return source.charAt(index);
        }

        @Override
        public @NotNull CharSequence copyOf(final @NotNull CharSequence source) {
            return source.toString();
        }

        private static final Kind instance = new Kind();
    }
}
