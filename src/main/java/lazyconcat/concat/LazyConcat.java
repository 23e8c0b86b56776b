// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package lazyconcat.concat;

import java.nio.ByteBuffer;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A deferred concatenation: a materialized <i>root</i> buffer followed by a queue of pending fragments that haven't
 * been copied into it yet.
 * <p>
 * The logical value of a container is always the root followed by all pending fragments, in the order they were
 * concatenated. {@link #concat(Object)} only enqueues, so building is constant time per fragment regardless of how
 * much data is involved. Reads decide how much gets copied:
 * <ul>
 * <li>{@link #iterator()} walks the logical sequence without copying anything;</li>
 * <li>{@link #getSlice(int, int)} materializes the shortest run of whole fragments that covers the requested range,
 * leaving the rest pending;</li>
 * <li>{@link #done()} materializes everything and hands out the finished root.</li>
 * </ul>
 * <p>
 * The root only ever grows: once data is materialized it's never rewritten or removed.
 * <p>
 * Containers are meant to have a single owner and aren't thread-safe. Read-only operations ({@link #iterator()},
 * {@link #logicalLength()}, {@link #sliceNeedsNormalization(int, int)}) may be performed concurrently with each
 * other, but never concurrently with any other operation.
 * <p>
 * Once {@link #done()} has been called, every other operation throws {@link IllegalStateException}.
 *
 * @param <E> the type of elements of the logical sequence
 * @param <S> the type of fragment sources
 * @param <V> the type of slice views
 * @param <R> the type of the finished result
 */
public final class LazyConcat<E, S, V, R> implements Iterable<E> {
    private LazyConcat(final @NotNull RootBuffer<E, S, V, R> root, final int expectedFragments) {
        this.root = root;
        pending = new FragmentQueue<>(expectedFragments);
    }

    /**
     * Returns a new container whose logical value starts with the contents of the given root buffer.
     * <p>
     * The container takes ownership of the buffer: it must not be used directly afterwards.
     */
    public static <E, S, V, R> @NotNull LazyConcat<E, S, V, R> of(final @NotNull RootBuffer<E, S, V, R> root) {
        return of(root, 0);
    }

    /**
     * Returns a new container over the given root buffer, with room for the given number of pending fragments.
     *
     * @throws IllegalArgumentException if the expected number of fragments is negative
     */
    public static <E, S, V, R> @NotNull LazyConcat<E, S, V, R> of(
        final @NotNull RootBuffer<E, S, V, R> root,
        final int expectedFragments
    ) {
        return new LazyConcat<>(Objects.requireNonNull(root), expectedFragments);
    }

    /**
     * Returns a new, empty text container.
     */
    public static @NotNull LazyConcat<Character, CharSequence, CharSequence, String> text() {
        return of(new TextBuffer());
    }

    /**
     * Returns a new text container starting with the given text.
     */
    public static @NotNull LazyConcat<Character, CharSequence, CharSequence, String> text(
        final @NotNull CharSequence initial
    ) {
        return of(new TextBuffer(initial));
    }

    /**
     * Returns a new, empty element list container.
     */
    public static <T> @NotNull LazyConcat<T, List<T>, List<T>, List<T>> list() {
        return of(new ListBuffer<>());
    }

    /**
     * Returns a new element list container starting with the elements of the given list.
     */
    public static <T> @NotNull LazyConcat<T, List<T>, List<T>, List<T>> list(final @NotNull List<? extends T> initial) {
        return of(new ListBuffer<>(initial));
    }

    /**
     * Returns a new, empty byte container.
     */
    public static @NotNull LazyConcat<Byte, byte[], ByteBuffer, byte[]> bytes() {
        return of(new ByteArrayBuffer());
    }

    /**
     * Returns a new byte container starting with a copy of the given bytes.
     */
    public static @NotNull LazyConcat<Byte, byte[], ByteBuffer, byte[]> bytes(final byte @NotNull [] initial) {
        return of(new ByteArrayBuffer(initial));
    }

    /**
     * Appends the given source to the logical sequence, without copying it.
     * <p>
     * The source is held by reference until it's materialized: modifying it in the meantime changes what this
     * container will produce. Use {@link #concatCopy(Object)} for sources that may change.
     * <p>
     * Complexity: amortized constant time.
     *
     * @return this container
     */
    public @NotNull LazyConcat<E, S, V, R> concat(final @NotNull S source) {
        return enqueue(Fragment.of(root().fragmentKind(), source));
    }

    /**
     * Appends a private copy of the given source to the logical sequence.
     * <p>
     * Complexity: linear in the length of the source.
     *
     * @return this container
     */
    public @NotNull LazyConcat<E, S, V, R> concatCopy(final @NotNull S source) {
        return enqueue(Fragment.copyOf(root().fragmentKind(), source));
    }

    /**
     * Appends the given fragment to the logical sequence.
     * <p>
     * Complexity: amortized constant time.
     *
     * @return this container
     * @throws IllegalArgumentException if the fragment's kind is not the one used by the root buffer
     */
    public @NotNull LazyConcat<E, S, V, R> concat(final @NotNull Fragment<E, S> fragment) {
        final var kind = root().fragmentKind();
        if (!kind.equals(fragment.kind())) {
            throw new IllegalArgumentException("Fragment kind doesn't match the root buffer");
        }
        return enqueue(fragment);
    }

    /**
     * Returns the length of the logical sequence: the root length plus the lengths of all pending fragments.
     * <p>
     * Complexity: constant time.
     */
    public long logicalLength() {
        return root().length() + pending.totalPendingLength();
    }

    /**
     * Returns the number of elements already materialized into the root.
     * <p>
     * Complexity: constant time.
     */
    public int materializedLength() {
        return root().length();
    }

    /**
     * Returns the number of fragments not yet materialized.
     */
    public int pendingFragmentCount() {
        checkNotFinalized();
        return pending.size();
    }

    /**
     * Returns {@code true} iff there are no pending fragments, so the root holds the entire logical sequence.
     */
    public boolean isNormalized() {
        checkNotFinalized();
        return pending.isEmpty();
    }

    /**
     * Materializes every pending fragment into the root. Does nothing if there are none.
     */
    public void normalize() {
        final var buffer = root();
        if (!pending.isEmpty()) {
            pending.materializeAll(buffer);
            modificationCount += 1;
        }
    }

    /**
     * Materializes whole pending fragments, in order, until the root is at least {@code length} long or nothing is
     * pending anymore.
     * <p>
     * Because fragments are never split, the root may end up longer than requested. A length beyond
     * {@link #logicalLength()} is equivalent to {@link #normalize()}.
     */
    public void normalizeToLength(final long length) {
        final var buffer = root();
        final var rootLength = buffer.length();
        if (length <= rootLength || pending.isEmpty()) {
            return;
        }
        pending.materializeFrontUntil(buffer, length - rootLength);
        modificationCount += 1;
    }

    /**
     * Returns {@code true} iff the range {@code [from, to)} extends past the root into pending fragments, that is iff
     * {@link #getSlice(int, int)} would have to materialize something first.
     * <p>
     * Complexity: constant time.
     */
    public boolean sliceNeedsNormalization(final int from, final int to) {
        return to > root().length();
    }

    /**
     * Returns a read-only view of the elements of the logical sequence in {@code [from, to)}.
     * <p>
     * If the range reaches into pending fragments, the shortest run of whole fragments covering it is materialized
     * first. Fragments entirely past {@code to} stay pending.
     *
     * @throws IndexOutOfBoundsException if {@code from < 0}, {@code from > to} or {@code to > logicalLength()}; the
     *                                   container is left unchanged
     */
    @CheckReturnValue
    public @NotNull V getSlice(final int from, final int to) {
        final var buffer = root();
        Objects.checkFromToIndex(from, to, logicalLength());
        if (sliceNeedsNormalization(from, to)) {
            normalizeToLength(to);
        }
        return buffer.slice(from, to);
    }

    /**
     * Returns a read-only view of the elements of the logical sequence from {@code from} to the end, materializing
     * everything.
     *
     * @throws IndexOutOfBoundsException if {@code from} is negative or past the end of the logical sequence
     */
    @CheckReturnValue
    public @NotNull V getSlice(final int from) {
        final var length = logicalLength();
        if (length > Integer.MAX_VALUE) {
            throw new IndexOutOfBoundsException("Logical length " + length + " is too large for a single slice");
        }
        return getSlice(from, (int) length);
    }

    /**
     * Returns a new iterator over the logical sequence: first the root, then each pending fragment in order.
     * <p>
     * Iterating doesn't materialize anything. Concatenating or normalizing during iteration makes the iterator
     * throw {@link ConcurrentModificationException} on a best-effort basis.
     */
    @Override
    public @NotNull Iterator<E> iterator() {
        return new Itr(root());
    }

    /**
     * Returns a new spliterator over the logical sequence.
     * <p>
     * The returned spliterator always reports at least {@link Spliterator#SIZED} and {@link Spliterator#ORDERED}.
     */
    @Override
    public @NotNull Spliterator<E> spliterator() {
        return Spliterators.spliterator(iterator(), logicalLength(), Spliterator.ORDERED);
    }

    /**
     * Returns a sequential stream over the logical sequence. Streaming doesn't materialize anything.
     */
    public @NotNull Stream<E> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Materializes everything and returns the finished root. The container can't be used afterwards.
     *
     * @throws IllegalStateException if called more than once
     */
    public @NotNull R done() {
        final var buffer = root();
        normalize();
        root = null;
        modificationCount += 1;
        log.debug("Finished lazy concatenation of {} element(s)", buffer.length());
        return buffer.finish();
    }

    /**
     * Returns the string forms of all elements of the logical sequence, in order and without separators. For text
     * containers this is the text itself. Doesn't materialize anything.
     * <p>
     * Complexity: linear time.
     */
    public @NotNull String contentToString() {
        final var builder = new StringBuilder();
        for (final var element : this) {
            builder.append(element);
        }
        return builder.toString();
    }

    /**
     * Returns a debugging representation of the root and the pending fragments. Doesn't materialize anything.
     */
    @Override
    public @NotNull String toString() {
        final var buffer = root;
        if (buffer == null) {
            return "LazyConcat{done}";
        }
        return "LazyConcat{root=" + buffer + ", pending=" + pending + '}';
    }

    private @NotNull LazyConcat<E, S, V, R> enqueue(final @NotNull Fragment<E, S> fragment) {
        pending.push(fragment);
        modificationCount += 1;
        return this;
    }

    private @NotNull RootBuffer<E, S, V, R> root() {
        final var buffer = root;
        if (buffer == null) {
            throw finalized();
        }
        return buffer;
    }

    private void checkNotFinalized() {
        if (root == null) {
            throw finalized();
        }
    }

    private static @NotNull IllegalStateException finalized() {
        throw new IllegalStateException("LazyConcat used after done()");
    }

    private static final Logger log = LoggerFactory.getLogger(LazyConcat.class);

    private @Nullable RootBuffer<E, S, V, R> root;
    private final FragmentQueue<E, S> pending;
    private int modificationCount = 0;

    private final class Itr implements Iterator<E> {
        private Itr(final @NotNull RootBuffer<E, S, V, R> buffer) {
            this.buffer = buffer;
            rootLength = buffer.length();
            expectedModificationCount = modificationCount;
        }

        @Override
        public boolean hasNext() {
            if (rootIndex < rootLength) {
                return true;
            }
            skipExhaustedFragments();
            return fragmentIndex < pending.size();
        }

        @Override
        @SuppressFBWarnings(value = "IT_NO_SUCH_ELEMENT", justification = "It can, SpotBugs is just confused")
        public E next() {
            if (modificationCount != expectedModificationCount) {
                throw new ConcurrentModificationException("LazyConcat modified during iteration");
            }
            final var index = rootIndex;
            if (index < rootLength) {
                rootIndex = index + 1;
                return buffer.get(index);
            }
            skipExhaustedFragments();
            if (fragmentIndex >= pending.size()) {
                throw new NoSuchElementException("No more elements");
            }
            final var element = pending.get(fragmentIndex).elementAt(offset);
            offset += 1;
            return element;
        }

        private void skipExhaustedFragments() {
            while (fragmentIndex < pending.size() && offset >= pending.get(fragmentIndex).length()) {
                fragmentIndex += 1;
                offset = 0;
            }
        }

        private final RootBuffer<E, S, V, R> buffer;
        private final int rootLength;
        private final int expectedModificationCount;
        private int rootIndex = 0;
        private int fragmentIndex = 0;
        private int offset = 0;
    }
}
