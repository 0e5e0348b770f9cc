package org.recdiff.engine;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Forward-only iterator over change entries that computes each entry only when it is pulled.
 *
 * <p>Subclasses implement {@link #advance()}; nesting is expressed by {@link #flatMap}, which keeps one
 * open child cursor per tree level and never looks past the entry being returned.
 */
abstract class ChangeCursor implements Iterator<ChangeEntry> {
    private ChangeEntry pending;
    private boolean exhausted;

    /**
     * @return the next entry, or {@code null} when there are no more
     */
    abstract ChangeEntry advance();

    @Override
    public final boolean hasNext() {
        if (pending == null && !exhausted) {
            pending = advance();
            exhausted = pending == null;
        }
        return pending != null;
    }

    @Override
    public final ChangeEntry next() {
        if (!hasNext()) {
            throw new NoSuchElementException("no more change entries");
        }
        ChangeEntry next = pending;
        pending = null;
        return next;
    }

    static Iterator<ChangeEntry> empty() {
        return Collections.emptyIterator();
    }

    static Iterator<ChangeEntry> of(ChangeEntry entry) {
        return Collections.singletonList(Objects.requireNonNull(entry, "entry")).iterator();
    }

    /**
     * Runs {@code supplier} on the first pull.
     */
    static Iterator<ChangeEntry> deferred(Supplier<Iterator<ChangeEntry>> supplier) {
        Objects.requireNonNull(supplier, "supplier");
        return new ChangeCursor() {
            private Iterator<ChangeEntry> delegate;

            @Override
            ChangeEntry advance() {
                if (delegate == null) {
                    delegate = Objects.requireNonNull(supplier.get(), "deferred cursor");
                }
                return delegate.hasNext() ? delegate.next() : null;
            }
        };
    }

    /**
     * Expands each source into its entries, one source at a time.
     */
    static <T> Iterator<ChangeEntry> flatMap(Iterator<T> sources, Function<? super T, Iterator<ChangeEntry>> expand) {
        Objects.requireNonNull(sources, "sources");
        Objects.requireNonNull(expand, "expand");
        return new ChangeCursor() {
            private Iterator<ChangeEntry> current = Collections.emptyIterator();

            @Override
            ChangeEntry advance() {
                while (!current.hasNext()) {
                    if (!sources.hasNext()) {
                        return null;
                    }
                    current = Objects.requireNonNull(expand.apply(sources.next()), "expanded cursor");
                }
                return current.next();
            }
        };
    }

    static <T> Iterator<ChangeEntry> map(Iterator<T> sources, Function<? super T, ChangeEntry> toEntry) {
        Objects.requireNonNull(toEntry, "toEntry");
        return flatMap(sources, source -> of(toEntry.apply(source)));
    }

    @SafeVarargs
    static Iterator<ChangeEntry> concat(Iterator<ChangeEntry>... parts) {
        return flatMap(Arrays.asList(parts).iterator(), Function.identity());
    }

    /**
     * Sequential stream view; pulling through {@code iterator()} or {@code findFirst()} advances
     * {@code cursor} one entry at a time.
     */
    static Stream<ChangeEntry> stream(Iterator<ChangeEntry> cursor) {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(cursor, Spliterator.ORDERED | Spliterator.NONNULL),
            false);
    }
}
