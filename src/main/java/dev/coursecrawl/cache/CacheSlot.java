package dev.coursecrawl.cache;

import org.jspecify.annotations.Nullable;

/**
 * One slot of a {@link PagedCache}. The value is meaningful only when {@code valid} is set and
 * {@code address} equals the queried address.
 */
record CacheSlot<V>(boolean valid, int address, @Nullable V value) {

    private static final CacheSlot<?> EMPTY = new CacheSlot<>(false, -1, null);

    @SuppressWarnings("unchecked")
    static <V> CacheSlot<V> empty() {
        return (CacheSlot<V>) EMPTY;
    }

    boolean holds(int queried) {
        return valid && address == queried;
    }
}
