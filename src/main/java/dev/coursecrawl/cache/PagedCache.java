package dev.coursecrawl.cache;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Direct-mapped read-through cache of pages.
 *
 * <p>Address {@code a} always lives in slot {@code a mod size}. Two addresses with the same
 * residue evict each other; there is no associativity and no recency policy. The slot count is
 * fixed for the lifetime of the cache.
 *
 * <p>Not thread-safe. A cache is owned by a single crawler and used from one thread.
 *
 * @param <V> page type
 */
public class PagedCache<V> {

    private static final Logger log = LoggerFactory.getLogger(PagedCache.class);

    private final CacheSlot<V>[] slots;

    @SuppressWarnings("unchecked")
    public PagedCache(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Cache size must be at least 1, got: " + size);
        }
        this.slots = (CacheSlot<V>[]) new CacheSlot<?>[size];
        resetAll();
    }

    /**
     * Returns the page at {@code address}, invoking {@code loader} only on a miss. A loader
     * failure leaves the slot unmodified.
     *
     * @param address page address
     * @param loader  miss handler
     * @return the cached or freshly loaded page
     */
    public V load(int address, PageLoader<V> loader) {
        int index = slotIndex(address);
        CacheSlot<V> slot = slots[index];
        if (slot.holds(address)) {
            log.debug("Cache hit for page {} (slot {})", address, index);
            return slot.value();
        }
        log.debug("Cache miss for page {} (slot {}, evicting {})",
                address, index, slot.valid() ? slot.address() : "nothing");
        V value = loader.load(address);
        slots[index] = new CacheSlot<>(true, address, value);
        return value;
    }

    /**
     * Invalidates the page at {@code address} if its slot currently holds exactly that address.
     * No-op otherwise.
     */
    public void invalidate(int address) {
        int index = slotIndex(address);
        if (slots[index].holds(address)) {
            slots[index] = CacheSlot.empty();
        }
    }

    /** Discards every cached page. */
    public void resetAll() {
        Arrays.fill(slots, CacheSlot.empty());
    }

    /** Number of slots. */
    public int size() {
        return slots.length;
    }

    private int slotIndex(int address) {
        return Math.floorMod(address, slots.length);
    }
}
