package dev.coursecrawl.cache;

/**
 * Produces the value of a page on a cache miss.
 *
 * @param <V> page type
 */
@FunctionalInterface
public interface PageLoader<V> {

    /**
     * Loads the page stored at the given address. Failures propagate to the caller of
     * {@link PagedCache#load(int, PageLoader)} and nothing is cached.
     */
    V load(int address);
}
