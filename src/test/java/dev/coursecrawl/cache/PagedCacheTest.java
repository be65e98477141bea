package dev.coursecrawl.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PagedCacheTest {

    private PagedCache<String> cache;
    private List<Integer> loads;
    private PageLoader<String> loader;

    @BeforeEach
    void setUp() {
        cache = new PagedCache<>(5);
        loads = new ArrayList<>();
        loader = address -> {
            loads.add(address);
            return "page-" + address;
        };
    }

    @Test
    void rejectsNonPositiveSize() {
        assertThatThrownBy(() -> new PagedCache<String>(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 1");
    }

    @Test
    void missInvokesLoaderAndHitDoesNot() {
        assertThat(cache.load(3, loader)).isEqualTo("page-3");
        assertThat(cache.load(3, loader)).isEqualTo("page-3");

        assertThat(loads).containsExactly(3);
    }

    @Test
    void collidingAddressesEvictEachOther() {
        cache.load(2, loader);
        cache.load(7, loader);
        cache.load(2, loader);

        assertThat(loads).containsExactly(2, 7, 2);
    }

    @Test
    void distinctSlotsDoNotInterfere() {
        for (int address = 0; address < 5; address++) {
            cache.load(address, loader);
        }
        for (int address = 0; address < 5; address++) {
            cache.load(address, loader);
        }

        assertThat(loads).containsExactly(0, 1, 2, 3, 4);
    }

    @Test
    void invalidateDropsOnlyTheHeldAddress() {
        cache.load(1, loader);
        cache.invalidate(1);
        cache.load(1, loader);

        assertThat(loads).containsExactly(1, 1);
    }

    @Test
    void invalidateOfCollidingAddressIsNoOp() {
        cache.load(1, loader);
        cache.invalidate(6);
        cache.invalidate(4);
        cache.load(1, loader);

        assertThat(loads).containsExactly(1);
    }

    @Test
    void resetAllForcesReload() {
        cache.load(0, loader);
        cache.load(1, loader);
        cache.resetAll();
        cache.load(0, loader);
        cache.load(1, loader);

        assertThat(loads).containsExactly(0, 1, 0, 1);
    }

    @Test
    void failingLoaderLeavesSlotUnchanged() {
        cache.load(2, loader);

        assertThatThrownBy(() -> cache.load(7, address -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        assertThat(cache.load(2, loader)).isEqualTo("page-2");
        assertThat(loads).containsExactly(2);
    }

    @Test
    void failingLoaderOnEmptySlotCachesNothing() {
        assertThatThrownBy(() -> cache.load(4, address -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        cache.load(4, loader);

        assertThat(loads).containsExactly(4);
    }

    @Test
    void negativeAddressesMapIntoRange() {
        cache.load(-1, loader);
        cache.load(-1, loader);

        assertThat(loads).containsExactly(-1);
    }

    @Test
    void nullPagesAreCached() {
        PagedCache<String> nullable = new PagedCache<>(1);
        List<Integer> calls = new ArrayList<>();

        nullable.load(0, address -> {
            calls.add(address);
            return null;
        });
        nullable.load(0, address -> {
            calls.add(address);
            return null;
        });

        assertThat(calls).containsExactly(0);
        assertThat(nullable.size()).isEqualTo(1);
    }
}
