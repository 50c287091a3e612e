package com.ryuqq.promotion.adapter.inmemory.object;

import com.ryuqq.promotion.core.spi.StoreException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link InMemoryObjectStore}.
 *
 * @author Promotion Team
 * @since 1.0.0
 */
class InMemoryObjectStoreTest {

    private final InMemoryObjectStore store = new InMemoryObjectStore();

    @Test
    void put_then_get_returns_copy() {
        byte[] data = {1, 2, 3};
        store.put("dev-audio", "a.mp3", data);
        data[0] = 9;

        byte[] read = store.get("dev-audio", "a.mp3");

        assertThat(read).containsExactly(1, 2, 3);
        assertThat(store.exists("dev-audio", "a.mp3")).isTrue();
        assertThat(store.objectCount("dev-audio")).isEqualTo(1);
    }

    @Test
    void buckets_are_isolated() {
        store.put("dev-audio", "a.mp3", new byte[]{1});

        assertThat(store.exists("stage-audio", "a.mp3")).isFalse();
        assertThatThrownBy(() -> store.get("stage-audio", "a.mp3"))
            .isInstanceOf(StoreException.class)
            .hasMessage("Object not found: stage-audio/a.mp3");
    }
}
