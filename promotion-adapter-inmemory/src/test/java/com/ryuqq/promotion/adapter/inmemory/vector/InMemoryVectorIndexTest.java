package com.ryuqq.promotion.adapter.inmemory.vector;

import com.ryuqq.promotion.core.model.ItemId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link InMemoryVectorIndex}.
 *
 * @author Promotion Team
 * @since 1.0.0
 */
class InMemoryVectorIndexTest {

    private final InMemoryVectorIndex index = new InMemoryVectorIndex();

    @Test
    void copies_only_existing_points_and_keeps_ids() {
        // given
        index.upsert("docs_dev", ItemId.of("d1"), new float[]{0.1f, 0.2f});
        index.upsert("docs_dev", ItemId.of("d2"), new float[]{0.3f, 0.4f});

        // when
        int copied = index.copyPoints(List.of(ItemId.of("d1"), ItemId.of("missing")), "docs_dev", "docs_stage");

        // then
        assertThat(copied).isEqualTo(1);
        assertThat(index.contains("docs_stage", ItemId.of("d1"))).isTrue();
        assertThat(index.contains("docs_stage", ItemId.of("d2"))).isFalse();
        assertThat(index.pointCount("docs_dev")).isEqualTo(2);
    }

    @Test
    void unknown_source_collection_copies_nothing() {
        assertThat(index.copyPoints(List.of(ItemId.of("d1")), "docs_test", "docs_stage")).isZero();
        assertThat(index.pointCount("docs_stage")).isZero();
    }
}
