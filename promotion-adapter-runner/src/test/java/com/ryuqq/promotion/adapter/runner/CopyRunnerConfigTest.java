package com.ryuqq.promotion.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CopyRunnerConfig 테스트.
 *
 * @author Promotion Team
 * @since 1.0.0
 */
class CopyRunnerConfigTest {

    @Test
    void 기본_설정값_확인() {
        CopyRunnerConfig config = new CopyRunnerConfig();

        assertThat(config.concurrency()).isEqualTo(4);
        assertThat(config.shutdownTimeoutMs()).isEqualTo(60000);
    }

    @Test
    void 실제_폭은_concurrency와_배치_상한_중_작은_값() {
        CopyRunnerConfig config = new CopyRunnerConfig().withConcurrency(8);

        assertThat(config.effectiveWidth(10)).isEqualTo(8);
        assertThat(config.effectiveWidth(3)).isEqualTo(3);
    }

    @Test
    void 잘못된_값은_거부됨() {
        assertThatThrownBy(() -> new CopyRunnerConfig(0, 1000))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("concurrency must be positive (current: 0)");
        assertThatThrownBy(() -> new CopyRunnerConfig().withShutdownTimeoutMs(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CopyRunnerConfig().effectiveWidth(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
