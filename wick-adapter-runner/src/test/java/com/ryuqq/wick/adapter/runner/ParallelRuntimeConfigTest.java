package com.ryuqq.wick.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ParallelRuntimeConfig 유닛 테스트.
 *
 * @author Wick Team
 * @since 1.0.0
 */
class ParallelRuntimeConfigTest {

    @Test
    void 기본값() {
        ParallelRuntimeConfig config = new ParallelRuntimeConfig();

        assertThat(config.concurrency()).isEqualTo(4);
        assertThat(config.sequentialThreshold()).isEqualTo(4);
        assertThat(config.timeoutMs()).isEqualTo(300_000);
    }

    @Test
    void withX는_해당_값만_변경() {
        // given
        ParallelRuntimeConfig config = new ParallelRuntimeConfig();

        // when
        ParallelRuntimeConfig changed = config.withConcurrency(8).withSequentialThreshold(0).withTimeoutMs(1000);

        // then
        assertThat(changed).isEqualTo(new ParallelRuntimeConfig(8, 0, 1000));
        assertThat(config).isEqualTo(new ParallelRuntimeConfig());
    }

    @Test
    void 잘못된_값은_예외() {
        assertThatThrownBy(() -> new ParallelRuntimeConfig(0, 4, 1000))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("concurrency");
        assertThatThrownBy(() -> new ParallelRuntimeConfig(4, -1, 1000))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sequentialThreshold");
        assertThatThrownBy(() -> new ParallelRuntimeConfig(4, 4, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("timeoutMs");
    }
}
