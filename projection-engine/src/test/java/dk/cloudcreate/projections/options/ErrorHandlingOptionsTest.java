package dk.cloudcreate.projections.options;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class ErrorHandlingOptionsTest {
    @Test
    void test_default_is_retry_three_times_then_skip() {
        assertThat(ErrorHandlingOptions.DEFAULT.strategy).isEqualTo(ErrorHandlingStrategy.RETRY);
        assertThat(ErrorHandlingOptions.DEFAULT.maxRetryAttempts).isEqualTo(3);
        assertThat(ErrorHandlingOptions.DEFAULT.initialRetryDelay).isEqualTo(Duration.ofSeconds(1));
        assertThat(ErrorHandlingOptions.DEFAULT.maxRetryDelay).isEqualTo(Duration.ofSeconds(30));
        assertThat(ErrorHandlingOptions.DEFAULT.fallbackStrategy).isEqualTo(ErrorHandlingStrategy.SKIP);
    }

    @Test
    void test_retry_delay_doubles_and_is_capped() {
        var options = ErrorHandlingOptions.retry(10, Duration.ofMillis(100), Duration.ofMillis(1000), ErrorHandlingStrategy.STOP);

        assertThat(options.calculateNextRetryDelay(0)).isEqualTo(Duration.ofMillis(100));
        assertThat(options.calculateNextRetryDelay(1)).isEqualTo(Duration.ofMillis(200));
        assertThat(options.calculateNextRetryDelay(2)).isEqualTo(Duration.ofMillis(400));
        assertThat(options.calculateNextRetryDelay(3)).isEqualTo(Duration.ofMillis(800));
        assertThat(options.calculateNextRetryDelay(4)).isEqualTo(Duration.ofMillis(1000));
        assertThat(options.calculateNextRetryDelay(100)).isEqualTo(Duration.ofMillis(1000));
    }

    @Test
    void verify_fallback_strategy_cannot_be_retry() {
        assertThatThrownBy(() -> ErrorHandlingOptions.retry(3, Duration.ofMillis(10), Duration.ofMillis(100), ErrorHandlingStrategy.RETRY))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void verify_invalid_retry_settings_are_rejected() {
        assertThatThrownBy(() -> ErrorHandlingOptions.retry(0, Duration.ofMillis(10), Duration.ofMillis(100), ErrorHandlingStrategy.SKIP))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ErrorHandlingOptions.retry(3, Duration.ZERO, Duration.ofMillis(100), ErrorHandlingStrategy.SKIP))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ErrorHandlingOptions.retry(3, Duration.ofMillis(500), Duration.ofMillis(100), ErrorHandlingStrategy.SKIP))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void test_skip_and_stop_factories() {
        assertThat(ErrorHandlingOptions.skip().strategy).isEqualTo(ErrorHandlingStrategy.SKIP);
        assertThat(ErrorHandlingOptions.stop().strategy).isEqualTo(ErrorHandlingStrategy.STOP);
        assertThat(ErrorHandlingOptions.skip()).isEqualTo(ErrorHandlingOptions.skip());
    }
}
