package dk.cloudcreate.projections.options;

import java.time.Duration;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * How a partition worker reacts when a projection handler fails to project an event
 */
public class ErrorHandlingOptions {
    public static final int      DEFAULT_MAX_RETRY_ATTEMPTS   = 3;
    public static final Duration DEFAULT_INITIAL_RETRY_DELAY  = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_RETRY_DELAY      = Duration.ofSeconds(30);
    /**
     * Retry 3 times with exponential backoff starting at 1 second (capped at 30 seconds), after which the event is skipped
     */
    public static final ErrorHandlingOptions DEFAULT = retry(DEFAULT_MAX_RETRY_ATTEMPTS,
                                                             DEFAULT_INITIAL_RETRY_DELAY,
                                                             DEFAULT_MAX_RETRY_DELAY,
                                                             ErrorHandlingStrategy.SKIP);

    public final ErrorHandlingStrategy strategy;
    /**
     * The number of retries after the initial failed attempt
     */
    public final int                   maxRetryAttempts;
    public final Duration              initialRetryDelay;
    public final Duration              maxRetryDelay;
    /**
     * Applied when the retries are exhausted. Only {@link ErrorHandlingStrategy#SKIP} and {@link ErrorHandlingStrategy#STOP} are allowed
     */
    public final ErrorHandlingStrategy fallbackStrategy;

    public ErrorHandlingOptions(ErrorHandlingStrategy strategy,
                                int maxRetryAttempts,
                                Duration initialRetryDelay,
                                Duration maxRetryDelay,
                                ErrorHandlingStrategy fallbackStrategy) {
        this.strategy = requireNonNull(strategy, "You must specify a strategy");
        this.initialRetryDelay = requireNonNull(initialRetryDelay, "You must specify an initialRetryDelay");
        this.maxRetryDelay = requireNonNull(maxRetryDelay, "You must specify a maxRetryDelay");
        this.fallbackStrategy = requireNonNull(fallbackStrategy, "You must specify a fallbackStrategy");
        requireTrue(maxRetryAttempts > 0, msg("maxRetryAttempts must be greater than zero, was {}", maxRetryAttempts));
        requireTrue(!initialRetryDelay.isNegative() && !initialRetryDelay.isZero(), msg("initialRetryDelay must be greater than zero, was {}", initialRetryDelay));
        requireTrue(!maxRetryDelay.isNegative() && !maxRetryDelay.isZero(), msg("maxRetryDelay must be greater than zero, was {}", maxRetryDelay));
        requireTrue(initialRetryDelay.compareTo(maxRetryDelay) <= 0, msg("initialRetryDelay {} cannot be greater than maxRetryDelay {}", initialRetryDelay, maxRetryDelay));
        requireTrue(fallbackStrategy != ErrorHandlingStrategy.RETRY, "fallbackStrategy cannot be RETRY. Use SKIP or STOP instead");
        this.maxRetryAttempts = maxRetryAttempts;
    }

    /**
     * Calculate the delay before the next retry
     *
     * @param currentNumberOfRetryAttempts the number of retries already performed (0 before the first retry)
     * @return <code>initialRetryDelay * 2^currentNumberOfRetryAttempts</code> capped at <code>maxRetryDelay</code>
     */
    public Duration calculateNextRetryDelay(int currentNumberOfRetryAttempts) {
        requireTrue(currentNumberOfRetryAttempts >= 0, "currentNumberOfRetryAttempts must be 0 or larger");
        // Beyond 2^30 the delay is capped anyway
        var exponent          = Math.min(currentNumberOfRetryAttempts, 30);
        var calculatedDelayMs = initialRetryDelay.toMillis() * (1L << exponent);
        if (calculatedDelayMs <= 0 || calculatedDelayMs >= maxRetryDelay.toMillis()) {
            return maxRetryDelay;
        }
        return Duration.ofMillis(calculatedDelayMs);
    }

    public static ErrorHandlingOptions retry(int maxRetryAttempts,
                                             Duration initialRetryDelay,
                                             Duration maxRetryDelay,
                                             ErrorHandlingStrategy fallbackStrategy) {
        return new ErrorHandlingOptions(ErrorHandlingStrategy.RETRY,
                                        maxRetryAttempts,
                                        initialRetryDelay,
                                        maxRetryDelay,
                                        fallbackStrategy);
    }

    public static ErrorHandlingOptions skip() {
        return new ErrorHandlingOptions(ErrorHandlingStrategy.SKIP,
                                        DEFAULT_MAX_RETRY_ATTEMPTS,
                                        DEFAULT_INITIAL_RETRY_DELAY,
                                        DEFAULT_MAX_RETRY_DELAY,
                                        ErrorHandlingStrategy.SKIP);
    }

    public static ErrorHandlingOptions stop() {
        return new ErrorHandlingOptions(ErrorHandlingStrategy.STOP,
                                        DEFAULT_MAX_RETRY_ATTEMPTS,
                                        DEFAULT_INITIAL_RETRY_DELAY,
                                        DEFAULT_MAX_RETRY_DELAY,
                                        ErrorHandlingStrategy.STOP);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ErrorHandlingOptions that = (ErrorHandlingOptions) o;
        return maxRetryAttempts == that.maxRetryAttempts &&
                strategy == that.strategy &&
                initialRetryDelay.equals(that.initialRetryDelay) &&
                maxRetryDelay.equals(that.maxRetryDelay) &&
                fallbackStrategy == that.fallbackStrategy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(strategy, maxRetryAttempts, initialRetryDelay, maxRetryDelay, fallbackStrategy);
    }

    @Override
    public String toString() {
        return "ErrorHandlingOptions{" +
                "strategy=" + strategy +
                ", maxRetryAttempts=" + maxRetryAttempts +
                ", initialRetryDelay=" + initialRetryDelay +
                ", maxRetryDelay=" + maxRetryDelay +
                ", fallbackStrategy=" + fallbackStrategy +
                '}';
    }
}
