package netops.gateway.scheduler;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential retry delay: {@code base * 2^(retry-1)} capped at {@code max}, plus up to 25% jitter.
 */
public class RetryBackoff {

    static final double MAX_JITTER = 0.25;

    private final Duration base;
    private final Duration max;
    private final DoubleSupplier random;

    public RetryBackoff(Duration base, Duration max) {
        this(base, max, () -> ThreadLocalRandom.current().nextDouble());
    }

    RetryBackoff(Duration base, Duration max, DoubleSupplier random) {
        if (base.isNegative() || max.isNegative()) {
            throw new IllegalArgumentException("Backoff durations must not be negative");
        }
        this.base = base;
        this.max = max.compareTo(base) < 0 ? base : max;
        this.random = random;
    }

    /**
     * Delay before the given retry attempt (1 for the first retry).
     */
    public Duration delayFor(int retry) {
        int exponent = Math.max(0, Math.min(retry - 1, 30));
        long delayMs;
        try {
            delayMs = Math.min(Math.multiplyExact(base.toMillis(), 1L << exponent), max.toMillis());
        } catch (ArithmeticException overflow) {
            delayMs = max.toMillis();
        }
        long jitterMs = (long) (delayMs * MAX_JITTER * random.getAsDouble());
        return Duration.ofMillis(delayMs + jitterMs);
    }

    public Duration base() {
        return base;
    }

    public Duration max() {
        return max;
    }
}
