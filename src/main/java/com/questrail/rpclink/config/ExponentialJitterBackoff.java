package com.questrail.rpclink.config;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with multiplicative jitter:
 * {@code base * 2^counter * uniform(0.5, 1.0)}.
 *
 * <p>With the default base of 100ms and a counter capped at 8 the longest delay
 * is just under 25.6 seconds.</p>
 */
public final class ExponentialJitterBackoff implements ReconnectBackoff
{
    static final ExponentialJitterBackoff DEFAULT = new ExponentialJitterBackoff(
            Duration.ofMillis(100),
            () -> ThreadLocalRandom.current().nextDouble());

    // keeps the delay representable as Duration millis
    private static final int MAX_EXPONENT = 30;

    private final Duration base;
    private final DoubleSupplier random;

    /**
     * @param base   delay for counter {@code 0} before jitter
     * @param random source of values in {@code [0, 1)}
     */
    public ExponentialJitterBackoff(Duration base, DoubleSupplier random)
    {
        this.base = Objects.requireNonNull(base, "base");
        this.random = Objects.requireNonNull(random, "random");
        if (base.isNegative()) {
            throw new IllegalArgumentException("base must be non-negative");
        }
    }

    @Override
    public Duration delayFor(int counter)
    {
        if (counter < 0) {
            throw new IllegalArgumentException("counter must be >= 0");
        }
        double factor = 0.5 + random.getAsDouble() * 0.5;
        double millis = base.toMillis() * Math.pow(2, Math.min(counter, MAX_EXPONENT)) * factor;
        return Duration.ofMillis(Math.round(millis));
    }
}
