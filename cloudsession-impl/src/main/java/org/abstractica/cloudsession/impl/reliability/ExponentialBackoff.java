package org.abstractica.cloudsession.impl.reliability;

import org.abstractica.cloudsession.ReconnectPolicy;

import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Reconnect policy with exponential backoff and full jitter.
 *
 * <p>The delay for attempt count {@code n} is drawn uniformly from
 * {@code [0, (2^min(n, maxExponent) - 1) * baseDelayMs)}. With the defaults
 * the ceiling grows 1s, 3s, 7s, 15s and stays at 31s from the fifth
 * attempt on.</p>
 */
public class ExponentialBackoff implements ReconnectPolicy
{
    /**
     * Default unit of the backoff ceiling in milliseconds.
     */
    public static final long DEFAULT_BASE_DELAY_MS = 1000;

    /**
     * Default attempt count at which the ceiling stops growing.
     */
    public static final int DEFAULT_MAX_EXPONENT = 5;

    /**
     * Retry limit meaning "never give up".
     */
    public static final int UNLIMITED = 0;

    private final long baseDelayMs;
    private final int maxExponent;
    private final int maxAttempts;
    private final DoubleSupplier random;

    /**
     * Creates the default policy: 1s base, ceiling capped at 2^5, no retry limit.
     */
    public ExponentialBackoff()
    {
        this(DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_EXPONENT, UNLIMITED, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Creates a policy with explicit parameters.
     *
     * @param baseDelayMs unit of the backoff ceiling in milliseconds
     * @param maxExponent attempt count at which the ceiling stops growing
     * @param maxAttempts give up once the attempt count reaches this, or {@link #UNLIMITED}
     * @param random      source of jitter in {@code [0, 1)}
     */
    public ExponentialBackoff(long baseDelayMs, int maxExponent, int maxAttempts, DoubleSupplier random)
    {
        if (baseDelayMs <= 0)
        {
            throw new IllegalArgumentException("baseDelayMs must be positive: " + baseDelayMs);
        }
        if (maxExponent < 0 || maxExponent > 30)
        {
            throw new IllegalArgumentException("maxExponent must be 0-30: " + maxExponent);
        }
        if (maxAttempts < 0)
        {
            throw new IllegalArgumentException("maxAttempts must not be negative: " + maxAttempts);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxExponent = maxExponent;
        this.maxAttempts = maxAttempts;
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public OptionalLong nextDelayMs(int attempts)
    {
        if (attempts < 0)
        {
            throw new IllegalArgumentException("Attempts must be non-negative: " + attempts);
        }
        if (maxAttempts != UNLIMITED && attempts >= maxAttempts)
        {
            return OptionalLong.empty();
        }

        long ceiling = calculateCeilingMs(attempts);
        double jitter = Math.min(Math.max(random.getAsDouble(), 0.0), Math.nextDown(1.0));
        return OptionalLong.of((long) (jitter * ceiling));
    }

    /**
     * Returns the exclusive upper bound of the delay for an attempt count.
     *
     * @param attempts the attempt count
     * @return ceiling in milliseconds
     */
    public long calculateCeilingMs(int attempts)
    {
        int exponent = Math.min(attempts, maxExponent);
        return ((1L << exponent) - 1) * baseDelayMs;
    }
}
