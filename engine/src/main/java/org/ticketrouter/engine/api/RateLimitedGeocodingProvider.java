package org.ticketrouter.engine.api;

import org.ticketrouter.engine.domain.model.GeoPoint;

import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * Enforces a minimum delay between successive provider calls by sleeping.
 * Calls are serialized on this instance's own monitor and nothing else.
 */
public final class RateLimitedGeocodingProvider implements GeocodingProvider {

    private static final Logger LOG = Logger.getLogger(RateLimitedGeocodingProvider.class.getName());

    /**
     * Blocking pause, replaceable in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final GeocodingProvider delegate;
    private final long minIntervalNanos;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;

    private long lastCallEndNanos;
    private boolean called;

    public RateLimitedGeocodingProvider(GeocodingProvider delegate, long minIntervalMillis) {
        this(delegate, minIntervalMillis, System::nanoTime, Thread::sleep);
    }

    public RateLimitedGeocodingProvider(GeocodingProvider delegate, long minIntervalMillis,
                                        LongSupplier nanoClock, Sleeper sleeper) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        if (minIntervalMillis < 0) {
            throw new IllegalArgumentException("minIntervalMillis must not be negative");
        }
        this.minIntervalNanos = minIntervalMillis * 1_000_000L;
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    @Override
    public synchronized Optional<GeoPoint> query(String query) throws GeocodingException {
        if (called) {
            long elapsed = nanoClock.getAsLong() - lastCallEndNanos;
            long waitNanos = minIntervalNanos - elapsed;
            if (waitNanos > 0) {
                long waitMillis = (waitNanos + 999_999L) / 1_000_000L;
                LOG.finest(() -> "[Geo] Rate limit: waiting " + waitMillis + "ms");
                try {
                    sleeper.sleep(waitMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new GeocodingException("Interrupted while waiting for rate limit", e);
                }
            }
        }
        try {
            return delegate.query(query);
        } finally {
            lastCallEndNanos = nanoClock.getAsLong();
            called = true;
        }
    }
}
