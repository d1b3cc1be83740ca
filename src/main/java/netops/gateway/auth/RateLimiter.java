package netops.gateway.auth;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sliding-window request limiter keyed by client (IP address).
 * Each key keeps the timestamps of its requests inside the current window.
 */
public class RateLimiter {

    private static final long SWEEP_EVERY = 1024;

    private final int maxRequests;
    private final long windowMs;
    private final Clock clock;
    private final long sweepEvery;

    // a key's window is only touched inside compute/computeIfPresent, which lock that key
    private final Map<String, Deque<Long>> windows = new ConcurrentHashMap<>();
    private final AtomicLong calls = new AtomicLong();

    public RateLimiter(int maxRequests, Duration window, Clock clock) {
        this(maxRequests, window, clock, SWEEP_EVERY);
    }

    RateLimiter(int maxRequests, Duration window, Clock clock, long sweepEvery) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be at least 1");
        }
        this.maxRequests = maxRequests;
        this.windowMs = window.toMillis();
        this.clock = clock;
        this.sweepEvery = sweepEvery;
    }

    public record Decision(boolean allowed, int remaining, long retryAfterSeconds) {
    }

    public Decision tryAcquire(String key) {
        long now = clock.millis();
        if (calls.incrementAndGet() % sweepEvery == 0) {
            sweep(now);
        }
        Decision[] decision = new Decision[1];
        windows.compute(key, (k, existing) -> {
            Deque<Long> hits = existing != null ? existing : new ArrayDeque<>();
            evict(hits, now);
            if (hits.size() >= maxRequests) {
                long retryAfterMs = hits.peekFirst() + windowMs - now;
                decision[0] = new Decision(false, 0, Math.max(1, (retryAfterMs + 999) / 1000));
            } else {
                hits.addLast(now);
                decision[0] = new Decision(true, maxRequests - hits.size(), 0);
            }
            return hits;
        });
        return decision[0];
    }

    public int maxRequests() {
        return maxRequests;
    }

    int trackedKeys() {
        return windows.size();
    }

    private void evict(Deque<Long> hits, long now) {
        while (!hits.isEmpty() && hits.peekFirst() <= now - windowMs) {
            hits.pollFirst();
        }
    }

    // Drop keys whose whole window has expired
    private void sweep(long now) {
        for (String key : windows.keySet()) {
            windows.computeIfPresent(key, (k, hits) -> {
                evict(hits, now);
                return hits.isEmpty() ? null : hits;
            });
        }
    }
}
