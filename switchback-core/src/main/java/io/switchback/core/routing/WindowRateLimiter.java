package io.switchback.core.routing;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fixed window request counter per backend. A backend without a configured limit is never throttled.
 * A reservation is taken before dispatch and returned when the dispatch fails, so only successful
 * dispatches stay counted.
 */
public final class WindowRateLimiter {
    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

    private final Map<String, Integer> limits;
    private final Duration window;
    private final Clock clock;
    private final Map<String, RateWindow> windows = new HashMap<>();

    public WindowRateLimiter(Map<String, Integer> limits, Clock clock) {
        this(limits, DEFAULT_WINDOW, clock);
    }

    public WindowRateLimiter(Map<String, Integer> limits, Duration window, Clock clock) {
        this.limits = Map.copyOf(Objects.requireNonNull(limits, "limits must not be null"));
        this.window = window == null || window.isZero() || window.isNegative() ? DEFAULT_WINDOW : window;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public synchronized boolean check(String backend) {
        Integer limit = limits.get(backend);
        if (limit == null) {
            return true;
        }
        return current(backend).count < limit;
    }

    /**
     * Checks and reserves one request in the current window under a single lock. Returns false
     * when the backend is over its limit. Unlimited backends are always granted without counting.
     */
    public synchronized boolean tryAcquire(String backend) {
        Integer limit = limits.get(backend);
        if (limit == null) {
            return true;
        }
        RateWindow rateWindow = current(backend);
        if (rateWindow.count >= limit) {
            return false;
        }
        rateWindow.count++;
        return true;
    }

    /**
     * Returns a reservation taken by {@link #tryAcquire} whose dispatch failed.
     */
    public synchronized void release(String backend) {
        RateWindow rateWindow = windows.get(backend);
        if (rateWindow != null && rateWindow.count > 0) {
            rateWindow.count--;
        }
    }

    public synchronized int count(String backend) {
        RateWindow rateWindow = windows.get(backend);
        return rateWindow == null ? 0 : rateWindow.count;
    }

    private RateWindow current(String backend) {
        Instant now = clock.instant();
        RateWindow rateWindow = windows.get(backend);
        if (rateWindow == null) {
            rateWindow = new RateWindow(now);
            windows.put(backend, rateWindow);
        } else if (Duration.between(rateWindow.start, now).compareTo(window) > 0) {
            rateWindow.start = now;
            rateWindow.count = 0;
        }
        return rateWindow;
    }

    private static final class RateWindow {
        private Instant start;
        private int count;

        private RateWindow(Instant start) {
            this.start = start;
        }
    }
}
