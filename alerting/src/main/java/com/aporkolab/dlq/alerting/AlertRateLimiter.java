package com.aporkolab.dlq.alerting;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * At most one alert per key within the interval, so a broken consumer does not
 * page once per message.
 */
public class AlertRateLimiter {

    private final Duration minInterval;
    private final Clock clock;
    private final ConcurrentMap<String, AtomicReference<Instant>> lastAlert = new ConcurrentHashMap<>();

    public AlertRateLimiter(Duration minInterval) {
        this(minInterval, Clock.systemUTC());
    }

    public AlertRateLimiter(Duration minInterval, Clock clock) {
        this.minInterval = minInterval;
        this.clock = clock;
    }

    /**
     * @return true if an alert may be sent for {@code key}; the key is then marked as alerted
     */
    public boolean tryAcquire(String key) {
        Instant now = clock.instant();
        AtomicReference<Instant> last = lastAlert.computeIfAbsent(key, k -> new AtomicReference<>());

        while (true) {
            Instant previous = last.get();
            if (previous != null && now.isBefore(previous.plus(minInterval))) {
                return false;
            }
            if (last.compareAndSet(previous, now)) {
                return true;
            }
        }
    }

    public void reset(String key) {
        lastAlert.remove(key);
    }

    public void reset() {
        lastAlert.clear();
    }
}
