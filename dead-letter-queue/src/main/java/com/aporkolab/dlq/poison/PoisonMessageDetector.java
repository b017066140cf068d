package com.aporkolab.dlq.poison;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects messages that fail the same way every time they are delivered.
 *
 * Failures are counted per (SHA-256 of the body, exception type). Once a key
 * reaches the threshold the message is poison and should skip its remaining
 * retry budget.
 *
 * Memory is bounded: the store is an access-ordered LRU that evicts the least
 * recently seen key when {@code maxEntries} is exceeded.
 *
 * Thread-safe: check-and-increment is a single critical section.
 * State is per process and lost on restart.
 */
public class PoisonMessageDetector {

    private static final Logger log = LoggerFactory.getLogger(PoisonMessageDetector.class);

    public static final int DEFAULT_THRESHOLD = 3;
    public static final int DEFAULT_MAX_ENTRIES = 10_000;

    private final int threshold;
    private final int maxEntries;
    private final Clock clock;
    private final Map<Key, Entry> entries;
    private long evictions;

    public PoisonMessageDetector() {
        this(DEFAULT_THRESHOLD, DEFAULT_MAX_ENTRIES);
    }

    public PoisonMessageDetector(int threshold, int maxEntries) {
        this(threshold, maxEntries, Clock.systemUTC());
    }

    public PoisonMessageDetector(int threshold, int maxEntries, Clock clock) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1");
        }
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1");
        }
        this.threshold = threshold;
        this.maxEntries = maxEntries;
        this.clock = clock;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Key, Entry> eldest) {
                if (size() > PoisonMessageDetector.this.maxEntries) {
                    evictions++;
                    return true;
                }
                return false;
            }
        };
    }

    /**
     * Records one failure of {@code body} with {@code error}.
     *
     * @return true once this body/error combination has failed {@code threshold} times
     */
    public boolean checkAndRecord(byte[] body, Throwable error) {
        Key key = new Key(hash(body), errorSignature(error));
        int count;
        synchronized (entries) {
            Entry entry = entries.get(key);
            if (entry == null) {
                entry = new Entry();
                entries.put(key, entry);
            }
            entry.count++;
            entry.lastSeen = clock.instant();
            count = entry.count;
        }

        if (count >= threshold) {
            log.warn("Poison message detected: {} failures with {} (threshold {})",
                    count, key.errorSignature(), threshold);
            return true;
        }
        log.debug("Recorded failure {}/{} for {}", count, threshold, key.errorSignature());
        return false;
    }

    /**
     * Current failure count for a body/error combination without recording anything.
     */
    public int getFailureCount(byte[] body, Throwable error) {
        Key key = new Key(hash(body), errorSignature(error));
        synchronized (entries) {
            Entry entry = entries.get(key);
            return entry == null ? 0 : entry.count;
        }
    }

    public Optional<Instant> getLastSeen(byte[] body, Throwable error) {
        Key key = new Key(hash(body), errorSignature(error));
        synchronized (entries) {
            Entry entry = entries.get(key);
            return entry == null ? Optional.empty() : Optional.of(entry.lastSeen);
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public long getEvictionCount() {
        synchronized (entries) {
            return evictions;
        }
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }

    public int getThreshold() {
        return threshold;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    static String hash(byte[] body) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(body == null ? new byte[0] : body));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String errorSignature(Throwable error) {
        return error == null ? "unknown" : error.getClass().getName();
    }

    /**
     * Convenience for text payloads.
     */
    public boolean checkAndRecord(String body, Throwable error) {
        return checkAndRecord(Objects.requireNonNullElse(body, "").getBytes(StandardCharsets.UTF_8), error);
    }

    private record Key(String contentHash, String errorSignature) {
    }

    private static final class Entry {
        private int count;
        private Instant lastSeen;
    }
}
