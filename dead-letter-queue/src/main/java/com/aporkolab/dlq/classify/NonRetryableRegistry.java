package com.aporkolab.dlq.classify;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.dlq.config.DlqConfig;

/**
 * Registry of exception types that must never be retried.
 *
 * Entries are matched against both the simple and the fully qualified class name.
 * The default entries are frozen at construction; custom entries can be added and
 * removed at runtime from any thread.
 *
 * Thread-safe: defaults are an immutable set, custom entries a concurrent set,
 * so lookups never block.
 */
public class NonRetryableRegistry implements ErrorClassifier {

    private static final Logger log = LoggerFactory.getLogger(NonRetryableRegistry.class);

    private final Set<String> defaults;
    private final Set<String> custom = ConcurrentHashMap.newKeySet();

    public NonRetryableRegistry() {
        this(DlqConfig.DEFAULT_NON_RETRYABLE_EXCEPTIONS);
    }

    public NonRetryableRegistry(Collection<String> defaults) {
        this.defaults = Set.copyOf(defaults);
    }

    @Override
    public ErrorClass classify(Throwable error) {
        return isNonRetryable(error) ? ErrorClass.NON_RETRYABLE : ErrorClass.RETRYABLE;
    }

    @Override
    public boolean isNonRetryable(Throwable error) {
        if (error == null) {
            return false;
        }
        if (error instanceof NonRetryableMessageException) {
            return true;
        }
        return isNonRetryable(error.getClass().getSimpleName())
                || isNonRetryable(error.getClass().getName());
    }

    public boolean isNonRetryable(String typeName) {
        return defaults.contains(typeName) || custom.contains(typeName);
    }

    public void register(String... typeNames) {
        for (String typeName : typeNames) {
            if (custom.add(typeName)) {
                log.info("Registered non-retryable exception type {}", typeName);
            }
        }
    }

    @SafeVarargs
    public final void register(Class<? extends Throwable>... types) {
        for (Class<? extends Throwable> type : types) {
            register(type.getName());
        }
    }

    /**
     * Removes custom entries. Default entries cannot be removed.
     */
    public void unregister(String... typeNames) {
        for (String typeName : typeNames) {
            if (defaults.contains(typeName)) {
                log.warn("Cannot unregister default non-retryable exception type {}", typeName);
                continue;
            }
            if (custom.remove(typeName)) {
                log.info("Unregistered non-retryable exception type {}", typeName);
            }
        }
    }

    @SafeVarargs
    public final void unregister(Class<? extends Throwable>... types) {
        for (Class<? extends Throwable> type : types) {
            unregister(type.getName());
        }
    }

    public Set<String> getDefaults() {
        return defaults;
    }

    public Set<String> getCustom() {
        return Set.copyOf(custom);
    }
}
