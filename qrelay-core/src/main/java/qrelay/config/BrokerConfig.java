package qrelay.config;

import qrelay.core.events.LifecycleListener;
import qrelay.core.events.LoggingLifecycleListener;
import qrelay.core.exceptions.ValidationException;
import qrelay.core.retry.BackoffPolicy;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 * Engine-wide settings: which message store to use, retry backoff, deduplication window
 * and background sweeping.
 *
 * @param storeType message store implementation
 * @param dbPath SQLite database file, {@code :memory:} for a private in-memory database
 * @param sqliteCacheSize value for {@code PRAGMA cache_size}
 * @param backoffPolicy delay before a rejected message is visible again
 * @param dedupWindow how long a dedup id suppresses repeated sends
 * @param sweepInterval period of the background visibility sweep, zero disables it
 * @param clock time source for visibility, expiry and backoff
 * @param listener sink for lifecycle events
 */
public record BrokerConfig(StoreType storeType, String dbPath, int sqliteCacheSize, BackoffPolicy backoffPolicy,
                           Duration dedupWindow, Duration sweepInterval, Clock clock, LifecycleListener listener) {

    public static final String DEFAULT_DB_PATH = ":memory:";
    public static final int DEFAULT_SQLITE_CACHE_SIZE = 256000;
    public static final Duration DEFAULT_BACKOFF_STEP = Duration.ofSeconds(5);
    public static final Duration DEFAULT_BACKOFF_MAX = Duration.ofMinutes(15);
    public static final Duration DEFAULT_DEDUP_WINDOW = Duration.ofMinutes(5);

    public enum StoreType {
        MEMORY,
        SQLITE;

        public static StoreType fromValue(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public static BrokerConfig defaults() {
        return new Builder().build();
    }

    /**
     * Reads {@code qrelay.*} keys; anything missing falls back to the builder defaults.
     * <ul>
     *   <li>{@code qrelay.store.type} - memory or sqlite</li>
     *   <li>{@code qrelay.store.path}, {@code qrelay.store.cache-size}</li>
     *   <li>{@code qrelay.backoff.type} - none, linear or exponential</li>
     *   <li>{@code qrelay.backoff.step-millis}, {@code qrelay.backoff.max-millis}</li>
     *   <li>{@code qrelay.dedup.window-seconds}</li>
     *   <li>{@code qrelay.sweep.interval-millis}</li>
     * </ul>
     */
    public static BrokerConfig fromProperties(Properties properties) throws ValidationException {
        Builder builder = new Builder();
        try {
            String storeType = properties.getProperty("qrelay.store.type");
            if (storeType != null) {
                builder.StoreType(StoreType.fromValue(storeType));
            }
            builder.DbPath(properties.getProperty("qrelay.store.path"));
            builder.SqliteCacheSize(intProperty(properties, "qrelay.store.cache-size"));

            String backoffType = properties.getProperty("qrelay.backoff.type");
            if (backoffType != null) {
                Long step = longProperty(properties, "qrelay.backoff.step-millis");
                Long max = longProperty(properties, "qrelay.backoff.max-millis");
                builder.BackoffPolicy(BackoffPolicy.named(backoffType,
                        step != null ? Duration.ofMillis(step) : DEFAULT_BACKOFF_STEP,
                        max != null ? Duration.ofMillis(max) : DEFAULT_BACKOFF_MAX));
            }

            Long dedupSeconds = longProperty(properties, "qrelay.dedup.window-seconds");
            if (dedupSeconds != null) {
                builder.DedupWindow(Duration.ofSeconds(dedupSeconds));
            }
            Long sweepMillis = longProperty(properties, "qrelay.sweep.interval-millis");
            if (sweepMillis != null) {
                builder.SweepInterval(Duration.ofMillis(sweepMillis));
            }
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid broker configuration: " + e.getMessage());
        }
        BrokerConfig config = builder.build();
        config.validate();
        return config;
    }

    public void validate() throws ValidationException {
        if (sqliteCacheSize <= 0) {
            throw new ValidationException("sqlite cache size must be positive: " + sqliteCacheSize, "sqliteCacheSize");
        }
        if (dedupWindow.isNegative()) {
            throw new ValidationException("dedup window must not be negative: " + dedupWindow, "dedupWindow");
        }
        if (sweepInterval.isNegative()) {
            throw new ValidationException("sweep interval must not be negative: " + sweepInterval, "sweepInterval");
        }
    }

    private static Integer intProperty(Properties properties, String key) {
        String value = properties.getProperty(key);
        return value != null ? Integer.valueOf(value.trim()) : null;
    }

    private static Long longProperty(Properties properties, String key) {
        String value = properties.getProperty(key);
        return value != null ? Long.valueOf(value.trim()) : null;
    }

    public static class Builder {
        private StoreType storeType;
        private String dbPath;
        private Integer sqliteCacheSize;
        private BackoffPolicy backoffPolicy;
        private Duration dedupWindow;
        private Duration sweepInterval;
        private Clock clock;
        private LifecycleListener listener;

        public Builder StoreType(StoreType storeType) {
            this.storeType = storeType;
            return this;
        }

        public Builder DbPath(String dbPath) {
            this.dbPath = dbPath;
            return this;
        }

        public Builder SqliteCacheSize(Integer sqliteCacheSize) {
            this.sqliteCacheSize = sqliteCacheSize;
            return this;
        }

        public Builder BackoffPolicy(BackoffPolicy backoffPolicy) {
            this.backoffPolicy = backoffPolicy;
            return this;
        }

        public Builder DedupWindow(Duration dedupWindow) {
            this.dedupWindow = dedupWindow;
            return this;
        }

        public Builder SweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
            return this;
        }

        public Builder Clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder Listener(LifecycleListener listener) {
            this.listener = listener;
            return this;
        }

        public BrokerConfig build() {
            return new BrokerConfig(
                    storeType != null ? storeType : StoreType.MEMORY,
                    dbPath != null ? dbPath : DEFAULT_DB_PATH,
                    sqliteCacheSize != null ? sqliteCacheSize : DEFAULT_SQLITE_CACHE_SIZE,
                    backoffPolicy != null ? backoffPolicy : qrelay.core.retry.BackoffPolicy.linear(DEFAULT_BACKOFF_STEP),
                    dedupWindow != null ? dedupWindow : DEFAULT_DEDUP_WINDOW,
                    sweepInterval != null ? sweepInterval : Duration.ZERO,
                    clock != null ? clock : java.time.Clock.systemUTC(),
                    listener != null ? listener : new LoggingLifecycleListener());
        }
    }
}
