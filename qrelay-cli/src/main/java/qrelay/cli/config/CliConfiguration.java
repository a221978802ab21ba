package qrelay.cli.config;

import io.github.cdimascio.dotenv.Dotenv;
import qrelay.config.BrokerConfig;
import qrelay.core.exceptions.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * Broker settings for the command line, read from a {@code .env} file or the
 * environment. Unset keys keep the broker defaults.
 */
public class CliConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(CliConfiguration.class);
    private static CliConfiguration instance;
    private final Dotenv dotenv;

    private CliConfiguration() {
        this(Dotenv.configure()
                .ignoreIfMissing()
                .load());
        logger.info("Configuration loaded successfully");
    }

    public CliConfiguration(Dotenv dotenv) {
        this.dotenv = dotenv;
    }

    public static synchronized CliConfiguration getInstance() {
        if (instance == null) {
            instance = new CliConfiguration();
        }
        return instance;
    }

    private String get(String key, String defaultValue) {
        String value = dotenv.get(key);
        return value != null ? value : defaultValue;
    }

    private int getInt(String key, int defaultValue) {
        String value = dotenv.get(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    // Store configuration
    public String getStoreType() {
        return get("QRELAY_STORE_TYPE", "memory");
    }

    public String getStorePath() {
        return get("QRELAY_STORE_PATH", BrokerConfig.DEFAULT_DB_PATH);
    }

    public int getStoreCacheSize() {
        return getInt("QRELAY_STORE_CACHE_SIZE", BrokerConfig.DEFAULT_SQLITE_CACHE_SIZE);
    }

    // Retry configuration
    public String getBackoffType() {
        return get("QRELAY_BACKOFF_TYPE", "linear");
    }

    public String getBackoffStepMillis() {
        return get("QRELAY_BACKOFF_STEP_MILLIS", String.valueOf(BrokerConfig.DEFAULT_BACKOFF_STEP.toMillis()));
    }

    public String getBackoffMaxMillis() {
        return get("QRELAY_BACKOFF_MAX_MILLIS", String.valueOf(BrokerConfig.DEFAULT_BACKOFF_MAX.toMillis()));
    }

    // Delivery configuration
    public String getDedupWindowSeconds() {
        return get("QRELAY_DEDUP_WINDOW_SECONDS", String.valueOf(BrokerConfig.DEFAULT_DEDUP_WINDOW.toSeconds()));
    }

    public String getSweepIntervalMillis() {
        return get("QRELAY_SWEEP_INTERVAL_MILLIS", "0");
    }

    public BrokerConfig toBrokerConfig() throws ValidationException {
        Properties properties = new Properties();
        properties.setProperty("qrelay.store.type", getStoreType());
        properties.setProperty("qrelay.store.path", getStorePath());
        properties.setProperty("qrelay.store.cache-size", String.valueOf(getStoreCacheSize()));
        properties.setProperty("qrelay.backoff.type", getBackoffType());
        properties.setProperty("qrelay.backoff.step-millis", getBackoffStepMillis());
        properties.setProperty("qrelay.backoff.max-millis", getBackoffMaxMillis());
        properties.setProperty("qrelay.dedup.window-seconds", getDedupWindowSeconds());
        properties.setProperty("qrelay.sweep.interval-millis", getSweepIntervalMillis());
        return BrokerConfig.fromProperties(properties);
    }
}
