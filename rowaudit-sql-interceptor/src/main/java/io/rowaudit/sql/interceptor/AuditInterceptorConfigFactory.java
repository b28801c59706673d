package io.rowaudit.sql.interceptor;

import com.typesafe.config.Config;
import io.rowaudit.sql.common.config.ConfigConstants;
import io.rowaudit.sql.common.model.CaptureMode;

import java.time.Duration;
import java.util.Locale;

/**
 * Reads an {@link AuditInterceptorConfig} from the {@code rowaudit} block:
 * <pre>{@code
 * rowaudit {
 *   capture_strategy = "rewrite"   # or "reload"
 *   fallback_to_reload = true
 *   auto_generated_columns = [id, createdat, createddate, timestamp, rowversion, modifiedat, modifieddate]
 *   metadata_cache {
 *     expire_after_write_ms = 0
 *     maximum_size = 10000
 *   }
 * }
 * }</pre>
 * Missing keys keep the builder defaults.
 */
public final class AuditInterceptorConfigFactory {

    private AuditInterceptorConfigFactory() {}

    public static AuditInterceptorConfig createConfig(Config config) {
        var builder = AuditInterceptorConfig.builder();
        if (config.hasPath(ConfigConstants.CAPTURE_STRATEGY_KEY)) {
            builder.captureStrategy(captureMode(config.getString(ConfigConstants.CAPTURE_STRATEGY_KEY)));
        }
        if (config.hasPath(ConfigConstants.FALLBACK_TO_RELOAD_KEY)) {
            builder.fallbackToReload(config.getBoolean(ConfigConstants.FALLBACK_TO_RELOAD_KEY));
        }
        if (config.hasPath(ConfigConstants.AUTO_GENERATED_COLUMNS_KEY)) {
            builder.autoGeneratedColumns(config.getStringList(ConfigConstants.AUTO_GENERATED_COLUMNS_KEY));
        }
        if (config.hasPath(ConfigConstants.METADATA_CACHE_PREFIX)) {
            Config cache = config.getConfig(ConfigConstants.METADATA_CACHE_PREFIX);
            if (cache.hasPath(ConfigConstants.EXPIRE_AFTER_WRITE_MS_KEY)) {
                builder.metadataExpireAfterWrite(Duration.ofMillis(cache.getLong(ConfigConstants.EXPIRE_AFTER_WRITE_MS_KEY)));
            }
            if (cache.hasPath(ConfigConstants.MAXIMUM_SIZE_KEY)) {
                builder.metadataMaximumSize(cache.getLong(ConfigConstants.MAXIMUM_SIZE_KEY));
            }
        }
        return builder.build();
    }

    static CaptureMode captureMode(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "rewrite", "query_rewrite" -> CaptureMode.REWRITE;
            case "reload", "select_reload" -> CaptureMode.RELOAD;
            default -> throw new IllegalArgumentException("Unknown capture strategy: " + value);
        };
    }
}
