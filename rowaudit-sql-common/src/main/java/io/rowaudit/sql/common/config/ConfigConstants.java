package io.rowaudit.sql.common.config;

public class ConfigConstants {

    public static final String CONFIG_PATH = "rowaudit";

    // Capture configuration keys
    public static final String CAPTURE_STRATEGY_KEY = "capture_strategy";
    public static final String FALLBACK_TO_RELOAD_KEY = "fallback_to_reload";
    public static final String AUTO_GENERATED_COLUMNS_KEY = "auto_generated_columns";

    // Metadata cache keys
    public static final String METADATA_CACHE_PREFIX = "metadata_cache";
    public static final String EXPIRE_AFTER_WRITE_MS_KEY = "expire_after_write_ms";
    public static final String MAXIMUM_SIZE_KEY = "maximum_size";

    // Pluggable collaborators, loaded through ConfigBasedProvider
    public static final String SINK_PREFIX = "sink";
    public static final String ACTOR_CONTEXT_PROVIDER_PREFIX = "actor_context_provider";

    // Connection keys
    public static final String CONNECTION_PREFIX = "connection";
    public static final String URL_KEY = "url";
    public static final String USERNAME_KEY = "username";
    public static final String PASSWORD_KEY = "password";

    // JDBC sink keys
    public static final String TABLE_NAME_KEY = "table_name";
    public static final String TEXT_TYPE_KEY = "text_type";
    public static final String TIMESTAMP_TYPE_KEY = "timestamp_type";

    // Fan-out and filtering sinks
    public static final String SINKS_KEY = "sinks";
    public static final String DELEGATE_PREFIX = "delegate";

    // Table filter keys
    public static final String INCLUDE_TABLES_KEY = "include_tables";
    public static final String EXCLUDE_TABLES_KEY = "exclude_tables";

    // Static actor keys
    public static final String ACTOR_ID_KEY = "actor_id";
    public static final String DISPLAY_NAME_KEY = "display_name";
    public static final String NETWORK_ADDRESS_KEY = "network_address";
    public static final String AGENT_KEY = "agent";

    // Metrics
    public static final String METRICS_PREFIX = "metrics";
    public static final String ENABLED_KEY = "enabled";
    public static final String INSTANCE_ID_KEY = "instance_id";

    private ConfigConstants() {
    }
}
