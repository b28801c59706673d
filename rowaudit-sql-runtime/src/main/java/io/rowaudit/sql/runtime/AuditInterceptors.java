package io.rowaudit.sql.runtime;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.rowaudit.sql.common.ActorContextProvider;
import io.rowaudit.sql.common.AuditSink;
import io.rowaudit.sql.common.config.ConfigBasedProvider;
import io.rowaudit.sql.common.config.ConfigConstants;
import io.rowaudit.sql.interceptor.AuditInterceptor;
import io.rowaudit.sql.interceptor.AuditInterceptorConfig;
import io.rowaudit.sql.interceptor.AuditInterceptorConfigFactory;
import io.rowaudit.sql.interceptor.AuditRecordAssembler;
import io.rowaudit.sql.interceptor.AuditRecorder;
import io.rowaudit.sql.interceptor.MicroMeterAuditRecorder;
import io.rowaudit.sql.interceptor.NOOPAuditRecorder;
import io.rowaudit.sql.interceptor.actor.StaticActorContextProvider;
import io.rowaudit.sql.interceptor.jdbc.AuditingConnectionFactory;
import io.rowaudit.sql.interceptor.metadata.InformationSchemaMetadataSource;
import io.rowaudit.sql.interceptor.metadata.TableMetadataCache;
import io.rowaudit.sql.sink.LoggingAuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

import static io.rowaudit.sql.common.config.ConfigConstants.CONFIG_PATH;

/**
 * Builds a ready to use {@link AuditInterceptor} from the {@code rowaudit} configuration block.
 * Sink and actor provider classes are loaded by name, see {@link ConfigBasedProvider}; without
 * them records go to {@link LoggingAuditSink} on behalf of the system actor.
 */
public final class AuditInterceptors {

    private static final Logger logger = LoggerFactory.getLogger(AuditInterceptors.class);

    private AuditInterceptors() {
    }

    /**
     * Loads {@code application.conf} over the bundled {@code reference.conf}.
     */
    public static AuditInterceptor load() throws Exception {
        return fromConfig(ConfigFactory.load().getConfig(CONFIG_PATH));
    }

    public static AuditInterceptor fromConfig(Config config) throws Exception {
        return fromConfig(config, Metrics.globalRegistry);
    }

    /**
     * @param registry used only when {@code metrics.enabled} is set
     */
    public static AuditInterceptor fromConfig(Config config, MeterRegistry registry) throws Exception {
        AuditInterceptorConfig interceptorConfig = AuditInterceptorConfigFactory.createConfig(config);
        AuditSink sink = ConfigBasedProvider.load(config, ConfigConstants.SINK_PREFIX,
                AuditSink.class, new LoggingAuditSink());
        ActorContextProvider actorContextProvider = ConfigBasedProvider.load(config,
                ConfigConstants.ACTOR_CONTEXT_PROVIDER_PREFIX, ActorContextProvider.class,
                new StaticActorContextProvider());
        AuditRecorder recorder = recorder(config, registry);

        logger.info("Creating audit interceptor with configuration:");
        logger.info("  Capture strategy: {} (fallback to reload: {})",
                interceptorConfig.captureStrategy(), interceptorConfig.fallbackToReload());
        logger.info("  Sink: {}", sink.getClass().getName());
        logger.info("  Actor context provider: {}", actorContextProvider.getClass().getName());

        var metadataCache = new TableMetadataCache(new InformationSchemaMetadataSource(),
                interceptorConfig.metadataExpireAfterWrite(), interceptorConfig.metadataMaximumSize());
        return new AuditInterceptor(interceptorConfig, metadataCache,
                new AuditRecordAssembler(sink, actorContextProvider), recorder);
    }

    /**
     * Opens audited connections to the database named by {@code connection.url}.
     */
    public static AuditingConnectionFactory connectionFactory(Config config) throws Exception {
        return connectionFactory(config, fromConfig(config));
    }

    public static AuditingConnectionFactory connectionFactory(Config config, AuditInterceptor interceptor) {
        if (!config.hasPath(ConfigConstants.CONNECTION_PREFIX)) {
            throw new IllegalArgumentException("No config found : " + ConfigConstants.CONNECTION_PREFIX);
        }
        Config connection = config.getConfig(ConfigConstants.CONNECTION_PREFIX);
        var properties = new Properties();
        if (connection.hasPath(ConfigConstants.USERNAME_KEY)) {
            properties.setProperty("user", connection.getString(ConfigConstants.USERNAME_KEY));
        }
        if (connection.hasPath(ConfigConstants.PASSWORD_KEY)) {
            properties.setProperty("password", connection.getString(ConfigConstants.PASSWORD_KEY));
        }
        return AuditingConnectionFactory.of(connection.getString(ConfigConstants.URL_KEY), properties, interceptor);
    }

    private static AuditRecorder recorder(Config config, MeterRegistry registry) {
        if (!config.hasPath(ConfigConstants.METRICS_PREFIX)) {
            return new NOOPAuditRecorder();
        }
        Config metrics = config.getConfig(ConfigConstants.METRICS_PREFIX);
        if (!metrics.hasPath(ConfigConstants.ENABLED_KEY) || !metrics.getBoolean(ConfigConstants.ENABLED_KEY)) {
            return new NOOPAuditRecorder();
        }
        String instanceId = metrics.hasPath(ConfigConstants.INSTANCE_ID_KEY)
                ? metrics.getString(ConfigConstants.INSTANCE_ID_KEY) : "default";
        return new MicroMeterAuditRecorder(registry, instanceId);
    }
}
