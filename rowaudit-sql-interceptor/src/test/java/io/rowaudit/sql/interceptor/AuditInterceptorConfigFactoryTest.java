package io.rowaudit.sql.interceptor;

import com.typesafe.config.ConfigFactory;
import io.rowaudit.sql.common.model.CaptureMode;
import io.rowaudit.sql.interceptor.capture.AutoGeneratedColumns;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AuditInterceptorConfigFactoryTest {

    @Test
    public void testEmptyConfigKeepsDefaults() {
        var config = AuditInterceptorConfigFactory.createConfig(ConfigFactory.empty());

        assertEquals(CaptureMode.REWRITE, config.captureStrategy());
        assertTrue(config.fallbackToReload());
        assertEquals(AutoGeneratedColumns.DEFAULT_NAMES, config.autoGeneratedColumns());
        assertEquals(Duration.ZERO, config.metadataExpireAfterWrite());
        assertEquals(10_000, config.metadataMaximumSize());
    }

    @Test
    public void testAllKeys() {
        var config = AuditInterceptorConfigFactory.createConfig(ConfigFactory.parseString("""
                capture_strategy = reload
                fallback_to_reload = false
                auto_generated_columns = [id, seq]
                metadata_cache {
                  expire_after_write_ms = 60000
                  maximum_size = 50
                }
                """));

        assertEquals(CaptureMode.RELOAD, config.captureStrategy());
        assertFalse(config.fallbackToReload());
        assertEquals(List.of("id", "seq"), config.autoGeneratedColumns());
        assertEquals(Duration.ofMinutes(1), config.metadataExpireAfterWrite());
        assertEquals(50, config.metadataMaximumSize());
    }

    @Test
    public void testInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> AuditInterceptorConfigFactory.createConfig(
                ConfigFactory.parseString("capture_strategy = trigger")));
        assertThrows(IllegalArgumentException.class, () -> AuditInterceptorConfig.builder().metadataMaximumSize(0));
    }
}
