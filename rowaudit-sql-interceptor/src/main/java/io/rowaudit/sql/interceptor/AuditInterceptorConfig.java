package io.rowaudit.sql.interceptor;

import io.rowaudit.sql.common.model.CaptureMode;
import io.rowaudit.sql.interceptor.capture.AutoGeneratedColumns;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Settings of an {@link AuditInterceptor}.
 *
 * @param fallbackToReload         run select-reload when the rewrite does not apply; otherwise the
 *                                 statement runs unaudited
 * @param metadataExpireAfterWrite zero keeps cached column lists until invalidated
 */
public record AuditInterceptorConfig(
        CaptureMode captureStrategy,
        boolean fallbackToReload,
        List<String> autoGeneratedColumns,
        Duration metadataExpireAfterWrite,
        long metadataMaximumSize
) {
    public AuditInterceptorConfig {
        Objects.requireNonNull(captureStrategy, "captureStrategy must not be null");
        Objects.requireNonNull(metadataExpireAfterWrite, "metadataExpireAfterWrite must not be null");
        autoGeneratedColumns = List.copyOf(autoGeneratedColumns);
    }

    public static AuditInterceptorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private CaptureMode captureStrategy = CaptureMode.REWRITE;
        private boolean fallbackToReload = true;
        private List<String> autoGeneratedColumns = AutoGeneratedColumns.DEFAULT_NAMES;
        private Duration metadataExpireAfterWrite = Duration.ZERO;
        private long metadataMaximumSize = 10_000;

        private Builder() {
        }

        public Builder captureStrategy(CaptureMode captureStrategy) {
            this.captureStrategy = Objects.requireNonNull(captureStrategy);
            return this;
        }

        public Builder fallbackToReload(boolean fallbackToReload) {
            this.fallbackToReload = fallbackToReload;
            return this;
        }

        public Builder autoGeneratedColumns(List<String> autoGeneratedColumns) {
            this.autoGeneratedColumns = Objects.requireNonNull(autoGeneratedColumns);
            return this;
        }

        public Builder metadataExpireAfterWrite(Duration metadataExpireAfterWrite) {
            if (metadataExpireAfterWrite.isNegative()) throw new IllegalArgumentException("metadataExpireAfterWrite must not be negative");
            this.metadataExpireAfterWrite = metadataExpireAfterWrite;
            return this;
        }

        public Builder metadataMaximumSize(long metadataMaximumSize) {
            if (metadataMaximumSize <= 0) throw new IllegalArgumentException("metadataMaximumSize must be positive");
            this.metadataMaximumSize = metadataMaximumSize;
            return this;
        }

        public AuditInterceptorConfig build() {
            return new AuditInterceptorConfig(
                    captureStrategy,
                    fallbackToReload,
                    autoGeneratedColumns,
                    metadataExpireAfterWrite,
                    metadataMaximumSize
            );
        }
    }
}
