package com.opsdash.infrastructure.config;

import com.opsdash.pagination.exec.EdgeCursorPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Pagination pagination = new Pagination();
    private Export export = new Export();

    public Pagination getPagination() {
        return pagination;
    }

    public void setPagination(Pagination pagination) {
        this.pagination = pagination;
    }

    public Export getExport() {
        return export;
    }

    public void setExport(Export export) {
        this.export = export;
    }

    public static class Pagination {
        private String cursorSecret;
        private Duration cursorTtl = Duration.ofHours(24);
        private int defaultLimit = 20;
        private int maxLimit = 100;
        private EdgeCursorPolicy edgeCursorPolicy = EdgeCursorPolicy.PASS_THROUGH;

        public String getCursorSecret() {
            return cursorSecret;
        }

        public void setCursorSecret(String cursorSecret) {
            this.cursorSecret = cursorSecret;
        }

        public Duration getCursorTtl() {
            return cursorTtl;
        }

        public void setCursorTtl(Duration cursorTtl) {
            this.cursorTtl = cursorTtl;
        }

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }

        public EdgeCursorPolicy getEdgeCursorPolicy() {
            return edgeCursorPolicy;
        }

        public void setEdgeCursorPolicy(EdgeCursorPolicy edgeCursorPolicy) {
            this.edgeCursorPolicy = edgeCursorPolicy;
        }
    }

    public static class Export {
        private int batchSize = 100;

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }
}
