package com.opsdash.infrastructure.config;

import com.opsdash.pagination.PaginationConfigurationException;
import com.opsdash.pagination.PaginatorFactory;
import com.opsdash.pagination.cursor.CodecConfig;
import com.opsdash.pagination.cursor.CursorCodec;
import com.opsdash.pagination.params.PaginationLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the pagination engine from {@code app.pagination.*}. Invalid values fail startup.
 */
@Configuration
public class PaginationConfig {

    private static final Logger log = LoggerFactory.getLogger(PaginationConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CursorCodec cursorCodec(AppProperties appProperties, Clock clock) {
        AppProperties.Pagination pagination = appProperties.getPagination();
        if (pagination.getCursorSecret() == null) {
            throw new PaginationConfigurationException("app.pagination.cursor-secret is not set");
        }
        CodecConfig config = new CodecConfig(pagination.getCursorSecret(), pagination.getCursorTtl(), clock);
        log.info("Cursor codec configured: ttl={}", config.ttl());
        return new CursorCodec(config);
    }

    @Bean
    public PaginatorFactory paginatorFactory(CursorCodec cursorCodec, AppProperties appProperties) {
        AppProperties.Pagination pagination = appProperties.getPagination();
        PaginationLimits limits = new PaginationLimits(pagination.getDefaultLimit(), pagination.getMaxLimit());
        log.info("Pagination limits: default={}, max={}, edgeCursorPolicy={}",
            limits.defaultLimit(), limits.maxLimit(), pagination.getEdgeCursorPolicy());
        return new PaginatorFactory(cursorCodec, limits, pagination.getEdgeCursorPolicy());
    }
}
