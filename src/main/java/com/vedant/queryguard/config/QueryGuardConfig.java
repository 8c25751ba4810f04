package com.vedant.queryguard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vedant.queryguard.security.SensitiveColumnCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class QueryGuardConfig {

    private static final Logger log = LoggerFactory.getLogger(QueryGuardConfig.class);

    // Loaded once at start-up; a missing or empty catalog fails the boot.
    @Bean
    public SensitiveColumnCatalog sensitiveColumnCatalog(
            ResourceLoader resourceLoader,
            @Value("${queryguard.catalog.location:classpath:sensitive-columns.json}") String location
    ) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            SensitiveColumnCatalog catalog = SensitiveColumnCatalog.load(in, new ObjectMapper());
            log.info("Sensitive column catalog {} loaded from {} ({} patterns)",
                    catalog.version(), location, catalog.patterns().size());
            return catalog;
        }
    }

    @Bean(name = "queryExecutor", destroyMethod = "shutdownNow")
    public ExecutorService queryExecutor(@Value("${queryguard.execution.threads:8}") int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "query-exec-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
