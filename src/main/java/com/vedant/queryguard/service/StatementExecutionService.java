package com.vedant.queryguard.service;

import com.vedant.queryguard.exception.ExecutionFailureException;
import com.vedant.queryguard.exception.ExecutionTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a sanitized statement against the target database under a hard deadline.
 *
 * The deadline is enforced twice: the caller stops waiting and interrupts the worker, and the
 * JDBC statement carries a query timeout so the driver cancels it on the server side.
 */
@Service
public class StatementExecutionService {

    private static final Logger log = LoggerFactory.getLogger(StatementExecutionService.class);

    private final JdbcTemplate jdbcTemplate;
    private final ExecutorService executor;
    private final long timeoutMs;

    public StatementExecutionService(JdbcTemplate jdbcTemplate,
                                     @Qualifier("queryExecutor") ExecutorService executor,
                                     @Value("${queryguard.execution.timeout-ms:30000}") long timeoutMs) {
        this.jdbcTemplate = jdbcTemplate;
        this.executor = executor;
        this.timeoutMs = timeoutMs;
        // an explicit spring.jdbc.template.query-timeout wins
        if (jdbcTemplate.getQueryTimeout() <= 0) {
            jdbcTemplate.setQueryTimeout(queryTimeoutSeconds(timeoutMs));
        }
    }

    static int queryTimeoutSeconds(long timeoutMs) {
        return (int) Math.max(1, (timeoutMs + 999) / 1000);
    }

    public List<Map<String, Object>> execute(String sql) {
        Future<List<Map<String, Object>>> future = executor.submit(() -> jdbcTemplate.queryForList(sql));
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Query exceeded {} ms and was cancelled: {}", timeoutMs, sql);
            throw new ExecutionTimeoutException(sql, timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Query execution failed: {}", sql, cause);
            throw new ExecutionFailureException(sql, cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ExecutionFailureException(sql, "Query execution was cancelled", e);
        }
    }
}
