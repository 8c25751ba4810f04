package com.vedant.queryguard.service;

import com.vedant.queryguard.model.AuditEntry;
import com.vedant.queryguard.model.PipelineRequest;
import com.vedant.queryguard.model.PipelineResult;
import com.vedant.queryguard.model.SecurityReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for callers: NL question → schema → SQL → safety pipeline.
 */
@Service
public class QueryService {

    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    private final SchemaService schemaService;
    private final SqlTranslationService translationService;
    private final QuerySafetyPipeline pipeline;
    private final AuditLogService auditLogService;
    private final String database;
    private final String dbType;
    private final int maxQuestionLength;

    public QueryService(
            SchemaService schemaService,
            SqlTranslationService translationService,
            QuerySafetyPipeline pipeline,
            AuditLogService auditLogService,
            @Value("${queryguard.target.database:querybot}") String database,
            @Value("${queryguard.target.kind:postgresql}") String dbType,
            @Value("${queryguard.nl.max-length:1000}") int maxQuestionLength
    ) {
        this.schemaService = schemaService;
        this.translationService = translationService;
        this.pipeline = pipeline;
        this.auditLogService = auditLogService;
        this.database = database;
        this.dbType = dbType;
        this.maxQuestionLength = maxQuestionLength;
    }

    /* ============================================================
       MAIN: NL → SQL → VALIDATE → SANITIZE → EXECUTE → AUDIT
       ============================================================ */
    public PipelineResult executeNlQuery(String nlQuery, String userId, String userEmail) {
        if (nlQuery == null || nlQuery.isBlank()) {
            throw new IllegalArgumentException("Please provide a valid query.");
        }
        if (nlQuery.length() > maxQuestionLength) {
            throw new IllegalArgumentException(
                    "Query is too long. Maximum " + maxQuestionLength + " characters allowed.");
        }

        String schema = schemaService.describeSchema();
        String sql = translationService.generateSql(nlQuery, schema, dbType);

        log.info("=== SQL RECEIVED FROM LLM ===\n{}\n=====================", sql);

        return pipeline.run(new PipelineRequest(userId, userEmail, database, dbType, nlQuery, sql, schema));
    }

    public SecurityReport checkStatement(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("Please provide a SQL statement.");
        }
        return pipeline.check(sql, schemaService.describeSchema(), dbType);
    }

    public List<AuditEntry> auditHistory(String userId, int limit) {
        return auditLogService.queryByUser(userId, limit);
    }
}
