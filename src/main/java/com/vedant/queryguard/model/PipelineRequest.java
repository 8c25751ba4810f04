package com.vedant.queryguard.model;

/**
 * Everything one pipeline run needs: who asked, against what, the generated statement and the
 * schema description of the target database.
 */
public record PipelineRequest(
        String userId,
        String userEmail,
        String database,
        String dbType,
        String naturalLanguageQuery,
        String statement,
        String schemaText
) {}
