package com.vedant.queryguard.service;

import com.vedant.queryguard.model.BlockedColumn;
import com.vedant.queryguard.model.IdentifierQuote;
import com.vedant.queryguard.model.SafeAlternative;
import com.vedant.queryguard.model.SanitizationOutcome;
import com.vedant.queryguard.model.SecurityWarning;
import com.vedant.queryguard.security.SensitiveColumnCatalog;
import com.vedant.queryguard.util.SchemaColumnResolver;
import com.vedant.queryguard.util.SqlProjectionParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Removes sensitive columns from an already validated statement.
 *
 * Only the first SELECT ... FROM span is rewritten. When nothing is blocked the statement is
 * returned as given. When the table cannot be identified the statement is passed through with a
 * warning (fail-open for table extraction only; the statement gate has already run).
 */
@Service
public class ColumnSecurityService {

    private static final Logger log = LoggerFactory.getLogger(ColumnSecurityService.class);

    public static final String TABLE_UNRESOLVED = "Could not determine table name to sanitize columns.";

    private final SensitiveColumnCatalog catalog;

    public ColumnSecurityService(SensitiveColumnCatalog catalog) {
        this.catalog = catalog;
    }

    public SanitizationOutcome sanitize(String sql, String schemaText) {
        return sanitize(sql, schemaText, IdentifierQuote.BACKTICK);
    }

    public SanitizationOutcome sanitize(String sql, String schemaText, IdentifierQuote quote) {
        List<String> requested = SqlProjectionParser.extractColumns(sql);
        String tableName = SqlProjectionParser.extractTableName(sql);

        if (tableName == null) {
            log.warn("Column sanitization skipped, no table found in: {}", sql);
            return SanitizationOutcome.unchanged(sql, List.of(SecurityWarning.of(TABLE_UNRESOLVED)));
        }

        List<String> resolved = expandWildcard(requested, schemaText, tableName);

        List<BlockedColumn> blocked = new ArrayList<>();
        List<String> allowed = new ArrayList<>();
        for (String column : resolved) {
            if (catalog.isSensitive(column)) {
                blocked.add(BlockedColumn.sensitive(column));
            } else {
                allowed.add(column);
            }
        }

        if (blocked.isEmpty()) {
            return SanitizationOutcome.unchanged(sql, List.of());
        }

        String projection;
        if (allowed.isEmpty()) {
            // every requested column is sensitive: serve an aggregate for the first one instead
            projection = catalog.safeAlternativeFor(blocked.get(0).column())
                    .orElse(SensitiveColumnCatalog.DEFAULT_ALTERNATIVE);
        } else {
            projection = allowed.stream()
                    .map(c -> SqlProjectionParser.isPlainIdentifier(c) ? quote.quote(c) : c)
                    .collect(Collectors.joining(", "));
        }

        String sanitized = SqlProjectionParser.replaceProjection(sql, projection);
        log.info("Blocked {} sensitive column(s) on table {}: {}", blocked.size(), tableName,
                blocked.stream().map(BlockedColumn::column).collect(Collectors.joining(", ")));
        return new SanitizationOutcome(sanitized, blocked, List.of());
    }

    /** One suggestion per blocked column: the catalog aggregate when known, a row count otherwise. */
    public List<SafeAlternative> suggestAlternatives(List<BlockedColumn> blockedColumns) {
        List<SafeAlternative> alternatives = new ArrayList<>();
        for (BlockedColumn b : blockedColumns) {
            String column = b.column();
            alternatives.add(catalog.safeAlternativeFor(column)
                    .map(safe -> new SafeAlternative(column, safe,
                            "Instead of selecting " + column + " directly, use: " + safe))
                    .orElseGet(() -> new SafeAlternative(column, "COUNT(*) as " + column + "_records",
                            "Use aggregate function instead of accessing " + column + " directly")));
        }
        return alternatives;
    }

    // bare * is replaced in place by the table's known columns; an unknown table contributes none
    private List<String> expandWildcard(List<String> requested, String schemaText, String tableName) {
        if (!requested.contains(SqlProjectionParser.WILDCARD)) return requested;

        List<String> tableColumns = SchemaColumnResolver.columnsForTable(schemaText, tableName);
        if (tableColumns.isEmpty()) {
            log.debug("No schema columns known for table {}", tableName);
        }
        List<String> expanded = new ArrayList<>();
        for (String column : requested) {
            if (SqlProjectionParser.WILDCARD.equals(column)) {
                expanded.addAll(tableColumns);
            } else {
                expanded.add(column);
            }
        }
        return expanded;
    }
}
