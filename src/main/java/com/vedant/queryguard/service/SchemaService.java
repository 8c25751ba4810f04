package com.vedant.queryguard.service;

import com.vedant.queryguard.util.SchemaColumnResolver;
import com.vedant.queryguard.util.SchemaColumnResolver.ColumnLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Describes the tables of the target database in the textual schema format
 * (see {@link SchemaColumnResolver}) using JDBC metadata.
 */
@Service
public class SchemaService {

    private static final Logger log = LoggerFactory.getLogger(SchemaService.class);

    private final JdbcTemplate jdbcTemplate;

    public SchemaService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public String describeSchema() {
        String schema = jdbcTemplate.execute((ConnectionCallback<String>) con -> {
            DatabaseMetaData md = con.getMetaData();
            String catalog = con.getCatalog();
            String schemaPattern = con.getSchema();

            List<String> tables = new ArrayList<>();
            try (ResultSet rs = md.getTables(catalog, schemaPattern, "%", new String[]{"TABLE"})) {
                while (rs.next()) tables.add(rs.getString("TABLE_NAME"));
            }

            StringBuilder sb = new StringBuilder();
            for (String table : tables) {
                Set<String> primaryKeys = new HashSet<>();
                try (ResultSet pk = md.getPrimaryKeys(catalog, schemaPattern, table)) {
                    while (pk.next()) primaryKeys.add(pk.getString("COLUMN_NAME"));
                }

                List<ColumnLine> columns = new ArrayList<>();
                try (ResultSet cols = md.getColumns(catalog, schemaPattern, table, "%")) {
                    while (cols.next()) {
                        String name = cols.getString("COLUMN_NAME");
                        String attributes;
                        if (primaryKeys.contains(name)) {
                            attributes = "PRIMARY KEY";
                        } else {
                            attributes = "NO".equals(cols.getString("IS_NULLABLE")) ? "NOT NULL" : "";
                        }
                        columns.add(new ColumnLine(name, cols.getString("TYPE_NAME"), attributes));
                    }
                }
                sb.append(SchemaColumnResolver.formatTable(table, columns));
            }
            return sb.toString();
        });

        log.debug("=== SCHEMA DESCRIPTION ===\n{}", schema);
        return schema == null ? "" : schema;
    }
}
