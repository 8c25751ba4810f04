package com.vedant.queryguard.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes the plain-text schema description handed to the translator and the sanitizer.
 *
 * <pre>
 * Table: users
 *   - id (integer) PRIMARY KEY
 *   - email (text) NOT NULL
 *
 * Table: accounts
 *   - ...
 * </pre>
 */
public class SchemaColumnResolver {

    private static final String TABLE_HEADER = "Table: ";
    private static final Pattern COLUMN_LINE = Pattern.compile("^\\s*-\\s+(\\w+)\\s+\\(");

    private SchemaColumnResolver() {
    }

    /**
     * Column names of {@code tableName} in declaration order. The table name must match the
     * header exactly (case-sensitive). An unknown table yields an empty list, not an error.
     */
    public static List<String> columnsForTable(String schemaText, String tableName) {
        if (schemaText == null || tableName == null) return Collections.emptyList();

        String header = TABLE_HEADER + tableName;
        List<String> columns = new ArrayList<>();
        boolean inBlock = false;

        for (String line : schemaText.split("\\R")) {
            if (!inBlock) {
                inBlock = line.strip().equals(header);
                continue;
            }
            if (line.isBlank() || line.strip().startsWith(TABLE_HEADER)) break;

            Matcher m = COLUMN_LINE.matcher(line);
            if (m.find()) columns.add(m.group(1));
        }
        return columns;
    }

    /** Table names in the order their blocks appear. */
    public static List<String> tableNames(String schemaText) {
        if (schemaText == null) return Collections.emptyList();
        List<String> names = new ArrayList<>();
        for (String line : schemaText.split("\\R")) {
            String s = line.strip();
            if (s.startsWith(TABLE_HEADER) && s.length() > TABLE_HEADER.length()) {
                names.add(s.substring(TABLE_HEADER.length()).strip());
            }
        }
        return names;
    }

    // one block, terminated by a blank line so blocks stay separated when concatenated
    public static String formatTable(String tableName, List<ColumnLine> columns) {
        StringBuilder sb = new StringBuilder();
        sb.append(TABLE_HEADER).append(tableName).append("\n");
        for (ColumnLine c : columns) {
            sb.append("  - ").append(c.name()).append(" (").append(c.type()).append(")");
            if (c.attributes() != null && !c.attributes().isBlank()) {
                sb.append(" ").append(c.attributes().trim());
            }
            sb.append("\n");
        }
        sb.append("\n");
        return sb.toString();
    }

    public record ColumnLine(String name, String type, String attributes) {}
}
