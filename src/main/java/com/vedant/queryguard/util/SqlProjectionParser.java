package com.vedant.queryguard.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Narrow, regex based reading of the first {@code SELECT ... FROM} span of a statement.
 * Not a SQL parser: only the first top-level projection and the first table after FROM
 * are understood, subqueries in the projection are not tracked.
 */
public class SqlProjectionParser {

    public static final String WILDCARD = "*";

    private static final Pattern SELECT_FROM =
            Pattern.compile("\\bSELECT\\s+(.*?)\\s+FROM\\b", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern FROM_TABLE =
            Pattern.compile("\\bFROM\\s+([`\"]?)(\\w+)\\1", Pattern.CASE_INSENSITIVE);
    // leading projection modifiers; group 1 holds the DISTINCT ON expression list
    private static final Pattern MODIFIER = Pattern.compile(
            "(?:DISTINCT\\s+ON\\s*\\(([^)]*)\\)\\s*"
                    + "|(?:DISTINCTROW|DISTINCT|ALL|TOP\\s*(?:\\(\\s*\\d+\\s*\\)|(?<=\\s)\\d+)(?:\\s+PERCENT)?(?:\\s+WITH\\s+TIES)?"
                    + "|SQL_NO_CACHE|SQL_CACHE|SQL_CALC_FOUND_ROWS|SQL_SMALL_RESULT|SQL_BIG_RESULT|SQL_BUFFER_RESULT"
                    + "|HIGH_PRIORITY|STRAIGHT_JOIN)\\s+)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern AS_ALIAS =
            Pattern.compile("\\s+AS\\s+[\\w`\"\\[\\]]+$", Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE_ALIAS =
            Pattern.compile("^(.+?)\\s+([\\w`\"\\[\\]]+)$", Pattern.DOTALL);
    private static final Pattern CALL_START = Pattern.compile("^(?:[A-Za-z_][\\w$]*\\s*)?\\(");
    private static final Pattern CASE_EXPRESSION =
            Pattern.compile("^CASE\\b.*\\bEND$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern LITERAL = Pattern.compile("^(?:'(?:[^']|'')*'|-?\\d+(?:\\.\\d+)?)$");
    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^']|'')*'");

    private static final String PART = "(?:`[^`]+`|\"[^\"]+\"|\\[[^\\]]+\\]|[A-Za-z_][\\w$]*)";
    private static final Pattern NAME_PART = Pattern.compile(PART);
    private static final Pattern COLUMN_REF =
            Pattern.compile("^" + PART + "(?:\\s*\\.\\s*(?:" + PART + "|\\*))*$");
    // identifiers inside a larger expression; names directly followed by "(" are functions
    private static final Pattern EMBEDDED_REF =
            Pattern.compile("(?<![\\w$.])" + PART + "(?:\\s*\\.\\s*" + PART + ")*(?![\\w$])(?!\\s*[.(])");
    private static final Pattern QUOTES = Pattern.compile("[`\"'\\[\\]]");

    private static final Set<String> KEYWORDS = Set.of(
            "ALL", "AND", "ANY", "AS", "ASC", "BETWEEN", "BIGINT", "BOOLEAN", "BY", "CASE", "CHAR", "COLLATE",
            "CURRENT", "DATE", "DAY", "DECIMAL", "DESC", "DISTINCT", "DOUBLE", "ELSE", "END", "ESCAPE", "EXISTS",
            "FALSE", "FILTER", "FLOAT", "FOLLOWING", "FROM", "GROUP", "HOUR", "ILIKE", "IN", "INT", "INTEGER",
            "INTERVAL", "IS", "LIKE", "MINUTE", "MONTH", "NOT", "NULL", "NUMERIC", "ON", "OR", "ORDER", "OVER",
            "PARTITION", "PRECEDING", "PRECISION", "RANGE", "REAL", "ROW", "ROWS", "SECOND", "SELECT", "SIGNED",
            "SOME", "TEXT", "THEN", "TIME", "TIMESTAMP", "TRUE", "UNBOUNDED", "UNSIGNED", "VARCHAR", "WHEN",
            "WHERE", "WITHIN", "YEAR");

    private SqlProjectionParser() {
    }

    /** Raw projection text between the first SELECT and FROM, or null when there is none. */
    public static String projection(String sql) {
        if (sql == null) return null;
        Matcher m = SELECT_FROM.matcher(sql);
        return m.find() ? m.group(1) : null;
    }

    /**
     * Column references of the first projection, in order and without repeats. A bare {@code *}
     * (or {@code t.*}) is kept as {@link #WILDCARD}; aggregate stars such as {@code COUNT(*)} name
     * no column and are dropped, as are literals and keywords. Every column an item mentions is
     * reported, including all function arguments and a {@code DISTINCT ON} list.
     */
    public static List<String> extractColumns(String sql) {
        String projection = projection(sql);
        if (projection == null) return Collections.emptyList();

        Set<String> columns = new LinkedHashSet<>();
        for (String item : splitTopLevel(projection)) {
            for (String ref : columnReferences(item)) {
                if (!ref.isEmpty()) columns.add(ref);
            }
        }
        return new ArrayList<>(columns);
    }

    /** First table after FROM, optionally quoted; null when it cannot be determined. */
    public static String extractTableName(String sql) {
        if (sql == null) return null;
        Matcher m = FROM_TABLE.matcher(sql);
        return m.find() ? m.group(2) : null;
    }

    /**
     * Replaces the first projection with {@code newProjection}. Leading modifiers such as DISTINCT,
     * TOP n or SQL_NO_CACHE survive the rewrite; {@code DISTINCT ON (..)} is reduced to DISTINCT.
     * Statements without a SELECT ... FROM span are returned unchanged.
     */
    public static String replaceProjection(String sql, String newProjection) {
        Matcher m = SELECT_FROM.matcher(sql);
        if (!m.find()) return sql;

        String replacement = "SELECT " + modifierPrefix(m.group(1).trim()) + newProjection + " FROM";
        return sql.substring(0, m.start()) + replacement + sql.substring(m.end());
    }

    private static String modifierPrefix(String projection) {
        StringBuilder prefix = new StringBuilder();
        Matcher mod = MODIFIER.matcher(projection);
        while (mod.lookingAt()) {
            String keyword = mod.group(1) != null
                    ? "DISTINCT"
                    : mod.group().trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
            prefix.append(keyword).append(' ');
            mod.region(mod.end(), projection.length());
        }
        return prefix.toString();
    }

    /** Splits on commas outside parentheses and quotes. */
    static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        StringBuilder current = new StringBuilder();

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '\'' || c == '"' || c == '`') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (c == ',' && depth == 0) {
                parts.add(current.toString().trim());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        if (!current.toString().isBlank()) parts.add(current.toString().trim());
        return parts;
    }

    /** Bare columns a projection item refers to; empty when it refers to none. */
    static List<String> columnReferences(String item) {
        List<String> refs = new ArrayList<>();
        String s = item.trim();

        Matcher mod = MODIFIER.matcher(s);
        while (mod.lookingAt()) {
            if (mod.group(1) != null) {
                for (String arg : splitTopLevel(mod.group(1))) refs.addAll(columnReferences(arg));
            }
            s = s.substring(mod.end()).trim();
            mod = MODIFIER.matcher(s);
        }
        if (s.equals(WILDCARD)) {
            refs.add(WILDCARD);
            return refs;
        }

        s = AS_ALIAS.matcher(s).replaceFirst("").trim();
        Matcher bare = BARE_ALIAS.matcher(s);
        if (bare.matches() && isSingleExpression(bare.group(1).trim()) && !isKeyword(bare.group(2))) {
            s = bare.group(1).trim();
        }

        String args = callArguments(s);
        if (args != null) {
            for (String arg : splitTopLevel(args)) {
                for (String ref : columnReferences(arg)) {
                    // COUNT(*) and friends
                    if (!WILDCARD.equals(ref)) refs.add(ref);
                }
            }
            return refs;
        }

        if (COLUMN_REF.matcher(s).matches()) {
            String name = lastNamePart(s);
            if (name != null) refs.add(name);
            return refs;
        }

        Matcher embedded = EMBEDDED_REF.matcher(STRING_LITERAL.matcher(s).replaceAll(" "));
        while (embedded.find()) {
            String name = lastNamePart(embedded.group());
            if (name != null) refs.add(name);
        }
        return refs;
    }

    /** Contents of the parentheses when {@code s} is exactly {@code name(...)} or {@code (...)}. */
    private static String callArguments(String s) {
        Matcher start = CALL_START.matcher(s);
        if (!start.lookingAt()) return null;

        int open = start.end() - 1;
        int depth = 0;
        char quote = 0;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '\'' || c == '"' || c == '`') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i == s.length() - 1 ? s.substring(open + 1, i).trim() : null;
            }
        }
        return null;
    }

    private static boolean isSingleExpression(String s) {
        if (COLUMN_REF.matcher(s).matches()) return lastNamePart(s) != null;
        return callArguments(s) != null
                || CASE_EXPRESSION.matcher(s).matches()
                || LITERAL.matcher(s).matches();
    }

    // last segment of a possibly qualified name, unquoted; WILDCARD for t.*, null for keywords
    private static String lastNamePart(String ref) {
        if (ref.endsWith(WILDCARD)) return WILDCARD;
        String last = null;
        Matcher part = NAME_PART.matcher(ref);
        while (part.find()) last = part.group();
        if (last == null) return null;
        boolean quoted = last.length() > 1 && QUOTES.matcher(last.substring(0, 1)).matches();
        if (!quoted && isKeyword(last)) return null;
        return QUOTES.matcher(last).replaceAll("").trim();
    }

    private static boolean isKeyword(String token) {
        return KEYWORDS.contains(token.toUpperCase(Locale.ROOT));
    }

    public static boolean isPlainIdentifier(String column) {
        return column != null && column.toLowerCase(Locale.ROOT).matches("[a-z_][a-z0-9_$]*");
    }
}
