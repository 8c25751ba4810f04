package com.vedant.queryguard.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vedant.queryguard.security.SensitiveColumnCatalog;
import com.vedant.queryguard.util.SchemaColumnResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Natural language to SQL through an OpenAI-compatible chat completion endpoint.
 * The output is untrusted: it always goes through {@link QuerySafetyPipeline} afterwards.
 */
@Service
public class SqlTranslationService {

    private static final Logger log = LoggerFactory.getLogger(SqlTranslationService.class);

    private final String apiKey;
    private final String apiUrl;
    private final SensitiveColumnCatalog catalog;
    private final HttpClient httpClient = HttpClient.newHttpClient();
    private final ObjectMapper mapper = new ObjectMapper();

    public SqlTranslationService(
            @Value("${llm.api.key:}") String apiKey,
            @Value("${llm.api.url:https://openrouter.ai/api/v1/chat/completions}") String apiUrl,
            SensitiveColumnCatalog catalog
    ) {
        this.apiKey = apiKey;
        this.apiUrl = apiUrl;
        this.catalog = catalog;
    }

    /* ============================================================
       NATURAL LANGUAGE → SQL
       ============================================================ */
    public String generateSql(String nlQuery, String schemaText, String dbType) {

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("API KEY missing, using fallback SQL.");
            return fallbackSql(schemaText);
        }

        try {
            Map<String, Object> payload = new HashMap<>();
            payload.put("model", "openai/gpt-4o-mini");

            String systemPrompt =
                    "You are an expert SQL query generator for " + (dbType == null ? "SQL" : dbType.toUpperCase()) + ".\n" +
                            "You must generate EXACTLY ONE read-only SELECT query.\n" +
                            "\n" +
                            "STRICT RULES:\n" +
                            "1. Only SELECT allowed. No INSERT/UPDATE/DELETE/ALTER/DROP.\n" +
                            "2. Use ONLY the tables and columns in the provided schema.\n" +
                            "3. No comments, no semicolons, no UNION.\n" +
                            "4. NEVER select these sensitive columns, even if asked: " +
                            String.join(", ", catalog.patterns()) + ".\n" +
                            "   If the user asks for them, return an aggregate such as COUNT(*) instead.\n" +
                            "5. Return ONLY the SQL string. No markdown. No ``` fences. No explanations.";

            String userContent = "Database Schema:\n" + schemaText + "\n\nNatural Language Query: " + nlQuery + "\n";

            List<Map<String, String>> messages = new ArrayList<>();
            messages.add(Map.of("role", "system", "content", systemPrompt));
            messages.add(Map.of("role", "user", "content", userContent));

            payload.put("messages", messages);
            payload.put("max_tokens", 400);

            String body = mapper.writeValueAsString(payload);

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl))
                    .header("Authorization", "Bearer " + apiKey)
                    .header("Content-Type", "application/json")
                    .header("X-Title", "QueryGuard")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            HttpResponse<String> response =
                    httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                log.error("LLM returned non-200 status: {}", response.statusCode());
                return fallbackSql(schemaText);
            }

            String sql = extractSql(mapper.readTree(response.body()));
            if (sql == null) {
                log.error("LLM response missing 'message.content'");
                return fallbackSql(schemaText);
            }

            log.info("=== LLM GENERATED SQL ===\n{}\n=========================", sql);
            return sql;

        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("SQL generation interrupted", ex);
        } catch (Exception ex) {
            log.error("LLM SQL generation failed", ex);
            return fallbackSql(schemaText);
        }
    }

    // Statement text from an OpenAI style response, fences and BOM stripped.
    // Semicolons are kept: the statement gate rejects multi-statement output.
    static String extractSql(JsonNode root) {
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) return null;
        JsonNode contentNode = choices.get(0).path("message").path("content");
        if (contentNode.isMissingNode() || contentNode.isNull()) return null;

        String sql = contentNode.asText()
                .replace("\uFEFF", "")
                .replaceAll("```sql", "")
                .replaceAll("```", "")
                .trim();
        return sql.isEmpty() ? null : sql;
    }

    String fallbackSql(String schemaText) {
        List<String> tables = SchemaColumnResolver.tableNames(schemaText);
        if (tables.isEmpty()) {
            throw new IllegalStateException("SQL translation unavailable and no table to fall back to");
        }
        return "SELECT * FROM " + tables.get(0) + " LIMIT 50";
    }
}
