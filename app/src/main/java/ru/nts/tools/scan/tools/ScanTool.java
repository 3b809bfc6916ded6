/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.scan.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.scan.core.EncodingUtils;
import ru.nts.tools.scan.core.McpTool;
import ru.nts.tools.scan.core.NtsFileException;
import ru.nts.tools.scan.core.NtsParamException;
import ru.nts.tools.scan.core.PathSanitizer;
import ru.nts.tools.scan.core.ScanOutcome;
import ru.nts.tools.scan.core.ScanService;
import ru.nts.tools.scan.core.ScanSource;
import ru.nts.tools.scan.core.matching.PatternSet;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Подсчёт вхождений набора литеральных паттернов в файле за один проход.
 * Повторный вызов для файла с тем же содержимым отвечает из кэша без сканирования.
 */
public class ScanTool implements McpTool {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ScanService service;

    public ScanTool(ScanService service) {
        this.service = service;
    }

    @Override
    public String getName() {
        return "nts_scan";
    }

    @Override
    public String getDescription() {
        return """
            Count occurrences of literal patterns in a file in a single streaming pass.

            BEHAVIOR:
            • All patterns are matched at once (Aho-Corasick); overlapping matches are all counted,
              e.g. 'aa' occurs 3 times in 'aaaa', and both 'a' and 'ab' are counted in 'xaby'.
            • Results are cached by SHA-256 of the file content: re-scanning identical content
              is answered from the cache without reading the file twice.
            • Matching is byte-exact against UTF-8 encoded patterns. No regex, no case folding.

            TIPS:
            • Use patternsFile for long pattern lists (one pattern per line, encoding auto-detected).
            • useCache=false forces a fresh scan and leaves the cache untouched.
            """;
    }

    @Override
    public String getCategory() {
        return "search";
    }

    @Override
    public JsonNode getInputSchema() {
        var schema = mapper.createObjectNode();
        schema.put("type", "object");
        var props = schema.putObject("properties");

        props.putObject("path").put("type", "string").put("description",
                "File to scan, relative to the project root. Required.");

        var patterns = props.putObject("patterns");
        patterns.put("type", "array").put("description",
                "Literal patterns to count. Duplicates are counted once. Empty strings are rejected.");
        patterns.putObject("items").put("type", "string");

        props.putObject("patternsFile").put("type", "string").put("description",
                "File with one pattern per line, appended to 'patterns'. Blank lines are ignored.");

        props.putObject("useCache").put("type", "boolean").put("description",
                "Consult and update the result cache. Default: true.");

        schema.putArray("required").add("path");
        return schema;
    }

    @Override
    public JsonNode execute(JsonNode params) throws Exception {
        String pathStr = params.path("path").asText("");
        if (pathStr.isBlank()) {
            throw NtsParamException.missing("path");
        }
        Path path = PathSanitizer.sanitize(pathStr);
        PatternSet patterns = PatternSet.of(collectPatterns(params));
        boolean useCache = params.path("useCache").asBoolean(true);

        ScanOutcome outcome = service.scan(ScanSource.ofFile(path), patterns, useCache);
        return createResponse(pathStr, outcome);
    }

    private List<String> collectPatterns(JsonNode params) {
        JsonNode patternsNode = params.get("patterns");
        JsonNode fileNode = params.get("patternsFile");
        if ((patternsNode == null || patternsNode.isNull()) && (fileNode == null || fileNode.isNull())) {
            throw NtsParamException.missing("patterns");
        }

        List<String> result = new ArrayList<>();
        if (patternsNode != null && !patternsNode.isNull()) {
            if (!patternsNode.isArray()) {
                throw NtsParamException.invalid("patterns", patternsNode.toString(), "an array of strings");
            }
            for (JsonNode item : patternsNode) {
                if (!item.isTextual()) {
                    throw NtsParamException.invalid("patterns", item.toString(), "a string");
                }
                result.add(item.asText());
            }
        }
        if (fileNode != null && !fileNode.isNull()) {
            Path file = PathSanitizer.sanitize(fileNode.asText());
            try {
                result.addAll(EncodingUtils.readNonBlankLines(file));
            } catch (IOException e) {
                throw NtsFileException.readFailed(file.toString(), e);
            }
        }
        return result;
    }

    private JsonNode createResponse(String pathStr, ScanOutcome outcome) {
        StringBuilder sb = new StringBuilder();
        if (outcome.cached()) {
            sb.append("File ").append(pathStr).append(" already processed. Retrieved results from storage.\n");
        } else {
            sb.append("Scanned ").append(pathStr).append(" (").append(outcome.bytes()).append(" bytes)\n");
        }
        sb.append("SHA-256: ").append(outcome.digest()).append("\n\n");
        for (Map.Entry<String, Long> e : outcome.table().asMap().entrySet()) {
            sb.append(e.getKey()).append(" : ").append(e.getValue()).append(" occurrences!\n");
        }

        ObjectNode res = mapper.createObjectNode();
        res.putArray("content").addObject().put("type", "text").put("text", sb.toString().stripTrailing());

        ObjectNode structured = res.putObject("structuredContent");
        structured.put("digest", outcome.digest());
        structured.put("cached", outcome.cached());
        structured.put("bytes", outcome.bytes());
        ObjectNode counts = structured.putObject("counts");
        outcome.table().asMap().forEach((pattern, count) -> counts.put(pattern, count.longValue()));
        return res;
    }
}
