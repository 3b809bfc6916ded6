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
package ru.nts.tools.scan.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.scan.core.FileUtils;
import ru.nts.tools.scan.core.NtsCacheException;
import ru.nts.tools.scan.core.matching.OccurrenceTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON-файл с результатами:
 * <pre>
 * {
 *     "9f86d081...": {
 *         "needle": 3,
 *         "hay": 0
 *     }
 * }
 * </pre>
 * Запись атомарна (Safe Swap через {@link FileUtils#safeWrite}).
 */
public class JsonResultStore implements ResultStore {

    private final Path file;
    private final ObjectMapper mapper;

    public JsonResultStore(Path file) {
        this(file, new ObjectMapper());
    }

    public JsonResultStore(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    public Map<String, OccurrenceTable> load() {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        JsonNode root;
        try {
            root = mapper.readTree(FileUtils.safeReadAllBytes(file));
        } catch (JsonProcessingException e) {
            throw new NtsCacheException(describe(), "invalid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new NtsCacheException(describe(), "unreadable: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            // Пустой файл - то же, что отсутствующий
            return new LinkedHashMap<>();
        }
        if (!root.isObject()) {
            throw new NtsCacheException(describe(), "root is " + root.getNodeType() + ", expected object");
        }

        Map<String, OccurrenceTable> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String key = entry.getKey();
            if (!ContentDigest.isValidHex(key)) {
                throw new NtsCacheException(describe(), "key '" + key + "' is not a " + ContentDigest.ALGORITHM + " digest");
            }
            entries.put(key, readTable(key, entry.getValue()));
        }
        return entries;
    }

    private OccurrenceTable readTable(String key, JsonNode node) {
        if (!node.isObject()) {
            throw new NtsCacheException(describe(), "entry " + key + " is " + node.getNodeType() + ", expected object");
        }
        Map<String, Long> counts = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (!value.isIntegralNumber() || !value.canConvertToLong() || value.asLong() < 0) {
                throw new NtsCacheException(describe(),
                        "entry " + key + " has invalid count for '" + field.getKey() + "': " + value);
            }
            counts.put(field.getKey(), value.asLong());
        }
        try {
            return OccurrenceTable.fromMap(counts);
        } catch (IllegalArgumentException e) {
            throw new NtsCacheException(describe(), "entry " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void save(Map<String, OccurrenceTable> entries) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        for (Map.Entry<String, OccurrenceTable> entry : entries.entrySet()) {
            ObjectNode table = root.putObject(entry.getKey());
            entry.getValue().asMap().forEach((pattern, count) -> table.put(pattern, count.longValue()));
        }
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance()
                        .withObjectFieldValueSpacing(Separators.Spacing.AFTER))
                .withObjectIndenter(new DefaultIndenter("    ", DefaultIndenter.SYS_LF));
        byte[] json = mapper.writer(printer).writeValueAsBytes(root);
        FileUtils.safeWrite(file, json);
    }

    public Path file() {
        return file;
    }

    @Override
    public String describe() {
        return file.toString();
    }
}
