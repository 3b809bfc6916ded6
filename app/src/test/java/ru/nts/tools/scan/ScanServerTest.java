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
package ru.nts.tools.scan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.scan.core.PathSanitizer;
import ru.nts.tools.scan.core.ScanConfig;
import ru.nts.tools.scan.core.ScanService;
import ru.nts.tools.scan.core.cache.ResultCache;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Интеграционные тесты MCP сервера сканера.
 * Проверяют обработку JSON-RPC сообщений, инициализацию протокола
 * и вызов инструмента сканирования.
 */
class ScanServerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private Path previousRoot;
    private ScanServer server;

    @BeforeEach
    void setUp() throws Exception {
        previousRoot = PathSanitizer.getRoot();
        PathSanitizer.setRoot(tempDir);
        Files.writeString(tempDir.resolve("data.txt"), "aaaa", StandardCharsets.UTF_8);
        ScanConfig config = ScanConfig.defaults().withRoot(tempDir);
        server = new ScanServer(config, new ScanService(ResultCache.inMemory(), 2));
    }

    @AfterEach
    void tearDown() {
        PathSanitizer.setRoot(previousRoot);
    }

    /**
     * Прогоняет сообщения через сервер и возвращает ответы, упорядоченные по id.
     */
    private Map<Integer, JsonNode> exchange(String... messages) throws Exception {
        String input = String.join("\n", messages) + "\n";
        ByteArrayOutputStream outContent = new ByteArrayOutputStream();

        server.serve(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(outContent, true, StandardCharsets.UTF_8));

        Map<Integer, JsonNode> responses = new HashMap<>();
        for (String line : outContent.toString(StandardCharsets.UTF_8).split("\n")) {
            if (line.trim().startsWith("{")) {
                JsonNode json = mapper.readTree(line);
                responses.put(json.get("id").isNull() ? -1 : json.get("id").asInt(), json);
            }
        }
        return responses;
    }

    private static String call(int id, String arguments) {
        return "{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"method\":\"tools/call\","
                + "\"params\":{\"name\":\"nts_scan\",\"arguments\":" + arguments + "}}";
    }

    // ==================== Протокол ====================

    @Test
    void testServerInitialization() throws Exception {
        JsonNode response = exchange("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{}}").get(1);

        JsonNode result = response.get("result");
        assertEquals(ScanServer.PROTOCOL_VERSION, result.get("protocolVersion").asText());
        assertEquals(ScanServer.SERVER_NAME, result.get("serverInfo").get("name").asText());
        assertTrue(result.get("capabilities").get("tools").has("listChanged"));
    }

    @Test
    void testPing() throws Exception {
        JsonNode response = exchange("{\"jsonrpc\":\"2.0\",\"id\":42,\"method\":\"ping\"}").get(42);

        assertTrue(response.get("result").isObject());
        assertEquals(0, response.get("result").size());
    }

    @Test
    void testNotificationGetsNoResponse() throws Exception {
        Map<Integer, JsonNode> responses = exchange(
                "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}",
                "{\"jsonrpc\":\"2.0\",\"method\":\"unknown/notification\"}",
                "{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"ping\"}");

        assertEquals(1, responses.size());
        assertTrue(responses.containsKey(7));
    }

    @Test
    void testUnknownMethod() throws Exception {
        JsonNode response = exchange("{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"resources/list\"}").get(3);

        assertEquals(-32601, response.get("error").get("code").asInt());
    }

    @Test
    void testParseError() throws Exception {
        JsonNode response = exchange("{broken").get(-1);

        assertEquals(-32700, response.get("error").get("code").asInt());
    }

    @Test
    void testUnknownToolIsInvalidParams() throws Exception {
        JsonNode response = exchange("{\"jsonrpc\":\"2.0\",\"id\":5,\"method\":\"tools/call\","
                + "\"params\":{\"name\":\"nts_nothing\",\"arguments\":{}}}").get(5);

        assertEquals(-32602, response.get("error").get("code").asInt());
    }

    @Test
    void testToolsList() throws Exception {
        JsonNode response = exchange("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/list\",\"params\":{}}").get(2);

        JsonNode tools = response.get("result").get("tools");
        List<String> names = new ArrayList<>();
        tools.forEach(t -> names.add(t.get("name").asText()));
        assertEquals(List.of("nts_scan"), names);
    }

    @Test
    void testFailingMessageIsLoggedAndOthersAnswered() throws Exception {
        Path logFile = tempDir.resolve("server.log");
        ScanConfig config = new ScanConfig(tempDir.resolve("results.json"), 1024, tempDir, false, logFile);
        server = new ScanServer(config, new ScanService(ResultCache.inMemory(), 2)) {
            @Override
            void processMessage(String message) {
                if (message.contains("\"explode\"")) {
                    throw new IllegalStateException("writer closed");
                }
                super.processMessage(message);
            }
        };

        Map<Integer, JsonNode> responses = exchange(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"explode\"}",
                "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"ping\"}");

        assertEquals(1, responses.size());
        assertTrue(responses.containsKey(2));
        String log = Files.readString(logFile, StandardCharsets.UTF_8);
        assertTrue(log.contains("Unhandled error while processing message"), log);
        assertTrue(log.contains("writer closed"), log);
    }

    // ==================== Сканирование ====================

    @Test
    void testScanCall() throws Exception {
        JsonNode response = exchange(call(10, "{\"path\":\"data.txt\",\"patterns\":[\"aa\",\"a\"]}")).get(10);

        JsonNode counts = response.get("result").get("structuredContent").get("counts");
        assertEquals(3, counts.get("aa").asLong());
        assertEquals(4, counts.get("a").asLong());
        assertFalse(response.get("result").has("isError"));
    }

    @Test
    void testScanErrorReportedAsToolError() throws Exception {
        JsonNode response = exchange(call(11, "{\"path\":\"missing.txt\",\"patterns\":[\"a\"]}")).get(11);

        JsonNode result = response.get("result");
        assertTrue(result.get("isError").asBoolean());
        assertTrue(result.get("content").get(0).get("text").asText().contains("FILE_NOT_FOUND"));
    }

    @Test
    void testParallelScansShareCache() throws Exception {
        List<String> calls = new ArrayList<>();
        for (int id = 1; id <= 8; id++) {
            calls.add(call(id, "{\"path\":\"data.txt\",\"patterns\":[\"aa\"]}"));
        }

        Map<Integer, JsonNode> responses = exchange(calls.toArray(new String[0]));

        assertEquals(8, responses.size(), "Сервер должен ответить на каждый запрос");
        for (JsonNode response : responses.values()) {
            assertEquals(3, response.get("result").get("structuredContent").get("counts").get("aa").asLong());
        }
    }
}
