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
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.scan.core.McpRouter;
import ru.nts.tools.scan.core.PathSanitizer;
import ru.nts.tools.scan.core.ScanConfig;
import ru.nts.tools.scan.core.ScanService;
import ru.nts.tools.scan.tools.ScanTool;

import java.io.BufferedReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * MCP сервер сканера: протокол Model Context Protocol поверх stdio (JSON-RPC 2.0, по строке на сообщение).
 * Запросы обрабатываются в пуле потоков; каждый вызов сканирования использует собственный сканер,
 * а общий кэш результатов защищён внутри {@link ScanService}.
 *
 * С аргументами командной строки работает как обычная утилита (см. {@link ScanCommand}).
 */
public class ScanServer {

    public static final String SERVER_NAME = "NTS-Scan-MCP";
    public static final String SERVER_VERSION = "1.0.0";
    public static final String PROTOCOL_VERSION = "2024-11-05";

    private static final int WORKER_THREADS = 4;

    private final ObjectMapper mapper = new ObjectMapper();
    private final McpRouter router = new McpRouter(mapper);
    private final ScanConfig config;
    private final PrintWriter logWriter;
    private PrintStream out;

    public ScanServer(ScanConfig config, ScanService service) {
        this.config = config;
        this.logWriter = openLog(config);
        router.registerTool(new ScanTool(service));
    }

    private static PrintWriter openLog(ScanConfig config) {
        if (config.logFile() == null) {
            return null;
        }
        try {
            return new PrintWriter(new FileWriter(config.logFile().toFile(), StandardCharsets.UTF_8, true), true);
        } catch (IOException e) {
            System.err.println("Warning: cannot open log file " + config.logFile() + ": " + e.getMessage());
            return null;
        }
    }

    /**
     * Записывает сообщение в лог-файл (если настроен) и в stderr в режиме отладки.
     */
    private void log(String message) {
        if (logWriter != null) {
            logWriter.println("[" + LocalDateTime.now() + "] " + message);
        }
        if (config.debug()) {
            System.err.println(message);
        }
    }

    /**
     * Точка входа. Без аргументов запускает MCP сервер, иначе выполняет одно сканирование.
     *
     * @param args Аргументы командной строки.
     */
    public static void main(String[] args) {
        // Принудительно UTF-8 для стандартных потоков: на Windows по умолчанию системная кодировка
        System.setOut(new PrintStream(System.out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(System.err, true, StandardCharsets.UTF_8));

        if (args.length > 0) {
            System.exit(ScanCommand.run(args, System.getenv(), System.out, System.err));
        }

        ScanConfig config = ScanConfig.fromEnvironment();
        PathSanitizer.setRoot(config.root());
        new ScanServer(config, ScanService.create(config)).serve(System.in, System.out);
    }

    /**
     * Цикл чтения сообщений до конца входного потока.
     * Возвращает управление после того, как все принятые запросы обработаны.
     */
    public void serve(InputStream in, PrintStream out) {
        this.out = out;
        log("MCP Server starting (root: " + config.root() + ", cache: " + config.cacheFile() + ")");

        ExecutorService executor = Executors.newFixedThreadPool(WORKER_THREADS);
        try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                final String message = line;
                executor.execute(() -> {
                    try {
                        processMessage(message);
                    } catch (Exception e) {
                        log("Unhandled error while processing message: " + e);
                        if (logWriter != null) {
                            e.printStackTrace(logWriter);
                        }
                    }
                });
            }
        } catch (IOException e) {
            log("Error in server loop: " + e.getMessage());
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(1, TimeUnit.HOURS)) {
                    log("Timed out waiting for in-flight requests");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log("MCP Server stopped");
    }

    /**
     * Обрабатывает одиночное JSON-RPC сообщение и отправляет ответ, если это был запрос.
     */
    void processMessage(String message) {
        JsonNode request;
        try {
            request = mapper.readTree(message);
        } catch (IOException e) {
            log("Failed to parse message: " + e.getMessage());
            ObjectNode response = mapper.createObjectNode();
            response.put("jsonrpc", "2.0");
            response.putNull("id");
            response.set("error", error(-32700, "Parse error: " + e.getMessage()));
            sendResponse(response);
            return;
        }

        String method = request.path("method").asText();
        JsonNode id = request.get("id");
        log("<<< " + method + (id != null ? " (id=" + id + ")" : ""));

        ObjectNode response = mapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        if (id != null) {
            response.set("id", id);
        }

        try {
            switch (method) {
                case "initialize" -> {
                    var clientInfo = request.path("params").path("clientInfo");
                    log("Client info: " + clientInfo.path("name").asText("unknown")
                            + " (" + clientInfo.path("version").asText() + ")");

                    var result = mapper.createObjectNode();
                    result.put("protocolVersion", PROTOCOL_VERSION);
                    var capabilities = result.putObject("capabilities");
                    capabilities.putObject("tools").put("listChanged", false);

                    var serverInfo = result.putObject("serverInfo");
                    serverInfo.put("name", SERVER_NAME);
                    serverInfo.put("version", SERVER_VERSION);
                    response.set("result", result);
                }
                case "notifications/initialized" -> {
                    // На уведомление ответ не отправляется
                    log("Client initialized connection.");
                    return;
                }
                case "ping" -> response.set("result", mapper.createObjectNode());
                case "tools/list" -> response.set("result", router.listTools());
                case "tools/call" -> {
                    String toolName = request.path("params").path("name").asText();
                    JsonNode params = request.path("params").path("arguments");
                    response.set("result", router.callTool(toolName, params));
                }
                default -> {
                    if (id == null) {
                        return;
                    }
                    response.set("error", error(-32601, "Method not found: " + method));
                }
            }
        } catch (IllegalArgumentException e) {
            log("IllegalArgumentException: " + e.getMessage());
            response.set("error", error(-32602, "Invalid params: " + e.getMessage()));
        } catch (Exception e) {
            log("Exception in " + method + ": " + e);
            if (logWriter != null) {
                e.printStackTrace(logWriter);
            }
            response.set("error", error(-32603, "Internal error: " + e.getMessage()));
        }

        if (id != null) {
            sendResponse(response);
        }
    }

    private ObjectNode error(int code, String message) {
        ObjectNode error = mapper.createObjectNode();
        error.put("code", code);
        error.put("message", message);
        return error;
    }

    /**
     * Синхронизированная отправка ответа: несколько рабочих потоков не должны перемешивать байты сообщений.
     */
    private synchronized void sendResponse(ObjectNode response) {
        try {
            String json = mapper.writeValueAsString(response);
            log(">>> " + json);
            out.print(json + "\n");
            out.flush();
        } catch (IOException e) {
            log("Failed to send response: " + e.getMessage());
        }
    }
}
