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
package ru.nts.tools.scan.core;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Настройки сканера, собираемые из переменных окружения.
 *
 * @param cacheFile Путь к JSON-хранилищу результатов ({@code NTS_SCAN_CACHE}).
 * @param chunkSize Размер чанка чтения в байтах ({@code NTS_SCAN_CHUNK_SIZE}).
 * @param root      Корень песочницы для путей инструментов ({@code PROJECT_ROOT}).
 * @param debug     Отладочный вывод в stderr ({@code MCP_DEBUG}).
 * @param logFile   Файл диагностического лога или null ({@code MCP_LOG_FILE}).
 */
public record ScanConfig(Path cacheFile, int chunkSize, Path root, boolean debug, Path logFile) {

    public static final String DEFAULT_CACHE_FILE = "results.json";
    public static final int DEFAULT_CHUNK_SIZE = 1024 * 1024;
    public static final int MIN_CHUNK_SIZE = 1;
    public static final int MAX_CHUNK_SIZE = 64 * 1024 * 1024;

    public ScanConfig {
        checkChunkSize(chunkSize);
        root = root.toAbsolutePath().normalize();
    }

    public static ScanConfig defaults() {
        return fromEnvironment(Map.of());
    }

    public static ScanConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Строит конфигурацию из карты переменных окружения.
     * Относительный путь кэша разрешается от корня проекта.
     *
     * @throws NtsParamException если размер чанка не число или вне допустимого диапазона.
     */
    public static ScanConfig fromEnvironment(Map<String, String> env) {
        String rootValue = env.get("PROJECT_ROOT");
        Path root = (rootValue != null && !rootValue.isBlank())
                ? Paths.get(rootValue)
                : Paths.get(".");
        root = root.toAbsolutePath().normalize();

        String cacheValue = env.getOrDefault("NTS_SCAN_CACHE", "");
        Path cacheFile = root.resolve(cacheValue.isBlank() ? DEFAULT_CACHE_FILE : cacheValue);

        int chunkSize = DEFAULT_CHUNK_SIZE;
        String chunkValue = env.get("NTS_SCAN_CHUNK_SIZE");
        if (chunkValue != null && !chunkValue.isBlank()) {
            chunkSize = parseChunkSize("NTS_SCAN_CHUNK_SIZE", chunkValue.trim());
        }

        boolean debug = "true".equalsIgnoreCase(env.get("MCP_DEBUG"));
        String logValue = env.get("MCP_LOG_FILE");
        Path logFile = (logValue != null && !logValue.isBlank()) ? Paths.get(logValue) : null;

        return new ScanConfig(cacheFile, chunkSize, root, debug, logFile);
    }

    public ScanConfig withCacheFile(Path cacheFile) {
        return new ScanConfig(cacheFile, chunkSize, root, debug, logFile);
    }

    public ScanConfig withChunkSize(int chunkSize) {
        return new ScanConfig(cacheFile, chunkSize, root, debug, logFile);
    }

    public ScanConfig withRoot(Path root) {
        return new ScanConfig(cacheFile, chunkSize, root, debug, logFile);
    }

    /**
     * Разбирает размер чанка из строки параметра.
     */
    public static int parseChunkSize(String parameter, String value) {
        int size;
        try {
            size = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw NtsParamException.invalid(parameter, value, "an integer number of bytes");
        }
        checkChunkSize(parameter, size);
        return size;
    }

    private static void checkChunkSize(int size) {
        checkChunkSize("chunkSize", size);
    }

    private static void checkChunkSize(String parameter, int size) {
        if (size < MIN_CHUNK_SIZE || size > MAX_CHUNK_SIZE) {
            throw NtsParamException.outOfRange(parameter, size, MIN_CHUNK_SIZE, MAX_CHUNK_SIZE);
        }
    }
}
