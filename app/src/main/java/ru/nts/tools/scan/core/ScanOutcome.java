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

import ru.nts.tools.scan.core.matching.OccurrenceTable;

import java.time.Duration;

/**
 * Результат одного запуска сканирования.
 *
 * @param source  Идентификатор входа.
 * @param table   Счётчики для каждого запрошенного паттерна.
 * @param digest  Hex SHA-256 содержимого.
 * @param cached  true, если результат взят из кэша без сканирования.
 * @param bytes   Количество байтов, прочитанных сканером (0 при попадании в кэш).
 * @param elapsed Время выполнения.
 */
public record ScanOutcome(String source, OccurrenceTable table, String digest, boolean cached,
                          long bytes, Duration elapsed) {
}
