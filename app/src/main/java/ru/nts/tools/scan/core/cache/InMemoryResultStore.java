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

import ru.nts.tools.scan.core.matching.OccurrenceTable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Хранилище в памяти процесса. Используется в тестах и при отключённом файловом кэше.
 */
public class InMemoryResultStore implements ResultStore {

    private Map<String, OccurrenceTable> snapshot = new LinkedHashMap<>();
    private int saveCount;

    @Override
    public synchronized Map<String, OccurrenceTable> load() {
        return new LinkedHashMap<>(snapshot);
    }

    @Override
    public synchronized void save(Map<String, OccurrenceTable> entries) {
        snapshot = new LinkedHashMap<>(entries);
        saveCount++;
    }

    /**
     * Сколько раз хранилище было перезаписано.
     */
    public synchronized int saveCount() {
        return saveCount;
    }

    @Override
    public String describe() {
        return "memory";
    }
}
