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

import ru.nts.tools.scan.core.NtsCacheException;
import ru.nts.tools.scan.core.matching.OccurrenceTable;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Кэш результатов, адресуемый содержимым: {@link ContentDigest} -> {@link OccurrenceTable}.
 *
 * Жизненный цикл: полная загрузка из хранилища при создании, изменения в памяти,
 * полная перезапись хранилища при {@link #flush()} (последняя запись побеждает).
 * Повреждённое хранилище не является ошибкой: кэш стартует пустым.
 *
 * Экземпляр не потокобезопасен; параллельные сканирования должны сериализовать
 * вызовы {@link #store} и {@link #flush}.
 */
public class ResultCache {

    private final ResultStore store;
    private final Map<String, OccurrenceTable> entries;

    private ResultCache(ResultStore store, Map<String, OccurrenceTable> entries) {
        this.store = store;
        this.entries = entries;
    }

    /**
     * Загружает кэш из хранилища.
     */
    public static ResultCache load(ResultStore store) {
        Map<String, OccurrenceTable> entries;
        try {
            entries = new LinkedHashMap<>(store.load());
        } catch (NtsCacheException e) {
            System.err.println("Warning: " + e.toLogMessage() + ". Starting with an empty cache.");
            entries = new LinkedHashMap<>();
        }
        return new ResultCache(store, entries);
    }

    /**
     * Кэш без файла: живёт только в памяти процесса.
     */
    public static ResultCache inMemory() {
        return load(new InMemoryResultStore());
    }

    public Optional<OccurrenceTable> lookup(ContentDigest digest) {
        return Optional.ofNullable(entries.get(digest.hex()));
    }

    /**
     * Вставляет или перезаписывает запись в памяти. На диск попадает только после {@link #flush()}.
     */
    public void store(ContentDigest digest, OccurrenceTable table) {
        entries.put(digest.hex(), table);
    }

    /**
     * Перезаписывает хранилище всем содержимым кэша.
     */
    public void flush() throws IOException {
        store.save(Collections.unmodifiableMap(entries));
    }

    public boolean contains(ContentDigest digest) {
        return entries.containsKey(digest.hex());
    }

    public int size() {
        return entries.size();
    }

    public Map<String, OccurrenceTable> entries() {
        return Collections.unmodifiableMap(entries);
    }

    public ResultStore backingStore() {
        return store;
    }
}
