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
package ru.nts.tools.scan.core.matching;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Итоговые счётчики вхождений: паттерн -> неотрицательное число.
 *
 * Порядок записей совпадает с порядком паттернов в наборе. Таблица неизменяема;
 * её создаёт только {@link StreamScanner#finish()} либо загрузка из кэша.
 */
public final class OccurrenceTable {

    private final Map<String, Long> counts;

    private OccurrenceTable(Map<String, Long> counts) {
        this.counts = Collections.unmodifiableMap(counts);
    }

    static OccurrenceTable of(PatternSet patterns, long[] counts) {
        Map<String, Long> map = new LinkedHashMap<>();
        for (PatternSet.Pattern p : patterns.patterns()) {
            map.put(p.text(), counts[p.index()]);
        }
        return new OccurrenceTable(map);
    }

    /**
     * Восстанавливает таблицу из отображения (например, прочитанного из хранилища).
     *
     * @throws IllegalArgumentException если есть пустой паттерн или отрицательный счётчик.
     */
    public static OccurrenceTable fromMap(Map<String, Long> counts) {
        Map<String, Long> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Long> e : counts.entrySet()) {
            if (e.getKey() == null || e.getKey().isEmpty()) {
                throw new IllegalArgumentException("Empty pattern key");
            }
            if (e.getValue() == null || e.getValue() < 0) {
                throw new IllegalArgumentException("Invalid count for '" + e.getKey() + "': " + e.getValue());
            }
            copy.put(e.getKey(), e.getValue());
        }
        return new OccurrenceTable(copy);
    }

    /**
     * Счётчик паттерна или 0, если паттерн не входит в таблицу.
     */
    public long count(String pattern) {
        return counts.getOrDefault(pattern, 0L);
    }

    public boolean contains(String pattern) {
        return counts.containsKey(pattern);
    }

    public boolean covers(Collection<String> patterns) {
        return counts.keySet().containsAll(patterns);
    }

    /**
     * Сужает таблицу до паттернов набора в порядке набора.
     *
     * @return Пусто, если для какого-либо паттерна набора счётчика нет.
     */
    public Optional<OccurrenceTable> project(PatternSet patterns) {
        Map<String, Long> projected = new LinkedHashMap<>();
        for (String text : patterns.texts()) {
            Long value = counts.get(text);
            if (value == null) {
                return Optional.empty();
            }
            projected.put(text, value);
        }
        return Optional.of(new OccurrenceTable(projected));
    }

    /**
     * Объединяет с более свежей таблицей; при совпадении ключей побеждает {@code newer}.
     */
    public OccurrenceTable mergedWith(OccurrenceTable newer) {
        Map<String, Long> merged = new LinkedHashMap<>(counts);
        merged.putAll(newer.counts);
        return new OccurrenceTable(merged);
    }

    public long total() {
        long total = 0;
        for (long c : counts.values()) {
            total += c;
        }
        return total;
    }

    public int size() {
        return counts.size();
    }

    public Map<String, Long> asMap() {
        return counts;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof OccurrenceTable other && counts.equals(other.counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}
