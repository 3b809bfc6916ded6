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

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты таблицы счётчиков: проекция, слияние, валидация.
 */
class OccurrenceTableTest {

    private static OccurrenceTable table(Object... pairs) {
        Map<String, Long> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], ((Number) pairs[i + 1]).longValue());
        }
        return OccurrenceTable.fromMap(map);
    }

    @Test
    void testCountOfAbsentPatternIsZero() {
        OccurrenceTable t = table("a", 3);

        assertEquals(3, t.count("a"));
        assertEquals(0, t.count("b"));
        assertFalse(t.contains("b"));
    }

    @Test
    void testProjectionToSubset() {
        OccurrenceTable t = table("a", 1, "b", 2, "c", 3);

        Optional<OccurrenceTable> projected = t.project(PatternSet.of("c", "a"));

        assertTrue(projected.isPresent());
        assertEquals(List.of("c", "a"), List.copyOf(projected.get().asMap().keySet()));
        assertEquals(3, projected.get().count("c"));
    }

    @Test
    void testProjectionFailsWhenPatternMissing() {
        OccurrenceTable t = table("a", 1);

        assertTrue(t.project(PatternSet.of("a", "b")).isEmpty());
        assertFalse(t.covers(List.of("a", "b")));
        assertTrue(t.covers(List.of("a")));
    }

    @Test
    void testMergePrefersNewerCounts() {
        OccurrenceTable older = table("a", 1, "b", 2);
        OccurrenceTable newer = table("b", 5, "c", 7);

        OccurrenceTable merged = older.mergedWith(newer);

        assertEquals(table("a", 1, "b", 5, "c", 7), merged);
        assertEquals(13, merged.total());
    }

    @Test
    void testZeroCountsAreKept() {
        OccurrenceTable t = table("never", 0);

        assertTrue(t.contains("never"));
        assertTrue(t.project(PatternSet.of("never")).isPresent());
    }

    @Test
    void testNegativeCountRejected() {
        assertThrows(IllegalArgumentException.class, () -> table("a", -1));
    }

    @Test
    void testEmptyKeyRejected() {
        assertThrows(IllegalArgumentException.class, () -> table("", 1));
    }

    @Test
    void testTableIsImmutable() {
        OccurrenceTable t = table("a", 1);
        assertThrows(UnsupportedOperationException.class, () -> t.asMap().put("b", 2L));
    }

    @Test
    void testBuiltFromScannerCounts() {
        PatternSet set = PatternSet.of("x", "y");
        OccurrenceTable t = OccurrenceTable.of(set, new long[]{4, 0});

        assertEquals(table("x", 4, "y", 0), t);
    }
}
