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
import ru.nts.tools.scan.core.NtsErrorCode;
import ru.nts.tools.scan.core.NtsPatternException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты построения автомата: бор, суффиксные ссылки, множества допуска, тотальность переходов.
 */
class MatchAutomatonTest {

    private static int walk(MatchAutomaton automaton, String prefix) {
        int state = MatchAutomaton.ROOT;
        for (byte b : prefix.getBytes(StandardCharsets.UTF_8)) {
            state = automaton.next(state, b);
        }
        return state;
    }

    // ==================== Бор ====================

    @Test
    void testSharedPrefixesShareStates() {
        // he, hers, his, she: h, he, her, hers, hi, his, s, sh, she + root
        MatchAutomaton automaton = MatchAutomaton.compile(PatternSet.of("he", "hers", "his", "she"));

        assertEquals(10, automaton.stateCount());
        assertEquals(2, automaton.depth(walk(automaton, "he")));
        assertEquals(4, automaton.depth(walk(automaton, "hers")));
    }

    @Test
    void testStateCountBoundedByTotalLength() {
        PatternSet set = PatternSet.of("abc", "xyz", "pqrs");
        MatchAutomaton automaton = MatchAutomaton.compile(set);

        assertEquals(set.totalLength() + 1, automaton.stateCount());
    }

    // ==================== Суффиксные ссылки ====================

    @Test
    void testFailureLinks() {
        MatchAutomaton automaton = MatchAutomaton.compile(PatternSet.of("he", "hers", "his", "she"));

        int she = walk(automaton, "she");
        int he = walk(automaton, "he");
        int sh = walk(automaton, "sh");
        int h = walk(automaton, "h");

        assertEquals(he, automaton.failure(she));
        assertEquals(h, automaton.failure(sh));
        assertEquals(MatchAutomaton.ROOT, automaton.failure(h));
        assertEquals(MatchAutomaton.ROOT, automaton.failure(MatchAutomaton.ROOT));
    }

    // ==================== Множества допуска ====================

    @Test
    void testAcceptSetsIncludeSuffixPatterns() {
        PatternSet set = PatternSet.of("he", "she", "hers");
        MatchAutomaton automaton = MatchAutomaton.compile(set);

        int[] atShe = automaton.accepting(walk(automaton, "she"));
        Arrays.sort(atShe);
        assertArrayEquals(new int[]{0, 1}, atShe);

        assertArrayEquals(new int[]{0}, automaton.accepting(walk(automaton, "he")));
        assertArrayEquals(new int[0], automaton.accepting(walk(automaton, "sh")));
        assertArrayEquals(new int[0], automaton.accepting(MatchAutomaton.ROOT));
    }

    @Test
    void testAcceptingReturnsCopy() {
        MatchAutomaton automaton = MatchAutomaton.compile(PatternSet.of("a"));
        int state = walk(automaton, "a");

        automaton.accepting(state)[0] = 42;

        assertArrayEquals(new int[]{0}, automaton.accepting(state));
    }

    // ==================== Тотальность ====================

    @Test
    void testTransitionFunctionIsTotal() {
        MatchAutomaton automaton = MatchAutomaton.compile(PatternSet.of("abc", "bcd", "ÿ"));

        for (int state = 0; state < automaton.stateCount(); state++) {
            for (int symbol = 0; symbol < MatchAutomaton.ALPHABET; symbol++) {
                int next = automaton.next(state, symbol);
                assertTrue(next >= 0 && next < automaton.stateCount(),
                        "state " + state + " symbol " + symbol + " -> " + next);
            }
        }
    }

    @Test
    void testMissingEdgeFallsBackThroughFailureLink() {
        MatchAutomaton automaton = MatchAutomaton.compile(PatternSet.of("abc", "bcd"));

        // После "abc" символ 'd' продолжает "bcd" через суффиксную ссылку abc -> bc
        int abc = walk(automaton, "abc");
        assertEquals(walk(automaton, "bcd"), automaton.next(abc, 'd'));
        // Неизвестный символ из корня остаётся в корне
        assertEquals(MatchAutomaton.ROOT, automaton.next(MatchAutomaton.ROOT, 'z'));
    }

    // ==================== Шаг advance ====================

    @Test
    void testAdvanceReportsMatchesInEndOrder() {
        MatchAutomaton automaton = MatchAutomaton.compile(PatternSet.of("a", "ab"));
        List<String> events = new ArrayList<>();

        ScanCursor cursor = automaton.advance(ScanCursor.START, "xaby".getBytes(StandardCharsets.UTF_8),
                (index, end) -> events.add(index + "@" + end));

        assertEquals(List.of("0@2", "1@3"), events);
        assertEquals(4, cursor.position());
    }

    @Test
    void testAdvanceRespectsOffsetAndLength() {
        MatchAutomaton automaton = MatchAutomaton.compile(PatternSet.of("aa"));
        byte[] buffer = "zzaaaazz".getBytes(StandardCharsets.UTF_8);
        List<Long> ends = new ArrayList<>();

        ScanCursor cursor = automaton.advance(ScanCursor.START, buffer, 2, 4, (index, end) -> ends.add(end));

        assertEquals(List.of(2L, 3L, 4L), ends);
        assertEquals(4, cursor.position());
    }

    @Test
    void testAdvanceRejectsForeignCursor() {
        MatchAutomaton automaton = MatchAutomaton.compile(PatternSet.of("a"));

        assertThrows(IllegalArgumentException.class,
                () -> automaton.advance(new ScanCursor(99, 0), new byte[1], MatchSink.IGNORE));
    }

    @Test
    void testAdvanceRejectsBadRange() {
        MatchAutomaton automaton = MatchAutomaton.compile(PatternSet.of("a"));

        assertThrows(IndexOutOfBoundsException.class,
                () -> automaton.advance(ScanCursor.START, new byte[4], 2, 3, MatchSink.IGNORE));
    }

    // ==================== Размер таблицы ====================

    @Test
    void testCapacityWithinLimit() {
        assertEquals(4, MatchAutomaton.checkCapacity(3));
        assertEquals(MatchAutomaton.MAX_TOTAL_LENGTH + 1, MatchAutomaton.checkCapacity(MatchAutomaton.MAX_TOTAL_LENGTH));
    }

    @Test
    void testOversizedPatternSetRejected() {
        long total = MatchAutomaton.MAX_TOTAL_LENGTH + 1;

        NtsPatternException e = assertThrows(NtsPatternException.class, () -> MatchAutomaton.checkCapacity(total));

        assertEquals(NtsErrorCode.PATTERN_SET_TOO_LARGE, e.getCode());
        assertEquals(total, e.getContext().get("total"));
        assertTrue(e.getMessage().contains("limit is " + MatchAutomaton.MAX_TOTAL_LENGTH + " bytes"), e.getMessage());
    }

    @Test
    void testHugeTotalLengthDoesNotOverflow() {
        assertThrows(NtsPatternException.class, () -> MatchAutomaton.checkCapacity(Integer.MAX_VALUE));
        assertThrows(NtsPatternException.class, () -> MatchAutomaton.checkCapacity(Long.MAX_VALUE - 1));
    }

    @Test
    void testAutomatonKeepsPatternSet() {
        PatternSet set = PatternSet.of("q");
        assertSame(set, MatchAutomaton.compile(set).patterns());
    }
}
