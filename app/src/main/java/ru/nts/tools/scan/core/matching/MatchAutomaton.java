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

import ru.nts.tools.scan.core.NtsPatternException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Детерминированный автомат Ахо-Корасик над байтовым алфавитом.
 *
 * Состояния хранятся в плоских массивах и адресуются целым индексом: строка {@code delta}
 * длиной {@link #ALPHABET} на каждое состояние, массив суффиксных ссылок и массив
 * эффективных множеств допуска. Функция переходов тотальна, поэтому поиск никогда не
 * откатывается: ровно один переход на каждый входной байт, независимо от числа и длины паттернов.
 *
 * После построения автомат неизменяем и может разделяться между параллельными сканированиями.
 */
public final class MatchAutomaton {

    public static final int ROOT = 0;
    public static final int ALPHABET = 256;

    /**
     * Наибольшая суммарная длина паттернов в байтах, при которой таблица переходов
     * ещё адресуется одним массивом.
     */
    public static final long MAX_TOTAL_LENGTH = Integer.MAX_VALUE / ALPHABET - 1;

    private static final int[] NO_MATCHES = new int[0];

    private final PatternSet patterns;
    private final int stateCount;
    private final int[] delta;
    private final int[] failure;
    private final int[] depth;
    private final int[][] accepts;

    private MatchAutomaton(PatternSet patterns, int stateCount, int[] delta, int[] failure,
                           int[] depth, int[][] accepts) {
        this.patterns = patterns;
        this.stateCount = stateCount;
        this.delta = delta;
        this.failure = failure;
        this.depth = depth;
        this.accepts = accepts;
    }

    /**
     * Компилирует автомат из набора паттернов.
     * Набор уже валиден, поэтому построение не может завершиться ошибкой.
     *
     * @param patterns Набор паттернов.
     * @return Неизменяемый автомат.
     */
    public static MatchAutomaton compile(PatternSet patterns) {
        int capacity = checkCapacity(patterns.totalLength());
        int[] delta = new int[capacity * ALPHABET];
        Arrays.fill(delta, -1);
        int[] depth = new int[capacity];
        List<List<Integer>> own = new ArrayList<>(capacity);
        own.add(new ArrayList<>());
        int stateCount = 1;

        // 1. Бор: общие префиксы разделяют состояния
        for (PatternSet.Pattern pattern : patterns.patterns()) {
            int state = ROOT;
            for (byte b : pattern.bytes()) {
                int slot = state * ALPHABET + (b & 0xFF);
                if (delta[slot] < 0) {
                    delta[slot] = stateCount;
                    depth[stateCount] = depth[state] + 1;
                    own.add(new ArrayList<>());
                    stateCount++;
                }
                state = delta[slot];
            }
            own.get(state).add(pattern.index());
        }

        int[] failure = new int[stateCount];
        int[][] accepts = new int[stateCount][];
        accepts[ROOT] = NO_MATCHES;

        // 2-4. BFS: суффиксные ссылки, наследование допусков и достраивание переходов.
        // Ссылка всегда ведёт в более мелкое состояние, строка которого к этому моменту уже полная.
        int[] queue = new int[stateCount];
        int head = 0;
        int tail = 0;
        for (int c = 0; c < ALPHABET; c++) {
            int child = delta[c];
            if (child < 0) {
                delta[c] = ROOT;
            } else {
                failure[child] = ROOT;
                accepts[child] = merge(own.get(child), NO_MATCHES);
                queue[tail++] = child;
            }
        }
        while (head < tail) {
            int state = queue[head++];
            int row = state * ALPHABET;
            int fallbackRow = failure[state] * ALPHABET;
            for (int c = 0; c < ALPHABET; c++) {
                int child = delta[row + c];
                if (child < 0) {
                    delta[row + c] = delta[fallbackRow + c];
                } else {
                    int link = delta[fallbackRow + c];
                    failure[child] = link;
                    accepts[child] = merge(own.get(child), accepts[link]);
                    queue[tail++] = child;
                }
            }
        }

        if (stateCount < capacity) {
            delta = Arrays.copyOf(delta, stateCount * ALPHABET);
            depth = Arrays.copyOf(depth, stateCount);
        }
        return new MatchAutomaton(patterns, stateCount, delta, failure, depth, accepts);
    }

    /**
     * Число состояний, под которое резервируется таблица переходов.
     *
     * @throws NtsPatternException если таблица не помещается в один массив.
     */
    static int checkCapacity(long totalLength) {
        long capacity = totalLength + 1;
        try {
            Math.multiplyExact(Math.toIntExact(capacity), ALPHABET);
        } catch (ArithmeticException e) {
            throw NtsPatternException.tooLarge(totalLength, MAX_TOTAL_LENGTH);
        }
        return (int) capacity;
    }

    private static int[] merge(List<Integer> own, int[] inherited) {
        if (own.isEmpty()) {
            return inherited;
        }
        int[] merged = new int[own.size() + inherited.length];
        for (int i = 0; i < own.size(); i++) {
            merged[i] = own.get(i);
        }
        System.arraycopy(inherited, 0, merged, own.size(), inherited.length);
        return merged;
    }

    /**
     * Прогоняет чанк через автомат, начиная с переданного курсора.
     *
     * Каждое совпадение сообщается приёмнику в порядке окончания; совпадения разных
     * паттернов, оканчивающиеся в одной позиции, сообщаются каждое отдельно.
     *
     * @param cursor Курсор после предыдущего чанка ({@link ScanCursor#START} для начала потока).
     * @param chunk  Буфер с данными.
     * @param offset Начало данных в буфере.
     * @param length Количество байтов (может быть 0).
     * @param sink   Приёмник совпадений.
     * @return Курсор после чанка.
     */
    public ScanCursor advance(ScanCursor cursor, byte[] chunk, int offset, int length, MatchSink sink) {
        if (cursor.state() >= stateCount) {
            throw new IllegalArgumentException("Cursor state " + cursor.state()
                    + " does not belong to this automaton (" + stateCount + " states)");
        }
        if (offset < 0 || length < 0 || offset + length > chunk.length) {
            throw new IndexOutOfBoundsException("offset=" + offset + ", length=" + length
                    + ", buffer=" + chunk.length);
        }
        int state = cursor.state();
        long position = cursor.position();
        int end = offset + length;
        for (int i = offset; i < end; i++) {
            state = delta[state * ALPHABET + (chunk[i] & 0xFF)];
            position++;
            int[] matched = accepts[state];
            for (int patternIndex : matched) {
                sink.onMatch(patternIndex, position);
            }
        }
        return new ScanCursor(state, position);
    }

    public ScanCursor advance(ScanCursor cursor, byte[] chunk, MatchSink sink) {
        return advance(cursor, chunk, 0, chunk.length, sink);
    }

    /**
     * Переход по одному символу.
     */
    public int next(int state, int symbol) {
        return delta[state * ALPHABET + (symbol & 0xFF)];
    }

    public int failure(int state) {
        return failure[state];
    }

    /**
     * Длина префикса, которому соответствует состояние.
     */
    public int depth(int state) {
        return depth[state];
    }

    /**
     * Индексы паттернов, оканчивающихся в состоянии, с учётом цепочки суффиксных ссылок.
     */
    public int[] accepting(int state) {
        return accepts[state].clone();
    }

    public int stateCount() {
        return stateCount;
    }

    public PatternSet patterns() {
        return patterns;
    }
}
