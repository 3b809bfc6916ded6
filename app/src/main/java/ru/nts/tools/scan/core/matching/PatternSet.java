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

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Набор различных литеральных паттернов для поиска.
 *
 * Паттерны хранятся в порядке первого появления; дубликаты схлопываются в одну запись,
 * поэтому индекс паттерна однозначно задаёт его значение. Каждый паттерн кодируется
 * в UTF-8, так как автомат работает над байтовым алфавитом. Кодировка фиксирована:
 * записи кэша адресуются текстом паттерна, и один текст всегда означает одни байты.
 */
public final class PatternSet {

    /**
     * Неизменяемый паттерн: исходный текст и его байтовое представление.
     */
    public record Pattern(int index, String text, byte[] bytes) {

        public int length() {
            return bytes.length;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Pattern other && index == other.index
                    && text.equals(other.text) && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode() {
            return 31 * text.hashCode() + index;
        }

        @Override
        public String toString() {
            return "#" + index + " '" + text + "'";
        }
    }

    private final List<Pattern> patterns;

    private PatternSet(List<Pattern> patterns) {
        this.patterns = Collections.unmodifiableList(patterns);
    }

    /**
     * Создаёт набор из паттернов в кодировке UTF-8.
     *
     * @throws NtsPatternException если список пуст или содержит пустой паттерн.
     */
    public static PatternSet of(String... patterns) {
        return of(Arrays.asList(patterns));
    }

    /**
     * Создаёт набор, кодируя каждый паттерн в UTF-8.
     * Непарные суррогаты не заменяются, а отклоняются.
     *
     * @param patterns Паттерны в порядке, заданном вызывающим.
     * @return Набор различных паттернов.
     * @throws NtsPatternException если список пуст, содержит пустой или некодируемый паттерн.
     */
    public static PatternSet of(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw NtsPatternException.emptySet();
        }
        CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);

        Map<String, Pattern> distinct = new LinkedHashMap<>();
        for (int i = 0; i < patterns.size(); i++) {
            String text = patterns.get(i);
            if (text == null || text.isEmpty()) {
                throw NtsPatternException.emptyPattern(i);
            }
            if (distinct.containsKey(text)) {
                continue;
            }
            byte[] bytes;
            try {
                ByteBuffer buffer = encoder.reset().encode(CharBuffer.wrap(text));
                bytes = new byte[buffer.remaining()];
                buffer.get(bytes);
            } catch (CharacterCodingException e) {
                throw NtsPatternException.unencodable(i, text, StandardCharsets.UTF_8.name());
            }
            distinct.put(text, new Pattern(distinct.size(), text, bytes));
        }
        return new PatternSet(new ArrayList<>(distinct.values()));
    }

    public int size() {
        return patterns.size();
    }

    /**
     * Паттерн по индексу, используемый при формировании отчёта о совпадениях.
     */
    public Pattern get(int index) {
        return patterns.get(index);
    }

    /**
     * Паттерны в порядке индексов (пары индекс/паттерн).
     */
    public List<Pattern> patterns() {
        return patterns;
    }

    public List<String> texts() {
        List<String> texts = new ArrayList<>(patterns.size());
        for (Pattern p : patterns) {
            texts.add(p.text());
        }
        return texts;
    }

    /**
     * Суммарная длина паттернов в байтах: верхняя граница числа состояний автомата минус корень.
     */
    public long totalLength() {
        long total = 0;
        for (Pattern p : patterns) {
            total += p.length();
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PatternSet other && texts().equals(other.texts());
    }

    @Override
    public int hashCode() {
        return texts().hashCode();
    }

    @Override
    public String toString() {
        return "PatternSet" + texts();
    }
}
