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

import java.io.IOException;
import java.io.InputStream;

/**
 * Потоковый сканер поверх скомпилированного автомата.
 *
 * Вход подаётся последовательными чанками произвольной длины; паттерн, разрезанный
 * границей чанка, находится благодаря курсору, который переносится между вызовами.
 * Ни один байт не обрабатывается повторно и не требуется заглядывание за границу чанка,
 * поэтому память ограничена размером чанка независимо от размера входа.
 *
 * Экземпляр не потокобезопасен: одно сканирование - один сканер.
 */
public final class StreamScanner {

    private final MatchAutomaton automaton;
    private final long[] counts;
    private final MatchSink counter;
    private ScanCursor cursor = ScanCursor.START;
    private OccurrenceTable result;

    public StreamScanner(MatchAutomaton automaton) {
        this.automaton = automaton;
        this.counts = new long[automaton.patterns().size()];
        this.counter = (patternIndex, end) -> counts[patternIndex]++;
    }

    /**
     * Подаёт очередной чанк.
     *
     * @return Курсор после чанка.
     * @throws IllegalStateException если сканирование уже завершено.
     */
    public ScanCursor feed(byte[] chunk) {
        return feed(chunk, 0, chunk.length);
    }

    public ScanCursor feed(byte[] chunk, int offset, int length) {
        if (result != null) {
            throw new IllegalStateException("Scan already finished at position " + cursor.position());
        }
        cursor = automaton.advance(cursor, chunk, offset, length, counter);
        return cursor;
    }

    /**
     * Завершает сканирование. Повторные вызовы возвращают ту же таблицу.
     */
    public OccurrenceTable finish() {
        if (result == null) {
            result = OccurrenceTable.of(automaton.patterns(), counts);
        }
        return result;
    }

    public ScanCursor cursor() {
        return cursor;
    }

    public boolean isFinished() {
        return result != null;
    }

    /**
     * Вычитывает поток целиком фиксированными чанками и возвращает итоговую таблицу.
     *
     * @param automaton Автомат.
     * @param input     Источник; не закрывается.
     * @param chunkSize Размер буфера чтения.
     * @throws IOException если чтение прервалось; частичный результат не возвращается.
     */
    public static OccurrenceTable scan(MatchAutomaton automaton, InputStream input, int chunkSize) throws IOException {
        StreamScanner scanner = new StreamScanner(automaton);
        byte[] buffer = new byte[chunkSize];
        int read;
        while ((read = input.read(buffer)) != -1) {
            scanner.feed(buffer, 0, read);
        }
        return scanner.finish();
    }
}
