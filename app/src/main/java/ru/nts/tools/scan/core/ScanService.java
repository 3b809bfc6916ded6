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

import ru.nts.tools.scan.core.cache.ContentDigest;
import ru.nts.tools.scan.core.cache.JsonResultStore;
import ru.nts.tools.scan.core.cache.ResultCache;
import ru.nts.tools.scan.core.matching.MatchAutomaton;
import ru.nts.tools.scan.core.matching.OccurrenceTable;
import ru.nts.tools.scan.core.matching.PatternSet;
import ru.nts.tools.scan.core.matching.StreamScanner;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Оркестратор: хеш входа -> поиск в кэше -> сканирование только при промахе -> запись в кэш.
 *
 * Попадание и промах дают одинаковые счётчики для одной пары (паттерны, вход):
 * кэш влияет только на то, выполняется ли работа повторно.
 *
 * Доступ к кэшу сериализован внутри сервиса, поэтому сервис можно вызывать из нескольких
 * потоков для разных входов. Скомпилированные автоматы переиспользуются между вызовами.
 */
public class ScanService {

    private static final int AUTOMATON_CACHE_SIZE = 16;

    private final ResultCache cache;
    private final int chunkSize;
    private final Object cacheLock = new Object();
    private final Map<PatternSet, MatchAutomaton> automata = Collections.synchronizedMap(
            new LinkedHashMap<>(AUTOMATON_CACHE_SIZE, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<PatternSet, MatchAutomaton> eldest) {
                    return size() > AUTOMATON_CACHE_SIZE;
                }
            });

    public ScanService(ResultCache cache, int chunkSize) {
        this.cache = cache;
        this.chunkSize = chunkSize;
    }

    /**
     * Сервис с файловым JSON-кэшем из конфигурации.
     */
    public static ScanService create(ScanConfig config) {
        return new ScanService(ResultCache.load(new JsonResultStore(config.cacheFile())), config.chunkSize());
    }

    public ScanOutcome scan(ScanSource source, PatternSet patterns) {
        return scan(source, patterns, true);
    }

    /**
     * Двухпроходный режим для перечитываемого источника.
     * Первый проход только хеширует; второй (при промахе) сканирует и хеширует повторно,
     * так что запись в кэш всегда ключуется хешем реально просканированных байтов.
     *
     * @param source   Источник.
     * @param patterns Паттерны.
     * @param useCache false - без поиска и записи в кэш.
     * @throws NtsFileException если источник не читается; частичный результат не возвращается.
     */
    public ScanOutcome scan(ScanSource source, PatternSet patterns, boolean useCache) {
        long start = System.nanoTime();
        if (useCache) {
            ContentDigest digest = digest(source);
            Optional<OccurrenceTable> hit = lookup(digest, patterns);
            if (hit.isPresent()) {
                return new ScanOutcome(source.id(), hit.get(), digest.hex(), true, 0, since(start));
            }
        }

        Pass pass;
        try (InputStream in = source.open()) {
            pass = scanAndDigest(in, patterns);
        } catch (IOException e) {
            throw NtsFileException.readFailed(source.id(), e);
        }
        if (useCache) {
            remember(pass.digest(), pass.table());
        }
        return new ScanOutcome(source.id(), pass.table(), pass.digest().hex(), false, pass.bytes(), since(start));
    }

    /**
     * Однопроходный режим для неперечитываемого потока: каждый чанк одновременно
     * хешируется и сканируется, результат затем сохраняется в кэш. Поток не закрывается.
     */
    public ScanOutcome scanOnce(InputStream input, String sourceId, PatternSet patterns, boolean useCache) {
        long start = System.nanoTime();
        Pass pass;
        try {
            pass = scanAndDigest(input, patterns);
        } catch (IOException e) {
            throw NtsFileException.readFailed(sourceId, e);
        }
        if (useCache) {
            remember(pass.digest(), pass.table());
        }
        return new ScanOutcome(sourceId, pass.table(), pass.digest().hex(), false, pass.bytes(), since(start));
    }

    /**
     * Хеширует источник без сканирования.
     */
    public ContentDigest digest(ScanSource source) {
        try (InputStream in = source.open()) {
            return ContentDigest.of(in, chunkSize);
        } catch (IOException e) {
            throw NtsFileException.readFailed(source.id(), e);
        }
    }

    /**
     * Автомат для набора; повторные запросы с тем же набором получают тот же экземпляр.
     */
    public MatchAutomaton automaton(PatternSet patterns) {
        return automata.computeIfAbsent(patterns, MatchAutomaton::compile);
    }

    public ResultCache cache() {
        return cache;
    }

    public int chunkSize() {
        return chunkSize;
    }

    private record Pass(OccurrenceTable table, ContentDigest digest, long bytes) {
    }

    private Pass scanAndDigest(InputStream in, PatternSet patterns) throws IOException {
        StreamScanner scanner = new StreamScanner(automaton(patterns));
        ContentDigest.Accumulator accumulator = ContentDigest.accumulator();
        byte[] buffer = new byte[chunkSize];
        int read;
        while ((read = in.read(buffer)) != -1) {
            accumulator.update(buffer, 0, read);
            scanner.feed(buffer, 0, read);
        }
        long bytes = accumulator.bytes();
        return new Pass(scanner.finish(), accumulator.finish(), bytes);
    }

    /**
     * Попадание только если запись содержит счётчик для каждого запрошенного паттерна.
     */
    private Optional<OccurrenceTable> lookup(ContentDigest digest, PatternSet patterns) {
        synchronized (cacheLock) {
            return cache.lookup(digest).flatMap(entry -> entry.project(patterns));
        }
    }

    /**
     * Сливает свежие счётчики с имеющейся записью и сбрасывает кэш на диск.
     * Ошибка записи не отменяет результат сканирования.
     */
    private void remember(ContentDigest digest, OccurrenceTable table) {
        synchronized (cacheLock) {
            OccurrenceTable merged = cache.lookup(digest)
                    .map(existing -> existing.mergedWith(table))
                    .orElse(table);
            cache.store(digest, merged);
            try {
                cache.flush();
            } catch (IOException e) {
                System.err.println("Warning: failed to persist result cache to "
                        + cache.backingStore().describe() + ": " + e.getMessage());
            }
        }
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
