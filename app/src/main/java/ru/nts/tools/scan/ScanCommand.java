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
package ru.nts.tools.scan;

import ru.nts.tools.scan.core.EncodingUtils;
import ru.nts.tools.scan.core.NtsException;
import ru.nts.tools.scan.core.NtsFileException;
import ru.nts.tools.scan.core.NtsParamException;
import ru.nts.tools.scan.core.ScanConfig;
import ru.nts.tools.scan.core.ScanOutcome;
import ru.nts.tools.scan.core.ScanService;
import ru.nts.tools.scan.core.ScanSource;
import ru.nts.tools.scan.core.matching.PatternSet;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Режим командной строки: одно сканирование файла с выводом счётчиков.
 *
 * <pre>
 * nts-scan &lt;file&gt; &lt;pattern&gt;... [--patterns-file F] [--cache F] [--no-cache] [--chunk-size N]
 * </pre>
 */
public final class ScanCommand {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    static final String USAGE = """
            Usage: nts-scan <file> <pattern>... [options]

            Counts occurrences of every literal pattern in <file> in a single pass.
            Results are cached by SHA-256 of the file content.

            Options:
              --patterns-file <f>  read additional patterns from <f>, one per line
              --cache <f>          result cache file (default: $NTS_SCAN_CACHE or results.json)
              --no-cache           do not read or update the result cache
              --chunk-size <n>     read buffer size in bytes (default: 1048576)
              -h, --help           show this help
            """;

    private ScanCommand() {
    }

    /**
     * Разобранные аргументы.
     */
    record Options(Path file, List<String> patterns, Path patternsFile, Path cacheFile,
                   boolean useCache, Integer chunkSize) {
    }

    /**
     * Выполняет команду.
     *
     * @return Код завершения процесса.
     */
    public static int run(String[] args, Map<String, String> env, PrintStream out, PrintStream err) {
        long start = System.nanoTime();
        Options options;
        try {
            options = parse(args);
        } catch (NtsParamException e) {
            err.println("Error: " + e.toUserMessage());
            err.println();
            err.print(USAGE);
            return EXIT_USAGE;
        }
        if (options == null) {
            out.print(USAGE);
            return EXIT_OK;
        }

        try {
            ScanConfig config = ScanConfig.fromEnvironment(env);
            if (options.cacheFile() != null) {
                config = config.withCacheFile(options.cacheFile());
            }
            if (options.chunkSize() != null) {
                config = config.withChunkSize(options.chunkSize());
            }

            PatternSet patterns = PatternSet.of(collectPatterns(options));
            ScanService service = ScanService.create(config);
            ScanOutcome outcome = service.scan(ScanSource.ofFile(options.file()), patterns, options.useCache());

            if (outcome.cached()) {
                out.println("File " + options.file() + " already processed. Retrieved results from storage.");
            }
            outcome.table().asMap().forEach((pattern, count) ->
                    out.println(pattern + " : " + count + " occurrences!"));
            out.println();
            out.println(String.format(Locale.ROOT, "real    %.3fs", (System.nanoTime() - start) / 1e9));
            return EXIT_OK;
        } catch (NtsException e) {
            err.println("Error: " + e.toUserMessage());
            return EXIT_FAILURE;
        }
    }

    private static List<String> collectPatterns(Options options) {
        List<String> patterns = new ArrayList<>(options.patterns());
        if (options.patternsFile() != null) {
            try {
                patterns.addAll(EncodingUtils.readNonBlankLines(options.patternsFile()));
            } catch (IOException e) {
                throw NtsFileException.readFailed(options.patternsFile().toString(), e);
            }
        }
        return patterns;
    }

    /**
     * Разбирает аргументы. Всё, что не является опцией, - файл и затем паттерны;
     * после {@code --} опции не распознаются (для паттернов, начинающихся с дефиса).
     *
     * @return null, если запрошена справка.
     * @throws NtsParamException при ошибке использования.
     */
    static Options parse(String[] args) {
        Path file = null;
        List<String> patterns = new ArrayList<>();
        Path patternsFile = null;
        Path cacheFile = null;
        boolean useCache = true;
        Integer chunkSize = null;
        boolean optionsEnded = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!optionsEnded && arg.startsWith("-") && arg.length() > 1) {
                switch (arg) {
                    case "-h", "--help" -> {
                        return null;
                    }
                    case "--" -> optionsEnded = true;
                    case "--no-cache" -> useCache = false;
                    case "--patterns-file" -> patternsFile = Paths.get(value(args, ++i, arg));
                    case "--cache" -> cacheFile = Paths.get(value(args, ++i, arg));
                    case "--chunk-size" -> chunkSize = ScanConfig.parseChunkSize(arg, value(args, ++i, arg));
                    default -> throw NtsParamException.invalid("option", arg, "one of --patterns-file, --cache, --no-cache, --chunk-size");
                }
                continue;
            }
            if (file == null) {
                file = Paths.get(arg);
            } else {
                patterns.add(arg);
            }
        }

        if (file == null) {
            throw NtsParamException.missing("file");
        }
        if (patterns.isEmpty() && patternsFile == null) {
            throw NtsParamException.missing("pattern");
        }
        return new Options(file, patterns, patternsFile, cacheFile, useCache, chunkSize);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw NtsParamException.missing(option);
        }
        return args[index];
    }
}
