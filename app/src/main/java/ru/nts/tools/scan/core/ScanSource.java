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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Перечитываемый источник входных байтов.
 * Каждый вызов {@link #open()} отдаёт поток с начала содержимого.
 */
public interface ScanSource {

    /**
     * Идентификатор для сообщений (путь файла и т.п.).
     */
    String id();

    InputStream open() throws IOException;

    static ScanSource ofFile(Path path) {
        return new FileSource(path);
    }

    static ScanSource ofBytes(String id, byte[] content) {
        return new BytesSource(id, content);
    }

    /**
     * Файл на диске. Существование проверяется при каждом открытии.
     */
    record FileSource(Path path) implements ScanSource {

        @Override
        public String id() {
            return path.toString();
        }

        @Override
        public InputStream open() throws IOException {
            if (!Files.exists(path)) {
                throw NtsFileException.notFound(path);
            }
            if (!Files.isRegularFile(path)) {
                throw NtsFileException.notAFile(path);
            }
            return FileUtils.safeOpen(path);
        }
    }

    record BytesSource(String id, byte[] content) implements ScanSource {

        @Override
        public InputStream open() {
            return new ByteArrayInputStream(content);
        }
    }
}
