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
import java.util.Map;

/**
 * Долговременное хранилище ключ-значение для кэша результатов.
 * Ключ - hex-строка {@link ContentDigest}, значение - таблица вхождений.
 */
public interface ResultStore {

    /**
     * Читает всё содержимое хранилища. Отсутствующее хранилище - пустой результат, не ошибка.
     *
     * @throws NtsCacheException если хранилище существует, но не читается или повреждено.
     */
    Map<String, OccurrenceTable> load();

    /**
     * Полностью перезаписывает хранилище переданным содержимым.
     */
    void save(Map<String, OccurrenceTable> entries) throws IOException;

    /**
     * Человекочитаемое описание (путь файла и т.п.) для сообщений об ошибках.
     */
    String describe();
}
