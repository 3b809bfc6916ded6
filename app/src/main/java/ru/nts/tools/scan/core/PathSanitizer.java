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

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Set;

/**
 * Ограничивает пути, переданные через MCP, корнем проекта.
 * Путь, выходящий за пределы корня, отклоняется до какого-либо чтения.
 */
public class PathSanitizer {

    /**
     * Текущий корень рабочей директории. Все операции должны ограничиваться этим путем.
     */
    private static volatile Path root = Paths.get(".").toAbsolutePath().normalize();

    /**
     * Служебные каталоги, содержимое которых не сканируется.
     */
    private static final Set<String> PROTECTED_NAMES = Set.of(".git", ".nts");

    /**
     * Переопределяет корень проекта.
     * Используется при старте сервера (PROJECT_ROOT) и в модульных тестах.
     *
     * @param newRoot Новый путь, который будет считаться корнем "песочницы".
     */
    public static void setRoot(Path newRoot) {
        root = newRoot.toAbsolutePath().normalize();
    }

    public static Path getRoot() {
        return root;
    }

    /**
     * Выполняет санитарную проверку и нормализацию пути.
     *
     * @param requestedPath Путь (абсолютный, относительный или содержащий '..').
     * @return Абсолютный нормализованный путь внутри корня.
     * @throws SecurityException Если путь ведет за пределы корня или в служебный каталог.
     */
    public static Path sanitize(String requestedPath) {
        // Предварительная нормализация разделителей для Windows
        String normalizedRequest = requestedPath.replace('\\', '/');
        Path requested = Paths.get(normalizedRequest);
        Path current = root;

        Path target = requested.isAbsolute()
                ? requested.toAbsolutePath().normalize()
                : current.resolve(normalizedRequest).toAbsolutePath().normalize();

        // Проверка Path Traversal: итоговый путь обязан начинаться с префикса корня
        if (!target.startsWith(current)) {
            throw new SecurityException("Access denied: path is outside of working directory: "
                    + requestedPath + " (Root: " + current + ")");
        }
        if (isProtected(current.relativize(target))) {
            throw new SecurityException("Access denied: " + requestedPath + " is inside a protected directory.");
        }
        return target;
    }

    /**
     * Проверяет все сегменты пути на совпадение с защищенными именами.
     */
    public static boolean isProtected(Path path) {
        for (Path part : path) {
            if (PROTECTED_NAMES.contains(part.toString())) {
                return true;
            }
        }
        return false;
    }
}
