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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты ограничения путей корнем проекта.
 */
class PathSanitizerTest {

    @TempDir
    Path tempDir;

    private Path previousRoot;

    @BeforeEach
    void setUp() {
        previousRoot = PathSanitizer.getRoot();
        PathSanitizer.setRoot(tempDir);
    }

    @AfterEach
    void tearDown() {
        PathSanitizer.setRoot(previousRoot);
    }

    @Test
    void testRelativePathResolvedAgainstRoot() {
        Path root = tempDir.toAbsolutePath().normalize();

        assertEquals(root.resolve("logs/app.log"), PathSanitizer.sanitize("logs/app.log"));
        assertEquals(root.resolve("a.txt"), PathSanitizer.sanitize("dir/../a.txt"));
    }

    @Test
    void testBackslashesNormalized() {
        assertEquals(tempDir.toAbsolutePath().normalize().resolve("x/y.txt"), PathSanitizer.sanitize("x\\y.txt"));
    }

    @Test
    void testTraversalRejected() {
        assertThrows(SecurityException.class, () -> PathSanitizer.sanitize("../outside.txt"));
    }

    @Test
    void testAbsoluteOutsideRejected() {
        Path outside = tempDir.toAbsolutePath().getRoot().resolve("etc").resolve("passwd");

        assertThrows(SecurityException.class, () -> PathSanitizer.sanitize(outside.toString()));
    }

    @Test
    void testProtectedDirectoryRejected() {
        SecurityException e = assertThrows(SecurityException.class, () -> PathSanitizer.sanitize(".git/config"));
        assertTrue(e.getMessage().contains("protected"));
    }

    @Test
    void testIsProtected() {
        assertTrue(PathSanitizer.isProtected(Paths.get("a", ".nts", "b")));
        assertFalse(PathSanitizer.isProtected(Paths.get("a", ".gitignore")));
    }
}
