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

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты структурированных ошибок.
 */
class NtsExceptionTest {

    @Test
    void testUserMessageLayout() {
        NtsException e = NtsFileException.notFound(Paths.get("logs", "app.log"));
        String path = Paths.get("logs", "app.log").toString();

        String message = e.toUserMessage();

        assertTrue(message.startsWith("[ERROR: FILE_NOT_FOUND]\nMessage: Input file not found\n"), message);
        assertTrue(message.contains("Solution: Check the input path '" + path + "'"), message);
        assertTrue(message.endsWith("Context: path=" + path), message);
        assertEquals(message, e.getMessage());
    }

    @Test
    void testUnresolvedPlaceholdersHidden() {
        String message = new NtsException(NtsErrorCode.PARAM_MISSING).toUserMessage();

        assertTrue(message.contains("parameter '...'"), message);
        assertFalse(message.contains("Context:"));
    }

    @Test
    void testLogMessageIsSingleLine() {
        NtsException e = NtsParamException.outOfRange("chunkSize", 0, 1, 64);

        assertEquals("[PARAM_OUT_OF_RANGE] Parameter out of range | parameter=chunkSize, value=0, min=1, max=64",
                e.toLogMessage());
    }

    @Test
    void testReadFailureMapping() {
        assertEquals(NtsErrorCode.FILE_NOT_FOUND,
                NtsFileException.readFailed("f", new NoSuchFileException("f")).getCode());
        assertEquals(NtsErrorCode.FILE_NOT_READABLE,
                NtsFileException.readFailed("f", new AccessDeniedException("f")).getCode());

        IOException cause = new IOException("device error");
        NtsFileException e = NtsFileException.readFailed("f", cause);
        assertEquals(NtsErrorCode.IO_ERROR, e.getCode());
        assertSame(cause, e.getCause());
        assertEquals("device error", e.getContext().get("cause"));
    }

    @Test
    void testCacheExceptionCarriesReason() {
        NtsCacheException e = new NtsCacheException("results.json", "root is ARRAY, expected object");

        assertEquals(NtsErrorCode.CACHE_CORRUPTED, e.getCode());
        assertTrue(e.toUserMessage().contains("(root is ARRAY, expected object)"));
    }
}
