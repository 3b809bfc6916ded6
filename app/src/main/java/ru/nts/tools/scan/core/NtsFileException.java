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

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input could not be opened or read. Fatal for the scan: no partial counts are returned.
 */
public class NtsFileException extends NtsException {

    public NtsFileException(NtsErrorCode code, String source) {
        super(code, Map.of("path", source));
    }

    public NtsFileException(NtsErrorCode code, String source, Throwable cause) {
        super(code, Map.of("path", source), cause);
    }

    private NtsFileException(NtsErrorCode code, Map<String, Object> context, Throwable cause) {
        super(code, context, cause);
    }

    /**
     * Factory: File not found
     */
    public static NtsFileException notFound(Path path) {
        return new NtsFileException(NtsErrorCode.FILE_NOT_FOUND, path.toString());
    }

    /**
     * Factory: Path exists but is not a regular file
     */
    public static NtsFileException notAFile(Path path) {
        return new NtsFileException(NtsErrorCode.NOT_A_FILE, path.toString());
    }

    /**
     * Maps an I/O failure on the given source to the closest error code.
     */
    public static NtsFileException readFailed(String source, IOException cause) {
        NtsErrorCode code;
        if (cause instanceof NoSuchFileException) {
            code = NtsErrorCode.FILE_NOT_FOUND;
        } else if (cause instanceof AccessDeniedException) {
            code = NtsErrorCode.FILE_NOT_READABLE;
        } else {
            code = NtsErrorCode.IO_ERROR;
        }
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("path", source);
        if (cause.getMessage() != null) {
            ctx.put("cause", cause.getMessage());
        }
        return new NtsFileException(code, ctx, cause);
    }
}
