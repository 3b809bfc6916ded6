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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pattern list rejected before any automaton is built.
 */
public class NtsPatternException extends NtsException {

    private NtsPatternException(NtsErrorCode code, Map<String, Object> context) {
        super(code, context);
    }

    /**
     * Factory: Empty pattern list
     */
    public static NtsPatternException emptySet() {
        return new NtsPatternException(NtsErrorCode.PATTERN_SET_EMPTY, null);
    }

    /**
     * Factory: Empty pattern at the given position of the caller's list
     */
    public static NtsPatternException emptyPattern(int index) {
        return new NtsPatternException(NtsErrorCode.PATTERN_EMPTY, Map.of("index", index));
    }

    /**
     * Factory: Pattern has characters the target charset cannot represent
     */
    public static NtsPatternException unencodable(int index, String pattern, String charset) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("index", index);
        ctx.put("pattern", pattern);
        ctx.put("charset", charset);
        return new NtsPatternException(NtsErrorCode.PATTERN_UNENCODABLE, ctx);
    }

    /**
     * Factory: Total pattern length exceeds what the transition table can address
     */
    public static NtsPatternException tooLarge(long totalLength, long limit) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("total", totalLength);
        ctx.put("limit", limit);
        return new NtsPatternException(NtsErrorCode.PATTERN_SET_TOO_LARGE, ctx);
    }
}
