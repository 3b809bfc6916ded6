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
 * Persisted result store is unreadable or malformed.
 * Never fatal: the cache is dropped and the scan proceeds without it.
 */
public class NtsCacheException extends NtsException {

    public NtsCacheException(String store, String reason) {
        this(store, reason, null);
    }

    public NtsCacheException(String store, String reason, Throwable cause) {
        super(NtsErrorCode.CACHE_CORRUPTED, context(store, reason), cause);
    }

    private static Map<String, Object> context(String store, String reason) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("path", store);
        ctx.put("reason", reason);
        return ctx;
    }
}
