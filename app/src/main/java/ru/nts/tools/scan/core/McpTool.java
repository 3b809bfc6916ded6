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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Инструмент, доступный MCP клиенту через 'tools/call'.
 */
public interface McpTool {

    String getName();

    String getDescription();

    String getCategory();

    JsonNode getInputSchema();

    JsonNode execute(JsonNode params) throws Exception;

    /**
     * Обертка над execute: любая ошибка превращается в результат с isError=true,
     * чтобы клиент получил диагностику, а не разрыв JSON-RPC обмена.
     */
    default JsonNode executeWithFeedback(JsonNode params) {
        try {
            return execute(params);
        } catch (NtsException e) {
            return createErrorResponse(e.getCode().name(), e.toUserMessage());
        } catch (IllegalArgumentException e) {
            return createErrorResponse("INVALID_ARGUMENTS", "Invalid request parameters: " + e.getMessage());
        } catch (SecurityException e) {
            return createErrorResponse("SECURITY_VIOLATION", "Security policy violation: " + e.getMessage());
        } catch (java.io.IOException e) {
            return createErrorResponse("SYSTEM_ERROR", "System I/O error: " + e.getMessage());
        } catch (Exception e) {
            return createErrorResponse("INTERNAL_BUG", "Internal server error: " + e);
        }
    }

    private JsonNode createErrorResponse(String type, String message) {
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode res = mapper.createObjectNode();
        res.putArray("content").addObject().put("type", "text").put("text", "Error [" + type + "]: " + message);
        res.put("isError", true);
        return res;
    }
}
