/*
 * Copyright 2026 Bundesagentur für Arbeit
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

package de.arbeitsagentur.mfa.orchestrator.sdk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import de.arbeitsagentur.mfa.orchestrator.event.payload.RdnaError;
import de.arbeitsagentur.mfa.orchestrator.util.SdkJson;

/**
 * Synchronous result of submitting a command.
 *
 * @param command  command name
 * @param error    API error block
 * @param response optional response body of read-style commands, {@code null} otherwise
 */
public record CommandAcknowledgement(String command, RdnaError error, String response) {

    public boolean accepted() {
        return error != null && !error.hasError();
    }

    static CommandAcknowledgement parse(String command, String json) throws JsonProcessingException {
        JsonNode root = SdkJson.MAPPER.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("acknowledgement is not an object");
        }
        JsonNode errorNode = root.get("error");
        if (errorNode == null || !errorNode.isObject()) {
            throw new IllegalArgumentException("acknowledgement has no error block");
        }
        RdnaError error = SdkJson.MAPPER.treeToValue(errorNode, RdnaError.class);
        if (error.longErrorCode() == null) {
            throw new IllegalArgumentException("acknowledgement error block has no longErrorCode");
        }
        JsonNode responseNode = root.get("response");
        String response = responseNode == null || responseNode.isNull()
                ? null
                : responseNode.isTextual() ? responseNode.asText() : responseNode.toString();
        return new CommandAcknowledgement(command, error, response);
    }
}
