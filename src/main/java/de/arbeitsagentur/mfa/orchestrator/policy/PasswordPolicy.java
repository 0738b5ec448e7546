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

package de.arbeitsagentur.mfa.orchestrator.policy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import de.arbeitsagentur.mfa.orchestrator.util.SdkJson;
import java.util.Locale;

/**
 * Password composition rules as delivered by the server under the {@code RELID_PASSWORD_POLICY}
 * challenge-info key.
 *
 * <p>Numeric fields {@code <= 0} mean "no constraint". The server is loose with types (numbers as
 * strings, flags as {@code "true"} strings), so fields are read leniently from the JSON tree.
 *
 * @param minLength                minimum length ({@code minL})
 * @param maxLength                maximum length ({@code maxL})
 * @param minDigits                minimum digits ({@code minDg})
 * @param minUpper                 minimum uppercase letters ({@code minUc})
 * @param minLower                 minimum lowercase letters ({@code minLc})
 * @param minSpecial               minimum special characters ({@code minSc})
 * @param disallowedChars          characters that must not appear ({@code charsNotAllowed})
 * @param maxRepeat                maximum repeated characters in a row ({@code Repetition})
 * @param disallowUserIDInPassword password must not contain the user id ({@code UserIDcheck})
 * @param disallowSequential       no sequential characters ({@code SeqCheck})
 * @param disallowCommonPassword   no blacklisted common passwords ({@code BlackListedCommonPassword})
 * @param serverMessage            server supplied wording ({@code msg}), may be {@code null}
 */
public record PasswordPolicy(
        int minLength,
        int maxLength,
        int minDigits,
        int minUpper,
        int minLower,
        int minSpecial,
        String disallowedChars,
        int maxRepeat,
        boolean disallowUserIDInPassword,
        boolean disallowSequential,
        boolean disallowCommonPassword,
        String serverMessage) {

    /**
     * Parses the policy document.
     *
     * @throws JsonProcessingException if the text is not JSON
     * @throws IllegalArgumentException if the document is not a JSON object
     */
    public static PasswordPolicy parse(String json) throws JsonProcessingException {
        if (json == null) {
            throw new IllegalArgumentException("policy document is null");
        }
        JsonNode root = SdkJson.MAPPER.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("policy document is not an object");
        }
        return new PasswordPolicy(
                intField(root, "minL"),
                intField(root, "maxL"),
                intField(root, "minDg"),
                intField(root, "minUc"),
                intField(root, "minLc"),
                intField(root, "minSc"),
                textField(root, "charsNotAllowed"),
                intField(root, "Repetition"),
                flag(root, "UserIDcheck"),
                flag(root, "SeqCheck"),
                flag(root, "BlackListedCommonPassword"),
                textField(root, "msg"));
    }

    private static int intField(JsonNode root, String name) {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            return 0;
        }
        if (node.isNumber()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException ignored) {
                // non-numeric text means no constraint
                return 0;
            }
        }
        return 0;
    }

    private static String textField(JsonNode root, String name) {
        JsonNode node = root.get(name);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }

    private static boolean flag(JsonNode root, String name) {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.isTextual() && "true".equals(node.asText().trim().toLowerCase(Locale.ROOT));
    }
}
