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

public final class CommandInputValidator {

    static final int MAX_USER_ID_LENGTH = 256;
    static final int MAX_SECRET_LENGTH = 512;
    static final int MAX_CODE_LENGTH = 128;
    static final int MAX_SIGNING_PAYLOAD_LENGTH = 65536;

    private CommandInputValidator() {}

    public static String require(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing field: " + fieldName);
        }
        return value;
    }

    public static void requireMaxLength(String value, int maxLength, String fieldName) {
        if (value == null) {
            return;
        }
        if (value.length() > maxLength) {
            throw new IllegalArgumentException("Field too long: " + fieldName);
        }
    }

    public static String requireBoundedText(String value, int maxLength, String fieldName) {
        String normalized = require(value, fieldName);
        requireMaxLength(normalized, maxLength, fieldName);
        requireNoControlCharacters(normalized, fieldName);
        return normalized;
    }

    public static String optionalBoundedText(String value, int maxLength, String fieldName) {
        if (value == null) {
            return null;
        }
        requireMaxLength(value, maxLength, fieldName);
        requireNoControlCharacters(value, fieldName);
        return value;
    }

    /** Secrets keep their exact characters; only presence and length are checked. */
    public static String requireSecret(String value, int maxLength, String fieldName) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Missing field: " + fieldName);
        }
        requireMaxLength(value, maxLength, fieldName);
        return value;
    }

    public static int requireNonNegative(int value, String fieldName) {
        if (value < 0) {
            throw new IllegalArgumentException("Negative field: " + fieldName);
        }
        return value;
    }

    private static void requireNoControlCharacters(String value, String fieldName) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isISOControl(value.charAt(i))) {
                throw new IllegalArgumentException("Invalid characters in field: " + fieldName);
            }
        }
    }
}
