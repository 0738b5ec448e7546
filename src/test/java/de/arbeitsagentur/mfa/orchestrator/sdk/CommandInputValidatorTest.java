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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class CommandInputValidatorTest {

    @Nested
    @DisplayName("requireBoundedText")
    class BoundedText {

        @Test
        void acceptsPlainText() {
            assertEquals("alice", CommandInputValidator.requireBoundedText("alice", 10, "userID"));
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "\t"})
        void rejectsMissing(String value) {
            IllegalArgumentException ex = assertThrows(
                    IllegalArgumentException.class, () -> CommandInputValidator.requireBoundedText(value, 10, "userID"));
            assertEquals("Missing field: userID", ex.getMessage());
        }

        @Test
        void rejectsTooLong() {
            IllegalArgumentException ex = assertThrows(
                    IllegalArgumentException.class,
                    () -> CommandInputValidator.requireBoundedText("x".repeat(11), 10, "userID"));
            assertEquals("Field too long: userID", ex.getMessage());
        }

        @ParameterizedTest
        @ValueSource(strings = {"ali\u0000ce", "alice\n", "a\u007Fb"})
        void rejectsControlCharacters(String value) {
            IllegalArgumentException ex = assertThrows(
                    IllegalArgumentException.class, () -> CommandInputValidator.requireBoundedText(value, 10, "userID"));
            assertEquals("Invalid characters in field: userID", ex.getMessage());
        }
    }

    @Nested
    @DisplayName("Secrets and numbers")
    class SecretsAndNumbers {

        @Test
        void secretsKeepWhitespace() {
            assertEquals("  pass  ", CommandInputValidator.requireSecret("  pass  ", 20, "password"));
        }

        @Test
        void emptySecretIsMissing() {
            assertThrows(IllegalArgumentException.class, () -> CommandInputValidator.requireSecret("", 20, "password"));
        }

        @Test
        void optionalTextMayBeNull() {
            assertNull(CommandInputValidator.optionalBoundedText(null, 10, "userID"));
            assertThrows(
                    IllegalArgumentException.class,
                    () -> CommandInputValidator.optionalBoundedText("x".repeat(11), 10, "userID"));
        }

        @Test
        void negativeNumbersAreRejected() {
            assertEquals(0, CommandInputValidator.requireNonNegative(0, "challengeMode"));
            IllegalArgumentException ex = assertThrows(
                    IllegalArgumentException.class, () -> CommandInputValidator.requireNonNegative(-3, "challengeMode"));
            assertEquals("Negative field: challengeMode", ex.getMessage());
        }
    }
}
