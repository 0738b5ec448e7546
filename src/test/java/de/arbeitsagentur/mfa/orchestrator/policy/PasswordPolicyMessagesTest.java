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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class PasswordPolicyMessagesTest {

    @Nested
    @DisplayName("Generated messages")
    class Generated {

        @Test
        void exactLength() {
            assertEquals("Must be exactly 8 characters long", PasswordPolicyMessages.fromJson("{\"minL\":8,\"maxL\":8}"));
        }

        @Test
        void lengthRange() {
            assertEquals(
                    "Must be between 8 and 16 characters long",
                    PasswordPolicyMessages.fromJson("{\"minL\":8,\"maxL\":16}"));
        }

        @Test
        void onlyMinimumOrMaximum() {
            assertEquals("Must be at least 6 characters long", PasswordPolicyMessages.fromJson("{\"minL\":6}"));
            assertEquals("Must be no more than 20 characters long", PasswordPolicyMessages.fromJson("{\"maxL\":20}"));
        }

        @Test
        void twoClausesJoinWithAnd() {
            assertEquals(
                    "Must contain at least 1 digit and must contain at least 1 uppercase letter",
                    PasswordPolicyMessages.fromJson("{\"minDg\":1,\"minUc\":1}"));
        }

        @Test
        void threeClausesUseSerialComma() {
            assertEquals(
                    "Must be at least 8 characters long, Must contain at least 2 digits, "
                            + "and cannot contain your username",
                    PasswordPolicyMessages.fromJson("{\"minL\":8,\"minDg\":2,\"UserIDcheck\":true}"));
        }

        @Test
        void everyConstraintIsDescribed() {
            PasswordPolicy policy = new PasswordPolicy(8, 16, 1, 1, 1, 1, "&%", 2, true, true, true, null);

            List<String> clauses = PasswordPolicyMessages.clauses(policy);

            assertEquals(
                    List.of(
                            "Must be between 8 and 16 characters long",
                            "Must contain at least 1 digit",
                            "Must contain at least 1 uppercase letter",
                            "Must contain at least 1 lowercase letter",
                            "Must contain at least 1 special character",
                            "Cannot contain these characters: &%",
                            "Cannot have more than 2 repeated characters in a row",
                            "Cannot contain your username",
                            "Cannot contain sequential characters (e.g., 123, abc)",
                            "Cannot be a commonly used password"),
                    clauses);
        }

        @Test
        void emptyPolicyUsesGenericMessage() {
            assertEquals(PasswordPolicyMessages.GENERIC_MESSAGE, PasswordPolicyMessages.fromJson("{}"));
        }
    }

    @Nested
    @DisplayName("Server message and lenient parsing")
    class Parsing {

        @Test
        void serverMessageWinsVerbatim() {
            assertEquals(
                    "Use 8 characters incl. one digit",
                    PasswordPolicyMessages.fromJson("{\"minL\":8,\"msg\":\"Use 8 characters incl. one digit\"}"));
        }

        @Test
        void invalidPolicySentinelIsIgnored() {
            assertEquals(
                    "Must be at least 8 characters long",
                    PasswordPolicyMessages.fromJson("{\"minL\":8,\"msg\":\"Invalid password policy\"}"));
        }

        @Test
        void numericStringsAndStringFlagsAreAccepted() {
            assertEquals(
                    "Must be at least 10 characters long and cannot be a commonly used password",
                    PasswordPolicyMessages.fromJson("{\"minL\":\"10\",\"BlackListedCommonPassword\":\"TRUE\"}"));
        }

        @Test
        void nonNumericValuesMeanNoConstraint() {
            assertEquals(
                    PasswordPolicyMessages.GENERIC_MESSAGE,
                    PasswordPolicyMessages.fromJson("{\"minL\":\"eight\",\"SeqCheck\":\"yes\",\"minDg\":[1]}"));
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"{minL:8", "[1,2]", "42"})
        void unparseablePolicyUsesFallback(String json) {
            assertEquals(PasswordPolicyMessages.PARSE_FAILURE_MESSAGE, PasswordPolicyMessages.fromJson(json));
        }
    }
}
