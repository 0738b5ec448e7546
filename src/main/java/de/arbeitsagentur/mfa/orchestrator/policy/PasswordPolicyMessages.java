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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.jboss.logging.Logger;

/** Turns a {@link PasswordPolicy} into the requirement sentence shown next to password inputs. */
public final class PasswordPolicyMessages {

    private static final Logger LOG = Logger.getLogger(PasswordPolicyMessages.class);

    public static final String INVALID_POLICY_SENTINEL = "Invalid password policy";
    public static final String GENERIC_MESSAGE = "Please enter a secure password";
    public static final String PARSE_FAILURE_MESSAGE =
            "Please enter a secure password according to your organization's policy";

    private PasswordPolicyMessages() {}

    /**
     * Parses the policy JSON and builds the message. Never throws.
     *
     * @param policyJson raw policy document, may be {@code null}
     * @return the requirement sentence, or {@link #PARSE_FAILURE_MESSAGE} if the document is unusable
     */
    public static String fromJson(String policyJson) {
        try {
            return generate(PasswordPolicy.parse(policyJson));
        } catch (Exception ex) {
            LOG.warnf("Failed to parse password policy: %s", ex.getMessage());
            return PARSE_FAILURE_MESSAGE;
        }
    }

    public static String generate(PasswordPolicy policy) {
        String serverMessage = policy.serverMessage();
        if (serverMessage != null && !serverMessage.isBlank() && !INVALID_POLICY_SENTINEL.equals(serverMessage)) {
            return serverMessage;
        }
        return join(clauses(policy));
    }

    static List<String> clauses(PasswordPolicy policy) {
        List<String> clauses = new ArrayList<>();

        int min = policy.minLength();
        int max = policy.maxLength();
        if (min > 0 && max > 0) {
            if (min == max) {
                clauses.add("Must be exactly " + min + " characters long");
            } else {
                clauses.add("Must be between " + min + " and " + max + " characters long");
            }
        } else if (min > 0) {
            clauses.add("Must be at least " + min + " characters long");
        } else if (max > 0) {
            clauses.add("Must be no more than " + max + " characters long");
        }

        addMinimum(clauses, policy.minDigits(), "digit");
        addMinimum(clauses, policy.minUpper(), "uppercase letter");
        addMinimum(clauses, policy.minLower(), "lowercase letter");
        addMinimum(clauses, policy.minSpecial(), "special character");

        String disallowed = policy.disallowedChars();
        if (disallowed != null && !disallowed.isBlank()) {
            clauses.add("Cannot contain these characters: " + disallowed);
        }
        if (policy.maxRepeat() > 0) {
            clauses.add("Cannot have more than " + policy.maxRepeat() + " repeated characters in a row");
        }
        if (policy.disallowUserIDInPassword()) {
            clauses.add("Cannot contain your username");
        }
        if (policy.disallowSequential()) {
            clauses.add("Cannot contain sequential characters (e.g., 123, abc)");
        }
        if (policy.disallowCommonPassword()) {
            clauses.add("Cannot be a commonly used password");
        }
        return clauses;
    }

    private static void addMinimum(List<String> clauses, int count, String noun) {
        if (count > 0) {
            clauses.add("Must contain at least " + count + " " + noun + (count > 1 ? "s" : ""));
        }
    }

    static String join(List<String> clauses) {
        if (clauses.isEmpty()) {
            return GENERIC_MESSAGE;
        }
        if (clauses.size() == 1) {
            return clauses.get(0);
        }
        if (clauses.size() == 2) {
            return clauses.get(0) + " and " + lower(clauses.get(1));
        }
        String last = clauses.get(clauses.size() - 1);
        return String.join(", ", clauses.subList(0, clauses.size() - 1)) + ", and " + lower(last);
    }

    private static String lower(String clause) {
        return clause.toLowerCase(Locale.ROOT);
    }
}
