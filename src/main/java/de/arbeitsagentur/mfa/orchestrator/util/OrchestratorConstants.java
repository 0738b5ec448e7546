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

package de.arbeitsagentur.mfa.orchestrator.util;

import java.util.Set;

public final class OrchestratorConstants {

    private OrchestratorConstants() {}

    public static final String PASSWORD_POLICY_KEY = "RELID_PASSWORD_POLICY";
    public static final String LDA_CONSENT_MESSAGE_KEY = "LDA_CONSENT_MESSAGE";

    public static final int STATUS_SUCCESS = 100;
    public static final int STATUS_OK = 0;
    public static final Set<Integer> SUCCESS_STATUS_CODES = Set.of(STATUS_OK, STATUS_SUCCESS);

    public static final int STATUS_PASSWORD_EXPIRED = 110;
    public static final int STATUS_ATTEMPTS_EXHAUSTED = 153;
    public static final int STATUS_POLICY_VIOLATION = 190;
    public static final Set<Integer> DESTRUCTIVE_STATUS_CODES =
            Set.of(STATUS_PASSWORD_EXPIRED, STATUS_ATTEMPTS_EXHAUSTED, STATUS_POLICY_VIOLATION);

    public static final int SESSION_CAN_BE_EXTENDED = 1;

    public static final String DEFAULT_HOME_SCREEN = "TutorialHome";
    public static final String DEFAULT_EXPIRED_PASSWORD_SUBTITLE =
            "Your password has expired. Please update it to continue.";
}
