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

package de.arbeitsagentur.mfa.orchestrator.router;

import de.arbeitsagentur.mfa.orchestrator.event.payload.RdnaError;
import de.arbeitsagentur.mfa.orchestrator.event.payload.RdnaStatus;
import de.arbeitsagentur.mfa.orchestrator.util.OrchestratorConstants;

/**
 * Checks the API error first and the business status second. A zero error code alone is never
 * treated as success.
 */
public final class ChallengeStatusEvaluator {

    static final String UNKNOWN_ERROR = "Unknown error occurred";

    private ChallengeStatusEvaluator() {}

    public static ChallengeStatus evaluate(RdnaError error, RdnaStatus status) {
        if (error != null && error.hasError()) {
            int errorCode = error.longErrorCode() == null ? -1 : error.longErrorCode();
            return new ChallengeStatus(false, true, false, false, false, errorCode, messageOr(error.errorString()));
        }
        if (status == null || status.statusCode() == null) {
            return new ChallengeStatus(false, false, true, false, true, -1, UNKNOWN_ERROR);
        }
        int statusCode = status.statusCode();
        if (OrchestratorConstants.SUCCESS_STATUS_CODES.contains(statusCode)) {
            return new ChallengeStatus(true, false, false, false, false, statusCode, "");
        }
        boolean severe = OrchestratorConstants.DESTRUCTIVE_STATUS_CODES.contains(statusCode);
        return new ChallengeStatus(false, false, true, severe, true, statusCode, messageOr(status.statusMessage()));
    }

    public static boolean isSuccess(RdnaError error, RdnaStatus status) {
        return evaluate(error, status).success();
    }

    private static String messageOr(String message) {
        return message == null || message.isBlank() ? UNKNOWN_ERROR : message;
    }
}
