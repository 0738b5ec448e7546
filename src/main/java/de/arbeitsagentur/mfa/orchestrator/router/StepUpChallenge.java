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

import de.arbeitsagentur.mfa.orchestrator.event.payload.GetPasswordEvent;

/**
 * Password re-authentication requested in the middle of a signing operation.
 *
 * @param userID        user to re-authenticate
 * @param challengeMode challenge mode to answer {@code setPassword} with
 * @param attemptsLeft  remaining attempts
 * @param status        evaluated error/status of the request
 * @param event         the originating event
 */
public record StepUpChallenge(
        String userID, int challengeMode, int attemptsLeft, ChallengeStatus status, GetPasswordEvent event) {

    static StepUpChallenge from(GetPasswordEvent event) {
        return new StepUpChallenge(
                event.userID(),
                event.challengeMode(),
                event.attemptsLeft(),
                ChallengeStatusEvaluator.evaluate(event.error(), event.status()),
                event);
    }
}
