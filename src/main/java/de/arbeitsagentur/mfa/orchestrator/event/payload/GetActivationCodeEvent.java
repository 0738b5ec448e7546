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

package de.arbeitsagentur.mfa.orchestrator.event.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The SDK asks for the activation code sent out of band.
 *
 * @param userID            user being activated
 * @param verificationKey   key displayed next to the code input
 * @param attemptsLeft      remaining attempts
 * @param challengeResponse challenge block
 * @param error             API error block
 */
public record GetActivationCodeEvent(
        @JsonProperty("userID") String userID,
        @JsonProperty("verificationKey") String verificationKey,
        @JsonProperty("attemptsLeft") Integer attemptsLeft,
        @JsonProperty("challengeResponse") ChallengeResponse challengeResponse,
        @JsonProperty("error") RdnaError error)
        implements SdkEvent, ChallengeEvent {

    @Override
    public String eventName() {
        return SdkEventNames.GET_ACTIVATION_CODE;
    }

    @Override
    public void validate() {
        PayloadChecks.requireChallengeEnvelope(this, eventName());
        PayloadChecks.requireNonNegative(attemptsLeft, eventName(), "attemptsLeft");
    }
}
