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
import java.util.List;
import java.util.Optional;

/**
 * Nested challenge block of an authentication event.
 *
 * @param status         business outcome
 * @param session        session details, present once the user is logged in
 * @param additionalInfo additional info block, may be {@code null}
 * @param challengeInfo  open key/value bag, never {@code null} and without {@code null} entries after
 *                       construction
 */
public record ChallengeResponse(
        @JsonProperty("status") RdnaStatus status,
        @JsonProperty("session") RdnaSession session,
        @JsonProperty("additionalInfo") AdditionalInfo additionalInfo,
        @JsonProperty("challengeInfo") List<ChallengeInfoEntry> challengeInfo) {

    public ChallengeResponse {
        challengeInfo = PayloadChecks.nonNullElements(challengeInfo);
    }

    /** First value stored under {@code key}, if any. */
    public Optional<String> challengeValue(String key) {
        for (ChallengeInfoEntry entry : challengeInfo) {
            if (key.equals(entry.key())) {
                return Optional.ofNullable(entry.value());
            }
        }
        return Optional.empty();
    }
}
