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

import java.util.Optional;

/**
 * Common view over events that carry a challenge block ({@code error} + {@code challengeResponse}).
 */
public interface ChallengeEvent {

    String userID();

    RdnaError error();

    ChallengeResponse challengeResponse();

    /**
     * Selects the variant of the step being requested; zero for events without modes. Never
     * {@code null} on an event that passed {@link SdkEvent#validate()}.
     */
    default Integer challengeMode() {
        return 0;
    }

    default Integer attemptsLeft() {
        return 0;
    }

    default RdnaStatus status() {
        ChallengeResponse response = challengeResponse();
        return response == null ? null : response.status();
    }

    default Optional<String> challengeValue(String key) {
        ChallengeResponse response = challengeResponse();
        return response == null ? Optional.empty() : response.challengeValue(key);
    }
}
