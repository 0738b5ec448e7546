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

/**
 * The SDK asks for the user to identify.
 *
 * @param recentLoggedInUser last user that logged in on this device, may be blank
 * @param rememberedUsers    users remembered on this device
 * @param challengeResponse  challenge block
 * @param error              API error block
 */
public record GetUserEvent(
        @JsonProperty("recentLoggedInUser") String recentLoggedInUser,
        @JsonProperty("rememberedUsers") List<String> rememberedUsers,
        @JsonProperty("challengeResponse") ChallengeResponse challengeResponse,
        @JsonProperty("error") RdnaError error)
        implements SdkEvent, ChallengeEvent {

    public GetUserEvent {
        rememberedUsers = PayloadChecks.nonNullElements(rememberedUsers);
    }

    @Override
    public String userID() {
        return recentLoggedInUser;
    }

    @Override
    public String eventName() {
        return SdkEventNames.GET_USER;
    }

    @Override
    public void validate() {
        PayloadChecks.requireChallengeEnvelope(this, eventName());
    }
}
