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
 * Result of {@code getAllChallenges}: credentials the logged-in user may update.
 *
 * @param userID  user the list belongs to
 * @param options credential types, e.g. {@code Password}
 * @param error   API error block
 */
public record CredentialsAvailableForUpdateEvent(
        @JsonProperty("userID") String userID,
        @JsonProperty("options") List<String> options,
        @JsonProperty("error") RdnaError error)
        implements SdkEvent {

    public CredentialsAvailableForUpdateEvent {
        options = PayloadChecks.nonNullElements(options);
    }

    @Override
    public String eventName() {
        return SdkEventNames.CREDENTIALS_AVAILABLE_FOR_UPDATE;
    }

    @Override
    public void validate() {
        PayloadChecks.requireError(error, eventName(), "error");
    }
}
