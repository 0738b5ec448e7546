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
 * The SDK offers ways to activate this device through an already activated one.
 *
 * @param userID           user being activated
 * @param newDeviceOptions activation options offered by the server
 * @param challengeInfo    auxiliary key/value bag
 */
public record AddNewDeviceOptionsEvent(
        @JsonProperty("userID") String userID,
        @JsonProperty("newDeviceOptions") List<String> newDeviceOptions,
        @JsonProperty("challengeInfo") List<ChallengeInfoEntry> challengeInfo)
        implements SdkEvent {

    public AddNewDeviceOptionsEvent {
        newDeviceOptions = PayloadChecks.nonNullElements(newDeviceOptions);
        challengeInfo = PayloadChecks.nonNullElements(challengeInfo);
    }

    @Override
    public String eventName() {
        return SdkEventNames.ADD_NEW_DEVICE_OPTIONS;
    }
}
