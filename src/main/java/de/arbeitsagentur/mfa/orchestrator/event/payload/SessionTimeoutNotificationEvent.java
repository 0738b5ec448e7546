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
 * Advisory idle-timeout warning with an optional extend action.
 *
 * @param userID                user owning the session
 * @param message               message to show the user
 * @param timeLeftInSeconds     seconds until the session expires
 * @param sessionCanBeExtended  {@code 1} when the session may be extended
 * @param info                  session details
 */
public record SessionTimeoutNotificationEvent(
        @JsonProperty("userID") String userID,
        @JsonProperty("message") String message,
        @JsonProperty("timeLeftInSeconds") Integer timeLeftInSeconds,
        @JsonProperty("sessionCanBeExtended") int sessionCanBeExtended,
        @JsonProperty("info") SessionInfo info)
        implements SdkEvent {

    public record SessionInfo(
            @JsonProperty("sessionType") int sessionType,
            @JsonProperty("currentWorkFlow") String currentWorkFlow) {}

    public boolean canExtend() {
        return sessionCanBeExtended == 1;
    }

    @Override
    public String eventName() {
        return SdkEventNames.SESSION_TIMEOUT_NOTIFICATION;
    }

    @Override
    public void validate() {
        PayloadChecks.requireNonNegative(timeLeftInSeconds, eventName(), "timeLeftInSeconds");
    }
}
