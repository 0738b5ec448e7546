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
 * A single threat reported by the SDK's runtime threat detection.
 *
 * @param threatId                 numeric threat identifier
 * @param threatName               display name
 * @param threatMsg                description shown to the user
 * @param threatCategory           e.g. {@code SYSTEM}, {@code APP}, {@code NETWORK}
 * @param threatSeverity           e.g. {@code LOW}, {@code HIGH}
 * @param configuredAction         action configured on the server
 * @param shouldProceedWithThreats {@code 1} when the user may continue
 * @param rememberActionForSession {@code 1} when the decision is remembered
 */
public record ThreatInfo(
        @JsonProperty("threatId") int threatId,
        @JsonProperty("threatName") String threatName,
        @JsonProperty("threatMsg") String threatMsg,
        @JsonProperty("threatCategory") String threatCategory,
        @JsonProperty("threatSeverity") String threatSeverity,
        @JsonProperty("configuredAction") String configuredAction,
        @JsonProperty("shouldProceedWithThreats") int shouldProceedWithThreats,
        @JsonProperty("rememberActionForSession") int rememberActionForSession) {}
