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
 * Final result of an authenticate-and-sign request.
 *
 * @param dataPayload        payload that was signed
 * @param dataPayloadLength  payload length reported by the SDK
 * @param reason             reason shown to the user
 * @param payloadSignature   signature over the payload
 * @param dataSignatureID    server side signature identifier
 * @param authLevel          authentication level used
 * @param authenticationType authenticator used
 * @param status             business outcome
 * @param error              API error block
 */
public record DataSigningResponseEvent(
        @JsonProperty("dataPayload") String dataPayload,
        @JsonProperty("dataPayloadLength") int dataPayloadLength,
        @JsonProperty("reason") String reason,
        @JsonProperty("payloadSignature") String payloadSignature,
        @JsonProperty("dataSignatureID") String dataSignatureID,
        @JsonProperty("authLevel") int authLevel,
        @JsonProperty("authenticationType") int authenticationType,
        @JsonProperty("status") RdnaStatus status,
        @JsonProperty("error") RdnaError error)
        implements SdkEvent {

    @Override
    public String eventName() {
        return SdkEventNames.AUTHENTICATE_USER_AND_SIGN_DATA;
    }

    @Override
    public void validate() {
        PayloadChecks.requireError(error, eventName(), "error");
        PayloadChecks.requireStatus(status, eventName(), "status");
    }
}
