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

import de.arbeitsagentur.mfa.orchestrator.event.MalformedEventException;

/**
 * Base interface for all decoded SDK events.
 *
 * <p>This is a sealed interface: every event name the orchestration layer understands maps to
 * exactly one record in this package.
 */
public sealed interface SdkEvent
        permits InitializeProgressEvent,
                InitializeErrorEvent,
                InitializedEvent,
                UserConsentThreatsEvent,
                TerminateWithThreatsEvent,
                GetUserEvent,
                GetActivationCodeEvent,
                GetUserConsentForLdaEvent,
                GetPasswordEvent,
                UserLoggedInEvent,
                UserLoggedOffEvent,
                CredentialsAvailableForUpdateEvent,
                UpdateCredentialResponseEvent,
                AddNewDeviceOptionsEvent,
                SessionTimeoutEvent,
                SessionTimeoutNotificationEvent,
                SessionExtensionResponseEvent,
                DataSigningResponseEvent {

    /** SDK event name this payload was delivered under. */
    String eventName();

    /**
     * Checks structural invariants that JSON decoding alone cannot express.
     *
     * @throws MalformedEventException if a required block is missing or a counter is negative
     */
    default void validate() {}
}
