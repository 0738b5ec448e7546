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

import java.util.List;

/**
 * Threats severe enough that the SDK terminates the app.
 *
 * <p>The SDK delivers this event as a bare JSON array of threats.
 *
 * @param threats reported threats, in SDK order
 */
public record TerminateWithThreatsEvent(List<ThreatInfo> threats) implements SdkEvent {

    public TerminateWithThreatsEvent {
        // a null threat entry rejects the whole list
        threats = threats == null ? null : List.copyOf(threats);
    }

    @Override
    public String eventName() {
        return SdkEventNames.TERMINATE_WITH_THREATS;
    }

    @Override
    public void validate() {
        PayloadChecks.require(threats, eventName(), "threats");
    }
}
