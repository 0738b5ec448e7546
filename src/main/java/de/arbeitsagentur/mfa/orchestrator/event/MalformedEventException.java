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

package de.arbeitsagentur.mfa.orchestrator.event;

/** Raised when an SDK payload cannot be decoded into its event record or fails validation. */
public class MalformedEventException extends RuntimeException {

    private final String eventName;

    public MalformedEventException(String eventName, String message) {
        super(eventName + ": " + message);
        this.eventName = eventName;
    }

    public MalformedEventException(String eventName, String message, Throwable cause) {
        super(eventName + ": " + message, cause);
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }
}
