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

package de.arbeitsagentur.mfa.orchestrator.sdk;

import de.arbeitsagentur.mfa.orchestrator.event.payload.RdnaError;

/** The SDK refused a command submission, or its acknowledgement could not be read. */
public class CommandRejectedException extends RuntimeException {

    private final String command;
    private final RdnaError error;

    public CommandRejectedException(String command, RdnaError error) {
        super(command + " rejected: " + describe(error));
        this.command = command;
        this.error = error;
    }

    public CommandRejectedException(String command, String message, Throwable cause) {
        super(command + " rejected: " + message, cause);
        this.command = command;
        this.error = null;
    }

    public String command() {
        return command;
    }

    /** Error block of the acknowledgement, {@code null} when the acknowledgement was unreadable. */
    public RdnaError error() {
        return error;
    }

    private static String describe(RdnaError error) {
        if (error == null) {
            return "no error block";
        }
        return error.errorString() + " (longErrorCode=" + error.longErrorCode() + ")";
    }
}
