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
 * Transport/API error block carried by most SDK events and every command acknowledgement.
 *
 * <p>{@code longErrorCode == 0} is the only reliable "no API error" signal. It says nothing about
 * whether the business operation itself succeeded; see {@link RdnaStatus}.
 *
 * @param longErrorCode  detailed error code, zero when the call reached the server cleanly, {@code null} when
 *                       the SDK left it out
 * @param shortErrorCode coarse error code
 * @param errorString    human-readable error description
 */
public record RdnaError(
        @JsonProperty("longErrorCode") Integer longErrorCode,
        @JsonProperty("shortErrorCode") int shortErrorCode,
        @JsonProperty("errorString") String errorString) {

    public static final RdnaError NONE = new RdnaError(0, 0, "");

    /** A block without a {@code longErrorCode} is never read as "no error". */
    public boolean hasError() {
        return longErrorCode == null || longErrorCode != 0;
    }
}
