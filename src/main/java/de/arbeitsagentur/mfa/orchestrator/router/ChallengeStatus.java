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

package de.arbeitsagentur.mfa.orchestrator.router;

/**
 * Outcome of checking a challenge payload's error and status blocks, in that order.
 *
 * @param success          no API error and a success status
 * @param apiError         {@code error.longErrorCode != 0}
 * @param statusError      API call fine, but the status code is outside the success range
 * @param severe           status code that ends the flow (expired password, exhausted attempts, policy violation)
 * @param clearCredentials credential inputs on the screen must be cleared
 * @param code             the code that decided the outcome (long error code or status code)
 * @param message          message to show inline, empty on success
 */
public record ChallengeStatus(
        boolean success,
        boolean apiError,
        boolean statusError,
        boolean severe,
        boolean clearCredentials,
        int code,
        String message) {}
