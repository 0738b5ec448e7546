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

package de.arbeitsagentur.mfa.orchestrator.session;

/**
 * Countdown state handed to the UI for rendering.
 *
 * @param kind             idle, advisory or mandatory
 * @param secondsRemaining seconds left, zero unless advisory
 * @param canExtend        the extend action is offered
 * @param message          message from the SDK, may be {@code null}
 * @param extending        an extension request is in flight
 * @param visible          the modal is currently shown
 */
public record CountdownView(
        SessionTimeoutState.Kind kind,
        int secondsRemaining,
        boolean canExtend,
        String message,
        boolean extending,
        boolean visible) {}
