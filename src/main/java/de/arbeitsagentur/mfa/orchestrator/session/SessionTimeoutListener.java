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
 * Receives session timeout updates. All methods have empty defaults. Called synchronously, must not
 * block.
 */
public interface SessionTimeoutListener {

    default void onStateChanged(CountdownView view) {}

    /** The advisory countdown reached zero. */
    default void onCountdownElapsed() {}

    default void onSessionExtended() {}

    /**
     * The extension request was rejected or answered unsuccessfully.
     *
     * @param message message to show in the modal
     */
    default void onExtensionFailed(String message) {}
}
