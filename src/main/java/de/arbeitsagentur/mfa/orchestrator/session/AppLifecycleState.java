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

import java.util.Locale;

/** App lifecycle states as reported by the platform. */
public enum AppLifecycleState {
    ACTIVE,
    BACKGROUND,
    INACTIVE;

    /** Timers are unreliable in both non-active states. */
    public boolean isBackgrounded() {
        return this != ACTIVE;
    }

    public static AppLifecycleState fromPlatform(String state) {
        if (state == null) {
            throw new IllegalArgumentException("Missing lifecycle state");
        }
        return switch (state.trim().toLowerCase(Locale.ROOT)) {
            case "active" -> ACTIVE;
            case "background" -> BACKGROUND;
            case "inactive" -> INACTIVE;
            default -> throw new IllegalArgumentException("Unknown lifecycle state: " + state);
        };
    }
}
