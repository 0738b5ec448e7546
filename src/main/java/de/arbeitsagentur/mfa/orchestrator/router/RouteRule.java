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

import java.util.Objects;

/**
 * What to do for a {@link RouteKey}.
 *
 * @param screen target screen, {@code null} unless the action navigates
 * @param action routing action
 */
public record RouteRule(Screen screen, RouteAction action) {

    public RouteRule {
        Objects.requireNonNull(action, "action");
        if (action == RouteAction.NAVIGATE_OR_UPDATE && screen == null) {
            throw new IllegalArgumentException("navigating rule needs a screen");
        }
    }

    public static RouteRule navigate(Screen screen) {
        return new RouteRule(screen, RouteAction.NAVIGATE_OR_UPDATE);
    }

    public static RouteRule overlay() {
        return new RouteRule(null, RouteAction.OVERLAY);
    }

    public static RouteRule none() {
        return new RouteRule(null, RouteAction.NONE);
    }
}
