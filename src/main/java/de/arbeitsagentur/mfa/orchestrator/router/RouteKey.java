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
 * Key of the route table.
 *
 * @param eventName     SDK event name
 * @param challengeMode challenge mode, or {@link #ANY_MODE} to match every mode
 */
public record RouteKey(String eventName, int challengeMode) {

    public static final int ANY_MODE = Integer.MIN_VALUE;

    public RouteKey {
        Objects.requireNonNull(eventName, "eventName");
    }

    public static RouteKey of(String eventName, int challengeMode) {
        return new RouteKey(eventName, challengeMode);
    }

    public static RouteKey any(String eventName) {
        return new RouteKey(eventName, ANY_MODE);
    }

    public boolean matchesAnyMode() {
        return challengeMode == ANY_MODE;
    }
}
