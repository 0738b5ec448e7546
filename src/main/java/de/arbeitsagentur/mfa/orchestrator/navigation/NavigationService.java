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

package de.arbeitsagentur.mfa.orchestrator.navigation;

import java.util.Map;
import java.util.Optional;

/**
 * The UI layer's navigation stack, treated as a black box.
 *
 * <p>Route names are plain strings; nested routes are addressed by navigating to the parent with
 * {@code {screen: child, params: {...}}}.
 */
public interface NavigationService {

    boolean isReady();

    /** Name of the innermost route currently presented. */
    Optional<String> currentRouteName();

    void navigate(String routeName, Map<String, Object> params);

    /** Replaces the parameters of the current route in place. */
    void setParams(Map<String, Object> params);

    /** Resets the whole stack to a single route. */
    void reset(String routeName);
}
