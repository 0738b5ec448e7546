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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Target screen plus the parameters it is rendered with.
 *
 * @param screen target screen
 * @param params screen parameters, unmodifiable; values may be {@code null}
 */
public record NavigationInstruction(Screen screen, Map<String, Object> params) {

    public NavigationInstruction {
        Objects.requireNonNull(screen, "screen");
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    /** Route actually navigated to: the parent navigator for nested screens. */
    public String routeName() {
        return screen.isNested() ? screen.parent().routeName() : screen.routeName();
    }

    /** Parameters for {@link #routeName()}, wrapping nested screens as {@code {screen, params}}. */
    public Map<String, Object> routeParams() {
        if (!screen.isNested()) {
            return params;
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("screen", screen.routeName());
        wrapped.put("params", params);
        return Collections.unmodifiableMap(wrapped);
    }

    public Object param(String name) {
        return params.get(name);
    }
}
