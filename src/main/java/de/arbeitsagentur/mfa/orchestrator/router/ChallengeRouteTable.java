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

import de.arbeitsagentur.mfa.orchestrator.event.payload.SdkEventNames;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * The router's transition table: {@code (eventName, challengeMode) -> rule}.
 *
 * <p>Lookup tries the exact {@code (eventName, mode)} key first, then {@code (eventName, ANY)}, then
 * the per-event fallback. The challenge mode therefore always wins over the event name.
 */
public final class ChallengeRouteTable {

    private static final Logger LOG = Logger.getLogger(ChallengeRouteTable.class);

    public static final int MODE_VERIFY = 0;
    public static final int MODE_SET = 1;
    public static final int MODE_UPDATE = 2;
    public static final int MODE_UPDATE_ON_EXPIRY = 4;
    public static final int MODE_LDA_TOGGLE_VERIFY = 5;
    public static final int MODE_STEP_UP_SIGNING = 12;
    public static final int MODE_LDA_TOGGLE_SET = 14;
    public static final int MODE_LDA_TOGGLE_VERIFY_ON_DISABLE = 15;
    public static final int MODE_LDA_TOGGLE_REVERIFY = 16;

    private final Map<RouteKey, RouteRule> rules;
    private final Map<String, RouteRule> fallbacks;

    private ChallengeRouteTable(Map<RouteKey, RouteRule> rules, Map<String, RouteRule> fallbacks) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
        this.fallbacks = Collections.unmodifiableMap(new LinkedHashMap<>(fallbacks));
    }

    public static ChallengeRouteTable standard() {
        return builder()
                .route(RouteKey.any(SdkEventNames.GET_USER), RouteRule.navigate(Screen.CHECK_USER))
                .route(RouteKey.any(SdkEventNames.GET_ACTIVATION_CODE), RouteRule.navigate(Screen.ACTIVATION_CODE))
                .route(RouteKey.any(SdkEventNames.GET_USER_CONSENT_FOR_LDA), RouteRule.navigate(Screen.USER_LDA_CONSENT))
                .route(password(MODE_VERIFY), RouteRule.navigate(Screen.VERIFY_PASSWORD))
                .route(password(MODE_SET), RouteRule.navigate(Screen.SET_PASSWORD))
                .route(password(MODE_UPDATE), RouteRule.navigate(Screen.UPDATE_PASSWORD))
                .route(password(MODE_UPDATE_ON_EXPIRY), RouteRule.navigate(Screen.UPDATE_EXPIRY_PASSWORD))
                .route(password(MODE_LDA_TOGGLE_VERIFY), RouteRule.navigate(Screen.VERIFY_PASSWORD))
                .route(password(MODE_STEP_UP_SIGNING), RouteRule.overlay())
                .route(password(MODE_LDA_TOGGLE_SET), RouteRule.navigate(Screen.SET_PASSWORD))
                .route(password(MODE_LDA_TOGGLE_VERIFY_ON_DISABLE), RouteRule.navigate(Screen.VERIFY_PASSWORD))
                .route(password(MODE_LDA_TOGGLE_REVERIFY), RouteRule.navigate(Screen.VERIFY_PASSWORD))
                .fallback(SdkEventNames.GET_PASSWORD, RouteRule.navigate(Screen.SET_PASSWORD))
                .route(RouteKey.any(SdkEventNames.USER_LOGGED_IN), RouteRule.navigate(Screen.DASHBOARD))
                .route(RouteKey.any(SdkEventNames.USER_LOGGED_OFF), RouteRule.none())
                .route(RouteKey.any(SdkEventNames.ADD_NEW_DEVICE_OPTIONS), RouteRule.navigate(Screen.VERIFY_AUTH))
                .build();
    }

    private static RouteKey password(int mode) {
        return RouteKey.of(SdkEventNames.GET_PASSWORD, mode);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Resolves the rule for an event, or empty when the event is not routed at all. */
    public Optional<RouteRule> resolve(String eventName, int challengeMode) {
        RouteRule exact = rules.get(RouteKey.of(eventName, challengeMode));
        if (exact != null) {
            return Optional.of(exact);
        }
        RouteRule any = rules.get(RouteKey.any(eventName));
        if (any != null) {
            return Optional.of(any);
        }
        RouteRule fallback = fallbacks.get(eventName);
        if (fallback != null) {
            LOG.warnf(
                    "No route for %s with challengeMode %d, falling back to %s",
                    eventName, challengeMode, fallback.screen());
            return Optional.of(fallback);
        }
        return Optional.empty();
    }

    public Map<RouteKey, RouteRule> rules() {
        return rules;
    }

    public static final class Builder {

        private final Map<RouteKey, RouteRule> rules = new LinkedHashMap<>();
        private final Map<String, RouteRule> fallbacks = new LinkedHashMap<>();

        private Builder() {}

        public Builder route(RouteKey key, RouteRule rule) {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(rule, "rule");
            if (rules.putIfAbsent(key, rule) != null) {
                throw new IllegalStateException("Duplicate route for " + key);
            }
            return this;
        }

        public Builder fallback(String eventName, RouteRule rule) {
            fallbacks.put(Objects.requireNonNull(eventName, "eventName"), Objects.requireNonNull(rule, "rule"));
            return this;
        }

        public ChallengeRouteTable build() {
            return new ChallengeRouteTable(rules, fallbacks);
        }
    }
}
