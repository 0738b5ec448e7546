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

/** Screens the router can send the app to, with the route names the UI layer registers. */
public enum Screen {
    CHECK_USER("CheckUserScreen"),
    ACTIVATION_CODE("ActivationCodeScreen"),
    USER_LDA_CONSENT("UserLDAConsentScreen"),
    VERIFY_PASSWORD("VerifyPasswordScreen"),
    SET_PASSWORD("SetPasswordScreen"),
    UPDATE_EXPIRY_PASSWORD("UpdateExpiryPasswordScreen"),
    VERIFY_AUTH("VerifyAuthScreen"),
    DATA_SIGNING_RESULT("DataSigningResult"),
    DASHBOARD_SHELL("DrawerNavigator"),
    DASHBOARD("Dashboard", DASHBOARD_SHELL),
    UPDATE_PASSWORD("UpdatePassword", DASHBOARD_SHELL);

    private final String routeName;
    private final Screen parent;

    Screen(String routeName) {
        this(routeName, null);
    }

    Screen(String routeName, Screen parent) {
        this.routeName = routeName;
        this.parent = parent;
    }

    public String routeName() {
        return routeName;
    }

    /** Enclosing navigator for nested screens, {@code null} for top-level ones. */
    public Screen parent() {
        return parent;
    }

    public boolean isNested() {
        return parent != null;
    }
}
