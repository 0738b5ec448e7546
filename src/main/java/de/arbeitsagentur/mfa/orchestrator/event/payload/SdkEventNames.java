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

package de.arbeitsagentur.mfa.orchestrator.event.payload;

/** Event names emitted by the SDK transport. */
public final class SdkEventNames {

    private SdkEventNames() {}

    public static final String INITIALIZE_PROGRESS = "onInitializeProgress";
    public static final String INITIALIZE_ERROR = "onInitializeError";
    public static final String INITIALIZED = "onInitialized";
    public static final String USER_CONSENT_THREATS = "onUserConsentThreats";
    public static final String TERMINATE_WITH_THREATS = "onTerminateWithThreats";
    public static final String GET_USER = "getUser";
    public static final String GET_ACTIVATION_CODE = "getActivationCode";
    public static final String GET_USER_CONSENT_FOR_LDA = "getUserConsentForLDA";
    public static final String GET_PASSWORD = "getPassword";
    public static final String USER_LOGGED_IN = "onUserLoggedIn";
    public static final String USER_LOGGED_OFF = "onUserLoggedOff";
    public static final String CREDENTIALS_AVAILABLE_FOR_UPDATE = "onCredentialsAvailableForUpdate";
    public static final String UPDATE_CREDENTIAL_RESPONSE = "onUpdateCredentialResponse";
    public static final String ADD_NEW_DEVICE_OPTIONS = "addNewDeviceOptions";
    public static final String SESSION_TIMEOUT = "onSessionTimeout";
    public static final String SESSION_TIMEOUT_NOTIFICATION = "onSessionTimeOutNotification";
    public static final String SESSION_EXTENSION_RESPONSE = "onSessionExtensionResponse";
    public static final String AUTHENTICATE_USER_AND_SIGN_DATA = "onAuthenticateUserAndSignData";
}
