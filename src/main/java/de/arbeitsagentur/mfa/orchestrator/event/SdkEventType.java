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

package de.arbeitsagentur.mfa.orchestrator.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import de.arbeitsagentur.mfa.orchestrator.event.payload.AddNewDeviceOptionsEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.CredentialsAvailableForUpdateEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.DataSigningResponseEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.GetActivationCodeEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.GetPasswordEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.GetUserConsentForLdaEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.GetUserEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.InitializeErrorEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.InitializeProgressEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.InitializedEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.SdkEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.SdkEventNames;
import de.arbeitsagentur.mfa.orchestrator.event.payload.SessionExtensionResponseEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.SessionTimeoutEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.SessionTimeoutNotificationEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.TerminateWithThreatsEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.ThreatInfo;
import de.arbeitsagentur.mfa.orchestrator.event.payload.UpdateCredentialResponseEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.UserConsentThreatsEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.UserLoggedInEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.UserLoggedOffEvent;
import de.arbeitsagentur.mfa.orchestrator.util.SdkJson;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed key for one SDK event name.
 *
 * <p>Each key knows the record its payload decodes into, so the registry can hand handlers a
 * fully typed event and never a half-parsed JSON tree.
 *
 * @param <T> payload record
 */
public final class SdkEventType<T extends SdkEvent> {

    @FunctionalInterface
    interface PayloadDecoder<T> {
        T decode(String rawPayload) throws JsonProcessingException;
    }

    private static final TypeReference<List<ThreatInfo>> THREAT_LIST = new TypeReference<>() {};

    private static final Map<String, SdkEventType<?>> BY_NAME = new LinkedHashMap<>();

    public static final SdkEventType<InitializeProgressEvent> INITIALIZE_PROGRESS =
            object(SdkEventNames.INITIALIZE_PROGRESS, InitializeProgressEvent.class);
    public static final SdkEventType<InitializeErrorEvent> INITIALIZE_ERROR =
            object(SdkEventNames.INITIALIZE_ERROR, InitializeErrorEvent.class);
    public static final SdkEventType<InitializedEvent> INITIALIZED =
            object(SdkEventNames.INITIALIZED, InitializedEvent.class);
    public static final SdkEventType<UserConsentThreatsEvent> USER_CONSENT_THREATS = register(
            SdkEventNames.USER_CONSENT_THREATS,
            UserConsentThreatsEvent.class,
            raw -> new UserConsentThreatsEvent(SdkJson.MAPPER.readValue(raw, THREAT_LIST)));
    public static final SdkEventType<TerminateWithThreatsEvent> TERMINATE_WITH_THREATS = register(
            SdkEventNames.TERMINATE_WITH_THREATS,
            TerminateWithThreatsEvent.class,
            raw -> new TerminateWithThreatsEvent(SdkJson.MAPPER.readValue(raw, THREAT_LIST)));
    public static final SdkEventType<GetUserEvent> GET_USER = object(SdkEventNames.GET_USER, GetUserEvent.class);
    public static final SdkEventType<GetActivationCodeEvent> GET_ACTIVATION_CODE =
            object(SdkEventNames.GET_ACTIVATION_CODE, GetActivationCodeEvent.class);
    public static final SdkEventType<GetUserConsentForLdaEvent> GET_USER_CONSENT_FOR_LDA =
            object(SdkEventNames.GET_USER_CONSENT_FOR_LDA, GetUserConsentForLdaEvent.class);
    public static final SdkEventType<GetPasswordEvent> GET_PASSWORD =
            object(SdkEventNames.GET_PASSWORD, GetPasswordEvent.class);
    public static final SdkEventType<UserLoggedInEvent> USER_LOGGED_IN =
            object(SdkEventNames.USER_LOGGED_IN, UserLoggedInEvent.class);
    public static final SdkEventType<UserLoggedOffEvent> USER_LOGGED_OFF =
            object(SdkEventNames.USER_LOGGED_OFF, UserLoggedOffEvent.class);
    public static final SdkEventType<CredentialsAvailableForUpdateEvent> CREDENTIALS_AVAILABLE_FOR_UPDATE =
            object(SdkEventNames.CREDENTIALS_AVAILABLE_FOR_UPDATE, CredentialsAvailableForUpdateEvent.class);
    public static final SdkEventType<UpdateCredentialResponseEvent> UPDATE_CREDENTIAL_RESPONSE =
            object(SdkEventNames.UPDATE_CREDENTIAL_RESPONSE, UpdateCredentialResponseEvent.class);
    public static final SdkEventType<AddNewDeviceOptionsEvent> ADD_NEW_DEVICE_OPTIONS =
            object(SdkEventNames.ADD_NEW_DEVICE_OPTIONS, AddNewDeviceOptionsEvent.class);
    public static final SdkEventType<SessionTimeoutEvent> SESSION_TIMEOUT =
            object(SdkEventNames.SESSION_TIMEOUT, SessionTimeoutEvent.class);
    public static final SdkEventType<SessionTimeoutNotificationEvent> SESSION_TIMEOUT_NOTIFICATION =
            object(SdkEventNames.SESSION_TIMEOUT_NOTIFICATION, SessionTimeoutNotificationEvent.class);
    public static final SdkEventType<SessionExtensionResponseEvent> SESSION_EXTENSION_RESPONSE =
            object(SdkEventNames.SESSION_EXTENSION_RESPONSE, SessionExtensionResponseEvent.class);
    public static final SdkEventType<DataSigningResponseEvent> AUTHENTICATE_USER_AND_SIGN_DATA =
            object(SdkEventNames.AUTHENTICATE_USER_AND_SIGN_DATA, DataSigningResponseEvent.class);

    private final String name;
    private final Class<T> payloadType;
    private final PayloadDecoder<T> decoder;

    private SdkEventType(String name, Class<T> payloadType, PayloadDecoder<T> decoder) {
        this.name = name;
        this.payloadType = payloadType;
        this.decoder = decoder;
    }

    private static <T extends SdkEvent> SdkEventType<T> object(String name, Class<T> payloadType) {
        return register(name, payloadType, raw -> SdkJson.MAPPER.readValue(raw, payloadType));
    }

    private static <T extends SdkEvent> SdkEventType<T> register(
            String name, Class<T> payloadType, PayloadDecoder<T> decoder) {
        SdkEventType<T> type = new SdkEventType<>(name, payloadType, decoder);
        BY_NAME.put(name, type);
        return type;
    }

    public static Optional<SdkEventType<?>> byName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public static Collection<SdkEventType<?>> values() {
        return Collections.unmodifiableCollection(BY_NAME.values());
    }

    public String name() {
        return name;
    }

    public Class<T> payloadType() {
        return payloadType;
    }

    /**
     * Decodes and validates a raw payload.
     *
     * @throws MalformedEventException if the JSON does not match the payload record or fails validation
     */
    public T decode(String rawPayload) {
        if (rawPayload == null || rawPayload.isBlank()) {
            throw new MalformedEventException(name, "empty payload");
        }
        T event;
        try {
            event = decoder.decode(rawPayload);
        } catch (JsonProcessingException ex) {
            throw new MalformedEventException(name, "cannot decode payload: " + ex.getOriginalMessage(), ex);
        } catch (RuntimeException ex) {
            throw new MalformedEventException(name, "cannot decode payload: " + ex.getMessage(), ex);
        }
        if (event == null) {
            throw new MalformedEventException(name, "payload is null");
        }
        event.validate();
        return event;
    }

    @Override
    public String toString() {
        return name;
    }
}
