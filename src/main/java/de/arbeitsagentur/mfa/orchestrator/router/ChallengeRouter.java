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

import de.arbeitsagentur.mfa.orchestrator.event.EventDispatchRegistry;
import de.arbeitsagentur.mfa.orchestrator.event.SdkEventType;
import de.arbeitsagentur.mfa.orchestrator.event.payload.AddNewDeviceOptionsEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.AdditionalInfo;
import de.arbeitsagentur.mfa.orchestrator.event.payload.ChallengeEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.CredentialsAvailableForUpdateEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.DataSigningResponseEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.GetActivationCodeEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.GetPasswordEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.GetUserConsentForLdaEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.GetUserEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.InitializedEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.RdnaSession;
import de.arbeitsagentur.mfa.orchestrator.event.payload.RdnaStatus;
import de.arbeitsagentur.mfa.orchestrator.event.payload.SdkEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.UpdateCredentialResponseEvent;
import de.arbeitsagentur.mfa.orchestrator.event.payload.UserLoggedInEvent;
import de.arbeitsagentur.mfa.orchestrator.navigation.Navigator;
import de.arbeitsagentur.mfa.orchestrator.navigation.OverlayPresenter;
import de.arbeitsagentur.mfa.orchestrator.policy.PasswordPolicyMessages;
import de.arbeitsagentur.mfa.orchestrator.sdk.CommandAcknowledgement;
import de.arbeitsagentur.mfa.orchestrator.sdk.SdkCommandService;
import de.arbeitsagentur.mfa.orchestrator.util.OrchestratorConfig;
import de.arbeitsagentur.mfa.orchestrator.util.OrchestratorConstants;
import de.arbeitsagentur.mfa.orchestrator.util.SessionTokenLog;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.jboss.logging.Logger;

/**
 * Maps authentication events to navigation instructions.
 *
 * <p>{@link #route(SdkEvent)} is the pure transition function driven by the
 * {@link ChallengeRouteTable}; {@link #handle(SdkEvent)} routes and applies the decision. The router
 * registers itself as the base handler of its events through {@link #attach}, screens that need a
 * different behaviour acquire a scoped subscription on top of it.
 */
public class ChallengeRouter {

    private static final Logger LOG = Logger.getLogger(ChallengeRouter.class);

    private final ChallengeRouteTable table;
    private final Navigator navigator;
    private final OverlayPresenter overlay;
    private final SdkCommandService commands;
    private final OrchestratorConfig.Platform platform;
    private final Clock clock;

    private volatile List<String> availableCredentials = List.of();
    private volatile StepUpChallenge activeStepUp;

    public ChallengeRouter(
            ChallengeRouteTable table,
            Navigator navigator,
            OverlayPresenter overlay,
            SdkCommandService commands,
            OrchestratorConfig config,
            Clock clock) {
        this.table = Objects.requireNonNull(table, "table");
        this.navigator = Objects.requireNonNull(navigator, "navigator");
        this.overlay = Objects.requireNonNull(overlay, "overlay");
        this.commands = Objects.requireNonNull(commands, "commands");
        this.platform = Objects.requireNonNull(config, "config").lda().platform();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void attach(EventDispatchRegistry registry) {
        registry.subscribe(SdkEventType.INITIALIZED, this::onInitialized);
        registry.subscribe(SdkEventType.GET_USER, this::handle);
        registry.subscribe(SdkEventType.GET_ACTIVATION_CODE, this::handle);
        registry.subscribe(SdkEventType.GET_USER_CONSENT_FOR_LDA, this::handle);
        registry.subscribe(SdkEventType.GET_PASSWORD, this::handle);
        registry.subscribe(SdkEventType.USER_LOGGED_IN, this::handle);
        registry.subscribe(SdkEventType.USER_LOGGED_OFF, this::handle);
        registry.subscribe(SdkEventType.ADD_NEW_DEVICE_OPTIONS, this::handle);
        registry.subscribe(SdkEventType.CREDENTIALS_AVAILABLE_FOR_UPDATE, this::onCredentialsAvailableForUpdate);
        registry.subscribe(SdkEventType.UPDATE_CREDENTIAL_RESPONSE, this::onUpdateCredentialResponse);
        registry.subscribe(SdkEventType.AUTHENTICATE_USER_AND_SIGN_DATA, this::onDataSigningResponse);
    }

    /** Routes {@code event} and applies the decision. */
    public RoutingDecision handle(SdkEvent event) {
        RoutingDecision decision = route(event);
        if (decision instanceof RoutingDecision.Navigate navigate) {
            navigator.navigateOrUpdate(navigate.instruction());
        } else if (decision instanceof RoutingDecision.Overlay raise) {
            activeStepUp = raise.challenge();
            overlay.showStepUp(raise.challenge());
        } else if (decision instanceof RoutingDecision.NoOp noOp) {
            LOG.debugf("No navigation for %s: %s", event.eventName(), noOp.reason());
        }
        if (event instanceof UserLoggedInEvent loggedIn) {
            onLoggedIn(loggedIn);
        }
        return decision;
    }

    /** Decides what {@code event} means for navigation without performing it. */
    public RoutingDecision route(SdkEvent event) {
        int mode = event instanceof ChallengeEvent challenge ? challenge.challengeMode() : 0;
        Optional<RouteRule> resolved = table.resolve(event.eventName(), mode);
        if (resolved.isEmpty()) {
            return new RoutingDecision.NoOp("no route for " + event.eventName());
        }
        RouteRule rule = resolved.get();
        return switch (rule.action()) {
            case NONE -> new RoutingDecision.NoOp(event.eventName() + " does not navigate");
            case OVERLAY -> event instanceof GetPasswordEvent password
                    ? new RoutingDecision.Overlay(StepUpChallenge.from(password))
                    : new RoutingDecision.NoOp("overlay route for non-password event " + event.eventName());
            case NAVIGATE_OR_UPDATE -> new RoutingDecision.Navigate(
                    new NavigationInstruction(rule.screen(), params(rule.screen(), event)));
        };
    }

    public List<String> availableCredentials() {
        return availableCredentials;
    }

    public Optional<StepUpChallenge> activeStepUp() {
        return Optional.ofNullable(activeStepUp);
    }

    /** Aborts the running challenge sequence; the SDK answers with a fresh {@code getUser}. */
    public CompletableFuture<CommandAcknowledgement> resetAuthState() {
        dismissStepUp();
        return commands.resetAuthState();
    }

    /** Cancels a pending step-up: hides the overlay and resets the signing state in the SDK. */
    public CompletableFuture<CommandAcknowledgement> cancelStepUp() {
        dismissStepUp();
        return commands.resetAuthenticateUserAndSignDataState();
    }

    private void dismissStepUp() {
        if (activeStepUp != null) {
            activeStepUp = null;
            overlay.hideStepUp();
        }
    }

    private void onInitialized(InitializedEvent event) {
        // the SDK follows up with getUser, getActivationCode or getPassword on its own
        RdnaSession session = event.session();
        LOG.infof("SDK initialized, session=%s", session == null ? null : session.sessionID());
    }

    private void onLoggedIn(UserLoggedInEvent event) {
        String userID = event.userID();
        AdditionalInfo info = event.challengeResponse().additionalInfo();
        SessionTokenLog.logLogin(
                userID,
                event.challengeResponse().session().sessionID(),
                info == null ? null : info.idvUserRole(),
                info == null ? null : info.jwtJsonTokenInfo());
        if (userID == null || userID.isBlank()) {
            LOG.warn("Logged in event without userID, skipping credential update query");
            return;
        }
        commands.getAllChallenges(userID).whenComplete((ack, error) -> {
            if (error != null) {
                LOG.warnf("getAllChallenges for %s failed: %s", userID, error.getMessage());
            } else {
                LOG.debugf("getAllChallenges submitted for %s, waiting for credential updates", userID);
            }
        });
    }

    void onCredentialsAvailableForUpdate(CredentialsAvailableForUpdateEvent event) {
        if (event.error().hasError()) {
            LOG.warnf(
                    "Credential update query failed for %s: %s",
                    event.userID(), event.error().errorString());
            return;
        }
        availableCredentials = event.options();
        LOG.debugf("Credentials available for update for %s: %s", event.userID(), event.options());
    }

    void onUpdateCredentialResponse(UpdateCredentialResponseEvent event) {
        ChallengeStatus outcome = ChallengeStatusEvaluator.evaluate(event.error(), event.status());
        if (outcome.success()) {
            LOG.infof("Credential %s updated for %s", event.credType(), event.userID());
        } else {
            LOG.infof(
                    "Credential %s update for %s failed: code=%d, severe=%s, message=%s",
                    event.credType(), event.userID(), outcome.code(), outcome.severe(), outcome.message());
        }
    }

    void onDataSigningResponse(DataSigningResponseEvent event) {
        activeStepUp = null;
        overlay.hideStepUp();
        ChallengeStatus outcome = ChallengeStatusEvaluator.evaluate(event.error(), event.status());
        if (!outcome.success()) {
            LOG.warnf("Data signing failed: code=%d, message=%s", outcome.code(), outcome.message());
            return;
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("signingResult", event);
        params.put("dataSignatureID", event.dataSignatureID());
        params.put("payloadSignature", event.payloadSignature());
        params.put("reason", event.reason());
        navigator.navigate(new NavigationInstruction(Screen.DATA_SIGNING_RESULT, params));
        LOG.debug("Data signing completed");
    }

    private Map<String, Object> params(Screen screen, SdkEvent event) {
        Map<String, Object> params = new LinkedHashMap<>();
        if (event instanceof ChallengeEvent challenge) {
            challengeParams(params, challenge);
        }
        params.put("eventName", event.eventName());
        params.put("eventData", event);

        switch (screen) {
            case CHECK_USER -> {
                params.put("title", "Set User");
                params.put("subtitle", "Enter your username to continue");
                if (event instanceof GetUserEvent getUser) {
                    params.put("rememberedUsers", getUser.rememberedUsers());
                }
            }
            case ACTIVATION_CODE -> {
                params.put("title", "Enter Activation Code");
                params.put("subtitle", "Enter the activation code for user: " + userOf(event));
                if (event instanceof GetActivationCodeEvent activation) {
                    params.put("verificationKey", activation.verificationKey());
                }
            }
            case USER_LDA_CONSENT -> {
                params.put("title", "Local Device Authentication Consent");
                params.put("subtitle", "Grant permission for device authentication for user: " + userOf(event));
                if (event instanceof GetUserConsentForLdaEvent consent) {
                    String ldaName = LdaType.displayName(consent.authenticationType(), platform);
                    params.put("authenticationType", consent.authenticationType());
                    params.put("ldaName", ldaName);
                    params.put(
                            "consent",
                            LdaConsentMessage.resolve(
                                    ldaName,
                                    consent.challengeValue(OrchestratorConstants.LDA_CONSENT_MESSAGE_KEY)
                                            .orElse(null)));
                }
            }
            case VERIFY_PASSWORD -> {
                params.put("title", "Verify Password");
                params.put("subtitle", "Enter your password to continue");
            }
            case SET_PASSWORD -> {
                params.put("title", "Set Password");
                params.put("subtitle", "Create a secure password for user: " + userOf(event));
            }
            case UPDATE_PASSWORD -> {
                params.put("title", "Update Password");
                params.put("subtitle", "Update the password for user: " + userOf(event));
            }
            case UPDATE_EXPIRY_PASSWORD -> {
                params.put("title", "Update Expired Password");
                params.put("subtitle", expirySubtitle(event));
            }
            case DASHBOARD -> dashboardParams(params, event);
            case VERIFY_AUTH -> {
                params.put("title", "Additional Device Activation");
                params.put("subtitle", "Activate this device for user: " + userOf(event));
                if (event instanceof AddNewDeviceOptionsEvent options) {
                    params.put("userID", options.userID());
                    params.put("newDeviceOptions", options.newDeviceOptions());
                }
            }
            default -> LOG.debugf("No extra params for %s", screen);
        }
        return params;
    }

    private static void challengeParams(Map<String, Object> params, ChallengeEvent challenge) {
        params.put("userID", challenge.userID());
        params.put("challengeMode", challenge.challengeMode());
        params.put("attemptsLeft", challenge.attemptsLeft());
        params.put("challengeStatus", ChallengeStatusEvaluator.evaluate(challenge.error(), challenge.status()));
        challenge.challengeValue(OrchestratorConstants.PASSWORD_POLICY_KEY)
                .ifPresent(policy -> params.put("passwordPolicyMessage", PasswordPolicyMessages.fromJson(policy)));
    }

    private void dashboardParams(Map<String, Object> params, SdkEvent event) {
        if (!(event instanceof UserLoggedInEvent loggedIn)) {
            return;
        }
        RdnaSession session = loggedIn.challengeResponse().session();
        AdditionalInfo info = loggedIn.challengeResponse().additionalInfo();
        params.put("sessionID", session.sessionID());
        params.put("sessionType", session.sessionType());
        params.put("jwtToken", info == null ? null : info.jwtJsonTokenInfo());
        params.put("userRole", info == null ? null : info.idvUserRole());
        params.put("currentWorkFlow", info == null ? null : info.currentWorkFlow());
        params.put("loginTime", clock.instant());
    }

    private static String expirySubtitle(SdkEvent event) {
        if (event instanceof ChallengeEvent challenge) {
            RdnaStatus status = challenge.status();
            if (status != null && status.statusMessage() != null && !status.statusMessage().isBlank()) {
                return status.statusMessage();
            }
        }
        return OrchestratorConstants.DEFAULT_EXPIRED_PASSWORD_SUBTITLE;
    }

    private static String userOf(SdkEvent event) {
        String userID = null;
        if (event instanceof ChallengeEvent challenge) {
            userID = challenge.userID();
        } else if (event instanceof AddNewDeviceOptionsEvent options) {
            userID = options.userID();
        }
        return userID == null ? "" : userID;
    }
}
