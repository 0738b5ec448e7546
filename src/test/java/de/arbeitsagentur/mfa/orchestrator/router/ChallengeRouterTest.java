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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import de.arbeitsagentur.mfa.orchestrator.event.DispatchObserver;
import de.arbeitsagentur.mfa.orchestrator.event.EventDispatchRegistry;
import de.arbeitsagentur.mfa.orchestrator.event.SdkEventType;
import de.arbeitsagentur.mfa.orchestrator.event.payload.DataSigningResponseEvent;
import de.arbeitsagentur.mfa.orchestrator.navigation.Navigator;
import de.arbeitsagentur.mfa.orchestrator.navigation.OverlayPresenter;
import de.arbeitsagentur.mfa.orchestrator.policy.PasswordPolicyMessages;
import de.arbeitsagentur.mfa.orchestrator.sdk.SdkCommandService;
import de.arbeitsagentur.mfa.orchestrator.support.FakeNavigationService;
import de.arbeitsagentur.mfa.orchestrator.support.MutableClock;
import de.arbeitsagentur.mfa.orchestrator.support.SdkPayloads;
import de.arbeitsagentur.mfa.orchestrator.util.OrchestratorConfig;
import de.arbeitsagentur.mfa.orchestrator.util.OrchestratorConstants;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class ChallengeRouterTest {

    private static final String LOGIN_TIME = "2026-03-01T09:30:00Z";

    private FakeNavigationService navigation;
    private OverlayPresenter overlay;
    private List<String> submitted;
    private EventDispatchRegistry registry;
    private ChallengeRouter router;

    @BeforeEach
    void setUp() {
        navigation = new FakeNavigationService();
        overlay = mock(OverlayPresenter.class);
        submitted = new ArrayList<>();
        SdkCommandService commands = new SdkCommandService((command, arguments, ack) -> {
            submitted.add(command);
            ack.accept(SdkPayloads.acknowledgement(0));
        });
        registry = new EventDispatchRegistry(OrchestratorConfig.defaults().events(), mock(DispatchObserver.class));
        router = new ChallengeRouter(
                ChallengeRouteTable.standard(),
                new Navigator(navigation),
                overlay,
                commands,
                OrchestratorConfig.defaults(),
                MutableClock.startingAt(LOGIN_TIME));
        router.attach(registry);
    }

    private void emit(String eventName, String payload) {
        registry.onTransportEvent(eventName, payload);
    }

    @Nested
    @DisplayName("Password challenges")
    class PasswordChallenges {

        @Test
        void expiredPasswordUsesStatusMessageAsSubtitle() {
            emit("getPassword", SdkPayloads.getPassword(
                    "alice", 4, 3, SdkPayloads.status(100, "Your password expired 3 days ago"), "[]"));

            FakeNavigationService.Route route = navigation.current();
            assertEquals("UpdateExpiryPasswordScreen", route.name());
            assertEquals("Update Expired Password", route.params().get("title"));
            assertEquals("Your password expired 3 days ago", route.params().get("subtitle"));
            assertEquals("alice", route.params().get("userID"));
            assertEquals(4, route.params().get("challengeMode"));
        }

        @Test
        void expiredPasswordWithoutMessageUsesDefaultSubtitle() {
            emit("getPassword", SdkPayloads.getPassword("alice", 4, 3, SdkPayloads.status(100, ""), "[]"));

            assertEquals(
                    OrchestratorConstants.DEFAULT_EXPIRED_PASSWORD_SUBTITLE,
                    navigation.current().params().get("subtitle"));
        }

        @Test
        void verifyModeOpensVerifyPassword() {
            emit("getPassword", SdkPayloads.getPassword("alice", 0, 3));

            assertEquals("VerifyPasswordScreen", navigation.current().name());
            assertEquals("Verify Password", navigation.current().params().get("title"));
            assertEquals(3, navigation.current().params().get("attemptsLeft"));
        }

        @Test
        void setModeOpensSetPassword() {
            emit("getPassword", SdkPayloads.getPassword("alice", 1, 3));

            assertEquals("SetPasswordScreen", navigation.current().name());
            assertEquals("Create a secure password for user: alice", navigation.current().params().get("subtitle"));
        }

        @Test
        void unknownModeFallsBackToSetPassword() {
            emit("getPassword", SdkPayloads.getPassword("alice", 42, 3));

            assertEquals("SetPasswordScreen", navigation.current().name());
        }

        @Test
        void repeatedChallengeUpdatesParamsInPlace() {
            emit("getPassword", SdkPayloads.getPassword("alice", 0, 3));
            int depth = navigation.depth();

            emit("getPassword", SdkPayloads.getPassword(
                    "alice", 0, 2, SdkPayloads.status(102, "Incorrect password"), "[]"));

            assertEquals(depth, navigation.depth());
            assertEquals(1, navigation.paramUpdates());
            assertEquals(2, navigation.current().params().get("attemptsLeft"));
            ChallengeStatus status = (ChallengeStatus) navigation.current().params().get("challengeStatus");
            assertFalse(status.success());
            assertEquals("Incorrect password", status.message());
        }

        @Test
        void updateModeNavigatesIntoDashboardShell() {
            emit("getPassword", SdkPayloads.getPassword("alice", 2, 3));

            assertEquals(List.of("DrawerNavigator"), navigation.navigations());
            assertEquals("UpdatePassword", navigation.current().name());
            assertEquals("Update Password", navigation.current().params().get("title"));
        }

        @Test
        void policyChallengeInfoProducesPolicyMessage() {
            String challengeInfo = "[{\"key\":\"RELID_PASSWORD_POLICY\","
                    + "\"value\":\"{\\\"minL\\\":8,\\\"maxL\\\":8}\"}]";

            emit("getPassword", SdkPayloads.getPassword(
                    "alice", 1, 3, SdkPayloads.status(100, "Success"), challengeInfo));

            assertEquals("Must be exactly 8 characters long", navigation.current().params().get("passwordPolicyMessage"));
        }

        @Test
        void brokenPolicyProducesGenericMessage() {
            String challengeInfo = "[{\"key\":\"RELID_PASSWORD_POLICY\",\"value\":\"{broken\"}]";

            emit("getPassword", SdkPayloads.getPassword(
                    "alice", 1, 3, SdkPayloads.status(100, "Success"), challengeInfo));

            assertEquals(
                    PasswordPolicyMessages.PARSE_FAILURE_MESSAGE,
                    navigation.current().params().get("passwordPolicyMessage"));
        }
    }

    @Nested
    @DisplayName("Step-up overlay")
    class StepUp {

        @Test
        void stepUpModeRaisesOverlayWithoutNavigation() {
            emit("getPassword", SdkPayloads.getPassword("alice", 12, 2));

            ArgumentCaptor<StepUpChallenge> captor = ArgumentCaptor.forClass(StepUpChallenge.class);
            verify(overlay).showStepUp(captor.capture());
            assertEquals("alice", captor.getValue().userID());
            assertEquals(2, captor.getValue().attemptsLeft());
            assertEquals(0, navigation.depth());
            assertTrue(router.activeStepUp().isPresent());
        }

        @Test
        void signingSuccessHidesOverlayAndShowsResult() {
            emit("getPassword", SdkPayloads.getPassword("alice", 12, 2));

            emit("onAuthenticateUserAndSignData", SdkPayloads.dataSigningResponse(0, 100));

            verify(overlay).hideStepUp();
            assertTrue(router.activeStepUp().isEmpty());
            assertEquals("DataSigningResult", navigation.current().name());
            assertEquals("sig-1", navigation.current().params().get("dataSignatureID"));
            assertInstanceOf(DataSigningResponseEvent.class, navigation.current().params().get("signingResult"));
        }

        @Test
        void signingFailureHidesOverlayWithoutResult() {
            emit("getPassword", SdkPayloads.getPassword("alice", 12, 2));

            emit("onAuthenticateUserAndSignData", SdkPayloads.dataSigningResponse(0, 102));

            verify(overlay).hideStepUp();
            assertEquals(0, navigation.depth());
        }

        @Test
        void signingApiErrorHidesOverlayWithoutResult() {
            emit("onAuthenticateUserAndSignData", SdkPayloads.dataSigningResponse(214, 100));

            verify(overlay).hideStepUp();
            assertEquals(0, navigation.depth());
        }

        @Test
        void cancelStepUpResetsSigningState() {
            emit("getPassword", SdkPayloads.getPassword("alice", 12, 2));

            router.cancelStepUp().join();

            verify(overlay).hideStepUp();
            assertTrue(router.activeStepUp().isEmpty());
            assertEquals(List.of("resetAuthenticateUserAndSignDataState"), submitted);
        }

        @Test
        void resetAuthStateWithoutOverlayOnlySubmitsCommand() {
            router.resetAuthState().join();

            verify(overlay, never()).hideStepUp();
            assertEquals(List.of("resetAuthState"), submitted);
        }
    }

    @Nested
    @DisplayName("Session events")
    class SessionEvents {

        @Test
        void loggedInOpensDashboardAndQueriesCredentials() {
            emit("onUserLoggedIn", SdkPayloads.userLoggedIn("alice"));

            assertEquals(List.of("DrawerNavigator"), navigation.navigations());
            FakeNavigationService.Route route = navigation.current();
            assertEquals("Dashboard", route.name());
            assertEquals("session-42", route.params().get("sessionID"));
            assertEquals("customer", route.params().get("userRole"));
            assertEquals(Instant.parse(LOGIN_TIME), route.params().get("loginTime"));
            assertEquals(List.of("getAllChallenges"), submitted);
        }

        @Test
        void loggedOffDoesNotNavigate() {
            RoutingDecision decision = router.route(SdkEventType.USER_LOGGED_OFF.decode(SdkPayloads.userLoggedOff("alice")));

            emit("onUserLoggedOff", SdkPayloads.userLoggedOff("alice"));

            assertInstanceOf(RoutingDecision.NoOp.class, decision);
            assertEquals(0, navigation.depth());
        }

        @Test
        void credentialsAreStoredOnlyWithoutError() {
            emit("onCredentialsAvailableForUpdate", SdkPayloads.credentialsAvailable("alice", 0, "Password", "LDA"));
            emit("onCredentialsAvailableForUpdate", SdkPayloads.credentialsAvailable("alice", 88, "Nothing"));

            assertEquals(List.of("Password", "LDA"), router.availableCredentials());
        }

        @Test
        void notReadyNavigationDropsInstruction() {
            navigation.setReady(false);

            emit("getUser", SdkPayloads.getUser());

            assertEquals(0, navigation.depth());
        }
    }

    @Nested
    @DisplayName("Activation screens")
    class Activation {

        @Test
        void getUserOpensCheckUser() {
            emit("getUser", SdkPayloads.getUser());

            assertEquals("CheckUserScreen", navigation.current().name());
            assertEquals(List.of("alice"), navigation.current().params().get("rememberedUsers"));
        }

        @Test
        void activationCodeCarriesVerificationKey() {
            emit("getActivationCode", SdkPayloads.getActivationCode("alice", 3));

            assertEquals("ActivationCodeScreen", navigation.current().name());
            assertEquals("vk-1", navigation.current().params().get("verificationKey"));
            assertEquals(
                    "Enter the activation code for user: alice", navigation.current().params().get("subtitle"));
        }

        @Test
        void consentUsesCustomMessageFromChallengeInfo() {
            String challengeInfo = "[{\"key\":\"LDA_CONSENT_MESSAGE\",\"value\":"
                    + "\"{\\\"title\\\":\\\"Enable __LDA_NAME__\\\",\\\"btnApprove\\\":\\\"Yes\\\"}\"}]";

            emit("getUserConsentForLDA", SdkPayloads.getUserConsentForLda("alice", 1, challengeInfo));

            Map<String, Object> params = navigation.current().params();
            assertEquals("UserLDAConsentScreen", navigation.current().name());
            assertEquals("Fingerprint", params.get("ldaName"));
            LdaConsentMessage consent = (LdaConsentMessage) params.get("consent");
            assertEquals("Enable Fingerprint", consent.title());
            assertEquals("Yes", consent.approveText());
            assertEquals("Reject", consent.rejectText());
        }

        @Test
        void newDeviceOptionsOpenVerifyAuth() {
            emit("addNewDeviceOptions", SdkPayloads.addNewDeviceOptions("alice"));

            assertEquals("VerifyAuthScreen", navigation.current().name());
            assertEquals(List.of("fallback"), navigation.current().params().get("newDeviceOptions"));
        }
    }

    @Test
    void routeIsPureAndDoesNotNavigate() {
        RoutingDecision decision = router.route(SdkEventType.GET_PASSWORD.decode(SdkPayloads.getPassword("alice", 1, 3)));

        RoutingDecision.Navigate navigate = assertInstanceOf(RoutingDecision.Navigate.class, decision);
        assertEquals(Screen.SET_PASSWORD, navigate.instruction().screen());
        assertEquals(0, navigation.depth());
        assertTrue(submitted.isEmpty());
    }
}
