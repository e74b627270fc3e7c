package nl.pim16aap2.beacon.launcher.auth;

import nl.pim16aap2.beacon.launcher.TestHttpServer;
import nl.pim16aap2.beacon.launcher.net.RecordingSleeper;
import nl.pim16aap2.beacon.runtime.AuthState;
import nl.pim16aap2.beacon.runtime.error.AuthenticationException;
import nl.pim16aap2.beacon.runtime.event.DeviceCodeEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthenticationChainTest
{
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    private TestHttpServer server;
    private RecordingSleeper sleeper;
    private AuthenticationChain chain;

    @BeforeEach
    void setUp()
        throws Exception
    {
        server = TestHttpServer.start();
        AuthServices.registerWorkingServices(server);
        sleeper = new RecordingSleeper();
        chain = AuthServices.chain(server, CLOCK, sleeper);
    }

    @AfterEach
    void tearDown()
    {
        server.close();
    }

    @Test
    void refresh_shouldRunAllThreeHops()
        throws Exception
    {
        // setup
        final List<String> tokenRequests = new CopyOnWriteArrayList<>();
        final List<String> brokerRequests = new CopyOnWriteArrayList<>();
        final List<String> loginRequests = new CopyOnWriteArrayList<>();
        server.handle(AuthServices.TOKEN_PATH, request ->
        {
            tokenRequests.add(request.body());
            return TestHttpServer.Response.json(200, "{\"access_token\":\"identity-access\"}");
        });
        server.handle(AuthServices.USER_AUTH_PATH, request ->
        {
            brokerRequests.add(request.body());
            return TestHttpServer.Response.json(200, "{\"Token\":\"user-token\"}");
        });
        server.handle(AuthServices.LOGIN_PATH, request ->
        {
            loginRequests.add(request.body());
            return TestHttpServer.Response.json(200, "{\"access_token\":\"game-access\"}");
        });

        // execute
        final AuthenticationChain.ChainResult result = chain.refresh("identity-refresh");

        // verify
        assertThat(result.gameAccessToken()).isEqualTo("game-access");
        assertThat(result.identityToken().accessToken()).isEqualTo("identity-access");
        assertThat(result.identityToken().refreshToken()).isNull();
        assertThat(result.profile().name()).isEqualTo("Steve");
        assertThat(tokenRequests).singleElement().asString()
            .contains("grant_type=refresh_token")
            .contains("refresh_token=identity-refresh")
            .contains("scope=XboxLive.signin+offline_access");
        assertThat(brokerRequests).singleElement().asString().contains("\"RpsTicket\":\"d=identity-access\"");
        assertThat(loginRequests).singleElement().asString().contains("XBL3.0 x=uhs-1;xsts-token");
    }

    @Test
    void authenticateInteractively_shouldPublishDeviceCodeAndPollUntilApproved()
        throws Exception
    {
        // setup
        final AtomicInteger polls = new AtomicInteger();
        server.handle(AuthServices.TOKEN_PATH, request -> polls.incrementAndGet() == 1 ?
            TestHttpServer.Response.json(400, "{\"error\":\"authorization_pending\"}") :
            TestHttpServer.Response.json(200, "{\"access_token\":\"identity-access\",\"refresh_token\":\"r\"}"));
        final List<DeviceCodeEvent> deviceCodes = new ArrayList<>();

        // execute
        final AuthenticationChain.ChainResult result = chain.authenticateInteractively(deviceCodes::add);

        // verify
        assertThat(deviceCodes).singleElement().satisfies(event ->
        {
            assertThat(event.userCode()).isEqualTo("ABCD-1234");
            assertThat(event.verificationUri()).hasToString("https://www.microsoft.com/link");
        });
        assertThat(polls).hasValue(2);
        assertThat(sleeper.delays()).containsExactly(Duration.ofSeconds(1));
        assertThat(result.identityToken().refreshToken()).isEqualTo("r");
        assertThat(result.profile().id()).isEqualTo(AuthServices.PLAYER_ID);
    }

    @Test
    void authenticateInteractively_shouldSlowDownWhenAsked()
        throws Exception
    {
        // setup
        final AtomicInteger polls = new AtomicInteger();
        server.handle(AuthServices.TOKEN_PATH, request -> polls.incrementAndGet() == 1 ?
            TestHttpServer.Response.json(400, "{\"error\":\"slow_down\"}") :
            TestHttpServer.Response.json(200, "{\"access_token\":\"identity-access\"}"));

        // execute
        chain.authenticateInteractively(event ->
        {
        });

        // verify
        assertThat(sleeper.delays()).containsExactly(Duration.ofSeconds(6));
    }

    @Test
    void refresh_shouldReportIdentityHopFailure()
    {
        // setup
        server.status(AuthServices.TOKEN_PATH, 400, "{\"error\":\"invalid_grant\"}");

        // execute
        final var thrown = assertThatThrownBy(() -> chain.refresh("revoked"));

        // verify
        thrown.isInstanceOfSatisfying(AuthenticationException.class, exception ->
            assertThat(exception.reachedState()).isEqualTo(AuthState.NOT_AUTHENTICATED));
        assertThat(server.requestCount(AuthServices.USER_AUTH_PATH)).isZero();
    }

    @Test
    void refresh_shouldReportBrokerHopFailure()
    {
        // setup
        server.status(AuthServices.XSTS_PATH, 401, "{\"XErr\":2148916233}");

        // execute
        final var thrown = assertThatThrownBy(() -> chain.refresh("identity-refresh"));

        // verify
        thrown.isInstanceOfSatisfying(AuthenticationException.class, exception ->
        {
            assertThat(exception.reachedState()).isEqualTo(AuthState.IDENTITY_OK);
            assertThat(exception).hasMessageContaining("authorization broker");
        });
        assertThat(server.requestCount(AuthServices.LOGIN_PATH)).isZero();
    }

    @Test
    void refresh_shouldReportMissingUserHashAsBrokerFailure()
    {
        // setup
        server.json(AuthServices.XSTS_PATH, "{\"Token\":\"xsts-token\",\"DisplayClaims\":{\"xui\":[]}}");

        // execute
        final var thrown = assertThatThrownBy(() -> chain.refresh("identity-refresh"));

        // verify
        thrown.isInstanceOfSatisfying(AuthenticationException.class, exception ->
            assertThat(exception.reachedState()).isEqualTo(AuthState.IDENTITY_OK));
    }

    @Test
    void refresh_shouldReportGameServiceHopFailure()
    {
        // setup
        server.status(AuthServices.PROFILE_PATH, 404, "{\"error\":\"NOT_FOUND\"}");

        // execute
        final var thrown = assertThatThrownBy(() -> chain.refresh("identity-refresh"));

        // verify
        thrown.isInstanceOfSatisfying(AuthenticationException.class, exception ->
            assertThat(exception.reachedState()).isEqualTo(AuthState.BROKER_OK));
    }
}
