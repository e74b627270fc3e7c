package nl.pim16aap2.beacon.launcher.auth;

import nl.pim16aap2.beacon.launcher.LauncherEndpoints;
import nl.pim16aap2.beacon.launcher.TestHttpServer;
import nl.pim16aap2.beacon.launcher.net.JsonHttpClient;
import nl.pim16aap2.beacon.launcher.net.RetryPolicy;
import nl.pim16aap2.beacon.launcher.net.Sleeper;

import java.time.Clock;

/**
 * Registers a working identity provider, authorization broker and game service on a {@link TestHttpServer}.
 */
final class AuthServices
{
    static final String DEVICE_CODE_PATH = "/oauth20_connect.srf";
    static final String TOKEN_PATH = "/oauth20_token.srf";
    static final String USER_AUTH_PATH = "/user/authenticate";
    static final String XSTS_PATH = "/xsts/authorize";
    static final String LOGIN_PATH = "/authentication/login_with_xbox";
    static final String PROFILE_PATH = "/minecraft/profile";

    static final String PLAYER_ID = "0123456789abcdef0123456789abcdef";
    static final String DASHED_PLAYER_ID = "01234567-89ab-cdef-0123-456789abcdef";

    private AuthServices()
    {
    }

    static void registerWorkingServices(TestHttpServer server)
    {
        server
            .json(DEVICE_CODE_PATH, """
                {
                  "user_code": "ABCD-1234",
                  "device_code": "device-code",
                  "verification_uri": "https://www.microsoft.com/link",
                  "interval": 1,
                  "expires_in": 900
                }
                """)
            .json(TOKEN_PATH, """
                {"access_token": "identity-access", "refresh_token": "identity-refresh-2"}
                """)
            .json(USER_AUTH_PATH, """
                {"Token": "user-token"}
                """)
            .json(XSTS_PATH, """
                {"Token": "xsts-token", "DisplayClaims": {"xui": [{"uhs": "uhs-1"}]}}
                """)
            .json(LOGIN_PATH, """
                {"access_token": "game-access"}
                """)
            .json(PROFILE_PATH, """
                {"id": "%s", "name": "Steve"}
                """.formatted(PLAYER_ID));
    }

    static JsonHttpClient httpClient(Sleeper sleeper)
    {
        return new JsonHttpClient("beacon-test/1.0", RetryPolicy.defaultNetworkPolicy().withSleeper(sleeper));
    }

    static AuthenticationChain chain(TestHttpServer server, Clock clock, Sleeper sleeper)
    {
        final JsonHttpClient httpClient = httpClient(sleeper);
        final LauncherEndpoints endpoints = LauncherEndpoints.underBaseUri(server.baseUri());
        return new AuthenticationChain(
            new MicrosoftIdentityClient(httpClient, endpoints, MicrosoftIdentityClient.DEFAULT_CLIENT_ID, clock, sleeper),
            new XboxBrokerClient(httpClient, endpoints),
            new GameServiceClient(httpClient, endpoints)
        );
    }

    static GameServiceClient gameServiceClient(TestHttpServer server, Sleeper sleeper)
    {
        return new GameServiceClient(httpClient(sleeper), LauncherEndpoints.underBaseUri(server.baseUri()));
    }
}
