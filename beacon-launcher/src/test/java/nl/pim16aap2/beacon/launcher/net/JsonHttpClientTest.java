package nl.pim16aap2.beacon.launcher.net;

import com.fasterxml.jackson.databind.JsonNode;
import nl.pim16aap2.beacon.launcher.TestHttpServer;
import nl.pim16aap2.beacon.runtime.error.HttpStatusException;
import nl.pim16aap2.beacon.runtime.error.TransientNetworkException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class JsonHttpClientTest
{
    private TestHttpServer server;
    private RecordingSleeper sleeper;
    private JsonHttpClient httpClient;

    @BeforeEach
    void setUp()
        throws Exception
    {
        server = TestHttpServer.start();
        sleeper = new RecordingSleeper();
        httpClient = new JsonHttpClient("beacon-test/1.0", RetryPolicy.defaultNetworkPolicy().withSleeper(sleeper));
    }

    @AfterEach
    void tearDown()
    {
        server.close();
    }

    @Test
    void getJson_shouldSendUserAgentAndParseBody()
        throws Exception
    {
        // setup
        server.handle("/data", request -> TestHttpServer.Response.json(200,
            "{\"agent\":\"" + request.header("User-Agent") + "\"}"));

        // execute
        final JsonNode root = httpClient.getJson(server.uri("/data"));

        // verify
        assertThat(root.path("agent").asText()).isEqualTo("beacon-test/1.0");
    }

    @Test
    void getJson_shouldGiveUpOnStalledBody()
    {
        // setup
        server.stalledBody("/slow", 100, "{\"partial\":".getBytes(StandardCharsets.UTF_8));
        final JsonHttpClient impatientClient = new JsonHttpClient(
            "beacon-test/1.0", RetryPolicy.defaultNetworkPolicy().withSleeper(sleeper), Duration.ofMillis(300));

        // execute & verify
        assertTimeoutPreemptively(Duration.ofSeconds(10), () ->
            assertThatThrownBy(() -> impatientClient.getJson(server.uri("/slow")))
                .isInstanceOf(TransientNetworkException.class)
                .hasMessageContaining("did not complete within 300 ms"));
        assertThat(server.requestCount("/slow")).isEqualTo(RetryPolicy.DEFAULT_MAX_ATTEMPTS);
    }

    @Test
    void getJson_shouldRetryServerErrors()
        throws Exception
    {
        // setup
        final AtomicInteger calls = new AtomicInteger();
        server.handle("/flaky", request -> calls.incrementAndGet() == 1 ?
            TestHttpServer.Response.json(503, "{}") :
            TestHttpServer.Response.json(200, "{\"ok\":true}"));

        // execute
        final JsonNode root = httpClient.getJson(server.uri("/flaky"));

        // verify
        assertThat(root.path("ok").asBoolean()).isTrue();
        assertThat(server.requestCount("/flaky")).isEqualTo(2);
        assertThat(sleeper.delays()).hasSize(1);
    }

    @Test
    void getJson_shouldFailWithoutRetryOnClientErrors()
    {
        // setup
        server.status("/missing", 404, "{\"error\":\"nope\"}");

        // execute
        final var thrown = assertThatThrownBy(() -> httpClient.getJson(server.uri("/missing")));

        // verify
        thrown.isInstanceOfSatisfying(HttpStatusException.class, exception ->
        {
            assertThat(exception.statusCode()).isEqualTo(404);
            assertThat(exception.body()).contains("nope");
        });
        assertThat(server.requestCount("/missing")).isEqualTo(1);
    }

    @Test
    void getJson_shouldGiveUpAfterThreeAttempts()
    {
        // setup
        server.status("/down", 500, "{}");

        // execute
        final var thrown = assertThatThrownBy(() -> httpClient.getJson(server.uri("/down")));

        // verify
        thrown.isInstanceOf(TransientNetworkException.class);
        assertThat(server.requestCount("/down")).isEqualTo(3);
    }

    @Test
    void postForm_shouldEncodeFields()
        throws Exception
    {
        // setup
        server.handle("/token", request -> TestHttpServer.Response.json(200,
            "{\"body\":\"" + request.body() + "\",\"type\":\"" + request.header("Content-Type") + "\"}"));
        final Map<String, String> form = new LinkedHashMap<>();
        form.put("scope", "XboxLive.signin offline_access");
        form.put("grant_type", "refresh_token");

        // execute
        final JsonNode root = httpClient.postForm(server.uri("/token"), form);

        // verify
        assertThat(root.path("body").asText())
            .isEqualTo("scope=XboxLive.signin+offline_access&grant_type=refresh_token");
        assertThat(root.path("type").asText()).isEqualTo("application/x-www-form-urlencoded");
    }

    @Test
    void getStatus_shouldReturnClientErrorsWithoutThrowing()
        throws Exception
    {
        // setup
        server.status("/profile", 401, "{}");

        // execute
        final int status = httpClient.getStatus(server.uri("/profile"), Map.of("Authorization", "Bearer x"));

        // verify
        assertThat(status).isEqualTo(401);
    }

    @Test
    void constructor_shouldRejectBlankUserAgent()
    {
        // execute + verify
        assertThatThrownBy(() -> new JsonHttpClient(" ", RetryPolicy.defaultNetworkPolicy()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
