package nl.pim16aap2.beacon.launcher.net;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.java.Log;
import nl.pim16aap2.beacon.runtime.error.LauncherException;
import nl.pim16aap2.beacon.runtime.error.TransientNetworkException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Small JSON client used for every metadata and authentication endpoint.
 * <p>
 * Each request is retried according to the configured {@link RetryPolicy}.
 */
@Log
public final class JsonHttpClient
{
    public static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(15);
    public static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);

    private final String userAgent;
    private final RetryPolicy retryPolicy;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public JsonHttpClient(String userAgent, RetryPolicy retryPolicy)
    {
        this(userAgent, retryPolicy, REQUEST_TIMEOUT);
    }

    JsonHttpClient(String userAgent, RetryPolicy retryPolicy, Duration requestTimeout)
    {
        this.userAgent = validateUserAgent(userAgent);
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy may not be null.");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout may not be null.");
        this.httpClient = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(CONNECT_TIMEOUT)
            .build();
        this.objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ObjectMapper objectMapper()
    {
        return objectMapper;
    }

    public JsonNode getJson(URI uri)
        throws LauncherException
    {
        return getJson(uri, Map.of());
    }

    public JsonNode getJson(URI uri, Map<String, String> headers)
        throws LauncherException
    {
        return parse(uri, getString(uri, headers));
    }

    public String getString(URI uri, Map<String, String> headers)
        throws LauncherException
    {
        final HttpRequest.Builder builder = newRequest(uri, headers).GET();
        return retryPolicy.execute("GET " + uri, () -> sendForBody(uri, builder.build()));
    }

    public JsonNode postJson(URI uri, Object body, Map<String, String> headers)
        throws LauncherException
    {
        final String payload;
        try
        {
            payload = objectMapper.writeValueAsString(body);
        }
        catch (JsonProcessingException exception)
        {
            throw new LauncherException("Failed to serialize request body for '%s'.".formatted(uri), exception);
        }

        final HttpRequest request = newRequest(uri, headers)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8))
            .build();
        return parse(uri, retryPolicy.execute("POST " + uri, () -> sendForBody(uri, request)));
    }

    public JsonNode postForm(URI uri, Map<String, String> form)
        throws LauncherException
    {
        final String payload = form.entrySet().stream()
            .map(entry -> encode(entry.getKey()) + "=" + encode(entry.getValue()))
            .collect(Collectors.joining("&"));

        final HttpRequest request = newRequest(uri, Map.of())
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8))
            .build();
        return parse(uri, retryPolicy.execute("POST " + uri, () -> sendForBody(uri, request)));
    }

    /**
     * Performs a GET request and returns its status code without interpreting it.
     * <p>
     * Only network failures are retried; every status code is returned to the caller.
     *
     * @param uri
     *     the URI to request.
     * @param headers
     *     additional request headers.
     * @return the status code of the response.
     *
     * @throws LauncherException
     *     If the endpoint could not be reached.
     */
    public int getStatus(URI uri, Map<String, String> headers)
        throws LauncherException
    {
        final HttpRequest request = newRequest(uri, headers).GET().build();
        return retryPolicy.execute("GET " + uri, () -> send(uri, request).statusCode());
    }

    private HttpRequest.Builder newRequest(URI uri, Map<String, String> headers)
    {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .header("User-Agent", userAgent)
            .header("Accept", "application/json")
            .timeout(requestTimeout);
        headers.forEach(builder::header);
        return builder;
    }

    private String sendForBody(URI uri, HttpRequest request)
        throws LauncherException
    {
        final HttpResponse<String> response = send(uri, request);
        if (!HttpStatusPolicy.isSuccess(response.statusCode()))
            HttpStatusPolicy.throwForStatus(uri, response.statusCode(), response.body());
        return response.body();
    }

    /**
     * Sends a request and reads its body, giving up once the request timeout has passed.
     */
    private HttpResponse<String> send(URI uri, HttpRequest request)
        throws LauncherException
    {
        log.finest(() -> "%s %s".formatted(request.method(), uri));
        final CompletableFuture<HttpResponse<String>> future =
            httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        try
        {
            return future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException exception)
        {
            future.cancel(true);
            throw new TransientNetworkException(
                "Request to '%s' did not complete within %d ms.".formatted(uri, requestTimeout.toMillis()),
                exception);
        }
        catch (ExecutionException exception)
        {
            final Throwable cause = exception.getCause();
            if (cause instanceof IOException)
                throw HttpStatusPolicy.networkFailure(uri, (IOException) cause);
            throw new LauncherException("Request to '%s' failed.".formatted(uri), cause == null ? exception : cause);
        }
        catch (InterruptedException exception)
        {
            future.cancel(true);
            throw HttpStatusPolicy.interrupted(uri, exception);
        }
    }

    private JsonNode parse(URI uri, String body)
        throws LauncherException
    {
        try
        {
            return objectMapper.readTree(body);
        }
        catch (JsonProcessingException exception)
        {
            throw new LauncherException("Failed to parse JSON response from '%s'.".formatted(uri), exception);
        }
    }

    private static String encode(String value)
    {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String validateUserAgent(String userAgent)
    {
        if (userAgent == null || userAgent.isBlank())
            throw new IllegalArgumentException("A non-empty User-Agent is required.");
        return userAgent;
    }
}
