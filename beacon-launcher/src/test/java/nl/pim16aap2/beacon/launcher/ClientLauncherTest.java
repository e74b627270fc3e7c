package nl.pim16aap2.beacon.launcher;

import nl.pim16aap2.beacon.launcher.auth.CredentialStore;
import nl.pim16aap2.beacon.launcher.net.RecordingSleeper;
import nl.pim16aap2.beacon.launcher.resolver.Platform;
import nl.pim16aap2.beacon.runtime.CredentialRecord;
import nl.pim16aap2.beacon.runtime.result.AuthResult;
import nl.pim16aap2.beacon.runtime.result.AuthStatusResult;
import nl.pim16aap2.beacon.runtime.result.ItemFailure;
import nl.pim16aap2.beacon.runtime.result.LaunchResult;
import nl.pim16aap2.beacon.runtime.result.LogoutResult;
import nl.pim16aap2.beacon.runtime.result.ProvisionResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Properties;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;

class ClientLauncherTest
{
    private static final Instant NOW = Instant.parse("2026-06-01T08:00:00Z");
    private static final String ASSET_HASH_A = "dd62e3af358f6ed9c34db858bad9d994ba775f11";
    private static final String ASSET_HASH_B = "2be39f7ad5f2b1f93f00f2e9d0be2eee704760f3";

    @TempDir
    Path clientDataDirectory;

    private TestHttpServer server;
    private RecordingSleeper sleeper;
    private LauncherSettings settings;
    private ClientLauncher launcher;

    @BeforeEach
    void setUp()
        throws Exception
    {
        server = TestHttpServer.start();
        sleeper = new RecordingSleeper();

        final Properties properties = new Properties();
        properties.setProperty("beacon.endpointBaseUri", server.baseUri().toString());
        properties.setProperty("beacon.javaExecutable", clientDataDirectory.resolve("missing-java").toString());
        properties.setProperty("beacon.downloadThreads", "2");
        settings = LauncherSettings.fromProperties(properties, clientDataDirectory);
        launcher = new ClientLauncher(
            settings, new Platform(Platform.LINUX, "x86_64", "6.8.0"), Clock.fixed(NOW, ZoneOffset.UTC), sleeper);
    }

    @AfterEach
    void tearDown()
    {
        server.close();
    }

    @Test
    void provision_shouldDownloadAndExtractEverything()
        throws Exception
    {
        // setup
        registerVersion();

        // execute
        final ProvisionResult result = launcher.provision("1.21.4", null);

        // verify
        assertThat(result.success()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.successCount()).isEqualTo(6);
        assertThat(result.skippedCount()).isZero();
        assertThat(result.extractedCount()).isEqualTo(1);
        assertThat(settings.layout().clientJar("1.21.4")).isRegularFile();
        assertThat(settings.layout().assetObject(ASSET_HASH_B)).hasContent("asset-b");
        assertThat(settings.layout().nativesDirectory("1.21.4").resolve("liblwjgl.so")).hasContent("native");
        assertThat(settings.layout().descriptor("1.21.4")).isRegularFile();
    }

    @Test
    void provision_shouldSkipFilesOnSecondRun()
        throws Exception
    {
        // setup
        registerVersion();
        launcher.provision("1.21.4", null);

        // execute
        final ProvisionResult result = launcher.provision("1.21.4", null);

        // verify
        assertThat(result.success()).isTrue();
        assertThat(result.skippedCount()).isEqualTo(result.successCount()).isEqualTo(6);
        assertThat(result.extractedCount()).isZero();
        assertThat(server.requestCount("/client.jar")).isEqualTo(1);
    }

    @Test
    void provision_shouldRetryAndReportIncompleteResult()
        throws Exception
    {
        // setup
        registerVersion();
        server.status("/assets/2b/" + ASSET_HASH_B, 404, "{}");

        // execute
        final ProvisionResult result = launcher.provision("1.21.4", null);

        // verify
        assertThat(result.success()).isFalse();
        assertThat(result.profile()).isNotNull();
        assertThat(result.errors()).extracting(ItemFailure::item).containsExactly("minecraft/lang/b.json");
        assertThat(server.requestCount("/assets/2b/" + ASSET_HASH_B)).isEqualTo(3);
        assertThat(sleeper.delays()).containsExactly(Duration.ofSeconds(3), Duration.ofSeconds(3));
    }

    @Test
    void provision_shouldFailForUnknownVersion()
    {
        // setup
        server.json("/mc/game/version_manifest_v2.json", "{\"versions\": []}");

        // execute
        final ProvisionResult result = launcher.provision("0.0.1", null);

        // verify
        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("0.0.1");
        assertThat(result.profile()).isNull();
    }

    @Test
    void launch_shouldRequireAuthenticationWithoutCredentials()
    {
        // execute
        final LaunchResult result = launcher.launch("1.21.4");

        // verify
        assertThat(result.success()).isFalse();
        assertThat(result.requiresAuth()).isTrue();
        assertThat(server.totalRequestCount()).isZero();
    }

    @Test
    void launch_shouldRejectVersionWithoutStoredDescriptor()
        throws Exception
    {
        // setup
        storeCredentials(NOW.minus(Duration.ofDays(1)));

        // execute
        final LaunchResult result = launcher.launch("1.21.4");

        // verify
        assertThat(result.success()).isFalse();
        assertThat(result.requiresAuth()).isFalse();
        assertThat(result.error()).isEqualTo("Version 1.21.4 has not been provisioned.");
        assertThat(server.totalRequestCount()).isZero();
    }

    @Test
    void launch_shouldReportSpawnFailure()
        throws Exception
    {
        // setup
        storeCredentials(NOW.minus(Duration.ofDays(1)));
        registerVersion();
        assertThat(launcher.provision("1.21.4", null).success()).isTrue();

        // execute
        final LaunchResult result = launcher.launch("1.21.4");

        // verify
        assertThat(result.success()).isFalse();
        assertThat(result.startFailure()).isFalse();
        assertThat(result.error()).contains("Failed to start client 1.21.4");
        assertThat(launcher.status().running()).isFalse();
    }

    @Test
    void launch_shouldUseVersionProvisionedByEarlierLauncher()
        throws Exception
    {
        // setup
        storeCredentials(NOW.minus(Duration.ofDays(1)));
        registerVersion();
        assertThat(launcher.provision("1.21.4", null).success()).isTrue();
        final int requestsAfterProvisioning = server.totalRequestCount();
        final ClientLauncher restarted = new ClientLauncher(
            settings, new Platform(Platform.LINUX, "x86_64", "6.8.0"), Clock.fixed(NOW, ZoneOffset.UTC), sleeper);

        // execute
        final LaunchResult result = restarted.launch("1.21.4");

        // verify
        assertThat(result.requiresAuth()).isFalse();
        assertThat(result.error()).contains("Failed to start client 1.21.4");
        assertThat(result.error()).doesNotContain("has not been provisioned");
        assertThat(server.totalRequestCount()).isEqualTo(requestsAfterProvisioning);
    }

    @Test
    void ensureValid_shouldUseCachedCredentials()
        throws Exception
    {
        // setup
        storeCredentials(NOW.minus(Duration.ofDays(10)));

        // execute
        final AuthResult result = launcher.ensureValid(false);

        // verify
        assertThat(result.success()).isTrue();
        assertThat(result.usedCache()).isTrue();
        assertThat(result.playerName()).isEqualTo("Steve");
    }

    @Test
    void logout_shouldForgetStoredCredentials()
        throws Exception
    {
        // setup
        storeCredentials(NOW.minus(Duration.ofDays(1)));
        assertThat(launcher.authStatus().authenticated()).isTrue();

        // execute
        final LogoutResult result = launcher.logout();

        // verify
        assertThat(result.success()).isTrue();
        final AuthStatusResult status = launcher.authStatus();
        assertThat(status.authenticated()).isFalse();
        assertThat(new CredentialStore(clientDataDirectory).file()).doesNotExist();
    }

    private void storeCredentials(Instant savedAt)
        throws Exception
    {
        new CredentialStore(clientDataDirectory).write(new CredentialRecord(
            "game-access",
            "identity-refresh",
            null,
            "client-token",
            "0123456789abcdef0123456789abcdef",
            "Steve",
            savedAt,
            null
        ));
    }

    private void registerVersion()
        throws IOException
    {
        server.json("/mc/game/version_manifest_v2.json", """
            {"versions": [{"id": "1.21.4", "url": "%s"}]}
            """.formatted(server.uri("/descriptors/1.21.4.json")));
        server.json("/descriptors/1.21.4.json", """
            {
              "id": "1.21.4",
              "type": "release",
              "mainClass": "net.minecraft.client.main.Main",
              "assetIndex": {"id": "19", "url": "%1$s/indexes/19.json"},
              "downloads": {"client": {"url": "%1$s/client.jar"}},
              "arguments": {"game": ["--username", "${auth_player_name}"], "jvm": ["-cp", "${classpath}"]},
              "libraries": [
                {"name": "com.example:lib:1.0"},
                {
                  "name": "org.lwjgl:lwjgl:3.3.3:natives-linux",
                  "rules": [{"action": "allow", "os": {"name": "linux"}}]
                }
              ]
            }
            """.formatted(server.baseUri()));
        server.json("/indexes/19.json", """
            {"objects": {
              "minecraft/lang/a.json": {"hash": "%s"},
              "minecraft/lang/b.json": {"hash": "%s"}
            }}
            """.formatted(ASSET_HASH_A, ASSET_HASH_B));
        server.bytes("/client.jar", zip("net/minecraft/client/main/Main.class", "class"));
        server.bytes("/libraries/com/example/lib/1.0/lib-1.0.jar", zip("com/example/Lib.class", "lib"));
        server.bytes("/libraries/org/lwjgl/lwjgl/3.3.3/lwjgl-3.3.3-natives-linux.jar",
            zip("linux/x64/org/lwjgl/liblwjgl.so", "native"));
        server.bytes("/assets/dd/" + ASSET_HASH_A, "asset-a".getBytes(StandardCharsets.UTF_8));
        server.bytes("/assets/2b/" + ASSET_HASH_B, "asset-b".getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] zip(String entryName, String content)
        throws IOException
    {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes))
        {
            zip.putNextEntry(new ZipEntry(entryName));
            zip.write(content.getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
        }
        return bytes.toByteArray();
    }
}
