package nl.pim16aap2.beacon.launcher.resolver;

import nl.pim16aap2.beacon.runtime.LibraryEntry;
import nl.pim16aap2.beacon.runtime.VersionProfile;
import nl.pim16aap2.beacon.runtime.error.LauncherException;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VersionDescriptorParserTest
{
    @Test
    void parse_shouldReadModernDescriptor()
        throws Exception
    {
        // execute
        final VersionProfile profile = Descriptors.parser().parse(Descriptors.json(Descriptors.BASE));

        // verify
        assertThat(profile.id()).isEqualTo("1.21.4");
        assertThat(profile.inheritsFrom()).isNull();
        assertThat(profile.clientJarVersion()).isEqualTo("1.21.4");
        assertThat(profile.gameArguments()).containsExactly("--username", "${auth_player_name}");
        assertThat(profile.jvmArguments()).containsExactly("-cp", "${classpath}");
        assertThat(profile.assetIndex()).isNotNull();
        assertThat(profile.assetIndex().id()).isEqualTo("19");
        assertThat(profile.clientDownload()).isNotNull();
        assertThat(profile.clientDownload().size()).isEqualTo(2048L);
    }

    @Test
    void parse_shouldDropLibrariesDisallowedOnPlatform()
        throws Exception
    {
        // execute
        final VersionProfile profile = Descriptors.parser().parse(Descriptors.json(Descriptors.BASE));

        // verify
        assertThat(profile.libraries())
            .extracting(entry -> entry.coordinate().toString())
            .containsExactly(
                "org.ow2.asm:asm:9.8",
                "org.ow2.asm:asm-tree:9.6",
                "com.google.guava:guava:33.0.0-jre",
                "org.lwjgl:lwjgl:3.3.3:natives-linux"
            );
        assertThat(profile.libraries().get(3).nativeLibrary()).isTrue();
        assertThat(profile.libraries().get(0).nativeLibrary()).isFalse();
        assertThat(profile.libraries().get(0).size()).isEqualTo(10L);
        assertThat(profile.libraries().get(0).sha1()).isEqualTo("a1");
    }

    @Test
    void parse_shouldLocateLibrariesWithoutArtifactInDeclaredRepository()
        throws Exception
    {
        // execute
        final VersionProfile profile = Descriptors.parser().parse(Descriptors.json(Descriptors.LOADER));

        // verify
        final LibraryEntry loader = profile.libraries().get(2);
        assertThat(loader.path()).isEqualTo("net/fabricmc/fabric-loader/0.16.10/fabric-loader-0.16.10.jar");
        assertThat(loader.url())
            .isEqualTo(URI.create("https://maven.example.net/net/fabricmc/fabric-loader/0.16.10/fabric-loader-0.16.10.jar"));
        assertThat(profile.inheritsFrom()).isEqualTo("1.21.4");
        assertThat(profile.clientJarVersion()).isEqualTo("1.21.4");
    }

    @Test
    void parse_shouldFallBackToDefaultRepository()
        throws Exception
    {
        // setup
        final String descriptor = """
            {"id": "x", "libraries": [{"name": "com.example:lib:1.0"}]}
            """;

        // execute
        final VersionProfile profile = Descriptors.parser().parse(Descriptors.json(descriptor));

        // verify
        assertThat(profile.libraries()).singleElement()
            .extracting(LibraryEntry::url)
            .isEqualTo(URI.create("https://libraries.example.net/com/example/lib/1.0/lib-1.0.jar"));
        assertThat(profile.mainClass()).isEqualTo(VersionDescriptorParser.DEFAULT_MAIN_CLASS);
        assertThat(profile.type()).isEqualTo("release");
    }

    @Test
    void parse_shouldLeaveUrlEmptyForExplicitArtifactWithoutUrl()
        throws Exception
    {
        // setup
        final String descriptor = """
            {"id": "x", "libraries": [{"name": "com.example:forge:1.0", "downloads": {"artifact": {"path": "a/b.jar", "url": ""}}}]}
            """;

        // execute
        final VersionProfile profile = Descriptors.parser().parse(Descriptors.json(descriptor));

        // verify
        final LibraryEntry entry = profile.libraries().get(0);
        assertThat(entry.url()).isNull();
        assertThat(entry.path()).isEqualTo("a/b.jar");
    }

    @Test
    void parse_shouldExpandLegacyNatives()
        throws Exception
    {
        // setup
        final String descriptor = """
            {
              "id": "1.12.2",
              "minecraftArguments": "--username ${auth_player_name}  --version ${version_name}",
              "libraries": [
                {
                  "name": "org.lwjgl.lwjgl:lwjgl-platform:2.9.4",
                  "natives": {"linux": "natives-linux-${arch}", "windows": "natives-windows-${arch}"},
                  "downloads": {
                    "classifiers": {
                      "natives-linux-64": {"path": "lwjgl-platform-natives-linux-64.jar", "url": "https://libraries.example.net/linux-64.jar", "size": 5}
                    }
                  }
                }
              ]
            }
            """;

        // execute
        final VersionProfile profile = Descriptors.parser().parse(Descriptors.json(descriptor));

        // verify
        assertThat(profile.gameArguments())
            .containsExactly("--username", "${auth_player_name}", "--version", "${version_name}");
        assertThat(profile.jvmArguments()).isEmpty();
        assertThat(profile.libraries()).singleElement().satisfies(entry ->
        {
            assertThat(entry.nativeLibrary()).isTrue();
            assertThat(entry.coordinate().classifier()).isEqualTo("natives-linux-64");
            assertThat(entry.url()).isEqualTo(URI.create("https://libraries.example.net/linux-64.jar"));
            assertThat(entry.size()).isEqualTo(5L);
        });
    }

    @Test
    void parse_shouldSkipInvalidLibraryNames()
        throws Exception
    {
        // setup
        final String descriptor = """
            {"id": "x", "libraries": [{"name": "broken"}, {"name": "com.example:lib:1.0"}]}
            """;

        // execute
        final VersionProfile profile = Descriptors.parser().parse(Descriptors.json(descriptor));

        // verify
        assertThat(profile.libraries()).hasSize(1);
    }

    @Test
    void parse_shouldRejectDescriptorWithoutId()
    {
        assertThatThrownBy(() -> Descriptors.parser().parse(Descriptors.json("{\"libraries\": []}")))
            .isInstanceOf(LauncherException.class)
            .hasMessageContaining("no id");
    }
}
