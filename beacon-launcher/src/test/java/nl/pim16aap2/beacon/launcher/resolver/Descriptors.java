package nl.pim16aap2.beacon.launcher.resolver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import nl.pim16aap2.beacon.runtime.LibraryCoordinate;
import nl.pim16aap2.beacon.runtime.LibraryEntry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;

/**
 * Descriptor fixtures shared by the resolver tests.
 */
final class Descriptors
{
    static final Platform LINUX = new Platform(Platform.LINUX, "x86_64", "6.8.0");
    static final URI LIBRARIES = URI.create("https://libraries.example.net/");

    static final String BASE = """
        {
          "id": "1.21.4",
          "type": "release",
          "mainClass": "net.minecraft.client.main.Main",
          "assetIndex": {"id": "19", "url": "https://meta.example.net/19.json", "size": 100, "sha1": "abc"},
          "downloads": {"client": {"url": "https://meta.example.net/client.jar", "size": 2048, "sha1": "def"}},
          "arguments": {
            "game": ["--username", "${auth_player_name}", {"rules": [{"action": "allow", "features": {"is_demo_user": true}}], "value": "--demo"}],
            "jvm": [{"rules": [{"action": "allow", "os": {"name": "osx"}}], "value": ["-XstartOnFirstThread"]}, "-cp", "${classpath}"]
          },
          "libraries": [
            {"name": "org.ow2.asm:asm:9.8", "downloads": {"artifact": {"path": "org/ow2/asm/asm/9.8/asm-9.8.jar", "url": "https://libraries.example.net/org/ow2/asm/asm/9.8/asm-9.8.jar", "size": 10, "sha1": "a1"}}},
            {"name": "org.ow2.asm:asm-tree:9.6", "downloads": {"artifact": {"path": "org/ow2/asm/asm-tree/9.6/asm-tree-9.6.jar", "url": "https://libraries.example.net/org/ow2/asm/asm-tree/9.6/asm-tree-9.6.jar"}}},
            {"name": "com.google.guava:guava:33.0.0-jre", "downloads": {"artifact": {"path": "com/google/guava/guava/33.0.0-jre/guava-33.0.0-jre.jar", "url": "https://libraries.example.net/com/google/guava/guava/33.0.0-jre/guava-33.0.0-jre.jar"}}},
            {"name": "org.lwjgl:lwjgl:3.3.3:natives-linux", "downloads": {"artifact": {"path": "org/lwjgl/lwjgl/3.3.3/lwjgl-3.3.3-natives-linux.jar", "url": "https://libraries.example.net/org/lwjgl/lwjgl/3.3.3/lwjgl-3.3.3-natives-linux.jar"}}, "rules": [{"action": "allow", "os": {"name": "linux"}}]},
            {"name": "org.lwjgl:lwjgl:3.3.3:natives-windows", "downloads": {"artifact": {"path": "org/lwjgl/lwjgl/3.3.3/lwjgl-3.3.3-natives-windows.jar", "url": "https://libraries.example.net/org/lwjgl/lwjgl/3.3.3/lwjgl-3.3.3-natives-windows.jar"}}, "rules": [{"action": "allow", "os": {"name": "windows"}}]}
          ]
        }
        """;

    static final String LOADER = """
        {
          "id": "fabric-loader-0.16.10-1.21.4",
          "inheritsFrom": "1.21.4",
          "mainClass": "net.fabricmc.loader.impl.launch.knot.KnotClient",
          "arguments": {"game": [], "jvm": ["-DFabricMcEmu= net.minecraft.client.main.Main "]},
          "libraries": [
            {"name": "org.ow2.asm:asm:9.9", "url": "https://maven.example.net/"},
            {"name": "org.ow2.asm:asm-tree:9.8", "url": "https://maven.example.net/"},
            {"name": "net.fabricmc:fabric-loader:0.16.10", "url": "https://maven.example.net"}
          ]
        }
        """;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Descriptors()
    {
    }

    static JsonNode json(String json)
    {
        try
        {
            return MAPPER.readTree(json);
        }
        catch (IOException exception)
        {
            throw new UncheckedIOException(exception);
        }
    }

    static VersionDescriptorParser parser()
    {
        return new VersionDescriptorParser(LINUX, LIBRARIES);
    }

    static LibraryEntry library(String name)
    {
        final LibraryCoordinate coordinate = LibraryCoordinate.parse(name);
        return new LibraryEntry(
            coordinate,
            coordinate.mavenPath(),
            URI.create("https://libraries.example.net/" + coordinate.mavenPath()),
            null,
            null,
            coordinate.classifier() != null && coordinate.classifier().startsWith("natives-"),
            LibraryPriority.of(coordinate)
        );
    }
}
