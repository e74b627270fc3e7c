package nl.pim16aap2.beacon.launcher.resolver;

import nl.pim16aap2.beacon.runtime.LibraryEntry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static nl.pim16aap2.beacon.launcher.resolver.Descriptors.library;
import static org.assertj.core.api.Assertions.assertThat;

class LibraryMergerTest
{
    private final LibraryMerger merger = new LibraryMerger();

    @Test
    void merge_shouldKeepPinnedVersionOverNewerOne()
    {
        // setup
        final List<LibraryEntry> loader = List.of(library("org.ow2.asm:asm:9.9"));
        final List<LibraryEntry> base = List.of(library("org.ow2.asm:asm:9.8"));

        // execute
        final List<LibraryEntry> merged = merger.merge(loader, base);

        // verify
        assertThat(merged).singleElement()
            .extracting(entry -> entry.coordinate().version())
            .isEqualTo("9.8");
    }

    @Test
    void merge_shouldAcceptPatchReleaseOfPinnedVersion()
    {
        // setup
        final List<LibraryEntry> loader = List.of(library("org.ow2.asm:asm:9.8.1"));
        final List<LibraryEntry> base = List.of(library("org.ow2.asm:asm:9.7"));

        // execute
        final List<LibraryEntry> merged = merger.merge(loader, base);

        // verify
        assertThat(merged).extracting(entry -> entry.coordinate().version()).containsExactly("9.8.1");
    }

    @Test
    void merge_shouldPreferHigherPriority()
    {
        // setup
        final List<LibraryEntry> loader = List.of(library("org.ow2.asm:asm-tree:9.6"));
        final List<LibraryEntry> base = List.of(library("org.ow2.asm:asm-tree:9.8"));

        // execute
        final List<LibraryEntry> merged = merger.merge(loader, base);

        // verify
        assertThat(merged).extracting(entry -> entry.coordinate().version()).containsExactly("9.8");
    }

    @Test
    void merge_shouldKeepLoaderEntryOnTie()
    {
        // setup
        final List<LibraryEntry> loader = List.of(library("com.google.guava:guava:32.0.0-jre"));
        final List<LibraryEntry> base = List.of(library("com.google.guava:guava:33.0.0-jre"));

        // execute
        final List<LibraryEntry> merged = merger.merge(loader, base);

        // verify
        assertThat(merged).extracting(entry -> entry.coordinate().version()).containsExactly("32.0.0-jre");
    }

    @Test
    void merge_shouldKeepNativesNextToPlainArtifact()
    {
        // setup
        final List<LibraryEntry> base = List.of(
            library("org.lwjgl:lwjgl:3.3.3"),
            library("org.lwjgl:lwjgl:3.3.3:natives-linux"),
            library("org.lwjgl:lwjgl:3.3.3:natives-linux-arm64")
        );

        // execute
        final List<LibraryEntry> merged = merger.merge(List.of(), base);

        // verify
        assertThat(merged).containsExactlyElementsOf(base);
    }

    @Test
    void merge_shouldPreserveFirstSeenOrder()
    {
        // setup
        final List<LibraryEntry> loader = List.of(library("net.fabricmc:fabric-loader:0.16.10"),
            library("org.ow2.asm:asm:9.9"));
        final List<LibraryEntry> base = List.of(library("com.google.guava:guava:33.0.0-jre"),
            library("org.ow2.asm:asm:9.8"));

        // execute
        final List<LibraryEntry> merged = merger.merge(loader, base);

        // verify
        assertThat(merged)
            .extracting(entry -> entry.coordinate().toString())
            .containsExactly(
                "net.fabricmc:fabric-loader:0.16.10",
                "org.ow2.asm:asm:9.8",
                "com.google.guava:guava:33.0.0-jre"
            );
    }

    @Test
    void merge_shouldBeIdempotent()
    {
        // setup
        final List<LibraryEntry> loader = List.of(library("org.ow2.asm:asm:9.9"), library("org.slf4j:slf4j-api:2.0.9"));
        final List<LibraryEntry> base = List.of(library("org.ow2.asm:asm:9.8"), library("org.slf4j:slf4j-api:2.0.9"));

        // execute
        final List<LibraryEntry> once = merger.merge(loader, base);
        final List<LibraryEntry> twice = merger.merge(once, base);

        // verify
        assertThat(twice).isEqualTo(once);
    }

    @Test
    void priority_shouldEncodeVersionsForConflictProneGroupsOnly()
    {
        assertThat(LibraryPriority.fromVersion("9.8")).isEqualTo(9_008_000L);
        assertThat(LibraryPriority.fromVersion("9.7.1")).isEqualTo(9_007_001L);
        assertThat(LibraryPriority.fromVersion("snapshot")).isZero();
        assertThat(library("com.google.guava:guava:33.0.0-jre").priority()).isZero();
        assertThat(library("org.ow2.asm:asm:9.8").priority()).isEqualTo(9_008_000L);
    }
}
