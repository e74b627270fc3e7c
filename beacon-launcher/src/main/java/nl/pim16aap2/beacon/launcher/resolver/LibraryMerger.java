package nl.pim16aap2.beacon.launcher.resolver;

import lombok.extern.java.Log;
import nl.pim16aap2.beacon.runtime.LibraryEntry;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the library lists of a loader and its base version into one list with a single entry per merge key.
 * <p>
 * Entries are considered in order: the loader's entries first, then the base's. When a key is already taken, the
 * incoming entry replaces the present one only if its priority is strictly higher, so ties keep the loader's entry.
 * Pinned libraries override this: an entry at the pinned version always beats one that is not, and is never replaced
 * by one that is not. The merged list keeps the position at which each key was first seen.
 */
@Log
public final class LibraryMerger
{
    private final List<PinnedLibrary> pinnedLibraries;

    public LibraryMerger(List<PinnedLibrary> pinnedLibraries)
    {
        this.pinnedLibraries = List.copyOf(pinnedLibraries);
    }

    public LibraryMerger()
    {
        this(List.of(PinnedLibrary.ASM));
    }

    public List<LibraryEntry> merge(List<LibraryEntry> loaderLibraries, List<LibraryEntry> baseLibraries)
    {
        final Map<String, LibraryEntry> merged = new LinkedHashMap<>();
        for (final LibraryEntry entry : loaderLibraries)
            add(merged, entry);
        for (final LibraryEntry entry : baseLibraries)
            add(merged, entry);
        return new ArrayList<>(merged.values());
    }

    private void add(Map<String, LibraryEntry> merged, LibraryEntry incoming)
    {
        final String key = incoming.mergeKey();
        final LibraryEntry present = merged.get(key);
        if (present == null)
        {
            merged.put(key, incoming);
            return;
        }

        if (shouldReplace(present, incoming))
        {
            log.fine(() -> "Replacing library %s with %s.".formatted(present.coordinate(), incoming.coordinate()));
            merged.put(key, incoming);
        }
        else
        {
            log.finer(() -> "Keeping library %s over %s.".formatted(present.coordinate(), incoming.coordinate()));
        }
    }

    private boolean shouldReplace(LibraryEntry present, LibraryEntry incoming)
    {
        final @Nullable PinnedLibrary pin = pinFor(incoming);
        if (pin != null)
        {
            final boolean presentPinned = pin.isPinnedVersion(present);
            final boolean incomingPinned = pin.isPinnedVersion(incoming);
            if (presentPinned != incomingPinned)
                return incomingPinned;
        }
        return incoming.priority() > present.priority();
    }

    private @Nullable PinnedLibrary pinFor(LibraryEntry entry)
    {
        for (final PinnedLibrary pinnedLibrary : pinnedLibraries)
        {
            if (pinnedLibrary.appliesTo(entry))
                return pinnedLibrary;
        }
        return null;
    }
}
