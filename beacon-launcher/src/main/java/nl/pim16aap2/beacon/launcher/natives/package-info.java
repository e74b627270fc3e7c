/**
 * Extraction of platform native libraries from their archives.
 */
@NullMarked
package nl.pim16aap2.beacon.launcher.natives;

import org.jspecify.annotations.NullMarked;
