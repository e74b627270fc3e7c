/**
 * Idempotent, retrying download of every file a version profile references.
 */
@NullMarked
package nl.pim16aap2.beacon.launcher.download;

import org.jspecify.annotations.NullMarked;
