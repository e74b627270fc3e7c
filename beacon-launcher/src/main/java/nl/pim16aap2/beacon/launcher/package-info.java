/**
 * The launcher facade and its configuration.
 * <p>
 * {@link nl.pim16aap2.beacon.launcher.ClientLauncher} is the entry point. It is built from
 * {@link nl.pim16aap2.beacon.launcher.LauncherSettings} and owns every collaborator it needs.
 */
@NullMarked
package nl.pim16aap2.beacon.launcher;

import org.jspecify.annotations.NullMarked;
