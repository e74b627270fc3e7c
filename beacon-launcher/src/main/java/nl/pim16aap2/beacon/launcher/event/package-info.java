@NullMarked
package nl.pim16aap2.beacon.launcher.event;

import org.jspecify.annotations.NullMarked;
