@NullMarked
package nl.pim16aap2.beacon.launcher.util;

import org.jspecify.annotations.NullMarked;
