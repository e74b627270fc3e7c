package nl.pim16aap2.beacon.runtime;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The fully resolved set of arguments and paths handed to the process spawn call.
 *
 * @param versionId
 *     The identifier of the profile the plan was built from.
 * @param executable
 *     The Java executable.
 * @param jvmArguments
 *     The JVM flags, including the classpath.
 * @param mainClass
 *     The main class.
 * @param gameArguments
 *     The game flags.
 * @param classpath
 *     The classpath entries, in order.
 * @param nativesDirectory
 *     The directory holding the extracted native libraries.
 * @param workingDirectory
 *     The working directory of the process.
 */
public record LaunchPlan(
    String versionId,
    String executable,
    List<String> jvmArguments,
    String mainClass,
    List<String> gameArguments,
    List<String> classpath,
    Path nativesDirectory,
    Path workingDirectory
)
{
    public LaunchPlan
    {
        Objects.requireNonNull(versionId, "versionId may not be null.");
        Objects.requireNonNull(executable, "executable may not be null.");
        Objects.requireNonNull(mainClass, "mainClass may not be null.");
        Objects.requireNonNull(nativesDirectory, "nativesDirectory may not be null.");
        Objects.requireNonNull(workingDirectory, "workingDirectory may not be null.");
        jvmArguments = List.copyOf(jvmArguments);
        gameArguments = List.copyOf(gameArguments);
        classpath = List.copyOf(classpath);
    }

    /**
     * Assembles the full command line.
     *
     * @return the executable followed by the JVM flags, the main class and the game flags.
     */
    public List<String> command()
    {
        final List<String> command = new ArrayList<>(jvmArguments.size() + gameArguments.size() + 2);
        command.add(executable);
        command.addAll(jvmArguments);
        command.add(mainClass);
        command.addAll(gameArguments);
        return command;
    }
}
