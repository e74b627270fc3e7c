package nl.pim16aap2.beacon.launcher.process;

import com.google.errorprone.annotations.concurrent.GuardedBy;
import lombok.extern.java.Log;
import nl.pim16aap2.beacon.launcher.event.LauncherEventBus;
import nl.pim16aap2.beacon.runtime.ClientProcessHandle;
import nl.pim16aap2.beacon.runtime.LaunchPlan;
import nl.pim16aap2.beacon.runtime.error.LauncherException;
import nl.pim16aap2.beacon.runtime.error.ProcessStartFailureException;
import nl.pim16aap2.beacon.runtime.event.ClientStartedEvent;
import nl.pim16aap2.beacon.runtime.event.ClientStoppedEvent;
import nl.pim16aap2.beacon.runtime.result.StatusResult;
import nl.pim16aap2.beacon.runtime.result.StopResult;
import org.jspecify.annotations.Nullable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts, watches and stops the client process.
 * <p>
 * At most one client runs per supervisor. A process that exits within the start grace period is reported as a start
 * failure together with the last lines it printed.
 */
@Log
public final class ClientProcessSupervisor
{
    public static final Duration START_GRACE_PERIOD = Duration.ofSeconds(3);
    public static final Duration STOP_GRACE_PERIOD = Duration.ofSeconds(3);
    static final int OUTPUT_TAIL_LINES = 40;
    private static final long OUTPUT_READER_JOIN_MILLIS = 1_000L;

    private final LauncherEventBus eventBus;
    private final ProcessStarter processStarter;
    private final LivenessProbe livenessProbe;
    private final Clock clock;
    private final Duration startGracePeriod;
    private final Duration stopGracePeriod;

    private final Object lock = new Object();
    @GuardedBy("lock")
    private @Nullable RunningClient running;
    @GuardedBy("lock")
    private boolean launching;

    public ClientProcessSupervisor(LauncherEventBus eventBus, Duration startGracePeriod, Duration stopGracePeriod)
    {
        this(eventBus, ClientProcessSupervisor::startProcess, process -> process.toHandle().isAlive(),
            Clock.systemUTC(), startGracePeriod, stopGracePeriod);
    }

    ClientProcessSupervisor(
        LauncherEventBus eventBus,
        ProcessStarter processStarter,
        LivenessProbe livenessProbe,
        Clock clock,
        Duration startGracePeriod,
        Duration stopGracePeriod)
    {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus may not be null.");
        this.processStarter = Objects.requireNonNull(processStarter, "processStarter may not be null.");
        this.livenessProbe = Objects.requireNonNull(livenessProbe, "livenessProbe may not be null.");
        this.clock = Objects.requireNonNull(clock, "clock may not be null.");
        this.startGracePeriod = Objects.requireNonNull(startGracePeriod, "startGracePeriod may not be null.");
        this.stopGracePeriod = Objects.requireNonNull(stopGracePeriod, "stopGracePeriod may not be null.");
    }

    /**
     * Spawns the client described by a launch plan.
     *
     * @param plan
     *     The plan to run.
     * @return the handle of the running client.
     * @throws ProcessStartFailureException
     *     If the process exited within the start grace period.
     * @throws LauncherException
     *     If a client is already running, or if the process could not be spawned.
     */
    public ClientProcessHandle launch(LaunchPlan plan)
        throws LauncherException
    {
        synchronized (lock)
        {
            if (launching || isAlive(running))
                throw new LauncherException("A client is already running.");
            running = null;
            launching = true;
        }

        try
        {
            final RunningClient client = spawn(plan);
            synchronized (lock)
            {
                running = client;
            }
            client.process().onExit().thenAccept(ignored -> onExit(client));
            eventBus.post(new ClientStartedEvent(client.handle()));
            log.info(() -> "Started client %s with pid %d.".formatted(plan.versionId(), client.handle().pid()));
            return client.handle();
        }
        finally
        {
            synchronized (lock)
            {
                launching = false;
            }
        }
    }

    private RunningClient spawn(LaunchPlan plan)
        throws LauncherException
    {
        final Process process;
        try
        {
            process = processStarter.start(plan);
        }
        catch (IOException exception)
        {
            throw new LauncherException("Failed to start client %s.".formatted(plan.versionId()), exception);
        }

        final OutputTail outputTail = new OutputTail(OUTPUT_TAIL_LINES);
        final Thread outputThread = createOutputReaderThread(process, outputTail);
        outputThread.start();

        final boolean exited;
        try
        {
            exited = process.waitFor(startGracePeriod.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (InterruptedException exception)
        {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new LauncherException("Interrupted while starting client %s.".formatted(plan.versionId()),
                exception);
        }

        if (exited)
        {
            joinQuietly(outputThread);
            final int exitCode = process.exitValue();
            log.warning(() -> "Client %s exited during startup with code %d.".formatted(plan.versionId(), exitCode));
            throw new ProcessStartFailureException(exitCode, outputTail.text());
        }

        return new RunningClient(
            process,
            new ClientProcessHandle(process.pid(), plan.versionId(), clock.instant()),
            new AtomicBoolean(false),
            new AtomicBoolean(false)
        );
    }

    /**
     * Stops the running client, if any.
     * <p>
     * The process is asked to terminate first and is killed when it is still alive after the stop grace period.
     *
     * @return whether a client was running and whether it had to be killed.
     */
    public StopResult stop()
    {
        final RunningClient client;
        synchronized (lock)
        {
            client = running;
        }
        if (client == null || !isAlive(client))
        {
            clear(client);
            return StopResult.notRunning();
        }

        client.stopRequested().set(true);
        final Process process = client.process();
        boolean forced = false;
        try
        {
            process.destroy();
            if (!process.waitFor(stopGracePeriod.toMillis(), TimeUnit.MILLISECONDS))
            {
                log.warning(() -> "Client %s did not stop within %d ms; killing it."
                    .formatted(client.handle().versionId(), stopGracePeriod.toMillis()));
                forced = true;
                process.destroyForcibly();
                process.waitFor(stopGracePeriod.toMillis(), TimeUnit.MILLISECONDS);
            }
        }
        catch (InterruptedException exception)
        {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return StopResult.failure("Interrupted while stopping the client.");
        }

        if (process.isAlive())
            return StopResult.failure("Client with pid %d is still alive.".formatted(client.handle().pid()));

        clear(client);
        publishStopped(client);
        return StopResult.stopped(forced);
    }

    /**
     * Checks whether the client is still running.
     * <p>
     * The handle is dropped as soon as the process is found to be gone.
     */
    public StatusResult status()
    {
        final RunningClient client;
        synchronized (lock)
        {
            client = running;
        }
        if (client == null)
            return StatusResult.notRunning();
        if (!isAlive(client))
        {
            clear(client);
            publishStopped(client);
            return StatusResult.notRunning();
        }
        return StatusResult.running(client.handle());
    }

    private void onExit(RunningClient client)
    {
        clear(client);
        publishStopped(client);
    }

    private void clear(@Nullable RunningClient client)
    {
        if (client == null)
            return;
        synchronized (lock)
        {
            if (running == client)
                running = null;
        }
    }

    private void publishStopped(RunningClient client)
    {
        if (!client.stoppedPublished().compareAndSet(false, true))
            return;

        final int exitCode = client.process().isAlive() ? -1 : client.process().exitValue();
        log.info(() -> "Client %s stopped with exit code %d.".formatted(client.handle().versionId(), exitCode));
        eventBus.post(new ClientStoppedEvent(client.handle(), exitCode, client.stopRequested().get()));
    }

    private boolean isAlive(@Nullable RunningClient client)
    {
        return client != null && livenessProbe.isAlive(client.process());
    }

    private static Process startProcess(LaunchPlan plan)
        throws IOException
    {
        final ProcessBuilder processBuilder = new ProcessBuilder(plan.command());
        processBuilder.directory(plan.workingDirectory().toFile());
        processBuilder.redirectErrorStream(true);
        return processBuilder.start();
    }

    private static Thread createOutputReaderThread(Process process, OutputTail outputTail)
    {
        final Thread thread = new Thread(() ->
        {
            try (
                BufferedReader reader =
                    new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)))
            {
                String line;
                while ((line = reader.readLine()) != null)
                {
                    outputTail.add(line);
                    final String outputLine = line;
                    log.finest(() -> "[client] " + outputLine);
                }
            }
            catch (IOException exception)
            {
                log.fine(() -> "Client output reader stopped: " + exception.getMessage());
            }
        }, "beacon-client-output-reader");
        thread.setDaemon(true);
        return thread;
    }

    private static void joinQuietly(Thread thread)
    {
        try
        {
            thread.join(OUTPUT_READER_JOIN_MILLIS);
        }
        catch (InterruptedException exception)
        {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Spawns the operating system process for a plan.
     */
    @FunctionalInterface
    interface ProcessStarter
    {
        Process start(LaunchPlan plan)
            throws IOException;
    }

    /**
     * Checks whether a spawned process is still alive.
     */
    @FunctionalInterface
    interface LivenessProbe
    {
        boolean isAlive(Process process);
    }

    private record RunningClient(
        Process process,
        ClientProcessHandle handle,
        AtomicBoolean stopRequested,
        AtomicBoolean stoppedPublished
    )
    {
    }
}
