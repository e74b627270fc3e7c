package nl.pim16aap2.beacon.launcher.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import lombok.extern.java.Log;

import java.util.logging.Level;

/**
 * Publish/subscribe channel for lifecycle and progress notifications.
 * <p>
 * Listeners register objects with {@link com.google.common.eventbus.Subscribe} methods; events are delivered on the
 * publishing thread. A failing listener is logged and does not affect the publisher.
 */
@Log
public class LauncherEventBus
{
    private final EventBus eventBus;

    public LauncherEventBus()
    {
        this.eventBus = new EventBus(LauncherEventBus::logSubscriberFailure);
    }

    public void post(Object event)
    {
        log.fine(() -> "Posting event: " + event);
        eventBus.post(event);
    }

    public void register(Object listener)
    {
        log.finer(() -> "Registering listener: " + listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener)
    {
        log.finer(() -> "Unregistering listener: " + listener.getClass().getName());
        eventBus.unregister(listener);
    }

    private static void logSubscriberFailure(Throwable exception, SubscriberExceptionContext context)
    {
        log.log(
            Level.WARNING,
            exception,
            () -> "Listener %s failed to handle %s."
                .formatted(context.getSubscriber().getClass().getName(), context.getEvent())
        );
    }
}
