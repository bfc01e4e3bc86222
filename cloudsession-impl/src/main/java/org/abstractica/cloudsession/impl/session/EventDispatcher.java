package org.abstractica.cloudsession.impl.session;

import org.abstractica.cloudsession.CloudEvent;
import org.abstractica.cloudsession.CloudSession;
import org.abstractica.cloudsession.Subscription;
import org.abstractica.cloudsession.handlers.EventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Keeps event listeners in registration order and invokes the ones whose
 * type matches each dispatched event.
 *
 * <p>Not thread-safe. The owning session confines access to its lock.</p>
 */
public class EventDispatcher
{
    private static final Logger LOG = LoggerFactory.getLogger(EventDispatcher.class);

    private final List<Registration<?>> registrations = new ArrayList<>();

    /**
     * A registered listener.
     */
    private final class Registration<E extends CloudEvent> implements Subscription
    {
        private final Class<E> type;
        private final EventListener<? super E> listener;
        private final boolean once;

        Registration(Class<E> type, EventListener<? super E> listener, boolean once)
        {
            this.type = type;
            this.listener = listener;
            this.once = once;
        }

        void invoke(CloudSession session, CloudEvent event)
        {
            listener.handle(session, type.cast(event));
        }

        @Override
        public void cancel()
        {
            registrations.remove(this);
        }
    }

    /**
     * Registers a listener.
     *
     * @param type     the event class
     * @param listener the listener
     * @param once     whether to remove the listener after its first invocation
     * @param <E>      the event type
     * @return the registration handle
     */
    public <E extends CloudEvent> Subscription add(Class<E> type, EventListener<? super E> listener, boolean once)
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(listener, "listener");

        Registration<E> registration = new Registration<>(type, listener, once);
        registrations.add(registration);
        return registration;
    }

    /**
     * Removes the earliest registration of a listener for a type.
     *
     * @param type     the event class
     * @param listener the listener
     * @return true if a registration was removed
     */
    public boolean remove(Class<? extends CloudEvent> type, EventListener<?> listener)
    {
        Iterator<Registration<?>> iter = registrations.iterator();
        while (iter.hasNext())
        {
            Registration<?> registration = iter.next();
            if (registration.type.equals(type) && registration.listener.equals(listener))
            {
                iter.remove();
                return true;
            }
        }
        return false;
    }

    /**
     * Invokes every listener registered for the event's type or a supertype.
     *
     * <p>Once-listeners are removed before they run. A listener that throws
     * is logged and does not prevent the others from running.</p>
     *
     * @param session the session the event belongs to
     * @param event   the event
     */
    public void dispatch(CloudSession session, CloudEvent event)
    {
        List<Registration<?>> matching = new ArrayList<>();
        for (Registration<?> registration : registrations)
        {
            if (registration.type.isInstance(event))
            {
                matching.add(registration);
            }
        }

        for (Registration<?> registration : matching)
        {
            if (registration.once)
            {
                if (!registrations.remove(registration))
                {
                    // Cancelled by an earlier listener for this event.
                    continue;
                }
            }
            else if (!registrations.contains(registration))
            {
                continue;
            }

            try
            {
                registration.invoke(session, event);
            }
            catch (Exception e)
            {
                LOG.error("Listener for {} failed", event.getClass().getSimpleName(), e);
            }
        }
    }

    /**
     * Returns the number of registered listeners.
     *
     * @return listener count
     */
    public int size()
    {
        return registrations.size();
    }
}
