package org.abstractica.cloudsession.handlers;

import org.abstractica.cloudsession.CloudEvent;
import org.abstractica.cloudsession.CloudSession;

/**
 * Handles session events of a specific type.
 *
 * <p>Listeners are registered per event type and invoked in registration
 * order. They are called while the session holds its internal lock, from
 * either the caller's thread or a transport thread; a listener that needs
 * to do slow work should hand the event off elsewhere.</p>
 *
 * @param <E> the event type this listener processes
 */
@FunctionalInterface
public interface EventListener<E extends CloudEvent>
{
    /**
     * Handles an event.
     *
     * @param session the session that produced the event
     * @param event   the event
     */
    void handle(CloudSession session, E event);
}
