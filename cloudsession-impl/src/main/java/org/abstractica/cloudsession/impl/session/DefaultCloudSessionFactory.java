package org.abstractica.cloudsession.impl.session;

import org.abstractica.cloudsession.CloudEndpoint;
import org.abstractica.cloudsession.CloudSession;
import org.abstractica.cloudsession.CloudSessionFactory;
import org.abstractica.cloudsession.Credentials;
import org.abstractica.cloudsession.ReconnectPolicy;
import org.abstractica.cloudsession.RoomId;
import org.abstractica.cloudsession.impl.reliability.ExponentialBackoff;
import org.abstractica.cloudsession.impl.transport.Transport;
import org.abstractica.cloudsession.impl.transport.WebSocketTransport;

import java.util.Objects;

/**
 * Default implementation of CloudSessionFactory.
 */
public class DefaultCloudSessionFactory implements CloudSessionFactory
{
    @Override
    public DefaultBuilder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private Credentials credentials;
        private RoomId roomId;
        private CloudEndpoint endpoint = CloudEndpoint.scratch();
        private ReconnectPolicy reconnectPolicy;
        private boolean autoStart = true;
        private Transport transport; // Optional custom transport (defaults to WebSocketTransport)
        private TaskScheduler scheduler; // Optional custom scheduler (defaults to a daemon thread)

        @Override
        public DefaultBuilder credentials(Credentials credentials)
        {
            this.credentials = Objects.requireNonNull(credentials, "credentials");
            return this;
        }

        @Override
        public DefaultBuilder roomId(RoomId roomId)
        {
            this.roomId = Objects.requireNonNull(roomId, "roomId");
            return this;
        }

        @Override
        public DefaultBuilder endpoint(CloudEndpoint endpoint)
        {
            this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
            return this;
        }

        @Override
        public DefaultBuilder turbowarp(boolean turbowarp)
        {
            this.endpoint = CloudEndpoint.of(turbowarp);
            return this;
        }

        @Override
        public DefaultBuilder reconnectPolicy(ReconnectPolicy policy)
        {
            this.reconnectPolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        @Override
        public DefaultBuilder autoStart(boolean autoStart)
        {
            this.autoStart = autoStart;
            return this;
        }

        /**
         * Sets the transport used to open connections.
         *
         * <p>If not set, {@link WebSocketTransport} is used. Use
         * {@link org.abstractica.cloudsession.impl.transport.SimulatedTransport}
         * for testing or local development.</p>
         *
         * @param transport the transport to use
         * @return this builder
         */
        public DefaultBuilder transport(Transport transport)
        {
            this.transport = Objects.requireNonNull(transport, "transport");
            return this;
        }

        /**
         * Sets the scheduler that runs reconnect attempts.
         *
         * <p>If not set, each session gets its own daemon thread.</p>
         *
         * @param scheduler the scheduler to use
         * @return this builder
         */
        public DefaultBuilder scheduler(TaskScheduler scheduler)
        {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
            return this;
        }

        @Override
        public CloudSession build()
        {
            if (credentials == null)
            {
                throw new IllegalStateException("Credentials must be specified");
            }
            if (roomId == null)
            {
                throw new IllegalStateException("Room id must be specified");
            }

            ReconnectPolicy policy = (reconnectPolicy != null) ? reconnectPolicy : new ExponentialBackoff();
            Transport net = (transport != null) ? transport : new WebSocketTransport();
            TaskScheduler tasks = (scheduler != null)
                    ? scheduler
                    : new ExecutorTaskScheduler("cloud-session-" + roomId);

            DefaultCloudSession session = new DefaultCloudSession(credentials, roomId, endpoint, net, policy, tasks);
            if (autoStart)
            {
                session.start();
            }
            return session;
        }
    }
}
