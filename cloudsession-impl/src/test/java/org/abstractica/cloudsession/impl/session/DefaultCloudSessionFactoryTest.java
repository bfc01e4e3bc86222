package org.abstractica.cloudsession.impl.session;

import org.abstractica.cloudsession.CloudEndpoint;
import org.abstractica.cloudsession.CloudSession;
import org.abstractica.cloudsession.Credentials;
import org.abstractica.cloudsession.ReconnectPolicy;
import org.abstractica.cloudsession.RoomId;
import org.abstractica.cloudsession.impl.transport.SimulatedTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DefaultCloudSessionFactory}.
 */
class DefaultCloudSessionFactoryTest
{
    private DefaultCloudSessionFactory factory;
    private SimulatedTransport transport;
    private ManualTaskScheduler scheduler;

    @BeforeEach
    void setUp()
    {
        factory = new DefaultCloudSessionFactory();
        transport = new SimulatedTransport();
        scheduler = new ManualTaskScheduler();
    }

    @Test
    void build_startsByDefault()
    {
        CloudSession session = factory.builder()
                .credentials(new Credentials("alice", "secret"))
                .roomId(RoomId.of(1L))
                .transport(transport)
                .scheduler(scheduler)
                .build();

        assertEquals(1, transport.connectionCount());
        assertEquals(CloudEndpoint.scratch(), session.getEndpoint());
        assertEquals(RoomId.of(1L), session.getRoomId());
        session.close();
        assertTrue(scheduler.isShutdown());
    }

    @Test
    void build_withoutAutoStartStaysIdle()
    {
        CloudSession session = factory.builder()
                .credentials(new Credentials("alice", "secret"))
                .roomId(RoomId.of("abc"))
                .transport(transport)
                .scheduler(scheduler)
                .autoStart(false)
                .build();

        assertEquals(0, transport.connectionCount());
        assertEquals(ConnectionState.IDLE, ((DefaultCloudSession) session).getConnectionState());
    }

    @Test
    void turbowarp_selectsTurbowarpEndpoint()
    {
        CloudSession session = factory.builder()
                .credentials(new Credentials("alice", ""))
                .roomId(RoomId.of(1L))
                .turbowarp(true)
                .transport(transport)
                .scheduler(scheduler)
                .build();

        assertEquals(CloudEndpoint.turbowarp(), session.getEndpoint());
        assertEquals("wss://clouddata.turbowarp.org/", transport.lastConnection().uri().toString());
    }

    @Test
    void reconnectPolicy_isUsed()
    {
        factory.builder()
                .credentials(new Credentials("alice", "secret"))
                .roomId(RoomId.of(1L))
                .reconnectPolicy(ReconnectPolicy.fixedDelay(5000))
                .transport(transport)
                .scheduler(scheduler)
                .build();

        transport.lastConnection().closeFromServer(1006, "gone");

        assertEquals(List.of(5000L), scheduler.delays());
    }

    @Test
    void build_requiresCredentialsAndRoom()
    {
        assertThrows(IllegalStateException.class, () -> factory.builder()
                .roomId(RoomId.of(1L))
                .build());
        assertThrows(IllegalStateException.class, () -> factory.builder()
                .credentials(new Credentials("alice", "secret"))
                .build());
        assertThrows(NullPointerException.class, () -> factory.builder().transport(null));
    }
}
