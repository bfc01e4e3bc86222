package org.abstractica.cloudsession.impl.transport;

import org.abstractica.cloudsession.impl.transport.SimulatedTransport.SimulatedConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SimulatedTransport}.
 */
class SimulatedTransportTest
{
    private static final URI ENDPOINT = URI.create("ws://localhost/");

    private SimulatedTransport transport;
    private List<String> calls;
    private TransportListener listener;

    @BeforeEach
    void setUp()
    {
        transport = new SimulatedTransport();
        calls = new ArrayList<>();
        listener = new TransportListener()
        {
            @Override
            public void onOpen(TransportConnection connection)
            {
                calls.add("open");
            }

            @Override
            public void onMessage(String frame)
            {
                calls.add("message:" + frame);
            }

            @Override
            public void onClose(int code, String reason)
            {
                calls.add("close:" + code + ":" + reason);
            }

            @Override
            public void onError(Throwable error)
            {
                calls.add("error:" + error.getMessage());
            }
        };
    }

    @Test
    void connect_staysPendingUntilOpened()
    {
        TransportConnection connection = transport.connect(ENDPOINT, Map.of("Origin", "o"), listener);

        assertFalse(connection.isOpen());
        assertThrows(IllegalStateException.class, () -> connection.send("x"));
        assertTrue(calls.isEmpty());
        assertSame(connection, transport.lastConnection());
        assertEquals(Map.of("Origin", "o"), transport.lastConnection().headers());
    }

    @Test
    void open_thenSendAndReceive()
    {
        transport.connect(ENDPOINT, Map.of(), listener);
        SimulatedConnection connection = transport.lastConnection();

        connection.open();
        connection.send("hello\n");
        connection.receive("world");

        assertTrue(connection.isOpen());
        assertEquals(List.of("hello\n"), connection.sentFrames());
        assertEquals(List.of("open", "message:world"), calls);
        assertThrows(IllegalStateException.class, connection::open);
    }

    @Test
    void autoOpen_opensInsideConnect()
    {
        transport.setAutoOpen(true);

        TransportConnection connection = transport.connect(ENDPOINT, Map.of(), listener);

        assertTrue(connection.isOpen());
        assertEquals(List.of("open"), calls);
    }

    @Test
    void drop_reportsErrorThenAbnormalClose()
    {
        transport.connect(ENDPOINT, Map.of(), listener);
        SimulatedConnection connection = transport.lastConnection();
        connection.open();

        connection.drop(new IOException("reset"));
        connection.drop(new IOException("again"));

        assertEquals(List.of("open", "error:reset", "close:1006:reset"), calls);
        assertFalse(connection.isOpen());
    }

    @Test
    void closeFromServer_reportsCodeOnce()
    {
        transport.connect(ENDPOINT, Map.of(), listener);
        SimulatedConnection connection = transport.lastConnection();

        connection.closeFromServer(4000, "bye");
        connection.closeFromServer(4000, "bye");

        assertEquals(List.of("close:4000:bye"), calls);
    }

    @Test
    void localClose_noCallback()
    {
        transport.connect(ENDPOINT, Map.of(), listener);
        SimulatedConnection connection = transport.lastConnection();
        connection.open();
        calls.clear();

        connection.close();

        assertTrue(connection.isClosedLocally());
        assertFalse(connection.isOpen());
        assertTrue(calls.isEmpty());
        assertThrows(IllegalStateException.class, () -> connection.receive("late"));
    }

    @Test
    void lastConnection_requiresOne()
    {
        assertEquals(0, transport.connectionCount());
        assertThrows(IllegalStateException.class, transport::lastConnection);
    }
}
