package org.abstractica.demo.client;

import org.abstractica.cloudsession.RoomId;
import org.abstractica.cloudsession.impl.transport.SimulatedTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DemoClient} console commands against a simulated server.
 */
class DemoClientTest
{
    private SimulatedTransport transport;
    private ByteArrayOutputStream output;
    private DemoClient client;

    @BeforeEach
    void setUp()
    {
        transport = new SimulatedTransport(true);
        output = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(output, true, StandardCharsets.UTF_8);
        client = new DemoClient(new DemoSettings("alice", "sid", RoomId.of(42L), false), transport, out);
        client.start();
    }

    @AfterEach
    void tearDown()
    {
        client.close();
    }

    private String output()
    {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    void setThenGet_printsValue()
    {
        assertTrue(client.handleCommand("set score 12"));
        assertTrue(client.handleCommand("get score"));

        assertTrue(output().contains("12"));
        assertEquals(2, transport.lastConnection().sentFrames().size()); // handshake + set
    }

    @Test
    void set_nonNumericReportsRejection()
    {
        client.handleCommand("set score abc");

        assertTrue(output().contains("Rejected"));
        assertTrue(client.getSession().get("score").isEmpty());
    }

    @Test
    void inboundVariable_isPrinted()
    {
        transport.lastConnection().receive("{\"method\":\"set\",\"name\":\"☁ lives\",\"value\":\"3\"}\n");

        assertTrue(output().contains("+ ☁ lives = 3"));
        assertTrue(output().contains("Loaded 1 variable(s)"));
    }

    @Test
    void prefixOff_disablesAutoPrefix()
    {
        client.handleCommand("prefix off");

        assertFalse(client.getSession().isAutoPrefix());
        assertTrue(output().contains("Autoprefix off"));
    }

    @Test
    void quit_returnsFalse()
    {
        assertFalse(client.handleCommand("quit"));
        assertTrue(client.handleCommand("unknown"));
    }
}
