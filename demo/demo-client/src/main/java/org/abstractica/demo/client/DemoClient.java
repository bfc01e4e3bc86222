package org.abstractica.demo.client;

import org.abstractica.cloudsession.CloudEvent;
import org.abstractica.cloudsession.CloudSession;
import org.abstractica.cloudsession.Credentials;
import org.abstractica.cloudsession.RoomId;
import org.abstractica.cloudsession.impl.session.DefaultCloudSessionFactory;
import org.abstractica.cloudsession.impl.transport.Transport;
import org.abstractica.cloudsession.impl.transport.WebSocketTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * Demo client application demonstrating library features.
 *
 * <p>Features demonstrated:</p>
 * <ul>
 *   <li>Session configuration from environment and arguments</li>
 *   <li>Typed event listeners for every session event</li>
 *   <li>Setting and reading cloud variables</li>
 *   <li>Autoprefix toggling</li>
 *   <li>Reconnection handled by the session</li>
 * </ul>
 */
public class DemoClient
{
    private static final Logger LOG = LoggerFactory.getLogger(DemoClient.class);

    private final CloudSession session;
    private final PrintStream out;

    public DemoClient(DemoSettings settings, Transport transport, PrintStream out)
    {
        this.out = Objects.requireNonNull(out, "out");
        this.session = new DefaultCloudSessionFactory().builder()
                .credentials(new Credentials(settings.username(), settings.sessionId()))
                .roomId(settings.roomId())
                .turbowarp(settings.turbowarp())
                .transport(transport)
                .autoStart(false)
                .build();

        registerListeners();
    }

    private void registerListeners()
    {
        session.on(CloudEvent.Open.class, (s, e) -> out.println("Connected to " + s.getEndpoint().uri()));
        session.on(CloudEvent.Close.class, (s, e) -> out.println("Disconnected: " + e.code() + " " + e.reason()));
        session.on(CloudEvent.TransportError.class, (s, e) -> LOG.warn("Transport error", e.cause()));
        session.once(CloudEvent.Setup.class, (s, e) ->
                out.println("Loaded " + s.variables().size() + " variable(s)"));
        session.on(CloudEvent.AddVariable.class, (s, e) -> out.println("+ " + e.name() + " = " + e.value()));
        session.on(CloudEvent.Set.class, (s, e) -> out.println("  " + e.name() + " = " + e.value()));
    }

    /**
     * Connects the session.
     */
    public void start()
    {
        session.start();
    }

    /**
     * Executes one console command.
     *
     * @param line the command line
     * @return false if the command asks to quit
     */
    public boolean handleCommand(String line)
    {
        String[] parts = line.trim().split("\\s+", 3);
        String command = parts[0].toLowerCase();

        switch (command)
        {
            case "":
                return true;
            case "set":
                if (parts.length < 3)
                {
                    out.println("Usage: set <name> <value>");
                }
                else if (!session.set(parts[1], parts[2]))
                {
                    out.println("Rejected: value must be numeric and at most "
                            + session.getEndpoint().maxValueLength() + " characters");
                }
                return true;
            case "get":
                if (parts.length < 2)
                {
                    out.println("Usage: get <name>");
                }
                else
                {
                    out.println(session.get(parts[1]).orElse("(unknown)"));
                }
                return true;
            case "vars":
                for (Map.Entry<String, String> entry : session.variables().entrySet())
                {
                    out.println(entry.getKey() + " = " + entry.getValue());
                }
                return true;
            case "prefix":
                if (parts.length >= 2 && parts[1].equalsIgnoreCase("off"))
                {
                    session.disableAutoPrefix();
                }
                else
                {
                    session.enableAutoPrefix();
                }
                out.println("Autoprefix " + (session.isAutoPrefix() ? "on" : "off"));
                return true;
            case "stats":
                out.printf("sent=%d queued=%d frames=%d malformed=%d attempts=%d opens=%d%n",
                        session.getStats().getPacketsSent(),
                        session.getStats().getPacketsQueued(),
                        session.getStats().getFramesReceived(),
                        session.getStats().getMalformedSegments(),
                        session.getStats().getConnectionAttempts(),
                        session.getStats().getSuccessfulOpens());
                return true;
            case "quit":
            case "exit":
                return false;
            default:
                out.println("Commands: set <name> <value>, get <name>, vars, prefix on|off, stats, quit");
                return true;
        }
    }

    /**
     * Closes the session.
     */
    public void close()
    {
        session.close();
    }

    CloudSession getSession()
    {
        return session;
    }

    public static void main(String[] args)
    {
        DemoSettings settings;
        try
        {
            settings = DemoSettings.resolve(args, System.getenv());
        }
        catch (IllegalArgumentException e)
        {
            System.err.println(e.getMessage());
            System.err.println("Usage: DemoClient [username] [sessionId] [projectId] [--turbowarp]");
            System.exit(2);
            return;
        }

        LOG.info("Starting demo client for room {} as {}", settings.roomId(), settings.username());

        DemoClient client = new DemoClient(settings, new WebSocketTransport(), System.out);
        client.start();

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)))
        {
            String line;
            while ((line = reader.readLine()) != null)
            {
                if (!client.handleCommand(line))
                {
                    break;
                }
            }
        }
        catch (IOException e)
        {
            LOG.error("Error reading console", e);
        }
        finally
        {
            client.close();
        }
    }
}
