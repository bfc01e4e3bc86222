package org.abstractica.demo.client;

import org.abstractica.cloudsession.RoomId;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Demo client settings resolved from command-line arguments and the
 * environment. Arguments win over environment variables.
 *
 * <p>Environment variables: {@code CLOUD_USERNAME}, {@code CLOUD_SESSION_ID},
 * {@code CLOUD_PROJECT_ID}, {@code CLOUD_TURBOWARP}.</p>
 *
 * @param username  account name
 * @param sessionId session token, may be empty for TurboWarp
 * @param roomId    project room
 * @param turbowarp whether to use the TurboWarp server
 */
public record DemoSettings(String username, String sessionId, RoomId roomId, boolean turbowarp)
{
    static final String ENV_USERNAME = "CLOUD_USERNAME";
    static final String ENV_SESSION_ID = "CLOUD_SESSION_ID";
    static final String ENV_PROJECT_ID = "CLOUD_PROJECT_ID";
    static final String ENV_TURBOWARP = "CLOUD_TURBOWARP";

    /**
     * Resolves settings.
     *
     * @param args positional {@code [username] [sessionId] [projectId]} plus optional {@code --turbowarp}
     * @param env  environment variables
     * @return the settings
     * @throws IllegalArgumentException if a required setting is missing or invalid
     */
    public static DemoSettings resolve(String[] args, Map<String, String> env)
    {
        boolean turbowarp = Boolean.parseBoolean(env.getOrDefault(ENV_TURBOWARP, "false"));
        List<String> positional = new ArrayList<>();
        for (String arg : args)
        {
            if (arg.equals("--turbowarp"))
            {
                turbowarp = true;
            }
            else
            {
                positional.add(arg);
            }
        }

        String username = pick(positional, 0, env.get(ENV_USERNAME));
        String sessionId = pick(positional, 1, env.get(ENV_SESSION_ID));
        String projectId = pick(positional, 2, env.get(ENV_PROJECT_ID));

        if (username == null || username.isBlank())
        {
            throw new IllegalArgumentException("Missing username (argument 1 or " + ENV_USERNAME + ")");
        }
        if (projectId == null || projectId.isBlank())
        {
            throw new IllegalArgumentException("Missing project id (argument 3 or " + ENV_PROJECT_ID + ")");
        }
        if (sessionId == null)
        {
            if (!turbowarp)
            {
                throw new IllegalArgumentException("Missing session id (argument 2 or " + ENV_SESSION_ID + ")");
            }
            sessionId = "";
        }

        return new DemoSettings(username, sessionId, parseRoomId(projectId), turbowarp);
    }

    private static String pick(List<String> positional, int index, String fallback)
    {
        return index < positional.size() ? positional.get(index) : fallback;
    }

    private static RoomId parseRoomId(String projectId)
    {
        try
        {
            return RoomId.of(Long.parseLong(projectId));
        }
        catch (NumberFormatException e)
        {
            return RoomId.of(projectId);
        }
    }
}
