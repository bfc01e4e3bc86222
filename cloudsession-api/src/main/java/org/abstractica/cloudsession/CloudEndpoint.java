package org.abstractica.cloudsession;

import java.net.URI;
import java.util.Objects;

/**
 * Describes a cloud variable server: where it lives, how a session proves
 * who it is, and how long a variable value may be.
 *
 * <p>Two presets cover the known servers:</p>
 * <pre>{@code
 * CloudEndpoint scratch = CloudEndpoint.scratch();
 * CloudEndpoint turbowarp = CloudEndpoint.turbowarp();
 * }</pre>
 *
 * <p>Other servers are described with {@link #builder()}.</p>
 *
 * @param uri                WebSocket URI of the server
 * @param origin             value of the {@code Origin} header
 * @param credentialStrategy how the session credential is presented
 * @param maxValueLength     maximum number of characters in a variable value
 */
public record CloudEndpoint(
        URI uri,
        String origin,
        CredentialStrategy credentialStrategy,
        int maxValueLength
)
{
    /**
     * Maximum value length accepted by the Scratch cloud server.
     */
    public static final int SCRATCH_MAX_VALUE_LENGTH = 256;

    /**
     * Maximum value length accepted by the TurboWarp cloud server.
     */
    public static final int TURBOWARP_MAX_VALUE_LENGTH = 100_000;

    private static final CloudEndpoint SCRATCH = new CloudEndpoint(
            URI.create("wss://clouddata.scratch.mit.edu/"),
            "https://scratch.mit.edu",
            CredentialStrategy.SESSION_COOKIE,
            SCRATCH_MAX_VALUE_LENGTH);

    private static final CloudEndpoint TURBOWARP = new CloudEndpoint(
            URI.create("wss://clouddata.turbowarp.org/"),
            "turbowarp.org",
            CredentialStrategy.ORIGIN_ONLY,
            TURBOWARP_MAX_VALUE_LENGTH);

    /**
     * How a session presents its credential when connecting.
     */
    public enum CredentialStrategy
    {
        /**
         * Send the session id as a {@code scratchsessionsid} cookie.
         */
        SESSION_COOKIE,

        /**
         * Send no cookie; the server trusts the {@code Origin} header.
         */
        ORIGIN_ONLY
    }

    public CloudEndpoint
    {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(credentialStrategy, "credentialStrategy");
        String scheme = uri.getScheme();
        if (!"ws".equalsIgnoreCase(scheme) && !"wss".equalsIgnoreCase(scheme))
        {
            throw new IllegalArgumentException("Endpoint URI must use ws or wss: " + uri);
        }
        if (maxValueLength <= 0)
        {
            throw new IllegalArgumentException("maxValueLength must be positive: " + maxValueLength);
        }
    }

    /**
     * Returns the Scratch cloud server endpoint.
     *
     * @return the endpoint
     */
    public static CloudEndpoint scratch()
    {
        return SCRATCH;
    }

    /**
     * Returns the TurboWarp cloud server endpoint.
     *
     * @return the endpoint
     */
    public static CloudEndpoint turbowarp()
    {
        return TURBOWARP;
    }

    /**
     * Selects one of the two known endpoints.
     *
     * @param turbowarp true for TurboWarp, false for Scratch
     * @return the endpoint
     */
    public static CloudEndpoint of(boolean turbowarp)
    {
        return turbowarp ? TURBOWARP : SCRATCH;
    }

    /**
     * Creates a builder for a custom endpoint.
     *
     * @return a new builder
     */
    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Builder for custom endpoints. Unset fields take the Scratch defaults
     * except the URI, which is required.
     */
    public static final class Builder
    {
        private URI uri;
        private String origin = SCRATCH.origin();
        private CredentialStrategy credentialStrategy = CredentialStrategy.SESSION_COOKIE;
        private int maxValueLength = SCRATCH_MAX_VALUE_LENGTH;

        private Builder() {}

        public Builder uri(String uri)
        {
            return uri(URI.create(Objects.requireNonNull(uri, "uri")));
        }

        public Builder uri(URI uri)
        {
            this.uri = Objects.requireNonNull(uri, "uri");
            return this;
        }

        public Builder origin(String origin)
        {
            this.origin = Objects.requireNonNull(origin, "origin");
            return this;
        }

        public Builder credentialStrategy(CredentialStrategy credentialStrategy)
        {
            this.credentialStrategy = Objects.requireNonNull(credentialStrategy, "credentialStrategy");
            return this;
        }

        public Builder maxValueLength(int maxValueLength)
        {
            this.maxValueLength = maxValueLength;
            return this;
        }

        /**
         * Builds the endpoint.
         *
         * @return the endpoint
         * @throws IllegalStateException if no URI was set
         */
        public CloudEndpoint build()
        {
            if (uri == null)
            {
                throw new IllegalStateException("Endpoint URI must be specified");
            }
            return new CloudEndpoint(uri, origin, credentialStrategy, maxValueLength);
        }
    }
}
