package org.abstractica.cloudsession;

/**
 * Factory for creating CloudSession instances.
 *
 * <p>Use the builder to configure the session before creation:</p>
 * <pre>{@code
 * CloudSessionFactory factory = new DefaultCloudSessionFactory();
 * CloudSession session = factory.builder()
 *     .credentials(new Credentials("alice", sessionId))
 *     .roomId(RoomId.of(123456789L))
 *     .turbowarp(false)
 *     .build();
 * }</pre>
 */
public interface CloudSessionFactory
{
    /**
     * Creates a new session builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a CloudSession.
     */
    interface Builder
    {
        /**
         * Sets the account credentials.
         *
         * @param credentials username and session id
         * @return this builder
         */
        Builder credentials(Credentials credentials);

        /**
         * Sets the project room to join.
         *
         * @param roomId the room id
         * @return this builder
         */
        Builder roomId(RoomId roomId);

        /**
         * Sets the server endpoint.
         *
         * <p>Optional. Defaults to {@link CloudEndpoint#scratch()}.</p>
         *
         * @param endpoint the endpoint
         * @return this builder
         */
        Builder endpoint(CloudEndpoint endpoint);

        /**
         * Selects one of the two known endpoints.
         *
         * @param turbowarp true for TurboWarp, false for Scratch
         * @return this builder
         */
        Builder turbowarp(boolean turbowarp);

        /**
         * Sets the reconnect policy.
         *
         * <p>Optional. Defaults to exponential backoff with full jitter and
         * no retry limit.</p>
         *
         * @param policy the policy
         * @return this builder
         */
        Builder reconnectPolicy(ReconnectPolicy policy);

        /**
         * Sets whether the built session connects immediately.
         *
         * <p>Optional. Defaults to true. When false, call
         * {@link CloudSession#start()} to connect.</p>
         *
         * @param autoStart whether to connect on build
         * @return this builder
         */
        Builder autoStart(boolean autoStart);

        /**
         * Builds the session.
         *
         * @return the configured session
         * @throws IllegalStateException if required parameters are missing
         */
        CloudSession build();
    }
}
