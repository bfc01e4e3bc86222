package org.abstractica.cloudsession;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CloudEndpoint}.
 */
class CloudEndpointTest
{
    @Test
    void scratchPreset()
    {
        CloudEndpoint endpoint = CloudEndpoint.scratch();

        assertEquals(URI.create("wss://clouddata.scratch.mit.edu/"), endpoint.uri());
        assertEquals("https://scratch.mit.edu", endpoint.origin());
        assertEquals(CloudEndpoint.CredentialStrategy.SESSION_COOKIE, endpoint.credentialStrategy());
        assertEquals(256, endpoint.maxValueLength());
    }

    @Test
    void turbowarpPreset()
    {
        CloudEndpoint endpoint = CloudEndpoint.turbowarp();

        assertEquals(URI.create("wss://clouddata.turbowarp.org/"), endpoint.uri());
        assertEquals("turbowarp.org", endpoint.origin());
        assertEquals(CloudEndpoint.CredentialStrategy.ORIGIN_ONLY, endpoint.credentialStrategy());
        assertEquals(100_000, endpoint.maxValueLength());
    }

    @Test
    void of_selectsPreset()
    {
        assertSame(CloudEndpoint.turbowarp(), CloudEndpoint.of(true));
        assertSame(CloudEndpoint.scratch(), CloudEndpoint.of(false));
    }

    @Test
    void builder_defaultsToScratchSettings()
    {
        CloudEndpoint endpoint = CloudEndpoint.builder()
                .uri("ws://localhost:8080/")
                .build();

        assertEquals(URI.create("ws://localhost:8080/"), endpoint.uri());
        assertEquals("https://scratch.mit.edu", endpoint.origin());
        assertEquals(CloudEndpoint.SCRATCH_MAX_VALUE_LENGTH, endpoint.maxValueLength());
    }

    @Test
    void builder_customValues()
    {
        CloudEndpoint endpoint = CloudEndpoint.builder()
                .uri("wss://cloud.example.org/")
                .origin("example.org")
                .credentialStrategy(CloudEndpoint.CredentialStrategy.ORIGIN_ONLY)
                .maxValueLength(1024)
                .build();

        assertEquals("example.org", endpoint.origin());
        assertEquals(CloudEndpoint.CredentialStrategy.ORIGIN_ONLY, endpoint.credentialStrategy());
        assertEquals(1024, endpoint.maxValueLength());
    }

    @Test
    void invalidEndpointsRejected()
    {
        assertThrows(IllegalStateException.class, () -> CloudEndpoint.builder().build());
        assertThrows(IllegalArgumentException.class, () -> CloudEndpoint.builder().uri("https://example.org/").build());
        assertThrows(IllegalArgumentException.class,
                () -> CloudEndpoint.builder().uri("ws://example.org/").maxValueLength(0).build());
        assertThrows(NullPointerException.class, () -> CloudEndpoint.builder().origin(null));
    }
}
