/**
 * Cloud session implementation module.
 *
 * <p>Provides the default implementation of the cloud session API.</p>
 */
module cloudsession.impl
{
    requires cloudsession.api;
    requires org.slf4j;
    requires com.fasterxml.jackson.databind;
    requires java.net.http;

    // Export factory implementations for external use
    exports org.abstractica.cloudsession.impl.session;
    exports org.abstractica.cloudsession.impl.transport;

    // Export protocol and building blocks for custom transports and tooling
    exports org.abstractica.cloudsession.impl.protocol;
    exports org.abstractica.cloudsession.impl.reliability;
    exports org.abstractica.cloudsession.impl.store;
}
