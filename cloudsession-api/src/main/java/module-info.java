/**
 * Cloud session API module.
 *
 * <p>Provides interfaces for reading and writing cloud variables shared by
 * every client connected to the same project room.</p>
 */
module cloudsession.api
{
    exports org.abstractica.cloudsession;
    exports org.abstractica.cloudsession.handlers;
}
