/**
 * Demo client module.
 *
 * <p>Demonstrates library usage with an interactive cloud variable console.</p>
 */
module demo.client
{
    requires cloudsession.api;
    requires cloudsession.impl;
    requires org.slf4j;
}
