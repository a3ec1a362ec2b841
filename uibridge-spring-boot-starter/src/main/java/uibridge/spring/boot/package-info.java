/**
 * Spring Boot auto-configuration for the UI command pipeline.
 *
 * <p>Declare a {@link uibridge.spi.RemoteSession} bean and inject the
 * {@code uiCommandChannel} {@link uibridge.dispatch.CommandChannel} to send commands.
 */
package uibridge.spring.boot;
