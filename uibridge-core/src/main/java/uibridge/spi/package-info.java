/**
 * Service provider interfaces for the collaborators the pipeline drives.
 *
 * <ul>
 *   <li>{@link uibridge.spi.RemoteSession} - thread-safe procedure-call handle on the editor</li>
 *   <li>{@link uibridge.spi.ShellIntegration} - platform shell entries, optional</li>
 *   <li>{@link uibridge.spi.MetricsExporter} - counters and gauges, defaults to no-op</li>
 * </ul>
 */
package uibridge.spi;
