/**
 * Root API for uibridge: a command pipeline between a graphical front-end and a remote
 * editor session.
 *
 * <h2>Core Design</h2>
 * <p>The front-end sends {@link uibridge.command.UiCommand}s to an inbound
 * {@linkplain uibridge.dispatch.CommandChannel channel}. A router classifies each command.
 * Pure-state commands (resize, scroll, drag) are <em>droppable</em>: bursts collapse to the
 * most recent value, which is executed without blocking intake. Everything else is
 * <em>guaranteed</em>: executed exactly once, in submission order, each call completing
 * before the next starts. There is no ordering between the two paths.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>uibridge-core</b> - command model, pipeline, SPIs, settings registry (zero external deps)</li>
 *   <li><b>uibridge-micrometer</b> - Micrometer metrics exporter</li>
 *   <li><b>uibridge-spring-boot-starter</b> - auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * CommandChannel inbound = new CommandChannel("ui");
 * CommandPipeline pipeline = CommandPipeline.builder()
 *     .remoteSession(session)
 *     .inbound(inbound)
 *     .build();
 *
 * inbound.send(new UiCommand.Resize(120, 40));
 * inbound.send(new UiCommand.Keyboard("ihello<Esc>"));
 * inbound.send(new UiCommand.Quit());
 *
 * inbound.close();                       // router cancels the shutdown signal
 * pipeline.awaitTermination(1, TimeUnit.SECONDS);
 * }</pre>
 *
 * @see uibridge.CommandPipeline
 * @see uibridge.command.UiCommand
 * @see uibridge.spi.RemoteSession
 */
package uibridge;
