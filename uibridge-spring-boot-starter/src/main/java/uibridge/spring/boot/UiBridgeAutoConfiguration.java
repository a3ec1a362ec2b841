package uibridge.spring.boot;

import uibridge.CommandPipeline;
import uibridge.dispatch.CommandChannel;
import uibridge.settings.DefaultSettingsRegistry;
import uibridge.spi.MetricsExporter;
import uibridge.spi.RemoteSession;
import uibridge.spi.ShellIntegration;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the UI command pipeline.
 *
 * <p>Wires a {@link CommandPipeline} between an inbound {@link CommandChannel} bean and the
 * application's {@link RemoteSession}. Front-end code injects the channel and sends
 * commands to it; the pipeline is closed with the context.
 *
 * @see UiBridgeProperties
 * @see UiBridgeMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(CommandPipeline.class)
@ConditionalOnBean(RemoteSession.class)
@EnableConfigurationProperties(UiBridgeProperties.class)
public class UiBridgeAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(name = "uiCommandChannel")
  public CommandChannel uiCommandChannel() {
    return new CommandChannel("ui");
  }

  @Bean
  @ConditionalOnMissingBean
  public DefaultSettingsRegistry settingsRegistry(UiBridgeProperties props) {
    return new DefaultSettingsRegistry(props.getSettings().getGlobalPrefix());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public CommandPipeline commandPipeline(UiBridgeProperties props,
      RemoteSession remoteSession,
      @Qualifier("uiCommandChannel") CommandChannel uiCommandChannel,
      ObjectProvider<ShellIntegration> shellIntegrationProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    var builder = CommandPipeline.builder()
        .remoteSession(remoteSession)
        .inbound(uiCommandChannel)
        .executionThreads(props.getDispatcher().getExecutionThreads())
        .drainTimeoutMs(props.getDispatcher().getDrainTimeoutMs())
        .minWidth(props.getResize().getMinWidth())
        .minHeight(props.getResize().getMinHeight());
    ShellIntegration shellIntegration = shellIntegrationProvider.getIfAvailable();
    if (shellIntegration != null) {
      builder.shellIntegration(shellIntegration);
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }
}
