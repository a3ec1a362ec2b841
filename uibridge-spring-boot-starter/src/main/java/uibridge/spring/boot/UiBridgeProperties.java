package uibridge.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import uibridge.execute.CommandExecutor;
import uibridge.micrometer.MicrometerMetricsExporter;
import uibridge.settings.DefaultSettingsRegistry;

/**
 * Configuration properties for the UI command pipeline.
 *
 * @see UiBridgeAutoConfiguration
 */
@ConfigurationProperties(prefix = "uibridge")
public class UiBridgeProperties {

  private final Dispatcher dispatcher = new Dispatcher();
  private final Resize resize = new Resize();
  private final Settings settings = new Settings();
  private final Metrics metrics = new Metrics();

  public Dispatcher getDispatcher() {
    return dispatcher;
  }

  public Resize getResize() {
    return resize;
  }

  public Settings getSettings() {
    return settings;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Dispatcher {
    /**
     * Size of the pool that runs droppable remote calls.
     */
    private int executionThreads = 4;

    /**
     * How long closing the pipeline waits for its loops, in milliseconds.
     */
    private long drainTimeoutMs = 5000;

    public int getExecutionThreads() {
      return executionThreads;
    }

    public void setExecutionThreads(int executionThreads) {
      this.executionThreads = executionThreads;
    }

    public long getDrainTimeoutMs() {
      return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
    }
  }

  public static class Resize {
    private int minWidth = CommandExecutor.DEFAULT_MIN_WIDTH;
    private int minHeight = CommandExecutor.DEFAULT_MIN_HEIGHT;

    public int getMinWidth() {
      return minWidth;
    }

    public void setMinWidth(int minWidth) {
      this.minWidth = minWidth;
    }

    public int getMinHeight() {
      return minHeight;
    }

    public void setMinHeight(int minHeight) {
      this.minHeight = minHeight;
    }
  }

  public static class Settings {
    /**
     * Prefix prepended to variable names when reading them from the remote session.
     */
    private String globalPrefix = DefaultSettingsRegistry.DEFAULT_GLOBAL_PREFIX;

    public String getGlobalPrefix() {
      return globalPrefix;
    }

    public void setGlobalPrefix(String globalPrefix) {
      this.globalPrefix = globalPrefix;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = MicrometerMetricsExporter.DEFAULT_NAME_PREFIX;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
