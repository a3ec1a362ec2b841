package uibridge.spi;

/**
 * Operating-system shell integration, such as "open with" context menu entries.
 *
 * <p>Only some platforms provide an implementation. Each call reports success as a boolean;
 * failures are reported by the caller as diagnostics and never abort the pipeline.
 */
public interface ShellIntegration {

  /**
   * Registers the entry shown for directories.
   *
   * @return {@code true} on success
   */
  boolean registerDirectoryEntry();

  /**
   * Registers the entry shown for files.
   *
   * @return {@code true} on success
   */
  boolean registerFileEntry();

  /**
   * Removes all registered entries.
   *
   * @return {@code true} on success, {@code false} if nothing could be removed
   */
  boolean unregister();
}
