package uibridge.settings;

/** Where a setting lives in the remote session. */
public enum SettingKind {
  /** A global variable, read under the registry's global prefix. */
  VARIABLE,
  /** An editor option, read by its own name. */
  OPTION
}
