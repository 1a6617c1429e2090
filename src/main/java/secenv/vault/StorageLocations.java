package secenv.vault;

import com.google.common.annotations.VisibleForTesting;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Where containers and configuration live on this machine.
 */
public abstract class StorageLocations {

  public static final String HOME_VARIABLE = "SECENV_HOME";

  public static Path defaultRoot() {
    return rootFor(System.getenv(), System.getProperty("os.name", ""), System.getProperty("user.home"));
  }

  /**
   * Pick the storage root.  In order of preference:
   * <ol>
   *   <li><code>$SECENV_HOME</code>, if set;</li>
   *   <li><code>%APPDATA%\SecuredEnv</code> on Windows;</li>
   *   <li><code>~/Library/Application Support/SecuredEnv</code> on macOS;</li>
   *   <li><code>$XDG_CONFIG_HOME/securedenv</code>, or <code>~/.config/securedenv</code>.</li>
   * </ol>
   */
  @VisibleForTesting
  static Path rootFor(Map<String, String> env, String osName, String home) {
    String explicit = env.get(HOME_VARIABLE);
    if (explicit != null && !explicit.isEmpty()) {
      return Paths.get(explicit);
    }

    String os = osName.toLowerCase(Locale.ROOT);
    if (os.startsWith("windows")) {
      String appData = env.get("APPDATA");
      return appData != null && !appData.isEmpty()
              ? Paths.get(appData, "SecuredEnv")
              : Paths.get(home, "AppData", "Roaming", "SecuredEnv");
    }
    if (os.startsWith("mac")) {
      return Paths.get(home, "Library", "Application Support", "SecuredEnv");
    }

    String xdg = env.get("XDG_CONFIG_HOME");
    return xdg != null && !xdg.isEmpty()
            ? Paths.get(xdg, "securedenv")
            : Paths.get(home, ".config", "securedenv");
  }

}
