package secenv.vault.types;

import java.nio.file.Path;

/**
 * A backup was requested but the project has no files eligible for backup.
 */
public class NoFilesFound extends Exception {
  public NoFilesFound(Path projectRoot) {
    super("no environment files found in " + projectRoot);
  }
}
