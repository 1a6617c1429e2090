package secenv.vault.types;

public class BackupNotFound extends Exception {
  public BackupNotFound(String message) {
    super(message);
  }

  public BackupNotFound(String message, Throwable cause) {
    super(message, cause);
  }
}
