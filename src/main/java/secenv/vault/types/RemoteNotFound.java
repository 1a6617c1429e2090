package secenv.vault.types;

public class RemoteNotFound extends Exception {
  public RemoteNotFound(String message, Throwable cause) {
    super(message, cause);
  }
}
