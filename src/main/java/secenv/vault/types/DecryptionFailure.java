package secenv.vault.types;

/**
 * Ciphertext failed authentication: the key is wrong, or the data was tampered
 * with or corrupted.  No plaintext is ever produced in this case.
 */
public class DecryptionFailure extends Exception {
  public DecryptionFailure(String message) {
    super(message);
  }

  public DecryptionFailure(String message, Throwable cause) {
    super(message, cause);
  }
}
