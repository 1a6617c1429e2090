package secenv.vault.types;

import java.util.Arrays;
import java.util.Objects;

/**
 * One encrypted file: AES-GCM ciphertext plus everything except the key that is
 * needed to decrypt it.
 */
public record EncryptedBlob(byte[] ciphertext, byte[] salt, byte[] nonce, byte[] authTag) {

  public EncryptedBlob {
    Objects.requireNonNull(ciphertext);
    Objects.requireNonNull(salt);
    Objects.requireNonNull(nonce);
    Objects.requireNonNull(authTag);
  }

  // NOTE: Arrays use reference equality, so we need our own equals() and hashCode()

  @Override
  public boolean equals(Object obj) {
    return obj instanceof EncryptedBlob other &&
            Arrays.equals(ciphertext, other.ciphertext) &&
            Arrays.equals(salt, other.salt) &&
            Arrays.equals(nonce, other.nonce) &&
            Arrays.equals(authTag, other.authTag);
  }

  @Override
  public int hashCode() {
    int h = Arrays.hashCode(ciphertext);
    h = h * 31 + Arrays.hashCode(salt);
    h = h * 31 + Arrays.hashCode(nonce);
    return h * 31 + Arrays.hashCode(authTag);
  }

  @Override
  public String toString() {
    return "EncryptedBlob[" + ciphertext.length + " bytes]";
  }
}
