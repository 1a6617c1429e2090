package secenv.vault.types;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * The secret an operation's encryption key is derived from: either a {@link Password}
 * typed by a person or a {@link RawKey} read from a key file.
 */
public interface KeyMaterial {

  /**
   * @return the bytes the key derivation starts from
   */
  byte[] derivationInput();

  record Password(String value) implements KeyMaterial {
    public Password {
      Objects.requireNonNull(value);
    }

    @Override
    public byte[] derivationInput() {
      return value.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
      return "Password[***]";
    }
  }

  record RawKey(byte[] bytes) implements KeyMaterial {
    public RawKey {
      Objects.requireNonNull(bytes);
    }

    @Override
    public byte[] derivationInput() {
      return bytes.clone();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof RawKey other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
      return "RawKey[" + bytes.length + " bytes]";
    }
  }

}
