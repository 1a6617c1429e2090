package secenv.prim.transforms;

import java.nio.charset.StandardCharsets;

/**
 * XOR with a fixed, repeating key.  The output is unreadable at a glance and
 * nothing more: anyone who knows the key (it is public) can undo it.  It is
 * NOT encryption and protects nothing; confidentiality has to come from
 * somewhere else.
 *
 * <p>XOR is its own inverse, so {@link #apply(byte[])} and {@link #unApply(byte[])}
 * compute the same function.
 */
public class Obfuscation implements BlobTransformer {

  private final byte[] key;

  public Obfuscation(String key) {
    this.key = key.getBytes(StandardCharsets.US_ASCII);
    if (this.key.length == 0) {
      throw new IllegalArgumentException("obfuscation key may not be empty");
    }
  }

  private byte[] xor(byte[] data) {
    byte[] result = new byte[data.length];
    for (int i = 0; i < data.length; ++i) {
      result[i] = (byte)(data[i] ^ key[i % key.length]);
    }
    return result;
  }

  @Override
  public byte[] apply(byte[] data) {
    return xor(data);
  }

  @Override
  public byte[] unApply(byte[] data) {
    return xor(data);
  }

}
