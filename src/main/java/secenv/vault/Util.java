package secenv.vault;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Console;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;

public abstract class Util {

  /**
   * The suggested size of in-memory byte buffers for I/O.
   * The value is 8192, which is currently the size used by {@link BufferedInputStream}
   * on desktop JVMs.
   */
  public static final int SUGGESTED_BUFFER_SIZE = 8192;

  /**
   * A thread-local byte array of {@link #SUGGESTED_BUFFER_SIZE} bytes.
   */
  private static final ThreadLocal<byte[]> MEM_BUFFER = ThreadLocal.withInitial(() -> new byte[SUGGESTED_BUFFER_SIZE]);

  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  public static long copyStream(InputStream in, OutputStream out) throws IOException {
    byte[] buf = MEM_BUFFER.get();
    long count = 0;
    int n;
    while ((n = in.read(buf)) >= 0) {
      out.write(buf, 0, n);
      count += n;
    }
    return count;
  }

  public static byte[] read(InputStream in) throws IOException {
    try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      copyStream(in, out);
      return out.toByteArray();
    }
  }

  public static MessageDigest sha256Digest() {
    MessageDigest md;
    try {
      md = MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      // This should never happen; all JREs are required to support
      // SHA-256 (as well as MD5 and SHA-1).
      throw new UnsupportedOperationException(e);
    }
    return md;
  }

  public static byte[] sha256(byte[]... chunks) {
    MessageDigest md = sha256Digest();
    for (byte[] chunk : chunks) {
      md.update(chunk);
    }
    return md.digest();
  }

  public static byte[] utf8(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  public static byte[] concat(byte[] a, byte[] b) {
    byte[] result = Arrays.copyOf(a, a.length + b.length);
    System.arraycopy(b, 0, result, a.length, b.length);
    return result;
  }

  /**
   * Fill a fresh array from a cryptographically secure source.
   * {@link SecureRandom} is thread-safe, so one instance serves every caller.
   * @param length the number of bytes
   * @return an array of random bytes
   */
  public static byte[] randomBytes(int length) {
    byte[] result = new byte[length];
    SECURE_RANDOM.nextBytes(result);
    return result;
  }

  private static final String HEX_CHARS = "0123456789abcdef";
  public static String toHex(byte[] bytes) {
    StringBuilder builder = new StringBuilder(bytes.length * 2);
    for (byte b : bytes) {
      int i = Byte.toUnsignedInt(b);
      builder.append(HEX_CHARS.charAt((i >> 4) & 0xF));
      builder.append(HEX_CHARS.charAt(i & 0xF));
    }
    return builder.toString();
  }

  /**
   * Convert a single hexadecimal digit to its integer value.
   * @param c a character
   * @return an int in the range [0, 15]
   */
  private static int hexValue(char c) {
    int value = Character.digit(c, 16);
    if (value < 0) {
      throw new IllegalArgumentException("character " + c + " is not a hex digit");
    }
    return value;
  }

  /**
   * Inverse of {@link #toHex(byte[])}.  Accepts upper- and lowercase digits.
   * @param hex an even-length string of hex digits
   * @return the decoded bytes
   * @throws IllegalArgumentException if the string is not valid hex
   */
  public static byte[] fromHex(CharSequence hex) {
    int len = hex.length();
    if (len % 2 != 0) {
      throw new IllegalArgumentException("hex string has odd length " + len);
    }
    byte[] result = new byte[len / 2];
    for (int i = 0; i < result.length; ++i) {
      int val1 = hexValue(hex.charAt(i * 2));
      int val2 = hexValue(hex.charAt(i * 2 + 1));
      result[i] = (byte)(val1 << 4 | val2);
    }
    return result;
  }

  public static @Nullable String readPassword(String prompt) {
    Console cons = System.console();
    if (cons == null) {
      throw new IllegalStateException("not connected to console");
    }
    char[] c1 = cons.readPassword("%s: ", prompt);
    if (c1 == null) return null;
    char[] c2 = cons.readPassword("Confirm: ");
    if (c2 == null) return null;
    if (!Arrays.equals(c1, c2)) {
      System.err.println("passwords do not match");
      return null;
    }
    return new String(c1);
  }

}
