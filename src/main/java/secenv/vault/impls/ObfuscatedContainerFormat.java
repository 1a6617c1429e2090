package secenv.vault.impls;

import secenv.prim.MalformedDataException;
import secenv.prim.transforms.BlobTransformer;
import secenv.prim.transforms.Obfuscation;
import secenv.vault.types.BackupRecord;
import secenv.vault.types.ContainerFormat;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * The on-disk container: a fixed header around an obfuscated payload produced
 * by some inner format.
 *
 * <p>The obfuscation layer only stops secrets (which are encrypted anyway) and
 * file names from being readable with <code>cat</code>.  It is not a security
 * boundary: the key is a constant, {@value #DEFAULT_OBFUSCATION_KEY}.
 *
 * @see JsonRecordFormat
 */
public class ObfuscatedContainerFormat implements ContainerFormat {

  // INTERNAL DETAILS
  //
  // The header is the 8-byte ASCII magic "SECENV01" followed by the 4-byte
  // big-endian payload length.  The length must account for every remaining
  // byte; trailing garbage is rejected just like truncation.

  public static final String DEFAULT_OBFUSCATION_KEY = "SecuredEnvObfuscation2024";

  private static final byte[] MAGIC = "SECENV01".getBytes(StandardCharsets.US_ASCII);
  private static final int HEADER_LENGTH = MAGIC.length + 4;

  private final ContainerFormat inner;
  private final BlobTransformer transformer;

  public ObfuscatedContainerFormat(ContainerFormat inner, BlobTransformer transformer) {
    this.inner = inner;
    this.transformer = transformer;
  }

  public ObfuscatedContainerFormat() {
    this(new JsonRecordFormat(), new Obfuscation(DEFAULT_OBFUSCATION_KEY));
  }

  private static int byteToUnsignedInt(byte b) {
    return ((int)b) & 0xFF;
  }

  static long readBigEndianInt(byte[] buffer, int offset) {
    return Integer.toUnsignedLong(
            (byteToUnsignedInt(buffer[offset]) << 24)
            | (byteToUnsignedInt(buffer[offset + 1]) << 16)
            | (byteToUnsignedInt(buffer[offset + 2]) << 8)
            | byteToUnsignedInt(buffer[offset + 3]));
  }

  static void serializeBigEndianInt(int i, byte[] buffer, int offset) {
    buffer[offset] = (byte)(i >> 24);
    buffer[offset + 1] = (byte)(i >> 16);
    buffer[offset + 2] = (byte)(i >> 8);
    buffer[offset + 3] = (byte)i;
  }

  @Override
  public BackupRecord load(byte[] data) throws MalformedDataException {
    if (data.length < HEADER_LENGTH) {
      throw new MalformedDataException("Container is too short (" + data.length + " bytes)");
    }
    if (!Arrays.equals(data, 0, MAGIC.length, MAGIC, 0, MAGIC.length)) {
      throw new MalformedDataException("Not a secenv container (bad magic number)");
    }
    long declared = readBigEndianInt(data, MAGIC.length);
    int actual = data.length - HEADER_LENGTH;
    if (declared != actual) {
      throw new MalformedDataException("Container declares " + declared + " payload bytes but has " + actual);
    }
    byte[] payload = Arrays.copyOfRange(data, HEADER_LENGTH, data.length);
    return inner.load(transformer.unApply(payload));
  }

  @Override
  public byte[] serialize(BackupRecord record) {
    byte[] payload = transformer.apply(inner.serialize(record));
    byte[] result = new byte[HEADER_LENGTH + payload.length];
    System.arraycopy(MAGIC, 0, result, 0, MAGIC.length);
    serializeBigEndianInt(payload.length, result, MAGIC.length);
    System.arraycopy(payload, 0, result, HEADER_LENGTH, payload.length);
    return result;
  }

}
