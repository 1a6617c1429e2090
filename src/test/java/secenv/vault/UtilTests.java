package secenv.vault;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;

@Test
public class UtilTests {

  private final String SHA256_FOR_ZERO_BYTES = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";

  @Test
  public void testSha256() {
    byte[] sha256bytes = Util.sha256(new byte[0]);
    String sha256string = Util.toHex(sha256bytes);
    Assert.assertEquals(sha256string, SHA256_FOR_ZERO_BYTES);
    byte[] sha256bytes2 = Util.fromHex(sha256string);
    Assert.assertEquals(sha256bytes2, sha256bytes);
  }

  @Test
  public void testSha256OfChunksIsSha256OfConcatenation() {
    byte[] a = Util.utf8("my-app");
    byte[] b = Util.utf8("securedenv-v1");
    Assert.assertEquals(Util.sha256(a, b), Util.sha256(Util.concat(a, b)));
  }

  @Test
  public void testHex() {
    Assert.assertEquals(Util.toHex(new byte[] { 0, 15, 16, (byte)0xAB, (byte)0xFF }), "000f10abff");
    Assert.assertEquals(Util.fromHex("000F10ABff"), new byte[] { 0, 15, 16, (byte)0xAB, (byte)0xFF });
    Assert.assertEquals(Util.fromHex(""), new byte[0]);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testOddLengthHex() {
    Util.fromHex("abc");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testNonHexDigit() {
    Util.fromHex("0g");
  }

  @Test
  public void testRead() throws IOException {
    byte[] data = new byte[Util.SUGGESTED_BUFFER_SIZE * 2 + 7];
    for (int i = 0; i < data.length; ++i) {
      data[i] = (byte)i;
    }
    Assert.assertEquals(Util.read(new ByteArrayInputStream(data)), data);
  }

  @Test
  public void testRandomBytes() {
    Assert.assertEquals(Util.randomBytes(32).length, 32);
    Assert.assertNotEquals(Util.toHex(Util.randomBytes(32)), Util.toHex(Util.randomBytes(32)));
  }

}
