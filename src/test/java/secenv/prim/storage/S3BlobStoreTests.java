package secenv.prim.storage;

import secenv.prim.NoValue;
import secenv.prim.PreconditionFailed;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.CreateBucketResponse;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketResponse;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

@Test
public class S3BlobStoreTests {

  /**
   * Implements the handful of calls {@link S3BlobStore} makes, including the
   * conditional-write headers.  ETags are a counter.
   */
  private static class FakeS3 implements S3Client {
    final Set<String> buckets = new HashSet<>();
    final Map<String, byte[]> objects = new HashMap<>();
    final Map<String, String> etags = new HashMap<>();
    int nextEtag = 1;

    @Override
    public String serviceName() {
      return "s3";
    }

    @Override
    public void close() {
    }

    @Override
    public HeadBucketResponse headBucket(HeadBucketRequest request) {
      if (!buckets.contains(request.bucket())) {
        throw NoSuchBucketException.builder().statusCode(404).message("no bucket " + request.bucket()).build();
      }
      return HeadBucketResponse.builder().build();
    }

    @Override
    public CreateBucketResponse createBucket(CreateBucketRequest request) {
      buckets.add(request.bucket());
      return CreateBucketResponse.builder().build();
    }

    @Override
    public ResponseBytes<GetObjectResponse> getObjectAsBytes(GetObjectRequest request) {
      String key = request.bucket() + '/' + request.key();
      byte[] data = objects.get(key);
      if (data == null) {
        throw NoSuchKeyException.builder().statusCode(404).message("no key " + key).build();
      }
      return ResponseBytes.fromByteArray(GetObjectResponse.builder().eTag(etags.get(key)).build(), data.clone());
    }

    @Override
    public PutObjectResponse putObject(PutObjectRequest request, RequestBody body) {
      String key = request.bucket() + '/' + request.key();
      String current = etags.get(key);
      if (request.ifNoneMatch() != null && current != null
              || request.ifMatch() != null && !request.ifMatch().equals(current)) {
        throw S3Exception.builder().statusCode(412).message("At least one of the pre-conditions you specified did not hold").build();
      }
      byte[] data;
      try (InputStream in = body.contentStreamProvider().newStream()) {
        data = in.readAllBytes();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      String etag = "\"" + nextEtag++ + "\"";
      objects.put(key, data);
      etags.put(key, etag);
      return PutObjectResponse.builder().eTag(etag).build();
    }
  }

  @Test
  public void testCreatesBucket() {
    FakeS3 s3 = new FakeS3();
    new S3BlobStore(s3, "env-backups");
    Assert.assertTrue(s3.buckets.contains("env-backups"));
  }

  @Test
  public void testReadMissing() throws IOException {
    S3BlobStore store = new S3BlobStore(new FakeS3(), "env-backups");
    try {
      store.read("my-app/backup.secenv");
      Assert.fail();
    } catch (NoValue e) {
      Assert.assertEquals(e.getMessage(), "my-app/backup.secenv");
    }
  }

  @Test
  public void testWriteReadUpdate() throws IOException, NoValue, PreconditionFailed {
    S3BlobStore store = new S3BlobStore(new FakeS3(), "env-backups");
    String r1 = store.write("my-app/backup.secenv", new byte[] { 1 }, null);
    Assert.assertEquals(store.read("my-app/backup.secenv"), new RemoteBlobStore.Snapshot(new byte[] { 1 }, r1));
    String r2 = store.write("my-app/backup.secenv", new byte[] { 2 }, r1);
    Assert.assertEquals(store.read("my-app/backup.secenv"), new RemoteBlobStore.Snapshot(new byte[] { 2 }, r2));
  }

  @Test
  public void testConditionalWrites() throws IOException, NoValue, PreconditionFailed {
    S3BlobStore store = new S3BlobStore(new FakeS3(), "env-backups");
    String r1 = store.write("my-app/backup.secenv", new byte[] { 1 }, null);
    store.write("my-app/backup.secenv", new byte[] { 2 }, r1);

    try {
      store.write("my-app/backup.secenv", new byte[] { 3 }, r1);
      Assert.fail("overwrote a newer revision");
    } catch (PreconditionFailed expected) {
      // ok
    }

    try {
      store.write("my-app/backup.secenv", new byte[] { 3 }, null);
      Assert.fail("created an object that already exists");
    } catch (PreconditionFailed expected) {
      // ok
    }

    Assert.assertEquals(store.read("my-app/backup.secenv").data(), new byte[] { 2 });
  }

}
