package secenv.prim.storage;

import secenv.prim.NoValue;
import secenv.prim.PreconditionFailed;
import org.checkerframework.checker.nullness.qual.Nullable;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;

/**
 * A {@link RemoteBlobStore} in an S3 bucket.  The object's ETag serves as its
 * revision, and writes use S3's conditional <code>If-Match</code> /
 * <code>If-None-Match</code> headers so that the compare-and-swap happens on
 * the server.
 */
public class S3BlobStore implements RemoteBlobStore {

  private static final int PRECONDITION_FAILED = 412;
  private static final int CONFLICT = 409;

  private final String bucket;
  private final S3Client s3client;

  public S3BlobStore(S3Client s3client, String bucketName) {
    this.bucket = bucketName;
    this.s3client = s3client;
    try {
      s3client.headBucket(HeadBucketRequest.builder().bucket(bucketName).build());
    } catch (NoSuchBucketException e) {
      s3client.createBucket(CreateBucketRequest.builder().bucket(bucketName).build());
    }
  }

  @Override
  public Snapshot read(String path) throws IOException, NoValue {
    ResponseBytes<GetObjectResponse> bytes;
    try {
      bytes = s3client.getObjectAsBytes(
              GetObjectRequest.builder()
                      .bucket(bucket)
                      .key(path)
                      .build());
    } catch (NoSuchKeyException e) {
      throw new NoValue(path);
    } catch (SdkClientException | S3Exception e) {
      // "SdkClientException" indicates any other kind of error, including:
      //   - malformed request
      //   - network error
      //   - unable to parse response from Amazon
      throw new IOException("failed to read s3://" + bucket + '/' + path, e);
    }
    return new Snapshot(bytes.asByteArray(), bytes.response().eTag());
  }

  @Override
  public String write(String path, byte[] data, @Nullable String expectedRevision) throws IOException, PreconditionFailed {
    PutObjectRequest.Builder request = PutObjectRequest.builder()
            .bucket(bucket)
            .key(path);
    if (expectedRevision != null) {
      request.ifMatch(expectedRevision);
    } else {
      request.ifNoneMatch("*");
    }

    PutObjectResponse response;
    try {
      response = s3client.putObject(request.build(), RequestBody.fromBytes(data));
    } catch (S3Exception e) {
      int status = e.statusCode();
      if (status == PRECONDITION_FAILED || status == CONFLICT) {
        throw new PreconditionFailed("s3://" + bucket + '/' + path + " changed since revision " + expectedRevision, e);
      }
      throw new IOException("failed to write s3://" + bucket + '/' + path, e);
    } catch (SdkClientException e) {
      throw new IOException("failed to write s3://" + bucket + '/' + path, e);
    }
    return response.eTag();
  }

}
