package secenv.prim;

/**
 * Thrown by conditional writes when the stored revision is not the one the
 * writer expected.  Usually this means another machine wrote in the meantime.
 *
 * @see secenv.prim.storage.RemoteBlobStore#write(String, byte[], String)
 */
public class PreconditionFailed extends Exception {
  public PreconditionFailed(String message) {
    super(message);
  }

  public PreconditionFailed(String message, Throwable cause) {
    super(message, cause);
  }
}
