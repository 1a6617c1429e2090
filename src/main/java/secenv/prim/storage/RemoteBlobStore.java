package secenv.prim.storage;

import secenv.prim.NoValue;
import secenv.prim.PreconditionFailed;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.util.Arrays;
import java.util.Objects;

/**
 * A remote map from paths to blobs that allows for compare-and-swap.
 *
 * <p>Every stored blob has a <em>revision</em>: an opaque string chosen by the store
 * that changes whenever the blob changes.  Writers pass the revision they last saw,
 * and the store refuses the write if somebody else got there first.  This prevents
 * one machine from blindly overwriting a blob that another machine just pushed.
 *
 * <p>Its methods may throw {@link IOException} since the store is usually across a
 * network.  Implementations never retry on their own.
 */
public interface RemoteBlobStore {

  /**
   * The contents of a blob together with the revision they were read at.
   */
  record Snapshot(byte[] data, String revision) {

    public Snapshot {
      Objects.requireNonNull(data);
      Objects.requireNonNull(revision);
    }

    // NOTE: Arrays use reference equality, so we need our own equals() and hashCode()

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Snapshot other &&
              revision.equals(other.revision) &&
              Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(data) * 31 + revision.hashCode();
    }

    @Override
    public String toString() {
      return "Snapshot[" + data.length + " bytes @ " + revision + ']';
    }
  }

  /**
   * Read a blob.
   * @param path the blob's path
   * @return the current contents and revision
   * @throws NoValue if nothing is stored at <code>path</code>
   * @throws IOException if the store could not be reached
   */
  Snapshot read(String path) throws IOException, NoValue;

  /**
   * Write a blob, conditioned on its current revision.
   * @param path the blob's path
   * @param data the new contents
   * @param expectedRevision the revision the caller last read, or <code>null</code> if
   *   the caller believes nothing is stored at <code>path</code> yet
   * @return the revision of the newly written blob
   * @throws PreconditionFailed if the stored revision is not <code>expectedRevision</code>
   *   (including the case where a blob exists but <code>expectedRevision</code> is null)
   * @throws IOException if something goes wrong while writing.  In this case the write
   *   may or may not have happened.
   */
  String write(String path, byte[] data, @Nullable String expectedRevision) throws IOException, PreconditionFailed;

}
