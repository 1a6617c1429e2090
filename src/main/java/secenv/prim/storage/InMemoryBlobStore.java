package secenv.prim.storage;

import secenv.prim.NoValue;
import secenv.prim.PreconditionFailed;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A strongly-consistent in-memory {@link RemoteBlobStore}.  Revisions are
 * numbered in write order.  Mostly useful for tests.
 */
public class InMemoryBlobStore implements RemoteBlobStore {

  private final Map<String, Snapshot> entries = new HashMap<>();
  private long nextRevision = 1;

  @Override
  public synchronized Snapshot read(String path) throws NoValue {
    Snapshot result = entries.get(path);
    if (result == null) {
      throw new NoValue(path);
    }
    return new Snapshot(result.data().clone(), result.revision());
  }

  @Override
  public synchronized String write(String path, byte[] data, @Nullable String expectedRevision) throws PreconditionFailed {
    Snapshot current = entries.get(path);
    String currentRevision = current == null ? null : current.revision();
    if (!Objects.equals(currentRevision, expectedRevision)) {
      throw new PreconditionFailed("expected " + path + " at revision " + expectedRevision + " but it is at " + currentRevision);
    }
    String revision = Long.toString(nextRevision++);
    entries.put(path, new Snapshot(data.clone(), revision));
    return revision;
  }

  @Override
  public synchronized String toString() {
    return entries.toString();
  }

}
