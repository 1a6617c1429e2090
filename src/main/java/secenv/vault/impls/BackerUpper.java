package secenv.vault.impls;

import secenv.prim.MalformedDataException;
import secenv.prim.NoValue;
import secenv.prim.PreconditionFailed;
import secenv.prim.storage.LocalDirectory;
import secenv.prim.storage.RemoteBlobStore;
import secenv.prim.time.UnreliableWallClock;
import secenv.vault.types.BackupInfo;
import secenv.vault.types.BackupNotFound;
import secenv.vault.types.BackupRecord;
import secenv.vault.types.BackupResult;
import secenv.vault.types.ContainerFormat;
import secenv.vault.types.DecryptionFailure;
import secenv.vault.types.EncryptedBlob;
import secenv.vault.types.ExportResult;
import secenv.vault.types.InvalidKeyConfig;
import secenv.vault.types.KeyMaterial;
import secenv.vault.types.KeyOptions;
import secenv.vault.types.NoFilesFound;
import secenv.vault.types.ProjectIdentity;
import secenv.vault.types.RemoteNotFound;
import secenv.vault.types.RestoreResult;
import secenv.vault.types.WeakKey;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * A thing that knows how to back up a project's secret files!
 *
 * <p>Features:
 * <ul>
 *   <li>Each eligible file is encrypted separately, with its own salt and nonce</li>
 *   <li>Keys are bound to the project name, so a container only opens for the project that made it</li>
 *   <li>Containers live under the storage root, in a directory named by the project hash</li>
 *   <li>Containers can be copied to and from a {@link RemoteBlobStore} without clobbering
 *       somebody else's newer push</li>
 * </ul>
 *
 * <p>Every operation takes the project root explicitly; nothing is remembered between calls.
 * A restore decrypts every file before it writes any of them, so a wrong key or a corrupted
 * entry leaves the project directory untouched.
 */
public class BackerUpper {

  public static final String CONTAINER_NAME = BackupRecord.CONTAINER_EXTENSION;
  public static final String REMOTE_CONTAINER_NAME = "backup" + BackupRecord.CONTAINER_EXTENSION;

  private static final String ELIGIBLE_PREFIX = ".env";
  private static final List<String> EXCLUDED_SUFFIXES = ImmutableList.of(
          ".example",
          ".template",
          BackupRecord.CONTAINER_EXTENSION);

  private final Path storageRoot;
  private final ContainerFormat format;
  private final AuthenticatedCipher cipher;
  private final KeyResolver keyResolver;
  private final UnreliableWallClock wallClock;

  public BackerUpper(Path storageRoot, ContainerFormat format, AuthenticatedCipher cipher, KeyResolver keyResolver, UnreliableWallClock wallClock) {
    this.storageRoot = storageRoot;
    this.format = format;
    this.cipher = cipher;
    this.keyResolver = keyResolver;
    this.wallClock = wallClock;
  }

  private LocalDirectory storageFor(ProjectIdentity project) {
    return new LocalDirectory(storageRoot.resolve(project.hash()));
  }

  @VisibleForTesting
  static boolean isEligible(String fileName) {
    return fileName.startsWith(ELIGIBLE_PREFIX)
            && EXCLUDED_SUFFIXES.stream().noneMatch(fileName::endsWith);
  }

  /**
   * List the files in <code>projectRoot</code> that a backup would include.
   * Subdirectories are not searched.
   *
   * @param projectRoot the project directory
   * @return the eligible file names, sorted
   * @throws IOException if the directory cannot be listed
   */
  public List<String> eligibleFiles(Path projectRoot) throws IOException {
    try (Stream<String> names = new LocalDirectory(projectRoot).list()) {
      return names.filter(BackerUpper::isEligible).sorted().collect(ImmutableList.toImmutableList());
    }
  }

  public static String remotePath(ProjectIdentity project) {
    return project.name() + '/' + REMOTE_CONTAINER_NAME;
  }

  public BackupResult backup(Path projectRoot, KeyOptions keyOptions) throws IOException, InvalidKeyConfig, NoFilesFound, WeakKey {
    KeyMaterial key = keyResolver.resolve(keyOptions);
    ProjectIdentity project = ProjectIdentity.of(projectRoot);

    List<String> names = eligibleFiles(projectRoot);
    if (names.isEmpty()) {
      throw new NoFilesFound(projectRoot);
    }

    LocalDirectory source = new LocalDirectory(projectRoot);
    Map<String, EncryptedBlob> files = new LinkedHashMap<>();
    for (String name : names) {
      byte[] plaintext = source.read(name);
      try {
        files.put(name, cipher.encrypt(plaintext, key, project));
      } finally {
        Arrays.fill(plaintext, (byte)0);
      }
      System.out.println(" --> " + name + " [encrypted]");
    }

    BackupRecord record = new BackupRecord(
            project.name(),
            project.hash(),
            wallClock.now().truncatedTo(ChronoUnit.MILLIS),
            files);
    LocalDirectory storage = storageFor(project);
    storage.createOrReplace(CONTAINER_NAME, format.serialize(record));
    return new BackupResult(project, names, storage.resolve(CONTAINER_NAME));
  }

  public boolean hasBackup(Path projectRoot) {
    return storageFor(ProjectIdentity.of(projectRoot)).exists(CONTAINER_NAME);
  }

  /**
   * Read a container's metadata without decrypting anything.
   *
   * @param projectRoot the project directory
   * @return the metadata, or null if the project has no backup
   * @throws MalformedDataException if the container is corrupted
   * @throws IOException if the container cannot be read
   */
  public @Nullable BackupInfo info(Path projectRoot) throws IOException, MalformedDataException {
    LocalDirectory storage = storageFor(ProjectIdentity.of(projectRoot));
    if (!storage.exists(CONTAINER_NAME)) {
      return null;
    }
    BackupRecord record = format.load(storage.read(CONTAINER_NAME));
    return new BackupInfo(
            record.projectName(),
            record.projectHash(),
            record.timestamp(),
            ImmutableList.copyOf(record.files().keySet()));
  }

  private byte[] readLocalContainer(ProjectIdentity project) throws IOException, BackupNotFound {
    LocalDirectory storage = storageFor(project);
    try {
      return storage.read(CONTAINER_NAME);
    } catch (NoSuchFileException e) {
      throw new BackupNotFound("no backup found for project " + project.name() + " (looked in " + storage + ')', e);
    }
  }

  public RestoreResult restore(Path projectRoot, KeyOptions keyOptions) throws IOException, InvalidKeyConfig, BackupNotFound, MalformedDataException, WeakKey, DecryptionFailure {
    KeyMaterial key = keyResolver.resolve(keyOptions);
    ProjectIdentity project = ProjectIdentity.of(projectRoot);
    BackupRecord record = format.load(readLocalContainer(project));
    return writeDecrypted(projectRoot, project, record, key);
  }

  private RestoreResult writeDecrypted(Path projectRoot, ProjectIdentity project, BackupRecord record, KeyMaterial key) throws IOException, WeakKey, DecryptionFailure {
    if (!record.projectHash().equals(project.hash())) {
      System.err.println("WARNING: backup was made for project '" + record.projectName()
              + "' but is being restored into '" + project.name() + '\'');
    }

    // Decrypt everything before writing anything.
    Map<String, byte[]> plaintexts = new LinkedHashMap<>();
    for (Map.Entry<String, EncryptedBlob> entry : record.files().entrySet()) {
      String name = entry.getKey();
      try {
        plaintexts.put(name, cipher.decrypt(entry.getValue(), key, project));
      } catch (DecryptionFailure e) {
        throw new DecryptionFailure("cannot decrypt " + name + ": " + e.getMessage(), e);
      }
    }

    LocalDirectory destination = new LocalDirectory(projectRoot);
    for (Map.Entry<String, byte[]> entry : plaintexts.entrySet()) {
      try {
        destination.createOrReplace(entry.getKey(), entry.getValue());
      } finally {
        Arrays.fill(entry.getValue(), (byte)0);
      }
      System.out.println(" --> " + entry.getKey() + " [restored]");
    }

    return new RestoreResult(project, record.projectName(), record.timestamp(), ImmutableList.copyOf(plaintexts.keySet()));
  }

  /**
   * Copy the project's container to <code>target</code>.  The copy is byte-for-byte
   * identical.
   *
   * @param projectRoot the project directory
   * @param keyOptions if non-null, the key is checked against the container's first
   *   entry before anything is written
   * @param target where to write the copy (replaced if it exists)
   */
  public ExportResult exportTo(Path projectRoot, @Nullable KeyOptions keyOptions, Path target) throws IOException, InvalidKeyConfig, BackupNotFound, MalformedDataException, WeakKey, DecryptionFailure {
    @Nullable KeyMaterial key = keyOptions == null ? null : keyResolver.resolve(keyOptions);
    ProjectIdentity project = ProjectIdentity.of(projectRoot);
    byte[] container = readLocalContainer(project);
    BackupRecord record = format.load(container);

    if (key != null) {
      var first = record.files().entrySet().stream().findFirst();
      if (first.isPresent()) {
        try {
          Arrays.fill(cipher.decrypt(first.get().getValue(), key, project), (byte)0);
        } catch (DecryptionFailure e) {
          throw new DecryptionFailure("key does not open " + first.get().getKey() + ": " + e.getMessage(), e);
        }
      }
    }

    Path absoluteTarget = target.toAbsolutePath();
    Path parent = absoluteTarget.getParent();
    Path fileName = absoluteTarget.getFileName();
    if (parent == null || fileName == null) {
      throw new IllegalArgumentException("cannot export to " + target);
    }
    new LocalDirectory(parent).createOrReplace(fileName.toString(), container);
    return new ExportResult(project, target, record.timestamp(), record.files().size());
  }

  /**
   * Adopt the container at <code>source</code> as this project's backup and restore
   * from it.  The container is checked for well-formedness, then stored verbatim.
   */
  public RestoreResult importFrom(Path projectRoot, KeyOptions keyOptions, Path source) throws IOException, InvalidKeyConfig, BackupNotFound, MalformedDataException, WeakKey, DecryptionFailure {
    KeyMaterial key = keyResolver.resolve(keyOptions);
    ProjectIdentity project = ProjectIdentity.of(projectRoot);

    byte[] container;
    try {
      container = Files.readAllBytes(source);
    } catch (NoSuchFileException e) {
      throw new BackupNotFound("no backup file at " + source, e);
    }
    BackupRecord record = format.load(container);

    storageFor(project).createOrReplace(CONTAINER_NAME, container);
    return writeDecrypted(projectRoot, project, record, key);
  }

  /**
   * Back up the project, then upload the container to <code>remote</code> under
   * <code>&lt;project name&gt;/backup.secenv</code>.
   *
   * @throws PreconditionFailed if the remote copy changed between reading its revision
   *   and writing the new one
   */
  public BackupResult push(Path projectRoot, KeyOptions keyOptions, RemoteBlobStore remote) throws IOException, InvalidKeyConfig, NoFilesFound, WeakKey, PreconditionFailed {
    BackupResult result = backup(projectRoot, keyOptions);
    byte[] container = storageFor(result.getProject()).read(CONTAINER_NAME);

    String path = remotePath(result.getProject());
    String revision;
    try {
      revision = remote.read(path).revision();
    } catch (NoValue e) {
      revision = null;
    }
    String newRevision = remote.write(path, container, revision);
    System.out.println(" --> " + path + " [pushed: " + (revision != null ? revision + " --> " : "new: ") + newRevision + ']');
    return result;
  }

  public RestoreResult pull(Path projectRoot, KeyOptions keyOptions, RemoteBlobStore remote) throws IOException, InvalidKeyConfig, RemoteNotFound, MalformedDataException, WeakKey, DecryptionFailure {
    KeyMaterial key = keyResolver.resolve(keyOptions);
    ProjectIdentity project = ProjectIdentity.of(projectRoot);

    String path = remotePath(project);
    RemoteBlobStore.Snapshot snapshot;
    try {
      snapshot = remote.read(path);
    } catch (NoValue e) {
      throw new RemoteNotFound("no remote backup at " + path, e);
    }
    BackupRecord record = format.load(snapshot.data());

    storageFor(project).createOrReplace(CONTAINER_NAME, snapshot.data());
    return writeDecrypted(projectRoot, project, record, key);
  }

}
