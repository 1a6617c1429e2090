package secenv.vault;

import secenv.prim.MalformedDataException;
import secenv.prim.NoValue;
import secenv.prim.PreconditionFailed;
import secenv.prim.storage.InMemoryBlobStore;
import secenv.prim.storage.RemoteBlobStore;
import secenv.prim.time.UnreliableWallClock;
import secenv.prim.transforms.Obfuscation;
import secenv.vault.impls.AuthenticatedCipher;
import secenv.vault.impls.BackerUpper;
import secenv.vault.impls.KeyDerivation;
import secenv.vault.impls.KeyFiles;
import secenv.vault.impls.KeyResolver;
import secenv.vault.impls.KeyValidator;
import secenv.vault.impls.ObfuscatedContainerFormat;
import secenv.vault.types.BackupInfo;
import secenv.vault.types.BackupNotFound;
import secenv.vault.types.BackupResult;
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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

@Test
public class BackupTests {

  private static final KeyDerivation.Iterations FAST = new KeyDerivation.Iterations(2, 2, 2);
  private static final String PASSWORD = "Str0ng!Pass99";
  private static final String ENV = "API_KEY=abc123\nDB_PASSWORD=hunter2\n";
  private static final String ENV_PROD = "API_KEY=live-key\n";

  private static class TestClock implements UnreliableWallClock {
    Instant now = Instant.parse("2024-03-01T12:00:00Z");

    @Override
    public synchronized Instant now() {
      return now;
    }

    public synchronized void timePasses(Duration time) {
      assert !time.isNegative();
      now = now.plus(time);
    }
  }

  private final TestClock clock = new TestClock();

  private BackerUpper newBackerUpper(Path storageRoot, KeyDerivation kdf) {
    return new BackerUpper(
            storageRoot,
            new ObfuscatedContainerFormat(),
            new AuthenticatedCipher(kdf),
            new KeyResolver(),
            clock);
  }

  private BackerUpper newBackerUpper(Path storageRoot) {
    return newBackerUpper(storageRoot, new KeyDerivation(new KeyValidator(), FAST));
  }

  /** A fresh, empty project directory with the given name. */
  private static Path newProject(String name) throws IOException {
    return Files.createDirectories(Files.createTempDirectory("secenv-project").resolve(name));
  }

  private static Path newStorageRoot() throws IOException {
    return Files.createTempDirectory("secenv-storage");
  }

  private static void write(Path dir, String name, String content) throws IOException {
    Files.write(dir.resolve(name), content.getBytes(StandardCharsets.UTF_8));
  }

  private static @Nullable String read(Path dir, String name) throws IOException {
    Path p = dir.resolve(name);
    return Files.exists(p) ? new String(Files.readAllBytes(p), StandardCharsets.UTF_8) : null;
  }

  private static Path populatedProject(String name) throws IOException {
    Path project = newProject(name);
    write(project, ".env", ENV);
    write(project, ".env.prod", ENV_PROD);
    return project;
  }

  @Test
  public void testBackupDeleteRestore() throws Exception {
    Path storage = newStorageRoot();
    Path project = populatedProject("my-app");
    write(project, ".env.example", "API_KEY=\n");
    write(project, "README.md", "hello");
    BackerUpper backupper = newBackerUpper(storage);

    BackupResult backup = backupper.backup(project, KeyOptions.password(PASSWORD));
    Assert.assertEquals(backup.getFiles(), List.of(".env", ".env.prod"));
    Assert.assertEquals(backup.getProject(), ProjectIdentity.named("my-app"));
    Assert.assertEquals(backup.getContainer(), storage.resolve(ProjectIdentity.named("my-app").hash()).resolve(".secenv"));
    Assert.assertTrue(Files.isRegularFile(backup.getContainer()));

    Files.delete(project.resolve(".env"));
    Files.delete(project.resolve(".env.prod"));

    RestoreResult restore = backupper.restore(project, KeyOptions.password(PASSWORD));
    Assert.assertEquals(restore.getFiles(), List.of(".env", ".env.prod"));
    Assert.assertEquals(restore.getOriginalProject(), "my-app");
    Assert.assertEquals(restore.getTimestamp(), clock.now());
    Assert.assertEquals(read(project, ".env"), ENV);
    Assert.assertEquals(read(project, ".env.prod"), ENV_PROD);
    Assert.assertEquals(read(project, ".env.example"), "API_KEY=\n");
  }

  @Test
  public void testRestoreOverwrites() throws Exception {
    Path storage = newStorageRoot();
    Path project = populatedProject("my-app");
    BackerUpper backupper = newBackerUpper(storage);
    backupper.backup(project, KeyOptions.password(PASSWORD));

    write(project, ".env", "API_KEY=changed\n");
    backupper.restore(project, KeyOptions.password(PASSWORD));
    Assert.assertEquals(read(project, ".env"), ENV);
  }

  @Test
  public void testEligibleFiles() throws IOException {
    Path project = newProject("my-app");
    for (String name : new String[] { ".env.local", ".env", ".envrc", "env", "x.env", ".env.example", ".env.template", ".env.secenv", ".secenv" }) {
      write(project, name, "X=1\n");
    }
    Files.createDirectory(project.resolve(".env.d"));
    write(project.resolve(".env.d"), ".env", "NESTED=1\n");

    Assert.assertEquals(newBackerUpper(newStorageRoot()).eligibleFiles(project), List.of(".env", ".env.local", ".envrc"));
  }

  @Test
  public void testNoFiles() throws Exception {
    Path storage = newStorageRoot();
    Path project = newProject("empty-app");
    write(project, ".env.example", "API_KEY=\n");
    BackerUpper backupper = newBackerUpper(storage);
    try {
      backupper.backup(project, KeyOptions.password(PASSWORD));
      Assert.fail("backed up a project with no secret files");
    } catch (NoFilesFound expected) {
      // ok
    }
    Assert.assertFalse(backupper.hasBackup(project));
  }

  @Test(expectedExceptions = BackupNotFound.class)
  public void testRestoreWithoutBackup() throws Exception {
    newBackerUpper(newStorageRoot()).restore(newProject("my-app"), KeyOptions.password(PASSWORD));
  }

  @Test
  public void testWeakPasswordIsRejectedBeforeWriting() throws Exception {
    Path storage = newStorageRoot();
    Path project = populatedProject("my-app");
    BackerUpper backupper = newBackerUpper(storage);
    try {
      backupper.backup(project, KeyOptions.password("Password1"));
      Assert.fail("weak password was accepted");
    } catch (WeakKey expected) {
      // ok
    }
    Assert.assertFalse(backupper.hasBackup(project));
  }

  @Test
  public void testKeyConfigIsChecked() throws Exception {
    Path storage = newStorageRoot();
    Path project = populatedProject("my-app");
    Path keyFile = project.getParent().resolve("k1");
    KeyFiles.generate(keyFile);
    BackerUpper backupper = newBackerUpper(storage);
    try {
      backupper.backup(project, new KeyOptions(PASSWORD, keyFile));
      Assert.fail("accepted both a password and a key file");
    } catch (InvalidKeyConfig e) {
      Assert.assertEquals(e.getReason(), InvalidKeyConfig.Reason.MUTUALLY_EXCLUSIVE);
    }
    try {
      backupper.backup(project, new KeyOptions(null, null));
      Assert.fail("accepted no key at all");
    } catch (InvalidKeyConfig e) {
      Assert.assertEquals(e.getReason(), InvalidKeyConfig.Reason.MISSING);
    }
    Assert.assertFalse(backupper.hasBackup(project));
  }

  @Test
  public void testKeyFilesAreIsolated() throws Exception {
    Path storage = newStorageRoot();
    Path project = populatedProject("my-app");
    Path k1 = project.getParent().resolve("k1");
    Path k2 = project.getParent().resolve("k2");
    KeyFiles.generate(k1);
    KeyFiles.generate(k2);
    BackerUpper backupper = newBackerUpper(storage);

    backupper.backup(project, KeyOptions.keyFile(k1));
    write(project, ".env", "LOCAL=edit\n");
    Files.delete(project.resolve(".env.prod"));

    try {
      backupper.restore(project, KeyOptions.keyFile(k2));
      Assert.fail("restored with the wrong key file");
    } catch (DecryptionFailure e) {
      Assert.assertTrue(e.getMessage().contains(".env"), e.getMessage());
    }

    // Nothing was written.
    Assert.assertEquals(read(project, ".env"), "LOCAL=edit\n");
    Assert.assertNull(read(project, ".env.prod"));

    backupper.restore(project, KeyOptions.keyFile(k1));
    Assert.assertEquals(read(project, ".env"), ENV);
    Assert.assertEquals(read(project, ".env.prod"), ENV_PROD);
  }

  @Test
  public void testWrongPasswordWritesNothing() throws Exception {
    Path storage = newStorageRoot();
    Path project = populatedProject("my-app");
    BackerUpper backupper = newBackerUpper(storage);
    backupper.backup(project, KeyOptions.password(PASSWORD));
    Files.delete(project.resolve(".env"));

    try {
      backupper.restore(project, KeyOptions.password("Wr0ng!Pass999"));
      Assert.fail("restored with the wrong password");
    } catch (DecryptionFailure expected) {
      // ok
    }
    Assert.assertNull(read(project, ".env"));
    Assert.assertEquals(read(project, ".env.prod"), ENV_PROD);
  }

  @Test
  public void testSameNameIsSameProject() throws Exception {
    Path storage = newStorageRoot();
    BackerUpper backupper = newBackerUpper(storage);
    backupper.backup(populatedProject("my-app"), KeyOptions.password(PASSWORD));

    // A different directory with the same name, e.g. a second checkout.
    Path elsewhere = newProject("my-app");
    Assert.assertTrue(backupper.hasBackup(elsewhere));
    backupper.restore(elsewhere, KeyOptions.password(PASSWORD));
    Assert.assertEquals(read(elsewhere, ".env"), ENV);
  }

  @Test
  public void testHasBackupAndInfo() throws Exception {
    Path storage = newStorageRoot();
    Path project = populatedProject("my-app");
    BackerUpper backupper = newBackerUpper(storage);
    Assert.assertFalse(backupper.hasBackup(project));
    Assert.assertNull(backupper.info(project));

    backupper.backup(project, KeyOptions.password(PASSWORD));
    clock.timePasses(Duration.ofHours(1));

    Assert.assertTrue(backupper.hasBackup(project));
    BackupInfo info = backupper.info(project);
    Assert.assertNotNull(info);
    Assert.assertEquals(info.getProject(), "my-app");
    Assert.assertEquals(info.getHash(), ProjectIdentity.named("my-app").hash());
    Assert.assertEquals(info.getTimestamp(), Instant.parse("2024-03-01T12:00:00Z"));
    Assert.assertEquals(info.getFiles(), List.of(".env", ".env.prod"));
  }

  @Test
  public void testExportImport() throws Exception {
    Path storage1 = newStorageRoot();
    Path project1 = populatedProject("my-app");
    BackerUpper machine1 = newBackerUpper(storage1);
    BackupResult backup = machine1.backup(project1, KeyOptions.password(PASSWORD));

    Path exported = Files.createTempDirectory("secenv-export").resolve("backup.secenv");
    ExportResult export = machine1.exportTo(project1, KeyOptions.password(PASSWORD), exported);
    Assert.assertEquals(export.getFileCount(), 2);
    Assert.assertEquals(export.getExportPath(), exported);
    Assert.assertEquals(Files.readAllBytes(exported), Files.readAllBytes(backup.getContainer()));

    Path storage2 = newStorageRoot();
    Path project2 = newProject("my-app");
    BackerUpper machine2 = newBackerUpper(storage2);
    RestoreResult restore = machine2.importFrom(project2, KeyOptions.password(PASSWORD), exported);
    Assert.assertEquals(restore.getFiles(), List.of(".env", ".env.prod"));
    Assert.assertEquals(read(project2, ".env"), ENV);
    Assert.assertEquals(read(project2, ".env.prod"), ENV_PROD);

    // The imported container is kept verbatim.
    Path imported = storage2.resolve(ProjectIdentity.named("my-app").hash()).resolve(".secenv");
    Assert.assertEquals(Files.readAllBytes(imported), Files.readAllBytes(exported));
  }

  @Test
  public void testExportWithoutKey() throws Exception {
    Path storage = newStorageRoot();
    Path project = populatedProject("my-app");
    BackerUpper backupper = newBackerUpper(storage);
    BackupResult backup = backupper.backup(project, KeyOptions.password(PASSWORD));
    Path exported = Files.createTempDirectory("secenv-export").resolve("out.secenv");
    backupper.exportTo(project, null, exported);
    Assert.assertEquals(Files.readAllBytes(exported), Files.readAllBytes(backup.getContainer()));
  }

  @Test
  public void testExportChecksKey() throws Exception {
    Path storage = newStorageRoot();
    Path project = populatedProject("my-app");
    BackerUpper backupper = newBackerUpper(storage);
    backupper.backup(project, KeyOptions.password(PASSWORD));
    Path exported = Files.createTempDirectory("secenv-export").resolve("out.secenv");
    try {
      backupper.exportTo(project, KeyOptions.password("Wr0ng!Pass999"), exported);
      Assert.fail("exported with the wrong key");
    } catch (DecryptionFailure expected) {
      // ok
    }
    Assert.assertFalse(Files.exists(exported));
  }

  @Test(expectedExceptions = BackupNotFound.class)
  public void testExportWithoutBackup() throws Exception {
    Path exported = Files.createTempDirectory("secenv-export").resolve("out.secenv");
    newBackerUpper(newStorageRoot()).exportTo(newProject("my-app"), null, exported);
  }

  @Test(expectedExceptions = BackupNotFound.class)
  public void testImportMissingFile() throws Exception {
    Path missing = Files.createTempDirectory("secenv-import").resolve("nope.secenv");
    newBackerUpper(newStorageRoot()).importFrom(newProject("my-app"), KeyOptions.password(PASSWORD), missing);
  }

  @Test
  public void testImportGarbageKeepsExistingBackup() throws Exception {
    Path storage = newStorageRoot();
    Path project = populatedProject("my-app");
    BackerUpper backupper = newBackerUpper(storage);
    BackupResult backup = backupper.backup(project, KeyOptions.password(PASSWORD));
    byte[] before = Files.readAllBytes(backup.getContainer());

    Path garbage = Files.createTempDirectory("secenv-import").resolve("garbage.secenv");
    Files.write(garbage, "SECENV01 but not really".getBytes(StandardCharsets.US_ASCII));
    try {
      backupper.importFrom(project, KeyOptions.password(PASSWORD), garbage);
      Assert.fail("imported a malformed container");
    } catch (MalformedDataException expected) {
      // ok
    }
    Assert.assertEquals(Files.readAllBytes(backup.getContainer()), before);
  }

  @Test
  public void testImportIntoDifferentlyNamedProject() throws Exception {
    Path storage = newStorageRoot();
    Path project = populatedProject("my-app");
    BackerUpper backupper = newBackerUpper(storage);
    BackupResult backup = backupper.backup(project, KeyOptions.password(PASSWORD));

    // Keys are bound to the project name, so the same password does not open it.
    Path other = newProject("other-app");
    try {
      backupper.importFrom(other, KeyOptions.password(PASSWORD), backup.getContainer());
      Assert.fail("opened a container made for another project");
    } catch (DecryptionFailure expected) {
      // ok
    }
    Assert.assertNull(read(other, ".env"));
  }

  @Test
  public void testPushPull() throws Exception {
    InMemoryBlobStore remote = new InMemoryBlobStore();

    Path storage1 = newStorageRoot();
    Path project1 = populatedProject("my-app");
    BackerUpper machine1 = newBackerUpper(storage1);
    BackupResult pushed = machine1.push(project1, KeyOptions.password(PASSWORD), remote);

    RemoteBlobStore.Snapshot snapshot = remote.read("my-app/backup.secenv");
    Assert.assertEquals(snapshot.data(), Files.readAllBytes(pushed.getContainer()));
    Assert.assertEquals(snapshot.revision(), "1");

    Path storage2 = newStorageRoot();
    Path project2 = newProject("my-app");
    BackerUpper machine2 = newBackerUpper(storage2);
    RestoreResult pulled = machine2.pull(project2, KeyOptions.password(PASSWORD), remote);
    Assert.assertEquals(pulled.getFiles(), List.of(".env", ".env.prod"));
    Assert.assertEquals(read(project2, ".env"), ENV);
    Assert.assertTrue(machine2.hasBackup(project2));

    // A second push replaces the first.
    write(project2, ".env", "API_KEY=rotated\n");
    machine2.push(project2, KeyOptions.password(PASSWORD), remote);
    Assert.assertEquals(remote.read("my-app/backup.secenv").revision(), "2");
    machine1.pull(project1, KeyOptions.password(PASSWORD), remote);
    Assert.assertEquals(read(project1, ".env"), "API_KEY=rotated\n");
  }

  @Test
  public void testPushConflict() throws Exception {
    InMemoryBlobStore remote = new InMemoryBlobStore();
    Path project = populatedProject("my-app");
    BackerUpper backupper = newBackerUpper(newStorageRoot());
    backupper.push(project, KeyOptions.password(PASSWORD), remote);

    byte[] theirs = "pushed by another machine".getBytes(StandardCharsets.UTF_8);

    // Another machine pushes between our read and our write.
    RemoteBlobStore racy = new RemoteBlobStore() {
      @Override
      public Snapshot read(String path) throws IOException, NoValue {
        Snapshot result = remote.read(path);
        try {
          remote.write(path, theirs, result.revision());
        } catch (PreconditionFailed e) {
          throw new AssertionError(e);
        }
        return result;
      }

      @Override
      public String write(String path, byte[] data, @Nullable String expectedRevision) throws IOException, PreconditionFailed {
        return remote.write(path, data, expectedRevision);
      }
    };

    try {
      backupper.push(project, KeyOptions.password(PASSWORD), racy);
      Assert.fail("push overwrote a concurrent push");
    } catch (PreconditionFailed expected) {
      // ok
    }
    Assert.assertEquals(remote.read("my-app/backup.secenv").data(), theirs);
  }

  @Test
  public void testPullWithoutRemoteBackup() throws Exception {
    Path project = newProject("my-app");
    try {
      newBackerUpper(newStorageRoot()).pull(project, KeyOptions.password(PASSWORD), new InMemoryBlobStore());
      Assert.fail("pulled from an empty remote");
    } catch (RemoteNotFound e) {
      Assert.assertTrue(e.getCause() instanceof NoValue);
    }
  }

  @Test
  public void testPullMalformedRemote() throws Exception {
    InMemoryBlobStore remote = new InMemoryBlobStore();
    remote.write("my-app/backup.secenv", new byte[] { 1, 2, 3 }, null);
    Path storage = newStorageRoot();
    Path project = newProject("my-app");
    BackerUpper backupper = newBackerUpper(storage);
    try {
      backupper.pull(project, KeyOptions.password(PASSWORD), remote);
      Assert.fail("pulled a malformed container");
    } catch (MalformedDataException expected) {
      // ok
    }
    Assert.assertFalse(backupper.hasBackup(project));
  }

  @Test
  public void testContainerFromAnotherImplementation() throws Exception {
    // Written independently, with the default work factor.
    Path source = Files.createTempDirectory("secenv-fixture").resolve("my-app.secenv");
    try (InputStream in = BackupTests.class.getResourceAsStream("my-app.secenv")) {
      Assert.assertNotNull(in);
      Files.copy(in, source);
    }

    Path storage = newStorageRoot();
    Path project = newProject("my-app");
    BackerUpper backupper = newBackerUpper(storage, new KeyDerivation());
    RestoreResult result = backupper.importFrom(project, KeyOptions.password(PASSWORD), source);

    Assert.assertEquals(result.getTimestamp(), Instant.parse("2024-03-01T12:00:00Z"));
    Assert.assertEquals(result.getFiles(), List.of(".env", ".env.prod"));
    Assert.assertEquals(read(project, ".env"), "API_KEY=abc123\n");
    Assert.assertEquals(read(project, ".env.prod"), "DB_URL=postgres://prod\n");
    Assert.assertTrue(Arrays.equals(
            Files.readAllBytes(storage.resolve("4c9a75cca717efb6").resolve(".secenv")),
            Files.readAllBytes(source)));
  }

  /**
   * A container in the older layout: "projectName" instead of "project", no hash,
   * and each blob wrapped with its size and line count under "environments".
   */
  private static byte[] legacyContainer(String projectName, String password, String... namesAndContents) throws Exception {
    AuthenticatedCipher cipher = new AuthenticatedCipher(new KeyDerivation(new KeyValidator(), FAST));
    ObjectMapper mapper = new ObjectMapper();
    ObjectNode root = mapper.createObjectNode();
    root.put("projectName", projectName);
    root.put("timestamp", "2024-03-01T12:00:00.000Z");
    ObjectNode environments = root.putObject("environments");
    for (int i = 0; i < namesAndContents.length; i += 2) {
      String content = namesAndContents[i + 1];
      EncryptedBlob blob = cipher.encrypt(
              content.getBytes(StandardCharsets.UTF_8),
              new KeyMaterial.Password(password),
              ProjectIdentity.named(projectName));
      ObjectNode env = environments.putObject(namesAndContents[i]);
      env.putObject("encrypted")
              .put("encrypted", Util.toHex(blob.ciphertext()))
              .put("salt", Util.toHex(blob.salt()))
              .put("iv", Util.toHex(blob.nonce()))
              .put("authTag", Util.toHex(blob.authTag()));
      env.put("size", content.length());
      env.put("lines", content.split("\n", -1).length);
    }
    byte[] payload = new Obfuscation(ObfuscatedContainerFormat.DEFAULT_OBFUSCATION_KEY).apply(mapper.writeValueAsBytes(root));
    return ByteBuffer.allocate(12 + payload.length)
            .put("SECENV01".getBytes(StandardCharsets.US_ASCII))
            .putInt(payload.length)
            .put(payload)
            .array();
  }

  @Test
  public void testImportLegacyContainer() throws Exception {
    Path source = Files.createTempDirectory("secenv-legacy").resolve("old.secenv");
    Files.write(source, legacyContainer("my-app", PASSWORD, ".env", ENV, ".env.prod", ENV_PROD));

    Path storage = newStorageRoot();
    Path project = newProject("my-app");
    BackerUpper backupper = newBackerUpper(storage);
    RestoreResult result = backupper.importFrom(project, KeyOptions.password(PASSWORD), source);

    Assert.assertEquals(result.getTimestamp(), Instant.parse("2024-03-01T12:00:00Z"));
    Assert.assertEquals(result.getFiles(), List.of(".env", ".env.prod"));
    Assert.assertEquals(read(project, ".env"), ENV);
    Assert.assertEquals(read(project, ".env.prod"), ENV_PROD);

    BackupInfo info = backupper.info(project);
    Assert.assertNotNull(info);
    Assert.assertEquals(info.getHash(), ProjectIdentity.named("my-app").hash());

    // A later restore reads the verbatim copy.
    Files.delete(project.resolve(".env"));
    backupper.restore(project, KeyOptions.password(PASSWORD));
    Assert.assertEquals(read(project, ".env"), ENV);
  }

}
