package secenv.vault.impls;

import secenv.prim.MalformedDataException;
import secenv.vault.Util;
import secenv.vault.types.BackupRecord;
import secenv.vault.types.ContainerFormat;
import secenv.vault.types.EncryptedBlob;
import secenv.vault.types.ProjectIdentity;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * The JSON payload of a container.  Binary fields are lowercase hex and the
 * timestamp is ISO-8601:
 * <pre>
 *   {"project": "...", "hash": "...", "timestamp": "2024-01-01T00:00:00Z",
 *    "files": {".env": {"encrypted": "...", "salt": "...", "iv": "...", "authTag": "..."}}}
 * </pre>
 *
 * <p>Older containers use a second shape, which {@link #load(byte[])} also accepts.  It
 * has no hash (the hash is recomputed from the name) and nests each blob one level down:
 * <pre>
 *   {"projectName": "...", "timestamp": "...",
 *    "environments": {".env": {"encrypted": {"encrypted": "...", ...}, "size": 17, "lines": 2}}}
 * </pre>
 * Only the first shape is ever written.
 */
public class JsonRecordFormat implements ContainerFormat {

  @JsonPropertyOrder({"encrypted", "salt", "iv", "authTag"})
  private static class JsonFile {
    public @Nullable String encrypted;
    public @Nullable String salt;
    public @Nullable String iv;
    public @Nullable String authTag;
  }

  // "size" and "lines" are informational and ignored.
  private static class JsonEnvironment {
    public @Nullable JsonFile encrypted;
  }

  @JsonPropertyOrder({"project", "hash", "timestamp", "files"})
  private static class JsonRecord {
    public @Nullable String project;
    public @Nullable String hash;
    public @Nullable String timestamp;
    public @Nullable Map<String, JsonFile> files;

    // legacy shape
    public @Nullable String projectName;
    public @Nullable Map<String, JsonEnvironment> environments;
  }

  private final ObjectMapper mapper;

  public JsonRecordFormat() {
    mapper = new ObjectMapper();
    mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  private static <T> T require(@Nullable T value, String what) throws MalformedDataException {
    if (value == null) {
      throw new MalformedDataException("Backup record has no " + what);
    }
    return value;
  }

  private static byte[] hexField(@Nullable String value, String file, String field) throws MalformedDataException {
    String hex = require(value, field + " for " + file);
    try {
      return Util.fromHex(hex);
    } catch (IllegalArgumentException e) {
      throw new MalformedDataException("Field " + field + " for " + file + " is not hex", e);
    }
  }

  @Override
  public BackupRecord load(byte[] data) throws MalformedDataException {
    final JsonRecord r;
    try {
      r = mapper.readValue(data, JsonRecord.class);
    } catch (JsonParseException e) {
      throw new MalformedDataException("Backup record is not legal JSON", e);
    } catch (JsonMappingException e) {
      throw new MalformedDataException("Backup record JSON is not well-formed", e);
    } catch (IOException e) {
      // Reading from a byte array; only a parse problem can get here.
      throw new MalformedDataException("Backup record could not be read", e);
    }
    if (r == null) {
      throw new MalformedDataException("Backup record is empty");
    }

    String project = require(r.project != null ? r.project : r.projectName, "project name");
    String hash = r.hash != null ? r.hash : ProjectIdentity.named(project).hash();
    Instant timestamp;
    try {
      timestamp = Instant.parse(require(r.timestamp, "timestamp"));
    } catch (DateTimeParseException e) {
      throw new MalformedDataException("Backup record timestamp '" + r.timestamp + "' is not ISO-8601", e);
    }

    Map<String, JsonFile> table;
    if (r.files != null) {
      table = r.files;
    } else {
      table = new LinkedHashMap<>();
      for (Map.Entry<String, JsonEnvironment> entry : require(r.environments, "file table").entrySet()) {
        JsonEnvironment env = require(entry.getValue(), "entry for " + entry.getKey());
        table.put(entry.getKey(), require(env.encrypted, "encrypted data for " + entry.getKey()));
      }
    }

    Map<String, EncryptedBlob> files = new TreeMap<>();
    for (Map.Entry<String, JsonFile> entry : table.entrySet()) {
      String name = entry.getKey();
      if (!BackupRecord.isLegalFileName(name)) {
        throw new MalformedDataException("Backup record contains an unsafe file name '" + name + '\'');
      }
      JsonFile f = require(entry.getValue(), "entry for " + name);
      files.put(name, new EncryptedBlob(
              hexField(f.encrypted, name, "encrypted"),
              hexField(f.salt, name, "salt"),
              hexField(f.iv, name, "iv"),
              hexField(f.authTag, name, "authTag")));
    }

    return new BackupRecord(project, hash, timestamp, files);
  }

  private static JsonFile toJson(EncryptedBlob blob) {
    JsonFile f = new JsonFile();
    f.encrypted = Util.toHex(blob.ciphertext());
    f.salt = Util.toHex(blob.salt());
    f.iv = Util.toHex(blob.nonce());
    f.authTag = Util.toHex(blob.authTag());
    return f;
  }

  @Override
  public byte[] serialize(BackupRecord record) {
    JsonRecord r = new JsonRecord();
    r.project = record.projectName();
    r.hash = record.projectHash();
    r.timestamp = record.timestamp().toString();
    Map<String, JsonFile> files = new LinkedHashMap<>();
    record.files().forEach((name, blob) -> files.put(name, toJson(blob)));
    r.files = files;
    try {
      return mapper.writeValueAsBytes(r);
    } catch (JsonProcessingException e) {
      // Strings, maps and nulls only.
      throw new IllegalStateException("could not serialize backup record", e);
    }
  }

}
