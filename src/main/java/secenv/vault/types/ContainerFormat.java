package secenv.vault.types;

import secenv.prim.MalformedDataException;

/**
 * A <code>ContainerFormat</code> implements serialization and deserialization
 * for the {@link BackupRecord} class.
 *
 * @see #load(byte[])
 * @see #serialize(BackupRecord)
 */
public interface ContainerFormat {

  /**
   * Load a record from bytes.
   *
   * @param data bytes previously produced by {@link #serialize(BackupRecord)}
   * @return a deserialized record
   * @throws MalformedDataException if the bytes are not in this format
   */
  BackupRecord load(byte[] data) throws MalformedDataException;

  /**
   * Serialize a record.
   *
   * @param record a record
   * @return the serialized bytes
   */
  byte[] serialize(BackupRecord record);

}
