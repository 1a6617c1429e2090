package secenv.prim;

/**
 * Bytes that were supposed to hold some serialized structure did not.  Callers
 * can use this to tell "this is the wrong file" apart from "this is the wrong key".
 */
public class MalformedDataException extends Exception {
  public MalformedDataException(String message) {
    super(message);
  }

  public MalformedDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
