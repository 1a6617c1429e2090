package secenv.prim;

/**
 * An exception indicating that a store holds no value under the requested name.
 * This class is similar to {@link java.nio.file.NoSuchFileException}, but does
 * not pretend that the store is a filesystem.
 */
public class NoValue extends Exception {
  public NoValue(String name) {
    super(name);
  }
}
