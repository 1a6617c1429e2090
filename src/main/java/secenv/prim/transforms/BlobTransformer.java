package secenv.prim.transforms;

/**
 * A reversible transformation on byte arrays.  For every input,
 * <code>unApply(apply(data))</code> equals <code>data</code>.
 */
public interface BlobTransformer {

  byte[] apply(byte[] data);
  byte[] unApply(byte[] data);

  /** Leaves data unchanged. */
  BlobTransformer IDENTITY = new BlobTransformer() {
    @Override
    public byte[] apply(byte[] data) {
      return data;
    }

    @Override
    public byte[] unApply(byte[] data) {
      return data;
    }
  };
}
