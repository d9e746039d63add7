package sivantoledo.estimators;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.io.UncheckedIOException;

/**
 * Converts per-key estimator state to and from opaque bytes, so that an 
 * external state store can checkpoint it.
 * 
 * Commons Math dense vectors and matrices are serializable, so the state
 * classes are written with plain object streams.
 */
public final class StateCodec {
  
  private StateCodec() {}

  public static byte[] toBytes(Serializable state) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
      out.writeObject(state);
    } catch (IOException ioe) {
      throw new UncheckedIOException("cannot serialize " + state.getClass().getName(), ioe);
    }
    return bytes.toByteArray();
  }

  public static <S extends Serializable> S fromBytes(byte[] bytes, Class<S> type) {
    try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
      return type.cast(in.readObject());
    } catch (IOException ioe) {
      throw new UncheckedIOException("cannot deserialize " + type.getName(), ioe);
    } catch (ClassNotFoundException cnfe) {
      throw new IllegalStateException("unknown state class in checkpoint", cnfe);
    }
  }
}
