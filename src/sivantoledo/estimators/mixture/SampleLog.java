package sivantoledo.estimators.mixture;

import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * An immutable, append-only sequence of samples. Appending is O(1) and
 * shares the existing prefix.
 *
 * Serialized as a flat list; the linked form is rebuilt on reading.
 */
final class SampleLog<S> implements Serializable {

  private static final long serialVersionUID = 1L;

  private final SampleLog<S> previous;
  private final S            last;
  private final int          size;

  private SampleLog(SampleLog<S> previous, S last, int size) {
    this.previous = previous;
    this.last     = last;
    this.size     = size;
  }

  static <S> SampleLog<S> empty() {
    return new SampleLog<>(null, null, 0);
  }

  SampleLog<S> append(S sample) {
    return new SampleLog<>(this, sample, size+1);
  }

  int size() { return size; }

  /**
   * The samples, oldest first.
   */
  List<S> toList() {
    List<S> reversed = new ArrayList<>(size);
    for (SampleLog<S> node = this; node.size > 0; node = node.previous) reversed.add(node.last);
    Collections.reverse(reversed);
    return ImmutableList.copyOf(reversed);
  }

  private Object writeReplace() {
    return new SerializedForm(toList());
  }

  private void readObject(ObjectInputStream in) throws InvalidObjectException {
    throw new InvalidObjectException("SampleLog is read through its serialized form");
  }

  private static final class SerializedForm implements Serializable {
    private static final long serialVersionUID = 1L;

    private final ArrayList<Object> samples;

    SerializedForm(List<?> samples) {
      this.samples = new ArrayList<>(samples);
    }

    private Object readResolve() {
      SampleLog<Object> log = empty();
      for (Object s: samples) log = log.append(s);
      return log;
    }
  }
}
