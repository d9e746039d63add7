package sivantoledo.estimators.kalman;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An immutable bounded sequence of the most recent filter steps of one key,
 * oldest first. Pushing returns a new buffer; the buffer may temporarily hold
 * one entry more than its capacity, until the oldest entry is smoothed and
 * removed.
 */
public final class LagBuffer implements Serializable {

  private static final long serialVersionUID = 1L;

  private final int                 capacity;
  private final ArrayList<LagEntry> entries;

  public LagBuffer(int capacity) {
    this(capacity, new ArrayList<>());
  }

  private LagBuffer(int capacity, ArrayList<LagEntry> entries) {
    checkArgument(capacity >= 0, "negative lag buffer capacity %s", capacity);
    this.capacity = capacity;
    this.entries  = entries;
  }

  public int     capacity()     { return capacity; }
  public int     size()         { return entries.size(); }
  public boolean isEmpty()      { return entries.isEmpty(); }
  public boolean isOverflowed() { return entries.size() > capacity; }

  public List<LagEntry> entries() { return Collections.unmodifiableList(entries); }

  public LagBuffer push(LagEntry e) {
    checkState(entries.size() <= capacity, "lag buffer already overflowed");
    ArrayList<LagEntry> copy = new ArrayList<>(entries);
    copy.add(e);
    return new LagBuffer(capacity, copy);
  }

  public LagBuffer dropOldest() {
    checkState(!entries.isEmpty(), "lag buffer is empty");
    return new LagBuffer(capacity, new ArrayList<>(entries.subList(1, entries.size())));
  }

  public LagBuffer cleared() {
    return new LagBuffer(capacity);
  }
}
