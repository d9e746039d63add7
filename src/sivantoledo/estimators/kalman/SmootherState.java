package sivantoledo.estimators.kalman;

import java.io.Serializable;

/**
 * The per-key state of a fixed-lag smoother: the newest filtered estimate and
 * the buffer of steps that have not been emitted yet.
 */
public final class SmootherState implements Serializable {

  private static final long serialVersionUID = 1L;

  private final KalmanState filterState;
  private final LagBuffer   buffer;

  public SmootherState(KalmanState filterState, LagBuffer buffer) {
    this.filterState = filterState;
    this.buffer      = buffer;
  }

  public KalmanState filterState() { return filterState; }
  public LagBuffer   buffer()      { return buffer; }

  public SmootherPhase phase() {
    return buffer.size() < buffer.capacity() ? SmootherPhase.ACCUMULATING : SmootherPhase.STEADY;
  }

  @Override
  public String toString() {
    return String.format("SmootherState(%s, %s, buffered=%d)", phase(), filterState, buffer.size());
  }
}
