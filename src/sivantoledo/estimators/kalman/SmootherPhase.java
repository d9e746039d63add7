package sivantoledo.estimators.kalman;

/**
 * The phase of a fixed-lag smoother of one key. While accumulating, the lag
 * buffer is not yet full and nothing is emitted; in the steady phase every
 * input emits exactly one smoothed estimate.
 */
public enum SmootherPhase {
  ACCUMULATING,
  STEADY
}
