package sivantoledo.estimators;

/**
 * Classification of the failures an estimator can report for one event.
 * 
 * @author Sivan Toledo
 */
public enum ErrorKind {
  DIMENSION_MISMATCH(true),  // input shape inconsistent with the configured sizes
  SINGULAR_MATRIX(false),    // recoverable by the configured fallback
  INVALID_WEIGHT(true),      // mixture weights left [0,1] or failed to renormalize
  INVALID_PARAMETER(true),   // e.g., a negative rate
  NON_CONVERGENCE(false),    // batch EM reached its iteration limit
  LATE_DATA(false),          // event behind the watermark, dropped
  CANCELLED(false);          // batch training was cancelled
  
  private final boolean fatal;
  
  ErrorKind(boolean fatal) { this.fatal = fatal; }
  
  /**
   * Whether this kind of failure aborts the update that raised it.
   * Non-fatal kinds still produce a result.
   * 
   * @return true if the update is abandoned and the previous state retained
   */
  public boolean isFatal() { return fatal; }
}
