package sivantoledo.estimators.kalman;

/**
 * What the filter does when the innovation covariance S cannot be inverted.
 */
public enum SingularMatrixPolicy {
  SKIP,           // keep the predicted state as the posterior and report a warning
  PSEUDO_INVERSE, // use the Moore-Penrose inverse of S
  FAIL            // reject the event
}
