package sivantoledo.estimators.regression;

import java.time.Instant;

import org.apache.commons.math3.linear.RealVector;

/**
 * A linear model y = x'*w whose coefficients are refined one observation at
 * a time. Implementations hold configuration only.
 */
public interface OnlineRegression {

  int stateSize();

  /**
   * @param initial the initial coefficients, or null for the configured ones
   * @return the state before the first observation (index 0)
   * @throws sivantoledo.estimators.EstimationException of kind DIMENSION_MISMATCH
   */
  RegressionState initialState(RealVector initial);

  /**
   * Incorporates one observation.
   *
   * @param state the current state
   * @param label y
   * @param features x
   * @param eventTime the time of the observation, may be null
   * @return the new state, with the index incremented
   * @throws sivantoledo.estimators.EstimationException of kind DIMENSION_MISMATCH
   *         or INVALID_PARAMETER (non-finite observation)
   */
  RegressionState update(RegressionState state, double label, RealVector features, Instant eventTime);
}
