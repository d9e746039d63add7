package sivantoledo.estimators.regression;

import java.time.Instant;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * An output record of a keyed online regression.
 */
public final class RegressionOutput<K> {

  private final K               stateKey;
  private final RegressionState state;

  RegressionOutput(K stateKey, RegressionState state) {
    this.stateKey = stateKey;
    this.state    = state;
  }

  public K          stateKey()     { return stateKey; }
  public long       stateIndex()   { return state.stateIndex(); }
  public Instant    eventTime()    { return state.eventTime(); }
  public RealVector coefficients() { return state.coefficients(); }
  public RealMatrix covariance()   { return state.covariance(); }
  public double     residual()     { return state.residual(); }

  @Override
  public String toString() {
    return String.format("RegressionOutput(key=%s, %s)", stateKey, state);
  }
}
