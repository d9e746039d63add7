package sivantoledo.estimators.regression;

import static com.google.common.base.Preconditions.checkArgument;

import java.time.Instant;

import org.apache.commons.math3.linear.RealVector;

import sivantoledo.estimators.ErrorKind;
import sivantoledo.estimators.EstimationException;
import sivantoledo.estimators.linalg.LinearAlgebra;

/**
 * The state size, the initial coefficients and the checks that every online
 * regression shares.
 */
abstract class AbstractOnlineRegression implements OnlineRegression {

  private final int        stateSize;
  private final RealVector initialCoefficients;

  AbstractOnlineRegression(int stateSize, RealVector initialCoefficients) {
    checkArgument(stateSize > 0, "stateSize must be positive, got %s", stateSize);
    this.stateSize = stateSize;
    if (initialCoefficients == null) {
      this.initialCoefficients = LinearAlgebra.zeros(stateSize);
    } else {
      checkArgument(initialCoefficients.getDimension() == stateSize,
                    "initial state has dimension %s, expected %s", initialCoefficients.getDimension(), stateSize);
      this.initialCoefficients = initialCoefficients.copy();
    }
  }

  @Override
  public int stateSize() { return stateSize; }

  RealVector initialCoefficients(RealVector override) {
    if (override == null) return initialCoefficients.copy();
    LinearAlgebra.checkVector(override, stateSize, "initial state");
    return override.copy();
  }

  void checkObservation(double label, RealVector features) {
    LinearAlgebra.checkVector(features, stateSize, "features");
    if (Double.isNaN(label) || Double.isInfinite(label) || features.isNaN() || features.isInfinite())
      throw new EstimationException(ErrorKind.INVALID_PARAMETER,
                                    "observation is not finite: y="+label+", x="+features);
  }

  static Instant timeOf(RegressionState state, Instant eventTime) {
    return eventTime == null ? state.eventTime() : eventTime;
  }
}
