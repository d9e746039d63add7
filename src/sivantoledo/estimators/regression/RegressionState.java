package sivantoledo.estimators.regression;

import java.io.Serializable;
import java.time.Instant;
import java.util.Arrays;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * The per-key state of an online regression: the coefficient estimate and,
 * for recursive least squares, its (scaled) inverse correlation matrix.
 * Immutable.
 */
public final class RegressionState implements Serializable {

  private static final long serialVersionUID = 1L;

  private final long       stateIndex;
  private final Instant    eventTime;
  private final RealVector coefficients;
  private final RealMatrix covariance; // null for least mean squares
  private final double     residual;   // a priori error of the last update, NaN before the first

  public RegressionState(long stateIndex, Instant eventTime, RealVector coefficients, RealMatrix covariance,
                         double residual) {
    this.stateIndex   = stateIndex;
    this.eventTime    = eventTime;
    this.coefficients = coefficients;
    this.covariance   = covariance;
    this.residual     = residual;
  }

  public long       stateIndex()   { return stateIndex; }
  public Instant    eventTime()    { return eventTime; }
  public RealVector coefficients() { return coefficients.copy(); }
  public RealMatrix covariance()   { return covariance == null ? null : covariance.copy(); }
  public double     residual()     { return residual; }

  @Override
  public String toString() {
    return String.format("RegressionState(index=%d, time=%s, w=%s)", stateIndex, eventTime,
                         Arrays.toString(coefficients.toArray()));
  }
}
