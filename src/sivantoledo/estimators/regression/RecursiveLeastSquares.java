package sivantoledo.estimators.regression;

import static com.google.common.base.Preconditions.checkArgument;

import java.time.Instant;
import java.util.Properties;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import sivantoledo.estimators.Options;
import sivantoledo.estimators.linalg.LinearAlgebra;

/**
 * Exponentially weighted recursive least squares. This is a Kalman filter
 * whose state is the coefficient vector, with an identity transition, no
 * process noise and a unit measurement noise; the forgetting factor lambda
 * plays the part of a fading factor. One update:
 *   k = P*x / (lambda + x'*P*x)
 *   e = y - x'*w
 *   w = w + e*k
 *   P = (P - k*x'*P) / lambda
 *
 * P starts as a large multiple of the identity (an uninformative prior).
 *
 * @author Sivan Toledo
 */
public class RecursiveLeastSquares extends AbstractOnlineRegression {

  public static final double DEFAULT_INITIAL_COVARIANCE = 1e6;

  private final double     forgettingFactor;
  private final RealMatrix initialCovariance;

  /**
   * @param stateSize number of coefficients
   * @param forgettingFactor lambda in (0,1]; 1 weighs all observations equally
   * @param initialCovariance P0, or null for 1e6 times the identity
   * @param initialCoefficients w0, or null for zero
   */
  public RecursiveLeastSquares(int stateSize, double forgettingFactor, RealMatrix initialCovariance,
                               RealVector initialCoefficients) {
    super(stateSize, initialCoefficients);
    checkArgument(forgettingFactor > 0 && forgettingFactor <= 1,
                  "forgettingFactor must be in (0,1], got %s", forgettingFactor);
    this.forgettingFactor = forgettingFactor;
    if (initialCovariance == null) {
      this.initialCovariance = LinearAlgebra.identity(stateSize).scalarMultiply(DEFAULT_INITIAL_COVARIANCE);
    } else {
      checkArgument(initialCovariance.getRowDimension() == stateSize
                    && initialCovariance.getColumnDimension() == stateSize,
                    "initialCovariance must be %s by %s", stateSize, stateSize);
      this.initialCovariance = LinearAlgebra.symmetrize(initialCovariance);
    }
  }

  public RecursiveLeastSquares(int stateSize) {
    this(stateSize, 1.0, null, null);
  }

  /**
   * Reads stateSize (required), forgettingFactor, initialState, and either
   * initialCovariance (a matrix) or initialCovarianceDiagonal (a scalar).
   */
  public static RecursiveLeastSquares fromProperties(Properties properties) {
    Options o = new Options(properties);
    Integer n = o.getInt("stateSize");
    checkArgument(n != null, "option stateSize is required");
    RealMatrix P0 = null;
    if (o.has("initialCovariance"))         P0 = o.getMatrix("initialCovariance");
    if (o.has("initialCovarianceDiagonal")) P0 = LinearAlgebra.identity(n).scalarMultiply(o.getDouble("initialCovarianceDiagonal"));
    return new RecursiveLeastSquares(n,
                                     o.has("forgettingFactor") ? o.getDouble("forgettingFactor") : 1.0,
                                     P0,
                                     o.has("initialState") ? o.getVector("initialState") : null);
  }

  public double forgettingFactor() { return forgettingFactor; }

  @Override
  public RegressionState initialState(RealVector initial) {
    return new RegressionState(0, null, initialCoefficients(initial), initialCovariance.copy(), Double.NaN);
  }

  @Override
  public RegressionState update(RegressionState state, double label, RealVector x, Instant eventTime) {
    checkObservation(label, x);
    RealVector w  = state.coefficients();
    RealMatrix P  = state.covariance();

    RealVector Px = P.operate(x);
    RealVector k  = Px.mapDivide(forgettingFactor + x.dotProduct(Px));
    double     e  = label - x.dotProduct(w);

    RealVector wUpdated = w.add(k.mapMultiply(e));
    RealMatrix PUpdated = P.subtract(k.outerProduct(P.preMultiply(x))).scalarMultiply(1.0/forgettingFactor);

    return new RegressionState(state.stateIndex()+1, timeOf(state, eventTime), wUpdated,
                               LinearAlgebra.symmetrize(PUpdated), e);
  }
}
