package sivantoledo.estimators.regression;

import static com.google.common.base.Preconditions.checkArgument;

import java.time.Instant;
import java.util.Properties;

import org.apache.commons.math3.linear.RealVector;

import sivantoledo.estimators.Options;

/**
 * Normalized least mean squares: a stochastic gradient step on the squared
 * a priori error, scaled by the energy of the features,
 *   e = y - x'*w
 *   w = w + mu*e*x / (a + x'*x)
 * where mu is the learning rate and a a regularization constant that keeps
 * the step bounded for small features. Converges for 0 < mu < 2.
 */
public class LeastMeanSquares extends AbstractOnlineRegression {

  private final double learningRate;
  private final double regularization;

  public LeastMeanSquares(int stateSize, double learningRate, double regularization, RealVector initialCoefficients) {
    super(stateSize, initialCoefficients);
    checkArgument(learningRate > 0 && learningRate < 2, "learningRate must be in (0,2), got %s", learningRate);
    checkArgument(regularization > 0, "regularizationConstant must be positive, got %s", regularization);
    this.learningRate   = learningRate;
    this.regularization = regularization;
  }

  public LeastMeanSquares(int stateSize) {
    this(stateSize, 1.0, 1.0, null);
  }

  /**
   * Reads stateSize (required), learningRate, regularizationConstant and
   * initialState.
   */
  public static LeastMeanSquares fromProperties(Properties properties) {
    Options o = new Options(properties);
    Integer n = o.getInt("stateSize");
    checkArgument(n != null, "option stateSize is required");
    return new LeastMeanSquares(n,
                                o.has("learningRate") ? o.getDouble("learningRate") : 1.0,
                                o.has("regularizationConstant") ? o.getDouble("regularizationConstant") : 1.0,
                                o.has("initialState") ? o.getVector("initialState") : null);
  }

  public double learningRate()   { return learningRate; }
  public double regularization() { return regularization; }

  @Override
  public RegressionState initialState(RealVector initial) {
    return new RegressionState(0, null, initialCoefficients(initial), null, Double.NaN);
  }

  @Override
  public RegressionState update(RegressionState state, double label, RealVector x, Instant eventTime) {
    checkObservation(label, x);
    RealVector w = state.coefficients();
    double     e = label - x.dotProduct(w);
    RealVector updated = w.add(x.mapMultiply(learningRate*e / (regularization + x.dotProduct(x))));
    return new RegressionState(state.stateIndex()+1, timeOf(state, eventTime), updated, null, e);
  }
}
