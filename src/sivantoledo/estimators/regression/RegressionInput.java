package sivantoledo.estimators.regression;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;

/**
 * One labelled observation y = x'*w + noise of an online linear regression.
 * The first input of a key may also carry the initial coefficients.
 */
public final class RegressionInput {

  private final double     label;
  private final RealVector features;
  private final RealVector initialState;

  private RegressionInput(double label, RealVector features, RealVector initialState) {
    this.label        = label;
    this.features     = features;
    this.initialState = initialState;
  }

  public static RegressionInput of(double label, RealVector features) {
    return new RegressionInput(label, features, null);
  }

  public static RegressionInput of(double label, double... features) {
    return of(label, new ArrayRealVector(features));
  }

  public RegressionInput withInitialState(RealVector w0) {
    return new RegressionInput(label, features, w0);
  }

  public double     label()        { return label; }
  public RealVector features()     { return features; }
  public RealVector initialState() { return initialState; }
}
