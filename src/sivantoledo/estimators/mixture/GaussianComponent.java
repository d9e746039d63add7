package sivantoledo.estimators.mixture;

import java.util.Arrays;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import sivantoledo.estimators.ErrorKind;
import sivantoledo.estimators.EstimationException;
import sivantoledo.estimators.linalg.LinearAlgebra;
import sivantoledo.estimators.linalg.RealCovarianceMatrix;

/**
 * A multivariate normal distribution N(mean, covariance).
 *
 * The sufficient statistic of a sample x is x followed by the entries of
 * x*x', row by row. The covariance produced by the M-step is symmetrized and
 * gets a small ridge on its diagonal, so that a component that collapses onto
 * a few samples stays positive definite.
 *
 * @author Sivan Toledo
 */
public final class GaussianComponent implements MixtureComponent<RealVector, GaussianComponent> {

  private static final long serialVersionUID = 1L;

  static final double RIDGE = 1e-6;

  private final RealVector mean;
  private final RealMatrix covariance;

  private transient volatile RealCovarianceMatrix factored;

  public GaussianComponent(RealVector mean, RealMatrix covariance) {
    LinearAlgebra.checkMatrix(covariance, mean.getDimension(), mean.getDimension(), "component covariance");
    this.mean       = mean.copy();
    this.covariance = covariance.copy();
  }

  public int        dimension()  { return mean.getDimension(); }
  public RealVector mean()       { return mean.copy(); }
  public RealMatrix covariance() { return covariance.copy(); }

  private RealCovarianceMatrix factored() {
    RealCovarianceMatrix C = factored;
    if (C == null) {
      C = new RealCovarianceMatrix(covariance, RealCovarianceMatrix.Representation.COVARIANCE_MATRIX);
      factored = C;
    }
    return C;
  }

  @Override
  public void validate(RealVector sample) {
    if (sample == null) throw new EstimationException(ErrorKind.INVALID_PARAMETER, "missing Gaussian sample");
    LinearAlgebra.checkVector(sample, dimension(), "sample");
    if (sample.isNaN() || sample.isInfinite())
      throw new EstimationException(ErrorKind.INVALID_PARAMETER, "sample has non-finite entries: "+sample);
  }

  @Override
  public double logDensity(RealVector sample) {
    validate(sample);
    return LinearAlgebra.gaussianLogDensity(sample, mean, factored());
  }

  @Override
  public double[] statistic(RealVector x) {
    validate(x);
    int d = dimension();
    double[] T = new double[d + d*d];
    for (int i=0; i<d; i++) {
      T[i] = x.getEntry(i);
      for (int j=0; j<d; j++) T[d + i*d + j] = x.getEntry(i)*x.getEntry(j);
    }
    return T;
  }

  @Override
  public double[] expectedStatistic() {
    int d = dimension();
    double[] T = new double[d + d*d];
    for (int i=0; i<d; i++) {
      T[i] = mean.getEntry(i);
      for (int j=0; j<d; j++) T[d + i*d + j] = covariance.getEntry(i, j) + mean.getEntry(i)*mean.getEntry(j);
    }
    return T;
  }

  @Override
  public GaussianComponent fromStatistic(double[] average) {
    int d = dimension();
    for (double a: average)
      if (!Double.isFinite(a))
        throw new EstimationException(ErrorKind.INVALID_PARAMETER, "updated Gaussian statistic is not finite");
    RealVector mu = MatrixUtils.createRealVector(Arrays.copyOf(average, d));
    RealMatrix second = MatrixUtils.createRealMatrix(d, d);
    for (int i=0; i<d; i++)
      for (int j=0; j<d; j++) second.setEntry(i, j, average[d + i*d + j]);
    RealMatrix cov = LinearAlgebra.symmetrize(second.subtract(mu.outerProduct(mu)))
                                  .add(LinearAlgebra.identity(d).scalarMultiply(RIDGE));
    return new GaussianComponent(mu, cov);
  }

  @Override
  public double[] parameters() {
    int d = dimension();
    double[] p = new double[d + d*d];
    for (int i=0; i<d; i++) {
      p[i] = mean.getEntry(i);
      for (int j=0; j<d; j++) p[d + i*d + j] = covariance.getEntry(i, j);
    }
    return p;
  }

  @Override
  public String toString() {
    return String.format("Gaussian(mean=%s, cov=%s)", Arrays.toString(mean.toArray()),
                         LinearAlgebra.toString(covariance.getData(), " %.3f"));
  }
}
