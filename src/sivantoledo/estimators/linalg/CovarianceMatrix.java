package sivantoledo.estimators.linalg;

import java.io.Serializable;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * A covariance matrix C of noise, of a residual, or of a mixture component,
 * kept in whatever form makes whitening cheap. Whitening multiplies by a
 * matrix W with W'*W = inv(C).
 *
 * @author Sivan Toledo
 */
public interface CovarianceMatrix extends Serializable {

  public int dimension();

  /**
   * @return W*v
   */
  public RealVector weigh(RealVector v);

  /**
   * @return log(det(C))
   */
  public double logDeterminant();

  /**
   * The Mahalanobis length of a deviation, sqrt(d'*inv(C)*d).
   */
  public default double whitenedNorm(RealVector deviation) {
    LinearAlgebra.checkVector(deviation, dimension(), "deviation");
    return weigh(deviation).getNorm();
  }

  /**
   * @return C as an explicit matrix
   */
  public RealMatrix get();
}
