package sivantoledo.estimators.linalg;

import java.util.Arrays;

import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * A covariance matrix of independent errors.
 */
public class DiagonalCovarianceMatrix implements CovarianceMatrix {
  
  private static final long serialVersionUID = 1L;

  public static enum Representation {
    DIAGONAL_VARIANCES,
    DIAGONAL_STANDARD_DEVIATIONS,
    DIAGONAL_INVERSE_STANDARD_DEVIATIONS,
  }

  private final RealVector weights; // 1/sigma_i
  
  public int dimension() { return weights.getDimension(); }
  
  public DiagonalCovarianceMatrix(double[] v, Representation rep) {
    this(MatrixUtils.createRealVector(v),rep);
  }

  /**
   * A multiple of the identity.
   * 
   * @param dimension the dimension of the matrix
   * @param v the common variance, standard deviation, or inverse standard deviation
   * @param rep how to interpret v
   */
  public DiagonalCovarianceMatrix(int dimension, double v, Representation rep) {
    this(filled(dimension, v), rep);
  }

  public DiagonalCovarianceMatrix(RealVector v, Representation rep) {
    switch (rep) {
    case DIAGONAL_VARIANCES:
      weights = v.map( (v_i) -> (1.0/Math.sqrt(v_i)) );
      break;
    case DIAGONAL_STANDARD_DEVIATIONS:
      weights = v.map( (v_i) -> (1.0/v_i) );
      break;
    case DIAGONAL_INVERSE_STANDARD_DEVIATIONS:
    default:
      weights = v.copy();
      break;      
    }
  }
  
  private static RealVector filled(int dimension, double v) {
    double[] a = new double[dimension];
    Arrays.fill(a, v);
    return MatrixUtils.createRealVector(a);
  }

  @Override
  public RealVector weigh(RealVector v) {
    return weights.ebeMultiply(v);
  }

  @Override
  public double logDeterminant() {
    double logdet = 0;
    for (int i=0; i<weights.getDimension(); i++) logdet -= 2*Math.log(Math.abs(weights.getEntry(i)));
    return logdet;
  }

  @Override
  public RealMatrix get() {
    return new DiagonalMatrix(weights.map( (w_i) -> (1.0/(w_i*w_i)) ).toArray());
  }
  
  @Override
  public String toString() { return String.format("DiagonalCovarianceMatrix(weights=%s)",Arrays.toString(weights.toArray())); };

}
