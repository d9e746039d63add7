package sivantoledo.estimators.linalg;

import java.util.Arrays;

import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSquareMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import sivantoledo.estimators.ErrorKind;
import sivantoledo.estimators.EstimationException;

/**
 * A dense covariance matrix, stored through its Cholesky factor.
 * 
 * A matrix that fails the Cholesky factorization (not symmetric positive 
 * definite, usually because of rounding) is perturbed by a multiple of the 
 * identity and factored again.
 */
public class RealCovarianceMatrix implements CovarianceMatrix {
  
  private static final long serialVersionUID = 1L;

  private final static Logger log = LogManager.getLogger();

  // cholesky tolerances; commons math defaults are too strict for covariances built from data
  private static final double RELATIVE_SYMMETRY_THRESHOLD   = 1e-8;
  private static final double ABSOLUTE_POSITIVITY_THRESHOLD = 1e-12;

  public static enum Representation {
    COVARIANCE_MATRIX, // covariance matrix C
    FACTOR,            // lower-triangular L such that L*L' = C
  }

  private final RealMatrix L;
  private final RealMatrix W; // inv(L), so W'*W = inv(C)
  
  public int dimension() { return W.getColumnDimension(); }
  
  public RealCovarianceMatrix(RealMatrix v, Representation rep) {
    if (!v.isSquare()) 
      throw new EstimationException(ErrorKind.DIMENSION_MISMATCH, "covariance matrix must be square",
                                    new NonSquareMatrixException(v.getRowDimension(), v.getColumnDimension()));
    switch (rep) {
    case COVARIANCE_MATRIX:
      L = factor(v);
      break;
    case FACTOR:
    default:
      L = v.copy();
      break;
    }
    W = MatrixUtils.inverse(L);
  }
  
  private static RealMatrix factor(RealMatrix v) {
    try {
      return new CholeskyDecomposition(LinearAlgebra.symmetrize(v), RELATIVE_SYMMETRY_THRESHOLD, ABSOLUTE_POSITIVITY_THRESHOLD).getL();
    } catch (NonPositiveDefiniteMatrixException npdme) {
      EigenDecomposition eig = new EigenDecomposition(LinearAlgebra.symmetrize(v));
      double[] eigenvalues = eig.getRealEigenvalues();
      double mev = Arrays.stream(eigenvalues).min().getAsDouble();
      double shift = Math.max(2*Math.abs(mev), ABSOLUTE_POSITIVITY_THRESHOLD*10);
      log.warn("covariance matrix is not symmetric positive definite (min eigenvalue {}), perturbing by {}", mev, shift);
      RealMatrix p = LinearAlgebra.symmetrize(v).add(MatrixUtils.createRealIdentityMatrix(eigenvalues.length).scalarMultiply(shift));
      try {
        return new CholeskyDecomposition(p, RELATIVE_SYMMETRY_THRESHOLD, ABSOLUTE_POSITIVITY_THRESHOLD).getL();
      } catch (NonPositiveDefiniteMatrixException still) {
        throw new EstimationException(ErrorKind.INVALID_PARAMETER, 
                                      "covariance matrix is not positive definite even after perturbation: "
                                      +LinearAlgebra.toString(v.getData(), " %.3e"), still);
      }
    }
  }
  
  /**
   * @return the lower-triangular Cholesky factor L, L*L' = C
   */
  public RealMatrix factor() { return L.copy(); }

  @Override
  public RealVector weigh(RealVector v) {
    return W.operate(v);
  }

  @Override
  public double logDeterminant() {
    double logdet = 0;
    for (int i=0; i<L.getRowDimension(); i++) logdet += 2*Math.log(L.getEntry(i, i));
    return logdet;
  }

  @Override
  public RealMatrix get() {
    return L.multiply(L.transpose());
  }

  @Override
  public String toString() { return "L="+LinearAlgebra.toString(L.getData(),"%.3e"); };

}
