package sivantoledo.estimators.linalg;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import sivantoledo.estimators.ErrorKind;
import sivantoledo.estimators.EstimationException;

/**
 * Dense linear algebra shared by the filters and the mixture models.
 * 
 * All operations return new objects; arguments are never modified.
 * Failures of Commons Math are translated into {@link EstimationException}s.
 * 
 * @author Sivan Toledo
 */
public final class LinearAlgebra {
  
  private static final double LOG_2_PI = Math.log(2 * Math.PI);
  
  private LinearAlgebra() {}
  
  public static void checkVector(RealVector v, int dimension, String label) {
    if (v.getDimension() != dimension)
      throw new EstimationException(ErrorKind.DIMENSION_MISMATCH, 
                                    String.format("%s has dimension %d, expected %d", label, v.getDimension(), dimension),
                                    new DimensionMismatchException(v.getDimension(), dimension));
  }

  public static void checkMatrix(RealMatrix A, int rows, int columns, String label) {
    if (A.getRowDimension() != rows || A.getColumnDimension() != columns)
      throw new EstimationException(ErrorKind.DIMENSION_MISMATCH, 
                                    String.format("%s is %d by %d, expected %d by %d", 
                                                  label, A.getRowDimension(), A.getColumnDimension(), rows, columns));
  }
  
  /**
   * Inverts a square matrix using an LU factorization.
   * 
   * @param A a square matrix
   * @return inv(A)
   * @throws EstimationException of kind SINGULAR_MATRIX if A is (numerically) singular
   */
  public static RealMatrix inverse(RealMatrix A) {
    checkMatrix(A, A.getRowDimension(), A.getRowDimension(), "matrix to invert");
    DecompositionSolver solver = new LUDecomposition(A).getSolver();
    try {
      return solver.getInverse();
    } catch (SingularMatrixException sme) {
      throw new EstimationException(ErrorKind.SINGULAR_MATRIX, "matrix is singular: "+toString(A.getData(), " %.3e"), sme);
    }
  }
  
  /**
   * The Moore-Penrose pseudo-inverse, computed from the SVD.
   * Never fails, even for rank-deficient matrices.
   * 
   * @param A any matrix
   * @return pinv(A)
   */
  public static RealMatrix pseudoInverse(RealMatrix A) {
    return new SingularValueDecomposition(A).getSolver().getInverse();
  }

  /**
   * Returns (A + A')/2. Used after every covariance update to remove the
   * asymmetry that rounding introduces.
   * 
   * @param A a square matrix
   * @return the symmetric part of A
   */
  public static RealMatrix symmetrize(RealMatrix A) {
    return A.add(A.transpose()).scalarMultiply(0.5);
  }
  
  public static double mahalanobis(RealVector x, RealVector mean, RealMatrix covariance) {
    RealCovarianceMatrix C = new RealCovarianceMatrix(covariance, RealCovarianceMatrix.Representation.COVARIANCE_MATRIX);
    return C.whitenedNorm(x.subtract(mean));
  }
  
  /**
   * The log of the multivariate normal density N(mean,C) at x.
   */
  public static double gaussianLogDensity(RealVector x, RealVector mean, CovarianceMatrix C) {
    double d = C.whitenedNorm(x.subtract(mean));
    return -0.5 * (x.getDimension()*LOG_2_PI + C.logDeterminant() + d*d);
  }
  
  public static RealMatrix identity(int n) {
    return MatrixUtils.createRealIdentityMatrix(n);
  }

  public static RealVector zeros(int n) {
    return MatrixUtils.createRealVector(new double[n]);
  }
  
  /**
   * Parses a matrix written row by row, rows separated by semicolons and
   * elements by commas, "1,0;0,1".
   */
  public static RealMatrix parseMatrix(String rows) {
    String[] r = rows.trim().split(";");
    double[][] A = new double[r.length][];
    for (int i=0; i<r.length; i++) A[i] = parseVector(r[i]).toArray();
    return MatrixUtils.createRealMatrix(A);
  }
  
  public static RealVector parseVector(String elements) {
    String[] e = elements.trim().split(",");
    double[] v = new double[e.length];
    for (int i=0; i<e.length; i++) v[i] = Double.parseDouble(e[i].trim());
    return MatrixUtils.createRealVector(v);
  }

  public static double normMax(double[] input) {
    double max = Double.NEGATIVE_INFINITY;
    for (int i=0; i<input.length; i++) {
      double a = Math.abs(input[i]);
      if (a > max) max = a;
    }
    return max;
  }

  public static String toString(double[][] A, String format) {
    StringBuilder s = new StringBuilder();
    s.append('[');
    for (int d=0; d<A.length; d++) {
      s.append('[');
      for (int i=0; i<A[d].length; i++) {
        s.append(String.format(format, A[d][i]));
      }
      s.append(']');
    }
    s.append(']');
    return s.toString();
  }

}
