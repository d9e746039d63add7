package sivantoledo.estimators.linalg;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.junit.Test;

import sivantoledo.estimators.ErrorKind;
import sivantoledo.estimators.EstimationException;

public class LinearAlgebraTest {

  private static final double EPS = 1e-10;

  private static void assertMatrixEquals(RealMatrix expected, RealMatrix actual, double tol) {
    assertEquals(expected.getRowDimension(), actual.getRowDimension());
    assertEquals(expected.getColumnDimension(), actual.getColumnDimension());
    for (int i=0; i<expected.getRowDimension(); i++)
      for (int j=0; j<expected.getColumnDimension(); j++)
        assertEquals("entry "+i+","+j, expected.getEntry(i, j), actual.getEntry(i, j), tol);
  }

  @Test
  public void inverseOfWellConditionedMatrix() {
    RealMatrix A = LinearAlgebra.parseMatrix("4,1;2,3");
    RealMatrix Ainv = LinearAlgebra.inverse(A);
    assertMatrixEquals(LinearAlgebra.identity(2), A.multiply(Ainv), EPS);
  }

  @Test
  public void inverseOfSingularMatrixFails() {
    try {
      LinearAlgebra.inverse(LinearAlgebra.parseMatrix("1,2;2,4"));
      fail("expected a singular matrix error");
    } catch (EstimationException ee) {
      assertEquals(ErrorKind.SINGULAR_MATRIX, ee.kind());
    }
  }

  @Test
  public void pseudoInverseOfRankDeficientMatrix() {
    RealMatrix A = LinearAlgebra.parseMatrix("1,0;0,0");
    assertMatrixEquals(A, LinearAlgebra.pseudoInverse(A), EPS);
    assertMatrixEquals(MatrixUtils.createRealMatrix(2, 2), LinearAlgebra.pseudoInverse(MatrixUtils.createRealMatrix(2, 2)), EPS);
  }

  @Test
  public void shapeChecks() {
    try {
      LinearAlgebra.checkVector(LinearAlgebra.zeros(3), 2, "x");
      fail("expected a dimension mismatch");
    } catch (EstimationException ee) {
      assertEquals(ErrorKind.DIMENSION_MISMATCH, ee.kind());
    }
    try {
      LinearAlgebra.checkMatrix(LinearAlgebra.identity(2), 2, 3, "H");
      fail("expected a dimension mismatch");
    } catch (EstimationException ee) {
      assertEquals(ErrorKind.DIMENSION_MISMATCH, ee.kind());
      assertTrue(ee.getMessage().contains("H"));
    }
  }

  @Test
  public void symmetrizeRemovesAsymmetry() {
    RealMatrix S = LinearAlgebra.symmetrize(LinearAlgebra.parseMatrix("1,2;4,3"));
    assertEquals(3.0, S.getEntry(0, 1), 0.0);
    assertEquals(3.0, S.getEntry(1, 0), 0.0);
  }

  @Test
  public void choleskyFactorReproducesMatrix() {
    RealMatrix C = LinearAlgebra.parseMatrix("5,3;3,5");
    RealMatrix L = new RealCovarianceMatrix(C, RealCovarianceMatrix.Representation.COVARIANCE_MATRIX).factor();
    assertEquals(0.0, L.getEntry(0, 1), 0.0);
    assertMatrixEquals(C, L.multiply(L.transpose()), EPS);
  }

  @Test
  public void nonPositiveDefiniteCovarianceIsRepaired() {
    RealMatrix C = LinearAlgebra.parseMatrix("1,2;2,1"); // eigenvalues 3 and -1
    RealCovarianceMatrix R = new RealCovarianceMatrix(C, RealCovarianceMatrix.Representation.COVARIANCE_MATRIX);
    RealMatrix repaired = R.get();
    assertTrue(repaired.getEntry(0, 0) > 1.0);
    assertTrue(Double.isFinite(R.logDeterminant()));
  }

  @Test
  public void logDeterminantOfBothRepresentations() {
    RealCovarianceMatrix R = new RealCovarianceMatrix(LinearAlgebra.parseMatrix("2,1;1,2"),
                                                      RealCovarianceMatrix.Representation.COVARIANCE_MATRIX);
    assertEquals(Math.log(3.0), R.logDeterminant(), EPS);

    DiagonalCovarianceMatrix D = new DiagonalCovarianceMatrix(new double[] { 2, 8 },
                                                              DiagonalCovarianceMatrix.Representation.DIAGONAL_VARIANCES);
    assertEquals(Math.log(16.0), D.logDeterminant(), EPS);
    assertMatrixEquals(LinearAlgebra.parseMatrix("2,0;0,8"), D.get(), EPS);

    DiagonalCovarianceMatrix sd = new DiagonalCovarianceMatrix(2, 3.0, DiagonalCovarianceMatrix.Representation.DIAGONAL_STANDARD_DEVIATIONS);
    assertMatrixEquals(LinearAlgebra.parseMatrix("9,0;0,9"), sd.get(), EPS);
  }

  @Test
  public void factorAndInverseDeviationRepresentations() {
    RealMatrix C = LinearAlgebra.parseMatrix("4,2;2,5");
    RealCovarianceMatrix fromMatrix = new RealCovarianceMatrix(C, RealCovarianceMatrix.Representation.COVARIANCE_MATRIX);
    RealCovarianceMatrix fromFactor = new RealCovarianceMatrix(fromMatrix.factor(), RealCovarianceMatrix.Representation.FACTOR);
    assertMatrixEquals(C, fromFactor.get(), 1e-12);
    assertEquals(fromMatrix.logDeterminant(), fromFactor.logDeterminant(), 1e-12);

    DiagonalCovarianceMatrix D = new DiagonalCovarianceMatrix(new double[] { 0.5, 0.25 },
                                                              DiagonalCovarianceMatrix.Representation.DIAGONAL_INVERSE_STANDARD_DEVIATIONS);
    assertMatrixEquals(LinearAlgebra.parseMatrix("4,0;0,16"), D.get(), 1e-12);
    assertEquals(1.0, D.whitenedNorm(LinearAlgebra.parseVector("2,0")), 1e-12);
  }

  @Test
  public void gaussianLogDensityMatchesUnivariateNormal() {
    NormalDistribution normal = new NormalDistribution(1.5, 2.0);
    RealVector x    = LinearAlgebra.parseVector("0.3");
    RealVector mean = LinearAlgebra.parseVector("1.5");
    CovarianceMatrix C = new DiagonalCovarianceMatrix(1, 4.0, DiagonalCovarianceMatrix.Representation.DIAGONAL_VARIANCES);
    assertEquals(normal.logDensity(0.3), LinearAlgebra.gaussianLogDensity(x, mean, C), 1e-12);
  }

  @Test
  public void mahalanobisDistance() {
    RealVector x = LinearAlgebra.parseVector("3,0");
    assertEquals(1.5, LinearAlgebra.mahalanobis(x, LinearAlgebra.zeros(2), LinearAlgebra.parseMatrix("4,0;0,1")), EPS);
  }

  @Test
  public void parsing() {
    RealMatrix A = LinearAlgebra.parseMatrix(" 1, 2 ; 3, 4 ");
    assertEquals(4.0, A.getEntry(1, 1), 0.0);
    assertEquals(3, LinearAlgebra.parseVector("1,2,3").getDimension());
    assertEquals(7.0, LinearAlgebra.normMax(new double[] { 1, -7, 3 }), 0.0);
  }
}
