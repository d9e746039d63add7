package sivantoledo.estimators.kalman;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.Test;

import sivantoledo.estimators.ErrorKind;
import sivantoledo.estimators.EstimationException;
import sivantoledo.estimators.linalg.LinearAlgebra;
import sivantoledo.estimators.state.StepResult;

public class LinearKalmanFilterTest {

  private static final double EPS = 1e-12;

  /*
   * x0 = 0, P0 = 1, F = H = Q = R = 1.
   */
  private static LinearKalmanFilter scalar() {
    return new LinearKalmanFilter(KalmanConfig.builder(1, 1).build());
  }

  @Test
  public void scalarStepByHand() {
    LinearKalmanFilter filter = scalar();
    LinearKalmanFilter.Step step = filter.step(filter.initialState(), KalmanInput.measurement(2.0), Instant.ofEpochSecond(5));

    // P' = 2, S = 3, K = 2/3
    assertEquals(1, step.prior().stateIndex());
    assertEquals(2.0, step.prior().covariance().getEntry(0, 0), EPS);

    KalmanState x = step.posterior();
    assertEquals(1, x.stateIndex());
    assertEquals(Instant.ofEpochSecond(5), x.eventTime());
    assertEquals(4.0/3.0, x.state().getEntry(0), EPS);
    assertEquals(2.0/3.0, x.covariance().getEntry(0, 0), EPS);
    assertEquals(2.0, x.residual().getEntry(0), EPS);
    assertEquals(3.0, x.residualCovariance().getEntry(0, 0), EPS);
    assertTrue(step.warnings().isEmpty());
  }

  @Test
  public void missingMeasurementOnlyPredicts() {
    LinearKalmanFilter filter = scalar();
    KalmanState x1 = filter.step(filter.initialState(), KalmanInput.measurement(2.0), null).posterior();
    KalmanState x2 = filter.step(x1, KalmanInput.predictOnly(), null).posterior();
    assertEquals(2, x2.stateIndex());
    assertEquals(4.0/3.0, x2.state().getEntry(0), EPS);
    assertEquals(5.0/3.0, x2.covariance().getEntry(0, 0), EPS);
    assertNull(x2.residual());
  }

  @Test
  public void controlVectorAndFadingFactor() {
    LinearKalmanFilter filter = new LinearKalmanFilter(KalmanConfig.builder(1, 1).fadingFactor(2.0).build());
    KalmanState prior = filter.predict(filter.initialState(), LinearAlgebra.identity(1), LinearAlgebra.identity(1),
                                       null, LinearAlgebra.parseVector("3"));
    assertEquals(3.0, prior.state().getEntry(0), EPS);
    assertEquals(5.0, prior.covariance().getEntry(0, 0), EPS); // 2^2 * 1 + 1
  }

  @Test
  public void twoDimensionalUpdate() {
    RealMatrix F = LinearAlgebra.parseMatrix("1,1;0,1");
    KalmanConfig config = KalmanConfig.builder(2, 1)
        .processModel(F)
        .processNoise(LinearAlgebra.parseMatrix("0.01,0;0,0.01"))
        .measurementModel(LinearAlgebra.parseMatrix("1,0"))
        .measurementNoise(LinearAlgebra.parseMatrix("0.25"))
        .build();
    LinearKalmanFilter filter = new LinearKalmanFilter(config);

    KalmanState state = filter.initialState();
    for (int k=1; k<=50; k++) state = filter.step(state, KalmanInput.measurement(2.0*k), null).posterior();

    // noiseless constant velocity 2
    assertEquals(100.0, state.state().getEntry(0), 0.05);
    assertEquals(2.0,   state.state().getEntry(1), 0.05);
    RealMatrix P = state.covariance();
    assertEquals(P.getEntry(0, 1), P.getEntry(1, 0), 0.0);
    assertTrue(P.getEntry(0, 0) > 0 && P.getEntry(1, 1) > 0);
  }

  @Test
  public void perEventOverrides() {
    LinearKalmanFilter filter = new LinearKalmanFilter(KalmanConfig.builder(2, 1).build());
    KalmanInput input = KalmanInput.measurement(1.0)
        .withMeasurementModel(LinearAlgebra.parseMatrix("0,1"))
        .withMeasurementNoise(LinearAlgebra.parseMatrix("1e-6"));
    KalmanState x = filter.step(filter.initialState(), input, null).posterior();
    assertEquals(0.0, x.state().getEntry(0), 1e-6);
    assertEquals(1.0, x.state().getEntry(1), 1e-5);
  }

  @Test
  public void perEventProcessAndControl() {
    LinearKalmanFilter filter = new LinearKalmanFilter(KalmanConfig.builder(2, 1).build());
    RealMatrix F = LinearAlgebra.parseMatrix("1,1;0,1");
    KalmanInput input = KalmanInput.predictOnly()
        .withProcessModel(F)
        .withProcessNoise(MatrixUtils.createRealMatrix(2, 2))
        .withControlFunction(LinearAlgebra.parseMatrix("0.5;1"))
        .withControl(MatrixUtils.createRealVector(new double[] { 2.0 }));
    LinearKalmanFilter.Step step = filter.step(filter.initialState(), input, null);

    assertSame(F, step.transition());
    KalmanState x = step.posterior();
    assertEquals(1.0, x.state().getEntry(0), EPS);
    assertEquals(2.0, x.state().getEntry(1), EPS);
    // F*I*F'
    assertEquals(2.0, x.covariance().getEntry(0, 0), EPS);
    assertEquals(1.0, x.covariance().getEntry(0, 1), EPS);
    assertEquals(1.0, x.covariance().getEntry(1, 1), EPS);
  }

  @Test
  public void dimensionMismatch() {
    LinearKalmanFilter filter = new LinearKalmanFilter(KalmanConfig.builder(2, 1).build());
    try {
      filter.step(filter.initialState(), KalmanInput.measurement(1.0, 2.0), null);
      fail("expected a dimension mismatch");
    } catch (EstimationException ee) {
      assertEquals(ErrorKind.DIMENSION_MISMATCH, ee.kind());
    }
    try {
      filter.step(filter.initialState(), KalmanInput.measurement(1.0).withProcessModel(LinearAlgebra.identity(3)), null);
      fail("expected a dimension mismatch");
    } catch (EstimationException ee) {
      assertEquals(ErrorKind.DIMENSION_MISMATCH, ee.kind());
    }
  }

  private static KalmanInput singularInput() {
    return KalmanInput.measurement(1.0)
        .withMeasurementModel(MatrixUtils.createRealMatrix(1, 1))
        .withMeasurementNoise(MatrixUtils.createRealMatrix(1, 1));
  }

  @Test
  public void singularInnovationIsSkippedByDefault() {
    LinearKalmanFilter filter = scalar();
    LinearKalmanFilter.Step step = filter.step(filter.initialState(), singularInput(), null);
    assertSame(step.prior(), step.posterior());
    assertEquals(1, step.warnings().size());
    assertEquals(ErrorKind.SINGULAR_MATRIX, step.warnings().get(0).kind());
  }

  @Test
  public void singularInnovationWithPseudoInverse() {
    LinearKalmanFilter filter = new LinearKalmanFilter(KalmanConfig.builder(1, 1)
        .singularMatrixPolicy(SingularMatrixPolicy.PSEUDO_INVERSE).build());
    LinearKalmanFilter.Step step = filter.step(filter.initialState(), singularInput(), null);
    // the gain is zero, the estimate stays at the prediction
    assertEquals(0.0, step.posterior().state().getEntry(0), EPS);
    assertEquals(2.0, step.posterior().covariance().getEntry(0, 0), EPS);
    assertEquals(1, step.warnings().size());
  }

  @Test
  public void singularInnovationCanFail() {
    LinearKalmanFilter filter = new LinearKalmanFilter(KalmanConfig.builder(1, 1)
        .singularMatrixPolicy(SingularMatrixPolicy.FAIL).build());
    try {
      filter.step(filter.initialState(), singularInput(), null);
      fail("expected a singular matrix error");
    } catch (EstimationException ee) {
      assertEquals(ErrorKind.SINGULAR_MATRIX, ee.kind());
    }
  }

  @Test
  public void slidingLikelihoodKeepsTheLastUpdates() {
    KalmanFilterEstimator<String> estimator = new KalmanFilterEstimator<>(KalmanConfig.builder(1, 1).slidingLikelihoodWindow(2).build());

    KalmanState state = estimator.initialState("k", KalmanInput.predictOnly());
    assertTrue(Double.isNaN(state.slidingLikelihood()));

    double[] z  = { 1.0, -0.5, 2.0 };
    double[] ll = new double[z.length];
    KalmanOutput<String> last = null;
    for (int k=0; k<z.length; k++) {
      StepResult<KalmanState, KalmanOutput<String>> r = estimator.step("k", state, KalmanInput.measurement(z[k]), null);
      state = r.state();
      last  = r.outputs().get(0);
      ll[k] = last.logLikelihood();
    }
    assertEquals(Math.exp(ll[1] + ll[2]), state.slidingLikelihood(), 1e-12);
    assertEquals(state.slidingLikelihood(), last.slidingLikelihood(), 0.0);
  }

  @Test
  public void residualDiagnostics() {
    KalmanFilterEstimator<String> estimator = new KalmanFilterEstimator<>(KalmanConfig.builder(1, 1).build());
    KalmanOutput<String> out = estimator.step("k", estimator.initialState("k", KalmanInput.predictOnly()), KalmanInput.measurement(2.0), null)
                                        .outputs().get(0);
    // y = 2, S = 3
    assertEquals(2.0/Math.sqrt(3.0), out.mahalanobis(), EPS);
    assertEquals(-0.5*(Math.log(2*Math.PI) + Math.log(3.0) + 4.0/3.0), out.logLikelihood(), EPS);

    KalmanOutput<String> predicted = estimator.step("k", estimator.initialState("k", KalmanInput.predictOnly()), KalmanInput.predictOnly(), null)
                                              .outputs().get(0);
    assertTrue(Double.isNaN(predicted.mahalanobis()));
    assertTrue(Double.isNaN(predicted.logLikelihood()));
  }

  @Test
  public void replayIsDeterministic() {
    LinearKalmanFilter filter = new LinearKalmanFilter(KalmanConfig.builder(2, 1)
        .processModel(LinearAlgebra.parseMatrix("1,0.1;0,1")).build());
    double[] z = { 0.3, 0.1, 0.9, 1.4, 1.2, 2.0 };
    KalmanState a = filter.initialState();
    KalmanState b = filter.initialState();
    for (double zk: z) a = filter.step(a, KalmanInput.measurement(zk), null).posterior();
    for (double zk: z) b = filter.step(b, KalmanInput.measurement(zk), null).posterior();
    assertEquals(a.state(), b.state());
    assertEquals(a.covariance(), b.covariance());
  }

  @Test
  public void firstInputMayCarryTheInitialStateOfItsKey() {
    KalmanFilterEstimator<String> estimator = new KalmanFilterEstimator<>(KalmanConfig.builder(1, 1).build());
    KalmanInput first = KalmanInput.measurement(5.0)
        .withInitialState(LinearAlgebra.parseVector("5"))
        .withInitialCovariance(LinearAlgebra.parseMatrix("2"));

    KalmanState a = estimator.initialState("a", first);
    assertEquals(0, a.stateIndex());
    assertEquals(5.0, a.state().getEntry(0), 0.0);
    assertEquals(2.0, a.covariance().getEntry(0, 0), 0.0);

    // P' = 3, S = 4, K = 3/4 and the residual is zero
    KalmanOutput<String> out = estimator.step("a", a, first, null).outputs().get(0);
    assertEquals(5.0, out.state().getEntry(0), EPS);
    assertEquals(0.75, out.covariance().getEntry(0, 0), EPS);

    // other keys keep the configured prior
    KalmanState b = estimator.initialState("b", KalmanInput.measurement(2.0));
    assertEquals(0.0, b.state().getEntry(0), 0.0);
    assertEquals(1.0, b.covariance().getEntry(0, 0), 0.0);
  }

  @Test
  public void initialStateOfTheWrongSize() {
    KalmanFilterEstimator<String> estimator = new KalmanFilterEstimator<>(KalmanConfig.builder(2, 1).build());
    try {
      estimator.initialState("a", KalmanInput.measurement(1.0).withInitialState(LinearAlgebra.parseVector("1,2,3")));
      fail("expected a dimension mismatch");
    } catch (EstimationException ee) {
      assertEquals(ErrorKind.DIMENSION_MISMATCH, ee.kind());
    }
    try {
      estimator.initialState("a", KalmanInput.measurement(1.0).withInitialCovariance(LinearAlgebra.identity(3)));
      fail("expected a dimension mismatch");
    } catch (EstimationException ee) {
      assertEquals(ErrorKind.DIMENSION_MISMATCH, ee.kind());
    }
  }
}
