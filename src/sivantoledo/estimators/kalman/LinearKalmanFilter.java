package sivantoledo.estimators.kalman;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import sivantoledo.estimators.ErrorKind;
import sivantoledo.estimators.EstimationException;
import sivantoledo.estimators.linalg.LinearAlgebra;
import sivantoledo.estimators.linalg.RealCovarianceMatrix;

/**
 * A conventional (covariance form) linear Kalman filter.
 *
 * The filter itself is stateless; it maps a {@link KalmanState} and an input
 * to a new {@link KalmanState}. Each input is processed in two steps:
 *   predict
 *   update (omitted if the input has no measurement)
 *
 * @author Sivan Toledo
 */
public class LinearKalmanFilter {

  /**
   * The result of one filter step. The prior and the transition matrix are
   * what a smoother needs to run the backward recursion later.
   */
  public static final class Step {
    private final KalmanState               prior;
    private final KalmanState               posterior;
    private final RealMatrix                transition;
    private final RealMatrix                processNoise;
    private final RealMatrix                measurementModel;
    private final List<EstimationException> warnings;

    Step(KalmanState prior, KalmanState posterior, RealMatrix transition, RealMatrix processNoise,
         RealMatrix measurementModel, List<EstimationException> warnings) {
      this.prior            = prior;
      this.posterior        = posterior;
      this.transition       = transition;
      this.processNoise     = processNoise;
      this.measurementModel = measurementModel;
      this.warnings         = warnings;
    }

    public KalmanState               prior()            { return prior; }
    public KalmanState               posterior()        { return posterior; }
    public RealMatrix                transition()       { return transition; }
    public RealMatrix                processNoise()     { return processNoise; }
    public RealMatrix                measurementModel() { return measurementModel; }
    public List<EstimationException> warnings()         { return warnings; }
  }

  private final KalmanConfig config;

  public LinearKalmanFilter(KalmanConfig config) {
    this.config = config;
  }

  public KalmanConfig config() { return config; }

  /**
   * The state of a filter that has not seen any input yet (index 0).
   */
  public KalmanState initialState() {
    return new KalmanState(0, null, config.initialState(), config.initialCovariance());
  }

  /**
   * The state of a key before its first input, taking the initial state and
   * covariance from that input where it carries them.
   *
   * @param first the first input of the key
   * @throws EstimationException of kind DIMENSION_MISMATCH
   */
  public KalmanState initialState(KalmanInput first) {
    int n = config.stateSize();
    RealVector x = config.initialState();
    RealMatrix P = config.initialCovariance();
    if (first.initialState() != null) {
      LinearAlgebra.checkVector(first.initialState(), n, "initial state");
      x = first.initialState();
    }
    if (first.initialCovariance() != null) {
      LinearAlgebra.checkMatrix(first.initialCovariance(), n, n, "initial covariance");
      P = LinearAlgebra.symmetrize(first.initialCovariance());
    }
    return new KalmanState(0, null, x, P);
  }

  /**
   * Advances the state by one step,
   *   x' = F*x + B*u
   *   P' = f^2 * F*P*F' + Q
   * where f is the fading factor.
   *
   * @param state the current state
   * @param F the transition matrix
   * @param Q the process noise covariance
   * @param B the control function, may be null (identity)
   * @param u the control vector, may be null
   * @return the predicted (prior) state, with the index incremented
   */
  public KalmanState predict(KalmanState state, RealMatrix F, RealMatrix Q, RealMatrix B, RealVector u) {
    int n = config.stateSize();
    LinearAlgebra.checkVector(state.state(), n, "state vector");
    LinearAlgebra.checkMatrix(F, n, n, "process model");
    LinearAlgebra.checkMatrix(Q, n, n, "process noise");

    RealVector x = F.operate(state.state());
    if (u != null) {
      if (B == null) {
        LinearAlgebra.checkVector(u, n, "control vector");
        x = x.add(u);
      } else {
        LinearAlgebra.checkMatrix(B, n, u.getDimension(), "control function");
        x = x.add(B.operate(u));
      }
    }

    double f = config.fadingFactor();
    RealMatrix P = F.multiply(state.covariance()).multiply(F.transpose()).scalarMultiply(f*f).add(Q);

    return new KalmanState(state.stateIndex()+1, state.eventTime(), x, LinearAlgebra.symmetrize(P),
                           null, null, state.slidingLogLikelihoods());
  }

  /**
   * Incorporates a measurement,
   *   y = z - H*x'
   *   S = H*P'*H' + R
   *   K = P'*H'*inv(S)
   *   x = x' + K*y
   *   P = (I - K*H)*P'
   *
   * @param prior the predicted state
   * @param z the measurement
   * @param H the observation matrix
   * @param R the measurement noise covariance
   * @return the posterior state, with the residual y and its covariance S
   * @throws EstimationException of kind DIMENSION_MISMATCH, or SINGULAR_MATRIX
   *         if S is singular and the policy is FAIL
   */
  public KalmanState update(KalmanState prior, RealVector z, RealMatrix H, RealMatrix R) {
    return update(prior, z, H, R, new ArrayList<>());
  }

  private KalmanState update(KalmanState prior, RealVector z, RealMatrix H, RealMatrix R, List<EstimationException> warnings) {
    int n = config.stateSize();
    int m = config.measurementSize();
    LinearAlgebra.checkVector(z, m, "measurement");
    LinearAlgebra.checkMatrix(H, m, n, "measurement model");
    LinearAlgebra.checkMatrix(R, m, m, "measurement noise");

    RealVector x   = prior.state();
    RealMatrix P   = prior.covariance();
    RealMatrix PHt = P.multiply(H.transpose());
    RealMatrix S   = LinearAlgebra.symmetrize(H.multiply(PHt).add(R));
    RealVector y   = z.subtract(H.operate(x));

    RealMatrix Sinv;
    try {
      Sinv = LinearAlgebra.inverse(S);
    } catch (EstimationException singular) {
      switch (config.singularMatrixPolicy()) {
      case PSEUDO_INVERSE:
        warnings.add(new EstimationException(ErrorKind.SINGULAR_MATRIX,
                                             "innovation covariance is singular, using its pseudo-inverse", singular));
        Sinv = LinearAlgebra.pseudoInverse(S);
        break;
      case SKIP:
        warnings.add(new EstimationException(ErrorKind.SINGULAR_MATRIX,
                                             "innovation covariance is singular, update skipped", singular));
        return prior;
      case FAIL:
      default:
        throw singular;
      }
    }

    RealMatrix K = PHt.multiply(Sinv);
    RealVector xPosterior = x.add(K.operate(y));
    RealMatrix PPosterior = LinearAlgebra.identity(n).subtract(K.multiply(H)).multiply(P);

    double[] window = prior.slidingLogLikelihoods();
    if (config.slidingLikelihoodWindow() > 0) {
      double ll = LinearAlgebra.gaussianLogDensity(y, LinearAlgebra.zeros(m),
                                                   new RealCovarianceMatrix(S, RealCovarianceMatrix.Representation.COVARIANCE_MATRIX));
      window = slide(window, ll, config.slidingLikelihoodWindow());
    }

    return new KalmanState(prior.stateIndex(), prior.eventTime(), xPosterior, LinearAlgebra.symmetrize(PPosterior),
                           y, S, window);
  }

  private static double[] slide(double[] window, double value, int capacity) {
    double[] w;
    if (window.length < capacity) {
      w = Arrays.copyOf(window, window.length+1);
    } else {
      w = new double[capacity];
      System.arraycopy(window, window.length-capacity+1, w, 0, capacity-1);
    }
    w[w.length-1] = value;
    return w;
  }

  /**
   * Runs predict and, if the input carries a measurement, update. Matrices
   * that the input does not override are taken from the configuration.
   *
   * @param state the current state
   * @param input the input
   * @param eventTime the time of the input, may be null
   * @return the prior, the posterior and the matrices that were used
   */
  public Step step(KalmanState state, KalmanInput input, Instant eventTime) {
    RealMatrix F = input.processModel()    != null ? input.processModel()    : config.processModel();
    RealMatrix Q = input.processNoise()    != null ? input.processNoise()    : config.processNoise();
    RealMatrix B = input.controlFunction() != null ? input.controlFunction() : config.controlFunction();

    KalmanState prior = predict(state, F, Q, B, input.control()).withEventTime(eventTime);

    RealMatrix H = input.measurementModel() != null ? input.measurementModel() : config.measurementModel();
    RealMatrix R = input.measurementNoise() != null ? input.measurementNoise() : config.measurementNoise();

    List<EstimationException> warnings = new ArrayList<>();
    KalmanState posterior = prior;
    if (input.hasMeasurement()) posterior = update(prior, input.measurement(), H, R, warnings);
    return new Step(prior, posterior, F, Q, H, warnings);
  }
}
