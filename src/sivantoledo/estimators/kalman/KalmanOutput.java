package sivantoledo.estimators.kalman;

import java.time.Instant;
import java.util.Arrays;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import sivantoledo.estimators.linalg.LinearAlgebra;
import sivantoledo.estimators.linalg.RealCovarianceMatrix;

/**
 * An output record of a keyed filter or smoother.
 *
 * The residual fields are null for steps that had no measurement (or whose
 * update was skipped). The system matrices are null unless the estimator was
 * configured to echo them.
 */
public final class KalmanOutput<K> {

  private final K          stateKey;
  private final long       stateIndex;
  private final Instant    eventTime;
  private final RealVector state;
  private final RealMatrix covariance;
  private final RealVector residual;
  private final RealMatrix residualCovariance;
  private final double     slidingLikelihood;
  private final RealMatrix processModel;
  private final RealMatrix processNoise;
  private final RealMatrix measurementModel;

  KalmanOutput(K stateKey, KalmanState estimate, double slidingLikelihood,
               RealMatrix processModel, RealMatrix processNoise, RealMatrix measurementModel) {
    this.stateKey           = stateKey;
    this.stateIndex         = estimate.stateIndex();
    this.eventTime          = estimate.eventTime();
    this.state              = estimate.state();
    this.covariance         = estimate.covariance();
    this.residual           = estimate.residual();
    this.residualCovariance = estimate.residualCovariance();
    this.slidingLikelihood  = slidingLikelihood;
    this.processModel       = processModel;
    this.processNoise       = processNoise;
    this.measurementModel   = measurementModel;
  }

  public K          stateKey()           { return stateKey; }
  public long       stateIndex()         { return stateIndex; }
  public Instant    eventTime()          { return eventTime; }
  public RealVector state()              { return state.copy(); }
  public RealMatrix covariance()         { return covariance.copy(); }
  public RealVector residual()           { return residual == null ? null : residual.copy(); }
  public RealMatrix residualCovariance() { return residualCovariance == null ? null : residualCovariance.copy(); }
  public double     slidingLikelihood()  { return slidingLikelihood; }
  public RealMatrix processModel()       { return processModel; }
  public RealMatrix processNoise()       { return processNoise; }
  public RealMatrix measurementModel()   { return measurementModel; }

  /**
   * The log of the Gaussian density of the residual under N(0,S).
   *
   * @return the log likelihood, or NaN if there is no residual
   */
  public double logLikelihood() {
    if (residual == null) return Double.NaN;
    return LinearAlgebra.gaussianLogDensity(residual, LinearAlgebra.zeros(residual.getDimension()),
                                            new RealCovarianceMatrix(residualCovariance,
                                                                     RealCovarianceMatrix.Representation.COVARIANCE_MATRIX));
  }

  /**
   * The Mahalanobis distance of the residual from 0 under its covariance S.
   *
   * @return the distance, or NaN if there is no residual
   */
  public double mahalanobis() {
    if (residual == null) return Double.NaN;
    return LinearAlgebra.mahalanobis(residual, LinearAlgebra.zeros(residual.getDimension()), residualCovariance);
  }

  @Override
  public String toString() {
    return String.format("KalmanOutput(key=%s, index=%d, time=%s, x=%s)",
                         stateKey, stateIndex, eventTime, Arrays.toString(state.toArray()));
  }
}
