package sivantoledo.estimators.kalman;

import java.io.Serializable;
import java.time.Instant;
import java.util.Arrays;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * An immutable snapshot of the state of a Kalman filter: the estimate of the
 * state vector, its covariance, and the residual of the last update.
 * 
 * The step index is incremented by every predict step, so the state produced
 * by the k-th input has index k.
 * 
 * @author Sivan Toledo
 */
public final class KalmanState implements Serializable {
  
  private static final long serialVersionUID = 1L;

  private final long       stateIndex;
  private final Instant    eventTime;          // just a label, may be null
  private final RealVector state;
  private final RealMatrix covariance;
  private final RealVector residual;           // null if the last step had no measurement
  private final RealMatrix residualCovariance; // null if the last step had no measurement
  private final double[]   slidingLogLikelihoods; // oldest first
  
  public KalmanState(long stateIndex, Instant eventTime, RealVector state, RealMatrix covariance) {
    this(stateIndex, eventTime, state, covariance, null, null, new double[0]);
  }

  KalmanState(long stateIndex, Instant eventTime, RealVector state, RealMatrix covariance,
              RealVector residual, RealMatrix residualCovariance, double[] slidingLogLikelihoods) {
    this.stateIndex            = stateIndex;
    this.eventTime             = eventTime;
    this.state                 = state;
    this.covariance            = covariance;
    this.residual              = residual;
    this.residualCovariance    = residualCovariance;
    this.slidingLogLikelihoods = slidingLogLikelihoods;
  }

  public long       stateIndex()         { return stateIndex; }
  public Instant    eventTime()          { return eventTime; }
  public RealVector state()              { return state.copy(); }
  public RealMatrix covariance()         { return covariance.copy(); }
  public RealVector residual()           { return residual == null ? null : residual.copy(); }
  public RealMatrix residualCovariance() { return residualCovariance == null ? null : residualCovariance.copy(); }
  
  double[] slidingLogLikelihoods() { return slidingLogLikelihoods; }

  /**
   * The product of the residual likelihoods in the sliding window.
   * 
   * @return exp of the sum of the windowed log likelihoods, NaN if the window is empty
   */
  public double slidingLikelihood() {
    if (slidingLogLikelihoods.length == 0) return Double.NaN;
    return Math.exp(Arrays.stream(slidingLogLikelihoods).sum());
  }

  KalmanState withEventTime(Instant time) {
    return new KalmanState(stateIndex, time, state, covariance, residual, residualCovariance, slidingLogLikelihoods);
  }
  
  @Override
  public String toString() {
    return String.format("KalmanState(index=%d, time=%s, x=%s)", stateIndex, eventTime, Arrays.toString(state.toArray()));
  }
}
