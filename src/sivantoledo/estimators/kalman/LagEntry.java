package sivantoledo.estimators.kalman;

import java.io.Serializable;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * One step of the filter as the smoother remembers it: the filtered estimate,
 * the predicted estimate it was computed from, and the matrices used to
 * predict it from the previous step.
 *
 * Once the backward pass has run over an entry, it also carries the smoothed
 * estimate.
 */
public final class LagEntry implements Serializable {

  private static final long serialVersionUID = 1L;

  private final KalmanState filtered;
  private final KalmanState prior;
  private final RealMatrix  transition;
  private final RealMatrix  processNoise;
  private final RealMatrix  measurementModel;
  private final KalmanState smoothed; // null until smoothed

  public LagEntry(KalmanState filtered, KalmanState prior, RealMatrix transition,
                  RealMatrix processNoise, RealMatrix measurementModel) {
    this(filtered, prior, transition, processNoise, measurementModel, null);
  }

  private LagEntry(KalmanState filtered, KalmanState prior, RealMatrix transition,
                   RealMatrix processNoise, RealMatrix measurementModel, KalmanState smoothed) {
    this.filtered         = filtered;
    this.prior            = prior;
    this.transition       = transition;
    this.processNoise     = processNoise;
    this.measurementModel = measurementModel;
    this.smoothed         = smoothed;
  }

  static LagEntry of(LinearKalmanFilter.Step step) {
    return new LagEntry(step.posterior(), step.prior(), step.transition(), step.processNoise(), step.measurementModel());
  }

  public KalmanState filtered()         { return filtered; }
  public KalmanState prior()            { return prior; }
  public RealMatrix  transition()       { return transition; }
  public RealMatrix  processNoise()     { return processNoise; }
  public RealMatrix  measurementModel() { return measurementModel; }
  public KalmanState smoothed()         { return smoothed; }

  LagEntry withSmoothed(KalmanState s) {
    return new LagEntry(filtered, prior, transition, processNoise, measurementModel, s);
  }
}
