package sivantoledo.estimators.kalman;

import java.time.Instant;
import java.util.function.BooleanSupplier;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.collect.ImmutableList;

import sivantoledo.estimators.state.StatefulEstimator;
import sivantoledo.estimators.state.StepResult;

/**
 * A keyed linear Kalman filter: every input emits the filtered estimate.
 */
public class KalmanFilterEstimator<K> implements StatefulEstimator<K, KalmanInput, KalmanState, KalmanOutput<K>> {

  private final static Logger log = LogManager.getLogger();

  private final LinearKalmanFilter filter;

  public KalmanFilterEstimator(KalmanConfig config) {
    this.filter = new LinearKalmanFilter(config);
  }

  @Override
  public KalmanState initialState(K key, KalmanInput first) {
    return filter.initialState(first);
  }

  @Override
  public StepResult<KalmanState, KalmanOutput<K>> step(K key, KalmanState state, KalmanInput input, Instant eventTime) {
    LinearKalmanFilter.Step step = filter.step(state, input, eventTime);
    KalmanOutput<K> out = output(key, step.posterior(), step.transition(), step.processNoise(), step.measurementModel(),
                                 filter.config());
    log.debug("key {} filtered {}", key, out);
    return new StepResult<>(step.posterior(), ImmutableList.of(out), step.warnings());
  }

  @Override
  public StepResult<KalmanState, KalmanOutput<K>> flush(K key, KalmanState state, BooleanSupplier cancelled) {
    return StepResult.silent(state);
  }

  static <K> KalmanOutput<K> output(K key, KalmanState estimate, RealMatrix F, RealMatrix Q, RealMatrix H,
                                    KalmanConfig config) {
    if (config.outputSystemMatrices())
      return new KalmanOutput<>(key, estimate, estimate.slidingLikelihood(), F, Q, H);
    return new KalmanOutput<>(key, estimate, estimate.slidingLikelihood(), null, null, null);
  }
}
