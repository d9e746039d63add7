package sivantoledo.estimators.kalman;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

import sivantoledo.estimators.state.StatefulEstimator;
import sivantoledo.estimators.state.StepResult;

/**
 * A keyed fixed-lag smoother. Outputs are delayed by the lag; whatever is
 * buffered when the key is flushed (eviction or end of stream) is smoothed
 * with the data available and emitted then.
 */
public class KalmanSmootherEstimator<K> implements StatefulEstimator<K, KalmanInput, SmootherState, KalmanOutput<K>> {

  private final FixedLagSmoother smoother;
  private final KalmanConfig     config;

  public KalmanSmootherEstimator(KalmanConfig config) {
    this.config   = config;
    this.smoother = new FixedLagSmoother(config);
  }

  @Override
  public SmootherState initialState(K key, KalmanInput first) {
    return smoother.initialState(first);
  }

  @Override
  public StepResult<SmootherState, KalmanOutput<K>> step(K key, SmootherState state, KalmanInput input, Instant eventTime) {
    FixedLagSmoother.Result r = smoother.step(state, input, eventTime);
    return new StepResult<>(r.state(), outputs(key, r.emitted()), r.warnings());
  }

  @Override
  public StepResult<SmootherState, KalmanOutput<K>> flush(K key, SmootherState state, BooleanSupplier cancelled) {
    FixedLagSmoother.Result r = smoother.flush(state);
    return new StepResult<>(r.state(), outputs(key, r.emitted()), r.warnings());
  }

  private List<KalmanOutput<K>> outputs(K key, List<LagEntry> emitted) {
    List<KalmanOutput<K>> out = new ArrayList<>();
    for (LagEntry e: emitted)
      out.add(KalmanFilterEstimator.output(key, e.smoothed(), e.transition(), e.processNoise(), e.measurementModel(), config));
    return out;
  }
}
