package sivantoledo.estimators.regression;

import java.time.Instant;
import java.util.function.BooleanSupplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.collect.ImmutableList;

import sivantoledo.estimators.state.StatefulEstimator;
import sivantoledo.estimators.state.StepResult;

/**
 * A keyed online regression: every observation emits the updated
 * coefficients of its key.
 */
public class RegressionEstimator<K> implements StatefulEstimator<K, RegressionInput, RegressionState, RegressionOutput<K>> {

  private final static Logger log = LogManager.getLogger();

  private final OnlineRegression regression;

  public RegressionEstimator(OnlineRegression regression) {
    this.regression = regression;
  }

  @Override
  public RegressionState initialState(K key, RegressionInput first) {
    return regression.initialState(first.initialState());
  }

  @Override
  public StepResult<RegressionState, RegressionOutput<K>> step(K key, RegressionState state, RegressionInput input,
                                                               Instant eventTime) {
    RegressionState updated = regression.update(state, input.label(), input.features(), eventTime);
    RegressionOutput<K> out = new RegressionOutput<>(key, updated);
    log.debug("key {} regressed {}", key, out);
    return StepResult.of(updated, ImmutableList.of(out));
  }

  @Override
  public StepResult<RegressionState, RegressionOutput<K>> flush(K key, RegressionState state, BooleanSupplier cancelled) {
    return StepResult.silent(state);
  }
}
