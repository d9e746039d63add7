package sivantoledo.estimators.mixture;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.collect.ImmutableList;

import sivantoledo.estimators.ErrorKind;
import sivantoledo.estimators.EstimationException;
import sivantoledo.estimators.state.StatefulEstimator;
import sivantoledo.estimators.state.StepResult;

/**
 * A keyed mixture estimator, trained either online, one update per
 * minibatch, or by batch EM over all the samples of a key when the key is
 * flushed.
 *
 * @param <K> key type
 * @param <S> sample type
 * @param <C> component type
 */
public class MixtureEstimator<K, S, C extends MixtureComponent<S, C>>
    implements StatefulEstimator<K, MixtureInput<S, C>, MixtureState<S, C>, MixtureOutput<K, S, C>> {

  private final static Logger log = LogManager.getLogger();

  private final MixtureConfig<S, C>   config;
  private final OnlineEmTrainer<S, C> online;
  private final BatchEmTrainer<S, C>  batch;

  public MixtureEstimator(MixtureConfig<S, C> config) {
    this.config = config;
    this.online = new OnlineEmTrainer<>(config.schedule());
    this.batch  = new BatchEmTrainer<>(config.batchTrainMaxIter(), config.batchTrainTol());
  }

  public MixtureConfig<S, C> config() { return config; }

  @Override
  public MixtureState<S, C> initialState(K key, MixtureInput<S, C> first) {
    MixtureModel<S, C> model = first.initialModel() != null ? first.initialModel() : config.initialModel();
    return online.initialState(model);
  }

  @Override
  public StepResult<MixtureState<S, C>, MixtureOutput<K, S, C>> step(K key, MixtureState<S, C> state,
                                                                      MixtureInput<S, C> input, Instant eventTime) {
    S sample = input.sample();
    if (config.enableBatchTrain()) {
      state.model().validate(sample);
      return StepResult.silent(state.withSample(sample, eventTime));
    }

    MixtureState<S, C> accumulated = online.accumulate(state, sample, eventTime);
    if (accumulated.pendingCount() < config.minibatchSize()) return StepResult.silent(accumulated);
    return consume(key, accumulated);
  }

  private StepResult<MixtureState<S, C>, MixtureOutput<K, S, C>> consume(K key, MixtureState<S, C> accumulated) {
    double logLikelihood = accumulated.batchLogLikelihood() / accumulated.pendingCount();
    MixtureState<S, C> updated = online.consume(accumulated);
    MixtureOutput<K, S, C> out = new MixtureOutput<>(key, updated.stateIndex(), updated.eventTime(), updated.model(),
                                                     logLikelihood, null, 0);
    log.debug("key {} emitted {}", key, out);
    return StepResult.of(updated, ImmutableList.of(out));
  }

  @Override
  public StepResult<MixtureState<S, C>, MixtureOutput<K, S, C>> flush(K key, MixtureState<S, C> state,
                                                                       BooleanSupplier cancelled) {
    if (!config.enableBatchTrain())
      return state.pendingCount() > 0 ? consume(key, state) : StepResult.silent(state);

    if (state.sampleCount() == 0) return StepResult.silent(state);

    BatchEmTrainer.Result<S, C> fit = batch.fit(state.model(), state.samples(), cancelled);
    List<EstimationException> warnings = new ArrayList<>();
    if (fit.cancelled()) {
      warnings.add(new EstimationException(ErrorKind.CANCELLED,
                                           "batch training cancelled after "+fit.iterations()+" iterations"));
    } else if (!fit.converged()) {
      warnings.add(new EstimationException(ErrorKind.NON_CONVERGENCE,
                                           String.format("batch training did not reach tolerance %s in %d iterations",
                                                         config.batchTrainTol(), fit.iterations())));
    }

    MixtureState<S, C> fitted = online.initialState(fit.model()).withFit(state.stateIndex()+1, state.eventTime(),
                                                                          state.sampleLog());
    MixtureOutput<K, S, C> out = new MixtureOutput<>(key, fitted.stateIndex(), fitted.eventTime(), fit.model(),
                                                     fit.logLikelihood(), fit.converged(), fit.iterations());
    return new StepResult<>(fitted, ImmutableList.of(out), warnings);
  }
}
