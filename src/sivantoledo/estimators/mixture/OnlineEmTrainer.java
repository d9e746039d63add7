package sivantoledo.estimators.mixture;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import sivantoledo.estimators.ErrorKind;
import sivantoledo.estimators.EstimationException;

/**
 * Online (stochastic approximation) EM over minibatches.
 *
 * Every component keeps a running statistic s[i] = (weight, moments). Samples
 * of a minibatch are accumulated with their responsibilities under the
 * current model; when the minibatch is consumed, its average statistic b[i]
 * is blended in,
 *   s[i] = (1-eta)*s[i] + eta*b[i],
 * the weights become the normalized running weights and every component is
 * re-estimated from its running moments. A component whose running weight is
 * negligible keeps its parameters.
 */
public class OnlineEmTrainer<S, C extends MixtureComponent<S, C>> {

  private final static Logger log = LogManager.getLogger();

  static final double MIN_COMPONENT_WEIGHT = 1e-12;

  private final StepSizeSchedule schedule;

  public OnlineEmTrainer(StepSizeSchedule schedule) {
    this.schedule = schedule;
  }

  public StepSizeSchedule schedule() { return schedule; }

  /**
   * A fresh state whose running statistics are the expectations of the
   * sufficient statistics under the given model.
   */
  public MixtureState<S, C> initialState(MixtureModel<S, C> model) {
    List<SufficientStatistics> running = new ArrayList<>();
    List<SufficientStatistics> batch   = new ArrayList<>();
    for (int i=0; i<model.size(); i++) {
      double[] expected = model.component(i).expectedStatistic();
      running.add(SufficientStatistics.zero(expected.length).plus(model.weight(i), expected));
      batch.add(SufficientStatistics.zero(expected.length));
    }
    return new MixtureState<>(0, null, model, running, batch, 0, 0.0, SampleLog.<S>empty());
  }

  /**
   * Adds one sample to the current minibatch.
   */
  public MixtureState<S, C> accumulate(MixtureState<S, C> state, S sample, Instant time) {
    MixtureModel<S, C> model = state.model();
    MixtureModel.Posterior posterior = model.posterior(sample);
    double[] r = posterior.responsibilities();

    List<SufficientStatistics> batch = new ArrayList<>();
    for (int i=0; i<model.size(); i++)
      batch.add(state.batch().get(i).plus(r[i], model.component(i).statistic(sample)));

    return new MixtureState<>(state.stateIndex(), time == null ? state.eventTime() : time, model,
                              state.running(), batch, state.pendingCount()+1,
                              state.batchLogLikelihood() + posterior.logLikelihood(), state.sampleLog());
  }

  /**
   * Consumes the current minibatch (possibly a partial one) and updates the
   * model.
   *
   * @throws EstimationException of kind INVALID_WEIGHT or INVALID_PARAMETER if
   *         the update leaves the parameter domain; the argument is unchanged
   */
  public MixtureState<S, C> consume(MixtureState<S, C> state) {
    int n = state.pendingCount();
    if (n == 0) throw new IllegalStateException("no samples to consume");

    long   t   = state.stateIndex()+1;
    double eta = schedule.stepSize(t);
    MixtureModel<S, C> model = state.model();
    int k = model.size();

    List<SufficientStatistics> running = new ArrayList<>();
    double total = 0;
    for (int i=0; i<k; i++) {
      SufficientStatistics s = state.running().get(i).blend(state.batch().get(i).scaled(1.0/n), eta);
      running.add(s);
      total += s.weight();
    }
    if (!(total > 0))
      throw new EstimationException(ErrorKind.INVALID_WEIGHT, "running component weights sum to "+total);

    double[] weights = new double[k];
    List<C> components = new ArrayList<>();
    for (int i=0; i<k; i++) {
      SufficientStatistics s = running.get(i);
      weights[i] = s.weight() / total;
      if (s.weight() > MIN_COMPONENT_WEIGHT) {
        components.add(model.component(i).fromStatistic(s.average()));
      } else {
        log.debug("component {} has negligible weight, keeping its parameters", i);
        components.add(model.component(i));
      }
    }
    MixtureModel<S, C> updated = new MixtureModel<>(weights, components);

    List<SufficientStatistics> batch = new ArrayList<>();
    for (SufficientStatistics b: state.batch()) batch.add(SufficientStatistics.zero(b.moments().length));

    log.debug("minibatch {} of {} samples consumed with step size {}", t, n, eta);
    return new MixtureState<>(t, state.eventTime(), updated, running, batch, 0, 0.0, state.sampleLog());
  }
}
