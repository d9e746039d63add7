package sivantoledo.estimators.mixture;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Classical EM over a whole data set, iterated until the parameters stop
 * moving (largest absolute change of the weights and component parameters
 * below the tolerance) or until the iteration limit.
 *
 * Cancellation is checked before every iteration; a cancelled fit returns
 * the last completed iterate.
 */
public class BatchEmTrainer<S, C extends MixtureComponent<S, C>> {

  private final static Logger log = LogManager.getLogger();

  public static final class Result<S, C extends MixtureComponent<S, C>> {
    private final MixtureModel<S, C> model;
    private final int                iterations;
    private final boolean            converged;
    private final boolean            cancelled;
    private final double             logLikelihood;

    Result(MixtureModel<S, C> model, int iterations, boolean converged, boolean cancelled, double logLikelihood) {
      this.model         = model;
      this.iterations    = iterations;
      this.converged     = converged;
      this.cancelled     = cancelled;
      this.logLikelihood = logLikelihood;
    }

    public MixtureModel<S, C> model()         { return model; }
    public int                iterations()    { return iterations; }
    public boolean            converged()     { return converged; }
    public boolean            cancelled()     { return cancelled; }

    /**
     * The average log likelihood of the samples under the returned model.
     */
    public double             logLikelihood() { return logLikelihood; }
  }

  private final int    maxIterations;
  private final double tolerance;

  public BatchEmTrainer(int maxIterations, double tolerance) {
    checkArgument(maxIterations > 0, "batchTrainMaxIter must be positive, got %s", maxIterations);
    checkArgument(tolerance > 0, "batchTrainTol must be positive, got %s", tolerance);
    this.maxIterations = maxIterations;
    this.tolerance     = tolerance;
  }

  public int    maxIterations() { return maxIterations; }
  public double tolerance()     { return tolerance; }

  public Result<S, C> fit(MixtureModel<S, C> initial, List<S> samples, BooleanSupplier cancelled) {
    if (samples.isEmpty()) return new Result<>(initial, 0, true, false, Double.NaN);

    MixtureModel<S, C> model = initial;
    int iterations = 0;
    while (iterations < maxIterations) {
      if (cancelled.getAsBoolean()) {
        log.info("batch EM cancelled after {} iterations", iterations);
        return new Result<>(model, iterations, false, true, averageLogLikelihood(model, samples));
      }
      MixtureModel<S, C> next = iterate(model, samples);
      iterations++;
      double change = next.distance(model);
      model = next;
      log.debug("batch EM iteration {}: parameter change {}", iterations, change);
      if (change < tolerance)
        return new Result<>(model, iterations, true, false, averageLogLikelihood(model, samples));
    }
    log.warn("batch EM did not converge to {} within {} iterations", tolerance, maxIterations);
    return new Result<>(model, iterations, false, false, averageLogLikelihood(model, samples));
  }

  /**
   * One E-step followed by one M-step.
   */
  MixtureModel<S, C> iterate(MixtureModel<S, C> model, List<S> samples) {
    int k = model.size();
    List<SufficientStatistics> stats = new ArrayList<>();
    for (int i=0; i<k; i++) stats.add(SufficientStatistics.zero(model.component(i).expectedStatistic().length));

    for (S s: samples) {
      double[] r = model.posterior(s).responsibilities();
      for (int i=0; i<k; i++) stats.set(i, stats.get(i).plus(r[i], model.component(i).statistic(s)));
    }

    double[] weights = new double[k];
    List<C> components = new ArrayList<>();
    for (int i=0; i<k; i++) {
      SufficientStatistics s = stats.get(i);
      weights[i] = s.weight() / samples.size();
      components.add(s.weight() > OnlineEmTrainer.MIN_COMPONENT_WEIGHT
                     ? model.component(i).fromStatistic(s.average())
                     : model.component(i));
    }
    return new MixtureModel<>(weights, components);
  }

  private double averageLogLikelihood(MixtureModel<S, C> model, List<S> samples) {
    double sum = 0;
    for (S s: samples) sum += model.logLikelihood(s);
    return sum / samples.size();
  }
}
