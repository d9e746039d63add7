package sivantoledo.estimators.mixture;

import java.time.Instant;

/**
 * An output record of a keyed mixture estimator.
 *
 * Online training emits one record per consumed minibatch, with the average
 * log likelihood of the minibatch under the model that assigned its
 * responsibilities. Batch training emits one record per fit, with the average
 * log likelihood of all samples under the fitted model, the number of EM
 * iterations and whether EM converged.
 */
public final class MixtureOutput<K, S, C extends MixtureComponent<S, C>> {

  private final K                  stateKey;
  private final long               stateIndex;
  private final Instant            eventTime;
  private final MixtureModel<S, C> model;
  private final double             logLikelihood;
  private final Boolean            converged;  // null for online training
  private final int                iterations;

  MixtureOutput(K stateKey, long stateIndex, Instant eventTime, MixtureModel<S, C> model,
                double logLikelihood, Boolean converged, int iterations) {
    this.stateKey      = stateKey;
    this.stateIndex    = stateIndex;
    this.eventTime     = eventTime;
    this.model         = model;
    this.logLikelihood = logLikelihood;
    this.converged     = converged;
    this.iterations    = iterations;
  }

  public K                  stateKey()      { return stateKey; }
  public long               stateIndex()    { return stateIndex; }
  public Instant            eventTime()     { return eventTime; }
  public MixtureModel<S, C> mixtureModel()  { return model; }
  public double             logLikelihood() { return logLikelihood; }
  public Boolean            converged()     { return converged; }
  public int                iterations()    { return iterations; }

  @Override
  public String toString() {
    return String.format("MixtureOutput(key=%s, index=%d, time=%s, logLikelihood=%.4f, %s)",
                         stateKey, stateIndex, eventTime, logLikelihood, model);
  }
}
