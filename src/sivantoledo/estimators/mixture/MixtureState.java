package sivantoledo.estimators.mixture;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The per-key state of a mixture estimator. Immutable.
 *
 * For online training it holds the running (blended) statistics of every
 * component and the statistics accumulated from the current, not yet
 * consumed, minibatch. For batch training it holds every sample of the key.
 * The index counts consumed minibatches, or fits in batch mode.
 */
public final class MixtureState<S, C extends MixtureComponent<S, C>> implements Serializable {

  private static final long serialVersionUID = 1L;

  private final long                            stateIndex;
  private final Instant                         eventTime;
  private final MixtureModel<S, C>              model;
  private final ArrayList<SufficientStatistics> running;
  private final ArrayList<SufficientStatistics> batch;
  private final int                             batchCount;
  private final double                          batchLogLikelihood;
  private final SampleLog<S>                    samples;

  MixtureState(long stateIndex, Instant eventTime, MixtureModel<S, C> model,
               List<SufficientStatistics> running, List<SufficientStatistics> batch,
               int batchCount, double batchLogLikelihood, SampleLog<S> samples) {
    this.stateIndex         = stateIndex;
    this.eventTime          = eventTime;
    this.model              = model;
    this.running            = new ArrayList<>(running);
    this.batch              = new ArrayList<>(batch);
    this.batchCount         = batchCount;
    this.batchLogLikelihood = batchLogLikelihood;
    this.samples            = samples;
  }

  public long               stateIndex() { return stateIndex; }
  public Instant            eventTime()  { return eventTime; }
  public MixtureModel<S, C> model()      { return model; }

  /**
   * The number of samples in the current minibatch.
   */
  public int pendingCount() { return batchCount; }

  /**
   * The samples retained for batch training.
   */
  public List<S> samples() { return samples.toList(); }

  public int sampleCount() { return samples.size(); }

  SampleLog<S>               sampleLog()          { return samples; }
  List<SufficientStatistics> running()            { return running; }
  List<SufficientStatistics> batch()              { return batch; }
  double                     batchLogLikelihood() { return batchLogLikelihood; }

  MixtureState<S, C> withSample(S sample, Instant time) {
    return new MixtureState<>(stateIndex, time == null ? eventTime : time, model, running, batch,
                              batchCount, batchLogLikelihood, samples.append(sample));
  }

  MixtureState<S, C> withFit(long index, Instant time, SampleLog<S> retained) {
    return new MixtureState<>(index, time, model, running, batch, batchCount, batchLogLikelihood, retained);
  }

  @Override
  public String toString() {
    return String.format("MixtureState(index=%d, pending=%d, samples=%d, %s)",
                         stateIndex, batchCount, samples.size(), model);
  }
}
