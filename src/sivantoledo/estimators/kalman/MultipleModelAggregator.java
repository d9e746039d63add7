package sivantoledo.estimators.kalman;

import static com.google.common.base.Preconditions.checkArgument;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.Ordering;

import sivantoledo.estimators.ErrorKind;
import sivantoledo.estimators.EstimationException;
import sivantoledo.estimators.Options;
import sivantoledo.estimators.linalg.LinearAlgebra;

/**
 * Multiple-model adaptive estimation. Several filters (one per key, each
 * with its own model) run over the same measurements; their outputs are
 * combined per step, weighting every model by its sliding likelihood,
 *   x = sum_i w_i*x_i / sum_i w_i
 *   P = sum_i w_i*P_i / sum_i w_i
 *
 * Outputs are grouped by state index and, if a window duration is set, by
 * the tumbling event-time window (aligned to the epoch) that contains them.
 * The filters must be configured with a sliding likelihood window.
 *
 * @author Sivan Toledo
 */
public class MultipleModelAggregator {

  private final static Logger log = LogManager.getLogger();

  /**
   * One combined estimate.
   */
  public static final class Estimate {
    private final long       stateIndex;
    private final Instant    windowStart;
    private final RealVector state;
    private final RealMatrix covariance;
    private final int        models;

    Estimate(long stateIndex, Instant windowStart, RealVector state, RealMatrix covariance, int models) {
      this.stateIndex  = stateIndex;
      this.windowStart = windowStart;
      this.state       = state;
      this.covariance  = covariance;
      this.models      = models;
    }

    public long       stateIndex()  { return stateIndex; }
    public Instant    windowStart() { return windowStart; } // null without windowing
    public RealVector state()       { return state.copy(); }
    public RealMatrix covariance()  { return covariance.copy(); }
    public int        models()      { return models; }

    @Override
    public String toString() {
      return String.format("Estimate(index=%d, window=%s, models=%d, x=%s)", stateIndex, windowStart, models, state);
    }
  }

  // key of a TreeMap ordered by ORDER
  private static final class Group {
    final long    stateIndex;
    final Instant windowStart;

    Group(long stateIndex, Instant windowStart) {
      this.stateIndex  = stateIndex;
      this.windowStart = windowStart;
    }
  }

  private static final Comparator<Group> ORDER = (a, b) -> ComparisonChain.start()
      .compare(a.windowStart, b.windowStart, Ordering.<Instant>natural().nullsFirst())
      .compare(a.stateIndex, b.stateIndex)
      .result();

  private final Duration window;

  /**
   * @param window the event-time window, or null to group by state index only
   */
  public MultipleModelAggregator(Duration window) {
    checkArgument(window == null || window.toMillis() > 0,
                  "multiple-model window must be at least a millisecond: %s", window);
    this.window = window;
  }

  /**
   * Reads multipleModelMeasurementWindowDuration (optional).
   */
  public static MultipleModelAggregator fromProperties(Properties properties) {
    Options o = new Options(properties);
    return new MultipleModelAggregator(o.has("multipleModelMeasurementWindowDuration")
                                       ? o.getDuration("multipleModelMeasurementWindowDuration") : null);
  }

  public Duration window() { return window; }

  /**
   * Combines the outputs of several models.
   *
   * @param outputs filter or smoother outputs, of any keys and in any order
   * @return one estimate per group, ordered by window and then state index
   * @throws EstimationException of kind INVALID_PARAMETER if an output has no
   *         sliding likelihood, DIMENSION_MISMATCH if the states of a group
   *         differ in size
   */
  public <K> List<Estimate> aggregate(Collection<KalmanOutput<K>> outputs) {
    Map<Group, List<KalmanOutput<K>>> groups = new TreeMap<>(ORDER);
    for (KalmanOutput<K> o: outputs) {
      if (Double.isNaN(o.slidingLikelihood()))
        throw new EstimationException(ErrorKind.INVALID_PARAMETER,
                                      "output of key "+o.stateKey()+" has no sliding likelihood; enable slidingLikelihoodWindow");
      groups.computeIfAbsent(new Group(o.stateIndex(), windowStart(o.eventTime())), g -> new ArrayList<>()).add(o);
    }

    List<Estimate> estimates = new ArrayList<>();
    for (Map.Entry<Group, List<KalmanOutput<K>>> e: groups.entrySet())
      estimates.add(combine(e.getKey(), e.getValue()));
    return estimates;
  }

  private <K> Estimate combine(Group group, List<KalmanOutput<K>> members) {
    int n = members.get(0).state().getDimension();
    double total = 0;
    for (KalmanOutput<K> o: members) total += o.slidingLikelihood();

    boolean uniform = !(total > 0) || Double.isInfinite(total);
    if (uniform)
      log.warn("sliding likelihoods of state {} sum to {}, weighting {} models equally", group.stateIndex, total, members.size());

    RealVector x = LinearAlgebra.zeros(n);
    RealMatrix P = MatrixUtils.createRealMatrix(n, n);
    for (KalmanOutput<K> o: members) {
      LinearAlgebra.checkVector(o.state(), n, "state of key "+o.stateKey());
      double w = uniform ? 1.0/members.size() : o.slidingLikelihood()/total;
      x = x.add(o.state().mapMultiply(w));
      P = P.add(o.covariance().scalarMultiply(w));
    }
    return new Estimate(group.stateIndex, group.windowStart, x, LinearAlgebra.symmetrize(P), members.size());
  }

  private Instant windowStart(Instant time) {
    if (window == null || time == null) return null;
    long size = window.toMillis();
    long t    = time.toEpochMilli();
    return Instant.ofEpochMilli(t - Math.floorMod(t, size));
  }
}
