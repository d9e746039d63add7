package sivantoledo.estimators.kalman;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import sivantoledo.estimators.EstimationException;

/**
 * A fixed-lag Rauch-Tung-Striebel smoother built on a {@link LinearKalmanFilter}.
 *
 * Every input is filtered and its step is appended to the lag buffer. When the
 * buffer holds more than fixedLag steps, a backward pass runs from the newest
 * filtered estimate to the oldest buffered step, whose smoothed estimate is
 * emitted and removed from the buffer. The k-th input (counting from 0) thus
 * emits the smoothed estimate of input k-fixedLag, and nothing is emitted for
 * the first fixedLag inputs. With fixedLag 0 the smoother emits filtered
 * estimates.
 *
 * Like the filter, the smoother is stateless; a failed step leaves the
 * {@link SmootherState} it was given untouched.
 *
 * @author Sivan Toledo
 */
public class FixedLagSmoother {

  private final static Logger log = LogManager.getLogger();

  /**
   * What a smoother step produced: the new state and the smoothed steps that
   * left the buffer, oldest first.
   */
  public static final class Result {
    private final SmootherState             state;
    private final List<LagEntry>            emitted;
    private final List<EstimationException> warnings;

    Result(SmootherState state, List<LagEntry> emitted, List<EstimationException> warnings) {
      this.state    = state;
      this.emitted  = emitted;
      this.warnings = warnings;
    }

    public SmootherState             state()    { return state; }
    public List<LagEntry>            emitted()  { return emitted; }
    public List<EstimationException> warnings() { return warnings; }
  }

  private final LinearKalmanFilter filter;
  private final int                fixedLag;

  public FixedLagSmoother(KalmanConfig config) {
    this.filter   = new LinearKalmanFilter(config);
    this.fixedLag = config.fixedLag();
  }

  public LinearKalmanFilter filter() { return filter; }
  public int fixedLag() { return fixedLag; }

  public SmootherState initialState() {
    return new SmootherState(filter.initialState(), new LagBuffer(fixedLag));
  }

  public SmootherState initialState(KalmanInput first) {
    return new SmootherState(filter.initialState(first), new LagBuffer(fixedLag));
  }

  public Result step(SmootherState state, KalmanInput input, Instant eventTime) {
    LinearKalmanFilter.Step step = filter.step(state.filterState(), input, eventTime);
    LagBuffer buffer = state.buffer().push(LagEntry.of(step));

    List<LagEntry> emitted = new ArrayList<>();
    if (buffer.isOverflowed()) {
      List<LagEntry> smoothed = RauchTungStriebel.smooth(buffer.entries());
      emitted.add(smoothed.get(0));
      buffer = buffer.dropOldest();
      log.debug("emitting smoothed estimate {} (lag {})", smoothed.get(0).smoothed().stateIndex(), fixedLag);
    }
    return new Result(new SmootherState(step.posterior(), buffer), emitted, step.warnings());
  }

  /**
   * Smooths everything still in the buffer with one backward pass from the
   * newest step and emits it. The buffer of the returned state is empty.
   */
  public Result flush(SmootherState state) {
    List<LagEntry> emitted = RauchTungStriebel.smooth(state.buffer().entries());
    if (!emitted.isEmpty()) log.debug("flushing {} buffered estimates", emitted.size());
    return new Result(new SmootherState(state.filterState(), state.buffer().cleared()), emitted, new ArrayList<>());
  }
}
