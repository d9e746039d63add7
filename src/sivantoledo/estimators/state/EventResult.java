package sivantoledo.estimators.state;

import java.time.Instant;
import java.util.List;

import com.google.common.collect.ImmutableList;

import sivantoledo.estimators.EstimationException;

/**
 * What happened to one event. Errors are reported here, never thrown.
 */
public final class EventResult<K, O> {
  
  public static enum Status {
    ACCEPTED, // applied to the state of the key
    LATE,     // behind the watermark, dropped
    FAILED    // the estimator rejected it, the state of the key is unchanged
  }
  
  private final K                         stateKey;
  private final Instant                   eventTime;
  private final Status                    status;
  private final List<O>                   outputs;
  private final List<EstimationException> warnings;
  private final EstimationException       error;
  
  private EventResult(K stateKey, Instant eventTime, Status status, List<O> outputs,
                      List<EstimationException> warnings, EstimationException error) {
    this.stateKey  = stateKey;
    this.eventTime = eventTime;
    this.status    = status;
    this.outputs   = ImmutableList.copyOf(outputs);
    this.warnings  = ImmutableList.copyOf(warnings);
    this.error     = error;
  }
  
  static <K, O> EventResult<K, O> accepted(K key, Instant time, StepResult<?, O> step) {
    return new EventResult<>(key, time, Status.ACCEPTED, step.outputs(), step.warnings(), null);
  }

  static <K, O> EventResult<K, O> late(K key, Instant time, EstimationException error) {
    return new EventResult<>(key, time, Status.LATE, ImmutableList.of(), ImmutableList.of(), error);
  }

  static <K, O> EventResult<K, O> failed(K key, Instant time, EstimationException error) {
    return new EventResult<>(key, time, Status.FAILED, ImmutableList.of(), ImmutableList.of(), error);
  }
  
  public K                         stateKey()  { return stateKey; }
  public Instant                   eventTime() { return eventTime; }
  public Status                    status()    { return status; }
  public List<O>                   outputs()   { return outputs; }
  public List<EstimationException> warnings()  { return warnings; }
  public EstimationException       error()     { return error; }
  
  public boolean isAccepted() { return status == Status.ACCEPTED; }

  @Override
  public String toString() {
    return String.format("EventResult(%s, %s, %s, %d outputs%s)", stateKey, eventTime, status, outputs.size(),
                         error == null ? "" : ", "+error);
  }
}
