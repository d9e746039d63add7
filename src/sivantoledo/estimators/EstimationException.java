package sivantoledo.estimators;

import java.time.Instant;

/**
 * A failure of a single estimator update.
 * 
 * The exception is raised by the numerical code without any knowledge of 
 * the key it is working on; the lifecycle manager tags it with the key and
 * the event time before reporting it.
 * 
 * @author Sivan Toledo
 */
public class EstimationException extends RuntimeException {
  
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;
  private final Object    stateKey;
  private final Instant   eventTime;

  public EstimationException(ErrorKind kind, String message) {
    this(kind, message, null, null, null);
  }

  public EstimationException(ErrorKind kind, String message, Throwable cause) {
    this(kind, message, cause, null, null);
  }

  private EstimationException(ErrorKind kind, String message, Throwable cause, Object stateKey, Instant eventTime) {
    super(message, cause);
    this.kind      = kind;
    this.stateKey  = stateKey;
    this.eventTime = eventTime;
  }
  
  /**
   * Returns a copy of this exception tagged with the key and event time
   * of the event that failed.
   * 
   * @param key the state key of the failed event
   * @param time the event time of the failed event, may be null
   * @return a tagged copy
   */
  public EstimationException withContext(Object key, Instant time) {
    EstimationException tagged = new EstimationException(kind, getMessage(), getCause(), key, time);
    tagged.setStackTrace(getStackTrace());
    return tagged;
  }

  public ErrorKind kind()     { return kind; }
  public Object    stateKey() { return stateKey; }
  public Instant   eventTime(){ return eventTime; }

  @Override
  public String toString() {
    if (stateKey == null) return String.format("%s: %s", kind, getMessage());
    return String.format("%s [key=%s, eventTime=%s]: %s", kind, stateKey, eventTime, getMessage());
  }
}
