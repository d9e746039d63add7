package sivantoledo.estimators.state;

import java.time.Instant;

/**
 * One input record: a key, an optional event time, and the estimator input.
 *
 * @param <K> the key type
 * @param <I> the estimator input type
 */
public final class KeyedEvent<K, I> {
  
  private final K       stateKey;
  private final Instant eventTime;
  private final I       input;
  
  public KeyedEvent(K stateKey, Instant eventTime, I input) {
    if (stateKey == null) throw new NullPointerException("stateKey");
    if (input    == null) throw new NullPointerException("input");
    this.stateKey  = stateKey;
    this.eventTime = eventTime;
    this.input     = input;
  }
  
  public static <K, I> KeyedEvent<K, I> of(K stateKey, I input) {
    return new KeyedEvent<>(stateKey, null, input);
  }

  public static <K, I> KeyedEvent<K, I> of(K stateKey, Instant eventTime, I input) {
    return new KeyedEvent<>(stateKey, eventTime, input);
  }

  public K       stateKey()  { return stateKey; }
  public Instant eventTime() { return eventTime; }
  public I       input()     { return input; }
  
  @Override
  public String toString() { return String.format("KeyedEvent(%s, %s)", stateKey, eventTime); }
}
