package sivantoledo.estimators.state;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Serializable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Throwables;

import sivantoledo.estimators.ErrorKind;
import sivantoledo.estimators.EstimationException;
import sivantoledo.estimators.StateCodec;

/**
 * Owns the state of every key of a stream and drives a {@link StatefulEstimator}
 * over the events of that stream.
 *
 * Each key's state is updated by one thread at a time (a lock per key);
 * different keys proceed in parallel. Eviction of a key takes the same lock,
 * so an update and an eviction of the same key never overlap. Errors of one
 * key are reported in its {@link EventResult} and never affect other keys.
 *
 * The driving loop calls {@link #process} for every event, {@link #sweep}
 * periodically to evict idle keys, and {@link #flushAll} at the end of the
 * stream.
 *
 * @author Sivan Toledo
 */
public class KeyedStateManager<K, I, S extends Serializable, O> {

  private final static Logger log = LogManager.getLogger();

  /*
   * The per-key handle. A handle that has been evicted is never reused;
   * a thread that finds an evicted handle looks the key up again.
   */
  private static final class Handle<S> {
    final ReentrantLock lock      = new ReentrantLock();
    final AtomicBoolean cancelled = new AtomicBoolean(false);
    S       state           = null;
    boolean evicted         = false;
    Instant maxEventTime    = null;
    Instant lastEventTime   = null;
    Instant lastProcessTime = null;
  }

  private final StatefulEstimator<K, I, S, O>   estimator;
  private final LifecycleConfig                 config;
  private final Clock                           clock;
  private final ConcurrentHashMap<K, Handle<S>> handles = new ConcurrentHashMap<>();
  private final AtomicReference<Instant>        globalMaxEventTime = new AtomicReference<>(null);
  private final AtomicLong                      lateEvents = new AtomicLong();

  public KeyedStateManager(StatefulEstimator<K, I, S, O> estimator, LifecycleConfig config) {
    this(estimator, config, Clock.systemUTC());
  }

  public KeyedStateManager(StatefulEstimator<K, I, S, O> estimator, LifecycleConfig config, Clock clock) {
    this.estimator = checkNotNull(estimator);
    this.config    = checkNotNull(config);
    this.clock     = checkNotNull(clock);
  }

  /**
   * Applies one event to the state of its key, creating the state if this is
   * the first event of the key.
   *
   * @param event the event
   * @return the outcome; exceptions of the estimator are reported here
   */
  public EventResult<K, O> process(KeyedEvent<K, I> event) {
    K key = event.stateKey();
    while (true) {
      Handle<S> h = handles.computeIfAbsent(key, k -> new Handle<>());
      h.lock.lock();
      try {
        if (h.evicted) continue; // lost a race with an eviction, look up again
        return apply(key, h, event);
      } finally {
        h.lock.unlock();
      }
    }
  }

  private EventResult<K, O> apply(K key, Handle<S> h, KeyedEvent<K, I> event) {
    Instant time = event.eventTime();

    if (isLate(h, time)) {
      lateEvents.incrementAndGet();
      log.debug("dropping late event for key {} at {} (max event time {})", key, time, h.maxEventTime);
      if (h.state == null) discard(key, h);
      return EventResult.late(key, time,
                              new EstimationException(ErrorKind.LATE_DATA, "event is behind the watermark")
                                .withContext(key, time));
    }

    StepResult<S, O> result;
    try {
      S current = h.state;
      if (current == null) {
        current = estimator.initialState(key, event.input());
        log.debug("created state for key {}", key);
      }
      result = estimator.step(key, current, event.input(), time);
    } catch (EstimationException ee) {
      log.debug("event for key {} at {} failed: {}", key, time, ee.toString());
      if (h.state == null) discard(key, h);
      return EventResult.failed(key, time, ee.withContext(key, time));
    }

    h.state = result.state();
    h.lastProcessTime = clock.instant();
    if (time != null) {
      h.lastEventTime = time;
      if (h.maxEventTime == null || time.isAfter(h.maxEventTime)) h.maxEventTime = time;
      globalMaxEventTime.accumulateAndGet(time, (a, b) -> (a == null || b.isAfter(a)) ? b : a);
    }
    for (EstimationException w: result.warnings())
      log.warn("key {} at {}: {}", key, time, w.getMessage());

    List<EstimationException> tagged = new ArrayList<>();
    for (EstimationException w: result.warnings()) tagged.add(w.withContext(key, time));
    return EventResult.accepted(key, time, new StepResult<>(result.state(), result.outputs(), tagged));
  }

  private boolean isLate(Handle<S> h, Instant time) {
    Duration watermark = config.watermarkDuration();
    if (watermark == null || time == null || h.maxEventTime == null) return false;
    return time.isBefore(h.maxEventTime.minus(watermark));
  }

  // called with the lock of h held
  private void discard(K key, Handle<S> h) {
    h.evicted = true;
    handles.remove(key, h);
  }

  /**
   * Processes a batch of events, running the events of different keys in
   * parallel on the given executor. Events of the same key are applied in
   * the order in which they appear in the list.
   *
   * @param events the events
   * @param executor runs one task per distinct key
   * @return one result per event, in the order of the events
   * @throws InterruptedException if interrupted while waiting for the tasks
   */
  public List<EventResult<K, O>> processAll(List<KeyedEvent<K, I>> events, ExecutorService executor)
      throws InterruptedException {
    Map<K, List<Integer>> byKey = new LinkedHashMap<>();
    for (int i=0; i<events.size(); i++)
      byKey.computeIfAbsent(events.get(i).stateKey(), k -> new ArrayList<>()).add(i);

    List<EventResult<K, O>> results = new ArrayList<>(Collections.nCopies(events.size(), null));
    List<Callable<Void>> tasks = new ArrayList<>();
    for (List<Integer> indices: byKey.values()) {
      tasks.add(() -> {
        for (int i: indices) {
          EventResult<K, O> r = process(events.get(i));
          synchronized (results) { results.set(i, r); }
        }
        return null;
      });
    }

    for (Future<Void> f: executor.invokeAll(tasks)) {
      try {
        f.get();
      } catch (ExecutionException ee) {
        Throwables.throwIfUnchecked(ee.getCause());
        throw new IllegalStateException("per-key task failed", ee.getCause());
      }
    }
    return results;
  }

  /**
   * Evicts the keys that have been idle for longer than the state timeout,
   * flushing their estimators first.
   *
   * @return the records emitted by the flushed keys
   */
  public List<O> sweep() {
    List<O> emitted = new ArrayList<>();
    if (config.timeoutMode() == TimeoutMode.NONE) return emitted;

    Instant now       = clock.instant();
    Instant watermark = watermark();
    for (Map.Entry<K, Handle<S>> e: handles.entrySet()) {
      Handle<S> h = e.getValue();
      h.lock.lock();
      try {
        if (h.evicted || h.state == null) continue;
        if (isTimedOut(h, now, watermark)) {
          log.info("key {} timed out ({} mode), evicting", e.getKey(), config.timeoutMode());
          emitted.addAll(evict(e.getKey(), h));
        }
      } finally {
        h.lock.unlock();
      }
    }
    return emitted;
  }

  private boolean isTimedOut(Handle<S> h, Instant now, Instant watermark) {
    Duration timeout = config.stateTimeoutDuration();
    switch (config.timeoutMode()) {
    case PROCESS:
      return h.lastProcessTime != null && Duration.between(h.lastProcessTime, now).compareTo(timeout) > 0;
    case EVENT:
      if (watermark == null || h.lastEventTime == null) return false;
      return Duration.between(h.lastEventTime, watermark).compareTo(timeout) > 0;
    case NONE:
    default:
      return false;
    }
  }

  // called with the lock of h held
  private List<O> evict(K key, Handle<S> h) {
    List<O> out = new ArrayList<>();
    try {
      StepResult<S, O> flushed = estimator.flush(key, h.state, h.cancelled::get);
      out.addAll(flushed.outputs());
      for (EstimationException w: flushed.warnings())
        log.warn("key {} flush: {}", key, w.getMessage());
    } catch (EstimationException ee) {
      log.warn("flushing key {} failed, state dropped: {}", key, ee.toString());
    }
    discard(key, h);
    return out;
  }

  /**
   * Flushes and removes one key.
   *
   * @param key the key
   * @return the records emitted by the flush; empty if the key has no state
   */
  public List<O> flush(K key) {
    Handle<S> h = handles.get(key);
    if (h == null) return new ArrayList<>();
    h.lock.lock();
    try {
      if (h.evicted || h.state == null) return new ArrayList<>();
      log.info("flushing key {}", key);
      return evict(key, h);
    } finally {
      h.lock.unlock();
    }
  }

  /**
   * End of stream: flushes and removes every key.
   *
   * @return the records emitted by all the flushes
   */
  public List<O> flushAll() {
    List<O> emitted = new ArrayList<>();
    for (K key: new ArrayList<>(handles.keySet())) emitted.addAll(flush(key));
    return emitted;
  }

  /**
   * Requests cancellation of long computations (batch training) of a key.
   * The request is checked between iterations.
   */
  public void cancel(K key) {
    Handle<S> h = handles.get(key);
    if (h != null) h.cancelled.set(true);
  }

  /**
   * The global event-time watermark: the maximum event time observed over all
   * keys, minus the watermark duration.
   *
   * @return the watermark, or null if no event carried an event time
   */
  public Instant watermark() {
    Instant max = globalMaxEventTime.get();
    if (max == null) return null;
    return config.watermarkDuration() == null ? max : max.minus(config.watermarkDuration());
  }

  public Optional<S> state(K key) {
    Handle<S> h = handles.get(key);
    if (h == null) return Optional.empty();
    h.lock.lock();
    try {
      return h.evicted ? Optional.empty() : Optional.ofNullable(h.state);
    } finally {
      h.lock.unlock();
    }
  }

  public Set<K> keys()            { return Collections.unmodifiableSet(handles.keySet()); }
  public int    size()            { return handles.size(); }
  public long   lateEventCount()  { return lateEvents.get(); }

  /**
   * Serializes the state of a key for an external checkpoint store.
   *
   * @param key the key
   * @return the serialized state, or empty if the key has no state
   */
  public Optional<byte[]> snapshot(K key) {
    return state(key).map(StateCodec::toBytes);
  }

  /**
   * Installs a checkpointed state for a key, replacing any current state.
   * Watermark and timeout bookkeeping of the key start afresh, and a pending
   * cancellation request is withdrawn.
   *
   * @param key the key
   * @param bytes bytes produced by {@link #snapshot}
   * @param stateClass the class of the state
   */
  public void restore(K key, byte[] bytes, Class<S> stateClass) {
    restore(key, StateCodec.fromBytes(bytes, stateClass));
  }

  /**
   * Installs a state for a key, as {@link #restore(Object, byte[], Class)}
   * does with a decoded checkpoint.
   */
  public void restore(K key, S restored) {
    while (true) {
      Handle<S> h = handles.computeIfAbsent(key, k -> new Handle<>());
      h.lock.lock();
      try {
        if (h.evicted) continue;
        h.state           = restored;
        h.maxEventTime    = null;
        h.lastEventTime   = null;
        h.lastProcessTime = clock.instant();
        h.cancelled.set(false);
        log.debug("restored state of key {}", key);
        return;
      } finally {
        h.lock.unlock();
      }
    }
  }
}
