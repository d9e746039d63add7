package sivantoledo.estimators.state;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.junit.Test;

import sivantoledo.estimators.ErrorKind;
import sivantoledo.estimators.StateCodec;
import sivantoledo.estimators.kalman.KalmanConfig;
import sivantoledo.estimators.kalman.KalmanFilterEstimator;
import sivantoledo.estimators.kalman.KalmanInput;
import sivantoledo.estimators.kalman.KalmanOutput;
import sivantoledo.estimators.kalman.KalmanSmootherEstimator;
import sivantoledo.estimators.kalman.KalmanState;
import sivantoledo.estimators.kalman.SmootherState;
import sivantoledo.estimators.linalg.LinearAlgebra;
import sivantoledo.estimators.mixture.MixtureConfig;
import sivantoledo.estimators.mixture.MixtureEstimator;
import sivantoledo.estimators.mixture.MixtureInput;
import sivantoledo.estimators.mixture.MixtureModel;
import sivantoledo.estimators.mixture.MixtureOutput;
import sivantoledo.estimators.mixture.MixtureState;
import sivantoledo.estimators.mixture.PoissonComponent;

public class KeyedStateManagerTest {

  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  private static Instant at(long seconds) { return T0.plusSeconds(seconds); }

  private static KalmanConfig filterConfig(int lag) {
    return KalmanConfig.builder(2, 1)
        .processModel(LinearAlgebra.parseMatrix("1,1;0,1"))
        .processNoise(LinearAlgebra.parseMatrix("0.01,0;0,0.01"))
        .measurementModel(LinearAlgebra.parseMatrix("1,0"))
        .fixedLag(lag)
        .build();
  }

  private static KeyedStateManager<String, KalmanInput, KalmanState, KalmanOutput<String>> filterManager(LifecycleConfig lifecycle,
                                                                                                         MutableClock clock) {
    return new KeyedStateManager<>(new KalmanFilterEstimator<String>(filterConfig(2)), lifecycle, clock);
  }

  private static KeyedEvent<String, KalmanInput> event(String key, long seconds, double z) {
    return KeyedEvent.of(key, at(seconds), KalmanInput.measurement(z));
  }

  @Test
  public void firstEventCreatesTheKey() {
    KeyedStateManager<String, KalmanInput, KalmanState, KalmanOutput<String>> m = filterManager(LifecycleConfig.defaults(), new MutableClock(T0));
    assertEquals(0, m.size());
    assertTrue(m.flushAll().isEmpty());

    EventResult<String, KalmanOutput<String>> r = m.process(event("a", 1, 0.5));
    assertTrue(r.isAccepted());
    assertEquals(1, r.outputs().size());
    assertEquals("a", r.outputs().get(0).stateKey());
    assertEquals(1, r.outputs().get(0).stateIndex());
    assertEquals(at(1), r.outputs().get(0).eventTime());
    assertEquals(1, m.size());
    assertTrue(m.state("a").isPresent());
    assertFalse(m.state("b").isPresent());
  }

  @Test
  public void lateEventsAreDroppedWithoutTouchingTheState() {
    LifecycleConfig lifecycle = LifecycleConfig.builder().watermarkDuration(Duration.ofSeconds(10)).build();
    KeyedStateManager<String, KalmanInput, KalmanState, KalmanOutput<String>> m = filterManager(lifecycle, new MutableClock(T0));

    assertTrue(m.process(event("a", 100, 1.0)).isAccepted());
    assertTrue(m.process(event("a", 120, 2.0)).isAccepted());
    KalmanState before = m.state("a").get();

    EventResult<String, KalmanOutput<String>> late = m.process(event("a", 105, 9.0));
    assertEquals(EventResult.Status.LATE, late.status());
    assertEquals(ErrorKind.LATE_DATA, late.error().kind());
    assertTrue(late.outputs().isEmpty());
    assertEquals(1, m.lateEventCount());
    assertTrue(before == m.state("a").get());

    // out of order but within the watermark
    EventResult<String, KalmanOutput<String>> inTime = m.process(event("a", 112, 3.0));
    assertTrue(inTime.isAccepted());
    assertEquals(3, m.state("a").get().stateIndex());

    // the watermark of one key does not affect another
    assertTrue(m.process(event("b", 50, 1.0)).isAccepted());
    assertEquals(at(110), m.watermark());
  }

  @Test
  public void withoutAWatermarkNothingIsLate() {
    KeyedStateManager<String, KalmanInput, KalmanState, KalmanOutput<String>> m = filterManager(LifecycleConfig.defaults(), new MutableClock(T0));
    m.process(event("a", 1000, 1.0));
    assertTrue(m.process(event("a", 1, 1.0)).isAccepted());
    assertTrue(m.process(KeyedEvent.of("a", KalmanInput.measurement(1.0))).isAccepted());
    assertEquals(0, m.lateEventCount());
  }

  @Test
  public void failuresAreIsolatedToTheirKey() {
    KeyedStateManager<String, KalmanInput, KalmanState, KalmanOutput<String>> m = filterManager(LifecycleConfig.defaults(), new MutableClock(T0));
    m.process(event("a", 1, 1.0));
    m.process(event("b", 1, 1.0));
    KalmanState before = m.state("a").get();

    EventResult<String, KalmanOutput<String>> bad = m.process(KeyedEvent.of("a", at(2), KalmanInput.measurement(1.0, 2.0)));
    assertEquals(EventResult.Status.FAILED, bad.status());
    assertEquals(ErrorKind.DIMENSION_MISMATCH, bad.error().kind());
    assertEquals("a", bad.error().stateKey());
    assertEquals(at(2), bad.error().eventTime());
    assertTrue(before == m.state("a").get());

    assertTrue(m.process(event("b", 2, 1.0)).isAccepted());
    assertEquals(2, m.state("b").get().stateIndex());

    // a key whose first event fails is not created
    assertEquals(EventResult.Status.FAILED, m.process(KeyedEvent.of("c", at(3), KalmanInput.measurement(1.0, 2.0))).status());
    assertFalse(m.keys().contains("c"));
  }

  @Test
  public void singularUpdatesAreAcceptedWithAWarning() {
    KeyedStateManager<String, KalmanInput, KalmanState, KalmanOutput<String>> m = new KeyedStateManager<>(
        new KalmanFilterEstimator<String>(KalmanConfig.builder(1, 1).build()), LifecycleConfig.defaults(), new MutableClock(T0));
    KalmanInput singular = KalmanInput.measurement(1.0)
        .withMeasurementModel(LinearAlgebra.parseMatrix("0"))
        .withMeasurementNoise(LinearAlgebra.parseMatrix("0"));
    EventResult<String, KalmanOutput<String>> r = m.process(KeyedEvent.of("a", at(1), singular));
    assertTrue(r.isAccepted());
    assertEquals(1, r.warnings().size());
    assertEquals(ErrorKind.SINGULAR_MATRIX, r.warnings().get(0).kind());
    assertEquals("a", r.warnings().get(0).stateKey());
  }

  @Test
  public void processTimeoutEvictsIdleKeysAndFlushesTheSmoother() {
    MutableClock clock = new MutableClock(T0);
    LifecycleConfig lifecycle = LifecycleConfig.builder()
        .timeoutMode(TimeoutMode.PROCESS).stateTimeoutDuration(Duration.ofSeconds(10)).build();
    KeyedStateManager<String, KalmanInput, SmootherState, KalmanOutput<String>> m =
        new KeyedStateManager<>(new KalmanSmootherEstimator<String>(filterConfig(3)), lifecycle, clock);

    for (int k=1; k<=4; k++) assertEquals(k > 3 ? 1 : 0, m.process(event("a", k, k)).outputs().size());
    clock.advance(Duration.ofSeconds(5));
    m.process(event("b", 1, 1.0));

    clock.advance(Duration.ofSeconds(6));
    List<KalmanOutput<String>> evicted = m.sweep();
    assertEquals(3, evicted.size());
    for (KalmanOutput<String> o: evicted) assertEquals("a", o.stateKey());
    assertFalse(m.keys().contains("a"));
    assertTrue(m.keys().contains("b"));

    clock.advance(Duration.ofSeconds(5));
    assertEquals(1, m.sweep().size());
    assertEquals(0, m.size());

    // a key that comes back starts afresh
    assertEquals(0, m.process(event("a", 100, 1.0)).outputs().size());
    assertEquals(1, m.state("a").get().filterState().stateIndex());
  }

  @Test
  public void eventTimeTimeoutUsesTheWatermark() {
    LifecycleConfig lifecycle = LifecycleConfig.builder()
        .watermarkDuration(Duration.ofSeconds(5))
        .timeoutMode(TimeoutMode.EVENT).stateTimeoutDuration(Duration.ofSeconds(30)).build();
    KeyedStateManager<String, KalmanInput, KalmanState, KalmanOutput<String>> m = filterManager(lifecycle, new MutableClock(T0));

    m.process(event("a", 0, 1.0));
    for (int k=0; k<=30; k++) m.process(event("b", k, 1.0));
    // watermark 25, a idle for 25 seconds of event time
    assertTrue(m.sweep().isEmpty());
    assertTrue(m.keys().contains("a"));

    m.process(event("b", 40, 1.0));
    // watermark 35
    m.sweep();
    assertFalse(m.keys().contains("a"));
    assertTrue(m.keys().contains("b"));
  }

  @Test
  public void noTimeoutModeNeverEvicts() {
    MutableClock clock = new MutableClock(T0);
    KeyedStateManager<String, KalmanInput, KalmanState, KalmanOutput<String>> m = filterManager(LifecycleConfig.defaults(), clock);
    m.process(event("a", 0, 1.0));
    clock.advance(Duration.ofDays(365));
    assertTrue(m.sweep().isEmpty());
    assertEquals(1, m.size());
  }

  @Test
  public void checkpointRoundTrip() {
    KeyedStateManager<String, KalmanInput, SmootherState, KalmanOutput<String>> original =
        new KeyedStateManager<>(new KalmanSmootherEstimator<String>(filterConfig(2)), LifecycleConfig.defaults(), new MutableClock(T0));
    for (int k=1; k<=5; k++) original.process(event("a", k, 0.3*k));

    byte[] bytes = original.snapshot("a").get();
    assertFalse(original.snapshot("missing").isPresent());

    KeyedStateManager<String, KalmanInput, SmootherState, KalmanOutput<String>> restored =
        new KeyedStateManager<>(new KalmanSmootherEstimator<String>(filterConfig(2)), LifecycleConfig.defaults(), new MutableClock(T0));
    restored.restore("a", bytes, SmootherState.class);

    for (int k=6; k<=8; k++) {
      KalmanOutput<String> x = original.process(event("a", k, 0.3*k)).outputs().get(0);
      KalmanOutput<String> y = restored.process(event("a", k, 0.3*k)).outputs().get(0);
      assertEquals(x.stateIndex(), y.stateIndex());
      assertArrayEquals(x.state().toArray(), y.state().toArray(), 0.0);
    }
    assertEquals(original.flushAll().size(), restored.flushAll().size());
  }

  @Test
  public void restoringAnOlderSnapshotResetsTheEventTimeHistory() {
    LifecycleConfig lifecycle = LifecycleConfig.builder().watermarkDuration(Duration.ofSeconds(5)).build();
    KeyedStateManager<String, KalmanInput, KalmanState, KalmanOutput<String>> m = filterManager(lifecycle, new MutableClock(T0));

    assertTrue(m.process(event("a", 1, 1.0)).isAccepted());
    byte[] early = m.snapshot("a").get();
    assertTrue(m.process(event("a", 100, 2.0)).isAccepted());
    assertEquals(EventResult.Status.LATE, m.process(event("a", 2, 1.0)).status());

    m.restore("a", early, KalmanState.class);
    assertEquals(1, m.state("a").get().stateIndex());

    EventResult<String, KalmanOutput<String>> r = m.process(event("a", 2, 1.5));
    assertTrue(r.isAccepted());
    assertEquals(2, r.outputs().get(0).stateIndex());
    assertEquals(1, m.lateEventCount());

    // the restored history is rebuilt from the events that follow
    assertEquals(EventResult.Status.LATE, m.process(event("a", -4, 1.0)).status());
  }

  @Test
  public void restoreWithdrawsAPendingCancellation() {
    MixtureConfig<Long, PoissonComponent> config = MixtureConfig.builder(
        MixtureModel.uniform(Arrays.asList(new PoissonComponent(1.0), new PoissonComponent(10.0))))
        .enableBatchTrain(true).build();
    KeyedStateManager<String, MixtureInput<Long, PoissonComponent>, MixtureState<Long, PoissonComponent>,
                      MixtureOutput<String, Long, PoissonComponent>> m =
        new KeyedStateManager<>(new MixtureEstimator<String, Long, PoissonComponent>(config), LifecycleConfig.defaults());
    for (long s: new long[] { 1, 12, 0, 9, 2, 11 }) m.process(KeyedEvent.of("k", MixtureInput.<Long, PoissonComponent>of(s)));

    MixtureState<Long, PoissonComponent> saved = m.state("k").get();
    m.cancel("k");
    m.restore("k", saved);

    List<MixtureOutput<String, Long, PoissonComponent>> out = m.flush("k");
    assertEquals(1, out.size());
    assertTrue(out.get(0).iterations() > 0);
  }

  @Test
  public void mixtureStateSurvivesACheckpoint() {
    MixtureConfig<Long, PoissonComponent> config = MixtureConfig.builder(
        MixtureModel.uniform(Arrays.asList(new PoissonComponent(1.0), new PoissonComponent(10.0)))).minibatchSize(3).build();
    KeyedStateManager<String, MixtureInput<Long, PoissonComponent>, MixtureState<Long, PoissonComponent>,
                      MixtureOutput<String, Long, PoissonComponent>> m =
        new KeyedStateManager<>(new MixtureEstimator<String, Long, PoissonComponent>(config), LifecycleConfig.defaults());
    for (long s: new long[] { 1, 12, 0, 9 }) m.process(KeyedEvent.of("k", MixtureInput.<Long, PoissonComponent>of(s)));

    byte[] bytes = m.snapshot("k").get();
    MixtureState<Long, PoissonComponent> live = m.state("k").get();
    MixtureState<?, ?> back = StateCodec.fromBytes(bytes, MixtureState.class);
    assertEquals(live.stateIndex(), back.stateIndex());
    assertEquals(live.pendingCount(), back.pendingCount());
    assertArrayEquals(live.model().parameterVector(), back.model().parameterVector(), 0.0);
  }

  @Test
  public void cancelledBatchTrainingStopsAtTheFlush() {
    MixtureConfig<Long, PoissonComponent> config = MixtureConfig.builder(
        MixtureModel.uniform(Arrays.asList(new PoissonComponent(1.0), new PoissonComponent(10.0))))
        .enableBatchTrain(true).build();
    KeyedStateManager<String, MixtureInput<Long, PoissonComponent>, MixtureState<Long, PoissonComponent>,
                      MixtureOutput<String, Long, PoissonComponent>> m =
        new KeyedStateManager<>(new MixtureEstimator<String, Long, PoissonComponent>(config), LifecycleConfig.defaults());
    for (long s: new long[] { 1, 12, 0, 9, 2, 11 }) {
      assertTrue(m.process(KeyedEvent.of("k", MixtureInput.<Long, PoissonComponent>of(s))).outputs().isEmpty());
      m.process(KeyedEvent.of("j", MixtureInput.<Long, PoissonComponent>of(s)));
    }
    m.cancel("k");
    m.cancel("missing");

    List<MixtureOutput<String, Long, PoissonComponent>> k = m.flush("k");
    assertEquals(1, k.size());
    assertEquals(0, k.get(0).iterations());
    assertFalse(k.get(0).converged());

    List<MixtureOutput<String, Long, PoissonComponent>> j = m.flush("j");
    assertEquals(1, j.size());
    assertTrue(j.get(0).iterations() > 0);
    assertEquals(0, m.size());
  }

  @Test
  public void parallelProcessingMatchesSequentialProcessing() throws InterruptedException {
    RandomGenerator random = new Well19937c(4001);
    List<KeyedEvent<String, KalmanInput>> events = new ArrayList<>();
    for (int k=0; k<200; k++) {
      String key = "key-" + (k % 8);
      events.add(event(key, k, k/8 + random.nextGaussian()));
    }

    KeyedStateManager<String, KalmanInput, KalmanState, KalmanOutput<String>> sequential = filterManager(LifecycleConfig.defaults(), new MutableClock(T0));
    for (KeyedEvent<String, KalmanInput> e: events) sequential.process(e);

    KeyedStateManager<String, KalmanInput, KalmanState, KalmanOutput<String>> parallel = filterManager(LifecycleConfig.defaults(), new MutableClock(T0));
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<EventResult<String, KalmanOutput<String>>> results = parallel.processAll(events, executor);
      assertEquals(events.size(), results.size());
      for (int i=0; i<events.size(); i++) {
        assertTrue(results.get(i).isAccepted());
        assertEquals(events.get(i).stateKey(), results.get(i).stateKey());
        assertEquals(events.get(i).eventTime(), results.get(i).eventTime());
      }
    } finally {
      executor.shutdown();
    }

    assertEquals(8, parallel.size());
    for (String key: sequential.keys()) {
      KalmanState a = sequential.state(key).get();
      KalmanState b = parallel.state(key).get();
      assertEquals(a.stateIndex(), b.stateIndex());
      assertArrayEquals(a.state().toArray(), b.state().toArray(), 0.0);
    }
  }

  @Test
  public void lifecycleFromOptions() {
    Properties p = new Properties();
    p.setProperty("watermarkDuration", "10 seconds");
    p.setProperty("timeoutMode", "event");
    p.setProperty("stateTimeoutDuration", "PT1M");
    LifecycleConfig c = LifecycleConfig.fromProperties(p);
    assertEquals(Duration.ofSeconds(10), c.watermarkDuration());
    assertEquals(TimeoutMode.EVENT, c.timeoutMode());
    assertEquals(Duration.ofMinutes(1), c.stateTimeoutDuration());
  }

  @Test(expected = IllegalArgumentException.class)
  public void timeoutModeRequiresADuration() {
    LifecycleConfig.builder().timeoutMode(TimeoutMode.PROCESS).build();
  }
}
