package sivantoledo.estimators.state;

import java.io.Serializable;
import java.time.Instant;
import java.util.function.BooleanSupplier;

/**
 * An estimator whose per-key state is owned by a {@link KeyedStateManager}.
 * 
 * Implementations hold configuration only. All mutable information lives in
 * the state objects, which are treated as immutable snapshots: step() returns
 * a new state and leaves its argument untouched, so a failed step leaves the 
 * key exactly as it was.
 * 
 * @param <K> key type
 * @param <I> input type
 * @param <S> per-key state type
 * @param <O> output record type
 */
public interface StatefulEstimator<K, I, S extends Serializable, O> {

  /**
   * Creates the state of a key that has not been seen before (or that 
   * was evicted). 
   * 
   * @param key the key
   * @param first the first input of the key, which may carry initial parameters
   * @return a fresh state
   */
  S initialState(K key, I first);
  
  /**
   * Applies one input to the state of a key.
   * 
   * @param key the key
   * @param state the current state
   * @param input the input
   * @param eventTime the event time of the input, may be null
   * @return the new state and the records to emit
   * @throws sivantoledo.estimators.EstimationException if the input cannot be applied
   */
  StepResult<S, O> step(K key, S state, I input, Instant eventTime);
  
  /**
   * Emits whatever the state still holds back, just before the key is 
   * removed (timeout eviction or end of stream).
   * 
   * @param key the key
   * @param state the final state of the key
   * @param cancelled polled between iterations of long computations
   * @return the final records
   */
  StepResult<S, O> flush(K key, S state, BooleanSupplier cancelled);
}
