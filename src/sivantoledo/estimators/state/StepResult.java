package sivantoledo.estimators.state;

import java.util.List;

import com.google.common.collect.ImmutableList;

import sivantoledo.estimators.EstimationException;

/**
 * The outcome of a successful estimator step: the new state, the records 
 * it emits (possibly none), and non-fatal problems that were recovered from.
 */
public final class StepResult<S, O> {
  
  private final S                          state;
  private final List<O>                    outputs;
  private final List<EstimationException>  warnings;
  
  public StepResult(S state, List<O> outputs, List<EstimationException> warnings) {
    this.state    = state;
    this.outputs  = ImmutableList.copyOf(outputs);
    this.warnings = ImmutableList.copyOf(warnings);
  }
  
  public static <S, O> StepResult<S, O> of(S state, List<O> outputs) {
    return new StepResult<>(state, outputs, ImmutableList.of());
  }

  public static <S, O> StepResult<S, O> silent(S state) {
    return new StepResult<>(state, ImmutableList.of(), ImmutableList.of());
  }

  public S                         state()    { return state; }
  public List<O>                   outputs()  { return outputs; }
  public List<EstimationException> warnings() { return warnings; }
}
