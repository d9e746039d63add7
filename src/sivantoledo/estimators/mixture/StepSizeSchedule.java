package sivantoledo.estimators.mixture;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.Serializable;

/**
 * The blend coefficient of online EM as a function of the number of
 * minibatches consumed so far, counting the current one (t = 1 for the first
 * update). Either a constant or (t+1)^-decayRate.
 */
public abstract class StepSizeSchedule implements Serializable {

  private static final long serialVersionUID = 1L;

  public abstract double stepSize(long t);

  public static StepSizeSchedule fixed(double stepSize) {
    checkArgument(stepSize > 0 && stepSize <= 1, "step size must be in (0,1], got %s", stepSize);
    return new Fixed(stepSize);
  }

  public static StepSizeSchedule decaying(double decayRate) {
    checkArgument(decayRate > 0 && decayRate <= 1, "decay rate must be in (0,1], got %s", decayRate);
    return new Decaying(decayRate);
  }

  private static final class Fixed extends StepSizeSchedule {
    private static final long serialVersionUID = 1L;
    private final double eta;
    Fixed(double eta) { this.eta = eta; }
    @Override public double stepSize(long t) { return eta; }
    @Override public String toString() { return "fixed("+eta+")"; }
  }

  private static final class Decaying extends StepSizeSchedule {
    private static final long serialVersionUID = 1L;
    private final double rate;
    Decaying(double rate) { this.rate = rate; }
    @Override public double stepSize(long t) { return Math.pow(t+1, -rate); }
    @Override public String toString() { return "decaying("+rate+")"; }
  }
}
