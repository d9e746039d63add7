package sivantoledo.estimators.mixture;

import sivantoledo.estimators.ErrorKind;
import sivantoledo.estimators.EstimationException;

/**
 * A Bernoulli distribution over booleans; the probability is that of true.
 */
public final class BernoulliComponent implements MixtureComponent<Boolean, BernoulliComponent> {

  private static final long serialVersionUID = 1L;

  // the M-step keeps p in [SLACK, 1-SLACK] so that neither outcome gets zero mass
  private static final double SLACK = 1e-9;

  private final double probability;

  public BernoulliComponent(double probability) {
    if (Double.isNaN(probability) || probability < 0 || probability > 1)
      throw new EstimationException(ErrorKind.INVALID_PARAMETER, "Bernoulli probability must be in [0,1], got "+probability);
    this.probability = probability;
  }

  public double probability() { return probability; }

  @Override
  public void validate(Boolean sample) {
    if (sample == null) throw new EstimationException(ErrorKind.INVALID_PARAMETER, "missing Bernoulli sample");
  }

  @Override
  public double logDensity(Boolean sample) {
    validate(sample);
    return Math.log(sample ? probability : 1-probability);
  }

  @Override
  public double[] statistic(Boolean sample) { return new double[] { sample ? 1.0 : 0.0 }; }

  @Override
  public double[] expectedStatistic() { return new double[] { probability }; }

  @Override
  public BernoulliComponent fromStatistic(double[] average) {
    double p = average[0];
    if (Double.isNaN(p) || p < -SLACK || p > 1+SLACK)
      throw new EstimationException(ErrorKind.INVALID_PARAMETER, "updated Bernoulli probability is invalid: "+p);
    return new BernoulliComponent(Math.min(1-SLACK, Math.max(SLACK, p)));
  }

  @Override
  public double[] parameters() { return new double[] { probability }; }

  @Override
  public String toString() { return String.format("Bernoulli(%.4f)", probability); }
}
