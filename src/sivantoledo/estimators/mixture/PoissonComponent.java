package sivantoledo.estimators.mixture;

import org.apache.commons.math3.special.Gamma;

import sivantoledo.estimators.ErrorKind;
import sivantoledo.estimators.EstimationException;

/**
 * A Poisson distribution over non-negative counts.
 */
public final class PoissonComponent implements MixtureComponent<Long, PoissonComponent> {

  private static final long serialVersionUID = 1L;

  static final double MIN_RATE = 1e-10;

  private final double rate;

  public PoissonComponent(double rate) {
    if (!(rate > 0) || Double.isInfinite(rate))
      throw new EstimationException(ErrorKind.INVALID_PARAMETER, "Poisson rate must be positive and finite, got "+rate);
    this.rate = rate;
  }

  public double rate() { return rate; }

  @Override
  public void validate(Long sample) {
    if (sample == null) throw new EstimationException(ErrorKind.INVALID_PARAMETER, "missing Poisson sample");
    if (sample < 0) throw new EstimationException(ErrorKind.INVALID_PARAMETER, "negative Poisson sample "+sample);
  }

  @Override
  public double logDensity(Long sample) {
    validate(sample);
    long k = sample;
    return k*Math.log(rate) - rate - Gamma.logGamma(k+1.0);
  }

  @Override
  public double[] statistic(Long sample) { return new double[] { sample }; }

  @Override
  public double[] expectedStatistic() { return new double[] { rate }; }

  @Override
  public PoissonComponent fromStatistic(double[] average) {
    double r = average[0];
    if (Double.isNaN(r) || r < 0)
      throw new EstimationException(ErrorKind.INVALID_PARAMETER, "updated Poisson rate is invalid: "+r);
    return new PoissonComponent(Math.max(r, MIN_RATE));
  }

  @Override
  public double[] parameters() { return new double[] { rate }; }

  @Override
  public String toString() { return String.format("Poisson(%.4f)", rate); }
}
