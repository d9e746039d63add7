package sivantoledo.estimators.mixture;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import sivantoledo.estimators.ErrorKind;
import sivantoledo.estimators.EstimationException;
import sivantoledo.estimators.linalg.LinearAlgebra;

/**
 * A finite mixture: mixing weights and one component per weight. Immutable.
 *
 * The constructor enforces the weight invariant: every weight in [0,1] and
 * the weights sum to 1, both within {@link #WEIGHT_TOLERANCE}.
 *
 * @param <S> the sample type
 * @param <C> the component type
 */
public final class MixtureModel<S, C extends MixtureComponent<S, C>> implements Serializable {

  private static final long serialVersionUID = 1L;

  private final static Logger log = LogManager.getLogger();

  public static final double WEIGHT_TOLERANCE = 1e-9;

  /**
   * The posterior over components of one sample.
   */
  public static final class Posterior {
    private final double[] responsibilities;
    private final double   logLikelihood;
    private final boolean  underflow;

    Posterior(double[] responsibilities, double logLikelihood, boolean underflow) {
      this.responsibilities = responsibilities;
      this.logLikelihood    = logLikelihood;
      this.underflow        = underflow;
    }

    public double[] responsibilities() { return responsibilities.clone(); }
    public double   logLikelihood()    { return logLikelihood; }

    /**
     * True if every component density underflowed and the responsibilities
     * were set to 1/K.
     */
    public boolean  underflow()        { return underflow; }
  }

  private final double[]     weights;
  private final ArrayList<C> components;

  public MixtureModel(double[] weights, List<C> components) {
    if (components.isEmpty())
      throw new EstimationException(ErrorKind.INVALID_PARAMETER, "a mixture needs at least one component");
    if (weights.length != components.size())
      throw new EstimationException(ErrorKind.DIMENSION_MISMATCH,
                                    String.format("%d weights for %d components", weights.length, components.size()));
    double sum = 0;
    for (double w: weights) {
      if (Double.isNaN(w) || w < -WEIGHT_TOLERANCE || w > 1+WEIGHT_TOLERANCE)
        throw new EstimationException(ErrorKind.INVALID_WEIGHT, "mixture weight outside [0,1]: "+Arrays.toString(weights));
      sum += w;
    }
    if (Math.abs(sum-1) > WEIGHT_TOLERANCE)
      throw new EstimationException(ErrorKind.INVALID_WEIGHT, "mixture weights sum to "+sum);
    this.weights    = weights.clone();
    this.components = new ArrayList<>(components);
  }

  /**
   * A mixture with equal weights.
   */
  public static <S, C extends MixtureComponent<S, C>> MixtureModel<S, C> uniform(List<C> components) {
    double[] w = new double[components.size()];
    Arrays.fill(w, 1.0/components.size());
    return new MixtureModel<>(w, components);
  }

  public int      size()          { return components.size(); }
  public double[] weights()       { return weights.clone(); }
  public double   weight(int i)   { return weights[i]; }
  public C        component(int i){ return components.get(i); }
  public List<C>  components()    { return Collections.unmodifiableList(components); }

  /**
   * Checks a sample against the component family, without evaluating it.
   */
  public void validate(S sample) {
    components.get(0).validate(sample);
  }

  /**
   * The E-step for one sample, r[i] = w[i]*p[i](s) / sum_j w[j]*p[j](s),
   * evaluated in the log domain. If every term underflows the
   * responsibilities are uniform.
   */
  public Posterior posterior(S sample) {
    int k = size();
    double[] logp = new double[k];
    double max = Double.NEGATIVE_INFINITY;
    for (int i=0; i<k; i++) {
      logp[i] = Math.log(weights[i]) + components.get(i).logDensity(sample);
      if (logp[i] > max) max = logp[i];
    }

    double[] r = new double[k];
    if (Double.isNaN(max) || Double.isInfinite(max)) {
      log.warn("all component densities underflow at sample {}, using uniform responsibilities", sample);
      Arrays.fill(r, 1.0/k);
      return new Posterior(r, Double.NEGATIVE_INFINITY, true);
    }

    double sum = 0;
    for (int i=0; i<k; i++) {
      r[i] = Double.isNaN(logp[i]) ? 0.0 : Math.exp(logp[i]-max);
      sum += r[i];
    }
    for (int i=0; i<k; i++) r[i] /= sum;
    return new Posterior(r, max + Math.log(sum), false);
  }

  public double logLikelihood(S sample) {
    return posterior(sample).logLikelihood();
  }

  /**
   * The weights followed by the parameters of every component.
   */
  public double[] parameterVector() {
    double[] v = weights.clone();
    for (C c: components) {
      double[] p = c.parameters();
      int n = v.length;
      v = Arrays.copyOf(v, n + p.length);
      System.arraycopy(p, 0, v, n, p.length);
    }
    return v;
  }

  /**
   * The largest absolute difference between the parameter vectors of two
   * mixtures with the same structure.
   */
  public double distance(MixtureModel<S, C> other) {
    double[] a = parameterVector();
    double[] b = other.parameterVector();
    if (a.length != b.length)
      throw new EstimationException(ErrorKind.DIMENSION_MISMATCH, "mixtures have different structures");
    double[] delta = new double[a.length];
    for (int i=0; i<a.length; i++) delta[i] = a[i]-b[i];
    return LinearAlgebra.normMax(delta);
  }

  @Override
  public String toString() {
    return String.format("MixtureModel(weights=%s, components=%s)", Arrays.toString(weights), components);
  }
}
