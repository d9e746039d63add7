package sivantoledo.estimators.mixture;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Responsibility weighted statistics of one component: the total
 * responsibility and the responsibility weighted sum (or average) of T(s).
 * Immutable.
 */
public final class SufficientStatistics implements Serializable {

  private static final long serialVersionUID = 1L;

  private final double   weight;
  private final double[] moments;

  public SufficientStatistics(double weight, double[] moments) {
    this.weight  = weight;
    this.moments = moments.clone();
  }

  public static SufficientStatistics zero(int size) {
    return new SufficientStatistics(0.0, new double[size]);
  }

  public double   weight()  { return weight; }
  public double[] moments() { return moments.clone(); }

  /**
   * Adds r*T(s) to the moments and r to the weight.
   */
  public SufficientStatistics plus(double r, double[] statistic) {
    double[] m = moments.clone();
    for (int i=0; i<m.length; i++) m[i] += r*statistic[i];
    return new SufficientStatistics(weight + r, m);
  }

  public SufficientStatistics scaled(double a) {
    double[] m = moments.clone();
    for (int i=0; i<m.length; i++) m[i] *= a;
    return new SufficientStatistics(a*weight, m);
  }

  /**
   * The convex combination (1-eta)*this + eta*other.
   */
  public SufficientStatistics blend(SufficientStatistics other, double eta) {
    double[] m = moments.clone();
    for (int i=0; i<m.length; i++) m[i] = (1-eta)*m[i] + eta*other.moments[i];
    return new SufficientStatistics((1-eta)*weight + eta*other.weight, m);
  }

  /**
   * The moments divided by the weight, the argument of the M-step.
   */
  public double[] average() {
    double[] m = moments.clone();
    for (int i=0; i<m.length; i++) m[i] /= weight;
    return m;
  }

  @Override
  public String toString() {
    return String.format("SufficientStatistics(weight=%.4f, moments=%s)", weight, Arrays.toString(moments));
  }
}
