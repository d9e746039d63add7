package sivantoledo.estimators.mixture;

import java.io.Serializable;

/**
 * One distribution family of a mixture, described through its sufficient
 * statistic T(s). Implementations are immutable.
 *
 * EM works on expectations of T: the E-step accumulates responsibility
 * weighted values of T, and the M-step maps an average of T back to the
 * maximum likelihood parameters.
 *
 * @param <S> the sample type
 * @param <C> the implementing class
 */
public interface MixtureComponent<S, C extends MixtureComponent<S, C>> extends Serializable {

  /**
   * Checks that a sample belongs to the sample space of this family.
   *
   * @throws sivantoledo.estimators.EstimationException of kind DIMENSION_MISMATCH
   *         or INVALID_PARAMETER if it does not
   */
  void validate(S sample);

  /**
   * The log of the density (or probability mass) of a sample.
   *
   * @throws sivantoledo.estimators.EstimationException as {@link #validate} does
   */
  double logDensity(S sample);

  /**
   * The sufficient statistic T(s) of a sample.
   */
  double[] statistic(S sample);

  /**
   * The expectation of T under this component's own parameters. Used to seed
   * the running statistics of online EM.
   */
  double[] expectedStatistic();

  /**
   * The maximum likelihood component for an average of the statistic.
   *
   * @param average a responsibility weighted average of T
   * @return a new component
   * @throws sivantoledo.estimators.EstimationException of kind INVALID_PARAMETER
   *         if the average maps outside the parameter domain
   */
  C fromStatistic(double[] average);

  /**
   * The parameters, flattened. Used to measure convergence.
   */
  double[] parameters();
}
