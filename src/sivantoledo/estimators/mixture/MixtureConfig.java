package sivantoledo.estimators.mixture;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import sivantoledo.estimators.Options;
import sivantoledo.estimators.linalg.LinearAlgebra;

/**
 * Configuration of a keyed mixture estimator: the initial mixture and the
 * training settings.
 *
 * Without a decay rate the online step size is constant; with one, the step
 * size of the t-th minibatch is (t+1)^-decayRate. With batch training enabled
 * the step size is ignored, samples are kept per key and one EM fit runs when
 * the key is flushed.
 */
public final class MixtureConfig<S, C extends MixtureComponent<S, C>> {

  private final MixtureModel<S, C> initialModel;
  private final int                minibatchSize;
  private final double             stepSize;
  private final Double             decayRate;       // null: constant step size
  private final boolean            enableBatchTrain;
  private final int                batchTrainMaxIter;
  private final double             batchTrainTol;

  private MixtureConfig(Builder<S, C> b) {
    this.initialModel      = b.initialModel;
    this.minibatchSize     = b.minibatchSize;
    this.stepSize          = b.stepSize;
    this.decayRate         = b.decayRate;
    this.enableBatchTrain  = b.enableBatchTrain;
    this.batchTrainMaxIter = b.batchTrainMaxIter;
    this.batchTrainTol     = b.batchTrainTol;
  }

  public MixtureModel<S, C> initialModel()      { return initialModel; }
  public int                minibatchSize()     { return minibatchSize; }
  public double             stepSize()          { return stepSize; }
  public Double             decayRate()         { return decayRate; }
  public boolean            enableBatchTrain()  { return enableBatchTrain; }
  public int                batchTrainMaxIter() { return batchTrainMaxIter; }
  public double             batchTrainTol()     { return batchTrainTol; }

  public StepSizeSchedule schedule() {
    return decayRate != null ? StepSizeSchedule.decaying(decayRate) : StepSizeSchedule.fixed(stepSize);
  }

  public static <S, C extends MixtureComponent<S, C>> Builder<S, C> builder(MixtureModel<S, C> initialModel) {
    return new Builder<>(initialModel);
  }

  /**
   * A Gaussian mixture from options: initialMeans (required, one row per
   * component), initialCovariances (matrices separated by '|', identity by
   * default), initialWeights (uniform by default) and the training options.
   */
  public static MixtureConfig<RealVector, GaussianComponent> gaussian(Properties properties) {
    Options o = new Options(properties);
    RealMatrix means = o.getMatrix("initialMeans");
    checkArgument(means != null, "option initialMeans is required");
    int k = means.getRowDimension();
    int d = means.getColumnDimension();

    List<RealMatrix> covariances = new ArrayList<>();
    if (o.has("initialCovariances")) {
      for (String c: o.getString("initialCovariances", null).split("\\|")) covariances.add(LinearAlgebra.parseMatrix(c));
      checkArgument(covariances.size() == k, "initialCovariances has %s matrices for %s components", covariances.size(), k);
    } else {
      for (int i=0; i<k; i++) covariances.add(LinearAlgebra.identity(d));
    }

    List<GaussianComponent> components = new ArrayList<>();
    for (int i=0; i<k; i++) components.add(new GaussianComponent(means.getRowVector(i), covariances.get(i)));
    return fromProperties(o, model(o, components));
  }

  /**
   * A Poisson mixture from options: initialRates (required), initialWeights
   * and the training options.
   */
  public static MixtureConfig<Long, PoissonComponent> poisson(Properties properties) {
    Options o = new Options(properties);
    RealVector rates = o.getVector("initialRates");
    checkArgument(rates != null, "option initialRates is required");
    List<PoissonComponent> components = new ArrayList<>();
    for (double r: rates.toArray()) components.add(new PoissonComponent(r));
    return fromProperties(o, model(o, components));
  }

  /**
   * A Bernoulli mixture from options: initialProbabilities (required),
   * initialWeights and the training options.
   */
  public static MixtureConfig<Boolean, BernoulliComponent> bernoulli(Properties properties) {
    Options o = new Options(properties);
    RealVector probabilities = o.getVector("initialProbabilities");
    checkArgument(probabilities != null, "option initialProbabilities is required");
    List<BernoulliComponent> components = new ArrayList<>();
    for (double p: probabilities.toArray()) components.add(new BernoulliComponent(p));
    return fromProperties(o, model(o, components));
  }

  private static <S, C extends MixtureComponent<S, C>> MixtureModel<S, C> model(Options o, List<C> components) {
    if (!o.has("initialWeights")) return MixtureModel.uniform(components);
    return new MixtureModel<>(o.getVector("initialWeights").toArray(), components);
  }

  private static <S, C extends MixtureComponent<S, C>> MixtureConfig<S, C> fromProperties(Options o, MixtureModel<S, C> model) {
    Builder<S, C> b = builder(model);
    if (o.has("minibatchSize"))     b.minibatchSize(o.getInt("minibatchSize"));
    if (o.has("stepSize"))          b.stepSize(o.getDouble("stepSize"));
    if (o.has("decayRate"))         b.decayRate(o.getDouble("decayRate"));
    if (o.has("enableBatchTrain"))  b.enableBatchTrain(o.getBoolean("enableBatchTrain"));
    if (o.has("batchTrainMaxIter")) b.batchTrainMaxIter(o.getInt("batchTrainMaxIter"));
    if (o.has("batchTrainTol"))     b.batchTrainTol(o.getDouble("batchTrainTol"));
    return b.build();
  }

  public static final class Builder<S, C extends MixtureComponent<S, C>> {
    private final MixtureModel<S, C> initialModel;
    private int     minibatchSize     = 1;
    private double  stepSize          = 0.1;
    private Double  decayRate         = null;
    private boolean enableBatchTrain  = false;
    private int     batchTrainMaxIter = 30;
    private double  batchTrainTol     = 0.1;

    private Builder(MixtureModel<S, C> initialModel) {
      this.initialModel = checkNotNull(initialModel);
    }

    public Builder<S, C> minibatchSize(int n)         { minibatchSize = n; return this; }
    public Builder<S, C> stepSize(double eta)         { stepSize = eta; return this; }
    public Builder<S, C> decayRate(Double rate)       { decayRate = rate; return this; }
    public Builder<S, C> enableBatchTrain(boolean b)  { enableBatchTrain = b; return this; }
    public Builder<S, C> batchTrainMaxIter(int n)     { batchTrainMaxIter = n; return this; }
    public Builder<S, C> batchTrainTol(double tol)    { batchTrainTol = tol; return this; }

    public MixtureConfig<S, C> build() {
      checkArgument(minibatchSize > 0, "minibatchSize must be positive: %s", minibatchSize);
      checkArgument(stepSize > 0 && stepSize <= 1, "stepSize must be in (0,1]: %s", stepSize);
      checkArgument(decayRate == null || (decayRate > 0 && decayRate <= 1), "decayRate must be in (0,1]: %s", decayRate);
      checkArgument(batchTrainMaxIter > 0, "batchTrainMaxIter must be positive: %s", batchTrainMaxIter);
      checkArgument(batchTrainTol > 0, "batchTrainTol must be positive: %s", batchTrainTol);
      return new MixtureConfig<>(this);
    }
  }

  @Override
  public String toString() {
    return String.format("MixtureConfig(minibatch=%d, stepSize=%s, decayRate=%s, batch=%s, maxIter=%d, tol=%s, %s)",
                         minibatchSize, stepSize, decayRate, enableBatchTrain, batchTrainMaxIter, batchTrainTol, initialModel);
  }
}
