package sivantoledo.estimators.kalman;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Locale;
import java.util.Properties;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import sivantoledo.estimators.Options;
import sivantoledo.estimators.linalg.CovarianceMatrix;
import sivantoledo.estimators.linalg.LinearAlgebra;

/**
 * Configuration of a linear Kalman filter or fixed-lag smoother.
 * 
 * The system is
 *   x_k = F*x_{k-1} + B*u_k + w_k,   w_k ~ N(0,Q)
 *   z_k = H*x_k + v_k,               v_k ~ N(0,R)
 * 
 * The matrices given here are defaults; every input may override them.
 * The configuration is validated when it is built, so that dimension errors
 * in the defaults surface before the first event.
 * 
 * @author Sivan Toledo
 */
public final class KalmanConfig {
  
  private final int                  stateSize;
  private final int                  measurementSize;
  private final RealVector           initialState;
  private final RealMatrix           initialCovariance;
  private final RealMatrix           processModel;       // F
  private final RealMatrix           processNoise;       // Q
  private final RealMatrix           measurementModel;   // H
  private final RealMatrix           measurementNoise;   // R
  private final RealMatrix           controlFunction;    // B, null means identity
  private final double               fadingFactor;
  private final SingularMatrixPolicy singularMatrixPolicy;
  private final int                  fixedLag;
  private final int                  slidingLikelihoodWindow;
  private final boolean              outputSystemMatrices;
  
  private KalmanConfig(Builder b) {
    stateSize               = b.stateSize;
    measurementSize         = b.measurementSize;
    initialState            = b.initialState      != null ? b.initialState      : LinearAlgebra.zeros(stateSize);
    initialCovariance       = b.initialCovariance != null ? b.initialCovariance : LinearAlgebra.identity(stateSize);
    processModel            = b.processModel      != null ? b.processModel      : LinearAlgebra.identity(stateSize);
    processNoise            = b.processNoise      != null ? b.processNoise      : LinearAlgebra.identity(stateSize);
    measurementModel        = b.measurementModel  != null ? b.measurementModel  : defaultMeasurementModel(measurementSize, stateSize);
    measurementNoise        = b.measurementNoise  != null ? b.measurementNoise  : LinearAlgebra.identity(measurementSize);
    controlFunction         = b.controlFunction;
    fadingFactor            = b.fadingFactor;
    singularMatrixPolicy    = b.singularMatrixPolicy;
    fixedLag                = b.fixedLag;
    slidingLikelihoodWindow = b.slidingLikelihoodWindow;
    outputSystemMatrices    = b.outputSystemMatrices;
  }
  
  /*
   * Maps the first state variable to every measurement.
   */
  private static RealMatrix defaultMeasurementModel(int measurementSize, int stateSize) {
    RealMatrix H = MatrixUtils.createRealMatrix(measurementSize, stateSize);
    for (int i=0; i<measurementSize; i++) H.setEntry(i, 0, 1.0);
    return H;
  }

  public int                  stateSize()               { return stateSize; }
  public int                  measurementSize()         { return measurementSize; }
  public RealVector           initialState()            { return initialState.copy(); }
  public RealMatrix           initialCovariance()       { return initialCovariance.copy(); }
  public RealMatrix           processModel()            { return processModel; }
  public RealMatrix           processNoise()            { return processNoise; }
  public RealMatrix           measurementModel()        { return measurementModel; }
  public RealMatrix           measurementNoise()        { return measurementNoise; }
  public RealMatrix           controlFunction()         { return controlFunction; }
  public double               fadingFactor()            { return fadingFactor; }
  public SingularMatrixPolicy singularMatrixPolicy()    { return singularMatrixPolicy; }
  public int                  fixedLag()                { return fixedLag; }
  public int                  slidingLikelihoodWindow() { return slidingLikelihoodWindow; }
  public boolean              outputSystemMatrices()    { return outputSystemMatrices; }
  
  public static Builder builder(int stateSize, int measurementSize) {
    return new Builder(stateSize, measurementSize);
  }
  
  /**
   * Reads a configuration from named options. Vectors are comma separated,
   * matrices are given row by row with rows separated by semicolons.
   * 
   * Recognized options: stateSize, measurementSize (both required), initialState,
   * initialCovariance, processModel, processNoise, measurementModel, 
   * measurementNoise, controlFunction, fadingFactor, singularMatrixPolicy,
   * fixedLag, slidingLikelihoodWindow, outputSystemMatrices.
   * 
   * @param properties the options
   * @return the validated configuration
   */
  public static KalmanConfig fromProperties(Properties properties) {
    Options o = new Options(properties);
    Integer n = o.getInt("stateSize");
    Integer m = o.getInt("measurementSize");
    checkArgument(n != null, "option stateSize is required");
    checkArgument(m != null, "option measurementSize is required");
    Builder b = builder(n, m);
    if (o.has("initialState"))            b.initialState(o.getVector("initialState"));
    if (o.has("initialCovariance"))       b.initialCovariance(o.getMatrix("initialCovariance"));
    if (o.has("processModel"))            b.processModel(o.getMatrix("processModel"));
    if (o.has("processNoise"))            b.processNoise(o.getMatrix("processNoise"));
    if (o.has("measurementModel"))        b.measurementModel(o.getMatrix("measurementModel"));
    if (o.has("measurementNoise"))        b.measurementNoise(o.getMatrix("measurementNoise"));
    if (o.has("controlFunction"))         b.controlFunction(o.getMatrix("controlFunction"));
    if (o.has("fadingFactor"))            b.fadingFactor(o.getDouble("fadingFactor"));
    if (o.has("fixedLag"))                b.fixedLag(o.getInt("fixedLag"));
    if (o.has("slidingLikelihoodWindow")) b.slidingLikelihoodWindow(o.getInt("slidingLikelihoodWindow"));
    if (o.has("outputSystemMatrices"))    b.outputSystemMatrices(o.getBoolean("outputSystemMatrices"));
    if (o.has("singularMatrixPolicy"))
      b.singularMatrixPolicy(SingularMatrixPolicy.valueOf(o.getString("singularMatrixPolicy", null).toUpperCase(Locale.ROOT)));
    return b.build();
  }
  
  public static final class Builder {
    private final int            stateSize;
    private final int            measurementSize;
    private RealVector           initialState;
    private RealMatrix           initialCovariance;
    private RealMatrix           processModel;
    private RealMatrix           processNoise;
    private RealMatrix           measurementModel;
    private RealMatrix           measurementNoise;
    private RealMatrix           controlFunction;
    private double               fadingFactor            = 1.0;
    private SingularMatrixPolicy singularMatrixPolicy    = SingularMatrixPolicy.SKIP;
    private int                  fixedLag                = 2;
    private int                  slidingLikelihoodWindow = 0;
    private boolean              outputSystemMatrices    = false;
    
    private Builder(int stateSize, int measurementSize) {
      checkArgument(stateSize > 0, "stateSize must be positive: %s", stateSize);
      checkArgument(measurementSize > 0, "measurementSize must be positive: %s", measurementSize);
      this.stateSize       = stateSize;
      this.measurementSize = measurementSize;
    }
    
    public Builder initialState(RealVector x)          { initialState = x; return this; }
    public Builder initialCovariance(RealMatrix P)     { initialCovariance = P; return this; }
    public Builder processModel(RealMatrix F)          { processModel = F; return this; }
    public Builder processNoise(RealMatrix Q)          { processNoise = Q; return this; }
    public Builder processNoise(CovarianceMatrix Q)    { processNoise = Q.get(); return this; }
    public Builder measurementModel(RealMatrix H)      { measurementModel = H; return this; }
    public Builder measurementNoise(RealMatrix R)      { measurementNoise = R; return this; }
    public Builder measurementNoise(CovarianceMatrix R){ measurementNoise = R.get(); return this; }
    public Builder controlFunction(RealMatrix B)       { controlFunction = B; return this; }
    public Builder fadingFactor(double f)              { fadingFactor = f; return this; }
    public Builder fixedLag(int lag)                   { fixedLag = lag; return this; }
    public Builder slidingLikelihoodWindow(int w)      { slidingLikelihoodWindow = w; return this; }
    public Builder outputSystemMatrices(boolean o)     { outputSystemMatrices = o; return this; }
    public Builder singularMatrixPolicy(SingularMatrixPolicy p) { singularMatrixPolicy = checkNotNull(p); return this; }
    
    public KalmanConfig build() {
      checkArgument(fadingFactor >= 1.0, "fadingFactor must be at least 1: %s", fadingFactor);
      checkArgument(fixedLag >= 0, "fixedLag must not be negative: %s", fixedLag);
      checkArgument(slidingLikelihoodWindow >= 0, "slidingLikelihoodWindow must not be negative: %s", slidingLikelihoodWindow);
      KalmanConfig c = new KalmanConfig(this);
      int n = c.stateSize, m = c.measurementSize;
      checkShape(c.initialState.getDimension(), 1, n, 1, "initialState");
      checkShape(c.initialCovariance, n, n, "initialCovariance");
      checkShape(c.processModel,      n, n, "processModel");
      checkShape(c.processNoise,      n, n, "processNoise");
      checkShape(c.measurementModel,  m, n, "measurementModel");
      checkShape(c.measurementNoise,  m, m, "measurementNoise");
      if (c.controlFunction != null) 
        checkArgument(c.controlFunction.getRowDimension() == n, "controlFunction must have %s rows", n);
      return c;
    }
    
    private static void checkShape(RealMatrix A, int rows, int columns, String label) {
      checkShape(A.getRowDimension(), A.getColumnDimension(), rows, columns, label);
    }

    private static void checkShape(int r, int c, int rows, int columns, String label) {
      checkArgument(r == rows && c == columns, "%s must be %s by %s, is %s by %s", label, rows, columns, r, c);
    }
  }
}
