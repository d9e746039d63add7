package sivantoledo.estimators.kalman;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * One input of a Kalman filter: an optional measurement, an optional
 * control vector, and optional per-event replacements of the system matrices.
 * 
 * An input without a measurement only advances the state (predict step).
 * The initial state and covariance are read only from the first input of a
 * key, and replace the configured ones for that key.
 */
public final class KalmanInput {
  
  private RealVector measurement;       // z
  private RealVector control;           // u
  private RealMatrix processModel;      // F
  private RealMatrix processNoise;      // Q
  private RealMatrix measurementModel;  // H
  private RealMatrix measurementNoise;  // R
  private RealMatrix controlFunction;   // B
  private RealVector initialState;      // x0
  private RealMatrix initialCovariance; // P0

  private KalmanInput() {}
  
  public static KalmanInput measurement(RealVector z) {
    return new KalmanInput().withMeasurement(z);
  }

  public static KalmanInput measurement(double... z) {
    return measurement(new ArrayRealVector(z));
  }

  public static KalmanInput predictOnly() {
    return new KalmanInput();
  }
  
  /*
   * The with-methods return copies; inputs are shared between threads
   * when they are replayed.
   */
  
  public KalmanInput withMeasurement(RealVector z)      { KalmanInput c = copy(); c.measurement = z;      return c; }
  public KalmanInput withControl(RealVector u)          { KalmanInput c = copy(); c.control = u;          return c; }
  public KalmanInput withProcessModel(RealMatrix F)     { KalmanInput c = copy(); c.processModel = F;     return c; }
  public KalmanInput withProcessNoise(RealMatrix Q)     { KalmanInput c = copy(); c.processNoise = Q;     return c; }
  public KalmanInput withMeasurementModel(RealMatrix H) { KalmanInput c = copy(); c.measurementModel = H; return c; }
  public KalmanInput withMeasurementNoise(RealMatrix R) { KalmanInput c = copy(); c.measurementNoise = R; return c; }
  public KalmanInput withControlFunction(RealMatrix B)  { KalmanInput c = copy(); c.controlFunction = B;  return c; }
  public KalmanInput withInitialState(RealVector x0)    { KalmanInput c = copy(); c.initialState = x0;    return c; }
  public KalmanInput withInitialCovariance(RealMatrix P0) { KalmanInput c = copy(); c.initialCovariance = P0; return c; }

  private KalmanInput copy() {
    KalmanInput c = new KalmanInput();
    c.measurement      = measurement;
    c.control          = control;
    c.processModel     = processModel;
    c.processNoise     = processNoise;
    c.measurementModel = measurementModel;
    c.measurementNoise = measurementNoise;
    c.controlFunction  = controlFunction;
    c.initialState     = initialState;
    c.initialCovariance = initialCovariance;
    return c;
  }

  public RealVector measurement()      { return measurement; }
  public RealVector control()          { return control; }
  public RealMatrix processModel()     { return processModel; }
  public RealMatrix processNoise()     { return processNoise; }
  public RealMatrix measurementModel() { return measurementModel; }
  public RealMatrix measurementNoise() { return measurementNoise; }
  public RealMatrix controlFunction()  { return controlFunction; }
  public RealVector initialState()     { return initialState; }
  public RealMatrix initialCovariance() { return initialCovariance; }
  
  public boolean hasMeasurement() { return measurement != null; }
}
