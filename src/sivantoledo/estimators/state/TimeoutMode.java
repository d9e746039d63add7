package sivantoledo.estimators.state;

import java.util.Locale;

/**
 * How idle keys are detected.
 */
public enum TimeoutMode {
  NONE,    // keys are never evicted by the sweep
  PROCESS, // wall-clock time since the last event of the key
  EVENT;   // event time of the last event of the key, relative to the watermark
  
  public static TimeoutMode parse(String name) {
    return valueOf(name.trim().toUpperCase(Locale.ROOT));
  }
}
