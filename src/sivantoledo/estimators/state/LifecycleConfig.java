package sivantoledo.estimators.state;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.time.Duration;
import java.util.Properties;

import sivantoledo.estimators.Options;

/**
 * Watermark and timeout settings of a {@link KeyedStateManager}.
 */
public final class LifecycleConfig {
  
  private final Duration    watermarkDuration;    // null: no event is ever late
  private final TimeoutMode timeoutMode;
  private final Duration    stateTimeoutDuration; // null iff timeoutMode == NONE
  
  private LifecycleConfig(Builder b) {
    this.watermarkDuration    = b.watermarkDuration;
    this.timeoutMode          = b.timeoutMode;
    this.stateTimeoutDuration = b.stateTimeoutDuration;
  }
  
  public Duration    watermarkDuration()    { return watermarkDuration; }
  public TimeoutMode timeoutMode()          { return timeoutMode; }
  public Duration    stateTimeoutDuration() { return stateTimeoutDuration; }
  
  public static Builder builder() { return new Builder(); }
  
  public static LifecycleConfig defaults() { return builder().build(); }
  
  /**
   * Reads watermarkDuration, timeoutMode and stateTimeoutDuration.
   */
  public static LifecycleConfig fromProperties(Properties properties) {
    Options o = new Options(properties);
    Builder b = builder();
    if (o.has("watermarkDuration"))    b.watermarkDuration(o.getDuration("watermarkDuration"));
    if (o.has("timeoutMode"))          b.timeoutMode(TimeoutMode.parse(o.getString("timeoutMode", null)));
    if (o.has("stateTimeoutDuration")) b.stateTimeoutDuration(o.getDuration("stateTimeoutDuration"));
    return b.build();
  }
  
  public static final class Builder {
    private Duration    watermarkDuration    = null;
    private TimeoutMode timeoutMode          = TimeoutMode.NONE;
    private Duration    stateTimeoutDuration = null;
    
    private Builder() {}
    
    public Builder watermarkDuration(Duration d)    { this.watermarkDuration = d; return this; }
    public Builder timeoutMode(TimeoutMode m)       { this.timeoutMode = checkNotNull(m); return this; }
    public Builder stateTimeoutDuration(Duration d) { this.stateTimeoutDuration = d; return this; }
    
    public LifecycleConfig build() {
      checkArgument(watermarkDuration == null || !watermarkDuration.isNegative(), 
                    "watermarkDuration must not be negative: %s", watermarkDuration);
      if (timeoutMode != TimeoutMode.NONE) {
        checkArgument(stateTimeoutDuration != null, "timeout mode %s requires stateTimeoutDuration", timeoutMode);
        checkArgument(!stateTimeoutDuration.isNegative() && !stateTimeoutDuration.isZero(),
                      "stateTimeoutDuration must be positive: %s", stateTimeoutDuration);
      }
      return new LifecycleConfig(this);
    }
  }

  @Override
  public String toString() {
    return String.format("LifecycleConfig(watermark=%s, timeoutMode=%s, timeout=%s)", 
                         watermarkDuration, timeoutMode, stateTimeoutDuration);
  }
}
