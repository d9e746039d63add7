package sivantoledo.estimators;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Properties;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import sivantoledo.estimators.linalg.LinearAlgebra;

/**
 * Typed access to estimator options given as {@link Properties}.
 * 
 * Missing options return null (or the given default); malformed values
 * raise IllegalArgumentException naming the option.
 */
public final class Options {
  
  private final Properties properties;
  
  public Options(Properties properties) {
    this.properties = properties;
  }
  
  public boolean has(String name) {
    String v = properties.getProperty(name);
    return v != null && !v.trim().isEmpty();
  }
  
  public String getString(String name, String defaultValue) {
    return has(name) ? properties.getProperty(name).trim() : defaultValue;
  }

  public Integer getInt(String name) {
    if (!has(name)) return null;
    try {
      return Integer.valueOf(getString(name, null));
    } catch (NumberFormatException nfe) {
      throw new IllegalArgumentException("option "+name+" is not an integer: "+properties.getProperty(name), nfe);
    }
  }

  public Double getDouble(String name) {
    if (!has(name)) return null;
    try {
      return Double.valueOf(getString(name, null));
    } catch (NumberFormatException nfe) {
      throw new IllegalArgumentException("option "+name+" is not a number: "+properties.getProperty(name), nfe);
    }
  }

  public Boolean getBoolean(String name) {
    if (!has(name)) return null;
    return Boolean.valueOf(getString(name, null));
  }
  
  public RealVector getVector(String name) {
    if (!has(name)) return null;
    try {
      return LinearAlgebra.parseVector(getString(name, null));
    } catch (NumberFormatException nfe) {
      throw new IllegalArgumentException("option "+name+" is not a vector: "+properties.getProperty(name), nfe);
    }
  }

  public RealMatrix getMatrix(String name) {
    if (!has(name)) return null;
    try {
      return LinearAlgebra.parseMatrix(getString(name, null));
    } catch (RuntimeException re) {
      throw new IllegalArgumentException("option "+name+" is not a matrix: "+properties.getProperty(name), re);
    }
  }

  public Duration getDuration(String name) {
    if (!has(name)) return null;
    return parseDuration(name, getString(name, null));
  }
  
  /**
   * Parses either an ISO-8601 duration ("PT10S") or an amount followed by a 
   * unit ("10 seconds", "500 millis", "2 hours").
   */
  static Duration parseDuration(String name, String text) {
    if (text.startsWith("P") || text.startsWith("p")) {
      try {
        return Duration.parse(text);
      } catch (DateTimeParseException dtpe) {
        throw new IllegalArgumentException("option "+name+" is not a duration: "+text, dtpe);
      }
    }
    String[] parts = text.trim().split("\\s+");
    if (parts.length != 2) throw new IllegalArgumentException("option "+name+" is not a duration: "+text);
    long amount;
    try {
      amount = Long.parseLong(parts[0]);
    } catch (NumberFormatException nfe) {
      throw new IllegalArgumentException("option "+name+" is not a duration: "+text, nfe);
    }
    String unit = parts[1].toLowerCase(Locale.ROOT);
    if (unit.endsWith("s") && !unit.equals("ms")) unit = unit.substring(0, unit.length()-1);
    switch (unit) {
    case "ms":
    case "milli":
    case "millisecond":
      return Duration.of(amount, ChronoUnit.MILLIS);
    case "second":
    case "sec":
      return Duration.ofSeconds(amount);
    case "minute":
    case "min":
      return Duration.ofMinutes(amount);
    case "hour":
      return Duration.ofHours(amount);
    case "day":
      return Duration.ofDays(amount);
    default:
      throw new IllegalArgumentException("option "+name+" has an unknown time unit: "+text);
    }
  }
}
