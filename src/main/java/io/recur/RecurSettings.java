package io.recur;

import com.google.common.base.Preconditions;
import io.recur.zone.OverlapPolicy;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;

/**
 * Tunables shared by the engines.
 *
 * <p>Values are read from the optional classpath resource {@code recur.properties}; JVM system
 * properties with the same names take precedence.
 *
 * <ul>
 *   <li>{@code recur.overlap-policy}: {@code EARLIER} or {@code LATER}, which instant an
 *       ambiguous wall-clock time resolves to
 * </ul>
 *
 * @param overlapPolicy the fall-back overlap policy
 */
public record RecurSettings(OverlapPolicy overlapPolicy) {
  /** Name of the optional classpath resource holding overrides. */
  public static final String RESOURCE = "recur.properties";

  static final String OVERLAP_POLICY = "recur.overlap-policy";

  public RecurSettings {
    Preconditions.checkNotNull(overlapPolicy, "'overlapPolicy' must not be null");
  }

  /**
   * Returns the built-in settings.
   *
   * @return settings with the EARLIER overlap policy
   */
  public static RecurSettings defaults() {
    return new RecurSettings(OverlapPolicy.EARLIER);
  }

  /**
   * Loads settings from {@code recur.properties} and system properties.
   *
   * @return the effective settings
   * @throws IllegalArgumentException if a configured value is malformed
   */
  public static RecurSettings load() {
    Properties props = new Properties();
    try (InputStream in = RecurSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in != null) {
        props.load(in);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("cannot read " + RESOURCE, e);
    }
    return fromProperties(props, System.getProperties());
  }

  static RecurSettings fromProperties(Properties file, Properties overrides) {
    String policy = lookup(OVERLAP_POLICY, file, overrides);
    if (policy == null) {
      return defaults();
    }
    try {
      return new RecurSettings(OverlapPolicy.valueOf(policy.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          OVERLAP_POLICY + " must be EARLIER or LATER, found '" + policy + "'", e);
    }
  }

  private static String lookup(String key, Properties file, Properties overrides) {
    String value = overrides.getProperty(key);
    return value != null ? value : file.getProperty(key);
  }
}
