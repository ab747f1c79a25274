package io.recur.zone;

import com.google.common.base.Preconditions;
import io.recur.RecurException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.time.zone.ZoneRulesProvider;
import java.util.List;
import java.util.NavigableMap;
import java.util.Set;

/**
 * Converts between wall-clock date-times and instants using the IANA rule database.
 *
 * <h2>DST Handling</h2>
 *
 * <ol>
 *   <li><b>Gap (spring forward):</b> the wall-clock time does not exist (e.g. 02:30 on the
 *       spring-forward day in America/New_York). It resolves as if the clock had advanced by the
 *       gap, so 02:30 becomes 03:30 in the new offset. Never fails.
 *   <li><b>Overlap (fall back):</b> the wall-clock time occurs twice (e.g. 01:30 on the
 *       fall-back day). It resolves according to the {@link OverlapPolicy}, {@code EARLIER} by
 *       default.
 * </ol>
 *
 * <p>Instances are immutable and hold only the zone identifier set captured at construction,
 * together with the rule database version, so they can be shared freely across threads.
 */
public final class TimezoneResolver {
  private static final TimezoneResolver SYSTEM = new TimezoneResolver(OverlapPolicy.EARLIER);

  private final Set<String> zoneIds;
  private final String rulesVersion;
  private final OverlapPolicy overlapPolicy;

  /**
   * Creates a resolver over the JVM's zone rules.
   *
   * @param overlapPolicy how ambiguous local times resolve
   */
  public TimezoneResolver(OverlapPolicy overlapPolicy) {
    this.overlapPolicy =
        Preconditions.checkNotNull(overlapPolicy, "'overlapPolicy' must not be null");
    this.zoneIds = Set.copyOf(ZoneId.getAvailableZoneIds());
    this.rulesVersion = loadVersion();
  }

  /**
   * Returns the shared resolver using the EARLIER overlap policy.
   *
   * @return the process-wide resolver
   */
  public static TimezoneResolver system() {
    return SYSTEM;
  }

  /**
   * Returns whether the identifier names an IANA region zone. Offset ids such as {@code +05:00}
   * are not accepted.
   *
   * @param zoneId the identifier to check
   * @return true if the identifier is known
   */
  public boolean validateZone(String zoneId) {
    return zoneId != null && zoneIds.contains(zoneId);
  }

  /**
   * Resolves an identifier to a ZoneId, failing fast on unknown names.
   *
   * @param zoneId the IANA identifier
   * @return the zone
   * @throws RecurException with kind INVALID_TIMEZONE if the identifier is unknown
   */
  public ZoneId resolveZone(String zoneId) throws RecurException {
    if (!validateZone(zoneId)) {
      throw RecurException.invalidTimezone(zoneId);
    }
    return ZoneId.of(zoneId);
  }

  /**
   * Converts a wall-clock time in the named zone to an instant.
   *
   * @param local the wall-clock time
   * @param zoneId the IANA identifier
   * @return the resolved instant
   * @throws RecurException with kind INVALID_TIMEZONE if the identifier is unknown
   */
  public Instant toInstant(LocalDateTime local, String zoneId) throws RecurException {
    return toInstant(local, resolveZone(zoneId));
  }

  /**
   * Converts a wall-clock time in the zone to an instant, applying the gap and overlap policies.
   *
   * @param local the wall-clock time
   * @param zone the zone
   * @return the resolved instant
   */
  public Instant toInstant(LocalDateTime local, ZoneId zone) {
    ZoneRules rules = zone.getRules();
    List<ZoneOffset> offsets = rules.getValidOffsets(local);
    if (offsets.size() == 1) {
      return local.toInstant(offsets.get(0));
    }

    ZoneOffsetTransition transition = rules.getTransition(local);
    if (offsets.isEmpty()) {
      return local.plus(transition.getDuration()).toInstant(transition.getOffsetAfter());
    }
    ZoneOffset offset =
        overlapPolicy == OverlapPolicy.EARLIER
            ? transition.getOffsetBefore()
            : transition.getOffsetAfter();
    return local.toInstant(offset);
  }

  /**
   * Converts an instant to wall-clock time in the named zone.
   *
   * @param instant the instant
   * @param zoneId the IANA identifier
   * @return the wall-clock time
   * @throws RecurException with kind INVALID_TIMEZONE if the identifier is unknown
   */
  public LocalDateTime toLocal(Instant instant, String zoneId) throws RecurException {
    return toLocal(instant, resolveZone(zoneId));
  }

  /**
   * Converts an instant to wall-clock time in the zone.
   *
   * @param instant the instant
   * @param zone the zone
   * @return the wall-clock time
   */
  public LocalDateTime toLocal(Instant instant, ZoneId zone) {
    return LocalDateTime.ofInstant(instant, zone);
  }

  /**
   * Classifies a wall-clock time against the zone's transitions.
   *
   * @param local the wall-clock time
   * @param zone the zone
   * @return NORMAL, GAP or OVERLAP
   */
  public LocalTimeKind classify(LocalDateTime local, ZoneId zone) {
    int n = zone.getRules().getValidOffsets(local).size();
    if (n == 0) {
      return LocalTimeKind.GAP;
    }
    return n == 1 ? LocalTimeKind.NORMAL : LocalTimeKind.OVERLAP;
  }

  /**
   * Returns the overlap policy in effect.
   *
   * @return the overlap policy
   */
  public OverlapPolicy overlapPolicy() {
    return overlapPolicy;
  }

  /**
   * Returns the version of the loaded tz rule database, e.g. {@code 2024a}. Include it in any
   * cache key built from resolver output.
   *
   * @return the rule database version
   */
  public String rulesVersion() {
    return rulesVersion;
  }

  private static String loadVersion() {
    NavigableMap<String, ZoneRules> versions = ZoneRulesProvider.getVersions("UTC");
    return versions.isEmpty() ? "unknown" : versions.lastKey();
  }
}
