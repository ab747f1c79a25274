package io.recur.model;

/** Classification of a span of time. Declaration order is overlay precedence, lowest first. */
public enum AvailabilityStatus {
  FREE,
  TENTATIVE,
  BUSY,
  OUT_OF_OFFICE
}
