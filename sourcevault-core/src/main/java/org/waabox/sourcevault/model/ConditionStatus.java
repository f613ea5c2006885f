package org.waabox.sourcevault.model;

/**
 * The tri-state value of a {@link Condition}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ConditionStatus {
  TRUE,
  FALSE,
  UNKNOWN
}
