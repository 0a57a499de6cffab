package com.gentoro.aasplan.extract;

import java.util.Optional;

/** Role of an action condition, selected by its {@code expressionGoal} tag. */
public enum ConditionRole {
  PRECONDITION("Requirement"),
  EFFECT("Assurance");

  private final String tag;

  ConditionRole(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }

  /** Empty for tags that select no role; such conditions are dropped. */
  public static Optional<ConditionRole> fromTag(String tag) {
    for (ConditionRole role : values()) {
      if (role.tag.equals(tag)) {
        return Optional.of(role);
      }
    }
    return Optional.empty();
  }
}
