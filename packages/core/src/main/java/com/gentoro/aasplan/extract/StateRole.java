package com.gentoro.aasplan.extract;

import java.util.Optional;

/** Role of a state assertion, selected by its {@code expressionGoal} tag. */
public enum StateRole {
  INIT("ActualValue"),
  GOAL("Requirement");

  private final String tag;

  StateRole(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }

  public static Optional<StateRole> fromTag(String tag) {
    for (StateRole role : values()) {
      if (role.tag.equals(tag)) {
        return Optional.of(role);
      }
    }
    return Optional.empty();
  }
}
