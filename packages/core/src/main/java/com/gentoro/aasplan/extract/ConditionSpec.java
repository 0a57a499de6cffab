package com.gentoro.aasplan.extract;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A condition read from an {@code InstanceDescription}.
 *
 * @param predicate resolved predicate name
 * @param classification raw {@code expressionGoal} tag, may be null
 * @param interpretation raw {@code interpretationLogic} tag, may be null
 * @param parameterRefs action variables in reference declaration order
 */
public record ConditionSpec(
    String predicate, String classification, String interpretation, List<String> parameterRefs) {
  public static final String NEGATION_TAG = "NotEqual";

  public ConditionSpec {
    Objects.requireNonNull(predicate, "predicate");
    parameterRefs = parameterRefs == null ? List.of() : List.copyOf(parameterRefs);
  }

  /** False only when the interpretation tag is {@code NotEqual}. */
  public boolean polarity() {
    return !NEGATION_TAG.equals(interpretation);
  }

  public Optional<ConditionRole> role() {
    return ConditionRole.fromTag(classification);
  }
}
