package com.gentoro.aasplan.domain;

import com.gentoro.aasplan.access.PlanningConfig;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Final, immutable planning model handed to a domain writer or solver.
 *
 * <p>Tables keep build order: types are listed parents first, the other tables in declaration
 * order. Every fluent application not listed in {@link #initialValues()} is false initially.
 */
public final class DomainModel {
  private final PlanningConfig config;
  private final String universalRootType;
  private final Map<String, PlanningType> types;
  private final Map<String, Fluent> fluents;
  private final Map<String, Action> actions;
  private final Map<String, PlanningObject> objects;
  private final Set<Atom> initialValues;
  private final List<Atom> goals;

  DomainModel(
      PlanningConfig config,
      String universalRootType,
      Map<String, PlanningType> types,
      Map<String, Fluent> fluents,
      Map<String, Action> actions,
      Map<String, PlanningObject> objects,
      Set<Atom> initialValues,
      List<Atom> goals) {
    this.config = config;
    this.universalRootType = universalRootType;
    this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
    this.fluents = Collections.unmodifiableMap(new LinkedHashMap<>(fluents));
    this.actions = Collections.unmodifiableMap(new LinkedHashMap<>(actions));
    this.objects = Collections.unmodifiableMap(new LinkedHashMap<>(objects));
    this.initialValues = Collections.unmodifiableSet(new LinkedHashSet<>(initialValues));
    this.goals = List.copyOf(goals);
  }

  public PlanningConfig config() {
    return config;
  }

  public String domainName() {
    return config.domainName();
  }

  public String problemName() {
    return config.problemName();
  }

  public List<String> requirements() {
    return config.requirements();
  }

  /** Implicit root every type descends from; never listed in {@link #types()}. */
  public String universalRootType() {
    return universalRootType;
  }

  public Map<String, PlanningType> types() {
    return types;
  }

  public Optional<PlanningType> type(String name) {
    return Optional.ofNullable(types.get(name));
  }

  public Map<String, Fluent> fluents() {
    return fluents;
  }

  public Optional<Fluent> fluent(String name) {
    return Optional.ofNullable(fluents.get(name));
  }

  public Map<String, Action> actions() {
    return actions;
  }

  public Optional<Action> action(String name) {
    return Optional.ofNullable(actions.get(name));
  }

  public Map<String, PlanningObject> objects() {
    return objects;
  }

  public Optional<PlanningObject> object(String name) {
    return Optional.ofNullable(objects.get(name));
  }

  /** Grounded applications that are true in the initial state. */
  public Set<Atom> initialValues() {
    return initialValues;
  }

  /** Initial truth value of a grounded application. */
  public boolean initialValue(Atom atom) {
    return initialValues.contains(atom);
  }

  /** Conjunction of grounded applications required to be true. */
  public List<Atom> goals() {
    return goals;
  }

  @Override
  public String toString() {
    return "DomainModel{"
        + "domain="
        + domainName()
        + ", problem="
        + problemName()
        + ", types="
        + types.size()
        + ", fluents="
        + fluents.size()
        + ", actions="
        + actions.size()
        + ", objects="
        + objects.size()
        + ", init="
        + initialValues.size()
        + ", goals="
        + goals.size()
        + '}';
  }
}
