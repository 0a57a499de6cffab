package com.gentoro.aasplan.domain;

import com.gentoro.aasplan.AasPlan;
import com.gentoro.aasplan.access.PlanningConfig;
import com.gentoro.aasplan.exception.ArityMismatchException;
import com.gentoro.aasplan.exception.DuplicateDeclarationException;
import com.gentoro.aasplan.exception.MissingBindingException;
import com.gentoro.aasplan.exception.TypeMismatchException;
import com.gentoro.aasplan.exception.UnboundVariableException;
import com.gentoro.aasplan.exception.UnknownObjectException;
import com.gentoro.aasplan.exception.UnknownPredicateException;
import com.gentoro.aasplan.exception.UnknownTypeException;
import com.gentoro.aasplan.extract.ActionSpec;
import com.gentoro.aasplan.extract.ConditionSpec;
import com.gentoro.aasplan.extract.ExtractedDomain;
import com.gentoro.aasplan.extract.InstanceSpec;
import com.gentoro.aasplan.extract.Parameter;
import com.gentoro.aasplan.extract.PredicateSignature;
import com.gentoro.aasplan.extract.StateAssertion;
import com.gentoro.aasplan.extract.TypeHierarchy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns extracted records into a {@link DomainModel}, enforcing referential integrity between
 * types, predicates, action parameters and objects.
 *
 * <p>Steps must run in order: types, predicates, actions, objects, initial state, goals. Each step
 * freezes its table; {@link #build()} snapshots the tables into the final model. Any integrity
 * violation aborts with the matching {@link com.gentoro.aasplan.exception.AasPlanException}.
 */
public class DomainModelBuilder {
  private static final org.slf4j.Logger log =
      com.gentoro.aasplan.logging.LoggingService.getLogger(DomainModelBuilder.class);

  public static final String DEFAULT_UNIVERSAL_ROOT = "object";

  private final PlanningConfig config;
  private final String universalRootType;

  private Map<String, PlanningType> types = Map.of();
  private Map<String, Fluent> fluents = Map.of();
  private Map<String, Action> actions = Map.of();
  private Map<String, PlanningObject> objects = Map.of();
  private Set<Atom> initialValues = Set.of();
  private List<Atom> goals = List.of();

  public DomainModelBuilder(PlanningConfig config) {
    this(config, DEFAULT_UNIVERSAL_ROOT);
  }

  public DomainModelBuilder(AasPlan aasPlan, PlanningConfig config) {
    this(
        config,
        aasPlan.configuration().getString("planning.universal-root-type", DEFAULT_UNIVERSAL_ROOT));
  }

  public DomainModelBuilder(PlanningConfig config, String universalRootType) {
    this.config = config;
    this.universalRootType = universalRootType;
  }

  /** Run every step on the extracted records and return the final model. */
  public DomainModel buildAll(ExtractedDomain domain) {
    buildTypes(domain.typeHierarchy());
    buildPredicates(domain.predicates());
    buildActions(domain.actions());
    buildObjects(domain.instances());
    buildInit(domain.initialStates());
    buildGoals(domain.goals());
    return build();
  }

  /**
   * Resolve the type forest by fixpoint iteration: a type is accepted once its parent is absent,
   * the universal root, or already accepted. Types whose parent chain never resolves (cycles,
   * unknown ancestors) are left out without failing.
   */
  public Map<String, PlanningType> buildTypes(TypeHierarchy hierarchy) {
    Map<String, PlanningType> resolved = new LinkedHashMap<>();
    boolean progress = true;
    while (progress) {
      progress = false;
      for (Map.Entry<String, String> entry : hierarchy.asMap().entrySet()) {
        String name = entry.getKey();
        if (name.equals(universalRootType) || resolved.containsKey(name)) {
          continue;
        }
        String parent = entry.getValue();
        if (parent == null || parent.equals(universalRootType)) {
          resolved.put(name, new PlanningType(name, null));
          progress = true;
        } else if (resolved.containsKey(parent)) {
          resolved.put(name, new PlanningType(name, parent));
          progress = true;
        }
      }
    }

    for (Map.Entry<String, String> entry : hierarchy.asMap().entrySet()) {
      String name = entry.getKey();
      if (!name.equals(universalRootType) && !resolved.containsKey(name)) {
        log.warn(
            "Type '{}' excluded: parent chain via '{}' does not reach a root",
            name,
            entry.getValue());
      }
    }

    this.types = Collections.unmodifiableMap(resolved);
    log.info("Built {} type(s)", types.size());
    for (PlanningType type : types.values()) {
      log.debug("  + {}", type.isRoot() ? type.name() : type.name() + " -> " + type.parent());
    }
    return types;
  }

  /** Declare one fluent per signature; every parameter type must exist. */
  public Map<String, Fluent> buildPredicates(List<PredicateSignature> signatures) {
    Map<String, Fluent> built = new LinkedHashMap<>();
    for (PredicateSignature signature : signatures) {
      if (built.containsKey(signature.name())) {
        log.warn("Predicate '{}' declared twice, keeping the first", signature.name());
        continue;
      }
      List<TypedParameter> parameters =
          typedParameters(signature.parameters(), "predicate", signature.name());
      built.put(signature.name(), new Fluent(signature.name(), parameters));
      log.debug("  + {}{}", signature.name(), parameters);
    }
    this.fluents = Collections.unmodifiableMap(built);
    log.info("Built {} fluent(s)", fluents.size());
    return fluents;
  }

  /**
   * Declare actions. Each condition must reference a declared predicate and bind only the action's
   * own parameters, positionally against the predicate's parameter order.
   */
  public Map<String, Action> buildActions(List<ActionSpec> specs) {
    Map<String, Action> built = new LinkedHashMap<>();
    for (ActionSpec spec : specs) {
      if (built.containsKey(spec.name())) {
        throw new DuplicateDeclarationException("action", spec.name());
      }
      List<TypedParameter> parameters = typedParameters(spec.parameters(), "action", spec.name());
      Map<String, String> parameterTypes = new HashMap<>();
      for (TypedParameter parameter : parameters) {
        parameterTypes.put(parameter.name(), parameter.type());
      }

      List<Literal> preconditions = new ArrayList<>();
      for (ConditionSpec condition : spec.preconditions()) {
        preconditions.add(bindCondition(condition, spec.name(), parameterTypes));
      }
      List<Literal> effects = new ArrayList<>();
      for (ConditionSpec condition : spec.effects()) {
        effects.add(bindCondition(condition, spec.name(), parameterTypes));
      }

      built.put(spec.name(), new Action(spec.name(), parameters, preconditions, effects));
      log.debug("  + {} ({} pre, {} eff)", spec.name(), preconditions.size(), effects.size());
    }
    this.actions = Collections.unmodifiableMap(built);
    log.info("Built {} action(s)", actions.size());
    return actions;
  }

  private Literal bindCondition(
      ConditionSpec condition, String action, Map<String, String> parameterTypes) {
    Fluent fluent = fluents.get(condition.predicate());
    if (fluent == null) {
      throw new UnknownPredicateException(condition.predicate(), "action", action);
    }
    for (String variable : condition.parameterRefs()) {
      if (!parameterTypes.containsKey(variable)) {
        throw new UnboundVariableException(variable, condition.predicate(), action);
      }
    }
    if (condition.parameterRefs().size() != fluent.arity()) {
      throw new ArityMismatchException(
          fluent.name(), fluent.arity(), condition.parameterRefs().size(), action);
    }
    for (int i = 0; i < fluent.arity(); i++) {
      String variable = condition.parameterRefs().get(i);
      requireAssignable(
          variable, parameterTypes.get(variable), fluent.parameters().get(i).type(), fluent.name());
    }
    return new Literal(new Atom(fluent.name(), condition.parameterRefs()), condition.polarity());
  }

  /** Declare objects; every object type must exist and names must be unique. */
  public Map<String, PlanningObject> buildObjects(List<InstanceSpec> instances) {
    Map<String, PlanningObject> built = new LinkedHashMap<>();
    for (InstanceSpec instance : instances) {
      if (!isKnownType(instance.type())) {
        throw new UnknownTypeException(instance.type(), "object", instance.name());
      }
      if (built.containsKey(instance.name())) {
        throw new DuplicateDeclarationException("object", instance.name());
      }
      built.put(instance.name(), new PlanningObject(instance.name(), instance.type()));
      log.debug("  + {} : {}", instance.name(), instance.type());
    }
    this.objects = Collections.unmodifiableMap(built);
    log.info("Built {} object(s)", objects.size());
    return objects;
  }

  /** Ground initial facts; each is recorded as true. */
  public Set<Atom> buildInit(List<StateAssertion> assertions) {
    Set<Atom> built = new LinkedHashSet<>();
    for (StateAssertion assertion : assertions) {
      Atom atom = ground(assertion, "initial");
      built.add(atom);
      log.debug("  + init {}", atom);
    }
    this.initialValues = Collections.unmodifiableSet(built);
    log.info("Set {} initial value(s)", initialValues.size());
    return initialValues;
  }

  /** Ground goal conjuncts. */
  public List<Atom> buildGoals(List<StateAssertion> assertions) {
    Set<Atom> built = new LinkedHashSet<>();
    for (StateAssertion assertion : assertions) {
      Atom atom = ground(assertion, "goal");
      built.add(atom);
      log.debug("  + goal {}", atom);
    }
    this.goals = List.copyOf(built);
    log.info("Set {} goal(s)", goals.size());
    return goals;
  }

  /**
   * Reorder the assertion's bindings into the predicate's declared parameter order and resolve
   * every value to a declared object.
   */
  private Atom ground(StateAssertion assertion, String role) {
    Fluent fluent = fluents.get(assertion.predicate());
    if (fluent == null) {
      throw new UnknownPredicateException(assertion.predicate(), "state", role);
    }
    List<String> arguments = new ArrayList<>(fluent.arity());
    for (TypedParameter parameter : fluent.parameters()) {
      String value = assertion.bindings().get(parameter.name());
      if (value == null) {
        throw new MissingBindingException(parameter.name(), fluent.name(), role);
      }
      PlanningObject object = objects.get(value);
      if (object == null) {
        throw new UnknownObjectException(value, fluent.name());
      }
      requireAssignable(object.name(), object.type(), parameter.type(), fluent.name());
      arguments.add(object.name());
    }
    if (assertion.bindings().size() > fluent.arity()) {
      Set<String> extra = new HashSet<>(assertion.bindings().keySet());
      fluent.parameters().forEach(p -> extra.remove(p.name()));
      log.debug("Ignoring bindings {} not declared by predicate '{}'", extra, fluent.name());
    }
    return new Atom(fluent.name(), arguments);
  }

  /** Snapshot of the tables built so far. */
  public DomainModel build() {
    DomainModel model =
        new DomainModel(
            config, universalRootType, types, fluents, actions, objects, initialValues, goals);
    log.info("Domain model ready: {}", model);
    return model;
  }

  private List<TypedParameter> typedParameters(
      List<Parameter> parameters, String ownerKind, String ownerName) {
    List<TypedParameter> result = new ArrayList<>(parameters.size());
    for (Parameter parameter : parameters) {
      if (!isKnownType(parameter.type())) {
        throw new UnknownTypeException(parameter.type(), ownerKind, ownerName);
      }
      result.add(new TypedParameter(parameter.variable(), parameter.type()));
    }
    return result;
  }

  /** Only declared types count; the universal root is implicit and never a usable type name. */
  private boolean isKnownType(String type) {
    return types.containsKey(type);
  }

  /** {@code actual} must equal {@code expected} or descend from it. */
  private void requireAssignable(String argument, String actual, String expected, String fluent) {
    String current = actual;
    Set<String> seen = new HashSet<>();
    while (current != null && seen.add(current)) {
      if (current.equals(expected)) {
        return;
      }
      PlanningType type = types.get(current);
      current = type == null ? null : type.parent();
    }
    throw new TypeMismatchException(argument, actual, expected, fluent);
  }
}
