package com.gentoro.aasplan.extract;

import com.gentoro.aasplan.access.GraphAccessor;
import com.gentoro.aasplan.access.ReferenceResolver;
import com.gentoro.aasplan.graph.ElementNode;
import com.gentoro.aasplan.graph.ElementNode.CollectionNode;
import com.gentoro.aasplan.graph.Submodel;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Walks the Component submodels and produces the intermediate planning records.
 *
 * <p>Submodels read, by idShort:
 *
 * <ul>
 *   <li>{@code TypeHierarchy}: entity tree below {@code EntryNode}
 *   <li>{@code PredicateDefinitions}: one collection per predicate
 *   <li>{@code Capabilities}: one collection per process operator (action)
 *   <li>{@code Instances}: one collection per object, optionally nesting {@code InitialStates} and
 *       {@code Goals}
 * </ul>
 *
 * <p>Extraction never mutates the graph and can be repeated; every call yields fresh, immutable
 * records.
 */
public class DomainExtractor {
  private static final org.slf4j.Logger log =
      com.gentoro.aasplan.logging.LoggingService.getLogger(DomainExtractor.class);

  static final String TYPE_HIERARCHY = "TypeHierarchy";
  static final String ENTRY_NODE = "EntryNode";
  static final String PREDICATE_DEFINITIONS = "PredicateDefinitions";
  static final String CAPABILITIES = "Capabilities";
  static final String INSTANCES = "Instances";

  private final GraphAccessor accessor;
  private final ReferenceResolver resolver;

  public DomainExtractor(GraphAccessor accessor) {
    this(accessor, new ReferenceResolver(accessor.graph()));
  }

  public DomainExtractor(GraphAccessor accessor, ReferenceResolver resolver) {
    this.accessor = accessor;
    this.resolver = resolver;
  }

  /** Run every extraction step in pipeline order. */
  public ExtractedDomain extractAll() {
    TypeHierarchy hierarchy = extractTypeHierarchy();
    List<PredicateSignature> predicates = extractPredicateDefinitions();
    List<ActionSpec> actions = extractProcessOperators();
    List<InstanceSpec> instances = extractInstances();
    StateAssertions states = extractInitialStatesAndGoals();
    return new ExtractedDomain(
        hierarchy, predicates, actions, instances, states.initialStates(), states.goals());
  }

  // ---------------------------------------------------------------------------------------------
  // Types
  // ---------------------------------------------------------------------------------------------

  /**
   * Every entity below {@code EntryNode} is a type whose parent is the enclosing entity; entities
   * directly below the entry node are roots.
   */
  public TypeHierarchy extractTypeHierarchy() {
    TypeHierarchy.Builder builder = TypeHierarchy.builder();
    for (Submodel submodel : accessor.findComponentSubmodels(TYPE_HIERARCHY)) {
      for (ElementNode element : submodel.elements()) {
        Optional<ElementNode.EntityNode> entry =
            element.asEntity().filter(e -> ENTRY_NODE.equals(e.idShort()));
        if (entry.isPresent()) {
          new TypeTreeWalker(builder, null).walk(entry.get().statements());
          break;
        }
      }
    }
    TypeHierarchy hierarchy = builder.build();

    log.info("Extracted {} type(s)", hierarchy.size());
    hierarchy
        .asMap()
        .forEach(
            (name, parent) ->
                log.debug("  {}", parent == null ? name + " (root)" : name + " -> " + parent));
    return hierarchy;
  }

  /** Depth-first walk that records entities as types and ignores every other element kind. */
  private static final class TypeTreeWalker implements ElementNode.Visitor<Void> {
    private final TypeHierarchy.Builder builder;
    private final String parent;

    TypeTreeWalker(TypeHierarchy.Builder builder, String parent) {
      this.builder = builder;
      this.parent = parent;
    }

    void walk(List<ElementNode> statements) {
      for (ElementNode statement : statements) {
        statement.accept(this);
      }
    }

    @Override
    public Void visitEntity(ElementNode.EntityNode entity) {
      builder.add(entity.idShort(), parent);
      new TypeTreeWalker(builder, entity.idShort()).walk(entity.statements());
      return null;
    }

    @Override
    public Void visitProperty(ElementNode.PropertyNode property) {
      return null;
    }

    @Override
    public Void visitReference(ElementNode.ReferenceNode reference) {
      return null;
    }

    @Override
    public Void visitCollection(ElementNode.CollectionNode collection) {
      return null;
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Predicates
  // ---------------------------------------------------------------------------------------------

  /** Predicates in discovery order; a name seen twice keeps its first declaration. */
  public List<PredicateSignature> extractPredicateDefinitions() {
    Map<String, PredicateSignature> predicates = new LinkedHashMap<>();
    for (Submodel submodel : accessor.findComponentSubmodels(PREDICATE_DEFINITIONS)) {
      for (CollectionNode definition : topLevelCollections(submodel)) {
        Optional<String> name = definition.propertyValue("predicateName");
        if (name.isEmpty()) {
          log.debug(
              "Skipping predicate collection '{}' without predicateName", definition.idShort());
          continue;
        }
        List<Parameter> parameters =
            definition.childCollection("parameters").map(this::readParameters).orElse(List.of());
        PredicateSignature signature = new PredicateSignature(name.get(), parameters);
        PredicateSignature existing = predicates.putIfAbsent(signature.name(), signature);
        if (existing != null) {
          log.warn(
              "Duplicate predicate '{}' in submodel '{}' ignored, keeping the first declaration",
              signature.name(),
              submodel.idShort());
        }
      }
    }

    List<PredicateSignature> result = List.copyOf(predicates.values());
    log.info("Extracted {} predicate(s)", result.size());
    for (PredicateSignature p : result) {
      log.debug("  {}{}", p.name(), formatParameters(p.parameters()));
    }
    return result;
  }

  // ---------------------------------------------------------------------------------------------
  // Actions
  // ---------------------------------------------------------------------------------------------

  /**
   * One action per process operator. Conditions come from {@code hasInput} and then {@code
   * hasOutput}; a {@code Requirement} tag makes a precondition, {@code Assurance} an effect, and
   * any other tag drops the condition.
   */
  public List<ActionSpec> extractProcessOperators() {
    List<ActionSpec> actions = new ArrayList<>();
    for (Submodel submodel : accessor.findComponentSubmodels(CAPABILITIES)) {
      for (CollectionNode operator : topLevelCollections(submodel)) {
        extractOperator(operator).ifPresent(actions::add);
      }
    }

    log.info("Extracted {} action(s)", actions.size());
    for (ActionSpec action : actions) {
      log.debug(
          "  {}{} ({} pre, {} eff)",
          action.name(),
          formatParameters(action.parameters()),
          action.preconditions().size(),
          action.effects().size());
    }
    return List.copyOf(actions);
  }

  private Optional<ActionSpec> extractOperator(CollectionNode operator) {
    Optional<String> name = operator.propertyValue("Name");
    if (name.isEmpty()) {
      log.warn("Skipping process operator '{}' without Name", operator.idShort());
      return Optional.empty();
    }

    List<Parameter> parameters =
        operator.childCollection("ProcessParameters").map(this::readParameters).orElse(List.of());

    List<CollectionNode> conditionNodes = new ArrayList<>();
    conditionNodes.addAll(childCollections(operator, "hasInput"));
    conditionNodes.addAll(childCollections(operator, "hasOutput"));

    List<ConditionSpec> preconditions = new ArrayList<>();
    List<ConditionSpec> effects = new ArrayList<>();
    for (CollectionNode node : conditionNodes) {
      Optional<ConditionSpec> condition = extractCondition(node);
      if (condition.isEmpty()) {
        continue;
      }
      ConditionSpec spec = condition.get();
      Optional<ConditionRole> role = spec.role();
      if (role.isEmpty()) {
        log.warn(
            "Condition '{}' of action '{}' has unrecognized expressionGoal '{}', dropped",
            node.idShort(),
            name.get(),
            spec.classification());
        continue;
      }
      switch (role.get()) {
        case PRECONDITION -> preconditions.add(spec);
        case EFFECT -> effects.add(spec);
      }
    }
    return Optional.of(new ActionSpec(name.get(), parameters, preconditions, effects));
  }

  /** Entries of every {@code container}-named child collection, in order. */
  private static List<CollectionNode> childCollections(CollectionNode operator, String container) {
    List<CollectionNode> result = new ArrayList<>();
    for (ElementNode child : operator.children()) {
      if (!container.equals(child.idShort())) {
        continue;
      }
      child
          .asCollection()
          .ifPresent(
              c -> c.children().forEach(entry -> entry.asCollection().ifPresent(result::add)));
    }
    return result;
  }

  /**
   * Read the {@code InstanceDescription} of a condition. Parameter references keep their
   * declaration order, which must match the predicate's parameter order.
   *
   * @return empty when the description or its predicate reference is missing
   */
  public Optional<ConditionSpec> extractCondition(CollectionNode condition) {
    Optional<CollectionNode> description = condition.childCollection("InstanceDescription");
    if (description.isEmpty()) {
      log.debug("Condition '{}' has no InstanceDescription", condition.idShort());
      return Optional.empty();
    }
    DescriptionReader reader = new DescriptionReader();
    for (ElementNode element : description.get().children()) {
      element.accept(reader);
    }
    if (reader.predicate == null) {
      log.debug("Condition '{}' has no predicateDefinitionRef", condition.idShort());
      return Optional.empty();
    }
    return Optional.of(
        new ConditionSpec(
            reader.predicate, reader.classification, reader.interpretation, reader.parameterRefs));
  }

  /** Collects the fields of an {@code InstanceDescription}. */
  private final class DescriptionReader implements ElementNode.Visitor<Void> {
    String predicate;
    String classification;
    String interpretation;
    final List<String> parameterRefs = new ArrayList<>();

    @Override
    public Void visitReference(ElementNode.ReferenceNode reference) {
      if ("predicateDefinitionRef".equals(reference.idShort())) {
        predicate = resolver.resolvePredicateReference(reference);
      }
      return null;
    }

    @Override
    public Void visitProperty(ElementNode.PropertyNode property) {
      switch (property.idShort()) {
        case "expressionGoal" -> classification = property.value();
        case "interpretationLogic" -> interpretation = property.value();
        default -> {}
      }
      return null;
    }

    @Override
    public Void visitCollection(CollectionNode collection) {
      if ("parameterBindingRefs".equals(collection.idShort())) {
        for (ElementNode entry : collection.children()) {
          entry
              .asReferenceElement()
              .map(resolver::resolveParameterReference)
              .ifPresent(parameterRefs::add);
        }
      }
      return null;
    }

    @Override
    public Void visitEntity(ElementNode.EntityNode entity) {
      return null;
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Instances and states
  // ---------------------------------------------------------------------------------------------

  public List<InstanceSpec> extractInstances() {
    List<InstanceSpec> instances = new ArrayList<>();
    for (Submodel submodel : accessor.findComponentSubmodels(INSTANCES)) {
      for (CollectionNode instance : topLevelCollections(submodel)) {
        Optional<String> name = instance.propertyValue("instanceName");
        Optional<String> type = instance.propertyValue("instanceType");
        if (name.isPresent() && type.isPresent()) {
          instances.add(new InstanceSpec(name.get(), type.get()));
        }
      }
    }

    log.info("Extracted {} instance(s)", instances.size());
    instances.forEach(i -> log.debug("  {} : {}", i.name(), i.type()));
    return List.copyOf(instances);
  }

  /**
   * Read the {@code InitialStates} and {@code Goals} collections nested in each instance. An
   * {@code ActualValue} tag makes an initial fact, {@code Requirement} a goal. Entries without a
   * predicate reference or without any populated binding are dropped.
   */
  public StateAssertions extractInitialStatesAndGoals() {
    List<StateAssertion> initialStates = new ArrayList<>();
    List<StateAssertion> goals = new ArrayList<>();

    for (Submodel submodel : accessor.findComponentSubmodels(INSTANCES)) {
      for (CollectionNode instance : topLevelCollections(submodel)) {
        for (ElementNode child : instance.children()) {
          if (!"InitialStates".equals(child.idShort()) && !"Goals".equals(child.idShort())) {
            continue;
          }
          List<CollectionNode> entries =
              child.asCollection().map(this::collections).orElse(List.of());
          for (CollectionNode entry : entries) {
            extractState(entry)
                .ifPresent(
                    state -> {
                      switch (state.role()) {
                        case INIT -> initialStates.add(state);
                        case GOAL -> goals.add(state);
                      }
                    });
          }
        }
      }
    }

    log.info("Extracted {} initial state(s), {} goal(s)", initialStates.size(), goals.size());
    initialStates.forEach(s -> log.debug("  init {}{}", s.predicate(), s.bindings()));
    goals.forEach(g -> log.debug("  goal {}{}", g.predicate(), g.bindings()));
    if (goals.isEmpty()) {
      log.warn("No goals found");
    }
    return new StateAssertions(initialStates, goals);
  }

  private Optional<StateAssertion> extractState(CollectionNode entry) {
    String predicate = null;
    String classification = null;
    Map<String, String> bindings = new LinkedHashMap<>();

    for (ElementNode element : entry.children()) {
      switch (element.idShort()) {
        case "predicateDefinitionRef" -> {
          Optional<ElementNode.ReferenceNode> reference = element.asReferenceElement();
          if (reference.isPresent()) {
            predicate = resolver.resolvePredicateReference(reference.get());
          }
        }
        case "expressionGoal" ->
            classification = element.asProperty().map(ElementNode.PropertyNode::value).orElse(null);
        case "parameterBindings" -> {
          List<CollectionNode> entries =
              element.asCollection().map(this::collections).orElse(List.of());
          for (CollectionNode binding : entries) {
            Optional<String> parameter = binding.propertyValue("parameter");
            Optional<String> value = binding.propertyValue("value");
            if (parameter.isPresent() && value.isPresent()) {
              bindings.put(parameter.get(), value.get());
            }
          }
        }
        default -> {}
      }
    }

    if (predicate == null || bindings.isEmpty()) {
      log.debug("Dropping state '{}' without predicate or bindings", entry.idShort());
      return Optional.empty();
    }
    Optional<StateRole> role = StateRole.fromTag(classification);
    if (role.isEmpty()) {
      log.warn(
          "State '{}' for predicate '{}' has unrecognized expressionGoal '{}', dropped",
          entry.idShort(),
          predicate,
          classification);
      return Optional.empty();
    }
    return Optional.of(new StateAssertion(predicate, role.get(), bindings));
  }

  // ---------------------------------------------------------------------------------------------
  // Helpers
  // ---------------------------------------------------------------------------------------------

  /** Parameter entries of a {@code parameters}/{@code ProcessParameters} collection. */
  private List<Parameter> readParameters(CollectionNode container) {
    List<Parameter> parameters = new ArrayList<>();
    for (CollectionNode entry : collections(container)) {
      Optional<String> variable = entry.propertyValue("Property");
      Optional<String> type = entry.propertyValue("Type");
      if (variable.isPresent() && type.isPresent()) {
        parameters.add(new Parameter(variable.get(), type.get()));
      }
    }
    return parameters;
  }

  private List<CollectionNode> collections(CollectionNode container) {
    List<CollectionNode> result = new ArrayList<>();
    for (ElementNode child : container.children()) {
      child.asCollection().ifPresent(result::add);
    }
    return result;
  }

  private static List<CollectionNode> topLevelCollections(Submodel submodel) {
    List<CollectionNode> result = new ArrayList<>();
    for (ElementNode element : submodel.elements()) {
      element.asCollection().ifPresent(result::add);
    }
    return result;
  }

  private static String formatParameters(List<Parameter> parameters) {
    StringBuilder sb = new StringBuilder("(");
    for (int i = 0; i < parameters.size(); i++) {
      if (i > 0) sb.append(", ");
      sb.append(parameters.get(i).variable()).append(": ").append(parameters.get(i).type());
    }
    return sb.append(')').toString();
  }
}
