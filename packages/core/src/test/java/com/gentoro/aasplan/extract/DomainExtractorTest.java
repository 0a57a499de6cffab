package com.gentoro.aasplan.extract;

import static com.gentoro.aasplan.TestGraphs.*;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.aasplan.TestGraphs;
import com.gentoro.aasplan.access.GraphAccessor;
import com.gentoro.aasplan.exception.ReferenceException;
import com.gentoro.aasplan.graph.ElementGraph;
import com.gentoro.aasplan.graph.ElementNode;
import com.gentoro.aasplan.graph.Shell;
import com.gentoro.aasplan.graph.Submodel;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DomainExtractorTest {

  private DomainExtractor extractor;

  @BeforeEach
  void setUp() {
    extractor = new DomainExtractor(new GraphAccessor(TestGraphs.robotCell()));
  }

  private static DomainExtractor extractorFor(Submodel... submodels) {
    List<Submodel> all = new ArrayList<>(Arrays.asList(submodels));
    Shell component = shell("urn:c", "Component", submodels);
    return new DomainExtractor(new GraphAccessor(new ElementGraph(null, List.of(component), all)));
  }

  @Test
  @DisplayName("type hierarchy follows entity nesting below EntryNode")
  void extractsTypeHierarchy() {
    TypeHierarchy hierarchy = extractor.extractTypeHierarchy();

    assertEquals(List.of("Locatable", "Robot", "Location"), List.copyOf(hierarchy.typeNames()));
    assertTrue(hierarchy.parentOf("Locatable").isEmpty());
    assertEquals("Locatable", hierarchy.parentOf("Robot").orElseThrow());
    assertTrue(hierarchy.parentOf("Location").isEmpty());
  }

  @Test
  @DisplayName("predicates keep parameter order; duplicates keep the first declaration")
  void extractsPredicates() {
    List<PredicateSignature> predicates = extractor.extractPredicateDefinitions();

    assertEquals(2, predicates.size());
    PredicateSignature at = predicates.get(0);
    assertEquals("at", at.name());
    assertEquals(
        List.of(new Parameter("?r", "Robot"), new Parameter("?l", "Location")), at.parameters());

    DomainExtractor duplicates =
        extractorFor(
            submodel(
                "urn:p",
                "PredicateDefinitions",
                coll(
                    "A",
                    prop("predicateName", "p"),
                    coll("parameters", coll("x", prop("Property", "?x"), prop("Type", "T")))),
                coll("B", prop("predicateName", "p")),
                coll("C", prop("description", "nameless"))));
    List<PredicateSignature> deduplicated = duplicates.extractPredicateDefinitions();
    assertEquals(1, deduplicated.size());
    assertEquals(1, deduplicated.get(0).arity());
  }

  @Test
  @DisplayName("operator conditions split by tag; unknown tags are dropped")
  void extractsOperators() {
    List<ActionSpec> actions = extractor.extractProcessOperators();

    assertEquals(1, actions.size());
    ActionSpec move = actions.get(0);
    assertEquals("move", move.name());
    assertEquals(
        List.of(
            new Parameter("?r", "Robot"),
            new Parameter("?from", "Location"),
            new Parameter("?to", "Location")),
        move.parameters());

    assertEquals(3, move.preconditions().size());
    assertEquals(4, move.effects().size());

    ConditionSpec first = move.preconditions().get(0);
    assertEquals("at", first.predicate());
    assertEquals(List.of("?r", "?from"), first.parameterRefs());
    assertTrue(first.polarity());

    ConditionSpec negated = move.preconditions().get(2);
    assertEquals(List.of("?r", "?to"), negated.parameterRefs());
    assertFalse(negated.polarity());
    assertFalse(move.effects().get(1).polarity());
  }

  @Test
  @DisplayName("operators without Name are skipped; operators without conditions are kept")
  void operatorEdgeCases() {
    DomainExtractor edge =
        extractorFor(
            submodel(
                "urn:caps",
                "Capabilities",
                coll("Anonymous", prop("Description", "no name")),
                coll("Wait", prop("Name", "wait"))));

    List<ActionSpec> actions = edge.extractProcessOperators();

    assertEquals(1, actions.size());
    assertEquals("wait", actions.get(0).name());
    assertTrue(actions.get(0).parameters().isEmpty());
    assertTrue(actions.get(0).preconditions().isEmpty());
    assertTrue(actions.get(0).effects().isEmpty());
  }

  @Test
  @DisplayName("conditions without description or predicate reference yield nothing")
  void extractConditionEmpty() {
    assertTrue(extractor.extractCondition(coll("c")).isEmpty());
    assertTrue(
        extractor
            .extractCondition(
                coll("c", coll("InstanceDescription", prop("expressionGoal", "Requirement"))))
            .isEmpty());
  }

  @Test
  @DisplayName("broken references inside a condition propagate")
  void brokenConditionReference() {
    ElementNode.CollectionNode condition =
        coll("c", coll("InstanceDescription", ref("predicateDefinitionRef", "urn:none", "X")));

    assertThrows(ReferenceException.class, () -> extractor.extractCondition(condition));
  }

  @Test
  @DisplayName("instances need both name and type")
  void extractsInstances() {
    assertEquals(
        List.of(
            new InstanceSpec("r1", "Robot"),
            new InstanceSpec("dock", "Location"),
            new InstanceSpec("station", "Location")),
        extractor.extractInstances());

    DomainExtractor partial =
        extractorFor(submodel("urn:i", "Instances", coll("x", prop("instanceName", "x"))));
    assertTrue(partial.extractInstances().isEmpty());
  }

  @Test
  @DisplayName("initial states and goals are read from nested collections")
  void extractsStates() {
    StateAssertions states = extractor.extractInitialStatesAndGoals();

    assertEquals(2, states.initialStates().size());
    StateAssertion robotAtDock = states.initialStates().get(0);
    assertEquals("at", robotAtDock.predicate());
    assertEquals(StateRole.INIT, robotAtDock.role());
    assertEquals(Map.of("?l", "dock", "?r", "r1"), robotAtDock.bindings());

    assertEquals(1, states.goals().size());
    assertEquals(StateRole.GOAL, states.goals().get(0).role());
    assertEquals(Map.of("?r", "r1", "?l", "station"), states.goals().get(0).bindings());
  }

  @Test
  @DisplayName("states without bindings or with unknown tags are dropped; no goals is allowed")
  void dropsIncompleteStates() {
    Submodel predicates =
        submodel("urn:p", "PredicateDefinitions", coll("Flag", prop("predicateName", "flag")));
    Submodel instances =
        submodel(
            "urn:i",
            "Instances",
            coll(
                "x",
                prop("instanceName", "x"),
                prop("instanceType", "T"),
                coll(
                    "InitialStates",
                    coll(
                        "NoBindings",
                        ref("predicateDefinitionRef", "urn:p", "Flag"),
                        prop("expressionGoal", "ActualValue")),
                    coll(
                        "Unknown",
                        ref("predicateDefinitionRef", "urn:p", "Flag"),
                        prop("expressionGoal", "Maybe"),
                        coll(
                            "parameterBindings",
                            coll("b", prop("parameter", "?x"), prop("value", "x")))),
                    coll(
                        "NoPredicate",
                        prop("expressionGoal", "ActualValue"),
                        coll(
                            "parameterBindings",
                            coll("b", prop("parameter", "?x"), prop("value", "x")))))));

    StateAssertions states = extractorFor(predicates, instances).extractInitialStatesAndGoals();

    assertTrue(states.initialStates().isEmpty());
    assertTrue(states.goals().isEmpty());
  }

  @Test
  @DisplayName("extraction is repeatable and yields equal records")
  void idempotent() {
    ExtractedDomain first = extractor.extractAll();
    ExtractedDomain second = extractor.extractAll();
    ExtractedDomain fresh =
        new DomainExtractor(new GraphAccessor(TestGraphs.robotCell())).extractAll();

    assertEquals(first, second);
    assertEquals(first, fresh);
  }
}
