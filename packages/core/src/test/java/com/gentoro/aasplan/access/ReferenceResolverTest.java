package com.gentoro.aasplan.access;

import static com.gentoro.aasplan.TestGraphs.*;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.aasplan.exception.AasPlanErrorCode;
import com.gentoro.aasplan.exception.ReferenceException;
import com.gentoro.aasplan.graph.ElementGraph;
import com.gentoro.aasplan.graph.Submodel;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReferenceResolverTest {

  private ReferenceResolver resolver;

  @BeforeEach
  void setUp() {
    Submodel predicates =
        submodel(
            "urn:preds",
            "PredicateDefinitions",
            coll("AtPredicate", prop("predicateName", "at")),
            coll("Unnamed", prop("description", "no name")),
            prop("NotACollection", "x"));
    Submodel capabilities =
        submodel(
            "urn:caps",
            "Capabilities",
            coll(
                "Move",
                prop("Name", "move"),
                coll(
                    "ProcessParameters",
                    coll("R", prop("Property", "?r"), prop("Type", "Robot")))),
            coll("NoParams", prop("Name", "noop")));
    resolver =
        new ReferenceResolver(
            new ElementGraph(null, List.of(), List.of(predicates, capabilities)));
  }

  @Test
  @DisplayName("predicate reference resolves to predicateName")
  void resolvesPredicate() {
    assertEquals("at", resolver.resolvePredicateReference(ref("r", "urn:preds", "AtPredicate")));
    assertEquals(
        "at", resolver.resolvePredicateReference(ref("r", "urn:preds", "AtPredicate", "extra")));
  }

  @Test
  @DisplayName("parameter reference resolves to the variable of the Property child")
  void resolvesParameter() {
    assertEquals(
        "?r",
        resolver.resolveParameterReference(ref("p", "urn:caps", "Move", "ProcessParameters", "R")));
  }

  @Test
  @DisplayName("every broken predicate reference is a ReferenceException with its key path")
  void predicateFailures() {
    assertThrows(
        ReferenceException.class,
        () -> resolver.resolvePredicateReference(ref("r", "urn:preds")));
    assertThrows(
        ReferenceException.class,
        () -> resolver.resolvePredicateReference(ref("r", "urn:missing", "AtPredicate")));
    assertThrows(
        ReferenceException.class,
        () -> resolver.resolvePredicateReference(ref("r", "urn:preds", "Gone")));
    assertThrows(
        ReferenceException.class,
        () -> resolver.resolvePredicateReference(ref("r", "urn:preds", "NotACollection")));
    ReferenceException ex =
        assertThrows(
            ReferenceException.class,
            () -> resolver.resolvePredicateReference(ref("r", "urn:preds", "Unnamed")));

    assertEquals(AasPlanErrorCode.REFERENCE_ERROR, ex.getCode());
    assertEquals(List.of("urn:preds", "Unnamed"), ex.getContext().get("keyPath"));
  }

  @Test
  @DisplayName("every broken parameter reference is a ReferenceException")
  void parameterFailures() {
    assertThrows(
        ReferenceException.class,
        () ->
            resolver.resolveParameterReference(
                ref("p", "urn:caps", "Move", "ProcessParameters")));
    assertThrows(
        ReferenceException.class,
        () ->
            resolver.resolveParameterReference(
                ref("p", "urn:nope", "Move", "ProcessParameters", "R")));
    assertThrows(
        ReferenceException.class,
        () ->
            resolver.resolveParameterReference(
                ref("p", "urn:caps", "Fly", "ProcessParameters", "R")));
    assertThrows(
        ReferenceException.class,
        () ->
            resolver.resolveParameterReference(
                ref("p", "urn:caps", "NoParams", "ProcessParameters", "R")));
    assertThrows(
        ReferenceException.class,
        () ->
            resolver.resolveParameterReference(
                ref("p", "urn:caps", "Move", "ProcessParameters", "X")));
  }
}
