package com.gentoro.aasplan.graph;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.aasplan.TestGraphs;
import com.gentoro.aasplan.exception.LoadException;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AasJsonGraphLoaderTest {

  private final AasJsonGraphLoader loader = new AasJsonGraphLoader();

  @Test
  @DisplayName("loads shells and submodels from the fixture environment")
  void loadsFixture() {
    ElementGraph graph = TestGraphs.robotCell();

    assertEquals(2, graph.shells().size());
    Shell system = graph.shells().get(0);
    assertEquals("CellSystem", system.idShort());
    assertEquals("Cell System", system.label());
    assertEquals(List.of("urn:sm:system:tech", "urn:sm:system:planning"), system.submodelIds());
    assertEquals("robot-cell", graph.sourceStem());

    Submodel types = graph.lookupById("urn:sm:robot:types").orElseThrow();
    ElementNode.EntityNode entry =
        types.element("EntryNode").flatMap(ElementNode::asEntity).orElseThrow();
    assertEquals(ElementKind.ENTITY, entry.kind());
    assertEquals(3, entry.statements().size());
  }

  @Test
  @DisplayName("unsupported element kinds are skipped")
  void skipsUnsupportedElements() {
    Submodel capabilities =
        TestGraphs.robotCell().lookupById("urn:sm:robot:capabilities").orElseThrow();

    assertEquals(1, capabilities.elements().size());
    assertTrue(capabilities.element("Manual").isEmpty());
  }

  @Test
  @DisplayName("reference elements keep their key values in order")
  void readsReferenceKeys() {
    Submodel capabilities =
        TestGraphs.robotCell().lookupById("urn:sm:robot:capabilities").orElseThrow();
    ElementNode.ReferenceNode ref =
        capabilities
            .element("MoveOperator")
            .flatMap(ElementNode::asCollection)
            .flatMap(op -> op.childCollection("hasInput"))
            .flatMap(in -> in.childCollection("RobotAtFrom"))
            .flatMap(c -> c.childCollection("InstanceDescription"))
            .flatMap(d -> d.child("predicateDefinitionRef"))
            .flatMap(ElementNode::asReferenceElement)
            .orElseThrow();

    assertEquals(List.of("urn:sm:robot:predicates", "AtPredicate"), ref.keyPath());
  }

  @Test
  @DisplayName("v2 style modelType objects and element lists are understood")
  void readsLegacyModelType() {
    String json =
        """
        {
          "assetAdministrationShells": [],
          "submodels": [
            { "id": "urn:sm:1", "idShort": "Data", "submodelElements": [
                { "modelType": { "name": "Property" }, "idShort": "a", "value": "1" },
                { "modelType": "SubmodelElementList", "idShort": "items", "value": [
                    { "modelType": "Property", "value": "x" } ] } ] }
          ]
        }
        """;
    ElementGraph graph =
        loader.read(
            Path.of("inline.json"),
            new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

    Submodel data = graph.lookupById("urn:sm:1").orElseThrow();
    assertEquals("1", data.propertyValue("a").orElseThrow());
    ElementNode.CollectionNode items =
        data.element("items").flatMap(ElementNode::asCollection).orElseThrow();
    assertEquals("x", items.children().get(0).asProperty().orElseThrow().value());
  }

  @Test
  @DisplayName("missing file, malformed JSON and missing ids raise LoadException")
  void failures(@TempDir Path dir) throws Exception {
    assertThrows(LoadException.class, () -> loader.load(dir.resolve("missing.json")));

    Path broken = dir.resolve("broken.json");
    Files.writeString(broken, "{ not json");
    assertThrows(LoadException.class, () -> loader.load(broken));

    Path noId = dir.resolve("noid.json");
    Files.writeString(noId, "{\"submodels\": [ { \"idShort\": \"x\" } ]}");
    LoadException ex = assertThrows(LoadException.class, () -> loader.load(noId));
    assertTrue(ex.getMessage().contains("'id'"));
  }
}
