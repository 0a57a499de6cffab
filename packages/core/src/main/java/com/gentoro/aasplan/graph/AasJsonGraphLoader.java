package com.gentoro.aasplan.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.aasplan.exception.LoadException;
import com.gentoro.aasplan.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads an AAS v3 JSON environment into an {@link ElementGraph}.
 *
 * <p>Expected top-level shape:
 *
 * <pre>{@code
 * {
 *   "assetAdministrationShells": [
 *     { "id": "urn:shell:1", "idShort": "Robot", "submodels": [
 *         { "type": "ModelReference", "keys": [ { "type": "Submodel", "value": "urn:sm:1" } ] } ] }
 *   ],
 *   "submodels": [
 *     { "id": "urn:sm:1", "idShort": "TechnicalData", "submodelElements": [
 *         { "modelType": "Property", "idShort": "AASRole", "value": "component" } ] }
 *   ]
 * }
 * }</pre>
 *
 * <p>Only {@code Property}, {@code ReferenceElement}, {@code SubmodelElementCollection}, {@code
 * SubmodelElementList} and {@code Entity} elements are kept; any other element kind is skipped.
 */
public class AasJsonGraphLoader implements GraphLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.aasplan.logging.LoggingService.getLogger(AasJsonGraphLoader.class);

  @Override
  public ElementGraph load(Path source) {
    if (source == null || !Files.isRegularFile(source)) {
      throw new LoadException("Container file not found: " + source);
    }
    try (InputStream in = Files.newInputStream(source)) {
      return read(source, in);
    } catch (IOException e) {
      throw new LoadException("Failed to read container: " + source, e);
    }
  }

  /** Parse an environment document from a stream; {@code source} is only recorded. */
  public ElementGraph read(Path source, InputStream in) {
    JsonNode root;
    try {
      root = JacksonUtility.getJsonMapper().readTree(in);
    } catch (IOException e) {
      throw new LoadException("Malformed AAS environment in " + source, e);
    }
    if (root == null || !root.isObject()) {
      throw new LoadException("AAS environment must be a JSON object: " + source);
    }

    List<Shell> shells = new ArrayList<>();
    for (JsonNode shellNode : root.path("assetAdministrationShells")) {
      shells.add(readShell(shellNode));
    }
    List<Submodel> submodels = new ArrayList<>();
    for (JsonNode submodelNode : root.path("submodels")) {
      submodels.add(readSubmodel(submodelNode));
    }

    log.info(
        "Loaded element graph from {}: {} shell(s), {} submodel(s)",
        source,
        shells.size(),
        submodels.size());
    return new ElementGraph(source, shells, submodels);
  }

  private Shell readShell(JsonNode node) {
    String id = requiredText(node, "id", "shell");
    String idShort = node.path("idShort").asText(id);

    List<String> submodelIds = new ArrayList<>();
    for (JsonNode reference : node.path("submodels")) {
      String target = lastKeyValue(reference.path("keys"));
      if (target != null) {
        submodelIds.add(target);
      }
    }
    return new Shell(id, idShort, displayName(node.path("displayName")), submodelIds);
  }

  private Submodel readSubmodel(JsonNode node) {
    String id = requiredText(node, "id", "submodel");
    String idShort = node.path("idShort").asText(id);
    return new Submodel(id, idShort, readElements(node.path("submodelElements")));
  }

  private List<ElementNode> readElements(JsonNode array) {
    List<ElementNode> elements = new ArrayList<>();
    for (JsonNode element : array) {
      ElementNode parsed = readElement(element);
      if (parsed != null) {
        elements.add(parsed);
      }
    }
    return elements;
  }

  private ElementNode readElement(JsonNode node) {
    String modelType = modelType(node);
    // list entries carry no idShort in AAS v3
    String idShort = node.path("idShort").asText("");

    switch (modelType) {
      case "Property":
        JsonNode value = node.get("value");
        return new ElementNode.PropertyNode(
            idShort, value == null || value.isNull() ? null : value.asText());
      case "ReferenceElement":
        List<String> keys = new ArrayList<>();
        for (JsonNode key : node.path("value").path("keys")) {
          keys.add(key.path("value").asText());
        }
        return new ElementNode.ReferenceNode(idShort, keys);
      case "SubmodelElementCollection":
      case "SubmodelElementList":
        return new ElementNode.CollectionNode(idShort, readElements(node.path("value")));
      case "Entity":
        return new ElementNode.EntityNode(idShort, readElements(node.path("statements")));
      default:
        log.debug("Skipping unsupported element '{}' of type '{}'", idShort, modelType);
        return null;
    }
  }

  private static String modelType(JsonNode node) {
    JsonNode modelType = node.path("modelType");
    // AAS v2 serializations wrap the type name in an object
    if (modelType.isObject()) {
      return modelType.path("name").asText("");
    }
    return modelType.asText("");
  }

  private static String displayName(JsonNode names) {
    if (!names.isArray() || names.isEmpty()) {
      return null;
    }
    for (JsonNode name : names) {
      if ("en".equals(name.path("language").asText("").toLowerCase(Locale.ROOT))) {
        return name.path("text").asText(null);
      }
    }
    return names.get(0).path("text").asText(null);
  }

  private static String lastKeyValue(JsonNode keys) {
    String value = null;
    for (JsonNode key : keys) {
      value = key.path("value").asText(null);
    }
    return value;
  }

  private static String requiredText(JsonNode node, String field, String kind) {
    JsonNode value = node.get(field);
    if (value == null || !value.isTextual() || value.asText().isBlank()) {
      throw new LoadException("Every " + kind + " requires a textual '" + field + "'");
    }
    return value.asText();
  }
}
