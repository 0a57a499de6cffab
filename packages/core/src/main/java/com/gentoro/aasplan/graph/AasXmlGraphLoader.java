package com.gentoro.aasplan.graph;

import com.gentoro.aasplan.exception.LoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Reads an AAS v3 XML environment into an {@link ElementGraph}.
 *
 * <p>Elements are matched by local name, so the document may use a default namespace or any
 * prefix. The kept element kinds are the same as for {@link AasJsonGraphLoader}: {@code property},
 * {@code referenceElement}, {@code submodelElementCollection}, {@code submodelElementList} and
 * {@code entity}.
 */
public class AasXmlGraphLoader implements GraphLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.aasplan.logging.LoggingService.getLogger(AasXmlGraphLoader.class);

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
    Element root;
    try {
      Document doc = newDocumentBuilder().parse(in);
      root = doc.getDocumentElement();
    } catch (SAXException | IOException e) {
      throw new LoadException("Malformed AAS environment in " + source, e);
    }
    if (root == null || !"environment".equals(localName(root))) {
      throw new LoadException("AAS environment must have an <environment> root: " + source);
    }

    List<Shell> shells = new ArrayList<>();
    for (Element container : children(root, "assetAdministrationShells")) {
      for (Element shell : children(container, "assetAdministrationShell")) {
        shells.add(readShell(shell));
      }
    }
    List<Submodel> submodels = new ArrayList<>();
    for (Element container : children(root, "submodels")) {
      for (Element submodel : children(container, "submodel")) {
        submodels.add(readSubmodel(submodel));
      }
    }

    log.info(
        "Loaded element graph from {}: {} shell(s), {} submodel(s)",
        source,
        shells.size(),
        submodels.size());
    return new ElementGraph(source, shells, submodels);
  }

  private static DocumentBuilder newDocumentBuilder() {
    try {
      DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
      f.setNamespaceAware(true);
      f.setIgnoringComments(true);
      f.setCoalescing(true);
      f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      return f.newDocumentBuilder();
    } catch (ParserConfigurationException e) {
      throw new LoadException("XML parser unavailable", e);
    }
  }

  private Shell readShell(Element node) {
    String id = requiredText(node, "id", "shell");
    String idShort = textOr(node, "idShort", id);

    List<String> submodelIds = new ArrayList<>();
    for (Element container : children(node, "submodels")) {
      for (Element reference : children(container, "reference")) {
        String target = lastKeyValue(reference);
        if (target != null) {
          submodelIds.add(target);
        }
      }
    }
    return new Shell(id, idShort, displayName(node), submodelIds);
  }

  private Submodel readSubmodel(Element node) {
    String id = requiredText(node, "id", "submodel");
    String idShort = textOr(node, "idShort", id);
    return new Submodel(id, idShort, readElements(child(node, "submodelElements")));
  }

  private List<ElementNode> readElements(Element container) {
    List<ElementNode> elements = new ArrayList<>();
    if (container == null) {
      return elements;
    }
    for (Element element : children(container)) {
      ElementNode parsed = readElement(element);
      if (parsed != null) {
        elements.add(parsed);
      }
    }
    return elements;
  }

  private ElementNode readElement(Element node) {
    String kind = localName(node);
    // list entries carry no idShort in AAS v3
    String idShort = textOr(node, "idShort", "");

    switch (kind) {
      case "property":
        return new ElementNode.PropertyNode(idShort, text(node, "value"));
      case "referenceElement":
        Element value = child(node, "value");
        return new ElementNode.ReferenceNode(
            idShort, value == null ? List.of() : keyValues(value));
      case "submodelElementCollection":
      case "submodelElementList":
        return new ElementNode.CollectionNode(idShort, readElements(child(node, "value")));
      case "entity":
        return new ElementNode.EntityNode(idShort, readElements(child(node, "statements")));
      default:
        log.debug("Skipping unsupported element '{}' of type '{}'", idShort, kind);
        return null;
    }
  }

  private static String displayName(Element shell) {
    Element names = child(shell, "displayName");
    if (names == null) {
      return null;
    }
    List<Element> entries = children(names);
    if (entries.isEmpty()) {
      return null;
    }
    for (Element entry : entries) {
      String language = text(entry, "language");
      if (language != null && "en".equals(language.toLowerCase(Locale.ROOT))) {
        return text(entry, "text");
      }
    }
    return text(entries.get(0), "text");
  }

  private static List<String> keyValues(Element reference) {
    List<String> values = new ArrayList<>();
    for (Element keys : children(reference, "keys")) {
      for (Element key : children(keys, "key")) {
        String value = text(key, "value");
        values.add(value == null ? "" : value);
      }
    }
    return values;
  }

  private static String lastKeyValue(Element reference) {
    List<String> values = keyValues(reference);
    return values.isEmpty() ? null : values.get(values.size() - 1);
  }

  private static String requiredText(Element node, String field, String kind) {
    String value = text(node, field);
    if (value == null || value.isBlank()) {
      throw new LoadException("Every " + kind + " requires a textual '" + field + "'");
    }
    return value;
  }

  // ---------------------------------------------------------------------------------------------
  // DOM helpers
  // ---------------------------------------------------------------------------------------------

  private static String localName(Node node) {
    String local = node.getLocalName();
    return local != null ? local : node.getNodeName();
  }

  private static List<Element> children(Element parent) {
    List<Element> out = new ArrayList<>();
    NodeList nodes = parent.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      if (nodes.item(i) instanceof Element element) {
        out.add(element);
      }
    }
    return out;
  }

  private static List<Element> children(Element parent, String name) {
    List<Element> out = new ArrayList<>();
    for (Element element : children(parent)) {
      if (name.equals(localName(element))) {
        out.add(element);
      }
    }
    return out;
  }

  private static Element child(Element parent, String name) {
    for (Element element : children(parent)) {
      if (name.equals(localName(element))) {
        return element;
      }
    }
    return null;
  }

  private static String text(Element parent, String name) {
    Element element = child(parent, name);
    return element == null ? null : element.getTextContent().trim();
  }

  private static String textOr(Element parent, String name, String fallback) {
    String value = text(parent, name);
    return value == null || value.isEmpty() ? fallback : value;
  }
}
