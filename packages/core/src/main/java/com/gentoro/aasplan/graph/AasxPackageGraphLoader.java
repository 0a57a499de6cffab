package com.gentoro.aasplan.graph;

import com.gentoro.aasplan.exception.LoadException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Opens an AASX package (an OPC zip archive) and reads its AAS environment part.
 *
 * <p>The part is located through the package relationships: {@code _rels/.rels} points at the
 * {@code aasx-origin} part, whose own relationships point at the {@code aas-spec} part. Packages
 * without usable relationships fall back to the first JSON or XML part that is not package
 * plumbing. JSON parts go to {@link AasJsonGraphLoader}, XML parts to {@link AasXmlGraphLoader}.
 */
public class AasxPackageGraphLoader implements GraphLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.aasplan.logging.LoggingService.getLogger(AasxPackageGraphLoader.class);

  static final String PACKAGE_RELS = "_rels/.rels";
  static final String ORIGIN_RELATIONSHIP = "aasx-origin";
  static final String SPEC_RELATIONSHIP = "aas-spec";

  private final AasJsonGraphLoader jsonLoader;
  private final AasXmlGraphLoader xmlLoader;

  public AasxPackageGraphLoader() {
    this(new AasJsonGraphLoader(), new AasXmlGraphLoader());
  }

  public AasxPackageGraphLoader(AasJsonGraphLoader jsonLoader, AasXmlGraphLoader xmlLoader) {
    this.jsonLoader = jsonLoader;
    this.xmlLoader = xmlLoader;
  }

  @Override
  public ElementGraph load(Path source) {
    if (source == null || !Files.isRegularFile(source)) {
      throw new LoadException("AASX package not found: " + source);
    }
    Map<String, byte[]> parts = readParts(source);

    String part =
        specPartFromRelationships(parts)
            .or(() -> firstEnvironmentPart(parts))
            .orElseThrow(
                () ->
                    new LoadException(
                        "AASX package contains no JSON or XML environment part: " + source));
    log.debug("Reading AAS environment part {} from {}", part, source);

    InputStream in = new ByteArrayInputStream(parts.get(part));
    if (part.toLowerCase(Locale.ROOT).endsWith(".json")) {
      return jsonLoader.read(source, in);
    }
    return xmlLoader.read(source, in);
  }

  private static Map<String, byte[]> readParts(Path source) {
    Map<String, byte[]> parts = new LinkedHashMap<>();
    try (ZipInputStream zip = new ZipInputStream(Files.newInputStream(source))) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        if (!entry.isDirectory()) {
          parts.put(partName(entry.getName()), zip.readAllBytes());
        }
      }
    } catch (IOException e) {
      throw new LoadException("Failed to read AASX package: " + source, e);
    }
    return parts;
  }

  /** Follow {@code _rels/.rels} → origin → {@code aas-spec}; empty if any hop is missing. */
  private static Optional<String> specPartFromRelationships(Map<String, byte[]> parts) {
    Optional<String> origin = relationshipTarget(parts, PACKAGE_RELS, "", ORIGIN_RELATIONSHIP);
    if (origin.isEmpty()) {
      return Optional.empty();
    }
    String originPart = origin.get();
    int slash = originPart.lastIndexOf('/');
    String originDir = slash < 0 ? "" : originPart.substring(0, slash + 1);
    String originRels = originDir + "_rels/" + originPart.substring(slash + 1) + ".rels";
    return relationshipTarget(parts, originRels, originDir, SPEC_RELATIONSHIP)
        .filter(parts::containsKey);
  }

  private static Optional<String> relationshipTarget(
      Map<String, byte[]> parts, String relsPart, String baseDir, String typeSuffix) {
    byte[] content = parts.get(relsPart);
    if (content == null) {
      return Optional.empty();
    }
    NodeList relationships;
    try {
      DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
      f.setNamespaceAware(true);
      f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      relationships =
          f.newDocumentBuilder()
              .parse(new ByteArrayInputStream(content))
              .getElementsByTagNameNS("*", "Relationship");
    } catch (ParserConfigurationException | SAXException | IOException e) {
      log.warn("Ignoring unreadable relationship part {}: {}", relsPart, e.getMessage());
      return Optional.empty();
    }
    for (int i = 0; i < relationships.getLength(); i++) {
      Element relationship = (Element) relationships.item(i);
      if (relationship.getAttribute("Type").endsWith("/" + typeSuffix)) {
        return resolveTarget(baseDir, relationship.getAttribute("Target"));
      }
    }
    return Optional.empty();
  }

  private static Optional<String> resolveTarget(String baseDir, String target) {
    if (target == null || target.isBlank()) {
      return Optional.empty();
    }
    try {
      URI base = new URI(null, null, "/" + baseDir, null);
      URI resolved = base.resolve(new URI(null, null, target, null));
      return Optional.of(partName(resolved.getPath()));
    } catch (URISyntaxException e) {
      log.warn("Ignoring malformed relationship target '{}'", target);
      return Optional.empty();
    }
  }

  private static Optional<String> firstEnvironmentPart(Map<String, byte[]> parts) {
    return parts.keySet().stream().filter(AasxPackageGraphLoader::isEnvironmentPart).findFirst();
  }

  private static boolean isEnvironmentPart(String name) {
    String lower = name.toLowerCase(Locale.ROOT);
    if (lower.startsWith("[content_types]") || lower.endsWith(".rels")) {
      return false;
    }
    return lower.endsWith(".json") || lower.endsWith(".xml");
  }

  private static String partName(String name) {
    return name.startsWith("/") ? name.substring(1) : name;
  }
}
