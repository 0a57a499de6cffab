package com.gentoro.aasplan.graph;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.aasplan.TestGraphs;
import com.gentoro.aasplan.exception.LoadException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AasxPackageGraphLoaderTest {

  private static final String CONTENT_TYPES =
      "<Types xmlns=\"http://schemas.openxmlformats.org/package/2006/content-types\"/>";

  private static String rels(String type, String target) {
    return "<Relationships xmlns=\"http://schemas.openxmlformats.org/package/2006/relationships\">"
        + "<Relationship Type=\"http://admin-shell.io/aasx/relationships/"
        + type
        + "\" Target=\""
        + target
        + "\" Id=\"r1\"/></Relationships>";
  }

  private static Path writePackage(Path file, Map<String, byte[]> parts) throws Exception {
    try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(file))) {
      for (Map.Entry<String, byte[]> part : parts.entrySet()) {
        zip.putNextEntry(new ZipEntry(part.getKey()));
        zip.write(part.getValue());
        zip.closeEntry();
      }
    }
    return file;
  }

  private static byte[] utf8(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  @Test
  @DisplayName("the XML environment named by the package relationships is loaded")
  void readsXmlPartThroughRelationships(@TempDir Path dir) throws Exception {
    Map<String, byte[]> parts = new LinkedHashMap<>();
    parts.put("[Content_Types].xml", utf8(CONTENT_TYPES));
    parts.put("_rels/.rels", utf8(rels("aasx-origin", "/aasx/aasx-origin")));
    parts.put("aasx/aasx-origin", new byte[0]);
    parts.put("aasx/_rels/aasx-origin.rels", utf8(rels("aas-spec", "line/line.aas.xml")));
    parts.put("aasx/notes.xml", utf8("<notes/>"));
    parts.put(
        "aasx/line/line.aas.xml",
        Files.readAllBytes(TestGraphs.fixture(TestGraphs.CONVEYOR_LINE)));
    Path aasx = writePackage(dir.resolve("conveyor-line.aasx"), parts);

    ElementGraph graph = GraphLoaderFactory.forPath(aasx).load(aasx);

    assertEquals(2, graph.shells().size());
    assertEquals("LineSystem", graph.shells().get(0).idShort());
    assertTrue(graph.lookupById("urn:sm:conveyor:capabilities").isPresent());
    assertEquals("conveyor-line", graph.sourceStem());
  }

  @Test
  @DisplayName("without relationships the first JSON part is used")
  void fallsBackToJsonPart(@TempDir Path dir) throws Exception {
    Map<String, byte[]> parts = new LinkedHashMap<>();
    parts.put("[Content_Types].xml", utf8(CONTENT_TYPES));
    parts.put("aasx/env.json", Files.readAllBytes(TestGraphs.fixture(TestGraphs.ROBOT_CELL)));
    Path aasx = writePackage(dir.resolve("robot-cell.aasx"), parts);

    ElementGraph graph = new AasxPackageGraphLoader().load(aasx);

    assertEquals(2, graph.shells().size());
    assertEquals("robot-cell", graph.sourceStem());
  }

  @Test
  @DisplayName("without relationships an XML-only package falls back to its XML part")
  void fallsBackToXmlPart(@TempDir Path dir) throws Exception {
    Map<String, byte[]> parts = new LinkedHashMap<>();
    parts.put("[Content_Types].xml", utf8(CONTENT_TYPES));
    parts.put(
        "aasx/env.xml", Files.readAllBytes(TestGraphs.fixture(TestGraphs.CONVEYOR_LINE)));
    Path aasx = writePackage(dir.resolve("xml-only.aasx"), parts);

    ElementGraph graph = new AasxPackageGraphLoader().load(aasx);

    assertEquals("Conveyor", graph.shells().get(1).idShort());
  }

  @Test
  @DisplayName("packages without an environment part and missing files raise LoadException")
  void failures(@TempDir Path dir) throws Exception {
    Map<String, byte[]> parts = new LinkedHashMap<>();
    parts.put("[Content_Types].xml", utf8(CONTENT_TYPES));
    parts.put("_rels/.rels", utf8(rels("aasx-origin", "/aasx/aasx-origin")));
    parts.put("aasx/manual.pdf", new byte[] {1, 2, 3});
    Path aasx = writePackage(dir.resolve("empty.aasx"), parts);

    LoadException ex =
        assertThrows(LoadException.class, () -> new AasxPackageGraphLoader().load(aasx));
    assertTrue(ex.getMessage().contains("no JSON or XML environment part"));
    assertThrows(
        LoadException.class, () -> new AasxPackageGraphLoader().load(dir.resolve("none.aasx")));
  }
}
