package com.gentoro.aasplan;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.aasplan.domain.Atom;
import com.gentoro.aasplan.domain.DomainModel;
import com.gentoro.aasplan.exception.ConfigException;
import com.gentoro.aasplan.exception.LoadException;
import com.gentoro.aasplan.exception.StateException;
import com.gentoro.aasplan.graph.GraphLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AasPlanTest {

  @Mock private GraphLoader loader;

  @Test
  @DisplayName("configuration is unavailable before initialize()")
  void requiresInitialization() {
    AasPlan app = new AasPlan(new String[0]);

    assertThrows(StateException.class, app::configuration);
  }

  @Test
  @DisplayName("compiles the robot cell into a complete domain model")
  void compilesFixture() {
    Path input = Path.of("cell.json");
    when(loader.load(input)).thenReturn(TestGraphs.robotCell());

    AasPlan app = new AasPlan(new String[0]);
    app.initialize();
    DomainModel model = app.run(loader, input);

    verify(loader).load(input);
    assertEquals("robot_domain", model.domainName());
    assertEquals("robot_problem", model.problemName());
    assertEquals(List.of("Locatable", "Robot", "Location"), List.copyOf(model.types().keySet()));
    assertEquals(Set.of("at", "free"), model.fluents().keySet());
    assertEquals(3, model.action("move").orElseThrow().preconditions().size());
    assertEquals(4, model.action("move").orElseThrow().effects().size());
    assertEquals(Set.of("r1", "dock", "station"), model.objects().keySet());
    assertEquals(
        Set.of(Atom.of("at", "r1", "dock"), Atom.of("free", "station")), model.initialValues());
    assertEquals(List.of(Atom.of("at", "r1", "station")), model.goals());
  }

  @Test
  @DisplayName("loader failures surface unchanged")
  void propagatesLoadFailure() {
    when(loader.load(any())).thenThrow(new LoadException("boom"));

    AasPlan app = new AasPlan(new String[0]);
    app.initialize();

    LoadException ex = assertThrows(LoadException.class, () -> app.run(loader, Path.of("x.json")));
    assertEquals("boom", ex.getMessage());
  }

  @Test
  @DisplayName("missing input location is a ConfigException")
  void missingInput() {
    AasPlan app = new AasPlan(new String[0]);
    app.initialize();

    assertThrows(ConfigException.class, app::run);
  }

  @Test
  @DisplayName("end to end: reads the container and writes PDDL files")
  void endToEnd(@TempDir Path dir) throws Exception {
    Path config = dir.resolve("app.yaml");
    Files.writeString(
        config,
        """
        output:
          pddl:
            enabled: true
        logging:
          level:
            root: WARN
        """);
    Path out = dir.resolve("pddl");
    String input = TestGraphs.fixture(TestGraphs.ROBOT_CELL).toString();

    AasPlan app =
        new AasPlan(new String[] {"-c", config.toString(), "-i", input, "-o", out.toString()});
    app.initialize();
    DomainModel model = app.run();

    assertEquals("robot_domain", model.domainName());
    String domain = Files.readString(out.resolve("robot_domain_domain.pddl"));
    assertTrue(domain.contains(":negative-preconditions"));
    assertTrue(domain.contains("(:action move"));
    String problem = Files.readString(out.resolve("robot_domain_problem.pddl"));
    assertTrue(problem.contains("(define (problem robot_problem)"));
    assertTrue(problem.contains("(at r1 dock)"));
  }
}
