package com.gentoro.aasplan.access;

import com.gentoro.aasplan.AasPlan;
import com.gentoro.aasplan.exception.ConfigException;
import com.gentoro.aasplan.graph.ElementGraph;
import com.gentoro.aasplan.graph.ElementNode;
import com.gentoro.aasplan.graph.Shell;
import com.gentoro.aasplan.graph.Submodel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view over a loaded {@link ElementGraph}: classifies shells into System and Component
 * roles, resolves the global planning configuration and scopes submodel lookups to Component
 * shells.
 */
public class GraphAccessor {
  private static final org.slf4j.Logger log =
      com.gentoro.aasplan.logging.LoggingService.getLogger(GraphAccessor.class);

  public static final List<String> DEFAULT_REQUIREMENTS = List.of("strips", "typing");

  static final String TECHNICAL_DATA = "TechnicalData";
  static final String ROLE_PROPERTY = "AASRole";
  static final String PLANNING_CONFIGURATION = "PlanningConfiguration";
  static final String SOFTWARE_NAMEPLATE = "SoftwareNameplate";
  static final String SOFTWARE_NAMEPLATE_INSTANCE = "SoftwareNameplateInstance";
  static final String INSTANCE_NAME = "InstanceName";
  static final String DEFAULT_DOMAIN_NAME = "domain";

  private final ElementGraph graph;
  private final List<String> defaultRequirements;
  private final Map<Shell, AasRole> roles;
  private final List<Shell> componentShells;

  public GraphAccessor(ElementGraph graph) {
    this(graph, DEFAULT_REQUIREMENTS);
  }

  public GraphAccessor(AasPlan aasPlan, ElementGraph graph) {
    this(
        graph,
        aasPlan
            .configuration()
            .getList(String.class, "planning.default-requirements", DEFAULT_REQUIREMENTS));
  }

  public GraphAccessor(ElementGraph graph, List<String> defaultRequirements) {
    this.graph = graph;
    this.defaultRequirements = List.copyOf(defaultRequirements);

    Map<Shell, AasRole> classified = new LinkedHashMap<>();
    List<Shell> components = new ArrayList<>();
    for (Shell shell : graph.shells()) {
      AasRole role = classified.computeIfAbsent(shell, this::readRole);
      if (role == AasRole.COMPONENT) {
        components.add(shell);
      }
    }
    this.roles = Collections.unmodifiableMap(classified);
    this.componentShells = Collections.unmodifiableList(components);
    log.info(
        "Classified {} component shell(s) out of {}",
        componentShells.size(),
        graph.shells().size());
    componentShells.forEach(s -> log.debug("  component: {}", s.idShort()));
  }

  public ElementGraph graph() {
    return graph;
  }

  public List<Shell> componentShells() {
    return componentShells;
  }

  /** Role of every shell of the graph, in source order. */
  public Map<Shell, AasRole> roles() {
    return roles;
  }

  /**
   * Role declared by the shell's {@code TechnicalData/AASRole} property. Without a usable
   * declaration a shell whose name contains "System" is treated as System (with a warning), any
   * other shell as Component. Shells of the graph are classified once, at construction.
   */
  public AasRole classifyRole(Shell shell) {
    AasRole role = roles.get(shell);
    return role != null ? role : readRole(shell);
  }

  private AasRole readRole(Shell shell) {
    for (Submodel submodel : graph.submodelsOf(shell)) {
      if (!TECHNICAL_DATA.equals(submodel.idShort())) {
        continue;
      }
      Optional<String> declared = submodel.propertyValue(ROLE_PROPERTY);
      if (declared.isPresent()) {
        Optional<AasRole> role = AasRole.fromValue(declared.get());
        if (role.isPresent()) {
          return role.get();
        }
        log.warn(
            "Shell '{}' declares unknown {} '{}', using fallback",
            shell.idShort(),
            ROLE_PROPERTY,
            declared.get());
      }
    }

    if (shell.label().contains("System") || shell.idShort().contains("System")) {
      log.warn(
          "Shell '{}' has no {} property, using System fallback", shell.idShort(), ROLE_PROPERTY);
      return AasRole.SYSTEM;
    }
    return AasRole.COMPONENT;
  }

  /** Submodels with the given idShort, taken from Component shells only, in shell order. */
  public List<Submodel> findComponentSubmodels(String name) {
    List<Submodel> result = new ArrayList<>();
    for (Shell shell : componentShells) {
      for (Submodel submodel : graph.submodelsOf(shell)) {
        if (name.equals(submodel.idShort())) {
          result.add(submodel);
        }
      }
    }
    return result;
  }

  /**
   * Resolve domain name, problem name and requirement tags.
   *
   * <p>Sources, in order: the System shell's {@code PlanningConfiguration} submodel, its {@code
   * SoftwareNameplate/SoftwareNameplateInstance/InstanceName} property, and finally the file stem
   * of the loaded container.
   *
   * <p>A graph without a file name (built in memory) falls back to {@value #DEFAULT_DOMAIN_NAME}.
   *
   * @throws ConfigException if {@code PlanningConfiguration} exists but has no {@code domainName}
   */
  public PlanningConfig resolvePlanningConfig() {
    List<Shell> systemShells = new ArrayList<>();
    roles.forEach(
        (shell, role) -> {
          if (role == AasRole.SYSTEM) {
            systemShells.add(shell);
          }
        });

    if (systemShells.isEmpty()) {
      log.info("No System shell found, deriving planning names from the container name");
      return fromSourceStem();
    }
    Shell system = systemShells.get(0);
    if (systemShells.size() > 1) {
      log.warn(
          "Found {} System shells, using planning configuration of '{}'",
          systemShells.size(),
          system.idShort());
    }

    Optional<Submodel> planning = submodelOf(system, PLANNING_CONFIGURATION);
    if (planning.isPresent()) {
      return fromPlanningConfiguration(system, planning.get());
    }

    Optional<String> instanceName =
        submodelOf(system, SOFTWARE_NAMEPLATE)
            .flatMap(sm -> sm.element(SOFTWARE_NAMEPLATE_INSTANCE))
            .flatMap(ElementNode::asCollection)
            .flatMap(c -> c.propertyValue(INSTANCE_NAME));
    if (instanceName.isPresent()) {
      log.info(
          "Planning names taken from {}/{}/{}: {}",
          SOFTWARE_NAMEPLATE,
          SOFTWARE_NAMEPLATE_INSTANCE,
          INSTANCE_NAME,
          instanceName.get());
      return new PlanningConfig(instanceName.get(), instanceName.get(), defaultRequirements);
    }

    log.warn(
        "System shell '{}' has no {} submodel, deriving planning names from the container name",
        system.idShort(),
        PLANNING_CONFIGURATION);
    return fromSourceStem();
  }

  private PlanningConfig fromPlanningConfiguration(Shell system, Submodel planning) {
    log.info("Using {} of '{}'", PLANNING_CONFIGURATION, system.idShort());
    String domainName =
        planning
            .propertyValue("domainName")
            .orElseThrow(
                () ->
                    new ConfigException(
                        "domainName is missing in "
                            + PLANNING_CONFIGURATION
                            + " of shell '"
                            + system.idShort()
                            + "'"));

    String problemName = planning.propertyValue("problemName").orElse(null);
    if (problemName == null) {
      log.info("problemName is missing, using domain name '{}'", domainName);
      problemName = domainName;
    }

    List<String> requirements = defaultRequirements;
    Optional<ElementNode.CollectionNode> configured =
        planning.element("requirements").flatMap(ElementNode::asCollection);
    if (configured.isPresent()) {
      requirements = new ArrayList<>();
      for (ElementNode child : configured.get().children()) {
        Optional<ElementNode.PropertyNode> property = child.asProperty();
        if (property.isPresent() && property.get().hasValue()) {
          requirements.add(property.get().value().trim());
        }
      }
    }
    log.debug(
        "Planning configuration: domain={}, problem={}, requirements={}",
        domainName,
        problemName,
        requirements);
    return new PlanningConfig(domainName, problemName, requirements);
  }

  private PlanningConfig fromSourceStem() {
    String stem = graph.sourceStem();
    if (stem == null || stem.isBlank()) {
      log.warn(
          "No planning configuration and no container file name, using domain name '{}'",
          DEFAULT_DOMAIN_NAME);
      return new PlanningConfig(DEFAULT_DOMAIN_NAME, DEFAULT_DOMAIN_NAME, defaultRequirements);
    }
    log.info("Domain name derived from container name: {}", stem);
    return new PlanningConfig(stem, stem, defaultRequirements);
  }

  private Optional<Submodel> submodelOf(Shell shell, String idShort) {
    for (Submodel submodel : graph.submodelsOf(shell)) {
      if (idShort.equals(submodel.idShort())) {
        return Optional.of(submodel);
      }
    }
    return Optional.empty();
  }
}
