package com.gentoro.aasplan;

import com.gentoro.aasplan.access.GraphAccessor;
import com.gentoro.aasplan.access.PlanningConfig;
import com.gentoro.aasplan.access.ReferenceResolver;
import com.gentoro.aasplan.domain.DomainModel;
import com.gentoro.aasplan.domain.DomainModelBuilder;
import com.gentoro.aasplan.exception.ConfigException;
import com.gentoro.aasplan.exception.StateException;
import com.gentoro.aasplan.extract.DomainExtractor;
import com.gentoro.aasplan.extract.ExtractedDomain;
import com.gentoro.aasplan.graph.ElementGraph;
import com.gentoro.aasplan.graph.GraphLoader;
import com.gentoro.aasplan.graph.GraphLoaderFactory;
import com.gentoro.aasplan.pddl.PddlWriter;
import com.gentoro.aasplan.utility.JacksonUtility;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

/**
 * Application context: owns startup parameters and configuration and runs the compile pipeline
 * load, classify, extract, build and (optionally) write PDDL.
 */
public class AasPlan {
  private static final org.slf4j.Logger log =
      com.gentoro.aasplan.logging.LoggingService.getLogger(AasPlan.class);

  public static final String DEFAULT_OUTPUT_DIR = "pddl/output";

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;

  public AasPlan(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.gentoro.aasplan.logging.LoggingService.applyConfiguration(configuration());
  }

  /** Compile the configured input container. */
  public DomainModel run() {
    Path input = inputLocation();
    return run(GraphLoaderFactory.forPath(input), input);
  }

  /** Compile {@code input} with the given loader; PDDL files are written when enabled. */
  public DomainModel run(GraphLoader loader, Path input) {
    log.info("Loading {}", input);
    DomainModel model = compile(loader.load(input));

    if (configuration().getBoolean("output.pddl.enabled", true)) {
      new PddlWriter().write(model, outputDir());
    } else {
      log.debug("PDDL output disabled");
    }
    return model;
  }

  /** Run accessor, extractor and builder over an already loaded graph. */
  public DomainModel compile(ElementGraph graph) {
    GraphAccessor accessor = new GraphAccessor(this, graph);
    PlanningConfig planningConfig = accessor.resolvePlanningConfig();
    log.info(
        "Compiling domain '{}' / problem '{}' with requirements {}",
        planningConfig.domainName(),
        planningConfig.problemName(),
        planningConfig.requirements());
    if (log.isDebugEnabled()) {
      log.debug("Planning configuration:\n{}", JacksonUtility.toJson(planningConfig));
    }

    ExtractedDomain extracted =
        new DomainExtractor(accessor, new ReferenceResolver(graph)).extractAll();
    DomainModel model = new DomainModelBuilder(this, planningConfig).buildAll(extracted);
    log.info("Compiled {}", model);
    return model;
  }

  Path inputLocation() {
    String location = startupParameters.getParameter("input", String.class);
    if (StringUtils.isBlank(location)) {
      location = configuration().getString("input.location", null);
    }
    if (StringUtils.isBlank(location)) {
      throw new ConfigException("No input container given, use --input or input.location");
    }
    return Path.of(location.trim());
  }

  Path outputDir() {
    String dir = startupParameters.getParameter("output", String.class);
    if (StringUtils.isBlank(dir)) {
      dir = configuration().getString("output.dir", DEFAULT_OUTPUT_DIR);
    }
    return Path.of(dir.trim());
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("AasPlan not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }
}
