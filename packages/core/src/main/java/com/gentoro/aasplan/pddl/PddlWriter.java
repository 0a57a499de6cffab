package com.gentoro.aasplan.pddl;

import com.gentoro.aasplan.domain.Action;
import com.gentoro.aasplan.domain.Atom;
import com.gentoro.aasplan.domain.DomainModel;
import com.gentoro.aasplan.domain.Fluent;
import com.gentoro.aasplan.domain.Literal;
import com.gentoro.aasplan.domain.PlanningObject;
import com.gentoro.aasplan.domain.PlanningType;
import com.gentoro.aasplan.domain.TypedParameter;
import com.gentoro.aasplan.exception.AasPlanErrorCode;
import com.gentoro.aasplan.exception.AasPlanException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders a {@link DomainModel} as a PDDL domain and problem.
 *
 * <p>Variables are always printed with a leading {@code ?}. Negative preconditions add the {@code
 * :negative-preconditions} requirement when it is not configured already.
 */
public class PddlWriter {
  private static final org.slf4j.Logger log =
      com.gentoro.aasplan.logging.LoggingService.getLogger(PddlWriter.class);

  static final String NEGATIVE_PRECONDITIONS = ":negative-preconditions";

  /** Output files written by {@link #write(DomainModel, Path)}. */
  public record PddlFiles(Path domainFile, Path problemFile) {}

  public PddlFiles write(DomainModel model, Path outputDir) {
    Path domainFile = outputDir.resolve(model.domainName() + "_domain.pddl");
    Path problemFile = outputDir.resolve(model.domainName() + "_problem.pddl");
    try {
      Files.createDirectories(outputDir);
      Files.writeString(domainFile, writeDomain(model), StandardCharsets.UTF_8);
      Files.writeString(problemFile, writeProblem(model), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new AasPlanException(
          AasPlanErrorCode.IO_ERROR,
          "Failed to write PDDL files to " + outputDir,
          e,
          Map.of("outputDir", outputDir.toString()));
    }
    log.info("PDDL domain written to {}", domainFile);
    log.info("PDDL problem written to {}", problemFile);
    return new PddlFiles(domainFile, problemFile);
  }

  public String writeDomain(DomainModel model) {
    StringBuilder sb = new StringBuilder();
    sb.append("(define (domain ").append(name(model.domainName())).append(")\n");
    sb.append(" (:requirements ").append(String.join(" ", requirements(model))).append(")\n");

    if (!model.types().isEmpty()) {
      sb.append(" (:types");
      for (PlanningType type : model.types().values()) {
        sb.append("\n   ")
            .append(name(type.name()))
            .append(" - ")
            .append(name(type.parentName().orElse(model.universalRootType())));
      }
      sb.append(")\n");
    }

    if (!model.fluents().isEmpty()) {
      sb.append(" (:predicates");
      for (Fluent fluent : model.fluents().values()) {
        sb.append("\n   (").append(name(fluent.name()));
        appendParameters(sb, fluent.parameters());
        sb.append(')');
      }
      sb.append(")\n");
    }

    for (Action action : model.actions().values()) {
      sb.append(" (:action ").append(name(action.name())).append('\n');
      sb.append("  :parameters (");
      appendParameters(sb, action.parameters());
      sb.append(")\n");
      sb.append("  :precondition ").append(conjunction(action.preconditions())).append('\n');
      sb.append("  :effect ").append(conjunction(action.effects())).append(")\n");
    }
    sb.append(")\n");
    return sb.toString();
  }

  public String writeProblem(DomainModel model) {
    StringBuilder sb = new StringBuilder();
    sb.append("(define (problem ").append(name(model.problemName())).append(")\n");
    sb.append(" (:domain ").append(name(model.domainName())).append(")\n");

    if (!model.objects().isEmpty()) {
      sb.append(" (:objects");
      for (PlanningObject object : model.objects().values()) {
        sb.append("\n   ").append(name(object.name())).append(" - ").append(name(object.type()));
      }
      sb.append(")\n");
    }

    sb.append(" (:init");
    for (Atom atom : model.initialValues()) {
      sb.append("\n   ").append(ground(atom));
    }
    sb.append(")\n");

    List<String> goals = new ArrayList<>();
    for (Atom goal : model.goals()) {
      goals.add(ground(goal));
    }
    sb.append(" (:goal (and");
    goals.forEach(g -> sb.append(' ').append(g));
    sb.append("))\n");
    sb.append(")\n");
    return sb.toString();
  }

  private static List<String> requirements(DomainModel model) {
    Set<String> requirements = new LinkedHashSet<>();
    for (String requirement : model.requirements()) {
      requirements.add(requirement.startsWith(":") ? requirement : ":" + requirement);
    }
    boolean negative =
        model.actions().values().stream()
            .flatMap(a -> a.preconditions().stream())
            .anyMatch(l -> !l.positive());
    if (negative && requirements.add(NEGATIVE_PRECONDITIONS)) {
      log.debug("Added {} for negative preconditions", NEGATIVE_PRECONDITIONS);
    }
    return new ArrayList<>(requirements);
  }

  private static void appendParameters(StringBuilder sb, List<TypedParameter> parameters) {
    for (int i = 0; i < parameters.size(); i++) {
      TypedParameter parameter = parameters.get(i);
      if (i > 0 || sb.charAt(sb.length() - 1) != '(') {
        sb.append(' ');
      }
      sb.append(variable(parameter.name())).append(" - ").append(name(parameter.type()));
    }
  }

  private static String conjunction(List<Literal> literals) {
    StringBuilder sb = new StringBuilder("(and");
    for (Literal literal : literals) {
      String atom = lifted(literal.atom());
      sb.append(' ').append(literal.positive() ? atom : "(not " + atom + ")");
    }
    return sb.append(')').toString();
  }

  private static String lifted(Atom atom) {
    StringBuilder sb = new StringBuilder("(").append(name(atom.fluent()));
    atom.arguments().forEach(a -> sb.append(' ').append(variable(a)));
    return sb.append(')').toString();
  }

  private static String ground(Atom atom) {
    StringBuilder sb = new StringBuilder("(").append(name(atom.fluent()));
    atom.arguments().forEach(a -> sb.append(' ').append(name(a)));
    return sb.append(')').toString();
  }

  static String variable(String name) {
    return "?" + name(name.startsWith("?") ? name.substring(1) : name);
  }

  static String name(String raw) {
    return raw.trim().replaceAll("\\s+", "_");
  }
}
