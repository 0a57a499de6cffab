package com.gentoro.aasplan.access;

import com.gentoro.aasplan.exception.ReferenceException;
import com.gentoro.aasplan.graph.ElementGraph;
import com.gentoro.aasplan.graph.ElementNode;
import com.gentoro.aasplan.graph.Submodel;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Follows the two kinds of cross-submodel references found in capability and instance
 * descriptions.
 *
 * <ul>
 *   <li>Predicate references: {@code [submodelId, predicateCollection, ...]} to the predicate's
 *       {@code predicateName}.
 *   <li>Parameter references: {@code [submodelId, operator, ProcessParameters, parameter, ...]} to
 *       the parameter's variable, held by its {@code Property} child.
 * </ul>
 *
 * <p>Both are pure functions of the graph; results are memoized per key path.
 */
public class ReferenceResolver {
  static final String PREDICATE_NAME = "predicateName";
  static final String PROCESS_PARAMETERS = "ProcessParameters";
  static final String PARAMETER_VARIABLE = "Property";

  private final ElementGraph graph;
  private final Map<List<String>, String> predicateCache = new HashMap<>();
  private final Map<List<String>, String> parameterCache = new HashMap<>();

  public ReferenceResolver(ElementGraph graph) {
    this.graph = graph;
  }

  /**
   * Resolve a predicate reference to the predicate name.
   *
   * @throws ReferenceException on a short key path or any missing link
   */
  public String resolvePredicateReference(ElementNode.ReferenceNode reference) {
    List<String> keys = reference.keyPath();
    String cached = predicateCache.get(keys);
    if (cached != null) {
      return cached;
    }
    if (keys.size() < 2) {
      throw new ReferenceException(
          "Predicate reference '"
              + reference.idShort()
              + "' needs at least 2 keys, found "
              + keys.size(),
          keys);
    }

    Submodel submodel = submodel(keys);
    String elementName = keys.get(1);
    ElementNode element =
        submodel
            .element(elementName)
            .orElseThrow(
                () ->
                    new ReferenceException(
                        "Predicate element '"
                            + elementName
                            + "' not found in submodel '"
                            + submodel.idShort()
                            + "'",
                        keys));
    ElementNode.CollectionNode predicate =
        element
            .asCollection()
            .orElseThrow(
                () ->
                    new ReferenceException(
                        "Predicate element '" + elementName + "' is not a collection", keys));
    String name =
        predicate
            .propertyValue(PREDICATE_NAME)
            .orElseThrow(
                () ->
                    new ReferenceException(
                        PREDICATE_NAME + " property not found in '" + elementName + "'", keys));

    predicateCache.put(keys, name);
    return name;
  }

  /**
   * Resolve a parameter-binding reference to the variable it names.
   *
   * @throws ReferenceException on a short key path or any missing link
   */
  public String resolveParameterReference(ElementNode.ReferenceNode reference) {
    List<String> keys = reference.keyPath();
    String cached = parameterCache.get(keys);
    if (cached != null) {
      return cached;
    }
    if (keys.size() < 4) {
      throw new ReferenceException(
          "Parameter reference '"
              + reference.idShort()
              + "' needs at least 4 keys, found "
              + keys.size(),
          keys);
    }

    Submodel submodel = submodel(keys);
    String operatorName = keys.get(1);
    String parameterName = keys.get(3);

    ElementNode.CollectionNode operator =
        submodel
            .element(operatorName)
            .flatMap(ElementNode::asCollection)
            .orElseThrow(
                () ->
                    new ReferenceException(
                        "Process operator '"
                            + operatorName
                            + "' not found in submodel '"
                            + submodel.idShort()
                            + "'",
                        keys));
    ElementNode.CollectionNode parameters =
        operator
            .childCollection(PROCESS_PARAMETERS)
            .orElseThrow(
                () ->
                    new ReferenceException(
                        PROCESS_PARAMETERS + " not found in operator '" + operatorName + "'",
                        keys));
    String variable =
        parameters
            .childCollection(parameterName)
            .flatMap(p -> p.propertyValue(PARAMETER_VARIABLE))
            .orElseThrow(
                () ->
                    new ReferenceException(
                        "Parameter '"
                            + parameterName
                            + "' not found in "
                            + PROCESS_PARAMETERS
                            + " of '"
                            + operatorName
                            + "'",
                        keys));

    parameterCache.put(keys, variable);
    return variable;
  }

  private Submodel submodel(List<String> keys) {
    String submodelId = keys.get(0);
    return graph
        .lookupById(submodelId)
        .orElseThrow(
            () -> new ReferenceException("Referenced submodel not found: " + submodelId, keys));
  }
}
