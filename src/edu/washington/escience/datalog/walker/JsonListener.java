package edu.washington.escience.datalog.walker;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import edu.washington.escience.datalog.syntax.DatalogProgram;
import edu.washington.escience.datalog.syntax.Parameter;
import edu.washington.escience.datalog.syntax.Predicate;
import edu.washington.escience.datalog.syntax.Rule;

/**
 * Builds a JSON document of a program:
 *
 * <pre>
 * {"schemes":[{"name":"a","parameters":[{"type":"ID","value":"A"}]}],
 *  "facts":[...], "rules":[{"head":{...},"body":[...]}], "queries":[...], "domain":["1"]}
 * </pre>
 */
public final class JsonListener extends DatalogBaseListener {
  /** Only create the mapper once, and share it among instances. */
  private static final ObjectMapper MAPPER = newMapper();

  /** The document being built. */
  private final ObjectNode root = MAPPER.createObjectNode();
  /** The array of the section being traversed. */
  private ArrayNode section;
  /** Literals seen in facts, sorted. */
  private final SortedSet<String> domain = new TreeSet<String>();

  /**
   * @return the mapper used to build and write documents.
   */
  private static ObjectMapper newMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.configure(SerializationFeature.INDENT_OUTPUT, false);
    return mapper;
  }

  /**
   * @param program a program.
   * @return the JSON text of the program.
   * @throws JsonProcessingException if Jackson fails to write the document.
   */
  public static String render(final DatalogProgram program) throws JsonProcessingException {
    final JsonListener listener = new JsonListener();
    DatalogWalker.walk(program, listener);
    return listener.toJson();
  }

  /**
   * @param predicate a predicate.
   * @return its JSON object.
   */
  private static ObjectNode toNode(final Predicate predicate) {
    final ObjectNode node = MAPPER.createObjectNode();
    node.put("name", predicate.getName());
    final ArrayNode parameters = node.putArray("parameters");
    for (final Parameter p : predicate.getParameters()) {
      parameters.addObject().put("type", p.getType().name()).put("value", p.getValue());
    }
    return node;
  }

  @Override
  public void enterSchemes(final List<Predicate> schemes) {
    section = root.putArray("schemes");
  }

  @Override
  public void enterScheme(final Predicate scheme) {
    section.add(toNode(scheme));
  }

  @Override
  public void enterFacts(final List<Predicate> facts) {
    section = root.putArray("facts");
  }

  @Override
  public void enterFact(final Predicate fact) {
    section.add(toNode(fact));
    for (final Parameter p : fact.getParameters()) {
      if (p.isString()) {
        domain.add(p.getValue());
      }
    }
  }

  @Override
  public void enterRules(final List<Rule> rules) {
    section = root.putArray("rules");
  }

  @Override
  public void enterRule(final Rule rule) {
    final ObjectNode node = section.addObject();
    node.set("head", toNode(rule.getHead()));
    final ArrayNode body = node.putArray("body");
    for (final Predicate p : rule.getBody()) {
      body.add(toNode(p));
    }
  }

  @Override
  public void enterQueries(final List<Predicate> queries) {
    section = root.putArray("queries");
  }

  @Override
  public void enterQuery(final Predicate query) {
    section.add(toNode(query));
  }

  @Override
  public void exitProgram(final DatalogProgram program) {
    final ArrayNode literals = root.putArray("domain");
    for (final String literal : domain) {
      literals.add(literal);
    }
    section = null;
  }

  /**
   * @return the document built so far.
   */
  public ObjectNode getDocument() {
    return root;
  }

  /**
   * @return the document built so far, as compact JSON text.
   * @throws JsonProcessingException if Jackson fails to write the document.
   */
  public String toJson() throws JsonProcessingException {
    return MAPPER.writeValueAsString(root);
  }
}
