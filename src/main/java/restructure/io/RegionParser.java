package restructure.io;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.io.CharStreams;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restructure.graph.LoopCollapser;
import restructure.graph.Node;
import restructure.graph.RegionGraph;
import restructure.graph.WeightOracle;

/**
 * Reads regions from a line based text format:
 *
 * <pre>
 * # comment
 * region main
 * code a 3
 * check c 0
 * edge a c
 * true c b
 * false c d
 * collapsed l loop.body
 * end
 * </pre>
 *
 * The first region in the file is the root, other regions are only reachable through {@code
 * collapsed} nodes of the root or its descendants. Code blocks are named {@code <region>:<id>},
 * their weight defaults to 1.
 */
public class RegionParser {
  private static final Logger LOGGER = LoggerFactory.getLogger("RegionParser");
  private static final Splitter WORDS =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings().trimResults();
  private static final int DEFAULT_WEIGHT = 1;

  private final Map<String, Declaration> declarations = new LinkedHashMap<>();
  private final Map<String, RegionGraph<String>> built = new HashMap<>();
  private final Set<String> inProgress = new LinkedHashSet<>();
  private final Map<String, Integer> weights = new HashMap<>();
  private final WeightOracle<String> oracle =
      block -> weights.getOrDefault(block, DEFAULT_WEIGHT);

  private RegionParser() {}

  public static RegionGraph<String> parse(InputStream in) throws IOException {
    return parse(CharStreams.toString(new InputStreamReader(in, StandardCharsets.UTF_8)));
  }

  public static RegionGraph<String> parse(String text) {
    RegionParser parser = new RegionParser();
    parser.declare(text);
    if (parser.declarations.isEmpty()) {
      throw new RegionParseError(1, "no region declared");
    }
    String root = parser.declarations.keySet().iterator().next();
    return parser.build(root, parser.declarations.get(root).line);
  }

  private static class Statement {
    final int line;
    final List<String> words;

    Statement(int line, List<String> words) {
      this.line = line;
      this.words = words;
    }

    String directive() {
      return words.get(0);
    }

    String word(int index) {
      if (index >= words.size()) {
        throw new RegionParseError(line, "'" + directive() + "' is missing an argument");
      }
      return words.get(index);
    }

    int number(int index) {
      String word = word(index);
      try {
        return Integer.parseInt(word);
      } catch (NumberFormatException e) {
        throw new RegionParseError(line, "expected a number but got '" + word + "'", e);
      }
    }

    void expectArity(int min, int max) {
      int arguments = words.size() - 1;
      if (arguments < min || arguments > max) {
        throw new RegionParseError(
            line, "'" + directive() + "' takes " + arity(min, max) + " but got " + arguments);
      }
    }

    private static String arity(int min, int max) {
      if (max == Integer.MAX_VALUE) {
        return "at least " + min + " arguments";
      }
      return min == max ? min + " arguments" : min + " to " + max + " arguments";
    }
  }

  private static class Declaration {
    final String name;
    final int line;
    final List<Statement> body = new ArrayList<>();

    Declaration(String name, int line) {
      this.name = name;
      this.line = line;
    }
  }

  /** Groups the statements by region without interpreting them. */
  private void declare(String text) {
    Declaration current = null;
    int lineNumber = 0;
    for (String line : Splitter.onPattern("\r?\n").split(text)) {
      lineNumber++;
      int comment = line.indexOf('#');
      if (comment >= 0) {
        line = line.substring(0, comment);
      }
      List<String> words = WORDS.splitToList(line);
      if (words.isEmpty()) {
        continue;
      }
      Statement statement = new Statement(lineNumber, words);
      switch (statement.directive()) {
        case "region":
          if (current != null) {
            throw new RegionParseError(lineNumber, "region " + current.name + " is not closed");
          }
          statement.expectArity(1, 1);
          current = new Declaration(statement.word(1), lineNumber);
          if (declarations.containsKey(current.name)) {
            throw new RegionParseError(lineNumber, "region " + current.name + " declared twice");
          }
          declarations.put(current.name, current);
          break;
        case "end":
          if (current == null) {
            throw new RegionParseError(lineNumber, "'end' outside of a region");
          }
          statement.expectArity(0, 0);
          current = null;
          break;
        default:
          if (current == null) {
            throw new RegionParseError(
                lineNumber, "'" + statement.directive() + "' outside of a region");
          }
          current.body.add(statement);
      }
    }
    if (current != null) {
      throw new RegionParseError(lineNumber, "region " + current.name + " is not closed");
    }
  }

  /** Builds a region after all regions it nests. */
  private RegionGraph<String> build(String name, int referencedAt) {
    RegionGraph<String> done = built.get(name);
    if (done != null) {
      return done;
    }
    Declaration declaration = declarations.get(name);
    if (declaration == null) {
      throw new RegionParseError(referencedAt, "unknown region " + name);
    }
    if (!inProgress.add(name)) {
      throw new RegionParseError(
          referencedAt, "region " + name + " nests itself via " + inProgress);
    }
    LOGGER.debug("Building region {}", name);

    RegionGraph<String> graph = new RegionGraph<>(name, oracle);
    Map<String, Node<String>> nodes = new HashMap<>();
    for (Statement statement : declaration.body) {
      try {
        interpret(statement, graph, nodes);
      } catch (IllegalArgumentException | IllegalStateException e) {
        throw new RegionParseError(statement.line, e.getMessage(), e);
      }
    }
    if (graph.size() == 0) {
      throw new RegionParseError(declaration.line, "region " + name + " is empty");
    }

    inProgress.remove(name);
    built.put(name, graph);
    return graph;
  }

  private void interpret(
      Statement statement, RegionGraph<String> graph, Map<String, Node<String>> nodes) {
    int line = statement.line;
    switch (statement.directive()) {
      case "code":
        {
          statement.expectArity(1, 2);
          String id = statement.word(1);
          String block = graph.name() + ":" + id;
          if (statement.words.size() > 2) {
            int weight = statement.number(2);
            if (weight < 0) {
              throw new RegionParseError(line, "negative weight " + weight);
            }
            weights.put(block, weight);
          }
          define(line, nodes, id, graph.addCodeNode(block, id));
          break;
        }
      case "check":
        statement.expectArity(2, 2);
        defineNamed(line, nodes, statement.word(1), graph.addCheck(statement.number(2)));
        break;
      case "set":
        statement.expectArity(2, 2);
        defineNamed(line, nodes, statement.word(1), graph.addSet(statement.number(2)));
        break;
      case "break":
        statement.expectArity(1, 1);
        defineNamed(line, nodes, statement.word(1), graph.addBreak());
        break;
      case "continue":
        statement.expectArity(1, 1);
        defineNamed(line, nodes, statement.word(1), graph.addContinue());
        break;
      case "collapsed":
        {
          statement.expectArity(2, 2);
          RegionGraph<String> nested = build(statement.word(2), line);
          define(line, nodes, statement.word(1), graph.addCollapsedNode(nested));
          break;
        }
      case "entry":
        statement.expectArity(1, 1);
        graph.setEntry(lookup(line, nodes, statement.word(1)));
        break;
      case "edge":
        statement.expectArity(2, 2);
        graph.addEdge(
            lookup(line, nodes, statement.word(1)), lookup(line, nodes, statement.word(2)));
        break;
      case "true":
        statement.expectArity(2, 2);
        graph.setTrue(
            checkNode(line, nodes, statement.word(1)), lookup(line, nodes, statement.word(2)));
        break;
      case "false":
        statement.expectArity(2, 2);
        graph.setFalse(
            checkNode(line, nodes, statement.word(1)), lookup(line, nodes, statement.word(2)));
        break;
      case "loop":
        {
          statement.expectArity(1, Integer.MAX_VALUE);
          String headId = statement.word(1);
          Node<String> head = lookup(line, nodes, headId);
          Set<Node<String>> body = new LinkedHashSet<>();
          body.add(head);
          for (String member : statement.words.subList(2, statement.words.size())) {
            body.add(lookup(line, nodes, member));
          }
          Node<String> collapsed = LoopCollapser.collapseLoop(graph, head, body);
          nodes.values().removeAll(body);
          nodes.put(headId, collapsed);
          break;
        }
      default:
        throw new RegionParseError(line, "unknown directive '" + statement.directive() + "'");
    }
  }

  private static void define(
      int line, Map<String, Node<String>> nodes, String id, Node<String> node) {
    if (nodes.putIfAbsent(id, node) != null) {
      throw new RegionParseError(line, "node " + id + " defined twice");
    }
  }

  private static void defineNamed(
      int line, Map<String, Node<String>> nodes, String id, Node<String> node) {
    node.setName(id);
    define(line, nodes, id, node);
  }

  private static Node<String> lookup(int line, Map<String, Node<String>> nodes, String id) {
    Node<String> node = nodes.get(id);
    if (node == null) {
      throw new RegionParseError(line, "unknown node " + id);
    }
    return node;
  }

  private static Node<String> checkNode(int line, Map<String, Node<String>> nodes, String id) {
    Node<String> node = lookup(line, nodes, id);
    if (!node.isCheck()) {
      throw new RegionParseError(line, id + " is not a check");
    }
    return node;
  }
}
