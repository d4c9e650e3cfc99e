package restructure.pipeline;

import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import restructure.RestructureError;
import restructure.ast.Ast;
import restructure.ast.AstDotPrinter;
import restructure.graph.DotWriter;
import restructure.graph.RegionGraph;

/** Writes every snapshot to {@code <directory>/<pass>/<region>/<stage>.dot}. */
public class DotGraphTracer implements GraphTracer {
  private static final String AST_PASS = "ast";

  private final Path directory;

  public DotGraphTracer(Path directory) {
    this.directory = directory;
  }

  @Override
  public boolean isEnabled() {
    return true;
  }

  @Override
  public <B> void traceGraph(RegionGraph<B> graph, String pass, String stage) {
    write(pass, graph.name(), stage, DotWriter.toDot(graph));
  }

  @Override
  public <B> void traceAst(Ast<B> ast, String region, String stage) {
    write(AST_PASS, region, stage, AstDotPrinter.toDot(ast));
  }

  private void write(String pass, String region, String stage, String dot) {
    Path file = directory.resolve(pass).resolve(sanitize(region)).resolve(sanitize(stage) + ".dot");
    try {
      MoreFiles.createParentDirectories(file);
      Files.write(file, dot.getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new RestructureError("Could not dump " + file, e);
    }
  }

  /** Node names may contain anything, file names may not. */
  static String sanitize(String name) {
    return name.replaceAll("[^A-Za-z0-9._-]", "_");
  }
}
