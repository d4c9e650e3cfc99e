package restructure.pipeline;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restructure.RestructureError;
import restructure.ast.Ast;
import restructure.ast.AstBuilder;
import restructure.ast.AstNormalizer;
import restructure.comb.Comber;
import restructure.comb.Untangler;
import restructure.dominance.Dominance;
import restructure.dominance.DominanceAnalysis;
import restructure.graph.Node;
import restructure.graph.RegionGraph;

/**
 * Turns a region into a goto-free AST: untangle, comb, build, normalize. Regions nested in
 * collapsed nodes are structured on demand while their parent's AST is built, and every region is
 * structured at most once.
 */
public class Restructurer implements AstBuilder.NestedRegions {
  private static final Logger LOGGER = LoggerFactory.getLogger("Restructurer");

  private final StructuringOptions options;
  private final Untangler untangler;
  private final Comber comber;
  private final AstBuilder builder;

  public Restructurer(StructuringOptions options, DominanceAnalysis analysis) {
    this.options = options;
    this.untangler = new Untangler(analysis, options.untangleFactor, options.tracer);
    this.comber = new Comber(analysis, options.tracer);
    this.builder = new AstBuilder(analysis, this);
  }

  public Restructurer(StructuringOptions options) {
    this(options, Dominance.ANALYSIS);
  }

  public Restructurer() {
    this(StructuringOptions.DEFAULT);
  }

  @Override
  public <B> Ast<B> generateAst(RegionGraph<B> region) {
    Optional<Ast<B>> done = region.ast();
    if (done.isPresent()) {
      return done.get();
    }
    LOGGER.debug("Structuring {} ({} nodes)", region.name(), region.size());
    region.removeNotReachables();
    if (!region.isDAG()) {
      throw new RestructureError("Region " + region.name() + " has a cycle that is not collapsed");
    }

    if (options.untangle) {
      int splits = untangler.untangle(region);
      LOGGER.debug("{}: {} untangle splits", region.name(), splits);
    }
    Comber.Statistics statistics = comber.comb(region);
    LOGGER.debug("{}: combing inserted {}", region.name(), statistics);
    region.removeNotReachables();
    trace(region, "before-ast");

    Ast<B> ast = builder.build(region);
    traceAst(ast, "raw");
    AstNormalizer.normalize(ast);
    traceAst(ast, "normalized");

    for (Node<B> removed : region.removeNotReachables()) {
      LOGGER.debug("{}: dropped unreachable {}", region.name(), removed);
    }
    region.purgeDummies();
    trace(region, "final");

    region.setAst(ast);
    return ast;
  }

  private <B> void trace(RegionGraph<B> region, String stage) {
    if (options.tracer.isEnabled()) {
      options.tracer.traceGraph(region, "restructure", stage);
    }
  }

  private <B> void traceAst(Ast<B> ast, String stage) {
    if (options.tracer.isEnabled()) {
      options.tracer.traceAst(ast, ast.region, stage);
    }
  }
}
