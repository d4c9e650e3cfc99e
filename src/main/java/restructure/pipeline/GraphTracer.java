package restructure.pipeline;

import restructure.ast.Ast;
import restructure.graph.RegionGraph;

/**
 * Optional side channel receiving snapshots of regions and ASTs while they are being structured.
 * Passes check {@link #isEnabled()} before doing any work on behalf of the tracer.
 */
public interface GraphTracer {

  GraphTracer NONE =
      new GraphTracer() {
        @Override
        public boolean isEnabled() {
          return false;
        }

        @Override
        public <B> void traceGraph(RegionGraph<B> graph, String pass, String stage) {}

        @Override
        public <B> void traceAst(Ast<B> ast, String region, String stage) {}
      };

  boolean isEnabled();

  <B> void traceGraph(RegionGraph<B> graph, String pass, String stage);

  <B> void traceAst(Ast<B> ast, String region, String stage);
}
