package restructure;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Joiner;
import com.google.common.collect.ObjectArrays;
import com.google.common.primitives.Booleans;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.event.Level;
import org.slf4j.impl.SimpleLogger;
import restructure.ast.Ast;
import restructure.ast.AstPrinter;
import restructure.graph.DotWriter;
import restructure.graph.RegionGraph;
import restructure.io.RegionParser;
import restructure.pipeline.DotGraphTracer;
import restructure.pipeline.Restructurer;
import restructure.pipeline.StructuringOptions;

public class Cli {

  static final String usage =
      Joiner.on(System.lineSeparator())
          .join(
              ObjectArrays.concat(
                  new String[] {
                    "Usage: restructure [--print-ast|--print-graph|--check] [--untangle-factor f]",
                    "                   [--no-untangle] [--help] [--verbosity] file",
                    "",
                    "  --print-ast          print the structured program of the root region",
                    "  --print-graph        print the root region after combing as dot graph",
                    "  --check              structure all regions without printing anything",
                    "  --untangle-factor f  untangle only if it saves f times its cost, default 1",
                    "  --no-untangle        skip untangling, only comb",
                    "  --verbosity|-v       Crank this up for more debug output",
                    "  --help               display this help and exit",
                    "",
                    "Environment variables:"
                  },
                  EnvVar.getAllEnvVarDescriptions(),
                  String.class));

  private final PrintStream out;
  private final PrintStream err;
  private final FileSystem fileSystem;

  Cli(OutputStream out, OutputStream err, FileSystem fileSystem) {
    this.out = new PrintStream(out);
    this.err = new PrintStream(err);
    this.fileSystem = fileSystem;
  }

  int run(String... args) {
    Parameters params = Parameters.parse(args);
    setLogLevel(params.verbosity);
    if (!params.valid()) {
      err.println("Called as: " + String.join(" ", args));
      err.println(usage);
      return 1;
    }
    if (params.help) {
      out.println(usage);
      return 0;
    }
    Path path = fileSystem.getPath(params.file);
    try (InputStream in = Files.newInputStream(path)) {
      RegionGraph<String> root = RegionParser.parse(in);
      Ast<String> ast = new Restructurer(options(params)).generateAst(root);
      if (params.printGraph) {
        out.print(DotWriter.toDot(root));
      } else if (!params.check) {
        out.print(AstPrinter.print(ast));
      }
    } catch (AccessDeniedException e) {
      err.println("error: access to file '" + path + "' was denied");
      return 1;
    } catch (RestructureError e) {
      err.println("error: " + e.getMessage());
      return 1;
    } catch (NoSuchFileException e) {
      err.println("error: file '" + path + "' doesn't exist");
      return 1;
    } catch (Throwable t) {
      // print full stacktrace for any other error
      t.printStackTrace(err);
      return 1;
    }
    return 0;
  }

  private StructuringOptions options(Parameters params) {
    StructuringOptions options =
        StructuringOptions.DEFAULT
            .withUntangle(!params.noUntangle)
            .withUntangleFactor(params.untangleFactor);
    if (EnvVar.RS_GRAPH.isSetToOne()) {
      Path directory = fileSystem.getPath(EnvVar.RS_GRAPH_DIR.valueOr("dots"));
      options = options.withTracer(new DotGraphTracer(directory));
    }
    return options;
  }

  private void setLogLevel(int verbosity) {
    verbosity = Math.max(0, verbosity);
    verbosity = Math.min(Level.values().length - 1, verbosity);
    // HACK ALERT
    String level = Level.values()[verbosity].toString();
    System.setProperty(SimpleLogger.DEFAULT_LOG_LEVEL_KEY, level);
  }

  private static class Parameters {
    private Parameters() {}

    /** True if the --print-ast option was set */
    @Parameter(names = "--print-ast")
    boolean printAst;

    /** True if the --print-graph option was set */
    @Parameter(names = "--print-graph")
    boolean printGraph;

    /** True if the --check option was set */
    @Parameter(names = "--check")
    boolean check;

    @Parameter(names = "--untangle-factor")
    Double untangleFactor = 1.0;

    @Parameter(names = "--no-untangle")
    boolean noUntangle;

    @Parameter(names = {"--verbosity", "-v"})
    Integer verbosity = 0;

    /** True if the --help option was set */
    @Parameter(names = "--help")
    boolean help;

    @SuppressWarnings("MismatchedQueryAndUpdateOfCollection")
    @Parameter
    private List<String> mainParameters = new ArrayList<>();

    /** The path of the file to process, possibly relative to the current working directory */
    String file;

    // set to true, if parsing arguments failed
    private boolean invalid;

    /** Returns true if the parameter values represent a valid set */
    boolean valid() {
      return !invalid
          && (help
              || (Booleans.countTrue(printAst, printGraph, check) <= 1
                  && untangleFactor >= 0
                  && mainParameters.size() == 1
                  && file != null));
    }

    static Parameters parse(String... args) {
      Parameters params = new Parameters();
      try {
        new JCommander(params, args);
        if (!params.mainParameters.isEmpty()) {
          params.file = params.mainParameters.get(params.mainParameters.size() - 1);
        }
      } catch (ParameterException e) {
        params.invalid = true;
      }
      return params;
    }
  }
}
