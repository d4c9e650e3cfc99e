package restructure;

import java.util.ArrayList;

public enum EnvVar {
  RS_GRAPH("Set to \"1\" to dump every intermediate region and AST as dot file."),
  RS_GRAPH_DIR("Directory the dot files are written to, \"dots\" if not set.");

  public final String description;

  EnvVar(String description) {
    this.description = description;
  }

  public String value() {
    if (isAvailable()) {
      return System.getenv(name());
    }
    return "";
  }

  public String valueOr(String fallback) {
    return isAvailable() ? value() : fallback;
  }

  public boolean isSetToOne() {
    return isAvailable() && "1".equals(System.getenv(name()));
  }

  public boolean isAvailable() {
    return System.getenv().containsKey(name());
  }

  public static String[] getAllEnvVarDescriptions() {
    ArrayList<String> descriptions = new ArrayList<>();
    for (EnvVar envVariable : EnvVar.values()) {
      descriptions.add(envVariable.name() + ": " + envVariable.description);
    }
    return descriptions.toArray(new String[0]);
  }
}
