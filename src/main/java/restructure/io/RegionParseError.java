package restructure.io;

import restructure.RestructureError;

/** A region file that could not be read, pointing to the offending line. */
public class RegionParseError extends RestructureError {

  public final int line;

  RegionParseError(int line, String message) {
    super(String.format("Parse error at line %d: %s", line, message));
    this.line = line;
  }

  RegionParseError(int line, String message, Throwable cause) {
    super(String.format("Parse error at line %d: %s", line, message), cause);
    this.line = line;
  }
}
