package restructure;

/** Basic error class in this project. */
public class RestructureError extends RuntimeException {

  public RestructureError(Exception wrapped) {
    super(wrapped);
  }

  public RestructureError(String message) {
    super(message);
  }

  public RestructureError(String message, Throwable cause) {
    super(message, cause);
  }
}
