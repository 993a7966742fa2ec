package exm.gopy.common.exceptions;

/**
 * Used to signal that program should quit.
 */
public class GopyFatal extends RuntimeException {
  public final int exitCode;

  public GopyFatal(int exitCode) {
    super("exit code " + exitCode);
    this.exitCode = exitCode;
  }

  private static final long serialVersionUID = 1L;
}
