
package exm.gopy.common.exceptions;

/**
 * This represents a translator internal error.
 * These always indicate a translator bug (or missing feature).
 * */
public class GopyRuntimeError extends RuntimeException
{
  public GopyRuntimeError(String msg)
  {
    super(msg);
  }

  public GopyRuntimeError(String msg, Throwable cause)
  {
    super(msg, cause);
  }

  private static final long serialVersionUID = 1L;
}
