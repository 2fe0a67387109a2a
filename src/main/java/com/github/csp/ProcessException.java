package com.github.csp;

/**
 * Unified single exception that's thrown by this engine. The idea is to use the code enum to
 * encapsulate the various contract violations a caller can commit.
 * 
 * Every code here describes a programming error, not a recoverable runtime condition, so this
 * exception is unchecked. A well-behaved caller checks {@link Cursor#canPerform(Object)} before
 * calling {@link Cursor#perform(Object)} and never sees it.
 */
public final class ProcessException extends RuntimeException {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public ProcessException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public ProcessException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public ProcessException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    ILLEGAL_EVENT("Cursor is not willing to perform the requested event in its current state"),
    // 2.
    EMPTY_INTERNAL_CHOICE("Cannot perform internal choice over no processes"),
    // 3.
    INVALID_CONFIGURATION("Trace configuration is invalid"),
    // 4.
    NULL_PROCESS("Null process is invalid");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
