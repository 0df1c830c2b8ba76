package io.dtindex;

import java.util.Optional;

/** Exception thrown when index text cannot be parsed or a period cannot become a frequency. */
public final class DateTimeIndexException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The token that could not be interpreted, if any. */
  private final String token;

  /** The original input string, if any. */
  private final String input;

  private DateTimeIndexException(
      ErrorKind kind, String message, String token, String input, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.token = token;
    this.input = input;
  }

  /**
   * Creates a new parse error for an unrecognized token.
   *
   * @param message the error message
   * @param token the offending token
   * @param input the original input string
   * @return a new DateTimeIndexException for a parse error
   */
  public static DateTimeIndexException parse(String message, String token, String input) {
    return new DateTimeIndexException(ErrorKind.PARSE, message, token, input, null);
  }

  /**
   * Creates a new parse error for a token that failed a lower-level conversion.
   *
   * @param message the error message
   * @param token the offending token
   * @param input the original input string
   * @param cause the underlying failure
   * @return a new DateTimeIndexException for a parse error
   */
  public static DateTimeIndexException parse(
      String message, String token, String input, Throwable cause) {
    return new DateTimeIndexException(ErrorKind.PARSE, message, token, input, cause);
  }

  /**
   * Creates a new frequency conversion error.
   *
   * @param message the error message
   * @return a new DateTimeIndexException for a frequency error
   */
  public static DateTimeIndexException frequency(String message) {
    return new DateTimeIndexException(ErrorKind.FREQUENCY, message, null, null, null);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the token that could not be interpreted, if available.
   *
   * @return the token, or empty if not available
   */
  public Optional<String> token() {
    return Optional.ofNullable(token);
  }

  /**
   * Returns the original input string, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }
}
