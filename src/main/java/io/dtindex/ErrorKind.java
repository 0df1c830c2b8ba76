package io.dtindex;

/** The type of error raised while parsing an index or converting a frequency. */
public enum ErrorKind {
  /** Parse error - malformed or unrecognized index text. */
  PARSE("parse"),
  /** Frequency error - a calendar period with no frequency equivalent. */
  FREQUENCY("frequency");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
