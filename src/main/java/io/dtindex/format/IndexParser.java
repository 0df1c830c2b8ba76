package io.dtindex.format;

import io.dtindex.DateTimeIndex;
import io.dtindex.DateTimeIndexException;
import io.dtindex.frequency.BusinessDayFrequency;
import io.dtindex.frequency.DayFrequency;
import io.dtindex.frequency.Frequency;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Parser for the strings produced by {@link IndexFormat}. */
public final class IndexParser {
  private static final Logger LOG = LoggerFactory.getLogger(IndexParser.class);

  /** Offset date-times, local date-times and plain dates; the latter two are read as UTC. */
  private static final DateTimeFormatter DATE_TIME =
      new DateTimeFormatterBuilder()
          .append(DateTimeFormatter.ISO_LOCAL_DATE)
          .optionalStart()
          .appendLiteral('T')
          .append(DateTimeFormatter.ISO_LOCAL_TIME)
          .optionalEnd()
          .optionalStart()
          .appendOffsetId()
          .optionalEnd()
          .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
          .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
          .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
          .parseDefaulting(ChronoField.OFFSET_SECONDS, 0)
          .toFormatter();

  private static final int UNIFORM_FIELDS = 4;

  private final String input;
  private final String[] tokens;

  private IndexParser(String input) {
    this.input = input;
    this.tokens = input.split(IndexFormat.FIELD_SEPARATOR, -1);
  }

  /**
   * Parses an index string.
   *
   * @param input the string to parse
   * @return the parsed index
   * @throws DateTimeIndexException if the input is invalid
   */
  public static DateTimeIndex parse(String input) throws DateTimeIndexException {
    if (input == null || input.trim().isEmpty()) {
      throw DateTimeIndexException.parse("empty input", "", input);
    }
    try {
      return new IndexParser(input).parseIndex();
    } catch (DateTimeIndexException e) {
      LOG.debug("{} error in date-time index '{}': {}", e.kind().value(), input, e.getMessage());
      throw e;
    }
  }

  /**
   * Parses a single date-time field.
   *
   * @param text an ISO-8601 offset date-time, local date-time or date
   * @return the date-time; local forms are taken to be UTC
   * @throws DateTimeParseException if the text is not a date-time
   */
  public static ZonedDateTime parseDateTime(String text) {
    return OffsetDateTime.parse(text, DATE_TIME).toZonedDateTime();
  }

  private DateTimeIndex parseIndex() throws DateTimeIndexException {
    String kind = tokens[0];
    switch (kind) {
      case IndexFormat.UNIFORM:
        return parseUniform();
      case IndexFormat.IRREGULAR:
        return parseIrregular();
      default:
        throw DateTimeIndexException.parse(
            "DateTimeIndex type '" + kind + "' not recognized", kind, input);
    }
  }

  private DateTimeIndex parseUniform() throws DateTimeIndexException {
    if (tokens.length != UNIFORM_FIELDS) {
      throw DateTimeIndexException.parse(
          "uniform index needs " + UNIFORM_FIELDS + " fields, found " + tokens.length,
          IndexFormat.UNIFORM,
          input);
    }
    ZonedDateTime start = dateTimeField(tokens[1]);
    int periods = intField(tokens[2], "periods");
    Frequency frequency = parseFrequency(tokens[3]);
    if (periods < 0) {
      throw DateTimeIndexException.parse("periods must not be negative", tokens[2], input);
    }
    return DateTimeIndex.uniform(start, periods, frequency);
  }

  private Frequency parseFrequency(String field) throws DateTimeIndexException {
    String[] parts = field.split(IndexFormat.FREQUENCY_SEPARATOR, -1);
    if (parts.length != 2) {
      throw DateTimeIndexException.parse(
          "frequency '" + field + "' must be a kind and a step", field, input);
    }
    String kind = parts[0];
    if (!kind.equals(DayFrequency.NAME) && !kind.equals(BusinessDayFrequency.NAME)) {
      throw DateTimeIndexException.parse("Frequency '" + kind + "' not recognized", kind, input);
    }
    int step = intField(parts[1], "step");
    if (step <= 0) {
      throw DateTimeIndexException.parse("step must be positive", parts[1], input);
    }
    if (kind.equals(DayFrequency.NAME)) {
      return new DayFrequency(step);
    }
    return new BusinessDayFrequency(step);
  }

  private DateTimeIndex parseIrregular() throws DateTimeIndexException {
    // "irregular," is the empty index
    int end = tokens.length == 2 && tokens[1].isEmpty() ? 1 : tokens.length;
    List<ZonedDateTime> dateTimes = new ArrayList<>(end - 1);
    for (int i = 1; i < end; i++) {
      dateTimes.add(dateTimeField(tokens[i]));
    }
    try {
      return DateTimeIndex.irregular(dateTimes);
    } catch (IllegalArgumentException e) {
      throw DateTimeIndexException.parse(e.getMessage(), IndexFormat.IRREGULAR, input, e);
    }
  }

  private ZonedDateTime dateTimeField(String token) throws DateTimeIndexException {
    try {
      return parseDateTime(token);
    } catch (DateTimeParseException e) {
      throw DateTimeIndexException.parse("invalid date-time '" + token + "'", token, input, e);
    }
  }

  private int intField(String token, String name) throws DateTimeIndexException {
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException e) {
      throw DateTimeIndexException.parse(
          "invalid " + name + " '" + token + "'", token, input, e);
    }
  }
}
