package io.dtindex.format;

import io.dtindex.DateTimeIndex;
import io.dtindex.Instants;
import io.dtindex.IrregularDateTimeIndex;
import io.dtindex.UniformDateTimeIndex;
import io.dtindex.frequency.BusinessDayFrequency;
import io.dtindex.frequency.DayFrequency;
import io.dtindex.frequency.Frequency;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.stream.Collectors;

/**
 * Renders indexes as canonical comma-separated strings.
 *
 * <ul>
 *   <li>{@code uniform,<start>,<periods>,<frequency>}, e.g. {@code
 *       uniform,2015-04-08T00:00:00.000Z,5,days 1}
 *   <li>{@code irregular,<date-time>,<date-time>,...}
 * </ul>
 */
public final class IndexFormat {
  static final String UNIFORM = "uniform";
  static final String IRREGULAR = "irregular";
  static final String FIELD_SEPARATOR = ",";
  static final String FREQUENCY_SEPARATOR = " ";

  private static final DateTimeFormatter DATE_TIME =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSXXX");

  private IndexFormat() {}

  /**
   * Renders an index as a canonical string.
   *
   * @param index the index to render
   * @return the canonical string representation
   */
  public static String render(DateTimeIndex index) {
    if (index instanceof UniformDateTimeIndex uniform) {
      return renderUniform(uniform);
    }
    return renderIrregular((IrregularDateTimeIndex) index);
  }

  /**
   * Renders a single date-time the way it appears inside an index string.
   *
   * @param dt the date-time to render
   * @return the date-time in UTC with millisecond precision
   */
  public static String renderDateTime(ZonedDateTime dt) {
    return DATE_TIME.format(dt.withZoneSameInstant(Instants.ZONE));
  }

  private static String renderUniform(UniformDateTimeIndex index) {
    return String.join(
        FIELD_SEPARATOR,
        UNIFORM,
        renderDateTime(index.start()),
        Integer.toString(index.periods()),
        renderFrequency(index.frequency()));
  }

  /**
   * Renders the frequency field of a uniform index string.
   *
   * @param frequency the frequency to render
   * @return the kind and step, e.g. {@code businessDays 2}
   */
  public static String renderFrequency(Frequency frequency) {
    String kind =
        frequency instanceof DayFrequency ? DayFrequency.NAME : BusinessDayFrequency.NAME;
    return kind + FREQUENCY_SEPARATOR + frequency.step();
  }

  private static String renderIrregular(IrregularDateTimeIndex index) {
    StringBuilder sb = new StringBuilder(IRREGULAR);
    sb.append(FIELD_SEPARATOR);
    sb.append(
        index
            .dateTimes()
            .map(IndexFormat::renderDateTime)
            .collect(Collectors.joining(FIELD_SEPARATOR)));
    return sb.toString();
  }
}
