package membership.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code {Field}} placeholders in message templates.
 *
 * <p>Dates render as {@code M/d/yyyy}; unknown or unset fields render as the empty
 * string. Text outside placeholders is copied verbatim.
 */
public final class TemplateExpander {
  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}]+)}");
  private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("M/d/yyyy");

  private TemplateExpander() {}

  public static String expand(String template, Map<String, ?> fields) {
    Objects.requireNonNull(fields, "fields");
    if (template == null || template.isEmpty()) {
      return "";
    }
    Matcher matcher = PLACEHOLDER.matcher(template);
    StringBuilder sb = new StringBuilder();
    while (matcher.find()) {
      Object value = fields.get(matcher.group(1).trim());
      matcher.appendReplacement(sb, Matcher.quoteReplacement(render(value)));
    }
    matcher.appendTail(sb);
    return sb.toString();
  }

  public static String formatDate(LocalDate date) {
    return date == null ? "" : DATE_FORMAT.format(date);
  }

  private static String render(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof LocalDate date) {
      return formatDate(date);
    }
    return value.toString();
  }
}
