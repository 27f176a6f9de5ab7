package membership.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TemplateExpanderTest {

  @Test
  void expandsPlaceholders() {
    Map<String, Object> fields = Map.of("First", "Ann", "Expires", LocalDate.of(2026, 3, 7), "Period", 2);

    assertEquals("Hi Ann, your 2 year term ends 3/7/2026.",
        TemplateExpander.expand("Hi {First}, your {Period} year term ends {Expires}.", fields));
  }

  @Test
  void missingOrNullFieldsRenderEmpty() {
    Map<String, Object> fields = new HashMap<>();
    fields.put("Renewed On", null);

    assertEquals("[] []", TemplateExpander.expand("[{Renewed On}] [{Unknown}]", fields));
  }

  @Test
  void replacementTextIsLiteral() {
    assertEquals("cost $5 \\o/", TemplateExpander.expand("cost {Price}", Map.of("Price", "$5 \\o/")));
  }

  @Test
  void nullOrEmptyTemplateIsEmpty() {
    assertEquals("", TemplateExpander.expand(null, Map.of()));
    assertEquals("", TemplateExpander.expand("", Map.of()));
  }

  @Test
  void formatDateUsesMonthDayYear() {
    assertEquals("12/25/2025", TemplateExpander.formatDate(LocalDate.of(2025, 12, 25)));
    assertEquals("", TemplateExpander.formatDate(null));
  }
}
