package membership.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultJsonCodecTest {

  private final JsonCodec codec = JsonCodec.getDefault();

  @Test
  void emptyOrNullMapEncodesAsEmptyObject() {
    assertEquals("{}", codec.toJson(Map.of()));
    assertEquals("{}", codec.toJson(null));
  }

  @Test
  void toJsonKeepsEntryOrder() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("email", "a@x.com");
    map.put("attempts", "3");

    assertEquals("{\"email\":\"a@x.com\",\"attempts\":\"3\"}", codec.toJson(map));
  }

  @Test
  void toJsonEscapesSpecialCharacters() {
    String json = codec.toJson(Map.of("msg", "Say \"hi\"\n\\\u0001"));

    assertEquals("{\"msg\":\"Say \\\"hi\\\"\\n\\\\\\u0001\"}", json);
  }

  @Test
  void toJsonWritesNullValues() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("error", null);

    assertEquals("{\"error\":null}", codec.toJson(map));
  }

  @Test
  void toJsonWithNullKeyThrows() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put(null, "value");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> codec.toJson(map));
    assertTrue(ex.getMessage().contains("null keys"));
  }

  @Test
  void parseObjectReadsWhatToJsonWrites() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("note", "line1\nline2\t\"quoted\"");
    map.put("groups", "a@x.com,b@x.com");

    assertEquals(map, codec.parseObject(codec.toJson(map)));
  }

  @Test
  void parseObjectHandlesWhitespaceUnicodeAndNulls() {
    Map<String, String> parsed = codec.parseObject(" { \"a\" : \"\\u00e9\" , \"b\" : null } ");

    assertEquals(Map.of("a", "\u00e9"), parsed);
  }

  @Test
  void parseObjectOfBlankOrNullIsEmpty() {
    assertTrue(codec.parseObject(null).isEmpty());
    assertTrue(codec.parseObject("  ").isEmpty());
    assertTrue(codec.parseObject("null").isEmpty());
    assertTrue(codec.parseObject("{}").isEmpty());
  }

  @Test
  void parseObjectRejectsMalformedInput() {
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("[1,2]"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"b\""));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":1}"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"b\"} extra"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"\\x\"}"));
  }
}
