package membership.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dependency-free {@link JsonCodec} for flat string objects.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> values) {
    if (values == null || values.isEmpty()) {
      return "{}";
    }
    StringBuilder sb = new StringBuilder("{");
    for (Map.Entry<String, String> entry : values.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("JSON object cannot contain null keys");
      }
      if (sb.length() > 1) {
        sb.append(',');
      }
      quote(sb, entry.getKey());
      sb.append(':');
      if (entry.getValue() == null) {
        sb.append("null");
      } else {
        quote(sb, entry.getValue());
      }
    }
    return sb.append('}').toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (json == null || json.isBlank() || "null".equals(json.trim())) {
      return Collections.emptyMap();
    }
    return new Reader(json).readObject();
  }

  private static void quote(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    sb.append('"');
  }

  /** Cursor over the input text. */
  private static final class Reader {
    private final String text;
    private int pos;

    Reader(String text) {
      this.text = text;
    }

    Map<String, String> readObject() {
      expect('{');
      Map<String, String> result = new LinkedHashMap<>();
      if (peek() == '}') {
        pos++;
        return finish(result);
      }
      while (true) {
        String key = readString();
        expect(':');
        if (text.startsWith("null", skipWhitespace())) {
          pos += 4;
        } else {
          result.put(key, readString());
        }
        char next = peek();
        pos++;
        if (next == '}') {
          return finish(result);
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or '}' at position " + (pos - 1));
        }
      }
    }

    private Map<String, String> finish(Map<String, String> result) {
      if (skipWhitespace() != text.length()) {
        throw new IllegalArgumentException("Unexpected content after JSON object");
      }
      return result;
    }

    private String readString() {
      expect('"');
      StringBuilder sb = new StringBuilder();
      while (pos < text.length()) {
        char c = text.charAt(pos++);
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        if (pos >= text.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char escaped = text.charAt(pos++);
        switch (escaped) {
          case '"', '\\', '/' -> sb.append(escaped);
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> {
            if (pos + 4 > text.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(text.substring(pos, pos + 4), 16));
            } catch (NumberFormatException e) {
              throw new IllegalArgumentException("Invalid unicode escape", e);
            }
            pos += 4;
          }
          default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + escaped);
        }
      }
      throw new IllegalArgumentException("Unterminated string");
    }

    private void expect(char expected) {
      if (peek() != expected) {
        throw new IllegalArgumentException("Expected '" + expected + "' at position " + pos);
      }
      pos++;
    }

    private char peek() {
      skipWhitespace();
      if (pos >= text.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON");
      }
      return text.charAt(pos);
    }

    private int skipWhitespace() {
      while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
      return pos;
    }
  }
}
