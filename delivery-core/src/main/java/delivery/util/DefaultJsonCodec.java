package delivery.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dependency-free {@link JsonCodec} for flat payload records.
 *
 * <p>Accessible via {@link JsonCodec#getDefault()}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, ?> record) {
    if (record == null) {
      throw new IllegalArgumentException("record must not be null");
    }
    StringBuilder sb = new StringBuilder();
    appendObject(sb, record, true);
    return sb.toString();
  }

  private static void appendObject(StringBuilder sb, Map<?, ?> map, boolean allowNesting) {
    sb.append('{');
    boolean first = true;
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException("record keys must be non-null strings");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      sb.append('"').append(escape(key)).append("\":");
      Object value = entry.getValue();
      if (value == null) {
        sb.append("null");
      } else if (value instanceof String s) {
        sb.append('"').append(escape(s)).append('"');
      } else if (value instanceof Integer || value instanceof Long) {
        sb.append(value);
      } else if (value instanceof Boolean b) {
        sb.append(b.booleanValue());
      } else if (allowNesting && value instanceof Map<?, ?> nested) {
        for (Object nestedValue : nested.values()) {
          if (nestedValue != null && !(nestedValue instanceof String)) {
            throw new IllegalArgumentException("nested values must be strings: " + key);
          }
        }
        appendObject(sb, nested, false);
      } else {
        throw new IllegalArgumentException(
            "Unsupported value type for " + key + ": " + value.getClass().getName());
      }
    }
    sb.append('}');
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (json == null) {
      throw new IllegalArgumentException("Expected JSON object, got null");
    }
    Parser parser = new Parser(json);
    parser.skipWhitespace();
    Map<String, Object> result = parser.readObject(true);
    parser.skipWhitespace();
    if (!parser.atEnd()) {
      throw new IllegalArgumentException("Trailing content after JSON object");
    }
    return result;
  }

  private static final class Parser {
    private final String input;
    private int idx;

    Parser(String input) {
      this.input = input;
    }

    boolean atEnd() {
      return idx >= input.length();
    }

    void skipWhitespace() {
      while (idx < input.length()) {
        char c = input.charAt(idx);
        if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
          break;
        }
        idx++;
      }
    }

    char peekChar() {
      if (atEnd()) {
        throw new IllegalArgumentException("Unexpected end of JSON");
      }
      return input.charAt(idx);
    }

    void expect(char c) {
      if (peekChar() != c) {
        throw new IllegalArgumentException("Expected '" + c + "' at offset " + idx);
      }
      idx++;
    }

    Map<String, Object> readObject(boolean allowNesting) {
      expect('{');
      Map<String, Object> result = new LinkedHashMap<>();
      skipWhitespace();
      if (peekChar() == '}') {
        idx++;
        return result;
      }
      while (true) {
        skipWhitespace();
        String key = readString();
        skipWhitespace();
        expect(':');
        skipWhitespace();
        Object value = readValue(allowNesting);
        if (value != null) {
          result.put(key, value);
        }
        skipWhitespace();
        char next = peekChar();
        idx++;
        if (next == '}') {
          return result;
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or '}' at offset " + (idx - 1));
        }
      }
    }

    Object readValue(boolean allowNesting) {
      char c = peekChar();
      if (c == '"') {
        return readString();
      }
      if (c == '{') {
        if (!allowNesting) {
          throw new IllegalArgumentException("Nested objects are limited to one level");
        }
        Map<String, Object> nested = readObject(false);
        Map<String, String> strings = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : nested.entrySet()) {
          if (!(e.getValue() instanceof String s)) {
            throw new IllegalArgumentException("Nested values must be strings: " + e.getKey());
          }
          strings.put(e.getKey(), s);
        }
        return strings;
      }
      if (input.startsWith("null", idx)) {
        idx += 4;
        return null;
      }
      if (input.startsWith("true", idx)) {
        idx += 4;
        return Boolean.TRUE;
      }
      if (input.startsWith("false", idx)) {
        idx += 5;
        return Boolean.FALSE;
      }
      if (c == '-' || (c >= '0' && c <= '9')) {
        return readLong();
      }
      throw new IllegalArgumentException("Unexpected character '" + c + "' at offset " + idx);
    }

    Long readLong() {
      int start = idx;
      if (input.charAt(idx) == '-') {
        idx++;
      }
      while (idx < input.length() && Character.isDigit(input.charAt(idx))) {
        idx++;
      }
      String digits = input.substring(start, idx);
      try {
        return Long.parseLong(digits);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid integer: " + digits, e);
      }
    }

    String readString() {
      expect('"');
      StringBuilder sb = new StringBuilder();
      while (idx < input.length()) {
        char c = input.charAt(idx);
        if (c == '"') {
          idx++;
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          idx++;
          continue;
        }
        if (idx + 1 >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char next = input.charAt(idx + 1);
        switch (next) {
          case '"', '\\', '/' -> sb.append(next);
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> {
            if (idx + 5 >= input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            String hex = input.substring(idx + 2, idx + 6);
            int code = 0;
            for (int i = 0; i < hex.length(); i++) {
              char h = hex.charAt(i);
              // ASCII only: Character.digit also accepts other scripts' digits
              int digit = h < 0x80 ? Character.digit(h, 16) : -1;
              if (digit < 0) {
                throw new IllegalArgumentException("Invalid unicode escape: \\u" + hex);
              }
              code = (code << 4) | digit;
            }
            sb.append((char) code);
            idx += 4;
          }
          default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
        }
        idx += 2;
      }
      throw new IllegalArgumentException("Unterminated string");
    }
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 8);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.toString();
  }
}
