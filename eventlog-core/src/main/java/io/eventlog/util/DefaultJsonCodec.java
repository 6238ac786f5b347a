package io.eventlog.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dependency-free {@link JsonCodec} for flat {@code {"key":"value"}} objects.
 *
 * <p>{@code null} values are skipped on parse since event metadata never holds them.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> values) {
    if (values == null || values.isEmpty()) {
      return null;
    }
    StringBuilder out = new StringBuilder(values.size() * 16).append('{');
    String separator = "";
    for (Map.Entry<String, String> entry : values.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("metadata cannot contain null keys");
      }
      out.append(separator);
      separator = ",";
      writeString(out, entry.getKey());
      out.append(':');
      if (entry.getValue() == null) {
        out.append("null");
      } else {
        writeString(out, entry.getValue());
      }
    }
    return out.append('}').toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (json == null || json.isBlank() || "null".equals(json.trim())) {
      return Collections.emptyMap();
    }
    Cursor cursor = new Cursor(json);
    cursor.expect('{');
    Map<String, String> result = new LinkedHashMap<>();
    if (cursor.consumeIf('}')) {
      cursor.expectEnd();
      return result;
    }
    do {
      String key = cursor.readString();
      cursor.expect(':');
      if (cursor.consumeLiteral("null")) {
        continue;
      }
      result.put(key, cursor.readString());
    } while (cursor.consumeIf(','));
    cursor.expect('}');
    cursor.expectEnd();
    return result;
  }

  private static void writeString(StringBuilder out, String value) {
    out.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> out.append("\\\"");
        case '\\' -> out.append("\\\\");
        case '\n' -> out.append("\\n");
        case '\r' -> out.append("\\r");
        case '\t' -> out.append("\\t");
        case '\b' -> out.append("\\b");
        case '\f' -> out.append("\\f");
        default -> {
          if (c < 0x20) {
            out.append(String.format("\\u%04x", (int) c));
          } else {
            out.append(c);
          }
        }
      }
    }
    out.append('"');
  }

  /** Single-pass reader over the input; every method skips leading whitespace. */
  private static final class Cursor {
    private final String input;
    private int pos;

    private Cursor(String input) {
      this.input = input;
    }

    void expect(char expected) {
      skipWhitespace();
      if (pos >= input.length() || input.charAt(pos) != expected) {
        throw new IllegalArgumentException("Expected '" + expected + "' at offset " + pos);
      }
      pos++;
    }

    boolean consumeIf(char candidate) {
      skipWhitespace();
      if (pos < input.length() && input.charAt(pos) == candidate) {
        pos++;
        return true;
      }
      return false;
    }

    boolean consumeLiteral(String literal) {
      skipWhitespace();
      if (input.startsWith(literal, pos)) {
        pos += literal.length();
        return true;
      }
      return false;
    }

    void expectEnd() {
      skipWhitespace();
      if (pos != input.length()) {
        throw new IllegalArgumentException("Trailing content at offset " + pos);
      }
    }

    String readString() {
      expect('"');
      StringBuilder sb = new StringBuilder();
      while (pos < input.length()) {
        char c = input.charAt(pos++);
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        if (pos >= input.length()) {
          break;
        }
        char escaped = input.charAt(pos++);
        switch (escaped) {
          case '"', '\\', '/' -> sb.append(escaped);
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'u' -> sb.append(readUnicodeEscape());
          default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + escaped);
        }
      }
      throw new IllegalArgumentException("Unterminated string");
    }

    private char readUnicodeEscape() {
      if (pos + 4 > input.length()) {
        throw new IllegalArgumentException("Invalid unicode escape");
      }
      try {
        char decoded = (char) Integer.parseInt(input.substring(pos, pos + 4), 16);
        pos += 4;
        return decoded;
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid unicode escape", e);
      }
    }

    private void skipWhitespace() {
      while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
        pos++;
      }
    }
  }
}
