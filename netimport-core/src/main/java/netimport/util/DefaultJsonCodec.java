package netimport.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Minimal {@link JsonCodec} for flat string-to-string objects.
 */
final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  private DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> values) {
    StringBuilder out = new StringBuilder("{");
    if (values != null) {
      String separator = "";
      for (Map.Entry<String, String> entry : values.entrySet()) {
        if (entry.getKey() == null) {
          throw new IllegalArgumentException("null keys are not supported");
        }
        out.append(separator);
        quote(out, entry.getKey()).append(':');
        if (entry.getValue() == null) {
          out.append("null");
        } else {
          quote(out, entry.getValue());
        }
        separator = ",";
      }
    }
    return out.append('}').toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    Map<String, String> result = new LinkedHashMap<>();
    if (json == null || json.isBlank() || "null".equals(json.trim())) {
      return result;
    }
    Cursor cursor = new Cursor(json);
    cursor.expect('{');
    if (cursor.tryConsume('}')) {
      cursor.expectEnd();
      return result;
    }
    do {
      String key = cursor.readString();
      cursor.expect(':');
      if (cursor.tryConsumeLiteral("null")) {
        continue;
      }
      result.put(key, cursor.readString());
    } while (cursor.tryConsume(','));
    cursor.expect('}');
    cursor.expectEnd();
    return result;
  }

  private static StringBuilder quote(StringBuilder out, String value) {
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
    return out.append('"');
  }

  private static final class Cursor {
    private final String text;
    private int pos;

    Cursor(String text) {
      this.text = text;
    }

    void skipWhitespace() {
      while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
    }

    boolean tryConsume(char c) {
      skipWhitespace();
      if (pos < text.length() && text.charAt(pos) == c) {
        pos++;
        return true;
      }
      return false;
    }

    boolean tryConsumeLiteral(String literal) {
      skipWhitespace();
      if (text.startsWith(literal, pos)) {
        pos += literal.length();
        return true;
      }
      return false;
    }

    void expect(char c) {
      if (!tryConsume(c)) {
        throw error("expected '" + c + "'");
      }
    }

    void expectEnd() {
      skipWhitespace();
      if (pos != text.length()) {
        throw error("trailing characters");
      }
    }

    String readString() {
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
          break;
        }
        char esc = text.charAt(pos++);
        switch (esc) {
          case '"', '\\', '/' -> sb.append(esc);
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'u' -> {
            if (pos + 4 > text.length()) {
              throw error("truncated unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(text.substring(pos, pos + 4), 16));
            } catch (NumberFormatException e) {
              throw new IllegalArgumentException("Invalid unicode escape at " + pos, e);
            }
            pos += 4;
          }
          default -> throw error("unsupported escape \\" + esc);
        }
      }
      throw error("unterminated string");
    }

    IllegalArgumentException error(String what) {
      return new IllegalArgumentException("Invalid JSON object (" + what + ") at offset " + pos);
    }
  }
}
