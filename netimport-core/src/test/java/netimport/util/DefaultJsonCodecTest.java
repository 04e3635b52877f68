package netimport.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultJsonCodecTest {

  private final JsonCodec codec = JsonCodec.getDefault();

  @Test
  void emptyOrNullMapBecomesEmptyObject() {
    assertEquals("{}", codec.toJson(Map.of()));
    assertEquals("{}", codec.toJson(null));
  }

  @Test
  void preservesEntryOrder() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("inventory", "nautobot");
    map.put("credentials", "lab");
    map.put("option.main.nbr_workers", "4");

    String json = codec.toJson(map);

    assertEquals("{\"inventory\":\"nautobot\",\"credentials\":\"lab\",\"option.main.nbr_workers\":\"4\"}", json);
    assertEquals(map, codec.parseObject(json));
  }

  @Test
  void escapesControlAndQuoteCharacters() {
    String json = codec.toJson(Map.of("msg", "say \"hi\"\n\tnow\\"));

    assertTrue(json.contains("\\\"hi\\\""));
    assertTrue(json.contains("\\n"));
    assertTrue(json.contains("\\t"));
    assertEquals("say \"hi\"\n\tnow\\", codec.parseObject(json).get("msg"));
  }

  @Test
  void parseDropsNullMembers() {
    Map<String, String> parsed = codec.parseObject("{ \"a\" : \"1\", \"b\": null }");

    assertEquals(Map.of("a", "1"), parsed);
  }

  @Test
  void parseUnicodeEscape() {
    assertEquals("é", codec.parseObject("{\"k\":\"\\u00e9\"}").get("k"));
  }

  @Test
  void parseBlankOrNullLiteralIsEmpty() {
    assertTrue(codec.parseObject(null).isEmpty());
    assertTrue(codec.parseObject("  ").isEmpty());
    assertTrue(codec.parseObject("null").isEmpty());
    assertTrue(codec.parseObject("{}").isEmpty());
  }

  @Test
  void parseRejectsMalformedInput() {
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("[1,2]"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":1}"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"1\"} x"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"unterminated}"));
  }

  @Test
  void toJsonRejectsNullKey() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put(null, "x");
    assertThrows(IllegalArgumentException.class, () -> codec.toJson(map));
  }
}
