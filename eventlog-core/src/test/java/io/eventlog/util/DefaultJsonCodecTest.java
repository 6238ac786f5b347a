package io.eventlog.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultJsonCodecTest {

  private final JsonCodec codec = JsonCodec.getDefault();

  @Test
  void toJsonWithEmptyMapReturnsNull() {
    assertNull(codec.toJson(Map.of()));
    assertNull(codec.toJson(null));
  }

  @Test
  void toJsonKeepsInsertionOrder() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("correlationId", "c-1");
    map.put("userId", "u-7");

    assertEquals("{\"correlationId\":\"c-1\",\"userId\":\"u-7\"}", codec.toJson(map));
  }

  @Test
  void toJsonEscapesControlCharacters() {
    String json = codec.toJson(Map.of("msg", "say \"hi\"\n\\\u0001"));

    assertEquals("{\"msg\":\"say \\\"hi\\\"\\n\\\\\\u0001\"}", json);
  }

  @Test
  void parseObjectReturnsEmptyMapForAbsentInput() {
    assertTrue(codec.parseObject(null).isEmpty());
    assertTrue(codec.parseObject("  ").isEmpty());
    assertTrue(codec.parseObject("null").isEmpty());
    assertTrue(codec.parseObject("{ }").isEmpty());
  }

  @Test
  void parseObjectReadsEscapesAndSkipsNulls() {
    Map<String, String> parsed = codec.parseObject(
        "{ \"a\" : \"x\\ty\", \"b\": null, \"c\":\"\\u00e9\\/\" }");

    assertEquals(2, parsed.size());
    assertEquals("x\ty", parsed.get("a"));
    assertEquals("\u00e9/", parsed.get("c"));
    assertFalse(parsed.containsKey("b"));
  }

  @Test
  void parseObjectRejectsMalformedInput() {
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("[1,2]"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":1}"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"b\"} extra"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"unterminated}"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"\\q\"}"));
  }

  @Test
  void encodedMetadataParsesBack() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("k\"ey", "va\\lue\r\n");
    map.put("unicode", "\u4e2d\u6587");

    assertEquals(map, codec.parseObject(codec.toJson(map)));
  }
}
