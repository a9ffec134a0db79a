package ca.gc.cra.relay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("relay.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
          logLevel: WARN
        publish:
          bind: 0.0.0.0:7000
          channelCapacity: 64
        subscribe:
          connect: 127.0.0.1:7000
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "publish").orElseThrow();

    assertEquals("none", map.get("metricsExporter"));
    assertEquals("WARN", map.get("logLevel"));
    assertEquals("0.0.0.0:7000", map.get("bind"));
    assertEquals("64", map.get("channelCapacity"));
    assertFalse(map.containsKey("connect"));
  }

  @Test
  void modeSectionOverridesCommon() throws IOException {
    Path yaml = tempDir.resolve("override.yaml");
    Files.writeString(yaml, """
        common:
          logLevel: INFO
        subscribe:
          logLevel: DEBUG
        """);

    assertEquals("DEBUG", YamlConfigLoader.load(yaml, "subscribe").orElseThrow().get("logLevel"));
  }

  @Test
  void topicListJoinsWithCommas() throws IOException {
    Path yaml = tempDir.resolve("topics.yaml");
    Files.writeString(yaml, """
        subscribe:
          topics:
            - orders.*
            - audit
        """);

    assertEquals("orders.*,audit", YamlConfigLoader.load(yaml, "subscribe").orElseThrow().get("topics"));
  }

  @Test
  void missingFileIsEmpty() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "publish");

    assertTrue(result.isEmpty());
  }

  @Test
  void rejectsNonMappingSection() throws IOException {
    Path yaml = tempDir.resolve("bad.yaml");
    Files.writeString(yaml, """
        publish: just-a-string
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "publish"));
  }

  @Test
  void rejectsMalformedYaml() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "publish: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "publish"));
  }

  @Test
  void rejectsArbitraryTypeTags() throws IOException {
    Path yaml = tempDir.resolve("tagged.yaml");
    Files.writeString(yaml, """
        publish: !!java.io.File
          path: /tmp
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "publish"));
  }
}
