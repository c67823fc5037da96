package org.apache.arrow.ballista.config;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class BallistaConfigTest {

  @Test
  void testDefaults() {
    BallistaConfig config = BallistaConfig.defaults();

    assertEquals(
        Path.of(System.getProperty("java.io.tmpdir"), "ballista"), config.shuffle().workDir());
    assertTrue(config.shuffle().syncOnFinish());
    assertFalse(config.shuffle().overwriteExisting());
    assertEquals(ShuffleOptions.DEFAULT_DATA_FILE_NAME, config.shuffle().dataFileName());
    assertEquals(DisplayOptions.defaults(), config.display());
  }

  @Test
  void testBuilderAndStringMapAgree() {
    BallistaConfig typed =
        BallistaConfig.builder()
            .shuffle(
                ShuffleOptions.builder()
                    .workDir(Path.of("/var/lib/ballista"))
                    .syncOnFinish(false)
                    .overwriteExisting(true)
                    .dataFileName("part.arrow")
                    .build())
            .display(new DisplayOptions(80, "    "))
            .build();

    BallistaConfig parsed =
        BallistaConfig.fromStringMap(
            Map.of(
                "ballista.shuffle.work_dir", "/var/lib/ballista",
                "ballista.shuffle.sync_on_finish", "false",
                "ballista.shuffle.overwrite_existing", "TRUE",
                "ballista.shuffle.data_file_name", "part.arrow",
                "ballista.display.max_description_length", "80",
                "ballista.display.indent_width", "4"));

    assertEquals(typed.shuffle(), parsed.shuffle());
    assertEquals(typed.display(), parsed.display());
    assertEquals(typed.toOptionsMap(), parsed.toOptionsMap());
    assertEquals(
        typed.toOptionsMap(), BallistaConfig.fromStringMap(typed.toOptionsMap()).toOptionsMap());
  }

  @Test
  void testIndentSurvivesOptionsMap() {
    BallistaConfig tabs = BallistaConfig.builder().display(new DisplayOptions(60, "\t")).build();

    Map<String, String> options = tabs.toOptionsMap();
    assertEquals("\t", options.get("ballista.display.indent"));
    assertEquals(new DisplayOptions(60, "\t"), BallistaConfig.fromStringMap(options).display());

    assertEquals(
        "   ",
        BallistaConfig.fromStringMap(Map.of("ballista.display.indent_width", "3"))
            .display()
            .indent());
  }

  @Test
  void testPartitionFile() {
    ShuffleOptions options = ShuffleOptions.builder().workDir(Path.of("/work")).build();
    assertEquals(Path.of("/work/job-1/2/3/data.arrow"), options.partitionFile("job-1", 2, 3));
  }

  @Test
  void testUnknownKeys() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> BallistaConfig.fromStringMap(Map.of("ballista.shuffle.compression", "zstd")));
    assertTrue(e.getMessage().contains("ballista.shuffle.compression"), e.getMessage());

    assertThrows(
        IllegalArgumentException.class,
        () -> BallistaConfig.fromStringMap(Map.of("datafusion.batch_size", "1024")));
  }

  @Test
  void testInvalidValues() {
    assertThrows(
        IllegalArgumentException.class,
        () -> BallistaConfig.fromStringMap(Map.of("ballista.shuffle.sync_on_finish", "yes")));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            BallistaConfig.fromStringMap(
                Map.of("ballista.display.max_description_length", "lots")));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            BallistaConfig.fromStringMap(Map.of("ballista.display.max_description_length", "0")));
  }
}
