package io.lrma.longsplit.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lrma.longsplit.domain.split.ArrayElementStructure;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ModelsCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void describesNamedModel() {
    ExitCode code = ModelsCli.run(new String[] {"name=mas10"});

    assertEquals(ExitCode.SUCCESS, code);
    String text = buffer.toString();
    assertTrue(text.startsWith("mas10: 11 elements"));
    assertTrue(text.contains("  0  Q 10x_Adapter random Poly_A 3p_Adapter"));
    assertTrue(text.contains(" 10  R"));
  }

  @Test
  void validatesTemplateFile() throws IOException {
    Path template = Files.writeString(tempDir.resolve("two.yaml"), "elements:\n  - [A, B]\n  - [C]\n");

    ExitCode code = ModelsCli.run(new String[] {"templateFile=" + template});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("2 elements"));
  }

  @Test
  void invalidTemplateIsConfigError() throws IOException {
    Path template = Files.writeString(tempDir.resolve("bad.yaml"), "layout: []\n");

    assertEquals(ExitCode.CONFIG_ERROR, ModelsCli.run(new String[] {"templateFile=" + template}));
  }

  @Test
  void unknownModelIsConfigError() {
    assertEquals(ExitCode.CONFIG_ERROR, ModelsCli.run(new String[] {"name=mas99"}));
  }

  @Test
  void nameAndTemplateTogetherAreInvalid() {
    ExitCode code = ModelsCli.run(new String[] {"name=mas15", "templateFile=x.yaml"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: models"));
  }

  @Test
  void describeNumbersElements() {
    ArrayElementStructure structure = ArrayElementStructure.of(List.of(List.of("A", "B"), List.of("C")));

    assertArrayEquals(
        new String[] {"demo: 2 elements", "  0  A B", "  1  C"},
        ModelsCli.describe("demo", structure));
  }
}
