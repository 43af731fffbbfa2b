package ca.gc.nrc.pyxis.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void separatesFlagsFromKeyValueArguments() {
    CliInput input = CliInput.parse(new String[] {"workDir=/tmp/x", "--DRY-RUN", "-v", "recipe=r.yaml"});

    assertArrayEquals(new String[] {"workDir=/tmp/x", "recipe=r.yaml"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void helpAliasesAreRecognised() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertFalse(CliInput.parse(null).help());
  }

  @Test
  void unknownFlagsExcludeHelpVerboseAndAllowed() {
    CliInput input = CliInput.parse(new String[] {"--help", "--verbose", "--dry-run", "--fast"});

    assertEquals(Set.of("--fast"), input.unknownFlags(Set.of("--dry-run")));
  }

  @Test
  void keyValueArgsReturnsCopy() {
    CliInput input = CliInput.parse(new String[] {"a=1"});
    input.keyValueArgs()[0] = "b=2";

    assertEquals("a=1", input.keyValueArgs()[0]);
  }
}
