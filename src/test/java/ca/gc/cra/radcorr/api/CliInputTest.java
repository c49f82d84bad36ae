package ca.gc.cra.radcorr.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"in=/d/a.dat", "--DRY-RUN", "-v", " ", "chunkSize=5"});

    assertArrayEquals(new String[] {"in=/d/a.dat", "chunkSize=5"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void helpAliasesAreNormalized() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).hasFlag("--help"));
  }

  @Test
  void unknownFlagsExcludeHelpVerboseAndSupported() {
    CliInput input = CliInput.parse(new String[] {"--help", "--debug", "--dry-run", "--force"});

    assertEquals(List.of("--force"), input.unknownFlags(Set.of("--dry-run")));
  }

  @Test
  void emptyArgsParse() {
    CliInput input = CliInput.parse(null);
    assertEquals(0, input.keyValueArgs().length);
    assertFalse(input.hasFlag(""));
  }
}
