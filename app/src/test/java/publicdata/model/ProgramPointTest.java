package publicdata.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class ProgramPointTest {

  @Test
  void parseTakesIndexFromLastSeparator() {
    ProgramPoint pp = ProgramPoint.parse("ns::fn:entry:i3");
    assertEquals("ns::fn", pp.function());
    assertEquals("entry", pp.block());
    assertEquals(3, pp.instructionIndex());
    assertEquals("ns::fn:entry:i3", pp.key());
  }

  @Test
  void ordersByInstructionIndexWithinBlock() {
    assertTrue(ProgramPoint.of("f", "b", 2).compareTo(ProgramPoint.of("f", "b", 10)) < 0);
  }

  @Test
  void rejectsMalformedKeys() {
    assertThrows(IllegalArgumentException.class, () -> ProgramPoint.parse("f:b"));
    assertThrows(IllegalArgumentException.class, () -> ProgramPoint.parse("f:b:ix"));
  }
}
