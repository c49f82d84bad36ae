package ca.gc.cra.radcorr.infrastructure.header;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.radcorr.domain.header.HeaderField;
import ca.gc.cra.radcorr.domain.header.HeaderFields;
import ca.gc.cra.radcorr.domain.header.HeaderSyntaxException;
import java.util.List;
import org.junit.jupiter.api.Test;

class EnviHeaderParserTest {
  private final EnviHeaderParser parser = new EnviHeaderParser();

  @Test
  void parsesTypicalHeader() throws Exception {
    HeaderFields fields = parser.parse("""
        ENVI
        description = {Radiance [mW/(cm^2*sr*um)] * 1000.0]}
        Samples = 640
        lines   = 480
        bands = 3
        file type = ENVI Standard
        wavelength units = Nanometers
        """);

    assertEquals(new HeaderField.IntegerValue(640), fields.get("samples").orElseThrow());
    assertEquals(new HeaderField.IntegerValue(480), fields.get("LINES").orElseThrow());
    assertEquals(new HeaderField.TextValue("ENVI Standard"), fields.get("file type").orElseThrow());
    assertEquals(
        new HeaderField.TextValue("Radiance [mW/(cm^2*sr*um)] * 1000.0]"),
        fields.get("description").orElseThrow());
    assertEquals(6, fields.size());
  }

  @Test
  void multiLineListWithBlankLinesMatchesSingleLineForm() throws Exception {
    HeaderFields multi = parser.parse("""
        wavelength = {
         400.0, 410.5,

         420.25
        ,430.0 }
        """);
    HeaderFields single = parser.parse("wavelength = {400.0, 410.5, 420.25, 430.0}\n");

    assertEquals(single.get("wavelength"), multi.get("wavelength"));
    HeaderField.FloatListValue list =
        assertInstanceOf(HeaderField.FloatListValue.class, multi.get("wavelength").orElseThrow());
    assertEquals(List.of(400.0, 410.5, 420.25, 430.0), list.values());
  }

  @Test
  void singleElementMultiLineListStaysAList() throws Exception {
    HeaderFields fields = parser.parse("wavelength = {\n 550.0}\n");

    assertEquals(new HeaderField.FloatListValue(List.of(550.0)), fields.get("wavelength").orElseThrow());
  }

  @Test
  void commaTakesPrecedenceOverIntegerParse() throws Exception {
    HeaderFields fields = parser.parse("bands = 1,2\n");

    assertInstanceOf(HeaderField.FloatListValue.class, fields.get("bands").orElseThrow());
  }

  @Test
  void lastAssignmentWins() throws Exception {
    HeaderFields fields = parser.parse("samples = 2\nsamples = 5\n");

    assertEquals(new HeaderField.IntegerValue(5), fields.get("samples").orElseThrow());
  }

  @Test
  void crlfLineEndingsAreAccepted() throws Exception {
    HeaderFields fields = parser.parse("ENVI\r\nsamples = 2\r\nwavelength = {\r\n 1,\r\n 2}\r\n");

    assertEquals(new HeaderField.IntegerValue(2), fields.get("samples").orElseThrow());
    assertEquals(new HeaderField.FloatListValue(List.of(1.0, 2.0)), fields.get("wavelength").orElseThrow());
  }

  @Test
  void lineWithoutEqualsIsRejectedWithLineNumber() {
    HeaderSyntaxException ex = assertThrows(HeaderSyntaxException.class,
        () -> parser.parse("ENVI\nsamples = 2\nbogus line\n"));

    assertEquals(3, ex.lineNumber());
    assertTrue(ex.getMessage().contains("missing '='"));
  }

  @Test
  void magicIsOnlySkippedOnFirstContentLine() {
    HeaderSyntaxException ex = assertThrows(HeaderSyntaxException.class,
        () -> parser.parse("samples = 2\nENVI\n"));

    assertEquals(2, ex.lineNumber());
  }

  @Test
  void unterminatedListReportsOpeningLine() {
    HeaderSyntaxException ex = assertThrows(HeaderSyntaxException.class,
        () -> parser.parse("ENVI\nbands = 2\nwavelength = {\n 400,\n 500\n"));

    assertEquals(3, ex.lineNumber());
    assertTrue(ex.getMessage().contains("wavelength"));
  }

  @Test
  void emptyTextYieldsNoFields() throws Exception {
    assertEquals(0, parser.parse("\n\n").size());
  }
}
