package ca.gc.nrc.pyxis.domain.attribute;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class AttributeValueTest {

  @Test
  void parseInfersKind() {
    assertEquals(AttributeValue.integer(42), AttributeValue.parse("42"));
    assertEquals(AttributeValue.integer(-7), AttributeValue.parse(" -7 "));
    assertEquals(AttributeValue.real(0.027), AttributeValue.parse("0.027"));
    assertEquals(AttributeValue.real(1.5e3), AttributeValue.parse("1.5e3"));
    assertEquals(AttributeValue.text("NACO"), AttributeValue.parse("NACO"));
    assertEquals(AttributeValue.text("1.2.3"), AttributeValue.parse("1.2.3"));
  }

  @Test
  void parseFallsBackToRealForLongDigitRuns() {
    AttributeValue value = AttributeValue.parse("1234567890123456789012");

    assertInstanceOf(AttributeValue.Real.class, value);
  }

  @Test
  void ofMapsBoxedTypes() {
    assertEquals(AttributeKind.INTEGER, AttributeValue.of(3).kind());
    assertEquals(AttributeKind.REAL, AttributeValue.of(3.0f).kind());
    assertEquals(AttributeKind.TEXT, AttributeValue.of(true).kind());
  }

  @Test
  void numericViews() {
    assertEquals(2.5, AttributeValue.text("2.5").asDouble());
    assertEquals(2, AttributeValue.real(2.9).asLong());
    assertEquals("12", AttributeValue.integer(12).asText());
    assertThrows(IllegalStateException.class, () -> AttributeValue.text("abc").asDouble());
  }
}
