package ca.gc.cra.pulse.domain.repr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class AttrTest {

  @Test
  void ofNullableDistinguishesPresentFromAbsent() {
    assertTrue(Attr.ofNullable("x").isPresent());
    assertTrue(Attr.ofNullable(null).isAbsent());
    assertEquals(Attr.<String>absent(), Attr.ofNullable(null));
    assertEquals(Attr.absent().hashCode(), Attr.ofNullable(null).hashCode());
  }

  @Test
  void unrepresentableKeepsTypeName() {
    Attr<String> attr = Attr.unrepresentable("Socket");

    assertTrue(attr.isUnrepresentable());
    assertEquals("Socket", attr.typeName());
    assertEquals("fallback", attr.orElse("fallback"));
    assertThrows(NoSuchElementException.class, attr::value);
    assertNotEquals(Attr.absent(), attr);
  }

  @Test
  void absentValueThrows() {
    NoSuchElementException ex = assertThrows(NoSuchElementException.class, () -> Attr.absent().value());

    assertEquals("attribute is ABSENT", ex.getMessage());
  }
}
