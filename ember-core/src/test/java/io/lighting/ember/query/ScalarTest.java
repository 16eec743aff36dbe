package io.lighting.ember.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ScalarTest {

    @Test
    void picksVariantFromJavaType() {
        assertEquals(new Scalar.IntValue(3), Scalar.of((Object) 3));
        assertEquals(new Scalar.FloatValue(1.5), Scalar.of((Object) 1.5f));
        assertEquals(new Scalar.TextValue("x"), Scalar.of((Object) new StringBuilder("x")));
        assertThrows(IllegalArgumentException.class, () -> Scalar.of((Object) BigDecimal.ONE));
        assertThrows(IllegalArgumentException.class, () -> Scalar.of((Object) null));
    }

    @Test
    void nullableVariantsConvertToOptional() {
        assertEquals(Optional.empty(), new Scalar.NullInt(null).toOptional());
        assertEquals(Optional.of(new Scalar.IntValue(4)), new Scalar.NullInt(4L).toOptional());
        assertTrue(new Scalar.NullText(null).isNull());
    }

    @Test
    void reportsSupportedJavaTypes() {
        assertTrue(Scalar.supports(int.class));
        assertTrue(Scalar.supports(Double.class));
        assertTrue(Scalar.supports(String.class));
        assertFalse(Scalar.supports(boolean.class));
        assertFalse(Scalar.supports(BigDecimal.class));
        assertFalse(Scalar.supports(null));
    }

    @Test
    void rendersSqlLiterals() {
        assertEquals("'it''s'", Scalar.of("it's").sqlLiteral());
        assertEquals("42", Scalar.of(42).sqlLiteral());
        assertEquals("NULL", new Scalar.NullFloat(null).sqlLiteral());
    }
}
