package io.lighting.ember.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class QueryTest {

    private static Query twoValues() {
        return QueryBuilder.create()
            .col("a").eq(null)
            .and("b").eq(null)
            .build()
            .orElseThrow();
    }

    @Test
    void setValuesReplacesPreviousValues() {
        Query query = twoValues();

        query.setValues(Scalar.of(1), Scalar.of(2));
        query.setValues(Scalar.of("c"), Scalar.of("d"));

        assertEquals(List.of(Scalar.of("c"), Scalar.of("d")), query.values());
        assertTrue(query.missingValues().isEmpty());
    }

    @Test
    void setValueIsOneBased() {
        Query query = twoValues();

        query.setValue(2, Scalar.of(7));

        assertEquals(Scalar.of(7), query.values().get(1));
        assertEquals(List.of(1), query.missingValues());
    }

    @Test
    void setValueOutOfRangeThrows() {
        Query query = twoValues();

        IndexOutOfBoundsException error =
            assertThrows(IndexOutOfBoundsException.class, () -> query.setValue(3, Scalar.of(1)));
        assertEquals("Query value index 3 out of range 1..2", error.getMessage());
        assertThrows(IndexOutOfBoundsException.class, () -> query.setValue(0, Scalar.of(1)));
    }

    @Test
    void limitAndOffsetCanBeChangedAndCleared() {
        Query query = twoValues();

        query.setLimit(5).setOffset(10);
        assertEquals(OptionalInt.of(5), query.limit());
        assertEquals(OptionalInt.of(10), query.offset());

        query.setLimit(null);
        assertEquals(OptionalInt.empty(), query.limit());
        assertThrows(IllegalArgumentException.class, () -> query.setOffset(-1));
    }

    @Test
    void valuesViewIsReadOnly() {
        Query query = twoValues();

        assertThrows(UnsupportedOperationException.class, () -> query.values().set(0, Scalar.of(1)));
    }

    @Test
    void repeatedPlaceholderCountsOnce() {
        Query query = QueryBuilder.create()
            .filter("a = $1 OR b = $1", Scalar.of(1))
            .build()
            .orElseThrow();

        assertEquals(1, query.placeholderCount());
    }

    @Test
    void equalQueriesCompareEqual() {
        Query left = twoValues().setValues(Scalar.of(1), Scalar.of(2));
        Query right = twoValues().setValues(Scalar.of(1), Scalar.of(2));

        assertEquals(left, right);
        assertEquals(left.hashCode(), right.hashCode());
    }
}
