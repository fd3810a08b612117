package ch.so.arp.vectorsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class VectorsTest {

    @Test
    void acceptsFiniteNumbersOfAnyType() {
        assertThat(Vectors.requireVector(List.of(1, 2.5d, 3.25f, 4L))).containsExactly(1.0d, 2.5d, 3.25d, 4.0d);
    }

    @Test
    void roundsToFloatPrecisionWithinFloatRange() {
        assertThat(Vectors.toFloatPrecision(new double[] { 0.1d, -Float.MAX_VALUE, 1e-50d }))
                .containsExactly((double) 0.1f, -Float.MAX_VALUE, 0.0d);
        assertThatThrownBy(() -> Vectors.toFloatPrecision(new double[] { 0.5d, 1e39d }))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("index 1");
    }

    @Test
    void rejectsNullAndEmptyVectors() {
        assertThatThrownBy(() -> Vectors.requireVector(null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> Vectors.requireVector(List.of()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void rejectsNonNumericElements() {
        List<Object> vector = List.of(0.1d, 0.2d, "a");

        assertThatThrownBy(() -> Vectors.requireVector(vector))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("index 2");
    }

    @Test
    void rejectsNullElements() {
        assertThatThrownBy(() -> Vectors.requireVector(Arrays.asList(0.1d, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("null");
    }

    @Test
    void rejectsNonFiniteElements() {
        assertThatThrownBy(() -> Vectors.requireVector(List.of(0.1d, Double.NaN)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> Vectors.requireVector(List.of(Double.POSITIVE_INFINITY)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void coerceRejectsValuesThatAreNotLists() {
        assertThatThrownBy(() -> Vectors.coerce("not a list"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("String");
        assertThatThrownBy(() -> Vectors.coerce(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void coerceRejectsMixedLists() {
        assertThatThrownBy(() -> Vectors.coerce(List.of(0.1d, 0.2d, "a"))).isInstanceOf(ValidationException.class);
    }

    @Test
    void coerceConvertsListsAndArrays() {
        assertThat(Vectors.coerce(List.of(1, 2))).containsExactly(1.0d, 2.0d);
        assertThat(Vectors.coerce(new float[] { 0.5f })).containsExactly(0.5d);
        assertThat(Vectors.coerce(new Object[] { 3L })).containsExactly(3.0d);
    }

    @Test
    void requiresIdInMetadata() {
        assertThat(Vectors.requireId(Map.of("id", 42))).isEqualTo("42");
        assertThatThrownBy(() -> Vectors.requireId(Map.of("name", "x")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'id'");
        Map<String, Object> nullId = new HashMap<>();
        nullId.put("id", null);
        assertThatThrownBy(() -> Vectors.requireId(nullId)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> Vectors.requireId(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void literalKeepsExactValues() {
        double[] values = { 0.1d, -2.0E-7d, 1.0d / 3.0d };

        String literal = Vectors.toLiteral(values);

        assertThat(literal).startsWith("[0.1,").endsWith("]");
        assertThat(Vectors.parseLiteral(literal)).containsExactly(values);
    }

    @Test
    void parsesArrayTextAndWhitespace() {
        assertThat(Vectors.parseLiteral(" {1, 2.5} ")).containsExactly(1.0d, 2.5d);
    }

    @Test
    void malformedLiteralIsStorageError() {
        assertThatThrownBy(() -> Vectors.parseLiteral("1,2")).isInstanceOf(StorageException.class);
        assertThatThrownBy(() -> Vectors.parseLiteral("[1,x]")).isInstanceOf(StorageException.class);
        assertThatThrownBy(() -> Vectors.parseLiteral(null)).isInstanceOf(StorageException.class);
    }
}
