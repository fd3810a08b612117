package ch.so.arp.vectorsearch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Validation and conversion helpers shared by all {@link SimilaritySearch}
 * backends.
 */
public final class Vectors {

    /**
     * Metadata entry holding the record identifier.
     */
    public static final String ID_FIELD = "id";

    private Vectors() {
    }

    /**
     * Check that the vector is a non-empty sequence of finite numbers.
     *
     * @param vector the vector to check
     * @return the vector values as a fresh array
     * @throws ValidationException if the check fails
     */
    public static double[] requireVector(List<?> vector) {
        if (vector == null) {
            throw new ValidationException("Vector must not be null");
        }
        if (vector.isEmpty()) {
            throw new ValidationException("Vector must not be empty");
        }
        double[] values = new double[vector.size()];
        int i = 0;
        for (Object element : vector) {
            if (!(element instanceof Number number)) {
                throw new ValidationException(
                        "Vector element at index " + i + " is not numeric: " + describe(element));
            }
            double value = number.doubleValue();
            if (!Double.isFinite(value)) {
                throw new ValidationException("Vector element at index " + i + " is not finite: " + value);
            }
            values[i++] = value;
        }
        return values;
    }

    /**
     * Extract the record identifier from the metadata.
     *
     * @param metadata the record metadata
     * @return the string form of the {@code id} entry
     * @throws ValidationException if there is no usable {@code id} entry
     */
    public static String requireId(Map<String, ?> metadata) {
        if (metadata == null) {
            throw new ValidationException("Metadata must not be null");
        }
        Object id = metadata.get(ID_FIELD);
        if (id == null) {
            throw new ValidationException("Metadata must contain an '" + ID_FIELD + "' field");
        }
        return id.toString();
    }

    /**
     * Convert an untyped value, for example a deserialized JSON node, into a
     * numeric list.
     *
     * @param candidate a collection or array of numbers
     * @return the values as doubles
     * @throws ValidationException if the value is not a list or holds a
     *                             non-numeric element
     */
    public static List<Double> coerce(Object candidate) {
        Collection<?> elements;
        if (candidate instanceof Collection<?> collection) {
            elements = collection;
        } else if (candidate instanceof Object[] array) {
            elements = Arrays.asList(array);
        } else if (candidate instanceof double[] array) {
            List<Double> values = new ArrayList<>(array.length);
            for (double value : array) {
                values.add(value);
            }
            elements = values;
        } else if (candidate instanceof float[] array) {
            elements = toList(array);
        } else {
            throw new ValidationException("Vector must be a list of numbers but was " + describe(candidate));
        }
        List<Double> values = new ArrayList<>(elements.size());
        for (double value : requireVector(new ArrayList<>(elements))) {
            values.add(value);
        }
        return values;
    }

    public static List<Float> toList(float[] values) {
        List<Float> list = new ArrayList<>(values.length);
        for (float value : values) {
            list.add(value);
        }
        return list;
    }

    /**
     * Round every value to float precision, the precision of a CQL
     * {@code vector<float, n>} or pgvector {@code vector} column.
     *
     * @throws ValidationException if a value is outside the float range
     */
    static double[] toFloatPrecision(double[] values) {
        double[] rounded = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            float value = (float) values[i];
            if (Float.isInfinite(value)) {
                throw new ValidationException(
                        "Vector element at index " + i + " is outside the float range: " + values[i]);
            }
            rounded[i] = value;
        }
        return rounded;
    }

    /**
     * Render the vector in the pgvector text form, e.g. {@code [0.1,0.2]}. The
     * decimal representation is exact enough to read back the same doubles.
     */
    static String toLiteral(double[] values) {
        StringBuilder builder = new StringBuilder();
        builder.append('[');
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(values[i]);
        }
        builder.append(']');
        return builder.toString();
    }

    /**
     * Parse the text form produced by {@link #toLiteral(double[])}. Array text
     * in braces ({@code {0.1,0.2}}) is accepted as well.
     *
     * @throws StorageException if the text is not a vector literal
     */
    static double[] parseLiteral(String literal) {
        if (literal == null) {
            throw new StorageException("Stored vector is null");
        }
        String trimmed = literal.trim();
        if (trimmed.length() < 2 || !isBracketed(trimmed)) {
            throw new StorageException("Stored vector is not a vector literal: " + literal);
        }
        String body = trimmed.substring(1, trimmed.length() - 1).trim();
        if (body.isEmpty()) {
            return new double[0];
        }
        String[] parts = body.split(",");
        double[] values = new double[parts.length];
        try {
            for (int i = 0; i < parts.length; i++) {
                values[i] = Double.parseDouble(parts[i].trim());
            }
        } catch (NumberFormatException ex) {
            throw new StorageException("Stored vector is not a vector literal: " + literal, ex);
        }
        return values;
    }

    private static boolean isBracketed(String value) {
        char first = value.charAt(0);
        char last = value.charAt(value.length() - 1);
        return (first == '[' && last == ']') || (first == '{' && last == '}');
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        return value.getClass().getSimpleName() + " '" + value + "'";
    }
}
