package com.tsrouter.model;

import java.util.Objects;

/**
 * A typed field value. The original literal is kept so that a point is
 * forwarded to its backends byte-for-byte as the client wrote the value.
 */
public final class FieldValue {

    public enum Type { FLOAT, INTEGER, UNSIGNED, STRING, BOOLEAN }

    private final Type type;
    private final String literal;

    private FieldValue(Type type, String literal) {
        this.type = type;
        this.literal = literal;
    }

    public static FieldValue ofLiteral(Type type, String literal) {
        return new FieldValue(Objects.requireNonNull(type), Objects.requireNonNull(literal));
    }

    public static FieldValue of(double value) {
        return new FieldValue(Type.FLOAT, Double.toString(value));
    }

    public static FieldValue of(long value) {
        return new FieldValue(Type.INTEGER, value + "i");
    }

    public static FieldValue of(boolean value) {
        return new FieldValue(Type.BOOLEAN, value ? "true" : "false");
    }

    public static FieldValue of(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return new FieldValue(Type.STRING, sb.append('"').toString());
    }

    public Type getType() {
        return type;
    }

    /**
     * The value as written in line protocol, including quotes and type suffix.
     */
    public String getLiteral() {
        return literal;
    }

    public double asDouble() {
        switch (type) {
            case FLOAT:
                return Double.parseDouble(literal);
            case INTEGER:
            case UNSIGNED:
                return Double.parseDouble(literal.substring(0, literal.length() - 1));
            default:
                throw new IllegalStateException("not a numeric field: " + literal);
        }
    }

    public long asLong() {
        if (type != Type.INTEGER && type != Type.UNSIGNED) {
            throw new IllegalStateException("not an integer field: " + literal);
        }
        return Long.parseLong(literal.substring(0, literal.length() - 1));
    }

    public boolean asBoolean() {
        if (type != Type.BOOLEAN) {
            throw new IllegalStateException("not a boolean field: " + literal);
        }
        return literal.charAt(0) == 't' || literal.charAt(0) == 'T';
    }

    public String asString() {
        if (type != Type.STRING) {
            throw new IllegalStateException("not a string field: " + literal);
        }
        StringBuilder sb = new StringBuilder(literal.length());
        for (int i = 1; i < literal.length() - 1; i++) {
            char c = literal.charAt(i);
            if (c == '\\' && i + 1 < literal.length() - 1) {
                c = literal.charAt(++i);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        FieldValue that = (FieldValue) o;
        return type == that.type && literal.equals(that.literal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, literal);
    }

    @Override
    public String toString() {
        return literal;
    }
}
