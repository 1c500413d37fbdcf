package com.tsrouter.model;

import com.tsrouter.exception.MalformedInputException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Parser and formatter for the line-structured ingestion protocol:
 * <pre>measurement[,tag=value...] field=value[,field=value...] timestamp</pre>
 *
 * Commas, spaces and equal signs in names are escaped with a backslash;
 * string field values are double quoted and may contain escaped quotes.
 * Parsing is per line so one bad line never affects its neighbours.
 */
public class LineProtocol {

    private static final Pattern FLOAT = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");
    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+i");
    private static final Pattern UNSIGNED = Pattern.compile("\\d+u");
    private static final Set<String> TRUE = Set.of("t", "T", "true", "True", "TRUE");
    private static final Set<String> FALSE = Set.of("f", "F", "false", "False", "FALSE");

    private final boolean fillMissingTimestamp;
    private final Clock clock;

    public LineProtocol(boolean fillMissingTimestamp, Clock clock) {
        this.fillMissingTimestamp = fillMissingTimestamp;
        this.clock = clock;
    }

    /**
     * Strict parser: every line must carry a timestamp.
     */
    public LineProtocol() {
        this(false, Clock.systemUTC());
    }

    /**
     * Parses one line into a point, converting its timestamp to nanoseconds.
     *
     * @throws MalformedInputException if the line does not follow the protocol
     */
    public Point parseLine(String rawLine, Precision precision) {
        String line = rawLine.strip();
        if (line.isEmpty()) {
            throw new MalformedInputException("empty line");
        }

        int keyEnd = indexOfUnescaped(line, 0, ' ');
        if (keyEnd < 0) {
            throw new MalformedInputException("missing fields");
        }

        List<String> keyParts = splitUnescaped(line.substring(0, keyEnd), ',');
        String measurement = unescape(keyParts.get(0));
        if (measurement.isEmpty()) {
            throw new MalformedInputException("missing measurement");
        }

        Map<String, String> tags = new TreeMap<>();
        for (int i = 1; i < keyParts.size(); i++) {
            String part = keyParts.get(i);
            int eq = indexOfUnescaped(part, 0, '=');
            if (eq <= 0 || eq == part.length() - 1) {
                throw new MalformedInputException("invalid tag: " + part);
            }
            String tagKey = unescape(part.substring(0, eq));
            if (tags.put(tagKey, unescape(part.substring(eq + 1))) != null) {
                throw new MalformedInputException("duplicate tag: " + tagKey);
            }
        }

        int fieldStart = keyEnd;
        while (fieldStart < line.length() && line.charAt(fieldStart) == ' ') {
            fieldStart++;
        }
        int fieldEnd = endOfFields(line, fieldStart);
        if (fieldEnd == fieldStart) {
            throw new MalformedInputException("missing fields");
        }

        Map<String, FieldValue> fields = new LinkedHashMap<>();
        for (String part : splitFields(line.substring(fieldStart, fieldEnd))) {
            int eq = indexOfUnescaped(part, 0, '=');
            if (eq <= 0 || eq == part.length() - 1) {
                throw new MalformedInputException("invalid field: " + part);
            }
            String fieldKey = unescape(part.substring(0, eq));
            if (fields.put(fieldKey, parseFieldValue(part.substring(eq + 1))) != null) {
                throw new MalformedInputException("duplicate field: " + fieldKey);
            }
        }

        String rest = line.substring(fieldEnd).trim();
        long timestamp;
        if (rest.isEmpty()) {
            if (!fillMissingTimestamp) {
                throw new MalformedInputException("missing timestamp");
            }
            timestamp = Math.multiplyExact(clock.millis(), 1_000_000L);
        } else {
            try {
                timestamp = precision.toNanos(Long.parseLong(rest));
            } catch (NumberFormatException e) {
                throw new MalformedInputException("invalid timestamp: " + rest, e);
            }
        }

        return new Point(measurement, tags, fields, timestamp);
    }

    /**
     * Formats a point as one line, without a trailing newline. Timestamps are in nanoseconds.
     */
    public static String format(Point point) {
        StringBuilder sb = new StringBuilder(64);
        appendPoint(sb, point);
        return sb.toString();
    }

    /**
     * Formats a batch, one point per line, each line terminated by a newline.
     */
    public static String format(Collection<Point> points) {
        StringBuilder sb = new StringBuilder(points.size() * 64);
        for (Point point : points) {
            appendPoint(sb, point);
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Reads the measurement of a line without parsing the rest of it.
     */
    public static String scanMeasurement(String line) {
        String stripped = line.strip();
        int end = stripped.length();
        for (int i = 0; i < stripped.length(); i++) {
            char c = stripped.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == ',' || c == ' ') {
                end = i;
                break;
            }
        }
        return unescape(stripped.substring(0, end));
    }

    private static void appendPoint(StringBuilder sb, Point point) {
        escape(sb, point.getMeasurement(), false);
        for (Map.Entry<String, String> tag : point.getTags().entrySet()) {
            sb.append(',');
            escape(sb, tag.getKey(), true);
            sb.append('=');
            escape(sb, tag.getValue(), true);
        }
        sb.append(' ');
        boolean first = true;
        for (Map.Entry<String, FieldValue> field : point.getFields().entrySet()) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            escape(sb, field.getKey(), true);
            sb.append('=').append(field.getValue().getLiteral());
        }
        sb.append(' ').append(point.getTimestamp());
    }

    private static void escape(StringBuilder sb, String value, boolean escapeEquals) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == ',' || c == ' ' || (escapeEquals && c == '=')) {
                sb.append('\\');
            }
            sb.append(c);
        }
    }

    private static FieldValue parseFieldValue(String literal) {
        if (literal.charAt(0) == '"') {
            if (literal.length() < 2 || literal.charAt(literal.length() - 1) != '"') {
                throw new MalformedInputException("unterminated string field: " + literal);
            }
            return FieldValue.ofLiteral(FieldValue.Type.STRING, literal);
        }
        if (INTEGER.matcher(literal).matches()) {
            try {
                Long.parseLong(literal.substring(0, literal.length() - 1));
            } catch (NumberFormatException e) {
                throw new MalformedInputException("integer field out of range: " + literal, e);
            }
            return FieldValue.ofLiteral(FieldValue.Type.INTEGER, literal);
        }
        if (UNSIGNED.matcher(literal).matches()) {
            try {
                Long.parseUnsignedLong(literal.substring(0, literal.length() - 1));
            } catch (NumberFormatException e) {
                throw new MalformedInputException("unsigned field out of range: " + literal, e);
            }
            return FieldValue.ofLiteral(FieldValue.Type.UNSIGNED, literal);
        }
        if (TRUE.contains(literal) || FALSE.contains(literal)) {
            return FieldValue.ofLiteral(FieldValue.Type.BOOLEAN, literal);
        }
        if (FLOAT.matcher(literal).matches()) {
            return FieldValue.ofLiteral(FieldValue.Type.FLOAT, literal);
        }
        throw new MalformedInputException("invalid field value: " + literal);
    }

    /**
     * End of the field section: the first space outside a quoted string.
     */
    private static int endOfFields(String line, int start) {
        boolean quoted = false;
        for (int i = start; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '"') {
                quoted = !quoted;
            } else if (c == ' ' && !quoted) {
                return i;
            }
        }
        if (quoted) {
            throw new MalformedInputException("unbalanced quotes");
        }
        return line.length();
    }

    private static List<String> splitFields(String section) {
        List<String> parts = new ArrayList<>();
        boolean quoted = false;
        int from = 0;
        for (int i = 0; i < section.length(); i++) {
            char c = section.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '"') {
                quoted = !quoted;
            } else if (c == ',' && !quoted) {
                parts.add(section.substring(from, i));
                from = i + 1;
            }
        }
        parts.add(section.substring(from));
        for (String part : parts) {
            if (part.isEmpty()) {
                throw new MalformedInputException("empty field in: " + section);
            }
        }
        return parts;
    }

    private static List<String> splitUnescaped(String s, char separator) {
        List<String> parts = new ArrayList<>();
        int from = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == separator) {
                parts.add(s.substring(from, i));
                from = i + 1;
            }
        }
        parts.add(s.substring(from));
        return parts;
    }

    private static int indexOfUnescaped(String s, int from, char target) {
        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == target) {
                return i;
            }
        }
        return -1;
    }

    private static String unescape(String s) {
        if (s.indexOf('\\') < 0) {
            return s;
        }
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                char next = s.charAt(i + 1);
                if (next == ',' || next == ' ' || next == '=') {
                    sb.append(next);
                    i++;
                    continue;
                }
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
