package com.tsrouter.query;

import com.tsrouter.exception.MalformedQueryException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Finds the measurement a query targets without fully parsing it.
 *
 * The query is split into whitespace separated tokens; quoted strings and
 * bracketed groups count as single tokens. The identifier after the first
 * {@code FROM} or {@code MEASUREMENT} keyword names the measurement:
 * <ul>
 *   <li>{@code "db"."rp"."cpu"} and {@code db..cpu} name {@code cpu}</li>
 *   <li>quoted identifiers are unquoted, {@code \"} standing for a quote</li>
 *   <li>a regular expression such as {@code /cpu.*}{@code /} is returned verbatim</li>
 * </ul>
 */
public final class InfluxQLScanner {

    private static final String IDENTIFIER_END = " \t\r\n.,;()";

    private InfluxQLScanner() {
    }

    /**
     * @throws MalformedQueryException if the query names no measurement or is not tokenizable
     */
    public static String extractMeasurement(String query) {
        if (query == null || query.isBlank()) {
            throw new MalformedQueryException("empty query");
        }
        List<int[]> tokens = tokenize(query);
        for (int i = 0; i < tokens.size() - 1; i++) {
            String token = text(query, tokens.get(i)).toLowerCase(Locale.ROOT);
            if (token.equals("from") || token.equals("measurement")) {
                return identifierAt(query, tokens.get(i + 1)[0]);
            }
        }
        throw new MalformedQueryException("no measurement in query: " + query);
    }

    /**
     * Token boundaries as {start, end} pairs.
     */
    static List<int[]> tokenize(String query) {
        List<int[]> tokens = new ArrayList<>();
        int n = query.length();
        int i = 0;
        while (i < n) {
            char c = query.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            int end;
            switch (c) {
                case '"':
                case '\'':
                    end = skipQuoted(query, i);
                    break;
                case '(':
                    end = closeGroup(query, i, ')');
                    break;
                case '[':
                    end = closeGroup(query, i, ']');
                    break;
                case '{':
                    end = closeGroup(query, i, '}');
                    break;
                default:
                    end = i;
                    while (end < n && !Character.isWhitespace(query.charAt(end))) {
                        end++;
                    }
            }
            tokens.add(new int[]{i, end});
            i = end;
        }
        return tokens;
    }

    private static String text(String query, int[] token) {
        return query.substring(token[0], token[1]);
    }

    // returns the index after the closing quote
    private static int skipQuoted(String query, int start) {
        char quote = query.charAt(start);
        for (int i = start + 1; i < query.length(); i++) {
            char c = query.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == quote) {
                return i + 1;
            }
        }
        throw new MalformedQueryException("unmatched quote in query: " + query);
    }

    private static int closeGroup(String query, int start, char close) {
        int end = query.indexOf(close, start);
        if (end < 0) {
            throw new MalformedQueryException("unclosed " + query.charAt(start) + " in query: " + query);
        }
        return end + 1;
    }

    private static String identifierAt(String query, int start) {
        if (query.charAt(start) == '/') {
            for (int i = start + 1; i < query.length(); i++) {
                char c = query.charAt(i);
                if (c == '\\') {
                    i++;
                } else if (c == '/') {
                    return query.substring(start, i + 1);
                }
            }
            throw new MalformedQueryException("unterminated regular expression in query: " + query);
        }

        String segment = "";
        int pos = start;
        while (true) {
            StringBuilder sb = new StringBuilder();
            if (pos < query.length() && (query.charAt(pos) == '"' || query.charAt(pos) == '\'')) {
                int end = skipQuoted(query, pos);
                for (int i = pos + 1; i < end - 1; i++) {
                    char c = query.charAt(i);
                    if (c == '\\' && i + 1 < end - 1) {
                        c = query.charAt(++i);
                    }
                    sb.append(c);
                }
                pos = end;
            } else {
                while (pos < query.length() && IDENTIFIER_END.indexOf(query.charAt(pos)) < 0) {
                    sb.append(query.charAt(pos++));
                }
            }
            segment = sb.toString();
            if (pos < query.length() && query.charAt(pos) == '.') {
                pos++;
                continue;
            }
            break;
        }
        if (segment.isEmpty()) {
            throw new MalformedQueryException("missing measurement in query: " + query);
        }
        return segment;
    }
}
