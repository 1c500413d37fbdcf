package com.tsrouter.query;

import com.tsrouter.exception.MalformedQueryException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Rejects queries the router must not forward.
 */
public class QueryValidator {

    private static final Pattern TIME_CONDITION =
            Pattern.compile("(?is)\\bwhere\\b.*?\"?\\btime\\b\"?\\s*(<|>|=|!=)");

    private final List<Pattern> forbidden;
    private final List<Pattern> obligated;
    private final boolean requireTimeBound;

    public QueryValidator(List<String> forbiddenPatterns, List<String> obligatedPatterns, boolean requireTimeBound) {
        this.forbidden = compile(forbiddenPatterns);
        this.obligated = compile(obligatedPatterns);
        this.requireTimeBound = requireTimeBound;
    }

    private static List<Pattern> compile(List<String> patterns) {
        List<Pattern> compiled = new ArrayList<>();
        if (patterns != null) {
            for (String pattern : patterns) {
                try {
                    compiled.add(Pattern.compile(pattern));
                } catch (PatternSyntaxException e) {
                    throw new IllegalArgumentException("Invalid query pattern: " + pattern, e);
                }
            }
        }
        return Collections.unmodifiableList(compiled);
    }

    /**
     * @throws MalformedQueryException if the query is empty, forbidden, matches no
     *                                 obligated pattern or lacks a required time bound
     */
    public void validate(String query) {
        if (query == null || query.isBlank()) {
            throw new MalformedQueryException("empty query");
        }
        for (Pattern pattern : forbidden) {
            if (pattern.matcher(query).find()) {
                throw new MalformedQueryException("query forbidden: " + query);
            }
        }
        if (!obligated.isEmpty() && obligated.stream().noneMatch(p -> p.matcher(query).find())) {
            throw new MalformedQueryException("query does not name a measurement: " + query);
        }
        if (requireTimeBound && isSelect(query) && !TIME_CONDITION.matcher(query).find()) {
            throw new MalformedQueryException("select without time condition: " + query);
        }
    }

    private static boolean isSelect(String query) {
        return query.stripLeading().toLowerCase(Locale.ROOT).startsWith("select");
    }
}
