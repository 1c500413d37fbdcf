package com.tsrouter.query;

import com.tsrouter.config.RouterProperties;
import com.tsrouter.exception.MalformedQueryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class QueryValidatorTest {

    private QueryValidator validator;

    @BeforeEach
    void setUp() {
        RouterProperties.Query defaults = new RouterProperties.Query();
        validator = new QueryValidator(defaults.getForbiddenPatterns(), defaults.getObligatedPatterns(), false);
    }

    @Test
    public void testAcceptsOrdinaryQueries() {
        assertDoesNotThrow(() -> validator.validate("select * from cpu"));
        assertDoesNotThrow(() -> validator.validate("show tag keys from cpu"));
        assertDoesNotThrow(() -> validator.validate("DROP MEASUREMENT cpu"));
    }

    @Test
    public void testRejectsForbiddenQueries() {
        assertThrows(MalformedQueryException.class, () -> validator.validate("GRANT ALL TO jdoe"));
        assertThrows(MalformedQueryException.class, () -> validator.validate("  revoke all privileges from jdoe"));
    }

    @Test
    public void testRejectsQueriesWithoutObligatedPattern() {
        assertThrows(MalformedQueryException.class, () -> validator.validate("show databases"));
        assertThrows(MalformedQueryException.class, () -> validator.validate("   "));
        assertThrows(MalformedQueryException.class, () -> validator.validate(null));
    }

    @Test
    public void testEmptyObligatedListAcceptsAnything() {
        QueryValidator open = new QueryValidator(Collections.emptyList(), Collections.emptyList(), false);
        assertDoesNotThrow(() -> open.validate("show databases"));
    }

    @Test
    public void testRequireTimeBound() {
        QueryValidator bounded = new QueryValidator(Collections.emptyList(), List.of("(?i)from"), true);

        assertThrows(MalformedQueryException.class, () -> bounded.validate("select * from cpu"));
        assertThrows(MalformedQueryException.class,
                () -> bounded.validate("select * from cpu where host = 'a'"));
        assertDoesNotThrow(() -> bounded.validate("select * from cpu where time > now() - 1h"));
        assertDoesNotThrow(() -> bounded.validate("SELECT * FROM cpu WHERE host = 'a' AND \"time\" >= 0"));
        assertDoesNotThrow(() -> bounded.validate("show tag keys from cpu"));
    }

    @Test
    public void testInvalidPattern() {
        assertThrows(IllegalArgumentException.class,
                () -> new QueryValidator(List.of("(unclosed"), Collections.emptyList(), false));
    }
}
