package com.tsrouter.query;

import com.tsrouter.exception.MalformedQueryException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class InfluxQLScannerTest {

    @Test
    public void testSimpleSelect() {
        assertEquals("cpu", InfluxQLScanner.extractMeasurement("select * from cpu"));
        assertEquals("cpu", InfluxQLScanner.extractMeasurement("SELECT value FROM cpu WHERE host = 'a'"));
        assertEquals("cpu", InfluxQLScanner.extractMeasurement("select * from cpu;"));
        assertEquals("cpu", InfluxQLScanner.extractMeasurement("  select\t*\nfrom\tcpu  "));
    }

    @Test
    public void testQuotedIdentifiers() {
        assertEquals("cpu", InfluxQLScanner.extractMeasurement("select * from \"cpu\""));
        assertEquals("c\"pu", InfluxQLScanner.extractMeasurement("select * from \"c\\\"pu\""));
        assertEquals("cpu load", InfluxQLScanner.extractMeasurement("select * from \"cpu load\" limit 1"));
    }

    @Test
    public void testQualifiedNamesUseLastSegment() {
        assertEquals("cpu", InfluxQLScanner.extractMeasurement("select * from \"mydb\".\"autogen\".\"cpu\""));
        assertEquals("cpu", InfluxQLScanner.extractMeasurement("select * from mydb.autogen.cpu"));
        assertEquals("cpu", InfluxQLScanner.extractMeasurement("select * from mydb..cpu"));
    }

    @Test
    public void testRegexIsReturnedVerbatim() {
        assertEquals("/cpu.*/", InfluxQLScanner.extractMeasurement("select * from /cpu.*/"));
        assertEquals("/c\\/pu/", InfluxQLScanner.extractMeasurement("select * from /c\\/pu/ limit 1"));
    }

    @Test
    public void testGroupsAreSkipped() {
        assertEquals("cpu", InfluxQLScanner.extractMeasurement("(select * from mem) from cpu"));
        assertEquals("cpu", InfluxQLScanner.extractMeasurement("select mean(value) from cpu group by time(1m)"));
    }

    @Test
    public void testOtherStatements() {
        assertEquals("jdoe", InfluxQLScanner.extractMeasurement("REVOKE ALL PRIVILEGES FROM \"jdoe\""));
        assertEquals("cpu", InfluxQLScanner.extractMeasurement("SHOW TAG VALUES FROM \"cpu\" WITH KEY = \"host\""));
        assertEquals("cpu", InfluxQLScanner.extractMeasurement("DROP MEASUREMENT \"cpu\""));
        assertEquals("cpu", InfluxQLScanner.extractMeasurement("delete from cpu where time < now() - 1d"));
    }

    @Test
    public void testMalformedQueries() {
        assertThrows(MalformedQueryException.class, () -> InfluxQLScanner.extractMeasurement(""));
        assertThrows(MalformedQueryException.class, () -> InfluxQLScanner.extractMeasurement(null));
        assertThrows(MalformedQueryException.class, () -> InfluxQLScanner.extractMeasurement("show databases"));
        assertThrows(MalformedQueryException.class, () -> InfluxQLScanner.extractMeasurement("select * from"));
        assertThrows(MalformedQueryException.class, () -> InfluxQLScanner.extractMeasurement("select * from \"cpu"));
        assertThrows(MalformedQueryException.class, () -> InfluxQLScanner.extractMeasurement("select (a from cpu"));
        assertThrows(MalformedQueryException.class, () -> InfluxQLScanner.extractMeasurement("select * from /cpu"));
        assertThrows(MalformedQueryException.class, () -> InfluxQLScanner.extractMeasurement("select * from ;"));
    }

    @Test
    public void testTokenize() {
        String query = "select \"a b\" from (x y) cpu";
        assertEquals(5, InfluxQLScanner.tokenize(query).size());
    }
}
