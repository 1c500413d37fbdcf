package com.tsrouter.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class WriteResultTest {

    @Test
    public void testCompleteWrite() {
        WriteResult result = new WriteResult();
        result.accept();

        assertTrue(result.isComplete());
        assertEquals(204, result.getHttpStatus());
    }

    @Test
    public void testClientErrorsWinOverUnavailable() {
        WriteResult result = new WriteResult();
        result.reject(1, WriteResult.Reason.UNAVAILABLE, "all backends of measurement cpu are down");
        assertEquals(503, result.getHttpStatus());

        result.reject(2, WriteResult.Reason.MALFORMED, "missing fields");
        assertEquals(400, result.getHttpStatus());
        assertEquals(2, result.getRejected());
        assertFalse(result.isComplete());
    }
}
