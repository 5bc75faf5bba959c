package com.querybridge.context;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RequestContextTest {

    @Test
    public void constructor_nullMdcValues_dropped() {
        Map<String, String> mdc = new HashMap<>();
        mdc.put("trace_id", "trace-1");
        mdc.put("user", null);
        mdc.put(null, "orphan");

        RequestContext context = new RequestContext(mdc, null);

        assertEquals(Map.of("trace_id", "trace-1"), context.getMdc());
    }

    @Test
    public void constructor_copiesMdc() {
        Map<String, String> mdc = new HashMap<>();
        mdc.put("trace_id", "trace-1");

        RequestContext context = new RequestContext(mdc, null);
        mdc.put("trace_id", "changed");

        assertEquals("trace-1", context.getMdc().get("trace_id"));
        assertThrows(UnsupportedOperationException.class, () -> context.getMdc().put("user", "bob"));
    }

    @Test
    public void constructor_nullMdc_empty() {
        assertTrue(new RequestContext(null, null).getMdc().isEmpty());
    }
}
