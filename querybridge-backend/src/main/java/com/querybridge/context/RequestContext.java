package com.querybridge.context;

import org.springframework.web.context.request.RequestAttributes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ambient state of the calling thread, captured so a worker thread can run with the same
 * trace id, user and request attributes.
 */
public final class RequestContext {
    /** MDC key holding the name of the user the request acts for. */
    public static final String USER_KEY = "user";

    private final Map<String, String> mdc;
    private final RequestAttributes requestAttributes;

    public RequestContext(Map<String, String> mdc, RequestAttributes requestAttributes) {
        this.mdc = copyWithoutNulls(mdc);
        this.requestAttributes = requestAttributes;
    }

    public Map<String, String> getMdc() {
        return mdc;
    }

    public RequestAttributes getRequestAttributes() {
        return requestAttributes;
    }

    // MDC adapters may hand back maps holding null keys or values.
    private static Map<String, String> copyWithoutNulls(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, String> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Restored context on a worker thread; closing it puts back whatever the thread had.
     */
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
