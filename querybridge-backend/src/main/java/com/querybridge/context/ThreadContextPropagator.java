package com.querybridge.context;

import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;

import java.util.Map;

/**
 * Copies the SLF4J MDC and Spring's {@link RequestContextHolder} attributes between threads.
 */
@Component
public class ThreadContextPropagator implements ContextPropagator {

    @Override
    public RequestContext capture() {
        return new RequestContext(MDC.getCopyOfContextMap(), RequestContextHolder.getRequestAttributes());
    }

    @Override
    public RequestContext.Scope restore(RequestContext context) {
        Map<String, String> previousMdc = MDC.getCopyOfContextMap();
        RequestAttributes previousAttributes = RequestContextHolder.getRequestAttributes();

        MDC.setContextMap(context.getMdc());
        if (context.getRequestAttributes() != null) {
            RequestContextHolder.setRequestAttributes(context.getRequestAttributes());
        }

        return () -> {
            if (previousMdc != null) {
                MDC.setContextMap(previousMdc);
            } else {
                MDC.clear();
            }
            if (previousAttributes != null) {
                RequestContextHolder.setRequestAttributes(previousAttributes);
            } else {
                RequestContextHolder.resetRequestAttributes();
            }
        };
    }
}
