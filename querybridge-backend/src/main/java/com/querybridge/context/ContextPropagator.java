package com.querybridge.context;

public interface ContextPropagator {

    RequestContext capture();

    RequestContext.Scope restore(RequestContext context);
}
