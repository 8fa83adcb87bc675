package com.competition.gateway.forward;

/**
 * Headers the gateway sets on forwarded requests and on responses.
 */
public final class GatewayHeaders {

    public static final String CORRELATION_ID = "X-Correlation-ID";
    public static final String TENANT_ID = "X-Tenant-ID";
    public static final String USER_ID = "X-User-ID";

    private GatewayHeaders() {
    }
}
