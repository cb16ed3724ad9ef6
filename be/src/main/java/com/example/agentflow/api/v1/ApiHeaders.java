package com.example.agentflow.api.v1;

/**
 * Request headers shared by the v1 controllers.
 */
public final class ApiHeaders {

    /** Caller identity (UUID); every owner-scoped endpoint requires it. */
    public static final String USER_ID = "X-User-Id";

    private ApiHeaders() {
    }
}
