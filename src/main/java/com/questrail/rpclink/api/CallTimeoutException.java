package com.questrail.rpclink.api;

import java.time.Duration;

/**
 * A remote call did not receive a response within its timeout.
 */
public final class CallTimeoutException extends RpcException
{
    private final String method;
    private final Duration timeout;

    public CallTimeoutException(String method, Duration timeout) {
        super("Remote method call \"" + method + "\" timed out after " + timeout.toMillis() + "ms");
        this.method = method;
        this.timeout = timeout;
    }

    public String method() {
        return method;
    }

    public Duration timeout() {
        return timeout;
    }
}
