package com.questrail.rpclink.api;

/**
 * CloseCodes
 * -----------------------------------------------------------------------------
 * Close status codes exchanged when a session ends.
 *
 * <p>The values follow RFC 6455 section 7.4.1. Only {@link #NORMAL} and the
 * application range {@code 3000..4999} may be <em>sent</em> by this library;
 * codes such as {@code 1006} are reported by transports but can never be put
 * on the wire.</p>
 */
public final class CloseCodes
{
    /** The purpose for which the connection was established has been fulfilled. */
    public static final int NORMAL = 1000;

    /** An endpoint is going away, such as a server shutting down. */
    public static final int GOING_AWAY = 1001;

    /** An endpoint is terminating the connection due to a protocol error. */
    public static final int PROTOCOL_ERROR = 1002;

    /** An endpoint received a type of data it cannot accept. */
    public static final int UNSUPPORTED_DATA = 1003;

    /** Reported locally when a close frame carried no status code. Never sent. */
    public static final int NO_STATUS_RECEIVED = 1005;

    /** Reported locally when the connection closed without a close frame. Never sent. */
    public static final int ABNORMAL_CLOSURE = 1006;

    /** Data within a message was not consistent with the type of the message. */
    public static final int INVALID_PAYLOAD_DATA = 1007;

    /** A message violated the receiving endpoint's policy. */
    public static final int POLICY_VIOLATION = 1008;

    /** A message was too big to process. */
    public static final int MESSAGE_TOO_BIG = 1009;

    /** The client expected the server to negotiate an extension that it did not. */
    public static final int MANDATORY_EXTENSION = 1010;

    /** The server encountered an unexpected condition. */
    public static final int INTERNAL_ERROR = 1011;

    public static final int SERVICE_RESTART = 1012;

    public static final int TRY_AGAIN_LATER = 1013;

    /** Default code sent when a session is closed because of a connect or probe timeout. */
    public static final int DEFAULT_TIMEOUT = 4100;

    /** Default code sent when a session is closed because the protocol engine failed. */
    public static final int DEFAULT_INTERNAL_ERROR = 4101;

    private CloseCodes() {}

    /**
     * Returns {@code true} if {@code code} may be sent to the peer: exactly
     * {@code 1000}, or within {@code 3000..4999} inclusive.
     */
    public static boolean isValidOutgoing(int code)
    {
        return code == NORMAL || (code >= 3000 && code <= 4999);
    }

    /**
     * Validates an outgoing close code.
     *
     * @param code  the code to check
     * @param label what the code is being used for, included in the error message
     * @return {@code code}
     * @throws IllegalArgumentException if the code may not be sent
     */
    public static int requireValidOutgoing(int code, String label)
    {
        if (!isValidOutgoing(code)) {
            throw new IllegalArgumentException(label + ": invalid close code (" + code
                    + "). It must be 1000 or in the range 3000 to 4999 inclusive");
        }
        return code;
    }
}
