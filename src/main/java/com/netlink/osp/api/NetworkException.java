package com.netlink.osp.api;

/**
 * Base class for failures reported by the network model.
 * <p>
 * All subclasses are unchecked. The caller owns any user-facing message.
 */
public class NetworkException extends RuntimeException {

    public NetworkException(String message) {
        super(message);
    }

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
