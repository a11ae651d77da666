package com.netlink.osp.api;

/**
 * Input that violates a model invariant: an out-of-range fiber index on a
 * persisted splice, a disallowed parent/child type pair, a missing required
 * parent, a full tray.
 */
public class ValidationException extends NetworkException {

    public ValidationException(String message) {
        super(message);
    }
}
