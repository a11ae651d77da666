package com.netlink.osp.api;

/** A referenced element, tray, cable, port or splice does not exist. */
public class NotFoundException extends NetworkException {
    private final String entity;
    private final long id;

    public NotFoundException(String entity, long id) {
        super(entity + " not found: " + id);
        this.entity = entity;
        this.id = id;
    }

    public String entity() {
        return entity;
    }

    public long id() {
        return id;
    }
}
