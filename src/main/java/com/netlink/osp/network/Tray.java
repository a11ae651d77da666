package com.netlink.osp.network;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/** Splice tray inside an enclosure. {@code capacity} is the maximum splice count. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Tray {
    private long id;
    private long enclosureId;
    private int number;
    private int capacity;
    private String notes;

    public Tray copy() {
        Tray t = new Tray();
        t.id = id;
        t.enclosureId = enclosureId;
        t.number = number;
        t.capacity = capacity;
        t.notes = notes;
        return t;
    }
}
