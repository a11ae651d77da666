package com.netlink.osp.network;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * Passive splitter inside an LCP or NAP. Its output ports are ordinary
 * {@link Port}s of the enclosure carrying this splitter's id.
 * {@code inputCableId}/{@code inputFiber} name the feeding fiber, once patched.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Splitter {
    private long id;
    private long enclosureId;
    private String name;
    private SplitterRatio ratio;
    private Long inputCableId;
    private Integer inputFiber;
    private String notes;
    private Instant createdAt;

    public boolean hasInput() {
        return inputCableId != null && inputFiber != null;
    }

    public Splitter copy() {
        Splitter s = new Splitter();
        s.id = id;
        s.enclosureId = enclosureId;
        s.name = name;
        s.ratio = ratio;
        s.inputCableId = inputCableId;
        s.inputFiber = inputFiber;
        s.notes = notes;
        s.createdAt = createdAt;
        return s;
    }
}
