package com.netlink.osp.network;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * PON port on the face of an OLT. An LCP fed from it records the port in
 * {@link NetworkElement#getPonPortId()}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PonPort {
    public static final int DEFAULT_MAX_SPLIT_RATIO = 64;

    private long id;
    private long oltId;
    private int portNumber;
    private String label;
    private PonPortStatus status = PonPortStatus.AVAILABLE;
    private Long connectedCableId;
    private int maxSplitRatio = DEFAULT_MAX_SPLIT_RATIO;
    private String notes;

    public PonPort copy() {
        PonPort p = new PonPort();
        p.id = id;
        p.oltId = oltId;
        p.portNumber = portNumber;
        p.label = label;
        p.status = status;
        p.connectedCableId = connectedCableId;
        p.maxSplitRatio = maxSplitRatio;
        p.notes = notes;
        return p;
    }
}
