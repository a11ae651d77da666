package com.netlink.osp.network;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.netlink.osp.loss.ConnectorType;

import lombok.Data;

/**
 * Patch port of an ODF or enclosure. Output ports of a splitter carry its
 * {@code splitterId}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Port {
    private long id;
    private long enclosureId;
    private Long splitterId;
    private int portNumber;
    private String label;
    private PortType type = PortType.BIDIRECTIONAL;
    private PortStatus status = PortStatus.AVAILABLE;
    private ConnectorType connectorType = ConnectorType.SC;
    private Long connectedCableId;
    private Integer connectedFiber;
    private String customerName;
    private String serviceId;

    public Port copy() {
        Port p = new Port();
        p.id = id;
        p.enclosureId = enclosureId;
        p.splitterId = splitterId;
        p.portNumber = portNumber;
        p.label = label;
        p.type = type;
        p.status = status;
        p.connectorType = connectorType;
        p.connectedCableId = connectedCableId;
        p.connectedFiber = connectedFiber;
        p.customerName = customerName;
        p.serviceId = serviceId;
        return p;
    }
}
