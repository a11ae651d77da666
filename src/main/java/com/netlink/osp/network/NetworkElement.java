package com.netlink.osp.network;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * A persisted node of the network hierarchy: an OLT, an ODF, or an enclosure.
 * <p>
 * The parent link is stored on the child as {@code (parentType, parentId)};
 * edges are derived from it. {@code cableId} names the cable that feeds this
 * element from its parent, when one has been attached; {@code ponPortId} the
 * OLT PON port an LCP is fed from.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class NetworkElement {
    private long id;
    private ElementType type;
    private EnclosureKind kind;
    private String name;
    private ElementType parentType;
    private Long parentId;
    private Long cableId;
    private Long ponPortId;
    private Double canvasX, canvasY;
    private Double gpsLat, gpsLng;
    private String address, notes;
    private Instant createdAt;

    public boolean hasParent() {
        return parentId != null;
    }

    /** Name for display; {@code TYPE-id} when the element has none. */
    public String displayName() {
        return name != null && !name.isBlank() ? name : type.name() + "-" + id;
    }

    public boolean hasPosition() {
        return canvasX != null && canvasY != null;
    }

    public NetworkElement copy() {
        NetworkElement e = new NetworkElement();
        e.id = id;
        e.type = type;
        e.kind = kind;
        e.name = name;
        e.parentType = parentType;
        e.parentId = parentId;
        e.cableId = cableId;
        e.ponPortId = ponPortId;
        e.canvasX = canvasX;
        e.canvasY = canvasY;
        e.gpsLat = gpsLat;
        e.gpsLng = gpsLng;
        e.address = address;
        e.notes = notes;
        e.createdAt = createdAt;
        return e;
    }
}
