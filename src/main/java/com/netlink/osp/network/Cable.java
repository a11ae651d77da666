package com.netlink.osp.network;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.netlink.osp.loss.FiberType;

import lombok.Data;

/**
 * A fiber cable. Tubes and fibers are derived from {@code fiberCount}, never
 * stored. A cable entered at splice time has no {@code id} until it is
 * attached to a graph edge.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Cable {
    private Long id;
    private String name;
    private int fiberCount;
    private FiberType fiberType = FiberType.SINGLEMODE;
    private Double lengthMeters;
    private String notes;

    /** Ephemeral cable identified only by name and size. */
    public static Cable of(String name, int fiberCount) {
        Cable c = new Cable();
        c.name = name;
        c.fiberCount = fiberCount;
        return c;
    }

    public Cable copy() {
        Cable c = new Cable();
        c.id = id;
        c.name = name;
        c.fiberCount = fiberCount;
        c.fiberType = fiberType;
        c.lengthMeters = lengthMeters;
        c.notes = notes;
        return c;
    }
}
