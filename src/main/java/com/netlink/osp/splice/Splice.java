package com.netlink.osp.splice;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * A fiber-to-fiber joint inside a tray. {@code (trayId, fiberA, fiberB)} is
 * unique. Cable names and resolved colors of both sides are denormalized
 * onto the record.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Splice {
    private long id;
    private long trayId;

    private Long cableAId;
    private String cableAName;
    private int fiberA;
    private String tubeAColor, fiberAColor;

    private Long cableBId;
    private String cableBName;
    private int fiberB;
    private String tubeBColor, fiberBColor;

    private SpliceType spliceType;
    private Double loss;
    private String technicianName;
    private Instant timestamp;
    private String notes;
    private Long otdrTraceId;
    private SpliceStatus status;

    public boolean hasLoss() {
        return loss != null;
    }

    public boolean samePair(int a, int b) {
        return fiberA == a && fiberB == b;
    }

    public Splice copy() {
        Splice s = new Splice();
        s.id = id;
        s.trayId = trayId;
        s.cableAId = cableAId;
        s.cableAName = cableAName;
        s.fiberA = fiberA;
        s.tubeAColor = tubeAColor;
        s.fiberAColor = fiberAColor;
        s.cableBId = cableBId;
        s.cableBName = cableBName;
        s.fiberB = fiberB;
        s.tubeBColor = tubeBColor;
        s.fiberBColor = fiberBColor;
        s.spliceType = spliceType;
        s.loss = loss;
        s.technicianName = technicianName;
        s.timestamp = timestamp;
        s.notes = notes;
        s.otdrTraceId = otdrTraceId;
        s.status = status;
        return s;
    }
}
