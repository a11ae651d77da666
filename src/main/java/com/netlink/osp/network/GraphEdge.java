package com.netlink.osp.network;

/**
 * Parent-to-child link derived from a child's parent pointer. Not persisted.
 *
 * @param cableName  name of the feeding cable, or null when none is attached
 * @param fiberCount fiber count of the feeding cable, or null
 */
public record GraphEdge(String id, long sourceId, long targetId, EdgeCategory category,
        String cableName, Integer fiberCount) {

    public static String edgeId(ElementType sourceType, long sourceId, ElementType targetType, long targetId) {
        return "e-" + sourceType.code() + "-" + sourceId + "-" + targetType.code() + "-" + targetId;
    }
}
