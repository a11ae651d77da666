package com.netlink.osp.util;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.netlink.osp.api.NetworkListener;
import com.netlink.osp.network.ConnectResult;
import com.netlink.osp.network.NetworkElement;
import com.netlink.osp.splice.BatchResult;

/**
 * Writes network mutations to the Log4j 2 log. Rejections go out at WARN,
 * rollbacks at ERROR.
 */
public final class LoggingNetworkListener implements NetworkListener {
    private static final Logger log = LogManager.getLogger(LoggingNetworkListener.class);

    @Override
    public void onElementCreated(NetworkElement element) {
        log.info("Created {} '{}' (id={}, parent={}:{})", element.getType(), element.getName(), element.getId(),
                element.getParentType(), element.getParentId());
    }

    @Override
    public void onConnect(ConnectResult result) {
        switch (result.status()) {
            case CONNECTED -> log.info("Connected {} -> {}", result.sourceId(), result.targetId());
            case UNCHANGED -> log.debug("Connection {} -> {} already in place", result.sourceId(), result.targetId());
            case REJECTED -> log.warn("Rejected connection {} -> {}: {}", result.sourceId(), result.targetId(),
                    result.reason());
        }
    }

    @Override
    public void onCascadeDeleted(long rootId, List<Long> removedIds) {
        log.info("Deleted element {} with {} descendant(s)", rootId, removedIds.size() - 1);
    }

    @Override
    public void onCascadeRolledBack(long rootId, Throwable cause) {
        log.error("Cascade delete of element {} rolled back", rootId, cause);
    }

    @Override
    public void onPositionNotPersisted(long elementId, Throwable cause) {
        log.warn("Could not persist canvas position of element {}: {}", elementId, cause.getMessage());
    }

    @Override
    public void onBatchCommitted(long trayId, BatchResult result) {
        log.info("Batch splice on tray {}: {} created, {} already present", trayId, result.created(),
                result.skipped());
    }
}
