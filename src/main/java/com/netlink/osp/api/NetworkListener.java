package com.netlink.osp.api;

import java.util.List;

import com.netlink.osp.network.ConnectResult;
import com.netlink.osp.network.NetworkElement;
import com.netlink.osp.splice.BatchResult;

/**
 * Observer of network model mutations.
 *
 * <p>
 * Callbacks run synchronously on the caller's thread after the mutation has
 * been committed (or rolled back). They are for logging, auditing and UI
 * refresh; the outcome itself is always returned to the caller directly, so a
 * listener is never the only place a rejection is reported.
 */
public interface NetworkListener {

    /** A new element was persisted. */
    void onElementCreated(NetworkElement element);

    /** A {@code connect} call finished, successfully or not. */
    void onConnect(ConnectResult result);

    /**
     * A cascade delete committed.
     *
     * @param rootId     the element the delete was requested for
     * @param removedIds every removed element id, root first, then descendants
     *                   in breadth-first order
     */
    void onCascadeDeleted(long rootId, List<Long> removedIds);

    /** A cascade delete failed and the store was restored. */
    void onCascadeRolledBack(long rootId, Throwable cause);

    /** Best-effort canvas position write failed; the drag is unaffected. */
    void onPositionNotPersisted(long elementId, Throwable cause);

    /** A batch of splices was committed to a tray. */
    void onBatchCommitted(long trayId, BatchResult result);
}
