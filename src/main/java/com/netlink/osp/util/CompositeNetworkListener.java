package com.netlink.osp.util;

import java.util.Arrays;
import java.util.List;

import com.netlink.osp.api.NetworkListener;
import com.netlink.osp.network.ConnectResult;
import com.netlink.osp.network.NetworkElement;
import com.netlink.osp.splice.BatchResult;

/**
 * Fans each callback out to several {@link NetworkListener}s in registration
 * order.
 */
public class CompositeNetworkListener implements NetworkListener {
    private NetworkListener[] listeners = new NetworkListener[0];

    public CompositeNetworkListener add(NetworkListener listener) {
        NetworkListener[] old = listeners;
        NetworkListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onElementCreated(NetworkElement element) {
        for (NetworkListener l : listeners)
            l.onElementCreated(element);
    }

    @Override
    public void onConnect(ConnectResult result) {
        for (NetworkListener l : listeners)
            l.onConnect(result);
    }

    @Override
    public void onCascadeDeleted(long rootId, List<Long> removedIds) {
        for (NetworkListener l : listeners)
            l.onCascadeDeleted(rootId, removedIds);
    }

    @Override
    public void onCascadeRolledBack(long rootId, Throwable cause) {
        for (NetworkListener l : listeners)
            l.onCascadeRolledBack(rootId, cause);
    }

    @Override
    public void onPositionNotPersisted(long elementId, Throwable cause) {
        for (NetworkListener l : listeners)
            l.onPositionNotPersisted(elementId, cause);
    }

    @Override
    public void onBatchCommitted(long trayId, BatchResult result) {
        for (NetworkListener l : listeners)
            l.onBatchCommitted(trayId, result);
    }
}
