package com.netlink.osp.util;

import java.util.ArrayList;
import java.util.List;

import com.netlink.osp.api.NetworkListener;
import com.netlink.osp.network.ConnectResult;
import com.netlink.osp.network.NetworkElement;
import com.netlink.osp.splice.BatchResult;

/** Test listener keeping every callback it receives. */
public class RecordingNetworkListener implements NetworkListener {
    public final List<NetworkElement> created = new ArrayList<>();
    public final List<ConnectResult> connects = new ArrayList<>();
    public final List<List<Long>> cascades = new ArrayList<>();
    public final List<Throwable> rollbacks = new ArrayList<>();
    public final List<Long> positionFailures = new ArrayList<>();
    public final List<BatchResult> batches = new ArrayList<>();

    @Override
    public void onElementCreated(NetworkElement element) {
        created.add(element);
    }

    @Override
    public void onConnect(ConnectResult result) {
        connects.add(result);
    }

    @Override
    public void onCascadeDeleted(long rootId, List<Long> removedIds) {
        cascades.add(removedIds);
    }

    @Override
    public void onCascadeRolledBack(long rootId, Throwable cause) {
        rollbacks.add(cause);
    }

    @Override
    public void onPositionNotPersisted(long elementId, Throwable cause) {
        positionFailures.add(elementId);
    }

    @Override
    public void onBatchCommitted(long trayId, BatchResult result) {
        batches.add(result);
    }
}
