package com.netlink.osp;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

import com.netlink.osp.api.NetworkListener;
import com.netlink.osp.io.ProjectDefinition;
import com.netlink.osp.io.ProjectJson;
import com.netlink.osp.network.NetworkGraph;
import com.netlink.osp.splice.SpliceContinuityStore;
import com.netlink.osp.store.InMemoryNetworkStore;
import com.netlink.osp.store.NetworkStore;
import com.netlink.osp.trace.FiberPathTracer;
import com.netlink.osp.util.CompositeNetworkListener;
import com.netlink.osp.util.LoggingNetworkListener;
import com.netlink.osp.util.TopologyExplain;

import lombok.extern.log4j.Log4j2;

/**
 * One open project: a store with the hierarchy graph and splice store
 * working on it. Every mutation is logged; further listeners can be added
 * with {@link #addListener(NetworkListener)}.
 */
@Log4j2
public final class OspProject {
    private final String name;
    private final NetworkStore store;
    private final CompositeNetworkListener listeners;
    private final NetworkGraph graph;
    private final SpliceContinuityStore splices;
    private final FiberPathTracer tracer;

    public OspProject(String name) {
        this(name, new InMemoryNetworkStore(), Clock.systemUTC());
    }

    public OspProject(String name, NetworkStore store, Clock clock) {
        this.name = name;
        this.store = store;
        this.listeners = new CompositeNetworkListener().add(new LoggingNetworkListener());
        this.graph = new NetworkGraph(store, listeners, clock);
        this.splices = new SpliceContinuityStore(store, listeners, clock);
        this.tracer = new FiberPathTracer(store);
    }

    /** Opens a saved project into a fresh in-memory store. */
    public static OspProject open(Path file) throws IOException {
        ProjectDefinition def = ProjectJson.readFile(file);
        OspProject project = new OspProject(def.getName() != null ? def.getName() : file.getFileName().toString());
        ProjectJson.loadInto(def, project.store);
        log.info("Opened project '{}' from {}", project.name, file);
        return project;
    }

    public void save(Path file) throws IOException {
        ProjectJson.writeFile(file, store, name);
    }

    public OspProject addListener(NetworkListener listener) {
        listeners.add(listener);
        return this;
    }

    public String name() {
        return name;
    }

    public NetworkStore store() {
        return store;
    }

    public NetworkGraph graph() {
        return graph;
    }

    public SpliceContinuityStore splices() {
        return splices;
    }

    public FiberPathTracer tracer() {
        return tracer;
    }

    public TopologyExplain explain() {
        return new TopologyExplain(graph);
    }
}
