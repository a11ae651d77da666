package com.netlink.osp.store;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;

import com.netlink.osp.api.NotFoundException;
import com.netlink.osp.network.Cable;
import com.netlink.osp.network.NetworkElement;
import com.netlink.osp.network.PonPort;
import com.netlink.osp.network.Port;
import com.netlink.osp.network.Splitter;
import com.netlink.osp.network.Tray;
import com.netlink.osp.splice.Splice;

import lombok.extern.log4j.Log4j2;

/**
 * {@link NetworkStore} over id-indexed sorted maps.
 *
 * <p>
 * Stored objects are private copies that are replaced, never mutated, so a
 * transaction snapshot only needs to copy the maps themselves. Nested
 * transactions join the outermost one.
 *
 * <p>
 * Not thread-safe; the model is single-user and event driven.
 */
@Log4j2
public class InMemoryNetworkStore implements NetworkStore {
    private TreeMap<Long, NetworkElement> elements = new TreeMap<>();
    private TreeMap<Long, Tray> trays = new TreeMap<>();
    private TreeMap<Long, Port> ports = new TreeMap<>();
    private TreeMap<Long, Splitter> splitters = new TreeMap<>();
    private TreeMap<Long, PonPort> ponPorts = new TreeMap<>();
    private TreeMap<Long, Cable> cables = new TreeMap<>();
    private TreeMap<Long, Splice> splices = new TreeMap<>();
    private long nextId = 1;
    private int txDepth;

    // ── Elements ────────────────────────────────────────────────────

    @Override
    public long putElement(NetworkElement element) {
        if (element.getId() == 0)
            element.setId(allocateId());
        else
            reserve(element.getId());
        elements.put(element.getId(), element.copy());
        return element.getId();
    }

    @Override
    public Optional<NetworkElement> findElement(long id) {
        return Optional.ofNullable(elements.get(id)).map(NetworkElement::copy);
    }

    @Override
    public List<NetworkElement> elements() {
        List<NetworkElement> out = new ArrayList<>(elements.size());
        for (NetworkElement e : elements.values())
            out.add(e.copy());
        return out;
    }

    @Override
    public void removeElement(long id) {
        if (elements.remove(id) == null)
            throw new NotFoundException("Element", id);
    }

    // ── Trays ───────────────────────────────────────────────────────

    @Override
    public long putTray(Tray tray) {
        if (tray.getId() == 0)
            tray.setId(allocateId());
        else
            reserve(tray.getId());
        trays.put(tray.getId(), tray.copy());
        return tray.getId();
    }

    @Override
    public Optional<Tray> findTray(long id) {
        return Optional.ofNullable(trays.get(id)).map(Tray::copy);
    }

    @Override
    public List<Tray> traysOf(long enclosureId) {
        List<Tray> out = new ArrayList<>();
        for (Tray t : trays.values()) {
            if (t.getEnclosureId() == enclosureId)
                out.add(t.copy());
        }
        out.sort(Comparator.comparingInt(Tray::getNumber));
        return out;
    }

    @Override
    public void removeTray(long id) {
        if (trays.remove(id) == null)
            throw new NotFoundException("Tray", id);
    }

    // ── Ports ───────────────────────────────────────────────────────

    @Override
    public long putPort(Port port) {
        if (port.getId() == 0)
            port.setId(allocateId());
        else
            reserve(port.getId());
        ports.put(port.getId(), port.copy());
        return port.getId();
    }

    @Override
    public List<Port> portsOf(long enclosureId) {
        List<Port> out = new ArrayList<>();
        for (Port p : ports.values()) {
            if (p.getEnclosureId() == enclosureId)
                out.add(p.copy());
        }
        out.sort(Comparator.comparingInt(Port::getPortNumber));
        return out;
    }

    @Override
    public void removePort(long id) {
        if (ports.remove(id) == null)
            throw new NotFoundException("Port", id);
    }

    // ── Splitters ───────────────────────────────────────────────────

    @Override
    public long putSplitter(Splitter splitter) {
        if (splitter.getId() == 0)
            splitter.setId(allocateId());
        else
            reserve(splitter.getId());
        splitters.put(splitter.getId(), splitter.copy());
        return splitter.getId();
    }

    @Override
    public Optional<Splitter> findSplitter(long id) {
        return Optional.ofNullable(splitters.get(id)).map(Splitter::copy);
    }

    @Override
    public List<Splitter> splittersOf(long enclosureId) {
        List<Splitter> out = new ArrayList<>();
        for (Splitter s : splitters.values()) {
            if (s.getEnclosureId() == enclosureId)
                out.add(s.copy());
        }
        return out;
    }

    @Override
    public void removeSplitter(long id) {
        if (splitters.remove(id) == null)
            throw new NotFoundException("Splitter", id);
    }

    // ── PON ports ───────────────────────────────────────────────────

    @Override
    public long putPonPort(PonPort port) {
        if (port.getId() == 0)
            port.setId(allocateId());
        else
            reserve(port.getId());
        ponPorts.put(port.getId(), port.copy());
        return port.getId();
    }

    @Override
    public Optional<PonPort> findPonPort(long id) {
        return Optional.ofNullable(ponPorts.get(id)).map(PonPort::copy);
    }

    @Override
    public List<PonPort> ponPortsOf(long oltId) {
        List<PonPort> out = new ArrayList<>();
        for (PonPort p : ponPorts.values()) {
            if (p.getOltId() == oltId)
                out.add(p.copy());
        }
        out.sort(Comparator.comparingInt(PonPort::getPortNumber));
        return out;
    }

    @Override
    public void removePonPort(long id) {
        if (ponPorts.remove(id) == null)
            throw new NotFoundException("PON port", id);
    }

    // ── Cables ──────────────────────────────────────────────────────

    @Override
    public long putCable(Cable cable) {
        if (cable.getId() == null || cable.getId() == 0)
            cable.setId(allocateId());
        else
            reserve(cable.getId());
        cables.put(cable.getId(), cable.copy());
        return cable.getId();
    }

    @Override
    public Optional<Cable> findCable(long id) {
        return Optional.ofNullable(cables.get(id)).map(Cable::copy);
    }

    @Override
    public List<Cable> cables() {
        List<Cable> out = new ArrayList<>(cables.size());
        for (Cable c : cables.values())
            out.add(c.copy());
        return out;
    }

    @Override
    public void removeCable(long id) {
        if (cables.remove(id) == null)
            throw new NotFoundException("Cable", id);
    }

    // ── Splices ─────────────────────────────────────────────────────

    @Override
    public long putSplice(Splice splice) {
        if (splice.getId() == 0)
            splice.setId(allocateId());
        else
            reserve(splice.getId());
        splices.put(splice.getId(), splice.copy());
        return splice.getId();
    }

    @Override
    public Optional<Splice> findSplice(long id) {
        return Optional.ofNullable(splices.get(id)).map(Splice::copy);
    }

    @Override
    public Optional<Splice> findSplice(long trayId, int fiberA, int fiberB) {
        for (Splice s : splices.values()) {
            if (s.getTrayId() == trayId && s.samePair(fiberA, fiberB))
                return Optional.of(s.copy());
        }
        return Optional.empty();
    }

    @Override
    public List<Splice> splicesOf(long trayId) {
        List<Splice> out = new ArrayList<>();
        for (Splice s : splices.values()) {
            if (s.getTrayId() == trayId)
                out.add(s.copy());
        }
        out.sort(Comparator.comparingInt(Splice::getFiberA).thenComparingInt(Splice::getFiberB));
        return out;
    }

    @Override
    public List<Splice> splices() {
        List<Splice> out = new ArrayList<>(splices.size());
        for (Splice s : splices.values())
            out.add(s.copy());
        return out;
    }

    @Override
    public void removeSplice(long id) {
        if (splices.remove(id) == null)
            throw new NotFoundException("Splice", id);
    }

    // ── Unit of work ────────────────────────────────────────────────

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        if (txDepth > 0) {
            txDepth++;
            try {
                return work.get();
            } finally {
                txDepth--;
            }
        }

        Snapshot before = new Snapshot();
        txDepth = 1;
        try {
            return work.get();
        } catch (RuntimeException | Error e) {
            before.restore();
            log.debug("Transaction rolled back: {}", e.toString());
            throw e;
        } finally {
            txDepth = 0;
        }
    }

    private long allocateId() {
        return nextId++;
    }

    private void reserve(long id) {
        if (id >= nextId)
            nextId = id + 1;
    }

    private final class Snapshot {
        private final TreeMap<Long, NetworkElement> elements = new TreeMap<>(InMemoryNetworkStore.this.elements);
        private final TreeMap<Long, Tray> trays = new TreeMap<>(InMemoryNetworkStore.this.trays);
        private final TreeMap<Long, Port> ports = new TreeMap<>(InMemoryNetworkStore.this.ports);
        private final TreeMap<Long, Splitter> splitters = new TreeMap<>(InMemoryNetworkStore.this.splitters);
        private final TreeMap<Long, PonPort> ponPorts = new TreeMap<>(InMemoryNetworkStore.this.ponPorts);
        private final TreeMap<Long, Cable> cables = new TreeMap<>(InMemoryNetworkStore.this.cables);
        private final TreeMap<Long, Splice> splices = new TreeMap<>(InMemoryNetworkStore.this.splices);
        private final long nextId = InMemoryNetworkStore.this.nextId;

        void restore() {
            InMemoryNetworkStore.this.elements = elements;
            InMemoryNetworkStore.this.trays = trays;
            InMemoryNetworkStore.this.ports = ports;
            InMemoryNetworkStore.this.splitters = splitters;
            InMemoryNetworkStore.this.ponPorts = ponPorts;
            InMemoryNetworkStore.this.cables = cables;
            InMemoryNetworkStore.this.splices = splices;
            InMemoryNetworkStore.this.nextId = nextId;
        }
    }
}
