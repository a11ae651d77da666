package com.netlink.osp.network;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.netlink.osp.api.NetworkListener;
import com.netlink.osp.api.NotFoundException;
import com.netlink.osp.api.ValidationException;
import com.netlink.osp.splice.Splice;
import com.netlink.osp.store.NetworkStore;

import lombok.extern.log4j.Log4j2;

/**
 * Typed parent/child hierarchy of network elements.
 *
 * <p>
 * The parent link lives on the child ({@code parentType, parentId}); edges
 * and child lists are derived from it on every call, so the store stays the
 * single source of truth. Allowed parent/child combinations come from
 * {@link ElementType}.
 *
 * <p>
 * Traversals (descendants, cascade delete, ancestor checks) walk an explicit
 * queue over an id index and never recurse, so closure chains of any depth
 * are handled in a stable breadth-first order.
 */
@Log4j2
public final class NetworkGraph {
    private final NetworkStore store;
    private final NetworkListener listener;
    private final Clock clock;

    public NetworkGraph(NetworkStore store, NetworkListener listener) {
        this(store, listener, Clock.systemUTC());
    }

    public NetworkGraph(NetworkStore store, NetworkListener listener, Clock clock) {
        this.store = store;
        this.listener = listener;
        this.clock = clock;
    }

    public static Set<ElementType> allowedChildTypes(ElementType type) {
        return type.allowedChildTypes();
    }

    // ── Creation ────────────────────────────────────────────────────

    /** Creates an OLT. A blank name is generated. */
    public NetworkElement createOlt(String name) {
        return createChild(null, null, ElementType.OLT, name, null);
    }

    /** Instant create: generated name, no position. */
    public NetworkElement createChild(Long parentId, ElementType parentType, ElementType childType) {
        return createChild(parentId, parentType, childType, null, null);
    }

    public NetworkElement createChild(Long parentId, ElementType parentType, ElementType childType, String name) {
        return createChild(parentId, parentType, childType, name, null);
    }

    /**
     * Creates an element under {@code parentId}.
     * <p>
     * Every precondition is checked before anything is written. A blank
     * {@code name} becomes {@code TYPE-n}, where {@code n} is one more than
     * the number of elements of that type.
     *
     * @param parentType expected type of the parent, or null to accept
     *                   whatever the parent is
     * @param position   initial canvas position, or null
     * @throws NotFoundException   if {@code parentId} names no element
     * @throws ValidationException if an OLT is given a parent, a non-root
     *                             type has none, the parent's type differs from
     *                             {@code parentType}, or the parent type may not
     *                             hold {@code childType}
     */
    public NetworkElement createChild(Long parentId, ElementType parentType, ElementType childType, String name,
            Position position) {
        return create(parentId, parentType, childType, EnclosureKind.defaultFor(childType), name, position);
    }

    /** Creates an enclosure of a specific subtype; the subtype's family is its role. */
    public NetworkElement createEnclosure(long parentId, EnclosureKind kind, String name, Position position) {
        return create(parentId, null, kind.family(), kind, name, position);
    }

    private NetworkElement create(Long parentId, ElementType parentType, ElementType childType, EnclosureKind kind,
            String name, Position position) {
        if (childType == null)
            throw new ValidationException("Element type required");
        NetworkElement parent = checkParent(parentId, parentType, childType);

        NetworkElement e = new NetworkElement();
        e.setType(childType);
        e.setKind(kind);
        e.setName(name == null || name.isBlank() ? nextName(childType) : name.trim());
        if (parent != null) {
            e.setParentType(parent.getType());
            e.setParentId(parent.getId());
        }
        if (position != null) {
            e.setCanvasX(position.x());
            e.setCanvasY(position.y());
        }
        e.setCreatedAt(clock.instant());
        store.putElement(e);
        listener.onElementCreated(e.copy());
        return e;
    }

    private NetworkElement checkParent(Long parentId, ElementType parentType, ElementType childType) {
        if (childType.isRoot()) {
            if (parentId != null)
                throw new ValidationException(childType + " is a root element and cannot have a parent");
            return null;
        }
        if (parentId == null) {
            boolean anyCandidate = store.elements().stream()
                    .anyMatch(e -> childType.allowedParentTypes().contains(e.getType()));
            if (!anyCandidate)
                throw new ValidationException("Cannot create " + childType + ": no "
                        + describe(childType.allowedParentTypes()) + " exists in the project");
            throw new ValidationException(childType + " requires a parent ("
                    + describe(childType.allowedParentTypes()) + ")");
        }
        NetworkElement parent = element(parentId);
        if (parentType != null && parent.getType() != parentType)
            throw new ValidationException("Element " + parentId + " is " + parent.getType() + ", not " + parentType);
        if (!parent.getType().canParent(childType))
            throw new ValidationException(childType + " cannot be placed under " + parent.getType()
                    + "; allowed parents: " + describe(childType.allowedParentTypes()));
        return parent;
    }

    private String nextName(ElementType type) {
        long existing = store.elements().stream().filter(e -> e.getType() == type).count();
        return type.namePrefix() + "-" + (existing + 1);
    }

    private static String describe(Set<ElementType> types) {
        List<String> names = new ArrayList<>();
        for (ElementType t : types)
            names.add(t.name());
        return String.join(" or ", names);
    }

    // ── Connections ─────────────────────────────────────────────────

    /**
     * Makes {@code targetId} a child of {@code sourceId}.
     * <p>
     * Rejected without change when the two are the same element, the
     * source's type may not hold the target's type, or the target is an
     * ancestor of the source. The listener hears every outcome.
     *
     * @throws NotFoundException if either element does not exist
     */
    public ConnectResult connect(long sourceId, long targetId) {
        NetworkElement source = element(sourceId);
        NetworkElement target = element(targetId);

        ConnectResult result;
        if (sourceId == targetId) {
            result = ConnectResult.rejected(sourceId, targetId, "An element cannot be connected to itself");
        } else if (!source.getType().canParent(target.getType())) {
            result = ConnectResult.rejected(sourceId, targetId, target.getType() + " cannot be a child of "
                    + source.getType() + "; allowed children: " + source.getType().allowedChildTypes());
        } else if (target.getParentId() != null && target.getParentId() == sourceId) {
            result = ConnectResult.unchanged(sourceId, targetId);
        } else if (isAncestor(targetId, source)) {
            result = ConnectResult.rejected(sourceId, targetId,
                    target.getName() + " is upstream of " + source.getName() + "; connecting would form a loop");
        } else {
            target.setParentType(source.getType());
            target.setParentId(sourceId);
            store.putElement(target);
            result = ConnectResult.connected(sourceId, targetId);
        }
        listener.onConnect(result);
        return result;
    }

    /** Clears the parent link of an element. Returns false if it had none. */
    public boolean disconnect(long childId) {
        NetworkElement child = element(childId);
        if (!child.hasParent())
            return false;
        child.setParentType(null);
        child.setParentId(null);
        store.putElement(child);
        log.debug("Disconnected {} '{}' from its parent", child.getType(), child.getName());
        return true;
    }

    /**
     * Stores {@code cable} as the feed of {@code childId}, the cable on the
     * edge from its parent. Returns the persisted cable.
     */
    public Cable attachCable(long childId, Cable cable) {
        NetworkElement child = element(childId);
        if (cable.getFiberCount() < 1)
            throw new ValidationException("Cable fiber count must be positive: " + cable.getFiberCount());
        return store.inTransaction(() -> {
            store.putCable(cable);
            child.setCableId(cable.getId());
            store.putElement(child);
            return cable.copy();
        });
    }

    private boolean isAncestor(long candidate, NetworkElement of) {
        Set<Long> seen = new HashSet<>();
        Long cursor = of.getParentId();
        while (cursor != null && seen.add(cursor)) {
            if (cursor == candidate)
                return true;
            cursor = store.findElement(cursor).map(NetworkElement::getParentId).orElse(null);
        }
        return false;
    }

    // ── Deletion ────────────────────────────────────────────────────

    /** Ids of every element below {@code id}, breadth-first, the element itself excluded. */
    public List<Long> descendants(long id) {
        element(id);
        return collectDescendants(id, childIndex());
    }

    /** Number of elements a cascade delete of {@code id} would remove besides {@code id}. */
    public int descendantCount(long id) {
        return descendants(id).size();
    }

    /**
     * Deletes an element, all its descendants, and every tray, splice,
     * splitter and port they own, as one unit of work. Cables those records
     * referenced go too once nothing left in the store refers to them, and
     * PON ports that fed a removed LCP are released. Either everything is removed or, on failure, nothing is.
     *
     * @return number of descendants removed
     * @throws NotFoundException if the element does not exist
     */
    public int deleteCascade(long id) {
        element(id);
        List<Long> removed = new ArrayList<>();
        removed.add(id);
        removed.addAll(collectDescendants(id, childIndex()));

        try {
            store.inTransaction(() -> {
                Set<Long> cables = new LinkedHashSet<>();
                Set<Long> ponPortIds = new LinkedHashSet<>();
                for (long elementId : removed) {
                    NetworkElement e = element(elementId);
                    if (e.getPonPortId() != null)
                        ponPortIds.add(e.getPonPortId());
                    removeOwned(e, cables);
                }
                ponPortIds.forEach(this::releasePonPort);
                for (long cableId : cables) {
                    if (store.findCable(cableId).isPresent() && !cableInUse(cableId))
                        store.removeCable(cableId);
                }
            });
        } catch (RuntimeException e) {
            listener.onCascadeRolledBack(id, e);
            throw e;
        }
        listener.onCascadeDeleted(id, Collections.unmodifiableList(removed));
        return removed.size() - 1;
    }

    // Cables referenced by anything removed are collected into cableRefs
    private void removeOwned(NetworkElement e, Set<Long> cableRefs) {
        long elementId = e.getId();
        addRef(cableRefs, e.getCableId());
        for (Tray tray : store.traysOf(elementId)) {
            for (Splice s : store.splicesOf(tray.getId())) {
                addRef(cableRefs, s.getCableAId());
                addRef(cableRefs, s.getCableBId());
                store.removeSplice(s.getId());
            }
            store.removeTray(tray.getId());
        }
        for (Port p : store.portsOf(elementId)) {
            addRef(cableRefs, p.getConnectedCableId());
            store.removePort(p.getId());
        }
        for (Splitter sp : store.splittersOf(elementId)) {
            addRef(cableRefs, sp.getInputCableId());
            store.removeSplitter(sp.getId());
        }
        for (PonPort pp : store.ponPortsOf(elementId)) {
            addRef(cableRefs, pp.getConnectedCableId());
            store.removePonPort(pp.getId());
        }
        store.removeElement(elementId);
    }

    private static void addRef(Set<Long> refs, Long cableId) {
        if (cableId != null)
            refs.add(cableId);
    }

    private boolean cableInUse(long cableId) {
        for (NetworkElement e : store.elements()) {
            if (e.getCableId() != null && e.getCableId() == cableId)
                return true;
            for (Port p : store.portsOf(e.getId())) {
                if (p.getConnectedCableId() != null && p.getConnectedCableId() == cableId)
                    return true;
            }
            for (Splitter sp : store.splittersOf(e.getId())) {
                if (sp.getInputCableId() != null && sp.getInputCableId() == cableId)
                    return true;
            }
            for (PonPort pp : store.ponPortsOf(e.getId())) {
                if (pp.getConnectedCableId() != null && pp.getConnectedCableId() == cableId)
                    return true;
            }
        }
        for (Splice sp : store.splices()) {
            if (Long.valueOf(cableId).equals(sp.getCableAId()) || Long.valueOf(cableId).equals(sp.getCableBId()))
                return true;
        }
        return false;
    }

    private static List<Long> collectDescendants(long rootId, Map<Long, List<Long>> childIndex) {
        List<Long> out = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        seen.add(rootId);
        ArrayDeque<Long> queue = new ArrayDeque<>();
        queue.add(rootId);
        while (!queue.isEmpty()) {
            long curr = queue.poll();
            for (long child : childIndex.getOrDefault(curr, List.of())) {
                if (seen.add(child)) {
                    out.add(child);
                    queue.add(child);
                }
            }
        }
        return out;
    }

    // Parent id -> child ids, children in id order
    private Map<Long, List<Long>> childIndex() {
        Map<Long, List<Long>> index = new LinkedHashMap<>();
        for (NetworkElement e : store.elements()) {
            if (e.hasParent())
                index.computeIfAbsent(e.getParentId(), k -> new ArrayList<>()).add(e.getId());
        }
        return index;
    }

    // ── Positions ───────────────────────────────────────────────────

    /**
     * Saves a manual canvas position. Best effort: a failure is reported to
     * the listener and returned as {@code false}, never thrown.
     */
    public boolean setPosition(long id, double x, double y) {
        try {
            NetworkElement e = element(id);
            e.setCanvasX(x);
            e.setCanvasY(y);
            store.putElement(e);
            return true;
        } catch (RuntimeException ex) {
            listener.onPositionNotPersisted(id, ex);
            return false;
        }
    }

    /** Layout of the current graph with default spacing. Nothing is written. */
    public Map<Long, Position> autoLayout() {
        return autoLayout(LayoutOptions.DEFAULTS);
    }

    public Map<Long, Position> autoLayout(LayoutOptions options) {
        return HierarchyLayout.compute(store.elements(), edges(), options);
    }

    /** Computes the layout and stores it, replacing manual positions. */
    public Map<Long, Position> applyLayout(LayoutOptions options) {
        Map<Long, Position> positions = autoLayout(options);
        store.inTransaction(() -> {
            for (var entry : positions.entrySet()) {
                NetworkElement e = element(entry.getKey());
                e.setCanvasX(entry.getValue().x());
                e.setCanvasY(entry.getValue().y());
                store.putElement(e);
            }
        });
        log.info("Applied auto layout to {} element(s)", positions.size());
        return positions;
    }

    // ── Ports ───────────────────────────────────────────────────────

    /**
     * Appends {@code count} available ports to an ODF or enclosure, numbered
     * after the existing ones.
     */
    public List<Port> addPorts(long enclosureId, int count) {
        NetworkElement owner = element(enclosureId);
        if (!owner.getType().hasPatchPorts())
            throw new ValidationException(owner.getType() + " '" + owner.displayName()
                    + "' has PON ports, not patch ports");
        if (count < 1)
            throw new ValidationException("Port count must be positive: " + count);
        return store.inTransaction(() -> appendPorts(enclosureId, count, null, PortType.BIDIRECTIONAL));
    }

    private List<Port> appendPorts(long enclosureId, int count, Long splitterId, PortType type) {
        int next = 1;
        for (Port p : store.portsOf(enclosureId))
            next = Math.max(next, p.getPortNumber() + 1);
        List<Port> added = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Port p = new Port();
            p.setEnclosureId(enclosureId);
            p.setSplitterId(splitterId);
            p.setPortNumber(next + i);
            p.setType(type);
            store.putPort(p);
            added.add(p);
        }
        return added;
    }

    public List<Port> ports(long enclosureId) {
        return store.portsOf(enclosureId);
    }

    /**
     * Marks a port connected to a cable fiber, or clears it when
     * {@code cableId} is null.
     */
    public Port patchPort(long enclosureId, int portNumber, Long cableId, Integer fiber) {
        Port port = store.portsOf(enclosureId).stream()
                .filter(p -> p.getPortNumber() == portNumber)
                .findFirst()
                .orElseThrow(() -> new ValidationException("Element " + enclosureId + " has no port " + portNumber));
        if (cableId != null) {
            requireFiber(cableId, fiber);
            port.setStatus(PortStatus.CONNECTED);
        } else {
            port.setStatus(PortStatus.AVAILABLE);
            fiber = null;
        }
        port.setConnectedCableId(cableId);
        port.setConnectedFiber(fiber);
        store.putPort(port);
        return port;
    }

    private Cable requireFiber(long cableId, Integer fiber) {
        Cable cable = store.findCable(cableId).orElseThrow(() -> new NotFoundException("Cable", cableId));
        if (fiber == null || fiber < 1 || fiber > cable.getFiberCount())
            throw new ValidationException("Fiber " + fiber + " is outside cable '" + cable.getName() + "' ("
                    + cable.getFiberCount() + "F)");
        return cable;
    }

    // ── Splitters ───────────────────────────────────────────────────

    /**
     * Installs a splitter in an LCP or NAP together with one output port per
     * leg, numbered after the enclosure's existing ports. A blank name
     * becomes {@code SPL-nn}.
     */
    public Splitter addSplitter(long enclosureId, SplitterRatio ratio, String name) {
        NetworkElement enclosure = element(enclosureId);
        if (enclosure.getType() != ElementType.LCP && enclosure.getType() != ElementType.NAP)
            throw new ValidationException("Splitters belong in an LCP or NAP, not " + enclosure.getType() + " '"
                    + enclosure.displayName() + "'");
        if (ratio == null)
            throw new ValidationException("Splitter ratio required");
        return store.inTransaction(() -> {
            Splitter splitter = new Splitter();
            splitter.setEnclosureId(enclosureId);
            splitter.setRatio(ratio);
            splitter.setName(name == null || name.isBlank()
                    ? String.format("SPL-%02d", store.splittersOf(enclosureId).size() + 1)
                    : name.trim());
            splitter.setCreatedAt(clock.instant());
            store.putSplitter(splitter);
            appendPorts(enclosureId, ratio.outputs(), splitter.getId(), PortType.OUTPUT);
            log.debug("Added {} splitter '{}' to {}", ratio.code(), splitter.getName(), enclosure.displayName());
            return splitter;
        });
    }

    public Splitter splitter(long splitterId) {
        return store.findSplitter(splitterId).orElseThrow(() -> new NotFoundException("Splitter", splitterId));
    }

    public List<Splitter> splitters(long enclosureId) {
        return store.splittersOf(enclosureId);
    }

    /** Output ports of a splitter in port order. */
    public List<Port> splitterPorts(long splitterId) {
        Splitter splitter = splitter(splitterId);
        List<Port> out = new ArrayList<>();
        for (Port p : store.portsOf(splitter.getEnclosureId())) {
            if (p.getSplitterId() != null && p.getSplitterId() == splitterId)
                out.add(p);
        }
        return out;
    }

    /** Patches the feeding fiber into a splitter's input. */
    public Splitter feedSplitter(long splitterId, long cableId, int fiber) {
        Splitter splitter = splitter(splitterId);
        requireFiber(cableId, fiber);
        splitter.setInputCableId(cableId);
        splitter.setInputFiber(fiber);
        store.putSplitter(splitter);
        return splitter;
    }

    /** Removes a splitter and its output ports. Returns the number of ports removed. */
    public int deleteSplitter(long splitterId) {
        List<Port> legs = splitterPorts(splitterId);
        store.inTransaction(() -> {
            for (Port p : legs)
                store.removePort(p.getId());
            store.removeSplitter(splitterId);
        });
        return legs.size();
    }

    // ── PON ports ───────────────────────────────────────────────────

    /** Appends {@code count} PON ports labelled {@code PON-nn} to an OLT. */
    public List<PonPort> addPonPorts(long oltId, int count, int maxSplitRatio) {
        NetworkElement olt = element(oltId);
        if (olt.getType() != ElementType.OLT)
            throw new ValidationException(olt.getType() + " '" + olt.displayName() + "' has no PON ports");
        if (count < 1)
            throw new ValidationException("PON port count must be positive: " + count);
        if (maxSplitRatio < 1)
            throw new ValidationException("Maximum split ratio must be positive: " + maxSplitRatio);
        return store.inTransaction(() -> {
            int next = 1;
            for (PonPort p : store.ponPortsOf(oltId))
                next = Math.max(next, p.getPortNumber() + 1);
            List<PonPort> added = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                PonPort p = new PonPort();
                p.setOltId(oltId);
                p.setPortNumber(next + i);
                p.setLabel(String.format("PON-%02d", next + i));
                p.setMaxSplitRatio(maxSplitRatio);
                store.putPonPort(p);
                added.add(p);
            }
            return added;
        });
    }

    public List<PonPort> ponPorts(long oltId) {
        return store.ponPortsOf(oltId);
    }

    /**
     * Feeds an LCP from PON port {@code portNumber} of the OLT above it. The
     * port becomes active; a port the LCP was fed from before is released.
     *
     * @throws ValidationException if the element is not an LCP, has no OLT
     *                             upstream, or the port is missing or faulty
     */
    public PonPort assignPonPort(long lcpId, int portNumber) {
        NetworkElement lcp = element(lcpId);
        if (lcp.getType() != ElementType.LCP)
            throw new ValidationException("Only an LCP is fed from a PON port, not " + lcp.getType());
        NetworkElement olt = rootOf(lcp)
                .orElseThrow(() -> new ValidationException(lcp.displayName() + " is not connected to an OLT"));
        PonPort port = store.ponPortsOf(olt.getId()).stream()
                .filter(p -> p.getPortNumber() == portNumber)
                .findFirst()
                .orElseThrow(() -> new ValidationException(olt.displayName() + " has no PON port " + portNumber));
        if (port.getStatus() == PonPortStatus.FAULTY)
            throw new ValidationException("PON port " + port.getLabel() + " is faulty");

        Long previous = lcp.getPonPortId();
        return store.inTransaction(() -> {
            lcp.setPonPortId(port.getId());
            store.putElement(lcp);
            port.setStatus(PonPortStatus.ACTIVE);
            store.putPonPort(port);
            if (previous != null && previous != port.getId())
                releasePonPort(previous);
            return port;
        });
    }

    // Active port with no LCP left on it goes back to available
    private void releasePonPort(long ponPortId) {
        Optional<PonPort> port = store.findPonPort(ponPortId);
        if (port.isEmpty() || port.get().getStatus() != PonPortStatus.ACTIVE)
            return;
        for (NetworkElement e : store.elements()) {
            if (e.getPonPortId() != null && e.getPonPortId() == ponPortId)
                return;
        }
        port.get().setStatus(PonPortStatus.AVAILABLE);
        store.putPonPort(port.get());
    }

    private Optional<NetworkElement> rootOf(NetworkElement of) {
        Set<Long> seen = new HashSet<>();
        NetworkElement cursor = of;
        while (cursor.hasParent() && seen.add(cursor.getId())) {
            Optional<NetworkElement> parent = store.findElement(cursor.getParentId());
            if (parent.isEmpty())
                return Optional.empty();
            cursor = parent.get();
        }
        return cursor.getType().isRoot() ? Optional.of(cursor) : Optional.empty();
    }

    // ── Queries ─────────────────────────────────────────────────────

    public NetworkElement element(long id) {
        return store.findElement(id).orElseThrow(() -> new NotFoundException("Element", id));
    }

    public Optional<NetworkElement> find(long id) {
        return store.findElement(id);
    }

    public List<NetworkElement> elements() {
        return store.elements();
    }

    public List<NetworkElement> elementsOf(ElementType type) {
        List<NetworkElement> out = new ArrayList<>();
        for (NetworkElement e : store.elements()) {
            if (e.getType() == type)
                out.add(e);
        }
        return out;
    }

    public List<NetworkElement> children(long id) {
        List<NetworkElement> out = new ArrayList<>();
        for (NetworkElement e : store.elements()) {
            if (e.getParentId() != null && e.getParentId() == id)
                out.add(e);
        }
        return out;
    }

    /** Elements that are roots by type. */
    public List<NetworkElement> roots() {
        List<NetworkElement> out = new ArrayList<>();
        for (NetworkElement e : store.elements()) {
            if (e.getType().isRoot())
                out.add(e);
        }
        return out;
    }

    /**
     * Elements whose type requires a parent but which have none, or whose
     * parent no longer exists.
     */
    public List<NetworkElement> orphans() {
        List<NetworkElement> all = store.elements();
        Set<Long> ids = new HashSet<>();
        for (NetworkElement e : all)
            ids.add(e.getId());
        List<NetworkElement> out = new ArrayList<>();
        for (NetworkElement e : all) {
            if (e.getType().isRoot())
                continue;
            if (!e.hasParent() || !ids.contains(e.getParentId()))
                out.add(e);
        }
        return out;
    }

    public List<NetworkElement> orphans(ElementType type) {
        List<NetworkElement> out = new ArrayList<>();
        for (NetworkElement e : orphans()) {
            if (e.getType() == type)
                out.add(e);
        }
        return out;
    }

    /** Parent-to-child edges with the feeding cable's metadata, in child id order. */
    public List<GraphEdge> edges() {
        List<NetworkElement> all = store.elements();
        Map<Long, NetworkElement> byId = new LinkedHashMap<>();
        for (NetworkElement e : all)
            byId.put(e.getId(), e);

        List<GraphEdge> out = new ArrayList<>();
        for (NetworkElement child : all) {
            if (!child.hasParent())
                continue;
            NetworkElement parent = byId.get(child.getParentId());
            if (parent == null)
                continue;
            Optional<Cable> cable = child.getCableId() == null ? Optional.empty()
                    : store.findCable(child.getCableId());
            out.add(new GraphEdge(
                    GraphEdge.edgeId(parent.getType(), parent.getId(), child.getType(), child.getId()),
                    parent.getId(), child.getId(),
                    EdgeCategory.between(parent.getType(), child.getType()),
                    cable.map(Cable::getName).orElse(null),
                    cable.map(Cable::getFiberCount).orElse(null)));
        }
        return out;
    }

    /** Element, tray and port totals for {@code id} and everything below it. */
    public HierarchyStats stats(long id) {
        List<Long> subtree = new ArrayList<>();
        subtree.add(id);
        subtree.addAll(descendants(id));

        Map<ElementType, Integer> byType = new EnumMap<>(ElementType.class);
        int trays = 0, ports = 0, connected = 0;
        for (long elementId : subtree) {
            byType.merge(element(elementId).getType(), 1, Integer::sum);
            trays += store.traysOf(elementId).size();
            for (Port p : store.portsOf(elementId)) {
                ports++;
                if (p.getStatus() == PortStatus.CONNECTED)
                    connected++;
            }
        }
        return new HierarchyStats(id, subtree.size(), Collections.unmodifiableMap(byType), trays, ports, connected);
    }
}
