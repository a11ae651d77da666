package com.netlink.osp.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToLongFunction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.netlink.osp.api.ValidationException;
import com.netlink.osp.network.Cable;
import com.netlink.osp.network.ElementType;
import com.netlink.osp.network.HierarchyLayout;
import com.netlink.osp.network.NetworkElement;
import com.netlink.osp.network.PonPort;
import com.netlink.osp.network.Port;
import com.netlink.osp.network.Splitter;
import com.netlink.osp.network.Tray;
import com.netlink.osp.splice.Splice;
import com.netlink.osp.store.NetworkStore;

import lombok.extern.log4j.Log4j2;

/**
 * Saves and restores a {@link NetworkStore} as a {@link ProjectDefinition}
 * JSON document. Timestamps are written as ISO-8601 strings.
 */
@Log4j2
public final class ProjectJson {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ProjectJson() {
        // Utility class
    }

    /** Captures the current content of {@code store}. */
    public static ProjectDefinition snapshot(NetworkStore store, String name) {
        ProjectDefinition def = new ProjectDefinition();
        def.setName(name);
        def.setElements(store.elements());
        def.setCables(store.cables());
        def.setSplices(store.splices());
        for (NetworkElement e : def.getElements()) {
            def.getTrays().addAll(store.traysOf(e.getId()));
            def.getSplitters().addAll(store.splittersOf(e.getId()));
            def.getPorts().addAll(store.portsOf(e.getId()));
            def.getPonPorts().addAll(store.ponPortsOf(e.getId()));
        }
        return def;
    }

    public static String write(NetworkStore store, String name) {
        try {
            return MAPPER.writeValueAsString(snapshot(store, name));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize project '" + name + "'", e);
        }
    }

    public static void writeFile(Path path, NetworkStore store, String name) throws IOException {
        Files.writeString(path, write(store, name));
        log.info("Saved project '{}' to {}", name, path);
    }

    /** Parses a project document. */
    public static ProjectDefinition read(String json) {
        try {
            return MAPPER.readValue(json, ProjectDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid project JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static ProjectDefinition readFile(Path path) throws IOException {
        return read(Files.readString(path));
    }

    /**
     * Validates {@code def} and copies it into an empty store, ids preserved,
     * as one unit of work.
     *
     * @throws ValidationException if the store is not empty, an id repeats, a
     *                             reference points nowhere, a parent type is
     *                             not allowed, parent links form a loop, a
     *                             fiber lies outside its cable, a splice pair
     *                             repeats in a tray, or a tray holds more
     *                             splices than its capacity
     */
    public static void loadInto(ProjectDefinition def, NetworkStore store) {
        if (!store.elements().isEmpty())
            throw new ValidationException("Target store already holds a project");
        validate(def);
        store.inTransaction(() -> {
            def.getElements().forEach(store::putElement);
            def.getCables().forEach(store::putCable);
            def.getTrays().forEach(store::putTray);
            def.getSplitters().forEach(store::putSplitter);
            def.getPorts().forEach(store::putPort);
            def.getPonPorts().forEach(store::putPonPort);
            def.getSplices().forEach(store::putSplice);
        });
        log.info("Loaded project '{}': {} elements, {} splices", def.getName(), def.getElements().size(),
                def.getSplices().size());
    }

    private static void validate(ProjectDefinition def) {
        Map<Long, NetworkElement> elements = index(def.getElements(), NetworkElement::getId, "element");
        for (NetworkElement e : def.getElements()) {
            if (e.getType() == null)
                throw new ValidationException("Element " + e.getId() + " has no type");
        }
        validateHierarchy(def, elements);

        Map<Long, Cable> cables = new HashMap<>();
        for (Cable c : def.getCables()) {
            if (c.getId() == null)
                throw new ValidationException("Cable '" + c.getName() + "' has no id");
            if (c.getFiberCount() < 1)
                throw new ValidationException("Cable " + c.getId() + " has fiber count " + c.getFiberCount());
            if (cables.put(c.getId(), c) != null)
                throw new ValidationException("Duplicate cable id " + c.getId());
        }
        for (NetworkElement e : def.getElements()) {
            if (e.getCableId() != null)
                requireCable(cables, e.getCableId(), "Element " + e.getId());
        }

        Map<Long, PonPort> ponPorts = index(def.getPonPorts(), PonPort::getId, "PON port");
        Set<String> ponNumbers = new HashSet<>();
        for (PonPort p : def.getPonPorts()) {
            NetworkElement olt = elements.get(p.getOltId());
            if (olt == null || olt.getType() != ElementType.OLT)
                throw new ValidationException("PON port " + p.getId() + " must belong to an OLT, got element "
                        + p.getOltId());
            if (!ponNumbers.add(p.getOltId() + ":" + p.getPortNumber()))
                throw new ValidationException("OLT " + p.getOltId() + " has PON port " + p.getPortNumber() + " twice");
            if (p.getConnectedCableId() != null)
                requireCable(cables, p.getConnectedCableId(), "PON port " + p.getId());
        }
        for (NetworkElement e : def.getElements()) {
            if (e.getPonPortId() == null)
                continue;
            if (e.getType() != ElementType.LCP)
                throw new ValidationException(e.getType() + " " + e.getId() + " cannot be fed from a PON port");
            if (!ponPorts.containsKey(e.getPonPortId()))
                throw new ValidationException("Element " + e.getId() + " refers to missing PON port "
                        + e.getPonPortId());
        }

        Map<Long, Tray> trays = index(def.getTrays(), Tray::getId, "tray");
        for (Tray t : def.getTrays()) {
            requireEnclosure(elements, t.getEnclosureId(), "Tray " + t.getId());
            if (t.getCapacity() < 1)
                throw new ValidationException("Tray " + t.getId() + " has capacity " + t.getCapacity());
        }

        Map<Long, Splitter> splitters = index(def.getSplitters(), Splitter::getId, "splitter");
        for (Splitter sp : def.getSplitters()) {
            NetworkElement owner = elements.get(sp.getEnclosureId());
            if (owner == null || (owner.getType() != ElementType.LCP && owner.getType() != ElementType.NAP))
                throw new ValidationException("Splitter " + sp.getId() + " must belong to an LCP or NAP, got element "
                        + sp.getEnclosureId());
            if (sp.getRatio() == null)
                throw new ValidationException("Splitter " + sp.getId() + " has no ratio");
            if (sp.getInputCableId() != null)
                requireFiber(cables, sp.getInputCableId(), sp.getInputFiber(), "Splitter " + sp.getId());
        }

        index(def.getPorts(), Port::getId, "port");
        Set<String> portNumbers = new HashSet<>();
        for (Port p : def.getPorts()) {
            NetworkElement owner = elements.get(p.getEnclosureId());
            if (owner == null || !owner.getType().hasPatchPorts())
                throw new ValidationException("Port " + p.getId() + " must belong to an ODF or enclosure, got element "
                        + p.getEnclosureId());
            if (!portNumbers.add(p.getEnclosureId() + ":" + p.getPortNumber()))
                throw new ValidationException("Element " + p.getEnclosureId() + " has port " + p.getPortNumber()
                        + " twice");
            if (p.getSplitterId() != null) {
                Splitter sp = splitters.get(p.getSplitterId());
                if (sp == null || sp.getEnclosureId() != p.getEnclosureId())
                    throw new ValidationException("Port " + p.getId() + " refers to splitter " + p.getSplitterId()
                            + " outside its enclosure");
            }
            if (p.getConnectedCableId() != null)
                requireFiber(cables, p.getConnectedCableId(), p.getConnectedFiber(), "Port " + p.getId());
        }

        validateSplices(def, trays, cables);
    }

    private static void validateHierarchy(ProjectDefinition def, Map<Long, NetworkElement> elements) {
        HierarchyLayout.Builder hierarchy = HierarchyLayout.builder();
        elements.keySet().forEach(hierarchy::addNode);
        for (NetworkElement e : def.getElements()) {
            if (!e.hasParent()) {
                if (e.getParentType() != null)
                    throw new ValidationException("Element " + e.getId() + " has a parent type but no parent");
                continue;
            }
            NetworkElement parent = elements.get(e.getParentId());
            if (parent == null)
                throw new ValidationException("Element " + e.getId() + " refers to missing parent " + e.getParentId());
            if (e.getParentType() != null && e.getParentType() != parent.getType())
                throw new ValidationException("Element " + e.getId() + " declares parent type " + e.getParentType()
                        + " but " + parent.getId() + " is " + parent.getType());
            if (!parent.getType().canParent(e.getType()))
                throw new ValidationException(e.getType() + " " + e.getId() + " cannot be placed under "
                        + parent.getType());
            if (e.getParentId() == e.getId())
                throw new ValidationException("Element " + e.getId() + " is its own parent");
            hierarchy.addEdge(parent.getId(), e.getId());
        }
        try {
            hierarchy.build();
        } catch (IllegalStateException e) {
            throw new ValidationException("Parent links form a loop: " + e.getMessage());
        }
    }

    private static void validateSplices(ProjectDefinition def, Map<Long, Tray> trays, Map<Long, Cable> cables) {
        index(def.getSplices(), Splice::getId, "splice");
        Map<Long, Set<Long>> pairsByTray = new HashMap<>();
        for (Splice s : def.getSplices()) {
            Tray tray = trays.get(s.getTrayId());
            if (tray == null)
                throw new ValidationException("Splice " + s.getId() + " refers to missing tray " + s.getTrayId());
            checkSpliceFiber(cables, s.getCableAId(), s.getFiberA(), "Splice " + s.getId() + " side A");
            checkSpliceFiber(cables, s.getCableBId(), s.getFiberB(), "Splice " + s.getId() + " side B");

            Set<Long> pairs = pairsByTray.computeIfAbsent(tray.getId(), k -> new HashSet<>());
            if (!pairs.add(pairKey(s.getFiberA(), s.getFiberB())))
                throw new ValidationException("Tray " + tray.getId() + " holds fiber pair " + s.getFiberA() + "/"
                        + s.getFiberB() + " more than once");
            if (pairs.size() > tray.getCapacity())
                throw new ValidationException("Tray " + tray.getId() + " holds more than its capacity of "
                        + tray.getCapacity() + " splices");
        }
    }

    // Splices may name a cable that was never persisted; only a stored cable bounds the fiber
    private static void checkSpliceFiber(Map<Long, Cable> cables, Long cableId, int fiber, String owner) {
        if (cableId != null && cables.containsKey(cableId)) {
            requireFiber(cables, cableId, fiber, owner);
        } else if (fiber < 1) {
            throw new ValidationException(owner + " has fiber " + fiber);
        }
    }

    private static Cable requireCable(Map<Long, Cable> cables, long cableId, String owner) {
        Cable cable = cables.get(cableId);
        if (cable == null)
            throw new ValidationException(owner + " refers to missing cable " + cableId);
        return cable;
    }

    private static void requireFiber(Map<Long, Cable> cables, long cableId, Integer fiber, String owner) {
        Cable cable = requireCable(cables, cableId, owner);
        if (fiber == null || fiber < 1 || fiber > cable.getFiberCount())
            throw new ValidationException(owner + " uses fiber " + fiber + " outside cable " + cableId + " ("
                    + cable.getFiberCount() + "F)");
    }

    private static <T> Map<Long, T> index(List<T> items, ToLongFunction<T> id, String kind) {
        Map<Long, T> byId = new HashMap<>();
        for (T item : items) {
            if (byId.put(id.applyAsLong(item), item) != null)
                throw new ValidationException("Duplicate " + kind + " id " + id.applyAsLong(item));
        }
        return byId;
    }

    private static long pairKey(int a, int b) {
        return ((long) a << 32) | (b & 0xffffffffL);
    }

    private static void requireEnclosure(Map<Long, NetworkElement> elements, long id, String owner) {
        NetworkElement e = elements.get(id);
        if (e == null || !e.getType().isEnclosure())
            throw new ValidationException(owner + " must belong to an enclosure, got element " + id);
    }
}
