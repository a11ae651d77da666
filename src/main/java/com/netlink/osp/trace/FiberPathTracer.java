package com.netlink.osp.trace;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

import com.netlink.osp.api.NotFoundException;
import com.netlink.osp.api.ValidationException;
import com.netlink.osp.network.ElementType;
import com.netlink.osp.network.NetworkElement;
import com.netlink.osp.network.PortStatus;
import com.netlink.osp.network.Port;
import com.netlink.osp.network.Splitter;
import com.netlink.osp.network.Tray;
import com.netlink.osp.splice.Splice;
import com.netlink.osp.store.NetworkStore;

import lombok.extern.log4j.Log4j2;

/**
 * Follows one fiber from any element up to the OLT and down to the
 * customer.
 *
 * <p>
 * The fiber is counted on the cable that feeds the start element. Going up,
 * each ancestor maps the fiber on its outgoing side to the fiber on its feed:
 * a closure through the tray splice whose B side carries it, an LCP or NAP
 * through the splitter whose output leg is patched to it, an ODF through the
 * patch port it lands on. Going down the same rules run in reverse, and the
 * cable leaving a splice or splitter leg picks the child to continue into.
 *
 * <p>
 * Both walks keep a visited set, so a corrupt parent loop ends the trace
 * with a missing link instead of spinning.
 */
@Log4j2
public final class FiberPathTracer {
    /** Loss assumed for a splice that has no measurement yet. */
    public static final double UNMEASURED_SPLICE_LOSS_DB = 0.05;

    private final NetworkStore store;

    public FiberPathTracer(NetworkStore store) {
        this.store = store;
    }

    /**
     * Traces {@code fiber} through {@code elementId}.
     *
     * @param fiber fiber on the cable feeding the start element, or null to
     *              follow the hierarchy alone
     * @throws NotFoundException   if the element does not exist
     * @throws ValidationException if the fiber is not positive
     */
    public FiberPath trace(long elementId, Integer fiber) {
        NetworkElement start = store.findElement(elementId)
                .orElseThrow(() -> new NotFoundException("Element", elementId));
        if (fiber != null && fiber < 1)
            throw new ValidationException("Fiber must be positive: " + fiber);

        Trace t = new Trace();
        Hop startHop = new Hop(start);
        startHop.fiberIn = start.getType().isRoot() ? null : fiber;
        t.segments.add(startHop);

        traceUpstream(start, fiber, t);
        traceDownstream(start, startHop, fiber, t);

        FiberPath path = t.toPath(elementId, fiber);
        log.debug("Traced fiber {} from {}: {} segment(s), {} dB, {}", fiber, start.displayName(),
                path.segments().size(), path.totalLossDb(), path.status());
        return path;
    }

    // ── Upstream ────────────────────────────────────────────────────

    private void traceUpstream(NetworkElement start, Integer fiber, Trace t) {
        Set<Long> visited = new HashSet<>();
        visited.add(start.getId());
        NetworkElement child = start;
        Integer current = fiber;
        while (!child.getType().isRoot()) {
            notePonPort(child, t);
            if (!child.hasParent()) {
                t.missingLinks.add(child.displayName() + " has no upstream connection");
                return;
            }
            Optional<NetworkElement> parent = store.findElement(child.getParentId());
            if (parent.isEmpty()) {
                t.missingLinks.add("Upstream element " + child.getParentId() + " of " + child.displayName()
                        + " not found");
                return;
            }
            NetworkElement node = parent.get();
            if (!visited.add(node.getId())) {
                t.loopAt(node);
                return;
            }
            t.addCableLength(child.getCableId());

            Hop hop = new Hop(node);
            hop.fiberOut = current;
            if (current != null)
                current = upstreamThrough(node, child.getCableId(), current, hop, t);
            hop.fiberIn = node.getType().isRoot() ? null : current;
            t.segments.addFirst(hop);
            child = node;
        }
    }

    // Fiber on the feed of node carrying what leaves it on childCable/fiber
    private Integer upstreamThrough(NetworkElement node, Long childCable, int fiber, Hop hop, Trace t) {
        switch (node.getType()) {
            case CLOSURE -> {
                Optional<Splice> splice = findSplice(node, hop,
                        s -> s.getFiberB() == fiber && sameCable(s.getCableBId(), childCable));
                if (splice.isPresent()) {
                    t.addSplice(hop);
                    return splice.get().getFiberA();
                }
            }
            case LCP, NAP -> {
                for (Splitter splitter : store.splittersOf(node.getId())) {
                    Optional<Port> leg = legs(node, splitter).stream()
                            .filter(p -> patchedTo(p, childCable, fiber))
                            .findFirst();
                    if (leg.isEmpty())
                        continue;
                    t.addSplitter(hop, splitter);
                    t.addPort(hop, leg.get());
                    if (!splitter.hasInput()) {
                        t.missingLinks.add("Splitter " + splitter.getName() + " in " + node.displayName()
                                + " has no input fiber");
                        return null;
                    }
                    return splitter.getInputFiber();
                }
            }
            case ODF -> {
                Optional<Port> port = odfPort(node, childCable, fiber);
                port.ifPresent(p -> t.addPort(hop, p));
            }
            default -> {
                // OLT: fiber leaves the head end unchanged
            }
        }
        return fiber;
    }

    // ── Downstream ──────────────────────────────────────────────────

    private record Exit(Integer fiber, Long cableId) {
    }

    private void traceDownstream(NetworkElement start, Hop startHop, Integer fiber, Trace t) {
        Map<Long, List<NetworkElement>> children = childIndex();
        Set<Long> visited = new HashSet<>();
        visited.add(start.getId());

        NetworkElement node = start;
        Hop hop = startHop;
        Integer current = fiber;
        while (true) {
            Exit exit = current == null ? new Exit(null, null) : downstreamThrough(node, current, hop, t);
            hop.fiberOut = exit.fiber();

            List<NetworkElement> kids = children.getOrDefault(node.getId(), List.of());
            if (kids.isEmpty())
                return;
            NetworkElement next = pick(kids, exit.cableId());
            if (next == null) {
                t.missingLinks.add("Cable " + exit.cableId() + " leaving " + node.displayName()
                        + " feeds no downstream element");
                return;
            }
            if (!visited.add(next.getId())) {
                t.loopAt(next);
                return;
            }
            notePonPort(next, t);
            t.addCableLength(next.getCableId());

            hop = new Hop(next);
            hop.fiberIn = exit.fiber();
            t.segments.addLast(hop);
            node = next;
            current = exit.fiber();
        }
    }

    private Exit downstreamThrough(NetworkElement node, int fiber, Hop hop, Trace t) {
        Long feed = node.getCableId();
        switch (node.getType()) {
            case CLOSURE -> {
                Optional<Splice> splice = findSplice(node, hop,
                        s -> s.getFiberA() == fiber && sameCable(s.getCableAId(), feed));
                if (splice.isPresent()) {
                    t.addSplice(hop);
                    return new Exit(splice.get().getFiberB(), splice.get().getCableBId());
                }
            }
            case LCP, NAP -> {
                for (Splitter splitter : store.splittersOf(node.getId())) {
                    if (!splitter.hasInput() || splitter.getInputFiber() != fiber
                            || !sameCable(splitter.getInputCableId(), feed))
                        continue;
                    t.addSplitter(hop, splitter);
                    Optional<Port> leg = legs(node, splitter).stream()
                            .filter(p -> p.getStatus() == PortStatus.CONNECTED)
                            .findFirst();
                    if (leg.isEmpty())
                        return new Exit(null, null);
                    t.addPort(hop, leg.get());
                    return new Exit(leg.get().getConnectedFiber(), leg.get().getConnectedCableId());
                }
                Optional<Port> drop = store.portsOf(node.getId()).stream()
                        .filter(p -> p.getSplitterId() == null && patchedTo(p, feed, fiber))
                        .findFirst();
                drop.ifPresent(p -> t.addPort(hop, p));
            }
            case ODF -> {
                Optional<Port> port = store.portsOf(node.getId()).stream()
                        .filter(p -> p.getStatus() == PortStatus.CONNECTED
                                ? Integer.valueOf(fiber).equals(p.getConnectedFiber())
                                : p.getPortNumber() == fiber)
                        .findFirst();
                if (port.isPresent()) {
                    t.addPort(hop, port.get());
                    Port p = port.get();
                    if (p.getStatus() == PortStatus.CONNECTED)
                        return new Exit(p.getConnectedFiber(), p.getConnectedCableId());
                }
            }
            default -> {
                // OLT
            }
        }
        return new Exit(fiber, null);
    }

    // Child fed by cableId, or the first child when the cable is unknown
    private static NetworkElement pick(List<NetworkElement> kids, Long cableId) {
        if (cableId == null)
            return kids.get(0);
        for (NetworkElement kid : kids) {
            if (cableId.equals(kid.getCableId()))
                return kid;
        }
        return null;
    }

    // ── Lookups ─────────────────────────────────────────────────────

    private Optional<Splice> findSplice(NetworkElement node, Hop hop, Predicate<Splice> match) {
        for (Tray tray : store.traysOf(node.getId())) {
            for (Splice s : store.splicesOf(tray.getId())) {
                if (match.test(s)) {
                    double loss = s.hasLoss() ? s.getLoss() : UNMEASURED_SPLICE_LOSS_DB;
                    hop.splice = new PathSegment.SpliceHop(s.getId(), tray.getId(), tray.getNumber(), loss,
                            s.hasLoss(), s.getStatus());
                    return Optional.of(s);
                }
            }
        }
        return Optional.empty();
    }

    private List<Port> legs(NetworkElement node, Splitter splitter) {
        List<Port> out = new ArrayList<>();
        for (Port p : store.portsOf(node.getId())) {
            if (p.getSplitterId() != null && p.getSplitterId() == splitter.getId())
                out.add(p);
        }
        return out;
    }

    // Patch port carrying the fiber, else the port numbered after it
    private Optional<Port> odfPort(NetworkElement odf, Long cable, int fiber) {
        List<Port> ports = store.portsOf(odf.getId());
        for (Port p : ports) {
            if (patchedTo(p, cable, fiber))
                return Optional.of(p);
        }
        for (Port p : ports) {
            if (p.getPortNumber() == fiber)
                return Optional.of(p);
        }
        return Optional.empty();
    }

    private static boolean patchedTo(Port p, Long cable, int fiber) {
        return p.getStatus() == PortStatus.CONNECTED
                && Integer.valueOf(fiber).equals(p.getConnectedFiber())
                && sameCable(p.getConnectedCableId(), cable);
    }

    // Unknown on either side matches
    private static boolean sameCable(Long a, Long b) {
        return a == null || b == null || a.equals(b);
    }

    private void notePonPort(NetworkElement e, Trace t) {
        if (t.ponPortNumber == null && e.getPonPortId() != null)
            store.findPonPort(e.getPonPortId()).ifPresent(p -> t.ponPortNumber = p.getPortNumber());
    }

    private Map<Long, List<NetworkElement>> childIndex() {
        Map<Long, List<NetworkElement>> index = new LinkedHashMap<>();
        for (NetworkElement e : store.elements()) {
            if (e.hasParent())
                index.computeIfAbsent(e.getParentId(), k -> new ArrayList<>()).add(e);
        }
        return index;
    }

    // ── Accumulators ────────────────────────────────────────────────

    private static final class Hop {
        final NetworkElement element;
        Integer fiberIn, fiberOut;
        PathSegment.SpliceHop splice;
        PathSegment.SplitterHop splitter;
        PathSegment.PortHop port;

        Hop(NetworkElement element) {
            this.element = element;
        }

        PathSegment toSegment(int order) {
            ElementType type = element.getType();
            return new PathSegment(order, element.getId(), type, element.displayName(), fiberIn, fiberOut,
                    splice, splitter, port);
        }
    }

    private final class Trace {
        final Deque<Hop> segments = new ArrayDeque<>();
        final List<String> missingLinks = new ArrayList<>();
        double loss, distance;
        int splices, connectors;
        Integer ponPortNumber;
        boolean loop;

        void addSplice(Hop hop) {
            loss += hop.splice.lossDb();
            splices++;
        }

        void addSplitter(Hop hop, Splitter splitter) {
            double db = splitter.getRatio().insertionLossDb();
            hop.splitter = new PathSegment.SplitterHop(splitter.getId(), splitter.getName(), splitter.getRatio(), db);
            loss += db;
        }

        void addPort(Hop hop, Port p) {
            hop.port = new PathSegment.PortHop(p.getId(), p.getPortNumber(), p.getStatus(), p.getCustomerName(),
                    p.getServiceId());
            connectors++;
        }

        void addCableLength(Long cableId) {
            if (cableId == null)
                return;
            store.findCable(cableId)
                    .filter(c -> c.getLengthMeters() != null)
                    .ifPresent(c -> distance += c.getLengthMeters());
        }

        void loopAt(NetworkElement e) {
            loop = true;
            missingLinks.add("Loop detected at " + e.displayName());
        }

        FiberPath toPath(long startId, Integer fiber) {
            List<PathSegment> out = new ArrayList<>(segments.size());
            for (Hop hop : segments)
                out.add(hop.toSegment(out.size()));
            return new FiberPath(startId, fiber, Collections.unmodifiableList(out), Math.round(loss * 100) / 100.0,
                    distance, splices, connectors, ponPortNumber, List.copyOf(missingLinks), loop);
        }
    }
}
