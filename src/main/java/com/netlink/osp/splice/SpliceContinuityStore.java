package com.netlink.osp.splice;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.netlink.osp.api.NetworkListener;
import com.netlink.osp.api.NotFoundException;
import com.netlink.osp.api.ValidationException;
import com.netlink.osp.color.ColorCodeEngine;
import com.netlink.osp.color.FiberInfo;
import com.netlink.osp.config.SessionPreferences;
import com.netlink.osp.network.Cable;
import com.netlink.osp.network.NetworkElement;
import com.netlink.osp.network.Tray;
import com.netlink.osp.store.NetworkStore;

import lombok.extern.log4j.Log4j2;

/**
 * Records and classifies fiber-to-fiber connections inside splice trays.
 *
 * <p>
 * Uniqueness: within one tray the pair {@code (fiberA, fiberB)} identifies a
 * splice. Writing an existing pair updates it in place. The same
 * {@code fiberA} may still appear in several pairs of a tray (fan-out is not
 * prevented); {@link #splicesForFiberA(long, int)} exposes it.
 *
 * <p>
 * Colors on stored splices are always resolved through
 * {@link ColorCodeEngine}, never taken from the caller.
 */
@Log4j2
public final class SpliceContinuityStore {
    private final NetworkStore store;
    private final NetworkListener listener;
    private final Clock clock;

    public SpliceContinuityStore(NetworkStore store, NetworkListener listener) {
        this(store, listener, Clock.systemUTC());
    }

    public SpliceContinuityStore(NetworkStore store, NetworkListener listener, Clock clock) {
        this.store = store;
        this.listener = listener;
        this.clock = clock;
    }

    // ── Trays ───────────────────────────────────────────────────────

    /**
     * Adds a tray to an enclosure, numbered after the existing ones.
     *
     * @throws NotFoundException   if the enclosure does not exist
     * @throws ValidationException if the element cannot hold trays or the
     *                             capacity is not positive
     */
    public Tray addTray(long enclosureId, int capacity) {
        NetworkElement enclosure = store.findElement(enclosureId)
                .orElseThrow(() -> new NotFoundException("Element", enclosureId));
        if (!enclosure.getType().isEnclosure())
            throw new ValidationException(enclosure.getType() + " '" + enclosure.getName() + "' cannot hold trays");
        if (capacity < 1)
            throw new ValidationException("Tray capacity must be positive: " + capacity);

        Tray tray = new Tray();
        tray.setEnclosureId(enclosureId);
        tray.setCapacity(capacity);
        tray.setNumber(store.traysOf(enclosureId).size() + 1);
        store.putTray(tray);
        return tray;
    }

    public List<Tray> traysOf(long enclosureId) {
        return store.traysOf(enclosureId);
    }

    /** Removes a tray and every splice in it. Returns the number of splices removed. */
    public int deleteTray(long trayId) {
        requireTray(trayId);
        return store.inTransaction(() -> {
            List<Splice> inTray = store.splicesOf(trayId);
            for (Splice s : inTray)
                store.removeSplice(s.getId());
            store.removeTray(trayId);
            return inTray.size();
        });
    }

    // ── Single splice ───────────────────────────────────────────────

    /**
     * Persists a splice, or updates the existing one with the same pair in the
     * tray. Status becomes {@code completed} when a loss is given, otherwise
     * {@code pending}.
     *
     * @throws NotFoundException   if the tray does not exist
     * @throws ValidationException if a fiber index is outside its cable, the
     *                             loss is not a finite non-negative number, or
     *                             the tray is full and the pair is new
     */
    public SpliceResult createOrUpdateSplice(SpliceRequest request, SessionPreferences prefs) {
        Tray tray = requireTray(request.trayId());
        FiberInfo infoA = resolve(request.cableA(), request.fiberA(), "A");
        FiberInfo infoB = resolve(request.cableB(), request.fiberB(), "B");
        Double loss = request.loss();
        if (loss != null && (loss.isNaN() || loss.isInfinite() || loss < 0))
            throw new ValidationException("Splice loss must be a non-negative number: " + loss);

        return store.inTransaction(() -> {
            Optional<Splice> existing = store.findSplice(tray.getId(), request.fiberA(), request.fiberB());
            Splice splice = existing.orElseGet(Splice::new);
            if (existing.isEmpty())
                checkCapacity(tray, 1);

            splice.setTrayId(tray.getId());
            applySide(splice, request.cableA(), infoA, true);
            applySide(splice, request.cableB(), infoB, false);
            splice.setSpliceType(prefs.spliceTypeOr(request.spliceType()));
            splice.setLoss(loss);
            splice.setStatus(SpliceStatus.forLoss(loss));
            splice.setTechnicianName(prefs.technicianOr(request.technicianName()));
            splice.setNotes(request.notes());
            if (request.otdrTraceId() != null)
                splice.setOtdrTraceId(request.otdrTraceId());
            splice.setTimestamp(clock.instant());
            store.putSplice(splice);

            SpliceOutcome outcome = existing.isPresent() ? SpliceOutcome.UPDATED : SpliceOutcome.CREATED;
            log.debug("Splice {} tray={} {}:{} -> {}:{}", outcome, tray.getId(), splice.getCableAName(),
                    splice.getFiberA(), splice.getCableBName(), splice.getFiberB());
            return new SpliceResult(outcome, splice);
        });
    }

    /** Explicit review/failure marking; loss and colors are untouched. */
    public Splice updateStatus(long spliceId, SpliceStatus status) {
        Splice splice = store.findSplice(spliceId).orElseThrow(() -> new NotFoundException("Splice", spliceId));
        splice.setStatus(status);
        store.putSplice(splice);
        return splice;
    }

    public void deleteSplice(long spliceId) {
        store.removeSplice(spliceId);
    }

    // ── Batch ───────────────────────────────────────────────────────

    public List<Splice> generateBatch(long trayId, Cable cableA, Cable cableB, int startFiberA, int startFiberB,
            int count, SpliceType spliceType, String technicianName) {
        return generateBatch(new BatchSpliceRequest(trayId, cableA, cableB, startFiberA, startFiberB, count,
                spliceType, technicianName));
    }

    /**
     * Proposes up to {@code count} 1:1 pairs in ascending order, each resolved
     * through the color engine for both cables. Generation stops at the first
     * pair that runs past either cable. Nothing is persisted.
     */
    public List<Splice> generateBatch(BatchSpliceRequest request) {
        int countA = request.cableA().getFiberCount();
        int countB = request.cableB().getFiberCount();
        List<Splice> out = new ArrayList<>(Math.min(request.count(), Math.max(countA, 0)));
        for (int i = 0; i < request.count(); i++) {
            int fiberA = request.startFiberA() + i;
            int fiberB = request.startFiberB() + i;
            if (fiberA > countA || fiberB > countB)
                break;
            Optional<FiberInfo> infoA = ColorCodeEngine.fiberInfo(fiberA, countA);
            Optional<FiberInfo> infoB = ColorCodeEngine.fiberInfo(fiberB, countB);
            if (infoA.isEmpty() || infoB.isEmpty())
                continue;

            Splice s = new Splice();
            s.setTrayId(request.trayId());
            applySide(s, request.cableA(), infoA.get(), true);
            applySide(s, request.cableB(), infoB.get(), false);
            s.setSpliceType(request.spliceType());
            s.setTechnicianName(request.technicianName());
            s.setTimestamp(clock.instant());
            s.setStatus(SpliceStatus.PENDING);
            out.add(s);
        }
        return out;
    }

    /**
     * Generates the batch and inserts every pair the tray does not already
     * hold. Existing pairs are reported as {@link SpliceOutcome#ALREADY_EXISTS}
     * and left untouched. All-or-nothing: if the tray fills up midway, nothing
     * is inserted.
     */
    public BatchResult commitBatch(BatchSpliceRequest request, SessionPreferences prefs) {
        Tray tray = requireTray(request.trayId());
        BatchSpliceRequest resolved = new BatchSpliceRequest(request.trayId(), request.cableA(), request.cableB(),
                request.startFiberA(), request.startFiberB(), request.count(),
                prefs.spliceTypeOr(request.spliceType()), prefs.technicianOr(request.technicianName()));
        List<Splice> proposed = generateBatch(resolved);

        BatchResult result = store.inTransaction(() -> {
            List<SpliceResult> results = new ArrayList<>(proposed.size());
            for (Splice s : proposed) {
                Optional<Splice> existing = store.findSplice(tray.getId(), s.getFiberA(), s.getFiberB());
                if (existing.isPresent()) {
                    results.add(new SpliceResult(SpliceOutcome.ALREADY_EXISTS, existing.get()));
                    continue;
                }
                checkCapacity(tray, 1);
                store.putSplice(s);
                results.add(new SpliceResult(SpliceOutcome.CREATED, s));
            }
            return new BatchResult(results);
        });
        listener.onBatchCommitted(tray.getId(), result);
        return result;
    }

    // ── Queries ─────────────────────────────────────────────────────

    public List<Splice> splices(long trayId) {
        return store.splicesOf(trayId);
    }

    /** Splices touching a persisted cable on either side. */
    public List<Splice> splicesByCable(long cableId) {
        List<Splice> out = new ArrayList<>();
        for (Splice s : store.splices()) {
            if ((s.getCableAId() != null && s.getCableAId() == cableId)
                    || (s.getCableBId() != null && s.getCableBId() == cableId))
                out.add(s);
        }
        return out;
    }

    /** Every splice in the tray that uses {@code fiberA}; more than one means fan-out. */
    public List<Splice> splicesForFiberA(long trayId, int fiberA) {
        List<Splice> out = new ArrayList<>();
        for (Splice s : store.splicesOf(trayId)) {
            if (s.getFiberA() == fiberA)
                out.add(s);
        }
        return out;
    }

    public SpliceMatrix matrix(long trayId, Cable cableA, Cable cableB) {
        requireTray(trayId);
        return SpliceMatrix.build(cableA.getFiberCount(), cableB.getFiberCount(), store.splicesOf(trayId));
    }

    // ── Classification ──────────────────────────────────────────────

    public static Map<SpliceType, LossThresholds> lossThresholds() {
        return SpliceType.thresholdTable();
    }

    /** Classifies a measured loss; a null loss is {@link LossClass#MISSING}. */
    public static LossClass classifyLoss(Double loss, SpliceType spliceType) {
        if (loss == null)
            return LossClass.MISSING;
        if (spliceType == null)
            throw new IllegalArgumentException("Splice type required to classify loss " + loss);
        return spliceType.thresholds().classify(loss);
    }

    public static SpliceStats stats(Collection<Splice> splices) {
        int total = splices.size();
        int completed = 0, pending = 0, needsReview = 0, failed = 0;
        int withLoss = 0, passing = 0;
        double sum = 0, min = Double.POSITIVE_INFINITY, max = 0;

        for (Splice s : splices) {
            if (s.getStatus() != null) {
                switch (s.getStatus()) {
                    case COMPLETED -> completed++;
                    case PENDING -> pending++;
                    case NEEDS_REVIEW -> needsReview++;
                    case FAILED -> failed++;
                }
            }
            if (s.hasLoss()) {
                double l = s.getLoss();
                withLoss++;
                sum += l;
                min = Math.min(min, l);
                max = Math.max(max, l);
            }
            if (s.getSpliceType() != null && classifyLoss(s.getLoss(), s.getSpliceType()).isPassing())
                passing++;
        }

        double avg = withLoss > 0 ? sum / withLoss : 0;
        double passRate = total > 0 ? passing * 100.0 / total : 0;
        return new SpliceStats(total, completed, pending, needsReview, failed, withLoss, avg,
                withLoss > 0 ? min : 0, max, passRate);
    }

    /** Documentation completeness of one splice. */
    public static ComplianceResult compliance(Splice splice) {
        List<String> issues = new ArrayList<>();
        boolean fail = false, warn = false;

        SpliceType type = splice.getSpliceType() != null ? splice.getSpliceType() : SpliceType.FUSION;
        LossClass lossClass = classifyLoss(splice.getLoss(), type);
        switch (lossClass) {
            case FAILED -> {
                issues.add(String.format("Loss exceeds maximum: %.2f dB", splice.getLoss()));
                fail = true;
            }
            case HIGH -> {
                issues.add(String.format("Loss is high: %.2f dB", splice.getLoss()));
                warn = true;
            }
            case MISSING -> {
                issues.add("No loss measurement recorded");
                warn = true;
            }
            default -> {
            }
        }

        if (splice.getOtdrTraceId() == null) {
            issues.add("No OTDR trace attached");
            warn = true;
        }
        if (splice.getTechnicianName() == null || splice.getTechnicianName().isBlank()) {
            issues.add("No technician sign-off");
            warn = true;
        }
        if (splice.getStatus() == SpliceStatus.NEEDS_REVIEW) {
            issues.add("Marked for review");
            warn = true;
        } else if (splice.getStatus() == SpliceStatus.FAILED) {
            issues.add("Splice marked as failed");
            fail = true;
        }

        ComplianceResult.Status status = fail ? ComplianceResult.Status.FAIL
                : warn ? ComplianceResult.Status.WARN : ComplianceResult.Status.PASS;
        return new ComplianceResult(status, issues, lossClass == LossClass.MISSING ? null : lossClass);
    }

    // ── Internals ───────────────────────────────────────────────────

    private Tray requireTray(long trayId) {
        return store.findTray(trayId).orElseThrow(() -> new NotFoundException("Tray", trayId));
    }

    private void checkCapacity(Tray tray, int adding) {
        int used = store.splicesOf(tray.getId()).size();
        if (used + adding > tray.getCapacity())
            throw new ValidationException("Tray " + tray.getNumber() + " is full (" + used + "/"
                    + tray.getCapacity() + ")");
    }

    private static FiberInfo resolve(Cable cable, int fiber, String side) {
        return ColorCodeEngine.fiberInfo(fiber, cable.getFiberCount())
                .orElseThrow(() -> new ValidationException("Fiber " + side + " " + fiber + " is outside cable '"
                        + cable.getName() + "' (1.." + cable.getFiberCount() + ")"));
    }

    private static void applySide(Splice s, Cable cable, FiberInfo info, boolean sideA) {
        if (sideA) {
            s.setCableAId(cable.getId());
            s.setCableAName(cable.getName());
            s.setFiberA(info.fiberNumber());
            s.setTubeAColor(info.tubeColor().displayName());
            s.setFiberAColor(info.fiberColor().displayName());
        } else {
            s.setCableBId(cable.getId());
            s.setCableBName(cable.getName());
            s.setFiberB(info.fiberNumber());
            s.setTubeBColor(info.tubeColor().displayName());
            s.setFiberBColor(info.fiberColor().displayName());
        }
    }
}
