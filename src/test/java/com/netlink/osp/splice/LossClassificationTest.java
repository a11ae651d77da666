package com.netlink.osp.splice;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import static org.junit.Assert.*;

public class LossClassificationTest {
    private static final double EPS = 1e-9;

    private static Splice splice(SpliceType type, Double loss, SpliceStatus status) {
        Splice s = new Splice();
        s.setSpliceType(type);
        s.setLoss(loss);
        s.setStatus(status);
        s.setTechnicianName("Jane");
        s.setOtdrTraceId(7L);
        return s;
    }

    @Test
    public void testFusionBoundaries() {
        assertEquals(LossClass.GOOD, SpliceContinuityStore.classifyLoss(0.08, SpliceType.FUSION));
        assertEquals(LossClass.GOOD, SpliceContinuityStore.classifyLoss(0.1, SpliceType.FUSION));
        assertEquals(LossClass.ACCEPTABLE, SpliceContinuityStore.classifyLoss(0.15, SpliceType.FUSION));
        assertEquals(LossClass.HIGH, SpliceContinuityStore.classifyLoss(0.28, SpliceType.FUSION));
        assertEquals(LossClass.FAILED, SpliceContinuityStore.classifyLoss(0.35, SpliceType.FUSION));
    }

    @Test
    public void testMechanicalThresholdsAreLooser() {
        assertEquals(LossClass.GOOD, SpliceContinuityStore.classifyLoss(0.2, SpliceType.MECHANICAL));
        assertEquals(LossClass.ACCEPTABLE, SpliceContinuityStore.classifyLoss(0.28, SpliceType.MECHANICAL));
        assertEquals(LossClass.HIGH, SpliceContinuityStore.classifyLoss(0.35, SpliceType.MECHANICAL));
        assertEquals(LossClass.FAILED, SpliceContinuityStore.classifyLoss(0.51, SpliceType.MECHANICAL));

        LossThresholds fusion = SpliceContinuityStore.lossThresholds().get(SpliceType.FUSION);
        LossThresholds mechanical = SpliceContinuityStore.lossThresholds().get(SpliceType.MECHANICAL);
        assertTrue(fusion.max() < mechanical.max());
    }

    @Test
    public void testMissingLoss() {
        assertEquals(LossClass.MISSING, SpliceContinuityStore.classifyLoss(null, SpliceType.FUSION));
        assertFalse(LossClass.MISSING.isPassing());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnorderedThresholdsRejected() {
        new LossThresholds(0.3, 0.2, 0.5);
    }

    @Test
    public void testStats() {
        List<Splice> list = new ArrayList<>();
        list.add(splice(SpliceType.FUSION, 0.05, SpliceStatus.COMPLETED));
        list.add(splice(SpliceType.FUSION, 0.12, SpliceStatus.COMPLETED));
        list.add(splice(SpliceType.FUSION, 0.40, SpliceStatus.FAILED));
        list.add(splice(SpliceType.FUSION, null, SpliceStatus.PENDING));

        SpliceStats stats = SpliceContinuityStore.stats(list);
        assertEquals(4, stats.total());
        assertEquals(2, stats.completed());
        assertEquals(1, stats.pending());
        assertEquals(1, stats.failed());
        assertEquals(3, stats.withLoss());
        assertEquals(0.19, stats.avgLoss(), EPS);
        assertEquals(0.05, stats.minLoss(), EPS);
        assertEquals(0.40, stats.maxLoss(), EPS);
        assertEquals(50.0, stats.passRate(), EPS);
    }

    @Test
    public void testStatsOfNothing() {
        SpliceStats stats = SpliceContinuityStore.stats(List.of());
        assertEquals(0, stats.total());
        assertEquals(0.0, stats.avgLoss(), EPS);
        assertEquals(0.0, stats.passRate(), EPS);
    }

    @Test
    public void testCompliance() {
        ComplianceResult clean = SpliceContinuityStore.compliance(splice(SpliceType.FUSION, 0.05,
                SpliceStatus.COMPLETED));
        assertEquals(ComplianceResult.Status.PASS, clean.status());
        assertTrue(clean.issues().isEmpty());
        assertEquals(LossClass.GOOD, clean.lossClass());

        Splice unsigned = splice(SpliceType.FUSION, 0.2, SpliceStatus.COMPLETED);
        unsigned.setTechnicianName(" ");
        unsigned.setOtdrTraceId(null);
        ComplianceResult warn = SpliceContinuityStore.compliance(unsigned);
        assertEquals(ComplianceResult.Status.WARN, warn.status());
        assertEquals(3, warn.issues().size());

        ComplianceResult failed = SpliceContinuityStore.compliance(splice(SpliceType.FUSION, 0.5,
                SpliceStatus.COMPLETED));
        assertEquals(ComplianceResult.Status.FAIL, failed.status());

        ComplianceResult missing = SpliceContinuityStore.compliance(splice(SpliceType.FUSION, null,
                SpliceStatus.PENDING));
        assertEquals(ComplianceResult.Status.WARN, missing.status());
        assertNull(missing.lossClass());
    }

    @Test
    public void testStatusFromLoss() {
        assertEquals(SpliceStatus.COMPLETED, SpliceStatus.forLoss(0.0));
        assertEquals(SpliceStatus.PENDING, SpliceStatus.forLoss(null));
        assertEquals(SpliceStatus.NEEDS_REVIEW, SpliceStatus.fromCode("needs-review"));
        assertEquals(SpliceType.MECHANICAL, SpliceType.fromCode("mechanical"));
    }
}
