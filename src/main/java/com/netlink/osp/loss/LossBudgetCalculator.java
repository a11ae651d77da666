package com.netlink.osp.loss;

import com.netlink.osp.splice.SpliceType;

/**
 * Deterministic dB budget arithmetic.
 *
 * <pre>
 * fiberLoss      = distanceKm * attenuation[fiberType][wavelength]
 * fusionLoss     = fusionSplices * splice[fusion]
 * mechanicalLoss = mechanicalSplices * splice[mechanical]
 * connectorLoss  = connectorPairs * connector[type]
 * marginLoss     = marginDb
 * totalLoss      = sum of the above
 * </pre>
 *
 * All per-unit values come from {@link LossTables}.
 */
public final class LossBudgetCalculator {

    private LossBudgetCalculator() {
        // Utility class
    }

    public static LossBudgetBreakdown calculate(LossBudgetInput in) {
        double attenuation = LossTables.attenuation(in.fiberType(), in.wavelength(), false);
        double fusionValue = LossTables.SPLICE_LOSS.get(SpliceType.FUSION).pick(in.useMaxValues());
        double mechanicalValue = LossTables.SPLICE_LOSS.get(SpliceType.MECHANICAL).pick(in.useMaxValues());
        double connectorValue = LossTables.CONNECTOR_LOSS.get(in.connectorType()).pick(in.useMaxValues());

        double fiber = round2(in.distanceKm() * attenuation);
        double fusion = round2(in.fusionSplices() * fusionValue);
        double mechanical = round2(in.mechanicalSplices() * mechanicalValue);
        double connector = round2(in.connectorPairs() * connectorValue);
        double margin = round2(in.marginDb());
        double total = round2(fiber + fusion + mechanical + connector + margin);

        return new LossBudgetBreakdown(fiber, fusion, mechanical, connector, margin, total,
                new LossBudgetBreakdown.Details(attenuation, fusionValue, mechanicalValue, connectorValue));
    }

    public static PowerBudgetCheck checkPowerBudget(double totalLoss, EquipmentClass equipment) {
        double budget = equipment.budgetDb();
        double margin = budget - totalLoss;
        return new PowerBudgetCheck(equipment, budget, round2(margin), margin >= 0);
    }

    static double round2(double v) {
        return Math.round(v * 100) / 100.0;
    }
}
