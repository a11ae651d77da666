package com.netlink.osp.loss;

import java.util.Objects;

import com.netlink.osp.api.ValidationException;

/**
 * Link description for a loss budget.
 *
 * @param useMaxValues price splices and connectors at their worst-case value
 *                     instead of the typical one
 * @param marginDb     safety margin added on top of the link loss
 */
public record LossBudgetInput(String name, FiberType fiberType, Wavelength wavelength, double distanceKm,
        int fusionSplices, int mechanicalSplices, int connectorPairs, ConnectorType connectorType,
        boolean useMaxValues, double marginDb) {

    public LossBudgetInput {
        Objects.requireNonNull(fiberType, "fiberType");
        Objects.requireNonNull(wavelength, "wavelength");
        Objects.requireNonNull(connectorType, "connectorType");
        if (distanceKm < 0 || Double.isNaN(distanceKm))
            throw new ValidationException("Distance must be >= 0 km: " + distanceKm);
        if (fusionSplices < 0 || mechanicalSplices < 0 || connectorPairs < 0)
            throw new ValidationException("Splice and connector counts must be >= 0");
        if (marginDb < 0 || Double.isNaN(marginDb))
            throw new ValidationException("Margin must be >= 0 dB: " + marginDb);
    }

    /** Typical-value link with no name. */
    public static LossBudgetInput of(FiberType fiberType, Wavelength wavelength, double distanceKm,
            int fusionSplices, int mechanicalSplices, int connectorPairs, ConnectorType connectorType,
            double marginDb) {
        return new LossBudgetInput(null, fiberType, wavelength, distanceKm, fusionSplices, mechanicalSplices,
                connectorPairs, connectorType, false, marginDb);
    }

    public LossBudgetInput withMaxValues() {
        return new LossBudgetInput(name, fiberType, wavelength, distanceKm, fusionSplices, mechanicalSplices,
                connectorPairs, connectorType, true, marginDb);
    }
}
