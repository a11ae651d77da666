package com.netlink.osp.loss;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.netlink.osp.splice.SpliceType;

/**
 * TIA-568 reference values used by {@link LossBudgetCalculator}.
 * <p>
 * Attenuation is dB/km, splice loss dB per splice, connector loss dB per mated
 * pair. A zero attenuation marks a wavelength not used with that fiber type.
 */
public final class LossTables {

    /** Maximum attenuation; the value budgets are calculated with. */
    public static final Map<FiberType, Map<Wavelength, Double>> ATTENUATION_MAX = attenuation(
            0, 0, 0.5, 0.4,
            3.5, 1.5, 0, 0);

    /** Typical attenuation, for reference next to a calculated budget. */
    public static final Map<FiberType, Map<Wavelength, Double>> ATTENUATION_TYPICAL = attenuation(
            0, 0, 0.35, 0.25,
            2.5, 0.8, 0, 0);

    public static final Map<SpliceType, LossValue> SPLICE_LOSS;
    public static final Map<ConnectorType, LossValue> CONNECTOR_LOSS;
    public static final Map<FiberType, List<Wavelength>> WAVELENGTH_OPTIONS;

    /** Other insertion losses a designer may add by hand. */
    public static final Map<String, Double> ADDITIONAL_LOSSES;

    static {
        Map<SpliceType, LossValue> splice = new EnumMap<>(SpliceType.class);
        splice.put(SpliceType.FUSION, new LossValue(0.1, 0.3));
        splice.put(SpliceType.MECHANICAL, new LossValue(0.3, 0.5));
        SPLICE_LOSS = Collections.unmodifiableMap(splice);

        Map<ConnectorType, LossValue> connector = new EnumMap<>(ConnectorType.class);
        connector.put(ConnectorType.LC, new LossValue(0.2, 0.5));
        connector.put(ConnectorType.SC, new LossValue(0.25, 0.5));
        connector.put(ConnectorType.FC, new LossValue(0.25, 0.5));
        connector.put(ConnectorType.ST, new LossValue(0.3, 0.5));
        connector.put(ConnectorType.MPO, new LossValue(0.35, 0.75));
        connector.put(ConnectorType.MTP, new LossValue(0.35, 0.75));
        CONNECTOR_LOSS = Collections.unmodifiableMap(connector);

        Map<FiberType, List<Wavelength>> options = new EnumMap<>(FiberType.class);
        options.put(FiberType.SINGLEMODE, List.of(Wavelength.NM_1310, Wavelength.NM_1550));
        options.put(FiberType.MULTIMODE, List.of(Wavelength.NM_850, Wavelength.NM_1300));
        WAVELENGTH_OPTIONS = Collections.unmodifiableMap(options);

        Map<String, Double> extra = new LinkedHashMap<>();
        extra.put("macrobend", 0.1);
        extra.put("patchPanel", 0.3);
        extra.put("splitter_1x2", 3.5);
        extra.put("splitter_1x4", 7.0);
        extra.put("splitter_1x8", 10.5);
        extra.put("splitter_1x16", 14.0);
        extra.put("splitter_1x32", 17.5);
        ADDITIONAL_LOSSES = Collections.unmodifiableMap(extra);
    }

    private LossTables() {
        // Constants
    }

    public static double attenuation(FiberType fiberType, Wavelength wavelength, boolean typical) {
        return (typical ? ATTENUATION_TYPICAL : ATTENUATION_MAX).get(fiberType).get(wavelength);
    }

    private static Map<FiberType, Map<Wavelength, Double>> attenuation(
            double sm850, double sm1300, double sm1310, double sm1550,
            double mm850, double mm1300, double mm1310, double mm1550) {
        Map<FiberType, Map<Wavelength, Double>> m = new EnumMap<>(FiberType.class);
        m.put(FiberType.SINGLEMODE, row(sm850, sm1300, sm1310, sm1550));
        m.put(FiberType.MULTIMODE, row(mm850, mm1300, mm1310, mm1550));
        return Collections.unmodifiableMap(m);
    }

    private static Map<Wavelength, Double> row(double nm850, double nm1300, double nm1310, double nm1550) {
        Map<Wavelength, Double> r = new EnumMap<>(Wavelength.class);
        r.put(Wavelength.NM_850, nm850);
        r.put(Wavelength.NM_1300, nm1300);
        r.put(Wavelength.NM_1310, nm1310);
        r.put(Wavelength.NM_1550, nm1550);
        return Collections.unmodifiableMap(r);
    }
}
