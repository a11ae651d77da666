package com.netlink.osp.loss;

/** Optical power budget of common transceiver classes, in dB. */
public enum EquipmentClass {
    GPON_CLASS_B("GPON Class B", 28),
    GPON_CLASS_B_PLUS("GPON Class B+", 28),
    GPON_CLASS_C("GPON Class C", 30),
    GPON_CLASS_C_PLUS("GPON Class C+", 32),
    XGSPON_N1("XGS-PON N1", 29),
    XGSPON_N2("XGS-PON N2", 31),
    GIGABIT_SX("1000BASE-SX", 7.5),
    GIGABIT_LX("1000BASE-LX", 11),
    GIGABIT_ZX("1000BASE-ZX", 23),
    TEN_GIG_SR("10GBASE-SR", 6.5),
    TEN_GIG_LR("10GBASE-LR", 9.4),
    TEN_GIG_ER("10GBASE-ER", 15.6);

    private final String label;
    private final double budgetDb;

    EquipmentClass(String label, double budgetDb) {
        this.label = label;
        this.budgetDb = budgetDb;
    }

    public String label() {
        return label;
    }

    public double budgetDb() {
        return budgetDb;
    }
}
