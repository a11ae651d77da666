package com.netlink.osp.loss;

/** Link loss compared with an equipment budget. {@code margin} is budget minus loss. */
public record PowerBudgetCheck(EquipmentClass equipment, double budgetDb, double margin, boolean pass) {
}
