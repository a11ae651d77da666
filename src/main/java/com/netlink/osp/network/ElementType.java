package com.netlink.osp.network;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Role of a network element in the outside-plant hierarchy.
 *
 * <pre>
 * OLT      root
 * ODF      parent: OLT
 * CLOSURE  parent: OLT, ODF, CLOSURE   (closures chain into closures)
 * LCP      parent: OLT, CLOSURE
 * NAP      parent: LCP
 * </pre>
 *
 * Child types are the inverse of the parent table.
 */
public enum ElementType {
    OLT("olt", false),
    ODF("odf", false),
    CLOSURE("closure", true),
    LCP("lcp", true),
    NAP("nap", true);

    private static final Map<ElementType, Set<ElementType>> ALLOWED_PARENTS = new EnumMap<>(ElementType.class);
    private static final Map<ElementType, Set<ElementType>> ALLOWED_CHILDREN = new EnumMap<>(ElementType.class);

    static {
        ALLOWED_PARENTS.put(OLT, Collections.unmodifiableSet(EnumSet.noneOf(ElementType.class)));
        ALLOWED_PARENTS.put(ODF, Collections.unmodifiableSet(EnumSet.of(OLT)));
        ALLOWED_PARENTS.put(CLOSURE, Collections.unmodifiableSet(EnumSet.of(OLT, ODF, CLOSURE)));
        ALLOWED_PARENTS.put(LCP, Collections.unmodifiableSet(EnumSet.of(OLT, CLOSURE)));
        ALLOWED_PARENTS.put(NAP, Collections.unmodifiableSet(EnumSet.of(LCP)));

        for (ElementType child : values()) {
            ALLOWED_CHILDREN.put(child, EnumSet.noneOf(ElementType.class));
        }
        for (var entry : ALLOWED_PARENTS.entrySet()) {
            for (ElementType parent : entry.getValue())
                ALLOWED_CHILDREN.get(parent).add(entry.getKey());
        }
        for (ElementType t : values()) {
            ALLOWED_CHILDREN.put(t, Collections.unmodifiableSet(ALLOWED_CHILDREN.get(t)));
        }
    }

    private final String code;
    private final boolean enclosure;

    ElementType(String code, boolean enclosure) {
        this.code = code;
        this.enclosure = enclosure;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** Closures, LCPs and NAPs are enclosures: they hold trays. */
    public boolean isEnclosure() {
        return enclosure;
    }

    /** Every element but the OLT has patch ports; the OLT has PON ports. */
    public boolean hasPatchPorts() {
        return this != OLT;
    }

    public boolean isRoot() {
        return ALLOWED_PARENTS.get(this).isEmpty();
    }

    public Set<ElementType> allowedParentTypes() {
        return ALLOWED_PARENTS.get(this);
    }

    public Set<ElementType> allowedChildTypes() {
        return ALLOWED_CHILDREN.get(this);
    }

    public boolean canParent(ElementType child) {
        return ALLOWED_CHILDREN.get(this).contains(child);
    }

    /** Prefix used for generated names, e.g. {@code CLOSURE-3}. */
    public String namePrefix() {
        return name();
    }

    /** Read-only view of the whole parent table. */
    public static Map<ElementType, Set<ElementType>> hierarchyTable() {
        return Collections.unmodifiableMap(ALLOWED_PARENTS);
    }

    @JsonCreator
    public static ElementType fromCode(String text) {
        for (ElementType t : values()) {
            if (t.code.equalsIgnoreCase(text) || t.name().equalsIgnoreCase(text))
                return t;
        }
        throw new IllegalArgumentException("Unknown element type: " + text);
    }
}
