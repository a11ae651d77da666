package com.netlink.osp.network;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Physical enclosure subtype. Each subtype belongs to one family, and the
 * family decides the element's role in the hierarchy.
 */
public enum EnclosureKind {
    SPLICE_CLOSURE("splice-closure", ElementType.CLOSURE),
    HANDHOLE("handhole", ElementType.CLOSURE),
    PEDESTAL("pedestal", ElementType.CLOSURE),
    BUILDING("building", ElementType.CLOSURE),
    POLE("pole", ElementType.CLOSURE),
    CABINET("cabinet", ElementType.CLOSURE),
    LCP("lcp", ElementType.LCP),
    FDT("fdt", ElementType.LCP),
    NAP("nap", ElementType.NAP),
    FAT("fat", ElementType.NAP);

    private final String code;
    private final ElementType family;

    EnclosureKind(String code, ElementType family) {
        this.code = code;
        this.family = family;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public ElementType family() {
        return family;
    }

    /**
     * Subtype assumed when an enclosure is created without one. Null for
     * OLT and ODF, which are not enclosures.
     */
    public static EnclosureKind defaultFor(ElementType type) {
        return switch (type) {
            case CLOSURE -> SPLICE_CLOSURE;
            case LCP -> LCP;
            case NAP -> NAP;
            default -> null;
        };
    }

    @JsonCreator
    public static EnclosureKind fromCode(String text) {
        for (EnclosureKind k : values()) {
            if (k.code.equalsIgnoreCase(text) || k.name().equalsIgnoreCase(text))
                return k;
        }
        throw new IllegalArgumentException("Unknown enclosure kind: " + text);
    }
}
