package com.netlink.osp.network;

import java.util.EnumSet;

import org.junit.Test;

import static org.junit.Assert.*;

public class ElementTypeTest {

    @Test
    public void testChildTypesAreInverseOfParentTable() {
        for (ElementType parent : ElementType.values()) {
            for (ElementType child : ElementType.values()) {
                assertEquals(parent + "->" + child, child.allowedParentTypes().contains(parent),
                        parent.allowedChildTypes().contains(child));
            }
        }
    }

    @Test
    public void testHierarchyTable() {
        assertTrue(ElementType.OLT.isRoot());
        assertFalse(ElementType.ODF.isRoot());
        assertEquals(EnumSet.of(ElementType.OLT), ElementType.ODF.allowedParentTypes());
        assertEquals(EnumSet.of(ElementType.OLT, ElementType.ODF, ElementType.CLOSURE),
                ElementType.CLOSURE.allowedParentTypes());
        assertEquals(EnumSet.of(ElementType.OLT, ElementType.CLOSURE), ElementType.LCP.allowedParentTypes());
        assertTrue(ElementType.CLOSURE.canParent(ElementType.CLOSURE));
        assertFalse(ElementType.LCP.canParent(ElementType.ODF));
        assertEquals(5, ElementType.hierarchyTable().size());
    }

    @Test
    public void testEnclosureFlags() {
        assertFalse(ElementType.OLT.isEnclosure());
        assertFalse(ElementType.ODF.isEnclosure());
        assertTrue(ElementType.NAP.isEnclosure());
        assertEquals(ElementType.CLOSURE, EnclosureKind.HANDHOLE.family());
        assertEquals(ElementType.LCP, EnclosureKind.fromCode("fdt").family());
        assertNull(EnclosureKind.defaultFor(ElementType.ODF));
        assertEquals(ElementType.CLOSURE, ElementType.fromCode("closure"));
    }

    @Test
    public void testEdgeCategory() {
        assertEquals(EdgeCategory.FEEDER, EdgeCategory.between(ElementType.OLT, ElementType.CLOSURE));
        assertEquals(EdgeCategory.DISTRIBUTION, EdgeCategory.between(ElementType.CLOSURE, ElementType.CLOSURE));
        assertEquals(EdgeCategory.DROP, EdgeCategory.between(ElementType.LCP, ElementType.NAP));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownCode() {
        ElementType.fromCode("splitter");
    }
}
