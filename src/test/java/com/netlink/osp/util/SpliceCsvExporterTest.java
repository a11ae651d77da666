package com.netlink.osp.util;

import java.time.Instant;
import java.util.List;

import org.junit.Test;

import com.netlink.osp.splice.Splice;
import com.netlink.osp.splice.SpliceStatus;
import com.netlink.osp.splice.SpliceType;

import static org.junit.Assert.*;

public class SpliceCsvExporterTest {

    @Test
    public void testHeaderAndRow() {
        Splice s = new Splice();
        s.setId(4);
        s.setCableAName("FDR, main");
        s.setFiberA(13);
        s.setTubeAColor("Orange");
        s.setFiberAColor("Blue");
        s.setCableBName("BR-7");
        s.setFiberB(1);
        s.setTubeBColor("Blue");
        s.setFiberBColor("Blue");
        s.setSpliceType(SpliceType.FUSION);
        s.setTechnicianName("Jane \"JJ\" Doe");
        s.setTimestamp(Instant.parse("2026-02-03T04:05:06Z"));
        s.setStatus(SpliceStatus.PENDING);

        String[] lines = SpliceCsvExporter.toCsv(List.of(s)).split("\n");
        assertEquals(2, lines.length);
        assertTrue(lines[0].startsWith("ID,Cable A,Fiber A,"));
        assertEquals("4,\"FDR, main\",13,Orange,Blue,BR-7,1,Blue,Blue,fusion,,\"Jane \"\"JJ\"\" Doe\","
                + "2026-02-03T04:05:06Z,pending,", lines[1]);
    }

    @Test
    public void testEscaping() {
        assertEquals("plain", SpliceCsvExporter.escape("plain"));
        assertEquals("\"a\nb\"", SpliceCsvExporter.escape("a\nb"));
        assertEquals("\"\"\"\"", SpliceCsvExporter.escape("\""));
    }

    @Test
    public void testEmptyTableIsHeaderOnly() {
        assertFalse(SpliceCsvExporter.toCsv(List.of()).contains("\n"));
    }
}
