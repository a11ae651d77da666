package com.netlink.osp.util;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

import com.netlink.osp.splice.Splice;

/**
 * Splice table as CSV. A field holding a comma, quote or line break is
 * quoted with inner quotes doubled; absent values are empty; timestamps are
 * ISO-8601.
 */
public final class SpliceCsvExporter {

    private record Column(String header, Function<Splice, Object> value) {
    }

    private static final List<Column> COLUMNS = List.of(
            new Column("ID", Splice::getId),
            new Column("Cable A", Splice::getCableAName),
            new Column("Fiber A", Splice::getFiberA),
            new Column("Tube A Color", Splice::getTubeAColor),
            new Column("Fiber A Color", Splice::getFiberAColor),
            new Column("Cable B", Splice::getCableBName),
            new Column("Fiber B", Splice::getFiberB),
            new Column("Tube B Color", Splice::getTubeBColor),
            new Column("Fiber B Color", Splice::getFiberBColor),
            new Column("Splice Type", s -> s.getSpliceType() == null ? null : s.getSpliceType().code()),
            new Column("Loss (dB)", Splice::getLoss),
            new Column("Technician", Splice::getTechnicianName),
            new Column("Date", Splice::getTimestamp),
            new Column("Status", s -> s.getStatus() == null ? null : s.getStatus().code()),
            new Column("Notes", Splice::getNotes));

    private SpliceCsvExporter() {
        // Utility class
    }

    public static String toCsv(Collection<Splice> splices) {
        StringWriter out = new StringWriter(128 + splices.size() * 96);
        try {
            write(out, splices);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    /** Header row then one row per splice, rows separated by {@code \n}. */
    public static void write(Writer out, Collection<Splice> splices) throws IOException {
        StringBuilder sb = new StringBuilder(256);
        for (int i = 0; i < COLUMNS.size(); i++) {
            if (i > 0)
                sb.append(',');
            sb.append(escape(COLUMNS.get(i).header()));
        }
        out.write(sb.toString());
        for (Splice s : splices) {
            sb.setLength(0);
            sb.append('\n');
            for (int i = 0; i < COLUMNS.size(); i++) {
                if (i > 0)
                    sb.append(',');
                Object v = COLUMNS.get(i).value().apply(s);
                sb.append(v == null ? "" : escape(v.toString()));
            }
            out.write(sb.toString());
        }
    }

    static String escape(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0)
            return value;
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
