package utilities;

import automaton.Automaton;
import org.openjdk.jol.info.GraphLayout;
import org.openjdk.jol.vm.VM;

import java.util.Locale;

public class MemUtil {

    // Retained size of the automaton graph (nodes, output table, pattern table).
    public long totalBytes(Automaton automaton) {
        return GraphLayout.parseInstance(automaton).totalSize();
    }

    // Detailed JOL report for a compiled automaton, optionally including the class footprint table.
    public String jolMemoryReport(boolean includeFootprintTable, Automaton automaton) {
        StringBuilder sb = new StringBuilder(4_096);

        // VM details (useful to interpret alignment, header sizes, and compressed oops status)
        sb.append("=== JOL / VM details ===\n");
        sb.append(VM.current().details()).append('\n');

        GraphLayout total = GraphLayout.parseInstance(automaton);
        sb.append("\n=== Automaton total ===\n");
        sb.append("Nodes             : ").append(automaton.nodeCount()).append('\n');
        sb.append("Total bytes       : ").append(total.totalSize()).append(" B\n");
        sb.append("Total bytes (MiB) : ")
                .append(String.format(Locale.ROOT, "%.3f", total.totalSize() / (1024.0 * 1024.0)))
                .append(" MiB\n");
        sb.append("Bytes per node    : ")
                .append(String.format(Locale.ROOT, "%.1f", total.totalSize() / (double) automaton.nodeCount()))
                .append('\n');

        if (includeFootprintTable) {
            // Class-by-class histogram (helps to spot large contributors, e.g. per-node child maps)
            sb.append("\n--- Class footprint ---\n");
            sb.append(total.toFootprint()).append('\n');
        }
        return sb.toString();
    }
}
