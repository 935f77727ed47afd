package utilities;

import org.openjdk.jol.info.GraphLayout;
import org.openjdk.jol.vm.VM;
import tree.gst.GeneralizedSuffixTree;

import java.util.Locale;

public class MemUtil {

    // Detailed JOL report for a suffix tree, optionally including the class footprint table.
    public String jolMemoryReport(GeneralizedSuffixTree tree, boolean includeFootprintTable) {
        StringBuilder sb = new StringBuilder(4_096);

        // VM details (useful to interpret alignment, header sizes, and compressed oops status)
        sb.append("=== JOL / VM details ===\n");
        sb.append(VM.current().details()).append('\n');

        GraphLayout total = GraphLayout.parseInstance(tree);
        sb.append("\n=== Suffix tree total (tree as root) ===\n");
        sb.append("Nodes             : ").append(tree.nodeCount()).append('\n');
        sb.append("Strings           : ").append(tree.stringCount()).append('\n');
        sb.append("Total bytes       : ").append(total.totalSize()).append(" B\n");
        sb.append("Total bytes (MiB) : ")
                .append(String.format(Locale.ROOT, "%.3f", total.totalSize() / (1024.0 * 1024.0)))
                .append(" MiB\n");
        if (tree.nodeCount() > 0) {
            sb.append("Bytes per node    : ")
                    .append(String.format(Locale.ROOT, "%.1f", total.totalSize() / (double) tree.nodeCount()))
                    .append('\n');
        }

        if (includeFootprintTable) {
            // Class-by-class histogram (spots large contributors such as the child maps)
            sb.append("\n--- Class footprint (tree root) ---\n");
            sb.append(total.toFootprint()).append('\n');
        }

        return sb.toString();
    }

    // Like jolMemoryReport but also returns the total MiB value.
    public MemoryUsageReport jolMemoryReportWithTotal(GeneralizedSuffixTree tree, boolean includeFootprintTable) {
        String txt = jolMemoryReport(tree, includeFootprintTable);
        long totalBytes = GraphLayout.parseInstance(tree).totalSize();
        double totalMiB = totalBytes / (1024.0 * 1024.0);
        return new MemoryUsageReport(txt, totalBytes, totalMiB);
    }
}
