package im.arun.genreport.service;

import java.util.List;

/**
 * Result of the pre-flight connectivity check.
 *
 * @param disconnected xrefs not reachable from the root, in document order
 * @param preview      {@code "<header>  (<xref>)"} lines for the first few of them
 */
public record ConnectivityReport(String root, List<String> disconnected, List<String> preview) {

    public ConnectivityReport {
        disconnected = List.copyOf(disconnected);
        preview = List.copyOf(preview);
    }

    public boolean isConnected() {
        return disconnected.isEmpty();
    }

    public int remaining() {
        return disconnected.size() - preview.size();
    }

    /**
     * Multi-line description for the user. With {@code proceeding} set, the run goes on and the
     * text reads as a warning instead of a failure.
     */
    public String message(boolean proceeding) {
        StringBuilder sb = new StringBuilder();
        sb.append("Connectivity check ").append(proceeding ? "warning" : "failed").append(": Found ")
            .append(disconnected.size())
            .append(" disconnected individual(s) not linked to the chosen root.\n");
        sb.append("Examples:\n");
        for (String line : preview) {
            sb.append("  - ").append(line).append('\n');
        }
        if (remaining() > 0) {
            sb.append("  ... and ").append(remaining()).append(" more\n");
        }
        sb.append("Tip: verify --root, fix family links, or re-run with --allow-islands to proceed anyway.");
        return sb.toString();
    }
}
