package im.arun.genreport.graph;

import im.arun.genreport.ged.GedDocument;
import im.arun.genreport.ged.GedLine;
import im.arun.genreport.model.FamilyRecord;
import im.arun.genreport.model.RecordRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds individuals that cannot be reached from a root over spouse and parent/child links.
 */
public class ConnectivityChecker {
    private static final Logger logger = LoggerFactory.getLogger(ConnectivityChecker.class);

    private final GedDocument document;

    public ConnectivityChecker(GedDocument document) {
        this.document = document;
    }

    /**
     * Individuals not connected to {@code rootXref}, in document order. Media-only placeholders
     * are never reported. If the root itself is not a candidate, every candidate is reported.
     */
    public Set<String> findDisconnected(String rootXref) {
        Map<String, Set<String>> adjacency = buildGraph();

        Set<String> people = new LinkedHashSet<>();
        for (String xref : document.individualXrefs()) {
            if (!isMediaPlaceholder(xref)) {
                people.add(xref);
            }
        }

        Set<String> visited = new HashSet<>();
        if (people.contains(rootXref)) {
            Deque<String> queue = new ArrayDeque<>();
            queue.add(rootXref);
            visited.add(rootXref);
            while (!queue.isEmpty()) {
                String current = queue.poll();
                for (String next : adjacency.getOrDefault(current, Set.of())) {
                    if (people.contains(next) && visited.add(next)) {
                        queue.add(next);
                    }
                }
            }
        }

        Set<String> disconnected = new LinkedHashSet<>(people);
        disconnected.removeAll(visited);
        logger.info("{} of {} individuals reachable from {}, {} disconnected",
            visited.size(), people.size(), rootXref, disconnected.size());
        return disconnected;
    }

    /**
     * Undirected person graph: spouse to spouse, and each spouse to each child, per family.
     */
    Map<String, Set<String>> buildGraph() {
        Map<String, Set<String>> adjacency = new HashMap<>();
        for (FamilyRecord family : document.allFamilies()) {
            String husband = family.husband();
            String wife = family.wife();
            if (husband != null && wife != null) {
                link(adjacency, husband, wife);
            }
            for (String child : family.children()) {
                if (husband != null) {
                    link(adjacency, husband, child);
                }
                if (wife != null) {
                    link(adjacency, wife, child);
                }
            }
        }
        return adjacency;
    }

    private static void link(Map<String, Set<String>> adjacency, String a, String b) {
        adjacency.computeIfAbsent(a, k -> new LinkedHashSet<>()).add(b);
        adjacency.computeIfAbsent(b, k -> new LinkedHashSet<>()).add(a);
    }

    /**
     * An individual without a NAME and without FAMC/FAMS links that only holds OBJE media.
     */
    public boolean isMediaPlaceholder(String xref) {
        RecordRange range = document.individual(xref).orElse(null);
        if (range == null) {
            return false;
        }
        boolean hasName = false;
        boolean hasFamily = false;
        boolean hasMedia = false;
        List<String> lines = document.lines();
        for (int i = range.start() + 1; i < range.end(); i++) {
            Integer level = GedLine.levelOf(lines.get(i));
            if (level == null || level != 1) {
                continue;
            }
            GedLine.TagValue tv = GedLine.tagAndValue(lines.get(i));
            switch (tv.tag()) {
                case "NAME":
                    hasName |= !tv.value().isBlank();
                    break;
                case "FAMC":
                case "FAMS":
                    hasFamily = true;
                    break;
                case "OBJE":
                    hasMedia = true;
                    break;
                default:
                    break;
            }
        }
        return !hasName && !hasFamily && hasMedia;
    }
}
