package im.arun.genreport.graph;

import im.arun.genreport.config.GenReportConfig;
import im.arun.genreport.ged.GedDocument;
import im.arun.genreport.ged.GedLine;
import im.arun.genreport.model.BirthDateKey;
import im.arun.genreport.model.FamilyRecord;
import im.arun.genreport.model.RecordRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assigns every individual reachable from the root a stable integer.
 *
 * <p>Ancestors get 0, 1, 2, ... generation by generation (father before mother). Other
 * relatives start at the next full thousand above the last ancestor and are grouped by
 * generation relative to the root, oldest first. A configured exception band finally places
 * specific individuals on a fixed range.
 *
 * <p>Ancestors reachable along more than one path keep the generation in which they were
 * first reached.
 */
public class IdentifierAssigner {
    private static final Logger logger = LoggerFactory.getLogger(IdentifierAssigner.class);

    private static final Pattern BIRTH_DATE =
        Pattern.compile("(\\d{4})(?:[- /.](\\d{1,2}))?(?:[- /.](\\d{1,2}))?");

    private final GedDocument document;
    private final GenReportConfig.ExceptionBand exceptionBand;
    private final Map<String, BirthDateKey> birthKeys = new HashMap<>();

    public IdentifierAssigner(GedDocument document) {
        this(document, new GenReportConfig.ExceptionBand());
    }

    public IdentifierAssigner(GedDocument document, GenReportConfig.ExceptionBand exceptionBand) {
        this.document = document;
        this.exceptionBand = exceptionBand;
    }

    /**
     * Generations of ancestors starting with {@code [root]}. Each generation lists the parents
     * of the previous one in order, father then mother; nobody appears twice.
     */
    public List<List<String>> ancestorLayers(String rootXref) {
        List<List<String>> layers = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        List<String> current = List.of(rootXref);

        while (!current.isEmpty()) {
            List<String> layer = new ArrayList<>();
            for (String xref : current) {
                if (xref != null && visited.add(xref)) {
                    layer.add(xref);
                }
            }
            if (layer.isEmpty()) {
                break;
            }
            layers.add(layer);

            List<String> next = new ArrayList<>();
            for (String xref : layer) {
                next.addAll(parentsOf(xref));
            }
            current = next;
        }
        return layers;
    }

    /**
     * Compute the identifier map for {@code rootXref}. Iteration order of the result is the
     * order of assignment.
     */
    public Map<String, Integer> assign(String rootXref) {
        Map<String, Integer> ids = new LinkedHashMap<>();
        Set<Integer> used = new HashSet<>();

        List<List<String>> layers = ancestorLayers(rootXref);
        int nextId = 0;
        for (List<String> layer : layers) {
            for (String xref : layer) {
                ids.put(xref, nextId);
                used.add(nextId);
                nextId++;
            }
        }
        int lastAncestor = nextId - 1;
        int nextThousand = lastAncestor >= 0 ? ((lastAncestor / 1000) + 1) * 1000 : 1000;

        TreeMap<Integer, List<String>> buckets = populateBuckets(layers, ids.keySet());
        orderRootChildren(buckets, rootXref);
        orderRootGeneration(buckets, rootXref, layers);
        buckets.replaceAll((generation, members) ->
            generation == -1 || generation == 0 ? members : oldestFirst(members));

        int next = nextThousand;
        for (List<String> members : buckets.values()) {
            for (String xref : members) {
                if (ids.containsKey(xref)) {
                    continue;
                }
                while (used.contains(next)) {
                    next++;
                }
                ids.put(xref, next);
                used.add(next);
                next++;
            }
        }

        assignExceptionBand(ids, used);

        logger.info("Assigned {} identifiers ({} ancestors in {} generations) from root {}",
            ids.size(), lastAncestor + 1, layers.size(), rootXref);
        return ids;
    }

    private TreeMap<Integer, List<String>> populateBuckets(List<List<String>> layers, Set<String> ancestors) {
        TreeMap<Integer, List<String>> buckets = new TreeMap<>();
        Set<String> seen = new HashSet<>();

        for (int generation = 0; generation < layers.size(); generation++) {
            for (String ancestor : layers.get(generation)) {
                for (FamilyRecord family : spouseFamilyRecords(ancestor)) {
                    Optional<String> other = family.otherSpouse(ancestor);
                    if (other.isPresent() && !ancestors.contains(other.get()) && seen.add(other.get())) {
                        buckets.computeIfAbsent(generation, g -> new ArrayList<>()).add(other.get());
                    }
                    for (String child : family.children()) {
                        if (!ancestors.contains(child) && seen.add(child)) {
                            buckets.computeIfAbsent(generation - 1, g -> new ArrayList<>()).add(child);
                        }
                    }
                }
            }
        }
        return buckets;
    }

    /**
     * Children of the root's own families, deduplicated, oldest first.
     */
    private void orderRootChildren(TreeMap<Integer, List<String>> buckets, String rootXref) {
        List<String> bucket = buckets.get(-1);
        if (bucket == null) {
            return;
        }
        Set<String> members = new HashSet<>(bucket);
        Set<String> children = new LinkedHashSet<>();
        for (FamilyRecord family : spouseFamilyRecords(rootXref)) {
            for (String child : family.children()) {
                if (members.contains(child)) {
                    children.add(child);
                }
            }
        }
        buckets.put(-1, oldestFirst(new ArrayList<>(children)));
    }

    /**
     * Root's spouses, then full siblings oldest first, then everybody else in discovery order.
     */
    private void orderRootGeneration(TreeMap<Integer, List<String>> buckets, String rootXref,
                                     List<List<String>> layers) {
        List<String> bucket = buckets.get(0);
        if (bucket == null) {
            return;
        }
        Set<String> members = new HashSet<>(bucket);

        List<String> spouses = new ArrayList<>();
        for (FamilyRecord family : spouseFamilyRecords(rootXref)) {
            family.otherSpouse(rootXref)
                .filter(members::contains)
                .ifPresent(spouses::add);
        }

        List<String> siblings = new ArrayList<>();
        if (layers.size() >= 2 && layers.get(1).size() >= 2) {
            String father = layers.get(1).get(0);
            String mother = layers.get(1).get(1);
            Set<String> parents = Set.of(father, mother);
            for (FamilyRecord family : spouseFamilyRecords(father)) {
                Set<String> couple = new HashSet<>();
                couple.add(family.husband());
                couple.add(family.wife());
                if (parents.equals(couple)) {
                    Set<String> unique = new LinkedHashSet<>();
                    for (String child : family.children()) {
                        if (!child.equals(rootXref) && members.contains(child)) {
                            unique.add(child);
                        }
                    }
                    siblings = oldestFirst(new ArrayList<>(unique));
                    break;
                }
            }
        }

        List<String> ordered = new ArrayList<>(spouses);
        for (String sibling : siblings) {
            if (!ordered.contains(sibling)) {
                ordered.add(sibling);
            }
        }
        for (String xref : bucket) {
            if (!ordered.contains(xref)) {
                ordered.add(xref);
            }
        }
        buckets.put(0, ordered);
    }

    private void assignExceptionBand(Map<String, Integer> ids, Set<Integer> used) {
        int next = exceptionBand.getStart();
        for (String xref : exceptionBand.getXrefs()) {
            if (!document.containsIndividual(xref) || ids.containsKey(xref)) {
                continue;
            }
            while (used.contains(next)) {
                next++;
            }
            ids.put(xref, next);
            used.add(next);
            logger.debug("Exception band: {} -> {}", xref, next);
            next++;
        }
    }

    /**
     * Sort key from the first DATE under the individual's first BIRT event. Missing parts are
     * {@link BirthDateKey#UNKNOWN}.
     */
    public BirthDateKey birthKey(String xref) {
        return birthKeys.computeIfAbsent(xref, this::readBirthKey);
    }

    private BirthDateKey readBirthKey(String xref) {
        RecordRange range = document.individual(xref).orElse(null);
        if (range == null) {
            return BirthDateKey.MISSING;
        }
        List<String> lines = document.lines();
        for (int i = range.start() + 1; i < range.end(); i++) {
            if (GedLine.levelOrZero(lines.get(i)) != 1 || !"BIRT".equals(GedLine.tagAndValue(lines.get(i)).tag())) {
                continue;
            }
            for (int j = i + 1; j < range.end() && GedLine.levelOrZero(lines.get(j)) > 1; j++) {
                GedLine.TagValue tv = GedLine.tagAndValue(lines.get(j));
                if ("DATE".equals(tv.tag()) && !tv.value().isEmpty()) {
                    return parseBirthKey(tv.value());
                }
            }
            return BirthDateKey.MISSING;
        }
        return BirthDateKey.MISSING;
    }

    static BirthDateKey parseBirthKey(String value) {
        Matcher m = BIRTH_DATE.matcher(value);
        if (!m.find()) {
            return BirthDateKey.MISSING;
        }
        int year = Integer.parseInt(m.group(1));
        int month = m.group(2) != null ? Integer.parseInt(m.group(2)) : BirthDateKey.UNKNOWN;
        int day = m.group(3) != null ? Integer.parseInt(m.group(3)) : BirthDateKey.UNKNOWN;
        return new BirthDateKey(year, month, day);
    }

    private List<String> oldestFirst(List<String> xrefs) {
        List<String> sorted = new ArrayList<>(xrefs);
        // List.sort is stable, so equal keys keep discovery order
        sorted.sort(Comparator.comparing(this::birthKey));
        return sorted;
    }

    /**
     * Father then mother of the first FAMC family, where present.
     */
    private List<String> parentsOf(String xref) {
        List<String> childFamilies = document.childFamilies(xref);
        if (childFamilies.isEmpty()) {
            return List.of();
        }
        Optional<FamilyRecord> family = document.family(childFamilies.get(0));
        if (family.isEmpty()) {
            return List.of();
        }
        List<String> parents = new ArrayList<>(2);
        if (family.get().husband() != null) {
            parents.add(family.get().husband());
        }
        if (family.get().wife() != null) {
            parents.add(family.get().wife());
        }
        return parents;
    }

    private List<FamilyRecord> spouseFamilyRecords(String xref) {
        List<FamilyRecord> records = new ArrayList<>();
        for (String famXref : document.spouseFamilies(xref)) {
            document.family(famXref).ifPresent(records::add);
        }
        return records;
    }
}
