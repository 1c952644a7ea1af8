package de.bsommerfeld.gridkeeper.db.catalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The table forest of one database: every catalogued table plus an index
 * from parent name to children.
 *
 * <h3>Parent resolution</h3>
 * The catalog's {@code parent_table} is authoritative. Only a structure row
 * without a recorded parent falls back to the naming convention
 * {@code <parent>_<column>}: its parent is the longest catalogued table name
 * {@code P} such that the row's name starts with {@code P + "_"}. A table
 * named {@code ItemsBackup} therefore never becomes a child of
 * {@code Items}.
 */
public final class TableHierarchy {

    private final Map<String, TableDescriptor> tables;
    private final Map<String, String> parents;
    private final Map<String, List<String>> children;

    private TableHierarchy(Map<String, TableDescriptor> tables) {
        this.tables = tables;
        this.parents = new HashMap<>();
        this.children = new HashMap<>();

        for (TableDescriptor table : tables.values()) {
            String parent = resolveParent(table);
            if (parent == null)
                continue;
            parents.put(table.name(), parent);
            children.computeIfAbsent(parent, k -> new ArrayList<>()).add(table.name());
        }
    }

    public static TableHierarchy of(Collection<TableDescriptor> descriptors) {
        Map<String, TableDescriptor> byName = new LinkedHashMap<>();
        for (TableDescriptor d : descriptors) {
            byName.put(d.name(), d);
        }
        return new TableHierarchy(byName);
    }

    public static TableHierarchy empty() {
        return new TableHierarchy(new LinkedHashMap<>());
    }

    public boolean contains(String table) {
        return tables.containsKey(table);
    }

    public TableDescriptor get(String table) {
        return tables.get(table);
    }

    /** All tables in catalog order. */
    public Collection<TableDescriptor> tables() {
        return Collections.unmodifiableCollection(tables.values());
    }

    public String parentOf(String table) {
        return parents.get(table);
    }

    public List<String> childrenOf(String table) {
        return List.copyOf(children.getOrDefault(table, List.of()));
    }

    /**
     * Every table below {@code table}, breadth first. A table is listed at
     * most once even if the catalog contains a cycle.
     */
    public List<String> descendantsOf(String table) {
        List<String> result = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(table);
        List<String> frontier = childrenOf(table);
        while (!frontier.isEmpty()) {
            List<String> next = new ArrayList<>();
            for (String child : frontier) {
                if (!visited.add(child))
                    continue;
                result.add(child);
                next.addAll(childrenOf(child));
            }
            frontier = next;
        }
        return result;
    }

    /** 0 for a root table, 1 for its children, and so on. */
    public int depthOf(String table) {
        int depth = 0;
        Set<String> seen = new HashSet<>();
        String current = parents.get(table);
        while (current != null && seen.add(current)) {
            depth++;
            current = parents.get(current);
        }
        return depth;
    }

    private String resolveParent(TableDescriptor table) {
        String recorded = table.parentTable();
        if (recorded != null && !recorded.isBlank())
            return recorded;
        if (!table.isStructure())
            return null;

        String best = null;
        for (String candidate : tables.keySet()) {
            if (candidate.equals(table.name()))
                continue;
            if (table.name().startsWith(candidate + "_")
                    && (best == null || candidate.length() > best.length()))
                best = candidate;
        }
        return best;
    }
}
