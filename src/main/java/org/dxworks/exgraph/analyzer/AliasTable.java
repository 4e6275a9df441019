package org.dxworks.exgraph.analyzer;

import org.dxworks.exgraph.model.QualifiedName;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Short name to qualified name mappings in effect while walking one module body.
 * <p>
 * A table is owned by exactly one module traversal and mutated in place as alias
 * directives are met.
 */
public class AliasTable {

    private final Map<String, QualifiedName> entries = new LinkedHashMap<>();

    public static AliasTable empty() {
        return new AliasTable();
    }

    /**
     * @return the qualified name bound to {@code shortName}, or {@code null} when unbound
     */
    public QualifiedName lookup(String shortName) {
        return entries.get(shortName);
    }

    public boolean contains(String shortName) {
        return entries.containsKey(shortName);
    }

    /**
     * Binds {@code shortName}; a later binding for the same name shadows the earlier one.
     * Unknown targets are never bound.
     */
    public void put(String shortName, QualifiedName target) {
        if (shortName == null || shortName.isEmpty() || target == null || target.isUnknown()) return;
        entries.put(shortName, target);
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
