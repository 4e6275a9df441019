package org.dxworks.exgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Dot-segmented module identifier, e.g. {@code MyApp.Accounts.User}.
 * <p>
 * {@link #UNKNOWN} stands for a reference that could not be resolved statically.
 * It has no segments and never takes part in alias expansion. In JSON it is written as
 * {@code null}, so a real module named {@code unknown} stays distinct from it.
 */
public final class QualifiedName implements Comparable<QualifiedName> {

    public static final String UNKNOWN_LABEL = "unknown";

    public static final QualifiedName UNKNOWN = new QualifiedName(Collections.emptyList());

    private final List<String> segments;

    private QualifiedName(List<String> segments) {
        this.segments = segments;
    }

    public static QualifiedName of(String... segments) {
        return of(Arrays.asList(segments));
    }

    public static QualifiedName of(List<String> segments) {
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("A qualified name needs at least one segment");
        }
        for (String segment : segments) {
            if (segment == null || segment.isEmpty()) {
                throw new IllegalArgumentException("Empty segment in qualified name: " + segments);
            }
        }
        return new QualifiedName(List.copyOf(segments));
    }

    @JsonCreator
    public static QualifiedName parse(String dotted) {
        if (dotted == null || dotted.isEmpty()) {
            return UNKNOWN;
        }
        return of(dotted.split("\\."));
    }

    public List<String> getSegments() {
        return segments;
    }

    public boolean isUnknown() {
        return segments.isEmpty();
    }

    public boolean isKnown() {
        return !segments.isEmpty();
    }

    public String firstSegment() {
        return isUnknown() ? null : segments.get(0);
    }

    public String lastSegment() {
        return isUnknown() ? null : segments.get(segments.size() - 1);
    }

    /**
     * Appends the given segments. Appending to {@link #UNKNOWN} stays unknown.
     */
    public QualifiedName append(List<String> more) {
        if (isUnknown()) return UNKNOWN;
        if (more.isEmpty()) return this;
        List<String> joined = new ArrayList<>(segments.size() + more.size());
        joined.addAll(segments);
        joined.addAll(more);
        return of(joined);
    }

    public QualifiedName append(QualifiedName other) {
        if (other.isUnknown()) return UNKNOWN;
        return append(other.segments);
    }

    @Override
    public int compareTo(QualifiedName other) {
        if (isUnknown() || other.isUnknown()) {
            // unknown sorts after every known name
            return Boolean.compare(isUnknown(), other.isUnknown());
        }
        int shared = Math.min(segments.size(), other.segments.size());
        for (int i = 0; i < shared; i++) {
            int cmp = segments.get(i).compareTo(other.segments.get(i));
            if (cmp != 0) return cmp;
        }
        return Integer.compare(segments.size(), other.segments.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QualifiedName)) return false;
        return segments.equals(((QualifiedName) o).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @JsonValue
    public String toJson() {
        return isUnknown() ? null : String.join(".", segments);
    }

    @Override
    public String toString() {
        return isUnknown() ? UNKNOWN_LABEL : String.join(".", segments);
    }
}
