package com.williamcallahan.mdcanvas.service.markup;

import com.williamcallahan.mdcanvas.domain.markup.Span;
import com.williamcallahan.mdcanvas.domain.markup.SpanKind;
import com.williamcallahan.mdcanvas.domain.markup.SpanTable;
import java.util.EnumMap;
import java.util.Map;

/**
 * Span counts estimated by the counting pass, one per table.
 */
public final class CapacityPlan {

    private final Map<SpanKind, Integer> counts;

    private CapacityPlan(Map<SpanKind, Integer> counts) {
        this.counts = counts;
    }

    /**
     * Returns a plan with no counted spans, so every table starts at its default capacity.
     */
    public static CapacityPlan none() {
        return new CapacityPlan(new EnumMap<>(SpanKind.class));
    }

    CapacityPlan with(SpanKind kind, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Span count must be non-negative: " + count);
        }
        EnumMap<SpanKind, Integer> updated = new EnumMap<>(SpanKind.class);
        updated.putAll(counts);
        updated.put(kind, count);
        return new CapacityPlan(updated);
    }

    /**
     * Adds the counts of another plan, used when a document is counted segment by segment.
     */
    CapacityPlan plus(CapacityPlan other) {
        EnumMap<SpanKind, Integer> merged = new EnumMap<>(SpanKind.class);
        for (SpanKind kind : SpanKind.values()) {
            merged.put(kind, countOf(kind) + other.countOf(kind));
        }
        return new CapacityPlan(merged);
    }

    public int countOf(SpanKind kind) {
        return counts.getOrDefault(kind, 0);
    }

    /**
     * Allocates an empty table sized for one span kind.
     *
     * @param kind table kind
     * @param maxCapacity hard growth bound
     * @param <T> span type
     * @return presized table
     */
    <T extends Span> SpanTable<T> allocate(SpanKind kind, int maxCapacity) {
        return SpanTable.sizedFor(countOf(kind), kind.defaultCapacity(), maxCapacity);
    }

    @Override
    public String toString() {
        return "CapacityPlan" + counts;
    }
}
