package org.indicate.curator.core.data.services.pojo;

/**
 * The closure holds (ancestor, pivot) and (pivot, descendant) but not (ancestor, descendant).
 */
public record TransitivityViolation(long ancestorConceptId, long pivotConceptId, long descendantConceptId) {
}
