package org.indicate.curator.core.data.domain;

/**
 * One pair of the precomputed transitive closure of the concept hierarchy.
 * Separation values are nullable because some vocabulary releases leave them empty.
 */
public final class ConceptAncestor {

	public interface Fields {
		String ANCESTOR_CONCEPT_ID = "ancestor_concept_id";
		String DESCENDANT_CONCEPT_ID = "descendant_concept_id";
		String MIN_LEVELS_OF_SEPARATION = "min_levels_of_separation";
		String MAX_LEVELS_OF_SEPARATION = "max_levels_of_separation";
	}

	private final long ancestorConceptId;
	private final long descendantConceptId;
	private final Integer minLevelsOfSeparation;
	private final Integer maxLevelsOfSeparation;

	public ConceptAncestor(long ancestorConceptId, long descendantConceptId, Integer minLevelsOfSeparation, Integer maxLevelsOfSeparation) {
		this.ancestorConceptId = ancestorConceptId;
		this.descendantConceptId = descendantConceptId;
		this.minLevelsOfSeparation = minLevelsOfSeparation;
		this.maxLevelsOfSeparation = maxLevelsOfSeparation;
	}

	public long getAncestorConceptId() {
		return ancestorConceptId;
	}

	public long getDescendantConceptId() {
		return descendantConceptId;
	}

	public Integer getMinLevelsOfSeparation() {
		return minLevelsOfSeparation;
	}

	public Integer getMaxLevelsOfSeparation() {
		return maxLevelsOfSeparation;
	}

	public boolean isSelf() {
		return ancestorConceptId == descendantConceptId;
	}

	@Override
	public String toString() {
		return ancestorConceptId + " > " + descendantConceptId + " (" + minLevelsOfSeparation + ")";
	}
}
