package org.indicate.curator.core.data.domain;

/**
 * Metadata row of the RELATIONSHIP table describing one relationship kind.
 */
public final class RelationshipType {

	public interface Fields {
		String RELATIONSHIP_ID = "relationship_id";
		String RELATIONSHIP_NAME = "relationship_name";
		String IS_HIERARCHICAL = "is_hierarchical";
		String DEFINES_ANCESTRY = "defines_ancestry";
		String REVERSE_RELATIONSHIP_ID = "reverse_relationship_id";
		String RELATIONSHIP_CONCEPT_ID = "relationship_concept_id";
	}

	private final String relationshipId;
	private final String relationshipName;
	private final boolean hierarchical;
	private final boolean definesAncestry;
	private final String reverseRelationshipId;
	private final Long relationshipConceptId;

	public RelationshipType(String relationshipId, String relationshipName, boolean hierarchical, boolean definesAncestry,
			String reverseRelationshipId, Long relationshipConceptId) {
		this.relationshipId = relationshipId;
		this.relationshipName = relationshipName;
		this.hierarchical = hierarchical;
		this.definesAncestry = definesAncestry;
		this.reverseRelationshipId = reverseRelationshipId;
		this.relationshipConceptId = relationshipConceptId;
	}

	public String getRelationshipId() {
		return relationshipId;
	}

	public String getRelationshipName() {
		return relationshipName;
	}

	public boolean isHierarchical() {
		return hierarchical;
	}

	public boolean isDefinesAncestry() {
		return definesAncestry;
	}

	public String getReverseRelationshipId() {
		return reverseRelationshipId;
	}

	public Long getRelationshipConceptId() {
		return relationshipConceptId;
	}

	@Override
	public String toString() {
		return relationshipId + " / " + reverseRelationshipId;
	}
}
