package org.indicate.curator.core.data.domain;

import org.apache.commons.lang3.StringUtils;

import java.time.LocalDate;

public final class ConceptRelationship {

	public interface Fields {
		String CONCEPT_ID_1 = "concept_id_1";
		String CONCEPT_ID_2 = "concept_id_2";
		String RELATIONSHIP_ID = "relationship_id";
		String VALID_START_DATE = "valid_start_date";
		String VALID_END_DATE = "valid_end_date";
		String INVALID_REASON = "invalid_reason";
	}

	private final long conceptId1;
	private final long conceptId2;
	private final String relationshipId;
	private final LocalDate validStartDate;
	private final LocalDate validEndDate;
	private final String invalidReason;

	public ConceptRelationship(long conceptId1, long conceptId2, String relationshipId) {
		this(conceptId1, conceptId2, relationshipId, null, null, null);
	}

	public ConceptRelationship(long conceptId1, long conceptId2, String relationshipId,
			LocalDate validStartDate, LocalDate validEndDate, String invalidReason) {
		this.conceptId1 = conceptId1;
		this.conceptId2 = conceptId2;
		this.relationshipId = relationshipId;
		this.validStartDate = validStartDate;
		this.validEndDate = validEndDate;
		this.invalidReason = StringUtils.trimToNull(invalidReason);
	}

	public long getConceptId1() {
		return conceptId1;
	}

	public long getConceptId2() {
		return conceptId2;
	}

	public String getRelationshipId() {
		return relationshipId;
	}

	public LocalDate getValidStartDate() {
		return validStartDate;
	}

	public LocalDate getValidEndDate() {
		return validEndDate;
	}

	public String getInvalidReason() {
		return invalidReason;
	}

	@Override
	public String toString() {
		return conceptId1 + " -[" + relationshipId + "]-> " + conceptId2;
	}
}
