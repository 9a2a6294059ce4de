package org.indicate.curator.core.data.services.pojo;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.indicate.curator.core.data.domain.Concept;

import java.util.Comparator;

/**
 * A concept reached from another concept, with the label of the path that reached it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RelatedConcept {

	public static final Comparator<String> NAME_ORDER = Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER);

	public static final Comparator<RelatedConcept> BY_NAME = Comparator
			.comparing(RelatedConcept::getConceptName, NAME_ORDER)
			.thenComparingLong(RelatedConcept::getConceptId);

	private final long conceptId;
	private final String conceptName;
	private final String vocabularyId;
	private final String conceptCode;
	private final String conceptClassId;
	private final String relationshipId;
	private Boolean recommended;

	public RelatedConcept(Concept concept, String relationshipId) {
		this.conceptId = concept.getConceptId();
		this.conceptName = concept.getConceptName();
		this.vocabularyId = concept.getVocabularyId();
		this.conceptCode = concept.getConceptCode();
		this.conceptClassId = concept.getConceptClassId();
		this.relationshipId = relationshipId;
	}

	public long getConceptId() {
		return conceptId;
	}

	public String getConceptName() {
		return conceptName;
	}

	public String getVocabularyId() {
		return vocabularyId;
	}

	public String getConceptCode() {
		return conceptCode;
	}

	public String getConceptClassId() {
		return conceptClassId;
	}

	public String getRelationshipId() {
		return relationshipId;
	}

	public Boolean getRecommended() {
		return recommended;
	}

	public RelatedConcept setRecommended(Boolean recommended) {
		this.recommended = recommended;
		return this;
	}

	@Override
	public String toString() {
		return relationshipId + " " + conceptId + " |" + conceptName + "|";
	}
}
