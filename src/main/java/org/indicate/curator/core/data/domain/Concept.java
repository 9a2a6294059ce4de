package org.indicate.curator.core.data.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A coded clinical term from the CONCEPT table.
 */
public final class Concept {

	public interface Fields {
		String CONCEPT_ID = "concept_id";
		String CONCEPT_NAME = "concept_name";
		String DOMAIN_ID = "domain_id";
		String VOCABULARY_ID = "vocabulary_id";
		String CONCEPT_CLASS_ID = "concept_class_id";
		String STANDARD_CONCEPT = "standard_concept";
		String CONCEPT_CODE = "concept_code";
		String VALID_START_DATE = "valid_start_date";
		String VALID_END_DATE = "valid_end_date";
		String INVALID_REASON = "invalid_reason";
	}

	private final long conceptId;
	private final String conceptName;
	private final String domainId;
	private final String vocabularyId;
	private final String conceptClassId;
	private final String standardConcept;
	private final String conceptCode;
	private final LocalDate validStartDate;
	private final LocalDate validEndDate;
	private final String invalidReason;

	public Concept(long conceptId, String conceptName, String domainId, String vocabularyId, String conceptClassId,
			String standardConcept, String conceptCode, LocalDate validStartDate, LocalDate validEndDate, String invalidReason) {
		this.conceptId = conceptId;
		this.conceptName = conceptName;
		this.domainId = domainId;
		this.vocabularyId = vocabularyId;
		this.conceptClassId = conceptClassId;
		this.standardConcept = StringUtils.trimToNull(standardConcept);
		this.conceptCode = conceptCode;
		this.validStartDate = validStartDate;
		this.validEndDate = validEndDate;
		this.invalidReason = StringUtils.trimToNull(invalidReason);
	}

	public long getConceptId() {
		return conceptId;
	}

	public String getConceptName() {
		return conceptName;
	}

	public String getDomainId() {
		return domainId;
	}

	public String getVocabularyId() {
		return vocabularyId;
	}

	public String getConceptClassId() {
		return conceptClassId;
	}

	@JsonIgnore
	public String getStandardConcept() {
		return standardConcept;
	}

	public StandardFlag getStandardFlag() {
		return StandardFlag.fromCode(standardConcept);
	}

	public String getConceptCode() {
		return conceptCode;
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

	public boolean isValid() {
		return invalidReason == null;
	}

	@JsonIgnore
	public boolean isStandardAndValid() {
		return getStandardFlag() == StandardFlag.STANDARD && isValid();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Concept concept = (Concept) o;
		return conceptId == concept.conceptId;
	}

	@Override
	public int hashCode() {
		return Objects.hash(conceptId);
	}

	@Override
	public String toString() {
		return conceptId + " |" + conceptName + "|";
	}
}
