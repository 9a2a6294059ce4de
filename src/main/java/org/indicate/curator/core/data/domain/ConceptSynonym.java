package org.indicate.curator.core.data.domain;

public final class ConceptSynonym {

	public interface Fields {
		String CONCEPT_ID = "concept_id";
		String CONCEPT_SYNONYM_NAME = "concept_synonym_name";
		String LANGUAGE_CONCEPT_ID = "language_concept_id";
	}

	private final long conceptId;
	private final String conceptSynonymName;
	private final Long languageConceptId;

	public ConceptSynonym(long conceptId, String conceptSynonymName, Long languageConceptId) {
		this.conceptId = conceptId;
		this.conceptSynonymName = conceptSynonymName;
		this.languageConceptId = languageConceptId;
	}

	public long getConceptId() {
		return conceptId;
	}

	public String getConceptSynonymName() {
		return conceptSynonymName;
	}

	public Long getLanguageConceptId() {
		return languageConceptId;
	}
}
