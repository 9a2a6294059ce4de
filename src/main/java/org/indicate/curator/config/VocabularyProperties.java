package org.indicate.curator.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Bound from the vocabulary.* properties.
 */
public class VocabularyProperties {

	// Folder of Athena tab-delimited files, loaded at startup when set
	private String folder;

	// Database holding the vocabulary tables, used at startup when set and no folder is given
	private String jdbcUrl;

	private int loadThreads = 5;

	// Hierarchical relationships that point from the child concept to the parent concept
	private List<String> childToParentRelationships = new ArrayList<>(List.of(
			"Is a", "Consists of", "Tradename of", "Quantified form of", "Marketed form of", "Box of", "RxNorm has ing", "RxNorm - ATC"));

	// Vocabularies whose recommended mappings are propagated by mapping enrichment
	private List<String> enrichmentVocabularies = new ArrayList<>(List.of("RxNorm", "RxNorm Extension", "LOINC", "SNOMED", "ICD10"));

	public String getFolder() {
		return folder;
	}

	public void setFolder(String folder) {
		this.folder = folder;
	}

	public String getJdbcUrl() {
		return jdbcUrl;
	}

	public void setJdbcUrl(String jdbcUrl) {
		this.jdbcUrl = jdbcUrl;
	}

	public int getLoadThreads() {
		return loadThreads;
	}

	public void setLoadThreads(int loadThreads) {
		this.loadThreads = loadThreads;
	}

	public List<String> getChildToParentRelationships() {
		return childToParentRelationships;
	}

	public void setChildToParentRelationships(List<String> childToParentRelationships) {
		this.childToParentRelationships = childToParentRelationships;
	}

	public List<String> getEnrichmentVocabularies() {
		return enrichmentVocabularies;
	}

	public void setEnrichmentVocabularies(List<String> enrichmentVocabularies) {
		this.enrichmentVocabularies = enrichmentVocabularies;
	}
}
