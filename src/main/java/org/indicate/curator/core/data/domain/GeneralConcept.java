package org.indicate.curator.core.data.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Dictionary-level concept that vocabulary concepts are mapped to.
 */
public class GeneralConcept {

	private long generalConceptId;
	private String generalConceptName;
	private String category;

	public GeneralConcept() {
	}

	public GeneralConcept(long generalConceptId, String generalConceptName, String category) {
		this.generalConceptId = generalConceptId;
		this.generalConceptName = generalConceptName;
		this.category = category;
	}

	@JsonIgnore
	public boolean isDrug() {
		return Concepts.DRUG_CATEGORY.equals(category);
	}

	public long getGeneralConceptId() {
		return generalConceptId;
	}

	public void setGeneralConceptId(long generalConceptId) {
		this.generalConceptId = generalConceptId;
	}

	public String getGeneralConceptName() {
		return generalConceptName;
	}

	public void setGeneralConceptName(String generalConceptName) {
		this.generalConceptName = generalConceptName;
	}

	public String getCategory() {
		return category;
	}

	public void setCategory(String category) {
		this.category = category;
	}
}
