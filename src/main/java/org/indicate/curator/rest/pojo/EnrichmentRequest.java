package org.indicate.curator.rest.pojo;

import org.indicate.curator.core.data.domain.GeneralConcept;
import org.indicate.curator.core.data.domain.Mapping;

import java.util.ArrayList;
import java.util.List;

public class EnrichmentRequest {

	private List<Mapping> mappings = new ArrayList<>();
	private List<GeneralConcept> generalConcepts = new ArrayList<>();
	private boolean preserveRecommended;

	public List<Mapping> getMappings() {
		return mappings;
	}

	public void setMappings(List<Mapping> mappings) {
		this.mappings = mappings;
	}

	public List<GeneralConcept> getGeneralConcepts() {
		return generalConcepts;
	}

	public void setGeneralConcepts(List<GeneralConcept> generalConcepts) {
		this.generalConcepts = generalConcepts;
	}

	public boolean isPreserveRecommended() {
		return preserveRecommended;
	}

	public void setPreserveRecommended(boolean preserveRecommended) {
		this.preserveRecommended = preserveRecommended;
	}
}
