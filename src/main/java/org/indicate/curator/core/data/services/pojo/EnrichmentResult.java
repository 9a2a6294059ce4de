package org.indicate.curator.core.data.services.pojo;

import org.indicate.curator.core.data.domain.Mapping;

import java.util.List;

/**
 * The complete regenerated mapping table: manual rows followed by the derived rows of this run.
 */
public class EnrichmentResult {

	private final List<Mapping> mappings;
	private final int derivedCount;
	private final int drugDerivedCount;
	private final int skippedSourceCount;

	public EnrichmentResult(List<Mapping> mappings, int derivedCount, int drugDerivedCount, int skippedSourceCount) {
		this.mappings = mappings;
		this.derivedCount = derivedCount;
		this.drugDerivedCount = drugDerivedCount;
		this.skippedSourceCount = skippedSourceCount;
	}

	public List<Mapping> getMappings() {
		return mappings;
	}

	/**
	 * Derived rows propagated from recommended manual mappings.
	 */
	public int getDerivedCount() {
		return derivedCount;
	}

	/**
	 * Derived rows found through the drug ingredient pass.
	 */
	public int getDrugDerivedCount() {
		return drugDerivedCount;
	}

	/**
	 * Recommended manual mappings whose source concept is unknown or outside the enrichment vocabularies.
	 */
	public int getSkippedSourceCount() {
		return skippedSourceCount;
	}
}
