package org.indicate.curator.core.data.domain;

import java.util.Objects;

/**
 * One line of a curated concept set.
 */
public class ConceptSetItem {

	private long conceptId;
	private String conceptName;
	private boolean excluded;
	private boolean includeDescendants;
	private boolean includeMapped;

	public ConceptSetItem() {
	}

	public ConceptSetItem(long conceptId) {
		this.conceptId = conceptId;
	}

	public ConceptSetItem(long conceptId, boolean excluded, boolean includeDescendants, boolean includeMapped) {
		this.conceptId = conceptId;
		this.excluded = excluded;
		this.includeDescendants = includeDescendants;
		this.includeMapped = includeMapped;
	}

	public static ConceptSetItem ancestorReplacement(Concept ancestor) {
		return new ConceptSetItem(ancestor.getConceptId(), false, true, false)
				.setConceptName(ancestor.getConceptName());
	}

	public ConceptSetItem copy() {
		return new ConceptSetItem(conceptId, excluded, includeDescendants, includeMapped).setConceptName(conceptName);
	}

	public long getConceptId() {
		return conceptId;
	}

	public ConceptSetItem setConceptId(long conceptId) {
		this.conceptId = conceptId;
		return this;
	}

	public String getConceptName() {
		return conceptName;
	}

	public ConceptSetItem setConceptName(String conceptName) {
		this.conceptName = conceptName;
		return this;
	}

	public boolean isExcluded() {
		return excluded;
	}

	public ConceptSetItem setExcluded(boolean excluded) {
		this.excluded = excluded;
		return this;
	}

	public boolean isIncludeDescendants() {
		return includeDescendants;
	}

	public ConceptSetItem setIncludeDescendants(boolean includeDescendants) {
		this.includeDescendants = includeDescendants;
		return this;
	}

	public boolean isIncludeMapped() {
		return includeMapped;
	}

	public ConceptSetItem setIncludeMapped(boolean includeMapped) {
		this.includeMapped = includeMapped;
		return this;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ConceptSetItem that = (ConceptSetItem) o;
		return conceptId == that.conceptId
				&& excluded == that.excluded
				&& includeDescendants == that.includeDescendants
				&& includeMapped == that.includeMapped;
	}

	@Override
	public int hashCode() {
		return Objects.hash(conceptId, excluded, includeDescendants, includeMapped);
	}

	@Override
	public String toString() {
		return "ConceptSetItem{" +
				"conceptId=" + conceptId +
				", excluded=" + excluded +
				", includeDescendants=" + includeDescendants +
				", includeMapped=" + includeMapped +
				'}';
	}
}
