package org.indicate.curator.core.data.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Link from a general (dictionary) concept to a vocabulary concept.
 */
public class Mapping {

	public enum Source {
		MANUAL("manual"),
		DERIVED("derived");

		private final String value;

		Source(String value) {
			this.value = value;
		}

		@JsonValue
		public String getValue() {
			return value;
		}
	}

	private long generalConceptId;
	private long conceptId;
	private Long unitConceptId;
	private boolean recommended;
	private Source source = Source.MANUAL;

	public Mapping() {
	}

	public Mapping(long generalConceptId, long conceptId, Long unitConceptId, boolean recommended, Source source) {
		this.generalConceptId = generalConceptId;
		this.conceptId = conceptId;
		this.unitConceptId = unitConceptId;
		this.recommended = recommended;
		this.source = source;
	}

	public static Mapping manual(long generalConceptId, long conceptId, boolean recommended) {
		return new Mapping(generalConceptId, conceptId, null, recommended, Source.MANUAL);
	}

	public static Mapping derived(long generalConceptId, long conceptId, Long unitConceptId, boolean recommended) {
		return new Mapping(generalConceptId, conceptId, unitConceptId, recommended, Source.DERIVED);
	}

	@JsonIgnore
	public MappingKey getKey() {
		return new MappingKey(generalConceptId, conceptId);
	}

	@JsonIgnore
	public boolean isDerived() {
		return source == Source.DERIVED;
	}

	public long getGeneralConceptId() {
		return generalConceptId;
	}

	public Mapping setGeneralConceptId(long generalConceptId) {
		this.generalConceptId = generalConceptId;
		return this;
	}

	public long getConceptId() {
		return conceptId;
	}

	public Mapping setConceptId(long conceptId) {
		this.conceptId = conceptId;
		return this;
	}

	public Long getUnitConceptId() {
		return unitConceptId;
	}

	public Mapping setUnitConceptId(Long unitConceptId) {
		this.unitConceptId = unitConceptId;
		return this;
	}

	public boolean isRecommended() {
		return recommended;
	}

	public Mapping setRecommended(boolean recommended) {
		this.recommended = recommended;
		return this;
	}

	public Source getSource() {
		return source;
	}

	public Mapping setSource(Source source) {
		this.source = source;
		return this;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Mapping mapping = (Mapping) o;
		return generalConceptId == mapping.generalConceptId
				&& conceptId == mapping.conceptId
				&& recommended == mapping.recommended
				&& Objects.equals(unitConceptId, mapping.unitConceptId)
				&& source == mapping.source;
	}

	@Override
	public int hashCode() {
		return Objects.hash(generalConceptId, conceptId, unitConceptId, recommended, source);
	}

	@Override
	public String toString() {
		return "Mapping{" +
				"generalConceptId=" + generalConceptId +
				", conceptId=" + conceptId +
				", unitConceptId=" + unitConceptId +
				", recommended=" + recommended +
				", source=" + source +
				'}';
	}

	public record MappingKey(long generalConceptId, long conceptId) {
	}
}
