package org.indicate.curator.core.data.domain;

import com.google.common.collect.ImmutableSet;

import java.util.Set;

public class Concepts {

	// Vocabularies
	public static final String RXNORM = "RxNorm";
	public static final String RXNORM_EXTENSION = "RxNorm Extension";
	public static final String LOINC = "LOINC";
	public static final String SNOMED = "SNOMED";
	public static final String ICD10 = "ICD10";

	public static final Set<String> RXNORM_VOCABULARIES = ImmutableSet.of(RXNORM, RXNORM_EXTENSION);

	// Domains
	public static final String DRUG_DOMAIN = "Drug";

	// Concept classes
	public static final String INGREDIENT = "Ingredient";
	public static final String CLINICAL_DRUG = "Clinical Drug";
	public static final String CLINICAL_DRUG_COMP = "Clinical Drug Comp";

	// Relationships
	public static final String MAPS_TO = "Maps to";
	public static final String MAPPED_FROM = "Mapped from";
	public static final String RXNORM_HAS_INGREDIENT = "RxNorm has ing";
	public static final String CONSTITUTES = "Constitutes";

	public static final Set<String> MAPPING_RELATIONSHIPS = ImmutableSet.of(MAPS_TO, MAPPED_FROM);

	// Labels given to rows derived from the closure rather than a relationship
	public static final String IS_A_LABEL = "Is a";
	public static final String ANCESTOR_LABEL = "Ancestor";
	public static final String DESCENDANT_LABEL = "Descendant";

	// General concept categories
	public static final String DRUG_CATEGORY = "Drug";

	private Concepts() {
	}
}
