package org.indicate.curator.core.data.services;

import org.indicate.curator.AbstractTest;
import org.indicate.curator.TestVocabulary;
import org.indicate.curator.core.data.domain.Concepts;
import org.indicate.curator.core.data.domain.GeneralConcept;
import org.indicate.curator.core.data.domain.Mapping;
import org.indicate.curator.core.data.services.pojo.EnrichmentResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class MappingEnrichmentServiceTest extends AbstractTest {

	private static final long GENERAL_CONCEPT = 1;

	private static final long SOURCE = 100;
	private static final long SOURCE_CHILD = 101;
	private static final long SOURCE_CHILD_INVALID = 102;
	private static final long SOURCE_MAPS_TO = 103;
	private static final long LOINC_TARGET = 104;
	private static final long ATC_SOURCE = 110;
	private static final long ATC_CHILD = 111;

	private static final long INGREDIENT = 200;
	private static final long COMPONENT = 201;
	private static final long CLINICAL_DRUG = 202;
	private static final long CLINICAL_DRUG_INVALID = 203;

	@Autowired
	private MappingEnrichmentService enrichmentService;

	@Test
	void testNoVocabularyRefused() {
		assertThrows(EnrichmentPreconditionException.class,
				() -> enrichmentService.enrich(List.of(Mapping.manual(GENERAL_CONCEPT, SOURCE, true)), new ArrayList<>(), false));
	}

	@Test
	void testRecommendedMappingPropagated() throws EnrichmentPreconditionException {
		install(vocabulary());
		List<Mapping> table = new ArrayList<>(List.of(
				Mapping.manual(GENERAL_CONCEPT, SOURCE, true),
				Mapping.derived(GENERAL_CONCEPT, 999, null, false)));

		EnrichmentResult result = enrichmentService.enrich(table, new ArrayList<>(), false);

		assertEquals(List.of(
				Mapping.manual(GENERAL_CONCEPT, SOURCE, true),
				Mapping.derived(GENERAL_CONCEPT, SOURCE_CHILD, null, false),
				Mapping.derived(GENERAL_CONCEPT, SOURCE_MAPS_TO, null, false)), result.getMappings());
		assertEquals(2, result.getDerivedCount());
		assertEquals(0, result.getDrugDerivedCount());
		assertEquals(0, result.getSkippedSourceCount());

		// The submitted table is left as it was
		assertEquals(2, table.size());
		assertEquals(Mapping.derived(GENERAL_CONCEPT, 999, null, false), table.get(1));
	}

	@Test
	void testNonRecommendedMappingNotPropagated() throws EnrichmentPreconditionException {
		install(vocabulary());

		EnrichmentResult result = enrichmentService.enrich(List.of(Mapping.manual(GENERAL_CONCEPT, SOURCE, false)), new ArrayList<>(), false);

		assertEquals(1, result.getMappings().size());
		assertEquals(0, result.getDerivedCount());
	}

	@Test
	void testSourceOutsideEnrichmentVocabulariesSkipped() throws EnrichmentPreconditionException {
		install(vocabulary());

		EnrichmentResult result = enrichmentService.enrich(List.of(
				Mapping.manual(GENERAL_CONCEPT, ATC_SOURCE, true),
				Mapping.manual(GENERAL_CONCEPT, 555, true)), new ArrayList<>(), false);

		assertEquals(2, result.getMappings().size());
		assertEquals(0, result.getDerivedCount());
		assertEquals(2, result.getSkippedSourceCount());
	}

	@Test
	void testRepeatedEnrichmentIsStable() throws EnrichmentPreconditionException {
		install(vocabulary());
		EnrichmentResult first = enrichmentService.enrich(List.of(Mapping.manual(GENERAL_CONCEPT, SOURCE, true)), new ArrayList<>(), true);

		// A curator recommends one of the derived rows
		List<Mapping> reviewed = first.getMappings().stream()
				.map(mapping -> new Mapping(mapping.getGeneralConceptId(), mapping.getConceptId(), mapping.getUnitConceptId(),
						mapping.isRecommended() || mapping.getConceptId() == SOURCE_CHILD, mapping.getSource()))
				.collect(Collectors.toList());

		EnrichmentResult second = enrichmentService.enrich(reviewed, new ArrayList<>(), true);
		EnrichmentResult third = enrichmentService.enrich(second.getMappings(), new ArrayList<>(), true);

		assertEquals(reviewed, second.getMappings());
		assertEquals(second.getMappings(), third.getMappings());
		assertTrue(third.getMappings().contains(Mapping.derived(GENERAL_CONCEPT, SOURCE_CHILD, null, true)));

		// Without preserving, the recommendation of a derived row is reset
		EnrichmentResult reset = enrichmentService.enrich(second.getMappings(), new ArrayList<>(), false);
		assertTrue(reset.getMappings().contains(Mapping.derived(GENERAL_CONCEPT, SOURCE_CHILD, null, false)));
	}

	@Test
	void testDrugMappingsDerivedFromIngredientName() throws EnrichmentPreconditionException {
		install(vocabulary());
		List<GeneralConcept> generalConcepts = List.of(
				new GeneralConcept(GENERAL_CONCEPT, " ASPIRIN ", Concepts.DRUG_CATEGORY),
				new GeneralConcept(2, "Aspirin", "Condition"));

		EnrichmentResult result = enrichmentService.enrich(new ArrayList<>(), generalConcepts, false);

		assertEquals(List.of(Mapping.derived(GENERAL_CONCEPT, CLINICAL_DRUG, null, true)), result.getMappings());
		assertEquals(0, result.getDerivedCount());
		assertEquals(1, result.getDrugDerivedCount());
	}

	@Test
	void testDrugPassWinsOverPropagatedRow() throws EnrichmentPreconditionException {
		install(vocabulary());

		EnrichmentResult result = enrichmentService.enrich(List.of(Mapping.manual(GENERAL_CONCEPT, INGREDIENT, true)),
				List.of(new GeneralConcept(GENERAL_CONCEPT, "aspirin", Concepts.DRUG_CATEGORY)), false);

		assertThat(result.getMappings()).containsExactly(
				Mapping.manual(GENERAL_CONCEPT, INGREDIENT, true),
				Mapping.derived(GENERAL_CONCEPT, CLINICAL_DRUG, null, true));
		assertEquals(0, result.getDerivedCount());
		assertEquals(1, result.getDrugDerivedCount());
	}

	private TestVocabulary vocabulary() {
		return new TestVocabulary()
				.concept(SOURCE, "Source", "Condition", Concepts.SNOMED, "Clinical Finding", "S", null)
				.concept(SOURCE_CHILD, "Source child", "Condition", Concepts.SNOMED, "Clinical Finding", "S", null)
				.concept(SOURCE_CHILD_INVALID, "Source child invalid", "Condition", Concepts.SNOMED, "Clinical Finding", null, "D")
				.concept(SOURCE_MAPS_TO, "Source equivalent", "Condition", Concepts.SNOMED, "Clinical Finding", "S", null)
				.concept(LOINC_TARGET, "Lab test", "Measurement", Concepts.LOINC, "Lab Test", "S", null)
				.concept(ATC_SOURCE, "Analgesics", "Drug", "ATC", "ATC 3rd", "C", null)
				.concept(ATC_CHILD, "Anilides", "Drug", "ATC", "ATC 4th", "C", null)
				.isA(SOURCE_CHILD, SOURCE)
				.isA(SOURCE_CHILD_INVALID, SOURCE)
				.isA(ATC_CHILD, ATC_SOURCE)
				.relationship(SOURCE, SOURCE_MAPS_TO, Concepts.MAPS_TO)
				.relationship(SOURCE, LOINC_TARGET, Concepts.MAPS_TO)

				.concept(INGREDIENT, "Aspirin", "Drug", Concepts.RXNORM, Concepts.INGREDIENT, "S", null)
				.concept(COMPONENT, "aspirin 81 MG", "Drug", Concepts.RXNORM, Concepts.CLINICAL_DRUG_COMP, "S", null)
				.concept(CLINICAL_DRUG, "aspirin 81 MG Oral Tablet", "Drug", Concepts.RXNORM, Concepts.CLINICAL_DRUG, "S", null)
				.concept(CLINICAL_DRUG_INVALID, "aspirin 81 MG Chewable Tablet", "Drug", Concepts.RXNORM, Concepts.CLINICAL_DRUG, null, "U")
				.relationship(COMPONENT, INGREDIENT, Concepts.RXNORM_HAS_INGREDIENT)
				.relationship(COMPONENT, CLINICAL_DRUG, Concepts.CONSTITUTES)
				.relationship(COMPONENT, CLINICAL_DRUG_INVALID, Concepts.CONSTITUTES)
				.hierarchyOnly(COMPONENT, INGREDIENT)
				.hierarchyOnly(CLINICAL_DRUG, COMPONENT)
				.hierarchyOnly(CLINICAL_DRUG_INVALID, COMPONENT);
	}
}
