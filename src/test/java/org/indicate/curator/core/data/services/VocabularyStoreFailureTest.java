package org.indicate.curator.core.data.services;

import org.indicate.curator.AbstractTest;
import org.indicate.curator.TestVocabularyDatabase;
import org.indicate.curator.core.data.domain.ConceptSetItem;
import org.indicate.curator.core.data.domain.Mapping;
import org.indicate.curator.core.data.services.pojo.OptimizationResult;
import org.indicate.curator.core.data.services.pojo.OptimizationResult.Status;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tables dropped after the vocabulary database was opened make every read fail.
 */
class VocabularyStoreFailureTest extends AbstractTest {

	@Autowired
	private ConceptGraphQueryService conceptGraphQueryService;

	@Autowired
	private HierarchyGraphService hierarchyGraphService;

	@Autowired
	private ConceptSetOptimizationService optimizationService;

	@Autowired
	private ClosureIntegrityService integrityService;

	@Autowired
	private MappingEnrichmentService enrichmentService;

	private TestVocabularyDatabase database;

	@BeforeEach
	void openDatabase() {
		database = new TestVocabularyDatabase();
		assertTrue(vocabularyService.openDatabase(database.getJdbcUrl()).isSuccess());
		assertEquals(1, conceptGraphQueryService.relatedConcepts(1, false).size());
	}

	@Test
	void testQueriesReturnNothing() {
		database.dropTable("concept_relationship");
		database.dropTable("concept_ancestor");

		assertTrue(conceptGraphQueryService.relatedConcepts(1, false).isEmpty());
		assertTrue(conceptGraphQueryService.descendantConcepts(2).isEmpty());
		assertTrue(conceptGraphQueryService.hierarchyNeighbors(1).isEmpty());
		assertTrue(conceptGraphQueryService.allRelatedForRecommendation(1, List.of()).isEmpty());
		assertTrue(hierarchyGraphService.buildGraph(1).getNodes().isEmpty());
		assertTrue(integrityService.findTransitivityViolations(List.of(1L)).isEmpty());

		// The concept table is still readable
		assertTrue(conceptGraphQueryService.findConcept(1).isPresent());
	}

	@Test
	void testConceptLookupReturnsNothing() {
		database.dropTable("concept");

		assertFalse(conceptGraphQueryService.findConcept(1).isPresent());
		assertTrue(conceptGraphQueryService.synonyms(1).isEmpty());
		assertTrue(conceptGraphQueryService.clinicalDrugsForIngredient(1).isEmpty());
	}

	@Test
	void testOptimizerReportsUnavailable() {
		database.dropTable("concept_ancestor");
		List<ConceptSetItem> items = List.of(new ConceptSetItem(1), new ConceptSetItem(2));

		OptimizationResult result = optimizationService.optimize(items);

		assertEquals(Status.UNAVAILABLE, result.getStatus());
		assertEquals(items, result.getOptimizedItems());
	}

	@Test
	void testEnrichmentFails() {
		database.dropTable("concept");
		List<Mapping> mappings = new ArrayList<>(List.of(new Mapping(100, 1, null, true, Mapping.Source.MANUAL)));

		assertThrows(EnrichmentPreconditionException.class, () -> enrichmentService.enrich(mappings, List.of(), false));
	}
}
