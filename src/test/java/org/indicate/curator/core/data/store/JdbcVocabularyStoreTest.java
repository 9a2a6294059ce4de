package org.indicate.curator.core.data.store;

import org.indicate.curator.core.data.domain.Concept;
import org.indicate.curator.core.data.domain.ConceptAncestor;
import org.indicate.curator.core.data.domain.ConceptRelationship;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class JdbcVocabularyStoreTest {

	private static final AtomicInteger databaseCounter = new AtomicInteger();

	private JdbcVocabularyStore store;
	private String jdbcUrl;
	private JdbcTemplate jdbcTemplate;

	@BeforeEach
	void setup() {
		store = new JdbcVocabularyStore();
		jdbcUrl = "jdbc:h2:mem:vocabulary" + databaseCounter.incrementAndGet() + ";DB_CLOSE_DELAY=-1";
		jdbcTemplate = new JdbcTemplate(new DriverManagerDataSource(jdbcUrl));
		jdbcTemplate.execute("CREATE TABLE concept (concept_id BIGINT, concept_name VARCHAR(255), domain_id VARCHAR(20), " +
				"vocabulary_id VARCHAR(20), concept_class_id VARCHAR(20), standard_concept VARCHAR(1), concept_code VARCHAR(50), " +
				"valid_start_date DATE, valid_end_date DATE, invalid_reason VARCHAR(1))");
	}

	@Test
	void testOpenDatabase() throws VocabularyLoadException {
		createRequiredTables();

		VocabularySnapshot snapshot = store.open(jdbcUrl);

		List<Concept> concepts = snapshot.concepts().where(Concept.Fields.CONCEPT_ID, 1112807L).execute();
		assertEquals(1, concepts.size());
		Concept aspirin = concepts.get(0);
		assertEquals("Aspirin", aspirin.getConceptName());
		assertEquals(LocalDate.of(1970, 1, 1), aspirin.getValidStartDate());
		assertTrue(aspirin.isStandardAndValid());

		assertEquals(1, snapshot.concepts()
				.where(Concept.Fields.CONCEPT_CLASS_ID, "Ingredient")
				.whereIn(Concept.Fields.VOCABULARY_ID, List.of("RxNorm", "RxNorm Extension"))
				.whereIgnoreCase(Concept.Fields.CONCEPT_NAME, "aspirin")
				.execute().size());

		assertEquals(Set.of(19059056L), snapshot.conceptRelationships()
				.where(ConceptRelationship.Fields.CONCEPT_ID_2, 1112807L)
				.where(ConceptRelationship.Fields.RELATIONSHIP_ID, "RxNorm has ing")
				.selectDistinct(ConceptRelationship.Fields.CONCEPT_ID_1, Long.class));

		List<ConceptAncestor> closure = snapshot.conceptAncestors()
				.where(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, 1112807L)
				.execute();
		assertEquals(2, closure.size());

		assertEquals(1, snapshot.concepts().whereNull(Concept.Fields.INVALID_REASON).whereIn(Concept.Fields.CONCEPT_ID, List.of(1112807L, 3L)).execute().size());
		assertTrue(snapshot.concepts().whereIn(Concept.Fields.CONCEPT_ID, List.of()).execute().isEmpty());

		// Optional tables not in the database read as empty
		assertTrue(snapshot.conceptSynonyms().execute().isEmpty());
		assertTrue(snapshot.relationshipTypes().execute().isEmpty());

		Map<String, Long> rowCounts = snapshot.getRowCounts();
		assertEquals(3L, rowCounts.get("concept"));
		assertEquals(3L, rowCounts.get("concept_ancestor"));
		assertEquals(0L, rowCounts.get("relationship"));
	}

	@Test
	void testLargeInListSplitAcrossStatements() throws VocabularyLoadException {
		createRequiredTables();
		VocabularySnapshot snapshot = store.open(jdbcUrl);

		List<Long> ids = new ArrayList<>();
		for (long id = 100_000; ids.size() < JdbcTableQuery.MAX_IN_VALUES * 2 + 10; id++) {
			ids.add(id);
		}
		ids.add(1112807L);
		ids.add(19059056L);

		List<Concept> concepts = snapshot.concepts().whereIn(Concept.Fields.CONCEPT_ID, ids).execute();

		assertThat(concepts).extracting(Concept::getConceptId).containsExactlyInAnyOrder(1112807L, 19059056L);
	}

	@Test
	void testEveryLargeInListSplit() throws VocabularyLoadException {
		createRequiredTables();
		VocabularySnapshot snapshot = store.open(jdbcUrl);

		List<Long> sourceIds = idsFrom(200_000, JdbcTableQuery.MAX_IN_VALUES + 500);
		sourceIds.add(19059056L);
		List<Long> targetIds = idsFrom(300_000, JdbcTableQuery.MAX_IN_VALUES + 200);
		targetIds.add(1112807L);

		List<ConceptRelationship> relationships = snapshot.conceptRelationships()
				.whereIn(ConceptRelationship.Fields.CONCEPT_ID_1, sourceIds)
				.whereIn(ConceptRelationship.Fields.CONCEPT_ID_2, targetIds)
				.execute();

		assertEquals(1, relationships.size());
		assertEquals("RxNorm has ing", relationships.get(0).getRelationshipId());
	}

	@Test
	void testSplitBatchesCoverEveryCombination() {
		JdbcTableQuery<ConceptRelationship> query = new JdbcTableQuery<>(VocabularyTable.CONCEPT_RELATIONSHIP, null);
		query.whereIn(ConceptRelationship.Fields.CONCEPT_ID_1, idsFrom(1, JdbcTableQuery.MAX_IN_VALUES * 2 + 1))
				.where(ConceptRelationship.Fields.RELATIONSHIP_ID, "Is a")
				.whereIn(ConceptRelationship.Fields.CONCEPT_ID_2, idsFrom(10_000, JdbcTableQuery.MAX_IN_VALUES + 1));

		List<List<AbstractTableQuery.Filter>> batches = query.splitLargeInFilters();

		assertEquals(6, batches.size());
		Set<Object> sources = new HashSet<>();
		for (List<AbstractTableQuery.Filter> batch : batches) {
			assertEquals(3, batch.size());
			assertThat(batch.get(0).values().size()).isLessThanOrEqualTo(JdbcTableQuery.MAX_IN_VALUES);
			assertThat(batch.get(2).values().size()).isLessThanOrEqualTo(JdbcTableQuery.MAX_IN_VALUES);
			sources.addAll(batch.get(0).values());
		}
		assertEquals(JdbcTableQuery.MAX_IN_VALUES * 2 + 1, sources.size());
	}

	@Test
	void testCountByRunsInDatabase() throws VocabularyLoadException {
		createRequiredTables();
		VocabularySnapshot snapshot = store.open(jdbcUrl);

		assertEquals(Map.of(1112807L, 2L, 19059056L, 1L), snapshot.conceptAncestors()
				.countBy(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, Long.class));
		assertEquals(Map.of(1112807L, 1L), snapshot.conceptAncestors()
				.where(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, 1112807L)
				.whereIn(ConceptAncestor.Fields.DESCENDANT_CONCEPT_ID, idsFrom(19059056L, JdbcTableQuery.MAX_IN_VALUES * 2))
				.countBy(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, Long.class));
		assertTrue(snapshot.conceptAncestors()
				.whereIn(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, List.of())
				.countBy(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, Long.class).isEmpty());
	}

	@Test
	void testClosedSnapshotReleasesPool() throws VocabularyLoadException {
		createRequiredTables();
		VocabularySnapshot snapshot = store.open(jdbcUrl);
		assertEquals(3, snapshot.concepts().execute().size());

		snapshot.close();

		assertTrue(((JdbcVocabularyStore.JdbcVocabularySnapshot) snapshot).isClosed());
		assertThrows(DataAccessException.class, () -> snapshot.concepts().execute());
		// Closing twice is harmless
		snapshot.close();
	}

	@Test
	void testUnknownColumnRejected() throws VocabularyLoadException {
		createRequiredTables();
		VocabularySnapshot snapshot = store.open(jdbcUrl);

		assertThrows(IllegalArgumentException.class, () -> snapshot.concepts().where("concept_id; DROP TABLE concept", 1));
	}

	@Test
	void testMissingRequiredTables() {
		VocabularyLoadException exception = assertThrows(VocabularyLoadException.class, () -> store.open(jdbcUrl));
		assertThat(exception.getMessage()).contains("concept_relationship", "concept_ancestor");
	}

	private static List<Long> idsFrom(long first, int count) {
		List<Long> ids = new ArrayList<>();
		for (long id = first; ids.size() < count; id++) {
			ids.add(id);
		}
		return ids;
	}

	private void createRequiredTables() {
		jdbcTemplate.execute("CREATE TABLE concept_relationship (concept_id_1 BIGINT, concept_id_2 BIGINT, relationship_id VARCHAR(20), " +
				"valid_start_date DATE, valid_end_date DATE, invalid_reason VARCHAR(1))");
		jdbcTemplate.execute("CREATE TABLE concept_ancestor (ancestor_concept_id BIGINT, descendant_concept_id BIGINT, " +
				"min_levels_of_separation INTEGER, max_levels_of_separation INTEGER)");

		jdbcTemplate.update("INSERT INTO concept VALUES (1112807, 'Aspirin', 'Drug', 'RxNorm', 'Ingredient', 'S', '1191', DATE '1970-01-01', DATE '2099-12-31', NULL)");
		jdbcTemplate.update("INSERT INTO concept VALUES (19059056, 'aspirin 81 MG Oral Tablet', 'Drug', 'RxNorm', 'Clinical Drug', 'S', '243670', DATE '1970-01-01', DATE '2099-12-31', NULL)");
		jdbcTemplate.update("INSERT INTO concept VALUES (3, 'Old concept', 'Condition', 'SNOMED', 'Clinical Finding', NULL, '123', DATE '1970-01-01', DATE '2010-01-01', 'D')");
		jdbcTemplate.update("INSERT INTO concept_relationship VALUES (19059056, 1112807, 'RxNorm has ing', DATE '1970-01-01', DATE '2099-12-31', NULL)");
		jdbcTemplate.update("INSERT INTO concept_ancestor VALUES (1112807, 1112807, 0, 0)");
		jdbcTemplate.update("INSERT INTO concept_ancestor VALUES (1112807, 19059056, 1, 1)");
		jdbcTemplate.update("INSERT INTO concept_ancestor VALUES (19059056, 19059056, 0, 0)");
	}
}
