package org.indicate.curator;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import org.indicate.curator.core.data.domain.*;
import org.indicate.curator.core.data.store.InMemoryTable;
import org.indicate.curator.core.data.store.InMemoryVocabularySnapshot;
import org.indicate.curator.core.data.store.VocabularySnapshot;
import org.indicate.curator.core.data.store.VocabularyTable;

import java.util.*;

/**
 * Builds small in memory vocabularies for tests.
 * Hierarchy links added with {@link #isA(long, long)} produce both relationship rows and a transitive ancestor closure,
 * including a self row per concept.
 */
public class TestVocabulary {

	public static final String IS_A = "Is a";
	public static final String SUBSUMES = "Subsumes";
	public static final String RXNORM_INGREDIENT_OF = "RxNorm ing of";
	public static final String CONSISTS_OF = "Consists of";

	private final Map<Long, Concept> concepts = new LinkedHashMap<>();
	private final List<ConceptRelationship> relationships = new ArrayList<>();
	private final List<ConceptSynonym> synonyms = new ArrayList<>();
	private final Map<Long, Set<Long>> parents = new HashMap<>();
	private final Set<List<Long>> removedClosureRows = new HashSet<>();
	private final List<RelationshipType> relationshipTypes = new ArrayList<>(List.of(
			new RelationshipType(IS_A, "Is a", true, true, SUBSUMES, 44818821L),
			new RelationshipType(SUBSUMES, "Subsumes", true, true, IS_A, 44818723L),
			new RelationshipType(Concepts.MAPS_TO, "Maps to", false, false, Concepts.MAPPED_FROM, 44818977L),
			new RelationshipType(Concepts.MAPPED_FROM, "Mapped from", false, false, Concepts.MAPS_TO, 44818724L),
			new RelationshipType(Concepts.RXNORM_HAS_INGREDIENT, "RxNorm has ingredient", true, true, RXNORM_INGREDIENT_OF, 44818859L),
			new RelationshipType(RXNORM_INGREDIENT_OF, "RxNorm ingredient of", true, true, Concepts.RXNORM_HAS_INGREDIENT, 44818859L),
			new RelationshipType(Concepts.CONSTITUTES, "Constitutes", true, true, CONSISTS_OF, 44818788L),
			new RelationshipType(CONSISTS_OF, "Consists of", true, true, Concepts.CONSTITUTES, 44818789L)
	));

	public TestVocabulary concept(long conceptId, String name) {
		return concept(conceptId, name, "Condition", Concepts.SNOMED, "Clinical Finding", "S", null);
	}

	public TestVocabulary concept(long conceptId, String name, String domainId, String vocabularyId, String conceptClassId,
			String standardConcept, String invalidReason) {
		concepts.put(conceptId, new Concept(conceptId, name, domainId, vocabularyId, conceptClassId, standardConcept,
				"C" + conceptId, null, null, invalidReason));
		return this;
	}

	public TestVocabulary invalidConcept(long conceptId, String name) {
		return concept(conceptId, name, "Condition", Concepts.SNOMED, "Clinical Finding", null, "D");
	}

	/**
	 * Child is a parent, stored as an Is a row with its Subsumes reverse and closed into the ancestor table.
	 */
	public TestVocabulary isA(long childId, long parentId) {
		relationships.add(new ConceptRelationship(childId, parentId, IS_A));
		relationships.add(new ConceptRelationship(parentId, childId, SUBSUMES));
		return hierarchyOnly(childId, parentId);
	}

	/**
	 * Adds the link to the ancestor closure without any relationship row.
	 */
	public TestVocabulary hierarchyOnly(long childId, long parentId) {
		parents.computeIfAbsent(childId, id -> new LinkedHashSet<>()).add(parentId);
		return this;
	}

	public TestVocabulary relationship(long conceptId1, long conceptId2, String relationshipId) {
		relationships.add(new ConceptRelationship(conceptId1, conceptId2, relationshipId));
		return this;
	}

	public TestVocabulary relationshipType(RelationshipType relationshipType) {
		relationshipTypes.add(relationshipType);
		return this;
	}

	public TestVocabulary synonym(long conceptId, String name, Long languageConceptId) {
		synonyms.add(new ConceptSynonym(conceptId, name, languageConceptId));
		return this;
	}

	/**
	 * Leaves one computed row out of the closure.
	 */
	public TestVocabulary withoutClosureRow(long ancestorId, long descendantId) {
		removedClosureRows.add(List.of(ancestorId, descendantId));
		return this;
	}

	public List<ConceptAncestor> closure() {
		Long2ObjectMap<Map<Long, int[]>> memo = new Long2ObjectOpenHashMap<>();
		Set<Long> ids = new TreeSet<>(concepts.keySet());
		ids.addAll(parents.keySet());
		parents.values().forEach(ids::addAll);

		List<ConceptAncestor> rows = new ArrayList<>();
		for (Long id : ids) {
			for (Map.Entry<Long, int[]> entry : ancestorsOf(id, memo).entrySet()) {
				if (!removedClosureRows.contains(List.of(entry.getKey(), id))) {
					rows.add(new ConceptAncestor(entry.getKey(), id, entry.getValue()[0], entry.getValue()[1]));
				}
			}
		}
		return rows;
	}

	private Map<Long, int[]> ancestorsOf(long id, Long2ObjectMap<Map<Long, int[]>> memo) {
		Map<Long, int[]> known = memo.get(id);
		if (known != null) {
			return known;
		}
		Map<Long, int[]> ancestors = new TreeMap<>();
		ancestors.put(id, new int[]{0, 0});
		for (Long parentId : parents.getOrDefault(id, Collections.emptySet())) {
			for (Map.Entry<Long, int[]> entry : ancestorsOf(parentId, memo).entrySet()) {
				int min = entry.getValue()[0] + 1;
				int max = entry.getValue()[1] + 1;
				int[] separation = ancestors.get(entry.getKey());
				if (separation == null) {
					ancestors.put(entry.getKey(), new int[]{min, max});
				} else {
					separation[0] = Math.min(separation[0], min);
					separation[1] = Math.max(separation[1], max);
				}
			}
		}
		memo.put(id, ancestors);
		return ancestors;
	}

	public List<Concept> getConcepts() {
		return new ArrayList<>(concepts.values());
	}

	public List<ConceptRelationship> getRelationships() {
		return relationships;
	}

	public List<ConceptSynonym> getSynonyms() {
		return synonyms;
	}

	public List<RelationshipType> getRelationshipTypes() {
		return relationshipTypes;
	}

	public VocabularySnapshot build() {
		return new InMemoryVocabularySnapshot("test", List.<InMemoryTable<?>>of(
				new InMemoryTable<>(VocabularyTable.CONCEPT, getConcepts()),
				new InMemoryTable<>(VocabularyTable.CONCEPT_RELATIONSHIP, relationships),
				new InMemoryTable<>(VocabularyTable.CONCEPT_ANCESTOR, closure()),
				new InMemoryTable<>(VocabularyTable.CONCEPT_SYNONYM, synonyms),
				new InMemoryTable<>(VocabularyTable.RELATIONSHIP, relationshipTypes)
		));
	}
}
