package org.indicate.curator.core.data.services;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import org.indicate.curator.core.data.domain.*;
import org.indicate.curator.core.data.services.pojo.RelatedConcept;
import org.indicate.curator.core.data.services.pojo.SynonymView;
import org.indicate.curator.core.data.store.VocabularySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Function;

import static java.util.stream.Collectors.counting;
import static java.util.stream.Collectors.groupingBy;

/**
 * Read-only lookups over the loaded vocabulary graph.
 * Every method returns an empty result when no vocabulary is loaded or the vocabulary store fails.
 */
@Service
public class ConceptGraphQueryService {

	@Autowired
	private VocabularyService vocabularyService;

	@Autowired
	private HierarchyDirectionService hierarchyDirectionService;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public Optional<Concept> findConcept(long conceptId) {
		return query("concept", conceptId, snapshot -> snapshot.concepts().where(Concept.Fields.CONCEPT_ID, conceptId).execute())
				.stream().findFirst();
	}

	/**
	 * Concepts reached through any relationship where the given concept is concept_id_1.
	 * Unfiltered results are grouped by relationship, most frequent relationship first, then sorted by name.
	 * When only standard valid targets are kept results are sorted by relationship id then concept id.
	 */
	public List<RelatedConcept> relatedConcepts(long conceptId, boolean standardValidOnly) {
		return query("related concepts", conceptId, snapshot -> findRelatedConcepts(snapshot, conceptId, standardValidOnly));
	}

	private List<RelatedConcept> findRelatedConcepts(VocabularySnapshot snapshot, long conceptId, boolean standardValidOnly) {
		List<ConceptRelationship> relationships = snapshot.conceptRelationships()
				.where(ConceptRelationship.Fields.CONCEPT_ID_1, conceptId)
				.execute();
		if (relationships.isEmpty()) {
			return new ArrayList<>();
		}

		Set<Long> targetIds = new LongOpenHashSet();
		relationships.forEach(relationship -> targetIds.add(relationship.getConceptId2()));
		Long2ObjectMap<Concept> targets = getConcepts(snapshot, targetIds);

		List<RelatedConcept> related = new ArrayList<>();
		for (ConceptRelationship relationship : relationships) {
			Concept target = targets.get(relationship.getConceptId2());
			if (target == null) {
				logger.debug("Relationship {} points at unknown concept, skipped.", relationship);
				continue;
			}
			if (standardValidOnly && !target.isStandardAndValid()) {
				continue;
			}
			related.add(new RelatedConcept(target, relationship.getRelationshipId()));
		}

		if (standardValidOnly) {
			related.sort(Comparator.comparing(RelatedConcept::getRelationshipId, RelatedConcept.NAME_ORDER)
					.thenComparingLong(RelatedConcept::getConceptId));
		} else {
			Map<String, Long> relationshipFrequency = related.stream()
					.collect(groupingBy(RelatedConcept::getRelationshipId, counting()));
			related.sort(Comparator.<RelatedConcept, Long>comparing(relatedConcept -> relationshipFrequency.get(relatedConcept.getRelationshipId()), Comparator.reverseOrder())
					.thenComparing(RelatedConcept::getRelationshipId, RelatedConcept.NAME_ORDER)
					.thenComparing(RelatedConcept.BY_NAME));
		}
		return related;
	}

	/**
	 * Standard valid concepts of the closure below the given concept, the concept itself included, sorted by name.
	 */
	public List<RelatedConcept> descendantConcepts(long conceptId) {
		return query("descendants", conceptId, snapshot -> findDescendantConcepts(snapshot, conceptId));
	}

	private List<RelatedConcept> findDescendantConcepts(VocabularySnapshot snapshot, long conceptId) {
		Set<Long> descendantIds = snapshot.conceptAncestors()
				.where(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, conceptId)
				.selectDistinct(ConceptAncestor.Fields.DESCENDANT_CONCEPT_ID, Long.class);

		List<RelatedConcept> descendants = new ArrayList<>();
		for (Concept concept : getStandardValidConcepts(snapshot, descendantIds)) {
			descendants.add(new RelatedConcept(concept, Concepts.IS_A_LABEL));
		}
		descendants.sort(RelatedConcept.BY_NAME);
		return descendants;
	}

	/**
	 * Standard valid ancestors and descendants of the concept, labelled Ancestor or Descendant.
	 * A direct hierarchical relationship between the pair decides the label, closure membership is used otherwise.
	 * Ancestors come first, each group sorted by name.
	 */
	public List<RelatedConcept> hierarchyNeighbors(long conceptId) {
		return query("hierarchy neighbours", conceptId, snapshot -> findHierarchyNeighbors(snapshot, conceptId));
	}

	private List<RelatedConcept> findHierarchyNeighbors(VocabularySnapshot snapshot, long conceptId) {
		Set<Long> ancestorIds = new LongOpenHashSet(snapshot.conceptAncestors()
				.where(ConceptAncestor.Fields.DESCENDANT_CONCEPT_ID, conceptId)
				.selectDistinct(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, Long.class));
		Set<Long> descendantIds = new LongOpenHashSet(snapshot.conceptAncestors()
				.where(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, conceptId)
				.selectDistinct(ConceptAncestor.Fields.DESCENDANT_CONCEPT_ID, Long.class));
		ancestorIds.remove(conceptId);
		descendantIds.remove(conceptId);

		Set<Long> neighbourIds = new LongOpenHashSet(ancestorIds);
		neighbourIds.addAll(descendantIds);
		if (neighbourIds.isEmpty()) {
			return new ArrayList<>();
		}
		List<Concept> neighbours = getStandardValidConcepts(snapshot, neighbourIds);

		Map<Long, String> directLabels = getDirectHierarchyLabels(snapshot, conceptId, neighbourIds);

		List<RelatedConcept> result = new ArrayList<>();
		for (Concept neighbour : neighbours) {
			long neighbourId = neighbour.getConceptId();
			String label = directLabels.getOrDefault(neighbourId,
					ancestorIds.contains(neighbourId) ? Concepts.ANCESTOR_LABEL : Concepts.DESCENDANT_LABEL);
			result.add(new RelatedConcept(neighbour, label));
		}
		result.sort(Comparator.comparing((RelatedConcept relatedConcept) -> !Concepts.ANCESTOR_LABEL.equals(relatedConcept.getRelationshipId()))
				.thenComparing(RelatedConcept.BY_NAME));
		return result;
	}

	private Map<Long, String> getDirectHierarchyLabels(VocabularySnapshot snapshot, long conceptId, Set<Long> neighbourIds) {
		Map<String, RelationshipType> hierarchicalTypes = hierarchyDirectionService.getHierarchicalRelationshipTypes(snapshot);
		Map<Long, String> labels = new HashMap<>();
		if (hierarchicalTypes.isEmpty()) {
			return labels;
		}

		List<ConceptRelationship> direct = new ArrayList<>(snapshot.conceptRelationships()
				.where(ConceptRelationship.Fields.CONCEPT_ID_1, conceptId)
				.whereIn(ConceptRelationship.Fields.CONCEPT_ID_2, neighbourIds)
				.whereIn(ConceptRelationship.Fields.RELATIONSHIP_ID, hierarchicalTypes.keySet())
				.execute());
		direct.addAll(snapshot.conceptRelationships()
				.where(ConceptRelationship.Fields.CONCEPT_ID_2, conceptId)
				.whereIn(ConceptRelationship.Fields.CONCEPT_ID_1, neighbourIds)
				.whereIn(ConceptRelationship.Fields.RELATIONSHIP_ID, hierarchicalTypes.keySet())
				.execute());

		for (ConceptRelationship relationship : direct) {
			HierarchyDirectionService.HierarchyEdge edge =
					hierarchyDirectionService.orient(relationship, hierarchicalTypes.get(relationship.getRelationshipId()));
			if (edge.parentId() == conceptId) {
				labels.putIfAbsent(edge.childId(), Concepts.DESCENDANT_LABEL);
			} else if (edge.childId() == conceptId) {
				labels.putIfAbsent(edge.parentId(), Concepts.ANCESTOR_LABEL);
			}
		}
		return labels;
	}

	/**
	 * Synonyms of the concept with their language name resolved where the language concept is known.
	 */
	public List<SynonymView> synonyms(long conceptId) {
		return query("synonyms", conceptId, snapshot -> findSynonyms(snapshot, conceptId));
	}

	private List<SynonymView> findSynonyms(VocabularySnapshot snapshot, long conceptId) {
		List<ConceptSynonym> synonyms = snapshot.conceptSynonyms().where(ConceptSynonym.Fields.CONCEPT_ID, conceptId).execute();
		Set<Long> languageIds = new LongOpenHashSet();
		for (ConceptSynonym synonym : synonyms) {
			if (synonym.getLanguageConceptId() != null) {
				languageIds.add(synonym.getLanguageConceptId());
			}
		}
		Long2ObjectMap<Concept> languages = getConcepts(snapshot, languageIds);

		List<SynonymView> views = new ArrayList<>();
		for (ConceptSynonym synonym : synonyms) {
			Concept language = synonym.getLanguageConceptId() != null ? languages.get(synonym.getLanguageConceptId().longValue()) : null;
			views.add(new SynonymView(synonym.getConceptSynonymName(), language != null ? language.getConceptName() : null, synonym.getLanguageConceptId()));
		}
		views.sort(Comparator.comparing(SynonymView::synonym, RelatedConcept.NAME_ORDER));
		return views;
	}

	/**
	 * Related and descendant concepts merged into one candidate list for mapping review.
	 * Concepts already mapped are flagged recommended and listed first.
	 */
	public List<RelatedConcept> allRelatedForRecommendation(long conceptId, Collection<Long> existingMappingConceptIds) {
		Map<Long, RelatedConcept> byConceptId = new LinkedHashMap<>();
		for (RelatedConcept relatedConcept : relatedConcepts(conceptId, false)) {
			byConceptId.putIfAbsent(relatedConcept.getConceptId(), relatedConcept);
		}
		for (RelatedConcept descendant : descendantConcepts(conceptId)) {
			byConceptId.putIfAbsent(descendant.getConceptId(), descendant);
		}

		Set<Long> existing = existingMappingConceptIds != null ? new LongOpenHashSet(existingMappingConceptIds) : Collections.emptySet();
		List<RelatedConcept> candidates = new ArrayList<>(byConceptId.values());
		candidates.forEach(candidate -> candidate.setRecommended(existing.contains(candidate.getConceptId())));
		candidates.sort(Comparator.comparing(RelatedConcept::getRecommended, Comparator.reverseOrder())
				.thenComparing(RelatedConcept.BY_NAME));
		return candidates;
	}

	/**
	 * Valid RxNorm and RxNorm Extension Clinical Drugs below an ingredient in the closure, sorted by name.
	 */
	public List<Concept> clinicalDrugsForIngredient(long ingredientConceptId) {
		return query("clinical drugs", ingredientConceptId, snapshot -> findClinicalDrugs(snapshot, ingredientConceptId));
	}

	private List<Concept> findClinicalDrugs(VocabularySnapshot snapshot, long ingredientConceptId) {
		Set<Long> descendantIds = snapshot.conceptAncestors()
				.where(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, ingredientConceptId)
				.selectDistinct(ConceptAncestor.Fields.DESCENDANT_CONCEPT_ID, Long.class);
		List<Concept> drugs = new ArrayList<>();
		for (Concept concept : snapshot.concepts()
				.whereIn(Concept.Fields.CONCEPT_ID, descendantIds)
				.where(Concept.Fields.CONCEPT_CLASS_ID, Concepts.CLINICAL_DRUG)
				.where(Concept.Fields.DOMAIN_ID, Concepts.DRUG_DOMAIN)
				.whereIn(Concept.Fields.VOCABULARY_ID, Concepts.RXNORM_VOCABULARIES)
				.execute()) {
			if (concept.isValid()) {
				drugs.add(concept);
			}
		}
		drugs.sort(Comparator.comparing(Concept::getConceptName, RelatedConcept.NAME_ORDER).thenComparingLong(Concept::getConceptId));
		return drugs;
	}

	/**
	 * Runs the query against the current snapshot. No snapshot, or a failing store, gives an empty list.
	 */
	private <T> List<T> query(String description, long conceptId, Function<VocabularySnapshot, List<T>> reader) {
		Optional<VocabularySnapshot> optionalSnapshot = vocabularyService.getSnapshot();
		if (optionalSnapshot.isEmpty()) {
			return new ArrayList<>();
		}
		try {
			return reader.apply(optionalSnapshot.get());
		} catch (DataAccessException e) {
			logger.error("Vocabulary store failed reading {} of concept {}, no results returned.", description, conceptId, e);
			return new ArrayList<>();
		}
	}

	/**
	 * Concepts by id. Ids without a concept row are absent from the map.
	 */
	public Long2ObjectMap<Concept> getConcepts(VocabularySnapshot snapshot, Collection<Long> conceptIds) {
		Long2ObjectMap<Concept> concepts = new Long2ObjectOpenHashMap<>();
		for (Concept concept : snapshot.concepts().whereIn(Concept.Fields.CONCEPT_ID, conceptIds).execute()) {
			concepts.put(concept.getConceptId(), concept);
		}
		return concepts;
	}

	private List<Concept> getStandardValidConcepts(VocabularySnapshot snapshot, Collection<Long> conceptIds) {
		List<Concept> concepts = new ArrayList<>();
		for (Concept concept : snapshot.concepts()
				.whereIn(Concept.Fields.CONCEPT_ID, conceptIds)
				.where(Concept.Fields.STANDARD_CONCEPT, StandardFlag.STANDARD.getCode())
				.execute()) {
			if (concept.isValid()) {
				concepts.add(concept);
			}
		}
		return concepts;
	}
}
