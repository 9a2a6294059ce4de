package org.indicate.curator.core.data.services;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import org.apache.commons.lang3.StringUtils;
import org.indicate.curator.config.VocabularyProperties;
import org.indicate.curator.core.data.domain.*;
import org.indicate.curator.core.data.services.pojo.EnrichmentResult;
import org.indicate.curator.core.data.store.VocabularySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Regenerates the derived partition of a mapping table from its recommended manual mappings.
 * <p>
 * Derived rows of the previous run are always discarded first. The caller's table is never modified,
 * the regenerated table is returned whole.
 */
@Service
public class MappingEnrichmentService {

	@Autowired
	private VocabularyService vocabularyService;

	@Autowired
	private ConceptGraphQueryService conceptGraphQueryService;

	@Autowired
	private VocabularyProperties vocabularyProperties;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	/**
	 * @param preserveRecommended keep the recommended flag of previously derived rows whose concept is derived again.
	 * @throws EnrichmentPreconditionException if no vocabulary is loaded or the vocabulary store cannot be read.
	 */
	public EnrichmentResult enrich(List<Mapping> mappings, List<GeneralConcept> generalConcepts, boolean preserveRecommended)
			throws EnrichmentPreconditionException {

		VocabularySnapshot snapshot = vocabularyService.getSnapshot()
				.orElseThrow(() -> new EnrichmentPreconditionException("No vocabulary is loaded. Load a vocabulary before enriching mappings."));
		try {
			return enrich(snapshot, mappings != null ? mappings : Collections.emptyList(),
					generalConcepts != null ? generalConcepts : Collections.emptyList(), preserveRecommended);
		} catch (DataAccessException e) {
			logger.error("Vocabulary store failed during mapping enrichment.", e);
			throw new EnrichmentPreconditionException("The vocabulary store could not be read: " + e.getMessage(), e);
		}
	}

	private EnrichmentResult enrich(VocabularySnapshot snapshot, List<Mapping> table, List<GeneralConcept> generalConcepts,
			boolean preserveRecommended) {

		Set<Long> preservedRecommended = new LongOpenHashSet();
		if (preserveRecommended) {
			for (Mapping mapping : table) {
				if (mapping.isDerived() && mapping.isRecommended()) {
					preservedRecommended.add(mapping.getConceptId());
				}
			}
		}

		List<Mapping> retained = new ArrayList<>();
		for (Mapping mapping : table) {
			if (!mapping.isDerived()) {
				retained.add(copy(mapping));
			}
		}

		Propagation propagation = propagateRecommendedMappings(snapshot, retained, preserveRecommended, preservedRecommended);
		List<Mapping> propagated = new ArrayList<>(propagation.mappings());
		List<Mapping> drugMappings = deriveDrugMappings(snapshot, generalConcepts);

		// Drug pass results win over propagated rows for the same concept
		Set<Long> drugConceptIds = new LongOpenHashSet();
		drugMappings.forEach(mapping -> drugConceptIds.add(mapping.getConceptId()));
		propagated.removeIf(mapping -> drugConceptIds.contains(mapping.getConceptId()));

		Set<Mapping.MappingKey> keys = new HashSet<>();
		retained.forEach(mapping -> keys.add(mapping.getKey()));
		List<Mapping> result = new ArrayList<>(retained);
		int derivedCount = appendNew(result, propagated, keys);
		int drugDerivedCount = appendNew(result, drugMappings, keys);

		logger.info("Mapping enrichment derived {} mappings and {} drug mappings, {} recommended sources skipped.",
				derivedCount, drugDerivedCount, propagation.skippedSources());
		return new EnrichmentResult(result, derivedCount, drugDerivedCount, propagation.skippedSources());
	}

	private Propagation propagateRecommendedMappings(VocabularySnapshot snapshot, List<Mapping> manualMappings,
			boolean preserveRecommended, Set<Long> preservedRecommended) {

		Set<String> allowedVocabularies = new HashSet<>(vocabularyProperties.getEnrichmentVocabularies());
		List<Mapping> recommended = manualMappings.stream().filter(Mapping::isRecommended).toList();
		Set<Long> sourceIds = new LongOpenHashSet();
		recommended.forEach(mapping -> sourceIds.add(mapping.getConceptId()));
		Long2ObjectMap<Concept> sources = conceptGraphQueryService.getConcepts(snapshot, sourceIds);

		List<Mapping> derived = new ArrayList<>();
		int skippedSources = 0;
		for (Mapping mapping : recommended) {
			Concept source = sources.get(mapping.getConceptId());
			if (source == null) {
				logger.debug("Recommended mapping {} points at unknown concept, skipped.", mapping);
				skippedSources++;
				continue;
			}
			if (!allowedVocabularies.contains(source.getVocabularyId())) {
				skippedSources++;
				continue;
			}

			Set<Long> candidateIds = new LongOpenHashSet(snapshot.conceptRelationships()
					.where(ConceptRelationship.Fields.CONCEPT_ID_1, source.getConceptId())
					.whereIn(ConceptRelationship.Fields.RELATIONSHIP_ID, Concepts.MAPPING_RELATIONSHIPS)
					.selectDistinct(ConceptRelationship.Fields.CONCEPT_ID_2, Long.class));
			candidateIds.addAll(snapshot.conceptAncestors()
					.where(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, source.getConceptId())
					.selectDistinct(ConceptAncestor.Fields.DESCENDANT_CONCEPT_ID, Long.class));

			List<Concept> candidates = new ArrayList<>(snapshot.concepts()
					.whereIn(Concept.Fields.CONCEPT_ID, candidateIds)
					.where(Concept.Fields.VOCABULARY_ID, source.getVocabularyId())
					.execute());
			candidates.sort(Comparator.comparingLong(Concept::getConceptId));
			for (Concept candidate : candidates) {
				if (!candidate.isValid()) {
					continue;
				}
				if (Concepts.DRUG_DOMAIN.equals(candidate.getDomainId()) && !Concepts.CLINICAL_DRUG.equals(candidate.getConceptClassId())) {
					continue;
				}
				boolean keepRecommended = preserveRecommended && preservedRecommended.contains(candidate.getConceptId());
				derived.add(Mapping.derived(mapping.getGeneralConceptId(), candidate.getConceptId(), mapping.getUnitConceptId(), keepRecommended));
			}
		}
		return new Propagation(derived, skippedSources);
	}

	/**
	 * Ingredient named like the general concept, then the Clinical Drug Comps that have it as ingredient,
	 * then the Clinical Drugs those components constitute.
	 */
	List<Mapping> deriveDrugMappings(VocabularySnapshot snapshot, List<GeneralConcept> generalConcepts) {
		List<Mapping> drugMappings = new ArrayList<>();
		for (GeneralConcept generalConcept : generalConcepts) {
			if (!generalConcept.isDrug() || StringUtils.isBlank(generalConcept.getGeneralConceptName())) {
				continue;
			}

			Set<Long> ingredientIds = validIds(snapshot.concepts()
					.where(Concept.Fields.CONCEPT_CLASS_ID, Concepts.INGREDIENT)
					.whereIn(Concept.Fields.VOCABULARY_ID, Concepts.RXNORM_VOCABULARIES)
					.whereIgnoreCase(Concept.Fields.CONCEPT_NAME, generalConcept.getGeneralConceptName().trim())
					.execute());
			if (ingredientIds.isEmpty()) {
				continue;
			}

			Set<Long> componentIds = validIds(snapshot.concepts()
					.whereIn(Concept.Fields.CONCEPT_ID, snapshot.conceptRelationships()
							.whereIn(ConceptRelationship.Fields.CONCEPT_ID_2, ingredientIds)
							.where(ConceptRelationship.Fields.RELATIONSHIP_ID, Concepts.RXNORM_HAS_INGREDIENT)
							.selectDistinct(ConceptRelationship.Fields.CONCEPT_ID_1, Long.class))
					.where(Concept.Fields.CONCEPT_CLASS_ID, Concepts.CLINICAL_DRUG_COMP)
					.execute());
			if (componentIds.isEmpty()) {
				continue;
			}

			Set<Long> clinicalDrugIds = validIds(snapshot.concepts()
					.whereIn(Concept.Fields.CONCEPT_ID, snapshot.conceptRelationships()
							.whereIn(ConceptRelationship.Fields.CONCEPT_ID_1, componentIds)
							.where(ConceptRelationship.Fields.RELATIONSHIP_ID, Concepts.CONSTITUTES)
							.selectDistinct(ConceptRelationship.Fields.CONCEPT_ID_2, Long.class))
					.where(Concept.Fields.CONCEPT_CLASS_ID, Concepts.CLINICAL_DRUG)
					.execute());

			List<Long> sortedDrugIds = new ArrayList<>(clinicalDrugIds);
			Collections.sort(sortedDrugIds);
			for (Long clinicalDrugId : sortedDrugIds) {
				drugMappings.add(Mapping.derived(generalConcept.getGeneralConceptId(), clinicalDrugId, null, true));
			}
		}
		return drugMappings;
	}

	private static Set<Long> validIds(List<Concept> concepts) {
		Set<Long> ids = new LongOpenHashSet();
		for (Concept concept : concepts) {
			if (concept.isValid()) {
				ids.add(concept.getConceptId());
			}
		}
		return ids;
	}

	private static int appendNew(List<Mapping> table, List<Mapping> additions, Set<Mapping.MappingKey> keys) {
		int appended = 0;
		for (Mapping addition : additions) {
			if (keys.add(addition.getKey())) {
				table.add(addition);
				appended++;
			}
		}
		return appended;
	}

	private static Mapping copy(Mapping mapping) {
		return new Mapping(mapping.getGeneralConceptId(), mapping.getConceptId(), mapping.getUnitConceptId(),
				mapping.isRecommended(), mapping.getSource());
	}

	private record Propagation(List<Mapping> mappings, int skippedSources) {
	}
}
