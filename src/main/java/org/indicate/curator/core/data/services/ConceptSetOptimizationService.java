package org.indicate.curator.core.data.services;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import org.indicate.curator.core.data.domain.Concept;
import org.indicate.curator.core.data.domain.ConceptAncestor;
import org.indicate.curator.core.data.domain.ConceptSetItem;
import org.indicate.curator.core.data.services.pojo.OptimizationResult;
import org.indicate.curator.core.data.services.pojo.OptimizationResult.Status;
import org.indicate.curator.core.data.services.pojo.OptimizationResult.Strategy;
import org.indicate.curator.core.data.store.VocabularySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Shrinks a concept set without changing the concepts it resolves to.
 * <p>
 * Bottom-up: an ancestor whose every descendant is already covered by the set replaces the items below it.
 * Passes repeat until nothing changes, at most {@link #MAX_PASSES} times.
 * Top-down, only tried when bottom-up changes nothing: items already implied by an include-descendants item are dropped.
 */
@Service
public class ConceptSetOptimizationService {

	public static final int MAX_PASSES = 10;

	@Autowired
	private VocabularyService vocabularyService;

	@Autowired
	private ConceptGraphQueryService conceptGraphQueryService;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public OptimizationResult optimize(List<ConceptSetItem> items) {
		List<ConceptSetItem> input = copy(items);
		Optional<VocabularySnapshot> optionalSnapshot = vocabularyService.getSnapshot();
		if (optionalSnapshot.isEmpty()) {
			logger.info("No vocabulary loaded, concept set of {} items returned unchanged.", input.size());
			return OptimizationResult.unchanged(Status.UNAVAILABLE, input, 0);
		}
		if (input.isEmpty()) {
			return OptimizationResult.unchanged(Status.OK, input, 0);
		}
		try {
			return optimize(optionalSnapshot.get(), input);
		} catch (DataAccessException e) {
			logger.error("Vocabulary store failed during optimization, concept set of {} items returned unchanged.", input.size(), e);
			return OptimizationResult.unchanged(Status.UNAVAILABLE, input, 0);
		}
	}

	private OptimizationResult optimize(VocabularySnapshot snapshot, List<ConceptSetItem> input) {
		OptimizationResult bottomUp = optimizeBottomUp(snapshot, input);
		if (bottomUp.getStrategy() == Strategy.BOTTOM_UP) {
			return bottomUp;
		}

		List<ConceptSetItem> redundant = findRedundantDescendants(snapshot, input);
		if (redundant.isEmpty()) {
			return OptimizationResult.unchanged(Status.OK, input, bottomUp.getPasses());
		}
		List<ConceptSetItem> optimized = new ArrayList<>(input);
		optimized.removeAll(redundant);
		logger.info("Top-down optimization removed {} of {} items.", redundant.size(), input.size());
		return new OptimizationResult(Status.OK, Strategy.TOP_DOWN, optimized, redundant, new ArrayList<>(), bottomUp.getPasses(), false);
	}

	private OptimizationResult optimizeBottomUp(VocabularySnapshot snapshot, List<ConceptSetItem> input) {
		List<ConceptSetItem> working = new ArrayList<>(input);
		List<ConceptSetItem> removed = new ArrayList<>();
		List<ConceptSetItem> added = new ArrayList<>();
		int passes = 0;
		boolean iterationLimitReached = false;

		while (passes < MAX_PASSES) {
			passes++;
			List<Substitution> substitutions = proposeSubstitutions(snapshot, working);
			if (substitutions.isEmpty()) {
				break;
			}

			// All substitutions of a pass are applied together
			Set<Long> consumed = new LongOpenHashSet();
			substitutions.forEach(substitution -> consumed.addAll(substitution.childIds()));
			List<ConceptSetItem> next = new ArrayList<>();
			for (ConceptSetItem item : working) {
				if (!item.isExcluded() && consumed.contains(item.getConceptId())) {
					removed.add(item);
				} else {
					next.add(item);
				}
			}
			for (Substitution substitution : substitutions) {
				ConceptSetItem ancestorItem = ConceptSetItem.ancestorReplacement(substitution.ancestor());
				next.add(ancestorItem);
				added.add(ancestorItem.copy());
			}
			working = next;
			logger.debug("Bottom-up pass {} replaced {} items with {} ancestors.", passes, consumed.size(), substitutions.size());

			if (passes == MAX_PASSES) {
				iterationLimitReached = true;
				logger.warn("Bottom-up optimization stopped after {} passes, the concept set may not be fully optimized.", MAX_PASSES);
			}
		}

		if (added.isEmpty()) {
			return OptimizationResult.unchanged(Status.OK, input, passes);
		}
		logger.info("Bottom-up optimization removed {} items and added {} ancestors in {} passes.", removed.size(), added.size(), passes);
		return new OptimizationResult(Status.OK, Strategy.BOTTOM_UP, working, removed, added, passes, iterationLimitReached);
	}

	/**
	 * One bottom-up pass over the current items. The items are not modified.
	 */
	List<Substitution> proposeSubstitutions(VocabularySnapshot snapshot, List<ConceptSetItem> items) {
		Set<Long> presentIds = new LongOpenHashSet();
		Set<Long> nonExcludedIds = new LongOpenHashSet();
		for (ConceptSetItem item : items) {
			presentIds.add(item.getConceptId());
			if (!item.isExcluded()) {
				nonExcludedIds.add(item.getConceptId());
			}
		}

		Set<Long> activeIds = validConceptIds(snapshot, nonExcludedIds);
		if (activeIds.size() < 2) {
			return Collections.emptyList();
		}

		Set<Long> coveredIds = new LongOpenHashSet(activeIds);
		Set<Long> includeDescendantsIds = new LongOpenHashSet();
		for (ConceptSetItem item : items) {
			if (!item.isExcluded() && item.isIncludeDescendants() && activeIds.contains(item.getConceptId())) {
				includeDescendantsIds.add(item.getConceptId());
			}
		}
		coveredIds.addAll(snapshot.conceptAncestors()
				.whereIn(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, includeDescendantsIds)
				.selectDistinct(ConceptAncestor.Fields.DESCENDANT_CONCEPT_ID, Long.class));

		// Ancestors of at least two active items that are not in the set themselves
		Long2ObjectMap<Set<Long>> matchedChildren = new Long2ObjectOpenHashMap<>();
		for (ConceptAncestor row : snapshot.conceptAncestors()
				.whereIn(ConceptAncestor.Fields.DESCENDANT_CONCEPT_ID, activeIds)
				.execute()) {
			long ancestorId = row.getAncestorConceptId();
			if (row.isSelf() || presentIds.contains(ancestorId)) {
				continue;
			}
			matchedChildren.computeIfAbsent(ancestorId, id -> new TreeSet<>()).add(row.getDescendantConceptId());
		}
		matchedChildren.values().removeIf(children -> children.size() < 2);
		if (matchedChildren.isEmpty()) {
			return Collections.emptyList();
		}

		Long2ObjectMap<Concept> ancestors = conceptGraphQueryService.getConcepts(snapshot, matchedChildren.keySet());
		Set<Long> candidateIds = new LongOpenHashSet();
		for (Long ancestorId : matchedChildren.keySet()) {
			Concept ancestor = ancestors.get(ancestorId.longValue());
			if (ancestor != null && ancestor.isValid()) {
				candidateIds.add(ancestorId);
			}
		}

		candidateIds.retainAll(fullyCoveredCandidates(snapshot, candidateIds, coveredIds));

		List<Long> ordered = new ArrayList<>(candidateIds);
		ordered.sort(Comparator.<Long>comparingInt(id -> matchedChildren.get(id.longValue()).size()).reversed()
				.thenComparing(Comparator.naturalOrder()));

		List<Substitution> substitutions = new ArrayList<>();
		Set<Long> consumed = new LongOpenHashSet();
		for (Long ancestorId : ordered) {
			Set<Long> children = matchedChildren.get(ancestorId.longValue());
			if (children.stream().anyMatch(consumed::contains)) {
				continue;
			}
			consumed.addAll(children);
			substitutions.add(new Substitution(ancestors.get(ancestorId.longValue()), children));
		}
		return substitutions;
	}

	/**
	 * Candidates whose every closure descendant is covered, whatever its validity.
	 * Descendants are counted by the store rather than loaded: all descendants per candidate against covered descendants
	 * per candidate. A candidate's own row counts as covered.
	 */
	private Set<Long> fullyCoveredCandidates(VocabularySnapshot snapshot, Set<Long> candidateIds, Set<Long> coveredIds) {
		if (candidateIds.isEmpty()) {
			return new LongOpenHashSet();
		}
		Map<Long, Long> descendantCounts = snapshot.conceptAncestors()
				.whereIn(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, candidateIds)
				.countBy(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, Long.class);
		Map<Long, Long> coveredCounts = snapshot.conceptAncestors()
				.whereIn(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, candidateIds)
				.whereIn(ConceptAncestor.Fields.DESCENDANT_CONCEPT_ID, coveredIds)
				.countBy(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, Long.class);

		// Own rows not already counted as covered
		Set<Long> uncoveredSelfRows = new LongOpenHashSet();
		for (ConceptAncestor row : snapshot.conceptAncestors()
				.whereIn(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, candidateIds)
				.whereIn(ConceptAncestor.Fields.DESCENDANT_CONCEPT_ID, candidateIds)
				.execute()) {
			if (row.isSelf() && !coveredIds.contains(row.getAncestorConceptId())) {
				uncoveredSelfRows.add(row.getAncestorConceptId());
			}
		}

		Set<Long> fullyCovered = new LongOpenHashSet();
		for (Long candidateId : candidateIds) {
			long uncovered = descendantCounts.getOrDefault(candidateId, 0L) - coveredCounts.getOrDefault(candidateId, 0L)
					- (uncoveredSelfRows.contains(candidateId) ? 1 : 0);
			if (uncovered == 0) {
				fullyCovered.add(candidateId);
			}
		}
		return fullyCovered;
	}

	/**
	 * Non-excluded valid items already implied by a non-excluded valid include-descendants item.
	 */
	private List<ConceptSetItem> findRedundantDescendants(VocabularySnapshot snapshot, List<ConceptSetItem> items) {
		Set<Long> nonExcludedIds = new LongOpenHashSet();
		for (ConceptSetItem item : items) {
			if (!item.isExcluded()) {
				nonExcludedIds.add(item.getConceptId());
			}
		}
		Set<Long> validIds = validConceptIds(snapshot, nonExcludedIds);

		Set<Long> rootIds = new LongOpenHashSet();
		for (ConceptSetItem item : items) {
			if (!item.isExcluded() && item.isIncludeDescendants() && validIds.contains(item.getConceptId())) {
				rootIds.add(item.getConceptId());
			}
		}
		if (rootIds.isEmpty()) {
			return new ArrayList<>();
		}

		Set<Long> impliedIds = new LongOpenHashSet();
		for (ConceptAncestor row : snapshot.conceptAncestors()
				.whereIn(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, rootIds)
				.whereIn(ConceptAncestor.Fields.DESCENDANT_CONCEPT_ID, validIds)
				.execute()) {
			if (!row.isSelf()) {
				impliedIds.add(row.getDescendantConceptId());
			}
		}

		List<ConceptSetItem> redundant = new ArrayList<>();
		for (ConceptSetItem item : items) {
			if (!item.isExcluded() && impliedIds.contains(item.getConceptId())) {
				redundant.add(item);
			}
		}
		return redundant;
	}

	private Set<Long> validConceptIds(VocabularySnapshot snapshot, Set<Long> conceptIds) {
		Set<Long> valid = new LongOpenHashSet();
		for (Concept concept : conceptGraphQueryService.getConcepts(snapshot, conceptIds).values()) {
			if (concept.isValid()) {
				valid.add(concept.getConceptId());
			}
		}
		return valid;
	}

	private static List<ConceptSetItem> copy(List<ConceptSetItem> items) {
		List<ConceptSetItem> copies = new ArrayList<>();
		if (items != null) {
			items.forEach(item -> copies.add(item.copy()));
		}
		return copies;
	}

	record Substitution(Concept ancestor, Set<Long> childIds) {
	}
}
