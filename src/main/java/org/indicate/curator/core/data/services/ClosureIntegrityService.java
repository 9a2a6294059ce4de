package org.indicate.curator.core.data.services;

import com.google.common.base.Preconditions;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import org.indicate.curator.core.data.domain.ConceptAncestor;
import org.indicate.curator.core.data.services.pojo.TransitivityViolation;
import org.indicate.curator.core.data.store.VocabularySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Checks that the ancestor closure is transitive around a set of pivot concepts.
 */
@Service
public class ClosureIntegrityService {

	@Autowired
	private VocabularyService vocabularyService;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	/**
	 * @throws IllegalArgumentException if any id is null.
	 */
	public List<TransitivityViolation> findTransitivityViolations(Collection<Long> pivotConceptIds) {
		if (pivotConceptIds == null || pivotConceptIds.isEmpty()) {
			return new ArrayList<>();
		}
		for (Long pivotConceptId : pivotConceptIds) {
			Preconditions.checkArgument(pivotConceptId != null, "Concept ids must not be null.");
		}
		Optional<VocabularySnapshot> optionalSnapshot = vocabularyService.getSnapshot();
		if (optionalSnapshot.isEmpty()) {
			return new ArrayList<>();
		}
		try {
			return findTransitivityViolations(optionalSnapshot.get(), pivotConceptIds);
		} catch (DataAccessException e) {
			logger.error("Vocabulary store failed checking the closure around {} concepts, no violations returned.", pivotConceptIds.size(), e);
			return new ArrayList<>();
		}
	}

	private List<TransitivityViolation> findTransitivityViolations(VocabularySnapshot snapshot, Collection<Long> pivotConceptIds) {
		Long2ObjectMap<Set<Long>> ancestorsOfPivot = new Long2ObjectOpenHashMap<>();
		for (ConceptAncestor row : snapshot.conceptAncestors()
				.whereIn(ConceptAncestor.Fields.DESCENDANT_CONCEPT_ID, pivotConceptIds)
				.execute()) {
			if (!row.isSelf()) {
				ancestorsOfPivot.computeIfAbsent(row.getDescendantConceptId(), id -> new TreeSet<>()).add(row.getAncestorConceptId());
			}
		}
		Long2ObjectMap<Set<Long>> descendantsOfPivot = new Long2ObjectOpenHashMap<>();
		for (ConceptAncestor row : snapshot.conceptAncestors()
				.whereIn(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, pivotConceptIds)
				.execute()) {
			if (!row.isSelf()) {
				descendantsOfPivot.computeIfAbsent(row.getAncestorConceptId(), id -> new TreeSet<>()).add(row.getDescendantConceptId());
			}
		}

		Set<Long> allAncestors = new LongOpenHashSet();
		ancestorsOfPivot.values().forEach(allAncestors::addAll);
		Set<Long> allDescendants = new LongOpenHashSet();
		descendantsOfPivot.values().forEach(allDescendants::addAll);

		Set<Pair> closurePairs = new HashSet<>();
		for (ConceptAncestor row : snapshot.conceptAncestors()
				.whereIn(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, allAncestors)
				.whereIn(ConceptAncestor.Fields.DESCENDANT_CONCEPT_ID, allDescendants)
				.execute()) {
			closurePairs.add(new Pair(row.getAncestorConceptId(), row.getDescendantConceptId()));
		}

		List<TransitivityViolation> violations = new ArrayList<>();
		for (Long pivotId : new TreeSet<>(pivotConceptIds)) {
			Set<Long> ancestors = ancestorsOfPivot.getOrDefault(pivotId.longValue(), Collections.emptySet());
			Set<Long> descendants = descendantsOfPivot.getOrDefault(pivotId.longValue(), Collections.emptySet());
			for (Long ancestorId : ancestors) {
				for (Long descendantId : descendants) {
					if (!ancestorId.equals(descendantId) && !closurePairs.contains(new Pair(ancestorId, descendantId))) {
						violations.add(new TransitivityViolation(ancestorId, pivotId, descendantId));
					}
				}
			}
		}
		if (!violations.isEmpty()) {
			logger.warn("Ancestor closure is not transitive, {} missing pairs found around {} concepts.", violations.size(), pivotConceptIds.size());
		}
		return violations;
	}

	private record Pair(long ancestorId, long descendantId) {
	}
}
