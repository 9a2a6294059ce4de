package org.indicate.curator.core.data.services;

import org.indicate.curator.config.VocabularyProperties;
import org.indicate.curator.core.data.domain.ConceptRelationship;
import org.indicate.curator.core.data.domain.RelationshipType;
import org.indicate.curator.core.data.store.VocabularySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides which end of a hierarchical relationship is the parent.
 * <p>
 * Relationship kinds listed in vocabulary.child-to-parent-relationships point from child to parent, their reverse kinds
 * point from parent to child. Kinds not covered by the list on either side fall back to comparing the relationship id with
 * its reverse id: the one that sorts first is taken as child to parent.
 */
@Service
public class HierarchyDirectionService {

	@Autowired
	private VocabularyProperties vocabularyProperties;

	private final Set<String> reportedUncuratedKinds = ConcurrentHashMap.newKeySet();

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public boolean isChildToParent(RelationshipType relationshipType) {
		return isChildToParent(relationshipType.getRelationshipId(), relationshipType.getReverseRelationshipId());
	}

	public boolean isChildToParent(String relationshipId, String reverseRelationshipId) {
		Set<String> childToParent = new HashSet<>(vocabularyProperties.getChildToParentRelationships());
		if (childToParent.contains(relationshipId)) {
			return true;
		}
		if (reverseRelationshipId != null && childToParent.contains(reverseRelationshipId)) {
			return false;
		}
		if (reportedUncuratedKinds.add(relationshipId)) {
			logger.warn("Hierarchical relationship '{}' is not in the curated child to parent list, direction inferred from its reverse id '{}'.",
					relationshipId, reverseRelationshipId);
		}
		return reverseRelationshipId != null && relationshipId.compareTo(reverseRelationshipId) < 0;
	}

	/**
	 * Relationship kinds flagged as defining ancestry, by relationship id.
	 */
	public Map<String, RelationshipType> getHierarchicalRelationshipTypes(VocabularySnapshot snapshot) {
		Map<String, RelationshipType> hierarchical = new HashMap<>();
		for (RelationshipType relationshipType : snapshot.relationshipTypes().execute()) {
			if (relationshipType.isDefinesAncestry()) {
				hierarchical.put(relationshipType.getRelationshipId(), relationshipType);
			}
		}
		return hierarchical;
	}

	/**
	 * Orients a hierarchical relationship row as a parent to child edge.
	 */
	public HierarchyEdge orient(ConceptRelationship relationship, RelationshipType relationshipType) {
		if (isChildToParent(relationshipType)) {
			return new HierarchyEdge(relationship.getConceptId2(), relationship.getConceptId1());
		}
		return new HierarchyEdge(relationship.getConceptId1(), relationship.getConceptId2());
	}

	public record HierarchyEdge(long parentId, long childId) {
	}
}
