package org.indicate.curator.core.data.services;

import com.google.common.base.Preconditions;
import it.unimi.dsi.fastutil.longs.Long2IntMap;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import org.indicate.curator.core.data.domain.Concept;
import org.indicate.curator.core.data.domain.ConceptAncestor;
import org.indicate.curator.core.data.domain.ConceptRelationship;
import org.indicate.curator.core.data.domain.RelationshipType;
import org.indicate.curator.core.data.services.pojo.HierarchyGraph;
import org.indicate.curator.core.data.services.pojo.HierarchyGraph.Category;
import org.indicate.curator.core.data.store.VocabularySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class HierarchyGraphService {

	public static final int DEFAULT_MAX_LEVELS = 5;

	private static final int MAX_LABEL_LENGTH = 50;
	private static final int TRUNCATED_LABEL_LENGTH = 47;

	@Autowired
	private VocabularyService vocabularyService;

	@Autowired
	private ConceptGraphQueryService conceptGraphQueryService;

	@Autowired
	private HierarchyDirectionService hierarchyDirectionService;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public HierarchyGraph buildGraph(long conceptId) {
		return buildGraph(conceptId, DEFAULT_MAX_LEVELS, DEFAULT_MAX_LEVELS);
	}

	/**
	 * Ancestors sit at negative levels and descendants at positive levels, each at its shortest separation from the concept.
	 * Concepts beyond maxLevelsUp or maxLevelsDown are left out. An unknown concept gives an empty graph.
	 */
	public HierarchyGraph buildGraph(long conceptId, int maxLevelsUp, int maxLevelsDown) {
		Preconditions.checkArgument(maxLevelsUp >= 0, "maxLevelsUp must not be negative.");
		Preconditions.checkArgument(maxLevelsDown >= 0, "maxLevelsDown must not be negative.");

		Optional<VocabularySnapshot> optionalSnapshot = vocabularyService.getSnapshot();
		if (optionalSnapshot.isEmpty()) {
			return HierarchyGraph.empty();
		}
		try {
			return buildGraph(optionalSnapshot.get(), conceptId, maxLevelsUp, maxLevelsDown);
		} catch (DataAccessException e) {
			logger.error("Vocabulary store failed building the hierarchy graph of concept {}, empty graph returned.", conceptId, e);
			return HierarchyGraph.empty();
		}
	}

	private HierarchyGraph buildGraph(VocabularySnapshot snapshot, long conceptId, int maxLevelsUp, int maxLevelsDown) {
		Long2ObjectMap<Concept> selected = conceptGraphQueryService.getConcepts(snapshot, Collections.singleton(conceptId));
		if (selected.isEmpty()) {
			return HierarchyGraph.empty();
		}

		Long2IntMap ancestorSeparation = minimumSeparation(snapshot.conceptAncestors()
				.where(ConceptAncestor.Fields.DESCENDANT_CONCEPT_ID, conceptId)
				.execute(), conceptId, true);
		Long2IntMap descendantSeparation = minimumSeparation(snapshot.conceptAncestors()
				.where(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, conceptId)
				.execute(), conceptId, false);

		Long2IntMap levels = new Long2IntOpenHashMap();
		levels.put(conceptId, 0);
		for (Long2IntMap.Entry entry : descendantSeparation.long2IntEntrySet()) {
			if (entry.getIntValue() <= maxLevelsDown) {
				levels.put(entry.getLongKey(), entry.getIntValue());
			}
		}
		// Ancestor placement wins when the closure lists a concept on both sides
		for (Long2IntMap.Entry entry : ancestorSeparation.long2IntEntrySet()) {
			if (entry.getIntValue() <= maxLevelsUp) {
				levels.put(entry.getLongKey(), -entry.getIntValue());
			} else {
				levels.remove(entry.getLongKey());
			}
		}

		Long2ObjectMap<Concept> concepts = conceptGraphQueryService.getConcepts(snapshot, levels.keySet());
		List<HierarchyGraph.Node> nodes = new ArrayList<>();
		int displayedAncestors = 0;
		int displayedDescendants = 0;
		for (Concept concept : concepts.values()) {
			long id = concept.getConceptId();
			Category category;
			if (id == conceptId) {
				category = Category.SELECTED;
			} else if (ancestorSeparation.containsKey(id)) {
				category = Category.ANCESTOR;
				displayedAncestors++;
			} else if (descendantSeparation.containsKey(id)) {
				category = Category.DESCENDANT;
				displayedDescendants++;
			} else {
				category = Category.OTHER;
			}
			nodes.add(new HierarchyGraph.Node(id, label(concept.getConceptName()), levels.get(id), category,
					concept.getConceptName(), concept.getVocabularyId(), concept.getConceptCode(), concept.getConceptClassId()));
		}
		nodes.sort(Comparator.comparingInt(HierarchyGraph.Node::level).thenComparingLong(HierarchyGraph.Node::id));

		List<HierarchyGraph.Edge> edges = findEdges(snapshot, concepts.keySet());

		HierarchyGraph.Stats stats = new HierarchyGraph.Stats(ancestorSeparation.size(), descendantSeparation.size(),
				displayedAncestors, displayedDescendants);
		return new HierarchyGraph(nodes, edges, stats);
	}

	private List<HierarchyGraph.Edge> findEdges(VocabularySnapshot snapshot, Set<Long> nodeIds) {
		Map<String, RelationshipType> hierarchicalTypes = hierarchyDirectionService.getHierarchicalRelationshipTypes(snapshot);
		if (hierarchicalTypes.isEmpty() || nodeIds.size() < 2) {
			return new ArrayList<>();
		}
		Set<HierarchyGraph.Edge> edges = new LinkedHashSet<>();
		for (ConceptRelationship relationship : snapshot.conceptRelationships()
				.whereIn(ConceptRelationship.Fields.CONCEPT_ID_1, nodeIds)
				.whereIn(ConceptRelationship.Fields.CONCEPT_ID_2, nodeIds)
				.whereIn(ConceptRelationship.Fields.RELATIONSHIP_ID, hierarchicalTypes.keySet())
				.execute()) {
			if (relationship.getConceptId1() == relationship.getConceptId2()) {
				continue;
			}
			HierarchyDirectionService.HierarchyEdge edge =
					hierarchyDirectionService.orient(relationship, hierarchicalTypes.get(relationship.getRelationshipId()));
			edges.add(new HierarchyGraph.Edge(edge.parentId(), edge.childId()));
		}
		List<HierarchyGraph.Edge> sorted = new ArrayList<>(edges);
		sorted.sort(Comparator.comparingLong(HierarchyGraph.Edge::from).thenComparingLong(HierarchyGraph.Edge::to));
		return sorted;
	}

	/**
	 * Smallest separation per related concept. Rows without a separation and the concept's own row are ignored.
	 */
	private static Long2IntMap minimumSeparation(List<ConceptAncestor> rows, long conceptId, boolean ancestors) {
		Long2IntMap separation = new Long2IntOpenHashMap();
		for (ConceptAncestor row : rows) {
			long otherId = ancestors ? row.getAncestorConceptId() : row.getDescendantConceptId();
			Integer minLevels = row.getMinLevelsOfSeparation();
			if (otherId == conceptId || minLevels == null) {
				continue;
			}
			if (!separation.containsKey(otherId) || minLevels < separation.get(otherId)) {
				separation.put(otherId, minLevels.intValue());
			}
		}
		return separation;
	}

	static String label(String conceptName) {
		if (conceptName == null) {
			return "";
		}
		if (conceptName.length() > MAX_LABEL_LENGTH) {
			return conceptName.substring(0, TRUNCATED_LABEL_LENGTH) + "...";
		}
		return conceptName;
	}
}
