package org.indicate.curator.core.data.services.pojo;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded node and edge view around one concept. Edges point from parent to child.
 */
public class HierarchyGraph {

	public enum Category {
		SELECTED("selected"),
		ANCESTOR("ancestor"),
		DESCENDANT("descendant"),
		OTHER("other");

		private final String value;

		Category(String value) {
			this.value = value;
		}

		@JsonValue
		public String getValue() {
			return value;
		}
	}

	public record Node(long id, String label, int level, Category category,
			String conceptName, String vocabularyId, String conceptCode, String conceptClassId) {
	}

	public record Edge(long from, long to) {
	}

	public record Stats(int totalAncestors, int totalDescendants, int displayedAncestors, int displayedDescendants) {
	}

	private final List<Node> nodes;
	private final List<Edge> edges;
	private final Stats stats;

	public HierarchyGraph(List<Node> nodes, List<Edge> edges, Stats stats) {
		this.nodes = nodes;
		this.edges = edges;
		this.stats = stats;
	}

	public static HierarchyGraph empty() {
		return new HierarchyGraph(new ArrayList<>(), new ArrayList<>(), new Stats(0, 0, 0, 0));
	}

	public List<Node> getNodes() {
		return nodes;
	}

	public List<Edge> getEdges() {
		return edges;
	}

	public Stats getStats() {
		return stats;
	}
}
