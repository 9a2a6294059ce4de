package org.indicate.curator.core.data.services.pojo;

import com.fasterxml.jackson.annotation.JsonValue;
import org.indicate.curator.core.data.domain.ConceptSetItem;

import java.util.ArrayList;
import java.util.List;

public class OptimizationResult {

	public enum Status {
		OK("ok"),
		UNAVAILABLE("unavailable");

		private final String value;

		Status(String value) {
			this.value = value;
		}

		@JsonValue
		public String getValue() {
			return value;
		}
	}

	public enum Strategy {
		NONE("none"),
		BOTTOM_UP("bottom_up"),
		TOP_DOWN("top_down");

		private final String value;

		Strategy(String value) {
			this.value = value;
		}

		@JsonValue
		public String getValue() {
			return value;
		}
	}

	private final Status status;
	private final Strategy strategy;
	private final List<ConceptSetItem> optimizedItems;
	private final List<ConceptSetItem> removedItems;
	private final List<ConceptSetItem> addedItems;
	private final int passes;
	private final boolean iterationLimitReached;

	public OptimizationResult(Status status, Strategy strategy, List<ConceptSetItem> optimizedItems,
			List<ConceptSetItem> removedItems, List<ConceptSetItem> addedItems, int passes, boolean iterationLimitReached) {
		this.status = status;
		this.strategy = strategy;
		this.optimizedItems = optimizedItems;
		this.removedItems = removedItems;
		this.addedItems = addedItems;
		this.passes = passes;
		this.iterationLimitReached = iterationLimitReached;
	}

	public static OptimizationResult unchanged(Status status, List<ConceptSetItem> items, int passes) {
		return new OptimizationResult(status, Strategy.NONE, items, new ArrayList<>(), new ArrayList<>(), passes, false);
	}

	public Status getStatus() {
		return status;
	}

	public Strategy getStrategy() {
		return strategy;
	}

	public List<ConceptSetItem> getOptimizedItems() {
		return optimizedItems;
	}

	public List<ConceptSetItem> getRemovedItems() {
		return removedItems;
	}

	public List<ConceptSetItem> getAddedItems() {
		return addedItems;
	}

	public int getRemovedCount() {
		return removedItems.size();
	}

	public int getPasses() {
		return passes;
	}

	public boolean isIterationLimitReached() {
		return iterationLimitReached;
	}
}
