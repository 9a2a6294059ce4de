package org.indicate.curator.core.data.store;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

import static java.util.stream.Collectors.toList;

class InMemoryTableQuery<T> extends AbstractTableQuery<T> {

	private final InMemoryTable<T> inMemoryTable;

	InMemoryTableQuery(InMemoryTable<T> inMemoryTable) {
		super(inMemoryTable.getTable());
		this.inMemoryTable = inMemoryTable;
	}

	@Override
	protected List<T> doExecute() {
		// Drive from the first equality or membership filter on an indexed column, scan the rest
		Filter driving = null;
		for (Filter filter : filters) {
			if ((filter.operator() == Operator.EQUALS || filter.operator() == Operator.IN) && inMemoryTable.isIndexed(filter.column())) {
				driving = filter;
				break;
			}
		}

		List<T> candidates;
		if (driving != null) {
			candidates = inMemoryTable.lookup(driving.column(),
					driving.operator() == Operator.IN ? driving.values() : Collections.singleton(driving.value()));
		} else {
			candidates = inMemoryTable.getRows();
		}

		Predicate<T> predicate = row -> true;
		for (Filter filter : filters) {
			if (filter != driving) {
				predicate = predicate.and(matcher(filter));
			}
		}
		return candidates.stream().filter(predicate).collect(toList());
	}

	@Override
	protected <V> Set<V> doSelectDistinct(String column, Class<V> type) {
		Set<V> values = new LinkedHashSet<>();
		for (T row : doExecute()) {
			V value = convert(table.getValue(row, column), type);
			if (value != null) {
				values.add(value);
			}
		}
		return values;
	}

	@Override
	protected <V> Map<V, Long> doCountBy(String column, Class<V> type) {
		Map<V, Long> counts = new HashMap<>();
		for (T row : doExecute()) {
			V value = convert(table.getValue(row, column), type);
			if (value != null) {
				counts.merge(value, 1L, Long::sum);
			}
		}
		return counts;
	}

	private Predicate<T> matcher(Filter filter) {
		String column = filter.column();
		return switch (filter.operator()) {
			case EQUALS -> row -> Objects.equals(normalise(table.getValue(row, column)), filter.value());
			case IN -> row -> filter.values().contains(normalise(table.getValue(row, column)));
			case IS_NULL -> row -> table.getValue(row, column) == null;
			case EQUALS_IGNORE_CASE -> row -> {
				Object value = table.getValue(row, column);
				return value != null && value.toString().equalsIgnoreCase((String) filter.value());
			};
		};
	}
}
