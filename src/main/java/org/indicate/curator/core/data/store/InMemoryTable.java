package org.indicate.curator.core.data.store;

import com.google.common.collect.ImmutableList;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Immutable rows of one table with a hash index per indexed column.
 */
public class InMemoryTable<T> {

	private final VocabularyTable<T> table;
	private final List<T> rows;
	private final Map<String, Map<Object, List<T>>> indexes;

	public InMemoryTable(VocabularyTable<T> table, List<T> rows) {
		this.table = table;
		this.rows = ImmutableList.copyOf(rows);
		this.indexes = new HashMap<>();
		for (String column : table.getIndexedColumns()) {
			Function<T, Object> accessor = table.getColumnAccessor(column);
			Map<Object, List<T>> index = new Object2ObjectOpenHashMap<>();
			for (T row : this.rows) {
				Object key = AbstractTableQuery.normalise(accessor.apply(row));
				if (key != null) {
					index.computeIfAbsent(key, k -> new ArrayList<>(1)).add(row);
				}
			}
			indexes.put(column, index);
		}
	}

	public static <T> InMemoryTable<T> empty(VocabularyTable<T> table) {
		return new InMemoryTable<>(table, Collections.emptyList());
	}

	public TableQuery<T> query() {
		return new InMemoryTableQuery<>(this);
	}

	boolean isIndexed(String column) {
		return indexes.containsKey(column);
	}

	List<T> lookup(String column, Collection<Object> keys) {
		Map<Object, List<T>> index = indexes.get(column);
		if (keys.size() == 1) {
			return index.getOrDefault(keys.iterator().next(), Collections.emptyList());
		}
		List<T> matches = new ArrayList<>();
		for (Object key : keys) {
			matches.addAll(index.getOrDefault(key, Collections.emptyList()));
		}
		return matches;
	}

	VocabularyTable<T> getTable() {
		return table;
	}

	List<T> getRows() {
		return rows;
	}

	public int size() {
		return rows.size();
	}
}
