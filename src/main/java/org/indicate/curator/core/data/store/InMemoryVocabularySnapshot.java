package org.indicate.curator.core.data.store;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

public class InMemoryVocabularySnapshot implements VocabularySnapshot {

	private final String location;
	private final Map<VocabularyTable<?>, InMemoryTable<?>> tables;

	public InMemoryVocabularySnapshot(String location, Collection<InMemoryTable<?>> loadedTables) {
		this.location = location;
		this.tables = new HashMap<>();
		for (InMemoryTable<?> loadedTable : loadedTables) {
			tables.put(loadedTable.getTable(), loadedTable);
		}
		for (VocabularyTable<?> table : VocabularyTable.ALL) {
			if (!tables.containsKey(table)) {
				tables.put(table, InMemoryTable.empty(table));
			}
		}
	}

	@Override
	@SuppressWarnings("unchecked")
	public <T> TableQuery<T> query(VocabularyTable<T> table) {
		return ((InMemoryTable<T>) tables.get(table)).query();
	}

	@Override
	public String getLocation() {
		return location;
	}

	@Override
	public Map<String, Long> getRowCounts() {
		Map<String, Long> counts = new LinkedHashMap<>();
		for (VocabularyTable<?> table : VocabularyTable.ALL) {
			counts.put(table.getTableName(), (long) tables.get(table).size());
		}
		return counts;
	}
}
