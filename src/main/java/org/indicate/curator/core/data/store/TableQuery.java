package org.indicate.curator.core.data.store;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Filter-before-materialize access to one vocabulary table.
 * Filters are combined with AND and are pushed down to the backing store, so only matching rows
 * are ever loaded into memory.
 *
 * @param <T> row type of the table
 */
public interface TableQuery<T> {

	TableQuery<T> where(String column, Object value);

	/**
	 * Restricts the column to any of the given values. An empty collection matches nothing.
	 */
	TableQuery<T> whereIn(String column, Collection<?> values);

	TableQuery<T> whereNull(String column);

	TableQuery<T> whereIgnoreCase(String column, String value);

	List<T> execute();

	/**
	 * Projects a single column of the matching rows.
	 */
	<V> Set<V> selectDistinct(String column, Class<V> type);

	/**
	 * Number of matching rows per value of the column. Counting is done by the backing store, rows are not loaded.
	 */
	<V> Map<V, Long> countBy(String column, Class<V> type);

}
