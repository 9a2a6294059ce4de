package org.indicate.curator.core.data.store;

import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects filters for a {@link TableQuery}. Subclasses decide how the filters are evaluated.
 */
abstract class AbstractTableQuery<T> implements TableQuery<T> {

	enum Operator {
		EQUALS,
		IN,
		IS_NULL,
		EQUALS_IGNORE_CASE
	}

	record Filter(String column, Operator operator, Object value, Set<Object> values) {
	}

	protected final VocabularyTable<T> table;
	protected final List<Filter> filters = new ArrayList<>();
	protected boolean matchesNothing;

	AbstractTableQuery(VocabularyTable<T> table) {
		this.table = table;
	}

	@Override
	public TableQuery<T> where(String column, Object value) {
		table.getColumnAccessor(column);
		Preconditions.checkNotNull(value, "Use whereNull to match an empty column.");
		filters.add(new Filter(column, Operator.EQUALS, normalise(value), null));
		return this;
	}

	@Override
	public TableQuery<T> whereIn(String column, Collection<?> values) {
		table.getColumnAccessor(column);
		Set<Object> normalised = new LinkedHashSet<>();
		for (Object value : values) {
			if (value != null) {
				normalised.add(normalise(value));
			}
		}
		if (normalised.isEmpty()) {
			matchesNothing = true;
		}
		filters.add(new Filter(column, Operator.IN, null, normalised));
		return this;
	}

	@Override
	public TableQuery<T> whereNull(String column) {
		table.getColumnAccessor(column);
		filters.add(new Filter(column, Operator.IS_NULL, null, null));
		return this;
	}

	@Override
	public TableQuery<T> whereIgnoreCase(String column, String value) {
		table.getColumnAccessor(column);
		Preconditions.checkNotNull(value, "Use whereNull to match an empty column.");
		filters.add(new Filter(column, Operator.EQUALS_IGNORE_CASE, value, null));
		return this;
	}

	@Override
	public List<T> execute() {
		if (matchesNothing) {
			return new ArrayList<>();
		}
		return doExecute();
	}

	@Override
	public <V> Set<V> selectDistinct(String column, Class<V> type) {
		table.getColumnAccessor(column);
		if (matchesNothing) {
			return new LinkedHashSet<>();
		}
		return doSelectDistinct(column, type);
	}

	@Override
	public <V> Map<V, Long> countBy(String column, Class<V> type) {
		table.getColumnAccessor(column);
		if (matchesNothing) {
			return new HashMap<>();
		}
		return doCountBy(column, type);
	}

	protected abstract List<T> doExecute();

	protected abstract <V> Set<V> doSelectDistinct(String column, Class<V> type);

	protected abstract <V> Map<V, Long> doCountBy(String column, Class<V> type);

	/**
	 * Integral numbers compare as longs whatever boxed type the caller used.
	 */
	static Object normalise(Object value) {
		if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return ((Number) value).longValue();
		}
		return value;
	}

	@SuppressWarnings("unchecked")
	static <V> V convert(Object value, Class<V> type) {
		if (value == null) {
			return null;
		}
		if (type == Long.class && value instanceof Number number) {
			return (V) Long.valueOf(number.longValue());
		}
		if (type == Integer.class && value instanceof Number number) {
			return (V) Integer.valueOf(number.intValue());
		}
		if (type == String.class) {
			return (V) value.toString();
		}
		return type.cast(value);
	}
}
