package org.indicate.curator.core.data.store;

import com.google.common.collect.Lists;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Translates the collected filters into a parameterized WHERE clause.
 */
class JdbcTableQuery<T> extends AbstractTableQuery<T> {

	// Keeps IN lists within the bind-parameter limits of common databases
	static final int MAX_IN_VALUES = 1_000;

	private final NamedParameterJdbcTemplate jdbcTemplate;

	JdbcTableQuery(VocabularyTable<T> table, NamedParameterJdbcTemplate jdbcTemplate) {
		super(table);
		this.jdbcTemplate = jdbcTemplate;
	}

	@Override
	protected List<T> doExecute() {
		RowMapper<T> rowMapper = (resultSet, rowNum) -> table.createRow(RowValues.of(resultSet));
		List<T> rows = new ArrayList<>();
		for (List<Filter> filterBatch : splitLargeInFilters()) {
			MapSqlParameterSource parameters = new MapSqlParameterSource();
			String sql = "SELECT * FROM " + table.getTableName() + whereClause(filterBatch, parameters);
			rows.addAll(jdbcTemplate.query(sql, parameters, rowMapper));
		}
		return rows;
	}

	@Override
	protected <V> Set<V> doSelectDistinct(String column, Class<V> type) {
		Set<V> values = new LinkedHashSet<>();
		for (List<Filter> filterBatch : splitLargeInFilters()) {
			MapSqlParameterSource parameters = new MapSqlParameterSource();
			String sql = "SELECT DISTINCT " + column + " FROM " + table.getTableName() + whereClause(filterBatch, parameters);
			for (Object value : jdbcTemplate.queryForList(sql, parameters, Object.class)) {
				V converted = convert(value, type);
				if (converted != null) {
					values.add(converted);
				}
			}
		}
		return values;
	}

	@Override
	protected <V> Map<V, Long> doCountBy(String column, Class<V> type) {
		Map<V, Long> counts = new HashMap<>();
		for (List<Filter> filterBatch : splitLargeInFilters()) {
			MapSqlParameterSource parameters = new MapSqlParameterSource();
			String sql = "SELECT " + column + ", COUNT(*) FROM " + table.getTableName() + whereClause(filterBatch, parameters) +
					" GROUP BY " + column;
			jdbcTemplate.query(sql, parameters, (RowCallbackHandler) resultSet -> {
				V value = convert(resultSet.getObject(1), type);
				if (value != null) {
					counts.merge(value, resultSet.getLong(2), Long::sum);
				}
			});
		}
		return counts;
	}

	/**
	 * One filter list per statement. Every oversized IN filter is partitioned, so a query with two of them
	 * runs once per combination of partitions. The batches never overlap, counts can be summed across them.
	 */
	List<List<Filter>> splitLargeInFilters() {
		List<List<Filter>> batches = new ArrayList<>();
		batches.add(filters);
		for (int i = 0; i < filters.size(); i++) {
			Filter filter = filters.get(i);
			if (filter.operator() != Operator.IN || filter.values().size() <= MAX_IN_VALUES) {
				continue;
			}
			List<List<Object>> partitions = Lists.partition(new ArrayList<>(filter.values()), MAX_IN_VALUES);
			List<List<Filter>> split = new ArrayList<>();
			for (List<Filter> batch : batches) {
				for (List<Object> partition : partitions) {
					List<Filter> partitioned = new ArrayList<>(batch);
					partitioned.set(i, new Filter(filter.column(), Operator.IN, null, new LinkedHashSet<>(partition)));
					split.add(partitioned);
				}
			}
			batches = split;
		}
		return batches;
	}

	private static String whereClause(List<Filter> filters, MapSqlParameterSource parameters) {
		StringBuilder where = new StringBuilder();
		for (int i = 0; i < filters.size(); i++) {
			Filter filter = filters.get(i);
			String parameter = "p" + i;
			where.append(i == 0 ? " WHERE " : " AND ");
			switch (filter.operator()) {
				case EQUALS -> {
					where.append(filter.column()).append(" = :").append(parameter);
					parameters.addValue(parameter, filter.value());
				}
				case IN -> {
					where.append(filter.column()).append(" IN (:").append(parameter).append(")");
					parameters.addValue(parameter, filter.values());
				}
				case IS_NULL -> where.append(filter.column()).append(" IS NULL");
				case EQUALS_IGNORE_CASE -> {
					where.append("LOWER(").append(filter.column()).append(") = LOWER(:").append(parameter).append(")");
					parameters.addValue(parameter, filter.value());
				}
			}
		}
		return where.toString();
	}
}
