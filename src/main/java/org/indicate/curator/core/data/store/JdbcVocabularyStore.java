package org.indicate.curator.core.data.store;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.jdbc.support.MetaDataAccessException;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.util.*;

/**
 * Opens a database that already holds the vocabulary tables, for example a DuckDB file built from an Athena download.
 * Rows are never cached; every query runs against the database through a connection pool owned by the snapshot.
 */
@Component
public class JdbcVocabularyStore implements VocabularyStore {

	private static final String DUCKDB_URL_PREFIX = "jdbc:duckdb:";

	@Value("${vocabulary.duckdb-read-only:true}")
	private boolean duckDbReadOnly = true;

	@Value("${vocabulary.jdbc-pool-size:5}")
	private int poolSize = 5;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	@Override
	public VocabularySnapshot open(String jdbcUrl) throws VocabularyLoadException {
		HikariDataSource dataSource = new HikariDataSource();
		dataSource.setPoolName("vocabulary");
		dataSource.setJdbcUrl(jdbcUrl);
		dataSource.setMaximumPoolSize(Math.max(1, poolSize));
		if (duckDbReadOnly && jdbcUrl.startsWith(DUCKDB_URL_PREFIX)) {
			dataSource.addDataSourceProperty("duckdb.read_only", "true");
		}

		try {
			Set<VocabularyTable<?>> availableTables = findAvailableTables(dataSource, jdbcUrl);
			logger.info("Opened vocabulary database {}", jdbcUrl);
			return new JdbcVocabularySnapshot(jdbcUrl, dataSource, availableTables);
		} catch (VocabularyLoadException e) {
			dataSource.close();
			throw e;
		}
	}

	private Set<VocabularyTable<?>> findAvailableTables(HikariDataSource dataSource, String jdbcUrl) throws VocabularyLoadException {
		Set<String> presentTables;
		try {
			presentTables = JdbcUtils.extractDatabaseMetaData(dataSource, metaData -> {
				Set<String> names = new HashSet<>();
				try (ResultSet tables = metaData.getTables(null, null, "%", null)) {
					while (tables.next()) {
						names.add(tables.getString("TABLE_NAME").toLowerCase(Locale.ROOT));
					}
				}
				return names;
			});
		} catch (MetaDataAccessException | RuntimeException e) {
			// Hikari reports an unusable url or driver unchecked
			throw new VocabularyLoadException("Failed to open vocabulary database " + jdbcUrl + ": " + e.getMessage(), e);
		}

		List<String> missing = new ArrayList<>();
		Set<VocabularyTable<?>> availableTables = new HashSet<>();
		for (VocabularyTable<?> table : VocabularyTable.ALL) {
			if (presentTables.contains(table.getTableName())) {
				availableTables.add(table);
			} else if (table.isRequired()) {
				missing.add(table.getTableName());
			} else {
				logger.info("Optional vocabulary table {} not found, table will be empty.", table.getTableName());
			}
		}
		if (!missing.isEmpty()) {
			throw new VocabularyLoadException("Missing required vocabulary tables in " + jdbcUrl + ": " + String.join(", ", missing));
		}
		return availableTables;
	}

	static class JdbcVocabularySnapshot implements VocabularySnapshot {

		private static final Logger logger = LoggerFactory.getLogger(JdbcVocabularySnapshot.class);

		private final String location;
		private final HikariDataSource dataSource;
		private final NamedParameterJdbcTemplate jdbcTemplate;
		private final Set<VocabularyTable<?>> availableTables;

		JdbcVocabularySnapshot(String location, HikariDataSource dataSource, Set<VocabularyTable<?>> availableTables) {
			this.location = location;
			this.dataSource = dataSource;
			this.jdbcTemplate = new NamedParameterJdbcTemplate(dataSource);
			this.availableTables = availableTables;
		}

		@Override
		public <T> TableQuery<T> query(VocabularyTable<T> table) {
			if (!availableTables.contains(table)) {
				return InMemoryTable.empty(table).query();
			}
			return new JdbcTableQuery<>(table, jdbcTemplate);
		}

		@Override
		public String getLocation() {
			return location;
		}

		@Override
		public Map<String, Long> getRowCounts() {
			Map<String, Long> counts = new LinkedHashMap<>();
			for (VocabularyTable<?> table : VocabularyTable.ALL) {
				long count = 0;
				if (availableTables.contains(table)) {
					try {
						Long result = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table.getTableName(), new MapSqlParameterSource(), Long.class);
						count = result != null ? result : 0;
					} catch (DataAccessException e) {
						logger.warn("Failed to count rows of {}", table.getTableName(), e);
						count = -1;
					}
				}
				counts.put(table.getTableName(), count);
			}
			return counts;
		}

		@Override
		public void close() {
			if (!dataSource.isClosed()) {
				dataSource.close();
				logger.info("Closed connection pool of vocabulary database {}", location);
			}
		}

		boolean isClosed() {
			return dataSource.isClosed();
		}
	}
}
