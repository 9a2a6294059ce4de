package org.indicate.curator.core.data.store;

import org.apache.commons.csv.CSVRecord;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Typed reads over one raw row, whether it came from a tab-delimited file or a JDBC result set.
 */
public abstract class RowValues {

	private static final DateTimeFormatter VOCABULARY_DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

	protected abstract Object get(String column);

	public static RowValues of(CSVRecord record) {
		return new RowValues() {
			@Override
			protected Object get(String column) {
				return record.isMapped(column) ? record.get(column) : null;
			}
		};
	}

	public static RowValues of(ResultSet resultSet) throws SQLException {
		ResultSetMetaData metaData = resultSet.getMetaData();
		Map<String, Object> values = new HashMap<>();
		for (int i = 1; i <= metaData.getColumnCount(); i++) {
			values.put(metaData.getColumnLabel(i).toLowerCase(Locale.ROOT), resultSet.getObject(i));
		}
		return new RowValues() {
			@Override
			protected Object get(String column) {
				return values.get(column);
			}
		};
	}

	public String getString(String column) {
		Object value = get(column);
		if (value == null) {
			return null;
		}
		String string = value.toString();
		return string.isEmpty() ? null : string;
	}

	public Long getLong(String column) {
		Object value = get(column);
		if (value instanceof Number number) {
			return number.longValue();
		}
		String string = getString(column);
		return string != null ? Long.parseLong(string.trim()) : null;
	}

	public long getRequiredLong(String column) {
		Long value = getLong(column);
		if (value == null) {
			throw new IllegalArgumentException("Column " + column + " is empty.");
		}
		return value;
	}

	public Integer getInteger(String column) {
		Long value = getLong(column);
		return value != null ? value.intValue() : null;
	}

	public boolean getBoolean(String column) {
		Object value = get(column);
		if (value instanceof Boolean bool) {
			return bool;
		}
		if (value instanceof Number number) {
			return number.intValue() != 0;
		}
		String string = getString(column);
		return string != null && ("1".equals(string.trim()) || "true".equalsIgnoreCase(string.trim()));
	}

	public LocalDate getDate(String column) {
		Object value = get(column);
		if (value instanceof LocalDate localDate) {
			return localDate;
		}
		if (value instanceof Date date) {
			return date.toLocalDate();
		}
		String string = getString(column);
		if (string == null) {
			return null;
		}
		try {
			return LocalDate.parse(string.trim(), VOCABULARY_DATE_FORMAT);
		} catch (DateTimeParseException e) {
			return LocalDate.parse(string.trim());
		}
	}
}
