package org.indicate.curator.core.data.services.pojo;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Date;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class VocabularyStatus {

	private final boolean available;
	private final String location;
	private final Date loadedAt;
	private final Map<String, Long> rowCounts;

	public VocabularyStatus(boolean available, String location, Date loadedAt, Map<String, Long> rowCounts) {
		this.available = available;
		this.location = location;
		this.loadedAt = loadedAt;
		this.rowCounts = rowCounts;
	}

	public static VocabularyStatus unavailable() {
		return new VocabularyStatus(false, null, null, null);
	}

	public boolean isAvailable() {
		return available;
	}

	public String getLocation() {
		return location;
	}

	public Date getLoadedAt() {
		return loadedAt;
	}

	public Map<String, Long> getRowCounts() {
		return rowCounts;
	}
}
