package org.indicate.curator.rest.pojo;

/**
 * Exactly one of folder or jdbcUrl must be set.
 */
public class VocabularyLoadRequest {

	private String folder;
	private String jdbcUrl;

	public String getFolder() {
		return folder;
	}

	public void setFolder(String folder) {
		this.folder = folder;
	}

	public String getJdbcUrl() {
		return jdbcUrl;
	}

	public void setJdbcUrl(String jdbcUrl) {
		this.jdbcUrl = jdbcUrl;
	}
}
