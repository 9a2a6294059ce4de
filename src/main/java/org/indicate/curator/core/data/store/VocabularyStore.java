package org.indicate.curator.core.data.store;

/**
 * Opens a vocabulary from some location and hands back a queryable snapshot.
 */
public interface VocabularyStore {

	/**
	 * @throws VocabularyLoadException if a required table is missing or cannot be read.
	 */
	VocabularySnapshot open(String location) throws VocabularyLoadException;

}
