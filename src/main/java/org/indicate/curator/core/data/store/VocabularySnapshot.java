package org.indicate.curator.core.data.store;

import org.indicate.curator.core.data.domain.*;

import java.util.Map;

/**
 * Read-only view of one loaded vocabulary. Safe for any number of concurrent readers.
 */
public interface VocabularySnapshot extends AutoCloseable {

	<T> TableQuery<T> query(VocabularyTable<T> table);

	default TableQuery<Concept> concepts() {
		return query(VocabularyTable.CONCEPT);
	}

	default TableQuery<ConceptRelationship> conceptRelationships() {
		return query(VocabularyTable.CONCEPT_RELATIONSHIP);
	}

	default TableQuery<ConceptAncestor> conceptAncestors() {
		return query(VocabularyTable.CONCEPT_ANCESTOR);
	}

	default TableQuery<ConceptSynonym> conceptSynonyms() {
		return query(VocabularyTable.CONCEPT_SYNONYM);
	}

	default TableQuery<RelationshipType> relationshipTypes() {
		return query(VocabularyTable.RELATIONSHIP);
	}

	/**
	 * Folder path or JDBC url the snapshot was opened from.
	 */
	String getLocation();

	/**
	 * Row count per table name, -1 where the count is not known.
	 */
	Map<String, Long> getRowCounts();

	/**
	 * Releases connections held by the snapshot. Queries fail once it is closed.
	 */
	@Override
	default void close() {
	}

}
