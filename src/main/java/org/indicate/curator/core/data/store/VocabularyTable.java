package org.indicate.curator.core.data.store;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.indicate.curator.core.data.domain.*;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Schema of one vocabulary table: where it lives, which columns it has and how a raw row becomes a domain object.
 *
 * @param <T> row type
 */
public final class VocabularyTable<T> {

	public static final VocabularyTable<Concept> CONCEPT = new VocabularyTable<>("concept", true,
			ImmutableMap.<String, Function<Concept, Object>>builder()
					.put(Concept.Fields.CONCEPT_ID, Concept::getConceptId)
					.put(Concept.Fields.CONCEPT_NAME, Concept::getConceptName)
					.put(Concept.Fields.DOMAIN_ID, Concept::getDomainId)
					.put(Concept.Fields.VOCABULARY_ID, Concept::getVocabularyId)
					.put(Concept.Fields.CONCEPT_CLASS_ID, Concept::getConceptClassId)
					.put(Concept.Fields.STANDARD_CONCEPT, Concept::getStandardConcept)
					.put(Concept.Fields.CONCEPT_CODE, Concept::getConceptCode)
					.put(Concept.Fields.VALID_START_DATE, Concept::getValidStartDate)
					.put(Concept.Fields.VALID_END_DATE, Concept::getValidEndDate)
					.put(Concept.Fields.INVALID_REASON, Concept::getInvalidReason)
					.build(),
			ImmutableSet.of(Concept.Fields.CONCEPT_ID, Concept.Fields.VOCABULARY_ID, Concept.Fields.CONCEPT_CLASS_ID),
			row -> new Concept(
					row.getRequiredLong(Concept.Fields.CONCEPT_ID),
					row.getString(Concept.Fields.CONCEPT_NAME),
					row.getString(Concept.Fields.DOMAIN_ID),
					row.getString(Concept.Fields.VOCABULARY_ID),
					row.getString(Concept.Fields.CONCEPT_CLASS_ID),
					row.getString(Concept.Fields.STANDARD_CONCEPT),
					row.getString(Concept.Fields.CONCEPT_CODE),
					row.getDate(Concept.Fields.VALID_START_DATE),
					row.getDate(Concept.Fields.VALID_END_DATE),
					row.getString(Concept.Fields.INVALID_REASON)));

	public static final VocabularyTable<ConceptRelationship> CONCEPT_RELATIONSHIP = new VocabularyTable<>("concept_relationship", true,
			ImmutableMap.<String, Function<ConceptRelationship, Object>>builder()
					.put(ConceptRelationship.Fields.CONCEPT_ID_1, ConceptRelationship::getConceptId1)
					.put(ConceptRelationship.Fields.CONCEPT_ID_2, ConceptRelationship::getConceptId2)
					.put(ConceptRelationship.Fields.RELATIONSHIP_ID, ConceptRelationship::getRelationshipId)
					.put(ConceptRelationship.Fields.VALID_START_DATE, ConceptRelationship::getValidStartDate)
					.put(ConceptRelationship.Fields.VALID_END_DATE, ConceptRelationship::getValidEndDate)
					.put(ConceptRelationship.Fields.INVALID_REASON, ConceptRelationship::getInvalidReason)
					.build(),
			ImmutableSet.of(ConceptRelationship.Fields.CONCEPT_ID_1, ConceptRelationship.Fields.CONCEPT_ID_2),
			row -> new ConceptRelationship(
					row.getRequiredLong(ConceptRelationship.Fields.CONCEPT_ID_1),
					row.getRequiredLong(ConceptRelationship.Fields.CONCEPT_ID_2),
					row.getString(ConceptRelationship.Fields.RELATIONSHIP_ID),
					row.getDate(ConceptRelationship.Fields.VALID_START_DATE),
					row.getDate(ConceptRelationship.Fields.VALID_END_DATE),
					row.getString(ConceptRelationship.Fields.INVALID_REASON)));

	public static final VocabularyTable<ConceptAncestor> CONCEPT_ANCESTOR = new VocabularyTable<>("concept_ancestor", true,
			ImmutableMap.<String, Function<ConceptAncestor, Object>>builder()
					.put(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, ConceptAncestor::getAncestorConceptId)
					.put(ConceptAncestor.Fields.DESCENDANT_CONCEPT_ID, ConceptAncestor::getDescendantConceptId)
					.put(ConceptAncestor.Fields.MIN_LEVELS_OF_SEPARATION, ConceptAncestor::getMinLevelsOfSeparation)
					.put(ConceptAncestor.Fields.MAX_LEVELS_OF_SEPARATION, ConceptAncestor::getMaxLevelsOfSeparation)
					.build(),
			ImmutableSet.of(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID, ConceptAncestor.Fields.DESCENDANT_CONCEPT_ID),
			row -> new ConceptAncestor(
					row.getRequiredLong(ConceptAncestor.Fields.ANCESTOR_CONCEPT_ID),
					row.getRequiredLong(ConceptAncestor.Fields.DESCENDANT_CONCEPT_ID),
					row.getInteger(ConceptAncestor.Fields.MIN_LEVELS_OF_SEPARATION),
					row.getInteger(ConceptAncestor.Fields.MAX_LEVELS_OF_SEPARATION)));

	public static final VocabularyTable<ConceptSynonym> CONCEPT_SYNONYM = new VocabularyTable<>("concept_synonym", false,
			ImmutableMap.<String, Function<ConceptSynonym, Object>>builder()
					.put(ConceptSynonym.Fields.CONCEPT_ID, ConceptSynonym::getConceptId)
					.put(ConceptSynonym.Fields.CONCEPT_SYNONYM_NAME, ConceptSynonym::getConceptSynonymName)
					.put(ConceptSynonym.Fields.LANGUAGE_CONCEPT_ID, ConceptSynonym::getLanguageConceptId)
					.build(),
			ImmutableSet.of(ConceptSynonym.Fields.CONCEPT_ID),
			row -> new ConceptSynonym(
					row.getRequiredLong(ConceptSynonym.Fields.CONCEPT_ID),
					row.getString(ConceptSynonym.Fields.CONCEPT_SYNONYM_NAME),
					row.getLong(ConceptSynonym.Fields.LANGUAGE_CONCEPT_ID)));

	public static final VocabularyTable<RelationshipType> RELATIONSHIP = new VocabularyTable<>("relationship", false,
			ImmutableMap.<String, Function<RelationshipType, Object>>builder()
					.put(RelationshipType.Fields.RELATIONSHIP_ID, RelationshipType::getRelationshipId)
					.put(RelationshipType.Fields.RELATIONSHIP_NAME, RelationshipType::getRelationshipName)
					.put(RelationshipType.Fields.IS_HIERARCHICAL, RelationshipType::isHierarchical)
					.put(RelationshipType.Fields.DEFINES_ANCESTRY, RelationshipType::isDefinesAncestry)
					.put(RelationshipType.Fields.REVERSE_RELATIONSHIP_ID, RelationshipType::getReverseRelationshipId)
					.put(RelationshipType.Fields.RELATIONSHIP_CONCEPT_ID, RelationshipType::getRelationshipConceptId)
					.build(),
			ImmutableSet.of(RelationshipType.Fields.RELATIONSHIP_ID),
			row -> new RelationshipType(
					row.getString(RelationshipType.Fields.RELATIONSHIP_ID),
					row.getString(RelationshipType.Fields.RELATIONSHIP_NAME),
					row.getBoolean(RelationshipType.Fields.IS_HIERARCHICAL),
					row.getBoolean(RelationshipType.Fields.DEFINES_ANCESTRY),
					row.getString(RelationshipType.Fields.REVERSE_RELATIONSHIP_ID),
					row.getLong(RelationshipType.Fields.RELATIONSHIP_CONCEPT_ID)));

	public static final List<VocabularyTable<?>> ALL = ImmutableList.of(CONCEPT, CONCEPT_RELATIONSHIP, CONCEPT_ANCESTOR, CONCEPT_SYNONYM, RELATIONSHIP);

	private final String tableName;
	private final boolean required;
	private final Map<String, Function<T, Object>> columns;
	private final Set<String> indexedColumns;
	private final Function<RowValues, T> rowFactory;

	private VocabularyTable(String tableName, boolean required, Map<String, Function<T, Object>> columns,
			Set<String> indexedColumns, Function<RowValues, T> rowFactory) {
		this.tableName = tableName;
		this.required = required;
		this.columns = columns;
		this.indexedColumns = indexedColumns;
		this.rowFactory = rowFactory;
	}

	public T createRow(RowValues values) {
		return rowFactory.apply(values);
	}

	/**
	 * Reads a column of a row, throwing if the column is not part of this table.
	 */
	public Object getValue(T row, String column) {
		return getColumnAccessor(column).apply(row);
	}

	public Function<T, Object> getColumnAccessor(String column) {
		Function<T, Object> accessor = columns.get(column);
		if (accessor == null) {
			throw new IllegalArgumentException("Table " + tableName + " has no column '" + column + "'.");
		}
		return accessor;
	}

	public String getTableName() {
		return tableName;
	}

	/**
	 * Athena export file name, for example CONCEPT_ANCESTOR.csv.
	 */
	public String getFileName() {
		return tableName.toUpperCase() + ".csv";
	}

	public boolean isRequired() {
		return required;
	}

	public Set<String> getColumnNames() {
		return columns.keySet();
	}

	public Set<String> getIndexedColumns() {
		return indexedColumns;
	}

	@Override
	public String toString() {
		return tableName;
	}
}
