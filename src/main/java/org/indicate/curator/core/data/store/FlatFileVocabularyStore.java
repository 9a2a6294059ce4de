package org.indicate.curator.core.data.store;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.indicate.curator.core.util.TimerUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Loads the tab-delimited Athena export files of a folder into memory, one file per task.
 */
@Component
public class FlatFileVocabularyStore implements VocabularyStore {

	static final CSVFormat ATHENA_FORMAT = CSVFormat.TDF
			.withHeader()
			.withSkipHeaderRecord()
			.withIgnoreHeaderCase()
			.withQuote(null);

	@Autowired
	private ExecutorService taskExecutor;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	@Override
	public VocabularySnapshot open(String location) throws VocabularyLoadException {
		File folder = new File(location);
		if (!folder.isDirectory()) {
			throw new VocabularyLoadException("Vocabulary folder not found: " + location);
		}

		Map<VocabularyTable<?>, File> tableFiles = findTableFiles(folder);
		List<String> missingRequired = findMissingRequiredFiles(tableFiles);
		if (!missingRequired.isEmpty()) {
			throw new VocabularyLoadException("Missing required vocabulary files in " + location + ": " + String.join(", ", missingRequired));
		}

		logger.info("Loading vocabulary tables {} from {}", tableFiles.keySet(), folder.getAbsolutePath());
		TimerUtil timer = new TimerUtil("Vocabulary load");
		Map<VocabularyTable<?>, Future<InMemoryTable<?>>> futures = new LinkedHashMap<>();
		for (Map.Entry<VocabularyTable<?>, File> entry : tableFiles.entrySet()) {
			VocabularyTable<?> table = entry.getKey();
			File file = entry.getValue();
			futures.put(table, taskExecutor.submit(() -> {
				InMemoryTable<?> loaded = readTable(table, file);
				timer.checkpoint(file.getName() + " (" + loaded.size() + " rows)");
				return loaded;
			}));
		}

		List<InMemoryTable<?>> loadedTables = new ArrayList<>();
		try {
			for (Map.Entry<VocabularyTable<?>, Future<InMemoryTable<?>>> entry : futures.entrySet()) {
				loadedTables.add(entry.getValue().get());
			}
		} catch (ExecutionException e) {
			futures.values().forEach(future -> future.cancel(true));
			throw new VocabularyLoadException("Failed to read vocabulary files in " + location + ": " + e.getCause().getMessage(), e.getCause());
		} catch (InterruptedException e) {
			futures.values().forEach(future -> future.cancel(true));
			Thread.currentThread().interrupt();
			throw new VocabularyLoadException("Vocabulary load was interrupted.", e);
		}
		timer.finish();

		return new InMemoryVocabularySnapshot(folder.getAbsolutePath(), loadedTables);
	}

	/**
	 * Names of the required table files missing from the folder. Lets callers report a malformed folder before loading.
	 */
	public List<String> findMissingRequiredFiles(File folder) {
		return findMissingRequiredFiles(findTableFiles(folder));
	}

	private List<String> findMissingRequiredFiles(Map<VocabularyTable<?>, File> tableFiles) {
		List<String> missing = new ArrayList<>();
		for (VocabularyTable<?> table : VocabularyTable.ALL) {
			if (table.isRequired() && !tableFiles.containsKey(table)) {
				missing.add(table.getFileName());
			}
		}
		return missing;
	}

	private Map<VocabularyTable<?>, File> findTableFiles(File folder) {
		Map<String, File> filesByLowerCaseName = new HashMap<>();
		File[] files = folder.listFiles(File::isFile);
		if (files != null) {
			for (File file : files) {
				filesByLowerCaseName.put(file.getName().toLowerCase(Locale.ROOT), file);
			}
		}
		Map<VocabularyTable<?>, File> tableFiles = new LinkedHashMap<>();
		for (VocabularyTable<?> table : VocabularyTable.ALL) {
			File file = filesByLowerCaseName.get(table.getFileName().toLowerCase(Locale.ROOT));
			if (file != null) {
				tableFiles.put(table, file);
			} else if (!table.isRequired()) {
				logger.info("Optional vocabulary file {} not found, table will be empty.", table.getFileName());
			}
		}
		return tableFiles;
	}

	<T> InMemoryTable<T> readTable(VocabularyTable<T> table, File file) throws IOException {
		List<T> rows = new ArrayList<>();
		try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8);
			 CSVParser parser = ATHENA_FORMAT.parse(reader)) {
			for (CSVRecord record : parser) {
				try {
					rows.add(table.createRow(RowValues.of(record)));
				} catch (IllegalArgumentException e) {
					throw new IOException("Malformed row " + record.getRecordNumber() + " in " + file.getName() + ": " + e.getMessage(), e);
				}
			}
		}
		return new InMemoryTable<>(table, rows);
	}

	public void setTaskExecutor(ExecutorService taskExecutor) {
		this.taskExecutor = taskExecutor;
	}
}
