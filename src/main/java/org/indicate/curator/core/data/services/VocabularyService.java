package org.indicate.curator.core.data.services;

import jakarta.annotation.PreDestroy;
import org.indicate.curator.core.data.services.pojo.VocabularyLoadResult;
import org.indicate.curator.core.data.services.pojo.VocabularyStatus;
import org.indicate.curator.core.data.store.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Date;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the vocabulary snapshot every query runs against.
 * A new snapshot becomes visible only once it has been opened completely.
 */
@Service
public class VocabularyService {

	@Autowired
	private FlatFileVocabularyStore flatFileVocabularyStore;

	@Autowired
	private JdbcVocabularyStore jdbcVocabularyStore;

	private final AtomicReference<LoadedVocabulary> current = new AtomicReference<>();

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public synchronized VocabularyLoadResult openFolder(String folder) {
		return open(flatFileVocabularyStore, folder);
	}

	public synchronized VocabularyLoadResult openDatabase(String jdbcUrl) {
		return open(jdbcVocabularyStore, jdbcUrl);
	}

	private VocabularyLoadResult open(VocabularyStore store, String location) {
		try {
			install(store.open(location));
			logger.info("Vocabulary {} is now available.", location);
			return VocabularyLoadResult.success(location);
		} catch (VocabularyLoadException e) {
			logger.error("Failed to load vocabulary from {}", location, e);
			return VocabularyLoadResult.failure(location, e.getMessage());
		}
	}

	/**
	 * Makes the snapshot current and closes the one it replaces.
	 */
	public void install(VocabularySnapshot snapshot) {
		LoadedVocabulary previous = current.getAndSet(new LoadedVocabulary(snapshot, new Date()));
		if (previous != null && previous.snapshot() != snapshot) {
			close(previous);
		}
	}

	public void clear() {
		LoadedVocabulary previous = current.getAndSet(null);
		if (previous != null) {
			close(previous);
			logger.info("Vocabulary cleared.");
		}
	}

	@PreDestroy
	public void shutdown() {
		clear();
	}

	private void close(LoadedVocabulary loaded) {
		loaded.snapshot().close();
	}

	/**
	 * The current snapshot, empty when no vocabulary is loaded.
	 */
	public Optional<VocabularySnapshot> getSnapshot() {
		LoadedVocabulary loaded = current.get();
		return loaded != null ? Optional.of(loaded.snapshot()) : Optional.empty();
	}

	public VocabularyStatus getStatus() {
		LoadedVocabulary loaded = current.get();
		if (loaded == null) {
			return VocabularyStatus.unavailable();
		}
		VocabularySnapshot snapshot = loaded.snapshot();
		return new VocabularyStatus(true, snapshot.getLocation(), loaded.loadedAt(), snapshot.getRowCounts());
	}

	private record LoadedVocabulary(VocabularySnapshot snapshot, Date loadedAt) {
	}
}
