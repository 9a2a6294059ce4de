package org.indicate.curator.rest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.apache.commons.lang3.StringUtils;
import org.indicate.curator.core.data.services.VocabularyService;
import org.indicate.curator.core.data.services.pojo.VocabularyLoadResult;
import org.indicate.curator.core.data.services.pojo.VocabularyStatus;
import org.indicate.curator.rest.pojo.VocabularyLoadRequest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@Tag(name = "Vocabularies", description = "Open and close the vocabulary snapshot")
@RequestMapping(value = "/vocabularies", produces = "application/json")
public class VocabularyController {

	@Autowired
	private VocabularyService vocabularyService;

	@GetMapping("/status")
	public VocabularyStatus getStatus() {
		return vocabularyService.getStatus();
	}

	@Operation(summary = "Load a vocabulary snapshot.",
			description = "Give either the folder of an Athena export or the JDBC URL of a vocabulary database. " +
					"The current snapshot stays in place when loading fails.")
	@PostMapping("/load")
	public VocabularyLoadResult load(@RequestBody VocabularyLoadRequest request) {
		ControllerHelper.requiredParam(request, "request body");
		boolean hasFolder = StringUtils.isNotBlank(request.getFolder());
		boolean hasJdbcUrl = StringUtils.isNotBlank(request.getJdbcUrl());
		if (hasFolder == hasJdbcUrl) {
			throw new IllegalArgumentException("Exactly one of folder or jdbcUrl must be given.");
		}
		return hasFolder ? vocabularyService.openFolder(request.getFolder()) : vocabularyService.openDatabase(request.getJdbcUrl());
	}

	@DeleteMapping
	@ResponseStatus(HttpStatus.NO_CONTENT)
	public void unload() {
		vocabularyService.clear();
	}

}
