package org.indicate.curator.rest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.indicate.curator.core.data.services.EnrichmentPreconditionException;
import org.indicate.curator.core.data.services.MappingEnrichmentService;
import org.indicate.curator.core.data.services.pojo.EnrichmentResult;
import org.indicate.curator.rest.pojo.EnrichmentRequest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

@RestController
@Tag(name = "Mappings", description = "-")
@RequestMapping(value = "/mappings", produces = "application/json")
public class MappingController {

	@Autowired
	private MappingEnrichmentService mappingEnrichmentService;

	@Operation(summary = "Regenerate the derived mappings of a mapping table.",
			description = "Derived rows of the submitted table are replaced. Manual rows are returned as they were. " +
					"Responds with 409 when no vocabulary is loaded.")
	@PostMapping("/enrich")
	public EnrichmentResult enrich(@RequestBody EnrichmentRequest request) throws EnrichmentPreconditionException {
		ControllerHelper.requiredParam(request, "request body");
		return mappingEnrichmentService.enrich(request.getMappings(), request.getGeneralConcepts(), request.isPreserveRecommended());
	}

}
