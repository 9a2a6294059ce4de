package org.indicate.curator.rest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.indicate.curator.core.data.domain.ConceptSetItem;
import org.indicate.curator.core.data.services.ConceptSetOptimizationService;
import org.indicate.curator.core.data.services.pojo.OptimizationResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@Tag(name = "Concept Sets", description = "-")
@RequestMapping(value = "/concept-sets", produces = "application/json")
public class ConceptSetController {

	@Autowired
	private ConceptSetOptimizationService conceptSetOptimizationService;

	@Operation(summary = "Optimize a concept set.",
			description = "Returns a smaller set that resolves to the same concepts. The submitted items are not changed.")
	@PostMapping("/optimize")
	public OptimizationResult optimize(@RequestBody List<ConceptSetItem> items) {
		return conceptSetOptimizationService.optimize(items);
	}

}
