package org.indicate.curator.rest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.indicate.curator.core.data.services.ClosureIntegrityService;
import org.indicate.curator.core.data.services.pojo.TransitivityViolation;
import org.indicate.curator.rest.pojo.ItemsPage;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.Set;

@RestController
@Tag(name = "Integrity", description = "-")
@RequestMapping(value = "/integrity", produces = "application/json")
public class IntegrityController {

	@Autowired
	private ClosureIntegrityService closureIntegrityService;

	@Operation(summary = "Find missing ancestor closure rows around the given concepts.")
	@PostMapping("/closure")
	public ItemsPage<TransitivityViolation> checkClosure(@RequestBody Set<Long> conceptIds) {
		return new ItemsPage<>(closureIntegrityService.findTransitivityViolations(conceptIds));
	}

}
