package org.indicate.curator.rest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.indicate.curator.core.data.domain.Concept;
import org.indicate.curator.core.data.services.ConceptGraphQueryService;
import org.indicate.curator.core.data.services.HierarchyGraphService;
import org.indicate.curator.core.data.services.pojo.HierarchyGraph;
import org.indicate.curator.core.data.services.pojo.RelatedConcept;
import org.indicate.curator.core.data.services.pojo.SynonymView;
import org.indicate.curator.rest.pojo.ItemsPage;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

@RestController
@Tag(name = "Concepts", description = "Concept graph lookups")
@RequestMapping(value = "/concepts", produces = "application/json")
public class ConceptController {

	@Autowired
	private ConceptGraphQueryService conceptGraphQueryService;

	@Autowired
	private HierarchyGraphService hierarchyGraphService;

	@GetMapping("/{conceptId}")
	public Concept findConcept(@PathVariable long conceptId) {
		return ControllerHelper.throwIfNotFound("Concept", conceptGraphQueryService.findConcept(conceptId).orElse(null));
	}

	@Operation(summary = "List concepts related to this concept.",
			description = "With standardOnly only valid standard targets are listed, ordered by relationship. " +
					"Otherwise every target is listed with the most frequent relationship kinds first.")
	@GetMapping("/{conceptId}/related")
	public ItemsPage<RelatedConcept> findRelated(
			@PathVariable long conceptId,
			@RequestParam(defaultValue = "false") boolean standardOnly) {
		return new ItemsPage<>(conceptGraphQueryService.relatedConcepts(conceptId, standardOnly));
	}

	@GetMapping("/{conceptId}/descendants")
	public ItemsPage<RelatedConcept> findDescendants(@PathVariable long conceptId) {
		return new ItemsPage<>(conceptGraphQueryService.descendantConcepts(conceptId));
	}

	@Operation(summary = "List ancestors and descendants of this concept.",
			description = "Each concept is labelled Ancestor or Descendant. A direct hierarchical relationship decides the label " +
					"where one exists, closure membership otherwise. Ancestors are listed first.")
	@GetMapping("/{conceptId}/hierarchy")
	public ItemsPage<RelatedConcept> findHierarchy(@PathVariable long conceptId) {
		return new ItemsPage<>(conceptGraphQueryService.hierarchyNeighbors(conceptId));
	}

	@GetMapping("/{conceptId}/synonyms")
	public ItemsPage<SynonymView> findSynonyms(@PathVariable long conceptId) {
		return new ItemsPage<>(conceptGraphQueryService.synonyms(conceptId));
	}

	@GetMapping("/{conceptId}/clinical-drugs")
	public ItemsPage<Concept> findClinicalDrugs(@PathVariable long conceptId) {
		return new ItemsPage<>(conceptGraphQueryService.clinicalDrugsForIngredient(conceptId));
	}

	@Operation(summary = "Bounded hierarchy graph around this concept.")
	@GetMapping("/{conceptId}/hierarchy-graph")
	public HierarchyGraph getHierarchyGraph(
			@PathVariable long conceptId,
			@Parameter(description = "Ancestor levels to include.")
			@RequestParam(defaultValue = "" + HierarchyGraphService.DEFAULT_MAX_LEVELS) int maxLevelsUp,
			@Parameter(description = "Descendant levels to include.")
			@RequestParam(defaultValue = "" + HierarchyGraphService.DEFAULT_MAX_LEVELS) int maxLevelsDown) {
		return hierarchyGraphService.buildGraph(conceptId, maxLevelsUp, maxLevelsDown);
	}

	@Operation(summary = "Related concepts for mapping recommendation.",
			description = "Every related concept, flagged recommended when it is already mapped. The body lists the mapped concept ids.")
	@PostMapping("/{conceptId}/recommendations")
	public ItemsPage<RelatedConcept> findRecommendations(
			@PathVariable long conceptId,
			@RequestBody(required = false) List<Long> existingMappingConceptIds) {
		return new ItemsPage<>(conceptGraphQueryService.allRelatedForRecommendation(conceptId,
				existingMappingConceptIds != null ? existingMappingConceptIds : new ArrayList<>()));
	}

}
