package org.indicate.curator.core.data.services;

import org.indicate.curator.AbstractTest;
import org.indicate.curator.TestVocabulary;
import org.indicate.curator.core.data.services.pojo.TransitivityViolation;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClosureIntegrityServiceTest extends AbstractTest {

	@Autowired
	private ClosureIntegrityService integrityService;

	@Test
	void testCompleteClosureHasNoViolations() {
		install(chain());

		assertTrue(integrityService.findTransitivityViolations(List.of(1L, 2L, 3L, 4L)).isEmpty());
	}

	@Test
	void testMissingRowReported() {
		install(chain().withoutClosureRow(1, 3));

		List<TransitivityViolation> violations = integrityService.findTransitivityViolations(List.of(2L));

		assertEquals(List.of(new TransitivityViolation(1, 2, 3)), violations);
	}

	@Test
	void testMissingRowReportedAroundEachPivot() {
		install(chain().withoutClosureRow(1, 4));

		List<TransitivityViolation> violations = integrityService.findTransitivityViolations(List.of(3L, 2L));

		assertEquals(List.of(new TransitivityViolation(1, 2, 4), new TransitivityViolation(1, 3, 4)), violations);
	}

	@Test
	void testNullIdRejected() {
		install(chain());

		assertThrows(IllegalArgumentException.class, () -> integrityService.findTransitivityViolations(Arrays.asList(2L, null)));
	}

	@Test
	void testNoVocabulary() {
		assertTrue(integrityService.findTransitivityViolations(List.of(1L)).isEmpty());
	}

	// 4 is a 3 is a 2 is a 1
	private TestVocabulary chain() {
		return new TestVocabulary()
				.concept(1, "One")
				.concept(2, "Two")
				.concept(3, "Three")
				.concept(4, "Four")
				.isA(2, 1)
				.isA(3, 2)
				.isA(4, 3);
	}
}
