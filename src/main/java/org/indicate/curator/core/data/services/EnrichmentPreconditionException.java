package org.indicate.curator.core.data.services;

/**
 * Thrown when mapping enrichment cannot run at all, for example because no vocabulary is loaded.
 * The message names the precondition that failed.
 */
public class EnrichmentPreconditionException extends ServiceException {
	public EnrichmentPreconditionException(String message) {
		super(message);
	}

	public EnrichmentPreconditionException(String message, Throwable cause) {
		super(message, cause);
	}
}
