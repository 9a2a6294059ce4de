package org.indicate.curator.core.data.services.pojo;

public record SynonymView(String synonym, String language, Long languageConceptId) {
}
