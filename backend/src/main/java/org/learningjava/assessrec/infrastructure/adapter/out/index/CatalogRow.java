package org.learningjava.assessrec.infrastructure.adapter.out.index;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.learningjava.assessrec.domain.model.catalog.CatalogItem;

/**
 * Metadata artifact row: same fields as the catalog snapshot, tags pipe-joined.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"name", "url", "test_type", "duration_minutes", "category", "description", "tags", "text_blob"})
record CatalogRow(
        @JsonProperty("name") String name,
        @JsonProperty("url") String url,
        @JsonProperty("test_type") String testType,
        @JsonProperty("duration_minutes") Integer durationMinutes,
        @JsonProperty("category") String category,
        @JsonProperty("description") String description,
        @JsonProperty("tags") String tags,
        @JsonProperty("text_blob") String textBlob
) {

    static CatalogRow from(CatalogItem item) {
        return new CatalogRow(
                item.name(),
                item.url(),
                item.testType(),
                item.durationMinutes(),
                item.category(),
                item.description(),
                item.joinedTags(),
                item.textBlob()
        );
    }

    CatalogItem toItem() {
        return new CatalogItem(name, url, testType, durationMinutes, category, description, CatalogItem.splitTags(tags), textBlob);
    }
}
