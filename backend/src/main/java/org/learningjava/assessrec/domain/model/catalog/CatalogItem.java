package org.learningjava.assessrec.domain.model.catalog;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * One assessment of the catalog snapshot.
 * <p>
 * {@code url}, {@code testType} and {@code durationMinutes} may be {@code null}.
 */
public record CatalogItem(
        String name,
        String url,              // null for synthetic / placeholder entries
        String testType,         // single-letter code, e.g. K, P, C
        Integer durationMinutes,
        String category,
        String description,
        List<String> tags,
        String textBlob          // name + category + tags + description, the embedded unit
) {

    public static final String TAG_DELIMITER = "|";
    private static final Pattern TAG_SPLIT = Pattern.compile(Pattern.quote(TAG_DELIMITER));

    public CatalogItem {
        name = name == null ? "" : name;
        category = category == null ? "" : category;
        description = description == null ? "" : description;
        tags = tags == null ? List.of() : List.copyOf(tags);
        textBlob = textBlob == null ? "" : textBlob;
    }

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }

    public String joinedTags() {
        return String.join(TAG_DELIMITER, tags);
    }

    public static List<String> splitTags(String joined) {
        if (joined == null || joined.isBlank()) return List.of();
        return Arrays.stream(TAG_SPLIT.split(joined))
                .map(String::trim)
                .filter(t -> !t.isEmpty())
                .toList();
    }
}
