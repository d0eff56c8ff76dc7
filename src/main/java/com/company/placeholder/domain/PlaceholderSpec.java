package com.company.placeholder.domain;

import com.company.placeholder.domain.enums.PlaceholderKind;
import lombok.Builder;
import lombok.Value;

/**
 * A placeholder as fixed by template analysis. Immutable for the duration of a batch.
 */
@Value
@Builder(toBuilder = true)
public class PlaceholderSpec {

    // Cache identity; a spec without an id is never cached
    String placeholderId;
    String templateId;

    String name;
    // Null when template analysis left it open; the display name decides then
    PlaceholderKind kind;

    // Present for SQL placeholders, may contain {{param}} tokens
    String sqlTemplate;

    // 0 means "use the configured default"
    int cacheTtlHours;

    public DisplayName getDisplayName() {
        return DisplayName.of(name);
    }

    public PlaceholderKind getKind() {
        return kind != null ? kind : PlaceholderKind.fromDisplayName(name);
    }

    public boolean isPeriod() {
        return getKind() == PlaceholderKind.PERIOD;
    }

    public boolean hasSqlTemplate() {
        return sqlTemplate != null && !sqlTemplate.isBlank();
    }

    public static PlaceholderSpec period(String name) {
        return PlaceholderSpec.builder()
                .name(name)
                .kind(PlaceholderKind.PERIOD)
                .build();
    }

    public static PlaceholderSpec sql(String placeholderId, String name, String sqlTemplate) {
        return PlaceholderSpec.builder()
                .placeholderId(placeholderId)
                .name(name)
                .kind(PlaceholderKind.SQL)
                .sqlTemplate(sqlTemplate)
                .build();
    }
}
