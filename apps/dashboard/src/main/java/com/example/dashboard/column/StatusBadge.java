package com.example.dashboard.column;

import org.springframework.lang.Nullable;

/**
 * Status cell content.
 *
 * @param status      status code shown in the badge, e.g. {@code COMPLETED}
 * @param description tooltip text
 * @param type        badge palette, e.g. {@code documentRequest} or {@code batch}
 */
public record StatusBadge(
        String status,
        @Nullable String description,
        String type
) {}
