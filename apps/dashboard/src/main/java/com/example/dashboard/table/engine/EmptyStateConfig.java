package com.example.dashboard.table.engine;

public record EmptyStateConfig(String message, String description) {

    private static final String DEFAULT_MESSAGE = "No data available";
    private static final String DEFAULT_DESCRIPTION = "Try adjusting your search or filters";

    public static final EmptyStateConfig DEFAULT = new EmptyStateConfig(DEFAULT_MESSAGE, DEFAULT_DESCRIPTION);

    public EmptyStateConfig {
        if (message == null) message = DEFAULT_MESSAGE;
        if (description == null) description = DEFAULT_DESCRIPTION;
    }
}
