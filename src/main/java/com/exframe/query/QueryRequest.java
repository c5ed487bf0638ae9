package com.exframe.query;

/**
 * One query against one domain. A {@code null} override means "unset": the
 * domain or persona default applies.
 */
public record QueryRequest(String query, String domainId, Boolean searchPatterns, Boolean showThinking) {
    public QueryRequest {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (domainId == null || domainId.isBlank()) {
            throw new IllegalArgumentException("domainId must not be blank");
        }
    }

    public static QueryRequest of(String query, String domainId) {
        return new QueryRequest(query, domainId, null, null);
    }
}
