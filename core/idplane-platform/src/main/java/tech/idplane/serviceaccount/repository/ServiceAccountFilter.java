package tech.idplane.serviceaccount.repository;

/**
 * Filter criteria for listing service accounts.
 *
 * @param search     case-insensitive substring over client id, client name and description (null for none)
 * @param activeOnly when true only active accounts are returned
 * @param skip       number of rows to skip
 * @param limit      maximum number of rows
 */
public record ServiceAccountFilter(
    String search,
    boolean activeOnly,
    int skip,
    int limit
) {

    public boolean hasSearch() {
        return search != null && !search.isBlank();
    }
}
