package io.iamcore.resource;

import java.util.List;

/**
 * One page of resources.
 *
 * @param totalResults total matching resources, independent of paging
 * @param startIndex   the request's 1-based start index
 * @param itemsPerPage number of resources in this page
 * @param resources    the page
 */
public record ListResponse<T extends Resource>(
        long totalResults,
        int startIndex,
        int itemsPerPage,
        List<T> resources) {

    public ListResponse {
        resources = List.copyOf(resources);
    }

    public static <T extends Resource> ListResponse<T> of(long totalResults, ListRequest request, List<T> resources) {
        return new ListResponse<>(totalResults, request.startIndex(), resources.size(), resources);
    }
}
