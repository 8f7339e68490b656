package com.datalake.query;

import com.datalake.domain.PageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Slices a sorted record list into pages.
 *
 * A page past the end is not an error: it comes back with no items and every
 * metadata field filled in.
 */
@Component
public class Paginator {

    private static final Logger log = LoggerFactory.getLogger(Paginator.class);

    private final int defaultPageSize;
    private final int maxPageSize;

    public Paginator(
            @Value("${datalake.pagination.default-page-size:10}") int defaultPageSize,
            @Value("${datalake.pagination.max-page-size:10}") int maxPageSize) {
        this.maxPageSize = Math.max(1, maxPageSize);
        this.defaultPageSize = Math.min(Math.max(1, defaultPageSize), this.maxPageSize);
    }

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    /**
     * Page request from numbers, size clamped to {@code [1, max]}
     */
    public PageRequest request(int page, int pageSize) {
        return PageRequest.of(page, pageSize, maxPageSize);
    }

    /**
     * Page request from raw request parameters.
     * A missing page means page 1; a missing or non-numeric size means the default size.
     *
     * @throws QueryValidationException if the page is not a number or is below 1
     */
    public PageRequest request(String rawPage, String rawPageSize) {
        int page = 1;
        if (rawPage != null && !rawPage.isBlank()) {
            try {
                page = Integer.parseInt(rawPage.trim());
            } catch (NumberFormatException e) {
                throw new QueryValidationException("Invalid page number '" + rawPage + "'", "page");
            }
        }

        int pageSize = defaultPageSize;
        if (rawPageSize != null && !rawPageSize.isBlank()) {
            try {
                pageSize = Integer.parseInt(rawPageSize.trim());
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric page size '{}', using default {}", rawPageSize, defaultPageSize);
            }
        }
        return PageRequest.of(page, pageSize, maxPageSize);
    }

    /**
     * Cut one page out of the items
     */
    public PageResult paginate(List<Map<String, Object>> items, PageRequest request) {
        int total = items.size();
        int pageSize = request.getPageSize();
        int page = request.getPage();
        int totalPages = (int) Math.ceil((double) total / pageSize);
        long offset = request.getOffset();

        List<Map<String, Object>> slice = new ArrayList<>();
        if (offset < total) {
            int from = (int) offset;
            slice.addAll(items.subList(from, Math.min(from + pageSize, total)));
        }

        PageResult result = new PageResult();
        result.setItems(slice);
        result.setPage(page);
        result.setPageSize(pageSize);
        result.setTotalPages(totalPages);
        result.setTotalCount(total);
        result.setOffset(offset);
        result.setHasNext(page < totalPages);
        result.setHasPrevious(page > 1);
        result.setNextPage(page < totalPages ? page + 1 : null);
        result.setPreviousPage(page > 1 ? Math.min(page - 1, Math.max(totalPages, 1)) : null);
        return result;
    }
}
