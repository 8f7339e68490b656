package com.datalake.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One page of a query result together with its pagination metadata.
 *
 * Invariants: {@code total_pages = ceil(total_count / page_size)} and
 * {@code offset = (page - 1) * page_size}. A page past the end carries no items
 * but keeps every metadata field populated.
 */
@JsonPropertyOrder({"source", "page", "page_size", "total_pages", "total_count", "offset",
    "has_next", "has_previous", "next_page", "previous_page", "partial_results", "failed_sources", "items"})
public class PageResult {

    @JsonProperty("items")
    private List<Map<String, Object>> items;

    @JsonProperty("page")
    private int page;

    @JsonProperty("page_size")
    private int pageSize;

    @JsonProperty("total_pages")
    private int totalPages;

    @JsonProperty("total_count")
    private long totalCount;

    @JsonProperty("offset")
    private long offset;

    @JsonProperty("has_next")
    private boolean hasNext;

    @JsonProperty("has_previous")
    private boolean hasPrevious;

    @JsonProperty("next_page")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private Integer nextPage;

    @JsonProperty("previous_page")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private Integer previousPage;

    @JsonProperty("source")
    private String source;

    @JsonProperty("partial_results")
    private boolean partialResults;

    @JsonProperty("failed_sources")
    private List<SourceFailure> failedSources;

    /**
     * Default constructor
     */
    public PageResult() {
        this.items = new ArrayList<>();
        this.failedSources = new ArrayList<>();
    }

    // Getters and Setters

    public List<Map<String, Object>> getItems() {
        return items;
    }

    public void setItems(List<Map<String, Object>> items) {
        this.items = items;
    }

    public int getPage() {
        return page;
    }

    public void setPage(int page) {
        this.page = page;
    }

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public int getTotalPages() {
        return totalPages;
    }

    public void setTotalPages(int totalPages) {
        this.totalPages = totalPages;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public void setTotalCount(long totalCount) {
        this.totalCount = totalCount;
    }

    public long getOffset() {
        return offset;
    }

    public void setOffset(long offset) {
        this.offset = offset;
    }

    public boolean isHasNext() {
        return hasNext;
    }

    public void setHasNext(boolean hasNext) {
        this.hasNext = hasNext;
    }

    public boolean isHasPrevious() {
        return hasPrevious;
    }

    public void setHasPrevious(boolean hasPrevious) {
        this.hasPrevious = hasPrevious;
    }

    public Integer getNextPage() {
        return nextPage;
    }

    public void setNextPage(Integer nextPage) {
        this.nextPage = nextPage;
    }

    public Integer getPreviousPage() {
        return previousPage;
    }

    public void setPreviousPage(Integer previousPage) {
        this.previousPage = previousPage;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public boolean isPartialResults() {
        return partialResults;
    }

    public void setPartialResults(boolean partialResults) {
        this.partialResults = partialResults;
    }

    public List<SourceFailure> getFailedSources() {
        return failedSources;
    }

    public void setFailedSources(List<SourceFailure> failedSources) {
        this.failedSources = failedSources;
    }
}
