package com.datalake.query;

/**
 * Requested page: a 1-based page number and a page size already clamped to {@code [1, max]}.
 */
public final class PageRequest {

    private final int page;
    private final int pageSize;

    private PageRequest(int page, int pageSize) {
        this.page = page;
        this.pageSize = pageSize;
    }

    /**
     * @throws QueryValidationException if {@code page < 1}
     */
    public static PageRequest of(int page, int pageSize, int maxPageSize) {
        if (page < 1) {
            throw new QueryValidationException("Page number must be at least 1, got " + page, "page");
        }
        int cap = Math.max(1, maxPageSize);
        return new PageRequest(page, Math.min(Math.max(pageSize, 1), cap));
    }

    public int getPage() {
        return page;
    }

    public int getPageSize() {
        return pageSize;
    }

    public long getOffset() {
        return (long) (page - 1) * pageSize;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PageRequest)) return false;
        PageRequest that = (PageRequest) o;
        return page == that.page && pageSize == that.pageSize;
    }

    @Override
    public int hashCode() {
        return 31 * page + pageSize;
    }

    @Override
    public String toString() {
        return "PageRequest{page=" + page + ", pageSize=" + pageSize + "}";
    }
}
