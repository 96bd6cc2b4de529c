package fin.lending.intake.service.support;

import fin.lending.intake.dto.PageQuery;
import fin.lending.intake.dto.PageResult;
import fin.lending.intake.repository.PageSlice;
import lombok.Value;

/**
 * Normalized paging: missing or non-positive values fall back to page 1 / size 10
 */
@Value
public class PageWindow {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PAGE_SIZE = 10;

    int page;
    int pageSize;

    public static PageWindow of(Integer page, Integer pageSize) {
        int normalizedPage = page != null && page > 0 ? page : DEFAULT_PAGE;
        int normalizedSize = pageSize != null && pageSize > 0 ? pageSize : DEFAULT_PAGE_SIZE;
        return new PageWindow(normalizedPage, normalizedSize);
    }

    public static PageWindow of(PageQuery query) {
        return query == null ? of(null, null) : of(query.getPage(), query.getPageSize());
    }

    /**
     * Rows to skip before this page; exceeds the int range for very large page numbers
     */
    public long getSkip() {
        return (page - 1L) * pageSize;
    }

    public int totalPages(long total) {
        return (int) ((total + pageSize - 1) / pageSize);
    }

    public <T> PageResult<T> toResult(PageSlice<T> slice) {
        return PageResult.<T>builder()
                .items(slice.getItems())
                .total(slice.getTotal())
                .page(page)
                .pageSize(pageSize)
                .totalPages(totalPages(slice.getTotal()))
                .build();
    }
}
