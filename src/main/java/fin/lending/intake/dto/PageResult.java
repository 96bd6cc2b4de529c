package fin.lending.intake.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Paginated envelope
 * @param <T> item type
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Paginated result")
public class PageResult<T> {
    private List<T> items;

    @Schema(description = "Total number of items across all pages", example = "5")
    private long total;

    @Schema(description = "Current page", example = "1")
    private int page;

    @Schema(description = "Items per page", example = "10")
    private int pageSize;

    @Schema(description = "Number of pages", example = "1")
    private int totalPages;

    /**
     * Same paging metadata over converted items
     */
    public <R> PageResult<R> map(Function<? super T, ? extends R> converter) {
        List<R> converted = items.stream().map(converter).collect(Collectors.toList());
        return new PageResult<>(converted, total, page, pageSize, totalPages);
    }
}
