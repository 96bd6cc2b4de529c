package fin.lending.intake.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Paging parameters as received; both optional
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Paging parameters")
public class PageQuery {
    @Min(value = 1, message = "Page must be at least 1")
    @Schema(description = "1-based page number", example = "1", defaultValue = "1")
    private Integer page;

    @Min(value = 1, message = "Page size must be at least 1")
    @Max(value = 100, message = "Page size must be at most 100")
    @Schema(description = "Items per page", example = "10", defaultValue = "10")
    private Integer pageSize;

    public static PageQuery firstPage() {
        return new PageQuery(null, null);
    }
}
