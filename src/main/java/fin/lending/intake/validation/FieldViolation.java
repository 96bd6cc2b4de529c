package fin.lending.intake.validation;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

/**
 * One violated input constraint
 */
@Value
@Schema(description = "Field validation failure")
public class FieldViolation {

    @Schema(description = "Path of the offending field; empty for object-level rules", example = "email")
    String field;

    @Schema(description = "Human readable reason", example = "Invalid email format")
    String message;
}
