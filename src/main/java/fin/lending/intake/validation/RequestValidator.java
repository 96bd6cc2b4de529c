package fin.lending.intake.validation;

import fin.lending.intake.exception.ValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs Bean Validation on use case input and reports every violation at once
 */
@Slf4j
@Component
public class RequestValidator {

    private static final Comparator<FieldViolation> BY_FIELD =
            Comparator.comparing(FieldViolation::getField).thenComparing(FieldViolation::getMessage);

    private final Validator validator;

    @Autowired
    public RequestValidator(Validator validator) {
        this.validator = validator;
    }

    /**
     * Validate the input against its declared constraints
     *
     * @param input the command or query to check
     * @return the same input, once every constraint holds
     * @throws ValidationException listing all violated fields
     */
    public <T> T validate(T input) {
        if (input == null) {
            throw ValidationException.of("", "Request body is required");
        }

        Set<ConstraintViolation<T>> violations = validator.validate(input);
        if (violations.isEmpty()) {
            return input;
        }

        List<FieldViolation> fieldViolations = violations.stream()
                .map(v -> new FieldViolation(v.getPropertyPath().toString(), v.getMessage()))
                .sorted(BY_FIELD)
                .collect(Collectors.toList());

        log.debug("Validation failed for {}: {}", input.getClass().getSimpleName(), fieldViolations);

        List<FieldViolation> objectLevel = fieldViolations.stream()
                .filter(v -> v.getField().isEmpty())
                .collect(Collectors.toList());
        if (objectLevel.size() == fieldViolations.size() && objectLevel.size() == 1) {
            throw new ValidationException(objectLevel.get(0).getMessage(), fieldViolations);
        }
        throw new ValidationException(fieldViolations);
    }
}
