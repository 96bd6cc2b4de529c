package fin.lending.intake.mapper;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Row of the customers table
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerRecord {
    private UUID id;
    private String fullName;
    private String email;
    private Instant createdAt;
}
