package fin.lending.intake.repository;

import fin.lending.intake.domain.LoanApplication;

import java.util.Optional;
import java.util.UUID;

/**
 * Persistence port for loan applications
 */
public interface LoanApplicationRepository {

    Optional<LoanApplication> findById(UUID id);

    /**
     * Insert when the application has no id yet (assigning one), update otherwise
     *
     * @return the stored application, always carrying an id
     */
    LoanApplication save(LoanApplication loanApplication);

    PageSlice<LoanApplication> findAll(long skip, int take);

    PageSlice<LoanApplication> findByCustomerId(UUID customerId, long skip, int take);

    void delete(UUID id);
}
