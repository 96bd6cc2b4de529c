package fin.lending.intake.service.loan;

import fin.lending.intake.domain.LoanApplication;
import fin.lending.intake.exception.LoanApplicationNotFoundException;
import fin.lending.intake.repository.LoanApplicationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Slf4j
@Service
public class GetLoanApplicationByIdUseCase {

    @Autowired
    private LoanApplicationRepository loanApplicationRepository;

    public LoanApplication execute(UUID loanApplicationId) {
        log.debug("Getting loan application: loanApplicationId={}", loanApplicationId);
        return loanApplicationRepository.findById(loanApplicationId)
                .orElseThrow(() -> new LoanApplicationNotFoundException(loanApplicationId));
    }
}
