package fin.lending.intake.service.loan;

import fin.lending.intake.exception.LoanApplicationNotFoundException;
import fin.lending.intake.repository.LoanApplicationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Slf4j
@Service
public class DeleteLoanApplicationUseCase {

    @Autowired
    private LoanApplicationRepository loanApplicationRepository;

    @Transactional
    public void execute(UUID loanApplicationId) {
        log.info("Deleting loan application: loanApplicationId={}", loanApplicationId);

        if (loanApplicationRepository.findById(loanApplicationId).isEmpty()) {
            throw new LoanApplicationNotFoundException(loanApplicationId);
        }

        loanApplicationRepository.delete(loanApplicationId);
    }
}
