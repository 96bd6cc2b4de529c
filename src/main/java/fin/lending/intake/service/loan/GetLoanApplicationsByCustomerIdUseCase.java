package fin.lending.intake.service.loan;

import fin.lending.intake.domain.LoanApplication;
import fin.lending.intake.dto.PageQuery;
import fin.lending.intake.dto.PageResult;
import fin.lending.intake.exception.CustomerNotFoundException;
import fin.lending.intake.repository.CustomerRepository;
import fin.lending.intake.repository.LoanApplicationRepository;
import fin.lending.intake.service.support.PageWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Page through one customer's loan applications, newest first
 */
@Slf4j
@Service
public class GetLoanApplicationsByCustomerIdUseCase {

    @Autowired
    private LoanApplicationRepository loanApplicationRepository;

    @Autowired
    private CustomerRepository customerRepository;

    public PageResult<LoanApplication> execute(UUID customerId, PageQuery query) {
        log.info("Getting loan applications by customer: customerId={}", customerId);

        if (customerRepository.findById(customerId).isEmpty()) {
            throw new CustomerNotFoundException(customerId);
        }

        PageWindow window = PageWindow.of(query);
        return window.toResult(
                loanApplicationRepository.findByCustomerId(customerId, window.getSkip(), window.getPageSize()));
    }
}
