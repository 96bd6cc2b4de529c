package fin.lending.intake.service.loan;

import fin.lending.intake.domain.LoanApplication;
import fin.lending.intake.domain.MoneyAmount;
import fin.lending.intake.dto.CreateLoanApplicationRequest;
import fin.lending.intake.exception.CustomerNotFoundException;
import fin.lending.intake.repository.CustomerRepository;
import fin.lending.intake.repository.LoanApplicationRepository;
import fin.lending.intake.service.LoanCalculatorService;
import fin.lending.intake.service.support.LoanIntakeMetrics;
import fin.lending.intake.validation.RequestValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Submit a loan application for an existing customer.
 *
 * Order of work:
 * 1. Validate the request (all violations reported together)
 * 2. Verify the customer exists
 * 3. Compute the monthly payment
 * 4. Persist
 */
@Slf4j
@Service
public class CreateLoanApplicationUseCase {

    @Autowired
    private LoanApplicationRepository loanApplicationRepository;

    @Autowired
    private CustomerRepository customerRepository;

    @Autowired
    private LoanCalculatorService loanCalculatorService;

    @Autowired
    private RequestValidator requestValidator;

    @Autowired
    private LoanIntakeMetrics metrics;

    @Autowired
    private Clock clock;

    @Transactional
    public LoanApplication execute(CreateLoanApplicationRequest request) {
        log.info("Creating new loan application");
        requestValidator.validate(request);

        UUID customerId = UUID.fromString(request.getCustomerId());
        if (customerRepository.findById(customerId).isEmpty()) {
            log.warn("Loan application refers to unknown customer: customerId={}", customerId);
            throw new CustomerNotFoundException(customerId);
        }

        String currency = request.getCurrencyCode() != null
                ? request.getCurrencyCode()
                : MoneyAmount.DEFAULT_CURRENCY;
        MoneyAmount principal = new MoneyAmount(request.getAmount(), currency);

        LoanApplication application = LoanApplication.submit(
                customerId,
                principal,
                request.getTermMonths(),
                request.getAnnualInterestRate(),
                loanCalculatorService,
                clock);

        LoanApplication saved = loanApplicationRepository.save(application);

        metrics.loanApplicationCreated();
        log.info("Loan application created: loanApplicationId={}, customerId={}, amount={}, monthlyPayment={}",
                saved.getId().orElse(null), customerId,
                saved.getAmount().format(), saved.getMonthlyPayment().format());
        return saved;
    }
}
