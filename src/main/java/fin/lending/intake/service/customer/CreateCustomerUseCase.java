package fin.lending.intake.service.customer;

import fin.lending.intake.domain.Customer;
import fin.lending.intake.dto.CreateCustomerRequest;
import fin.lending.intake.exception.CustomerAlreadyExistsException;
import fin.lending.intake.repository.CustomerRepository;
import fin.lending.intake.service.support.LoanIntakeMetrics;
import fin.lending.intake.validation.RequestValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Register a new customer with a unique email
 */
@Slf4j
@Service
public class CreateCustomerUseCase {

    @Autowired
    private CustomerRepository customerRepository;

    @Autowired
    private RequestValidator requestValidator;

    @Autowired
    private LoanIntakeMetrics metrics;

    @Autowired
    private Clock clock;

    @Transactional
    public Customer execute(CreateCustomerRequest request) {
        log.info("Creating new customer");
        requestValidator.validate(request);

        if (customerRepository.findByEmail(request.getEmail()).isPresent()) {
            log.warn("Customer email already registered");
            throw new CustomerAlreadyExistsException(request.getEmail());
        }

        Customer customer = Customer.register(request.getFullName(), request.getEmail(), clock);
        Customer saved = customerRepository.save(customer);

        metrics.customerCreated();
        log.info("Customer created: customerId={}", saved.getId().orElse(null));
        return saved;
    }
}
