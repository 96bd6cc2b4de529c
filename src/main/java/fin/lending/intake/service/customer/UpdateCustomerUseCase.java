package fin.lending.intake.service.customer;

import fin.lending.intake.domain.Customer;
import fin.lending.intake.dto.UpdateCustomerRequest;
import fin.lending.intake.exception.CustomerAlreadyExistsException;
import fin.lending.intake.exception.CustomerNotFoundException;
import fin.lending.intake.repository.CustomerRepository;
import fin.lending.intake.validation.RequestValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Change a customer's name and/or email
 */
@Slf4j
@Service
public class UpdateCustomerUseCase {

    @Autowired
    private CustomerRepository customerRepository;

    @Autowired
    private RequestValidator requestValidator;

    @Transactional
    public Customer execute(UUID customerId, UpdateCustomerRequest request) {
        log.info("Updating customer: customerId={}", customerId);
        requestValidator.validate(request);

        Customer customer = customerRepository.findById(customerId)
                .orElseThrow(() -> new CustomerNotFoundException(customerId));

        String newEmail = request.getEmail();
        if (newEmail != null && !newEmail.equals(customer.getEmail())) {
            Optional<Customer> owner = customerRepository.findByEmail(newEmail);
            if (owner.isPresent() && !owner.get().getId().equals(customer.getId())) {
                log.warn("Email already used by another customer: customerId={}", customerId);
                throw new CustomerAlreadyExistsException(newEmail);
            }
            customer.updateEmail(newEmail);
        }

        if (request.getFullName() != null) {
            customer.updateFullName(request.getFullName());
        }

        Customer saved = customerRepository.save(customer);
        log.info("Customer updated: customerId={}", customerId);
        return saved;
    }
}
