package fin.lending.intake.service.customer;

import fin.lending.intake.exception.CustomerNotFoundException;
import fin.lending.intake.repository.CustomerRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Slf4j
@Service
public class DeleteCustomerUseCase {

    @Autowired
    private CustomerRepository customerRepository;

    /**
     * Delete an existing customer
     *
     * @throws CustomerNotFoundException if no customer has this id
     */
    @Transactional
    public void execute(UUID customerId) {
        log.info("Deleting customer: customerId={}", customerId);

        if (customerRepository.findById(customerId).isEmpty()) {
            log.warn("Customer not found for deletion: customerId={}", customerId);
            throw new CustomerNotFoundException(customerId);
        }

        customerRepository.delete(customerId);
        log.info("Customer deleted: customerId={}", customerId);
    }
}
