package fin.lending.intake.service.customer;

import fin.lending.intake.domain.Customer;
import fin.lending.intake.exception.CustomerNotFoundException;
import fin.lending.intake.repository.CustomerRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Slf4j
@Service
public class GetCustomerByIdUseCase {

    @Autowired
    private CustomerRepository customerRepository;

    public Customer execute(UUID customerId) {
        log.debug("Getting customer: customerId={}", customerId);
        return customerRepository.findById(customerId)
                .orElseThrow(() -> new CustomerNotFoundException(customerId));
    }
}
