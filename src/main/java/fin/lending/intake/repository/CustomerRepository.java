package fin.lending.intake.repository;

import fin.lending.intake.domain.Customer;

import java.util.Optional;
import java.util.UUID;

/**
 * Persistence port for customers
 */
public interface CustomerRepository {

    Optional<Customer> findById(UUID id);

    Optional<Customer> findByEmail(String email);

    /**
     * Insert when the customer has no id yet (assigning one), update otherwise
     *
     * @return the stored customer, always carrying an id
     */
    Customer save(Customer customer);

    PageSlice<Customer> findAll(long skip, int take);

    void delete(UUID id);
}
