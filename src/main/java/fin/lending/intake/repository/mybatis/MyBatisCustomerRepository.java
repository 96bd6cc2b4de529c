package fin.lending.intake.repository.mybatis;

import fin.lending.intake.domain.Customer;
import fin.lending.intake.exception.CustomerAlreadyExistsException;
import fin.lending.intake.exception.CustomerHasLoanApplicationsException;
import fin.lending.intake.mapper.CustomerMapper;
import fin.lending.intake.mapper.CustomerRecord;
import fin.lending.intake.repository.CustomerRepository;
import fin.lending.intake.repository.PageSlice;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * MyBatis implementation of the customer repository
 */
@Slf4j
@Repository
public class MyBatisCustomerRepository implements CustomerRepository {

    @Autowired
    private CustomerMapper customerMapper;

    @Override
    public Optional<Customer> findById(UUID id) {
        log.debug("Finding customer by ID: customerId={}", id);
        return Optional.ofNullable(customerMapper.findById(id)).map(MyBatisCustomerRepository::toDomain);
    }

    @Override
    public Optional<Customer> findByEmail(String email) {
        log.debug("Finding customer by email");
        return Optional.ofNullable(customerMapper.findByEmail(email)).map(MyBatisCustomerRepository::toDomain);
    }

    @Override
    public Customer save(Customer customer) {
        try {
            if (customer.isPersisted()) {
                CustomerRecord row = toRecord(customer);
                log.debug("Updating customer: customerId={}", row.getId());
                if (customerMapper.update(row) == 0) {
                    throw new IllegalStateException("Customer vanished during update: customerId=" + row.getId());
                }
                return customer;
            }

            Customer inserted = customer.withId(UUID.randomUUID());
            log.debug("Creating customer: customerId={}", inserted.getId().orElseThrow());
            customerMapper.insert(toRecord(inserted));
            return inserted;
        } catch (DuplicateKeyException e) {
            // unique index on email closes the check-then-insert window
            throw new CustomerAlreadyExistsException(customer.getEmail(), e);
        }
    }

    @Override
    public PageSlice<Customer> findAll(long skip, int take) {
        log.debug("Finding customers page: skip={}, take={}", skip, take);
        List<Customer> customers = customerMapper.findPage(skip, take).stream()
                .map(MyBatisCustomerRepository::toDomain)
                .collect(Collectors.toList());
        return PageSlice.of(customers, customerMapper.countAll());
    }

    @Override
    public void delete(UUID id) {
        log.debug("Deleting customer: customerId={}", id);
        try {
            customerMapper.deleteById(id);
        } catch (DataIntegrityViolationException e) {
            throw new CustomerHasLoanApplicationsException(id, e);
        }
    }

    private static Customer toDomain(CustomerRecord row) {
        return new Customer(row.getId(), row.getFullName(), row.getEmail(), row.getCreatedAt());
    }

    private static CustomerRecord toRecord(Customer customer) {
        return CustomerRecord.builder()
                .id(customer.getId().orElse(null))
                .fullName(customer.getFullName())
                .email(customer.getEmail())
                .createdAt(customer.getCreatedAt())
                .build();
    }
}
