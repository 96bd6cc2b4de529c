package fin.lending.intake.repository.mybatis;

import fin.lending.intake.BaseIntegrationTest;
import fin.lending.intake.domain.Customer;
import fin.lending.intake.exception.CustomerAlreadyExistsException;
import fin.lending.intake.repository.PageSlice;
import fin.lending.intake.testutil.CustomerTestBuilder;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Repository contract against the real mapper XML
 */
class MyBatisCustomerRepositoryTest extends BaseIntegrationTest {

    @Test
    void testInsertAssignsId() {
        Customer saved = customerRepository.save(CustomerTestBuilder.aCustomer().build());

        assertThat(saved.isPersisted()).isTrue();
        Optional<Customer> loaded = customerRepository.findById(saved.getId().orElseThrow());
        assertThat(loaded).isPresent();
        assertThat(loaded.get().getFullName()).isEqualTo("John Doe");
        assertThat(loaded.get().getEmail()).isEqualTo("john@example.com");
    }

    @Test
    void testUpdateExisting() {
        Customer saved = customerRepository.save(CustomerTestBuilder.aCustomer().build());

        saved.updateFullName("Jane Doe");
        customerRepository.save(saved);

        assertThat(customerRepository.findByEmail("john@example.com"))
                .map(Customer::getFullName)
                .contains("Jane Doe");
        assertDatabaseCounts(1, 0);
    }

    @Test
    void testFindMissing() {
        assertThat(customerRepository.findById(UUID.randomUUID())).isEmpty();
        assertThat(customerRepository.findByEmail("nobody@example.com")).isEmpty();
    }

    @Test
    void testFindAllReportsTotal() {
        customerRepository.save(CustomerTestBuilder.aCustomer().email("a@example.com").build());
        customerRepository.save(CustomerTestBuilder.aCustomer().email("b@example.com").build());
        customerRepository.save(CustomerTestBuilder.aCustomer().email("c@example.com").build());

        PageSlice<Customer> slice = customerRepository.findAll(2, 2);

        assertThat(slice.getTotal()).isEqualTo(3);
        assertThat(slice.getItems()).hasSize(1);
    }

    @Test
    void testUniqueEmailIndex() {
        customerRepository.save(CustomerTestBuilder.aCustomer().build());

        assertThatThrownBy(() -> customerRepository.save(CustomerTestBuilder.aCustomer().fullName("Other").build()))
                .isInstanceOf(CustomerAlreadyExistsException.class);
    }
}
