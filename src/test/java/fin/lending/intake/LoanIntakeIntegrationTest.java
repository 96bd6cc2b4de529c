package fin.lending.intake;

import fin.lending.intake.domain.Customer;
import fin.lending.intake.domain.LoanApplication;
import fin.lending.intake.dto.PageQuery;
import fin.lending.intake.dto.PageResult;
import fin.lending.intake.exception.CustomerAlreadyExistsException;
import fin.lending.intake.exception.CustomerHasLoanApplicationsException;
import fin.lending.intake.service.customer.DeleteCustomerUseCase;
import fin.lending.intake.service.customer.ListCustomersUseCase;
import fin.lending.intake.service.loan.GetLoanApplicationByIdUseCase;
import fin.lending.intake.service.loan.GetLoanApplicationsByCustomerIdUseCase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end use case flows with the MyBatis repositories and H2
 */
@DisplayName("Loan intake integration tests")
class LoanIntakeIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private GetLoanApplicationByIdUseCase getLoanApplicationByIdUseCase;

    @Autowired
    private GetLoanApplicationsByCustomerIdUseCase getLoanApplicationsByCustomerIdUseCase;

    @Autowired
    private ListCustomersUseCase listCustomersUseCase;

    @Autowired
    private DeleteCustomerUseCase deleteCustomerUseCase;

    @Test
    @DisplayName("Customer and loan application round trip through the store")
    void testCreateCustomerAndLoanApplication() {
        // GIVEN: a registered customer
        Customer customer = createCustomer("John Doe", "john@example.com");
        UUID customerId = customer.getId().orElseThrow();

        // WHEN: a loan application is submitted
        LoanApplication created = createLoanApplication(customerId);

        // THEN: the stored application carries the computed payment
        LoanApplication loaded = getLoanApplicationByIdUseCase.execute(created.getId().orElseThrow());
        assertThat(loaded.getCustomerId()).isEqualTo(customerId);
        assertThat(loaded.getAmount().getAmount().toPlainString()).isEqualTo("25000.00");
        assertThat(loaded.getTermMonths()).isEqualTo(48);
        assertThat(loaded.getAnnualInterestRate()).isEqualByComparingTo("4.5");
        assertThat(loaded.getMonthlyPayment().getAmount()).isEqualByComparingTo("570.09");

        PageResult<LoanApplication> byCustomer =
                getLoanApplicationsByCustomerIdUseCase.execute(customerId, PageQuery.firstPage());
        assertThat(byCustomer.getTotal()).isEqualTo(1);
        assertThat(byCustomer.getItems()).hasSize(1);

        assertDatabaseCounts(1, 1);
    }

    @Test
    @DisplayName("Pages of a five-item listing do not overlap")
    void testPaginationWithoutOverlap() {
        IntStream.rangeClosed(1, 5).forEach(i -> createCustomer("Customer " + i, "customer" + i + "@example.com"));

        PageResult<Customer> first = listCustomersUseCase.execute(new PageQuery(1, 2));
        PageResult<Customer> second = listCustomersUseCase.execute(new PageQuery(2, 2));
        PageResult<Customer> third = listCustomersUseCase.execute(new PageQuery(3, 2));

        assertThat(first.getItems()).hasSize(2);
        assertThat(second.getItems()).hasSize(2);
        assertThat(third.getItems()).hasSize(1);
        assertThat(first.getTotal()).isEqualTo(5);
        assertThat(first.getTotalPages()).isEqualTo(3);

        Set<UUID> seen = new HashSet<>();
        for (PageResult<Customer> page : List.of(first, second, third)) {
            Set<UUID> ids = page.getItems().stream()
                    .map(c -> c.getId().orElseThrow())
                    .collect(Collectors.toSet());
            assertThat(seen).doesNotContainAnyElementsOf(ids);
            seen.addAll(ids);
        }
        assertThat(seen).hasSize(5);
    }

    @Test
    @DisplayName("Page beyond the end is empty but keeps the totals")
    void testPageBeyondEnd() {
        createCustomer("John Doe", "john@example.com");

        PageResult<Customer> page = listCustomersUseCase.execute(new PageQuery(5, 10));

        assertThat(page.getItems()).isEmpty();
        assertThat(page.getTotal()).isEqualTo(1);
        assertThat(page.getTotalPages()).isEqualTo(1);
    }

    @Test
    @DisplayName("A customer with loan applications cannot be deleted")
    void testDeleteCustomerWithApplications() {
        Customer customer = createCustomer("John Doe", "john@example.com");
        createLoanApplication(customer.getId().orElseThrow());

        assertThatThrownBy(() -> deleteCustomerUseCase.execute(customer.getId().orElseThrow()))
                .isInstanceOf(CustomerHasLoanApplicationsException.class);
    }

    @Test
    void testDeleteCustomerWithoutApplications() {
        Customer customer = createCustomer("John Doe", "john@example.com");

        deleteCustomerUseCase.execute(customer.getId().orElseThrow());

        assertDatabaseCounts(0, 0);
    }

    @Test
    @DisplayName("Duplicate email is refused")
    void testDuplicateEmail() {
        createCustomer("John Doe", "john@example.com");

        assertThatThrownBy(() -> createCustomer("Johnny Doe", "john@example.com"))
                .isInstanceOf(CustomerAlreadyExistsException.class);
    }
}
