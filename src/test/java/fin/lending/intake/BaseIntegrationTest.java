package fin.lending.intake;

import fin.lending.intake.domain.Customer;
import fin.lending.intake.domain.LoanApplication;
import fin.lending.intake.repository.CustomerRepository;
import fin.lending.intake.repository.LoanApplicationRepository;
import fin.lending.intake.service.customer.CreateCustomerUseCase;
import fin.lending.intake.service.loan.CreateLoanApplicationUseCase;
import fin.lending.intake.testutil.CustomerTestBuilder;
import fin.lending.intake.testutil.LoanApplicationTestBuilder;
import org.junit.jupiter.api.AfterEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Base class for integration tests against the in-memory database
 * Provides common setup, teardown, and utility methods
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
public abstract class BaseIntegrationTest {

    @Autowired
    protected CustomerRepository customerRepository;

    @Autowired
    protected LoanApplicationRepository loanApplicationRepository;

    @Autowired
    protected CreateCustomerUseCase createCustomerUseCase;

    @Autowired
    protected CreateLoanApplicationUseCase createLoanApplicationUseCase;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    /**
     * Ensures clean state between tests
     */
    @AfterEach
    void baseCleanup() {
        // applications first (FK to customers)
        jdbcTemplate.update("DELETE FROM loan_applications");
        jdbcTemplate.update("DELETE FROM customers");
    }

    // ============= TEST DATA HELPERS =============

    protected Customer createCustomer(String fullName, String email) {
        return createCustomerUseCase.execute(
                CustomerTestBuilder.aCustomer().fullName(fullName).email(email).toRequest());
    }

    protected LoanApplication createLoanApplication(UUID customerId) {
        return createLoanApplicationUseCase.execute(
                LoanApplicationTestBuilder.aLoanApplication().customerId(customerId).build());
    }

    // ============= ASSERTION UTILITIES =============

    protected void assertDatabaseCounts(int expectedCustomers, int expectedLoanApplications) {
        Integer customers = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM customers", Integer.class);
        Integer applications = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM loan_applications", Integer.class);

        assertThat(customers).isEqualTo(expectedCustomers);
        assertThat(applications).isEqualTo(expectedLoanApplications);
    }
}
