package fin.lending.intake.service.support;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Business counters exposed through the Micrometer registry
 */
@Component
public class LoanIntakeMetrics {

    private final Counter customersCreated;
    private final Counter loanApplicationsCreated;

    public LoanIntakeMetrics(MeterRegistry registry) {
        this.customersCreated = Counter.builder("loan_intake.customers.created")
                .description("Customers registered")
                .register(registry);
        this.loanApplicationsCreated = Counter.builder("loan_intake.loan_applications.created")
                .description("Loan applications submitted")
                .register(registry);
    }

    public void customerCreated() {
        customersCreated.increment();
    }

    public void loanApplicationCreated() {
        loanApplicationsCreated.increment();
    }
}
