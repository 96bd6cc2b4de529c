package fin.lending.intake;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Loan intake service: customers, loan applications and amortized monthly payments.
 */
@SpringBootApplication
public class LoanIntakeApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoanIntakeApplication.class, args);
    }
}
