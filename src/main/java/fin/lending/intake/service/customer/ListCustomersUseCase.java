package fin.lending.intake.service.customer;

import fin.lending.intake.domain.Customer;
import fin.lending.intake.dto.PageQuery;
import fin.lending.intake.dto.PageResult;
import fin.lending.intake.repository.CustomerRepository;
import fin.lending.intake.service.support.PageWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class ListCustomersUseCase {

    @Autowired
    private CustomerRepository customerRepository;

    public PageResult<Customer> execute(PageQuery query) {
        PageWindow window = PageWindow.of(query);
        log.info("Listing customers: page={}, pageSize={}", window.getPage(), window.getPageSize());

        return window.toResult(customerRepository.findAll(window.getSkip(), window.getPageSize()));
    }
}
