package fin.lending.intake.service.loan;

import fin.lending.intake.domain.LoanApplication;
import fin.lending.intake.dto.PageQuery;
import fin.lending.intake.dto.PageResult;
import fin.lending.intake.repository.LoanApplicationRepository;
import fin.lending.intake.service.support.PageWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class ListLoanApplicationsUseCase {

    @Autowired
    private LoanApplicationRepository loanApplicationRepository;

    public PageResult<LoanApplication> execute(PageQuery query) {
        PageWindow window = PageWindow.of(query);
        log.info("Listing loan applications: page={}, pageSize={}", window.getPage(), window.getPageSize());

        return window.toResult(loanApplicationRepository.findAll(window.getSkip(), window.getPageSize()));
    }
}
