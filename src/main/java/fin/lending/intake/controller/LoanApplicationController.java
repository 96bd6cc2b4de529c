package fin.lending.intake.controller;

import fin.lending.intake.domain.LoanApplication;
import fin.lending.intake.dto.ApiResponse;
import fin.lending.intake.dto.CreateLoanApplicationRequest;
import fin.lending.intake.dto.LoanApplicationResponse;
import fin.lending.intake.dto.PageQuery;
import fin.lending.intake.dto.PageResult;
import fin.lending.intake.service.loan.CreateLoanApplicationUseCase;
import fin.lending.intake.service.loan.DeleteLoanApplicationUseCase;
import fin.lending.intake.service.loan.GetLoanApplicationByIdUseCase;
import fin.lending.intake.service.loan.ListLoanApplicationsUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST Controller for loan applications
 */
@Slf4j
@RestController
@RequestMapping("/api/loan-applications")
@Tag(name = "Loan Applications", description = "APIs for loan application intake")
public class LoanApplicationController {

    @Autowired
    private CreateLoanApplicationUseCase createLoanApplicationUseCase;

    @Autowired
    private GetLoanApplicationByIdUseCase getLoanApplicationByIdUseCase;

    @Autowired
    private ListLoanApplicationsUseCase listLoanApplicationsUseCase;

    @Autowired
    private DeleteLoanApplicationUseCase deleteLoanApplicationUseCase;

    /**
     * Submit a loan application
     *
     * @param request principal, term, rate and applicant
     * @return the stored application with its computed monthly payment
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(
        summary = "Submit a loan application",
        description = "The customer must exist. The fixed monthly payment is computed at submission " +
                      "and stored with the application."
    )
    public ApiResponse<LoanApplicationResponse> createLoanApplication(
            @RequestBody CreateLoanApplicationRequest request) {
        LoanApplication application = createLoanApplicationUseCase.execute(request);
        return ApiResponse.success(201, "Loan application created successfully",
                LoanApplicationResponse.fromLoanApplication(application));
    }

    @GetMapping("/{loanApplicationId}")
    @Operation(summary = "Get loan application by ID")
    public ApiResponse<LoanApplicationResponse> getLoanApplication(
            @Parameter(description = "Loan application ID", required = true)
            @PathVariable UUID loanApplicationId) {
        LoanApplication application = getLoanApplicationByIdUseCase.execute(loanApplicationId);
        return ApiResponse.success(LoanApplicationResponse.fromLoanApplication(application));
    }

    @GetMapping
    @Operation(summary = "List loan applications", description = "Newest first; page defaults to 1, pageSize to 10 (max 100)")
    public ApiResponse<PageResult<LoanApplicationResponse>> listLoanApplications(
            @Valid @ModelAttribute PageQuery query) {
        PageResult<LoanApplication> page = listLoanApplicationsUseCase.execute(query);
        return ApiResponse.success(page.map(LoanApplicationResponse::fromLoanApplication));
    }

    @DeleteMapping("/{loanApplicationId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete loan application")
    public void deleteLoanApplication(
            @Parameter(description = "Loan application ID", required = true)
            @PathVariable UUID loanApplicationId) {
        log.info("Received delete loan application request: loanApplicationId={}", loanApplicationId);
        deleteLoanApplicationUseCase.execute(loanApplicationId);
    }
}
