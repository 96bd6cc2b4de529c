package fin.lending.intake.controller;

import fin.lending.intake.domain.Customer;
import fin.lending.intake.dto.ApiResponse;
import fin.lending.intake.dto.CreateCustomerRequest;
import fin.lending.intake.dto.CustomerResponse;
import fin.lending.intake.dto.LoanApplicationResponse;
import fin.lending.intake.dto.PageQuery;
import fin.lending.intake.dto.PageResult;
import fin.lending.intake.dto.UpdateCustomerRequest;
import fin.lending.intake.service.customer.CreateCustomerUseCase;
import fin.lending.intake.service.customer.DeleteCustomerUseCase;
import fin.lending.intake.service.customer.GetCustomerByIdUseCase;
import fin.lending.intake.service.customer.ListCustomersUseCase;
import fin.lending.intake.service.customer.UpdateCustomerUseCase;
import fin.lending.intake.service.loan.GetLoanApplicationsByCustomerIdUseCase;
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
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST Controller for Customer management
 * Request bodies are validated by the use cases so that every violation is reported at once
 */
@Slf4j
@RestController
@RequestMapping("/api/customers")
@Tag(name = "Customers", description = "APIs for customer operations")
public class CustomerController {

    @Autowired
    private CreateCustomerUseCase createCustomerUseCase;

    @Autowired
    private UpdateCustomerUseCase updateCustomerUseCase;

    @Autowired
    private GetCustomerByIdUseCase getCustomerByIdUseCase;

    @Autowired
    private DeleteCustomerUseCase deleteCustomerUseCase;

    @Autowired
    private ListCustomersUseCase listCustomersUseCase;

    @Autowired
    private GetLoanApplicationsByCustomerIdUseCase getLoanApplicationsByCustomerIdUseCase;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create a customer", description = "Register a new customer; email must be unique")
    public ApiResponse<CustomerResponse> createCustomer(@RequestBody CreateCustomerRequest request) {
        Customer customer = createCustomerUseCase.execute(request);
        return ApiResponse.success(201, "Customer created successfully", CustomerResponse.fromCustomer(customer));
    }

    @GetMapping("/{customerId}")
    @Operation(summary = "Get customer by ID")
    public ApiResponse<CustomerResponse> getCustomer(
            @Parameter(description = "Customer ID", required = true)
            @PathVariable UUID customerId) {
        return ApiResponse.success(CustomerResponse.fromCustomer(getCustomerByIdUseCase.execute(customerId)));
    }

    @PatchMapping("/{customerId}")
    @Operation(summary = "Update customer", description = "Change full name and/or email; at least one is required")
    public ApiResponse<CustomerResponse> updateCustomer(
            @Parameter(description = "Customer ID", required = true)
            @PathVariable UUID customerId,
            @RequestBody UpdateCustomerRequest request) {
        Customer customer = updateCustomerUseCase.execute(customerId, request);
        return ApiResponse.success(200, "Customer updated successfully", CustomerResponse.fromCustomer(customer));
    }

    @DeleteMapping("/{customerId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete customer")
    public void deleteCustomer(
            @Parameter(description = "Customer ID", required = true)
            @PathVariable UUID customerId) {
        deleteCustomerUseCase.execute(customerId);
    }

    @GetMapping
    @Operation(summary = "List customers", description = "Newest first; page defaults to 1, pageSize to 10 (max 100)")
    public ApiResponse<PageResult<CustomerResponse>> listCustomers(@Valid @ModelAttribute PageQuery query) {
        PageResult<Customer> page = listCustomersUseCase.execute(query);
        return ApiResponse.success(page.map(CustomerResponse::fromCustomer));
    }

    @GetMapping("/{customerId}/loan-applications")
    @Operation(summary = "List a customer's loan applications")
    public ApiResponse<PageResult<LoanApplicationResponse>> listLoanApplications(
            @Parameter(description = "Customer ID", required = true)
            @PathVariable UUID customerId,
            @Valid @ModelAttribute PageQuery query) {
        return ApiResponse.success(getLoanApplicationsByCustomerIdUseCase.execute(customerId, query)
                .map(LoanApplicationResponse::fromLoanApplication));
    }
}
