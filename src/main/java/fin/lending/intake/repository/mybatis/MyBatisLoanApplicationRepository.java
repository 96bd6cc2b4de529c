package fin.lending.intake.repository.mybatis;

import fin.lending.intake.domain.LoanApplication;
import fin.lending.intake.domain.MoneyAmount;
import fin.lending.intake.mapper.LoanApplicationMapper;
import fin.lending.intake.mapper.LoanApplicationRecord;
import fin.lending.intake.repository.LoanApplicationRepository;
import fin.lending.intake.repository.PageSlice;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * MyBatis implementation of the loan application repository
 */
@Slf4j
@Repository
public class MyBatisLoanApplicationRepository implements LoanApplicationRepository {

    @Autowired
    private LoanApplicationMapper loanApplicationMapper;

    @Override
    public Optional<LoanApplication> findById(UUID id) {
        log.debug("Finding loan application by ID: loanApplicationId={}", id);
        return Optional.ofNullable(loanApplicationMapper.findById(id))
                .map(MyBatisLoanApplicationRepository::toDomain);
    }

    @Override
    public LoanApplication save(LoanApplication loanApplication) {
        if (loanApplication.isPersisted()) {
            LoanApplicationRecord row = toRecord(loanApplication);
            log.debug("Updating loan application: loanApplicationId={}", row.getId());
            if (loanApplicationMapper.update(row) == 0) {
                throw new IllegalStateException(
                        "Loan application vanished during update: loanApplicationId=" + row.getId());
            }
            return loanApplication;
        }

        LoanApplication inserted = loanApplication.withId(UUID.randomUUID());
        log.debug("Creating loan application: loanApplicationId={}, customerId={}",
                inserted.getId().orElseThrow(), inserted.getCustomerId());
        loanApplicationMapper.insert(toRecord(inserted));
        return inserted;
    }

    @Override
    public PageSlice<LoanApplication> findAll(long skip, int take) {
        log.debug("Finding loan applications page: skip={}, take={}", skip, take);
        return PageSlice.of(toDomain(loanApplicationMapper.findPage(skip, take)), loanApplicationMapper.countAll());
    }

    @Override
    public PageSlice<LoanApplication> findByCustomerId(UUID customerId, long skip, int take) {
        log.debug("Finding loan applications by customer: customerId={}, skip={}, take={}", customerId, skip, take);
        return PageSlice.of(
                toDomain(loanApplicationMapper.findPageByCustomerId(customerId, skip, take)),
                loanApplicationMapper.countByCustomerId(customerId));
    }

    @Override
    public void delete(UUID id) {
        log.debug("Deleting loan application: loanApplicationId={}", id);
        loanApplicationMapper.deleteById(id);
    }

    private static List<LoanApplication> toDomain(List<LoanApplicationRecord> records) {
        return records.stream()
                .map(MyBatisLoanApplicationRepository::toDomain)
                .collect(Collectors.toList());
    }

    /**
     * Single conversion point from stored columns to domain values
     */
    private static LoanApplication toDomain(LoanApplicationRecord row) {
        String currency = row.getCurrencyCode() != null ? row.getCurrencyCode() : MoneyAmount.DEFAULT_CURRENCY;
        return LoanApplication.restore(
                row.getId(),
                row.getCustomerId(),
                new MoneyAmount(row.getAmount(), currency),
                row.getTermMonths(),
                row.getAnnualInterestRate(),
                new MoneyAmount(row.getMonthlyPayment(), currency),
                row.getCreatedAt());
    }

    private static LoanApplicationRecord toRecord(LoanApplication loanApplication) {
        return LoanApplicationRecord.builder()
                .id(loanApplication.getId().orElse(null))
                .customerId(loanApplication.getCustomerId())
                .amount(loanApplication.getAmount().getAmount())
                .currencyCode(loanApplication.getAmount().getCurrencyCode())
                .termMonths(loanApplication.getTermMonths())
                .annualInterestRate(loanApplication.getAnnualInterestRate())
                .monthlyPayment(loanApplication.getMonthlyPayment().getAmount())
                .createdAt(loanApplication.getCreatedAt())
                .build();
    }
}
