package fin.lending.intake.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.UUID;

/**
 * MyBatis mapper for loan applications
 */
@Mapper
public interface LoanApplicationMapper {

    int insert(LoanApplicationRecord loanApplication);

    int update(LoanApplicationRecord loanApplication);

    LoanApplicationRecord findById(@Param("id") UUID id);

    List<LoanApplicationRecord> findPage(@Param("offset") long offset, @Param("limit") int limit);

    long countAll();

    List<LoanApplicationRecord> findPageByCustomerId(@Param("customerId") UUID customerId,
                                                     @Param("offset") long offset,
                                                     @Param("limit") int limit);

    long countByCustomerId(@Param("customerId") UUID customerId);

    int deleteById(@Param("id") UUID id);
}
