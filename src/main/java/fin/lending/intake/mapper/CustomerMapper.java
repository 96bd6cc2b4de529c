package fin.lending.intake.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.UUID;

/**
 * MyBatis mapper for customers
 */
@Mapper
public interface CustomerMapper {
    /**
     * Insert a new customer (id supplied by the caller)
     */
    int insert(CustomerRecord customer);

    /**
     * Update name and email of an existing customer
     */
    int update(CustomerRecord customer);

    CustomerRecord findById(@Param("id") UUID id);

    CustomerRecord findByEmail(@Param("email") String email);

    /**
     * Newest first
     */
    List<CustomerRecord> findPage(@Param("offset") long offset, @Param("limit") int limit);

    long countAll();

    int deleteById(@Param("id") UUID id);
}
