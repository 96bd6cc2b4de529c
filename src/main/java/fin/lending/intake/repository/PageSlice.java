package fin.lending.intake.repository;

import lombok.Value;

import java.util.List;

/**
 * One window of a paged query together with the total row count
 *
 * @param <T> item type
 */
@Value
public class PageSlice<T> {
    List<T> items;
    long total;

    public static <T> PageSlice<T> of(List<T> items, long total) {
        return new PageSlice<>(List.copyOf(items), total);
    }
}
