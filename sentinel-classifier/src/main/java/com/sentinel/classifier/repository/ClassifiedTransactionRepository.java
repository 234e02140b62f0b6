package com.sentinel.classifier.repository;

import com.sentinel.classifier.engine.Category;
import com.sentinel.classifier.entity.ClassifiedTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for the classification history.
 */
@Repository
public interface ClassifiedTransactionRepository extends JpaRepository<ClassifiedTransaction, Long> {

    /**
     * All transactions in the order they were classified
     */
    List<ClassifiedTransaction> findAllByOrderByIdAsc();

    List<ClassifiedTransaction> findByCategoryOrderByIdAsc(Category category);

    /**
     * Number of stored transactions per category; categories without rows are absent
     */
    @Query("SELECT t.category AS category, COUNT(t) AS total FROM ClassifiedTransaction t GROUP BY t.category")
    List<CategoryCount> countGroupedByCategory();

    interface CategoryCount {
        Category getCategory();

        Long getTotal();
    }
}
