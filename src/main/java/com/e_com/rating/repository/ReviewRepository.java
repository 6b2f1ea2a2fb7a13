package com.e_com.rating.repository;

import com.e_com.rating.model.Review;
import com.e_com.rating.model.ReviewState;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ReviewRepository extends JpaRepository<Review, Long> {

    @EntityGraph(attributePaths = "product")
    List<Review> findByStateOrderByIdAsc(ReviewState state);

    // Newest first; same-day reviews fall back to creation order
    List<Review> findByProductIdAndStateOrderBySubmittedOnDescIdDesc(Long productId, ReviewState state, Pageable pageable);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from Review r where r.id = :id and r.state = :state")
    Optional<Review> findByIdAndStateForUpdate(@Param("id") Long id, @Param("state") ReviewState state);

    @Query("select count(r) as activeCount, coalesce(sum(r.grade), 0) as gradeTotal "
            + "from Review r where r.product.id = :productId and r.state = :state")
    GradeTally tallyGrades(@Param("productId") Long productId, @Param("state") ReviewState state);

    interface GradeTally {
        Number getActiveCount();

        Number getGradeTotal();
    }
}
