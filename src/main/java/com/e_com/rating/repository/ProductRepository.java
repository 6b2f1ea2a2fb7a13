package com.e_com.rating.repository;

import com.e_com.rating.model.Product;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface ProductRepository extends JpaRepository<Product, Long> {

    Optional<Product> findBySlug(String slug);

    // SELECT ... FOR UPDATE: serializes rating recomputes per product
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from Product p where p.slug = :slug")
    Optional<Product> findBySlugForUpdate(@Param("slug") String slug);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from Product p where p.id = :id")
    Optional<Product> findByIdForUpdate(@Param("id") Long id);
}
