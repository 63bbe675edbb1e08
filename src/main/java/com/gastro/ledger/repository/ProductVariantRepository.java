package com.gastro.ledger.repository;

import com.gastro.ledger.model.ProductVariant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface ProductVariantRepository extends JpaRepository<ProductVariant, Long> {

    @Query("SELECT DISTINCT v FROM ProductVariant v JOIN FETCH v.product "
            + "LEFT JOIN FETCH v.recipeLines rl LEFT JOIN FETCH rl.ingredient WHERE v.active = true")
    List<ProductVariant> findActiveWithRecipe();

    @Query("SELECT v FROM ProductVariant v JOIN FETCH v.product WHERE v.id IN :ids")
    List<ProductVariant> findWithProductByIdIn(@Param("ids") Collection<Long> ids);
}
