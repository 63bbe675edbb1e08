package com.gastro.ledger.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;

@Entity
@Table(name = "recipe_lines", uniqueConstraints = {
        @UniqueConstraint(name = "uk_recipe_variant_ingredient", columnNames = { "variant_id", "ingredient_id" })
})
@Data
public class RecipeLine {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "variant_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private ProductVariant variant;

    @ManyToOne(optional = false)
    @JoinColumn(name = "ingredient_id", nullable = false)
    private Ingredient ingredient;

    // In the ingredient's unit (kg or pieces) per one sold unit
    @Column(nullable = false, precision = 10, scale = 3)
    private BigDecimal quantityPerUnit;

    @Column(name = "is_primary")
    private boolean primary;
}
