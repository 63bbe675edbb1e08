package com.gastro.ledger.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Entity
@Table(name = "product_variants")
@Data
public class ProductVariant {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "product_id", nullable = false)
    private Product product;

    private String name; // null for the standard size

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    private boolean active = true;

    @OneToMany(mappedBy = "variant", cascade = CascadeType.ALL, orphanRemoval = true)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<RecipeLine> recipeLines = new ArrayList<>();

    public void addRecipeLine(RecipeLine line) {
        line.setVariant(this);
        recipeLines.add(line);
    }

    public Optional<RecipeLine> getPrimaryLine() {
        return recipeLines.stream().filter(RecipeLine::isPrimary).findFirst();
    }

    public String getDisplayName() {
        String productName = product != null ? product.getName() : "#" + id;
        return name == null || name.isBlank() ? productName : productName + " (" + name + ")";
    }
}
