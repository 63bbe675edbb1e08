package com.gastro.ledger.config;

import com.gastro.ledger.dto.IngredientRequest;
import com.gastro.ledger.dto.IngredientResponse;
import com.gastro.ledger.dto.VariantRequest;
import com.gastro.ledger.model.UnitType;
import com.gastro.ledger.repository.IngredientRepository;
import com.gastro.ledger.service.CatalogService;
import com.gastro.ledger.service.SettingsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.List;

@Slf4j
@Configuration
@ConditionalOnProperty(name = "ledger.seed-demo-data", havingValue = "true")
public class DataInitializer {

    @Bean
    CommandLineRunner init(IngredientRepository ingredientRepo, CatalogService catalogService,
            SettingsService settingsService) {
        return args -> {
            if (ingredientRepo.count() > 0) {
                return;
            }

            IngredientResponse meat = ingredient(catalogService, "Kebab meat", UnitType.WEIGHT, "kg");
            IngredientResponse pita = ingredient(catalogService, "Pita bread", UnitType.COUNT, "szt");
            IngredientResponse tortilla = ingredient(catalogService, "Tortilla", UnitType.COUNT, "szt");
            IngredientResponse cabbage = ingredient(catalogService, "Cabbage", UnitType.WEIGHT, "kg");
            IngredientResponse fries = ingredient(catalogService, "Fries", UnitType.WEIGHT, "kg");

            variant(catalogService, "Kebab in pita", null, "28.00",
                    line(pita, "1", true), line(meat, "0.150", false), line(cabbage, "0.050", false));
            variant(catalogService, "Kebab wrap", null, "30.00",
                    line(tortilla, "1", true), line(meat, "0.150", false), line(cabbage, "0.040", false));
            variant(catalogService, "Fries", "Large", "14.00", line(fries, "0.250", true));

            settingsService.updateSetting(SettingsService.KEY_CURRENCY_LABEL, "PLN");
            log.info("Seeded demo catalog");
        };
    }

    private static IngredientResponse ingredient(CatalogService catalogService, String name, UnitType unitType,
            String unitLabel) {
        IngredientRequest request = new IngredientRequest();
        request.setName(name);
        request.setUnitType(unitType);
        request.setUnitLabel(unitLabel);
        return catalogService.createIngredient(request);
    }

    private static void variant(CatalogService catalogService, String product, String variant, String price,
            VariantRequest.RecipeLineRequest... lines) {
        VariantRequest request = new VariantRequest();
        request.setProductName(product);
        request.setVariantName(variant);
        request.setPrice(new BigDecimal(price));
        request.setRecipe(List.of(lines));
        catalogService.createVariant(request);
    }

    private static VariantRequest.RecipeLineRequest line(IngredientResponse ingredient, String perUnit,
            boolean primary) {
        VariantRequest.RecipeLineRequest line = new VariantRequest.RecipeLineRequest();
        line.setIngredientId(ingredient.id());
        line.setQuantityPerUnit(new BigDecimal(perUnit));
        line.setPrimary(primary);
        return line;
    }
}
