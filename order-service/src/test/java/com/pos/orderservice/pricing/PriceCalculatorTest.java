package com.pos.orderservice.pricing;

import com.pos.orderservice.exception.InvalidSelectionException;
import com.pos.orderservice.model.AddonSnapshot;
import com.pos.orderservice.model.MenuItemSnapshot;
import com.pos.orderservice.model.VariantSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PriceCalculatorTest {

    private PriceCalculator calculator;

    private UUID smallBowlId;
    private UUID largeBowlId;
    private UUID quinoaId;
    private MenuItemSnapshot bowl;

    @BeforeEach
    void setUp() {
        calculator = new PriceCalculator();

        smallBowlId = UUID.randomUUID();
        largeBowlId = UUID.randomUUID();
        quinoaId = UUID.randomUUID();

        bowl = variantItem("Buddha Bowl",
                variant(smallBowlId, "6oz", "259", true),
                variant(largeBowlId, "10oz", "329", true));
        bowl.getAddons().add(AddonSnapshot.builder()
                .addonId(quinoaId)
                .name("Quinoa")
                .basePrice(new BigDecimal("70"))
                .categoryPriceOverride(new BigDecimal("50"))
                .categoryLinked(true)
                .available(true)
                .build());
    }

    @Test
    void calculate_VariantWithCategoryPricedAddon() {
        PriceBreakdown breakdown = calculator.calculate(bowl, List.of(smallBowlId),
                List.of(new SelectedAddon(quinoaId, 2)));

        assertThat(breakdown.getBasePrice()).isEqualByComparingTo("0");
        assertThat(breakdown.getVariantContributions()).hasSize(1);
        assertThat(breakdown.getVariantContributions().get(0).getName()).isEqualTo("6oz");
        assertThat(breakdown.getAddonContributions()).hasSize(1);
        assertThat(breakdown.getAddonContributions().get(0).getUnitPrice()).isEqualByComparingTo("50");
        assertThat(breakdown.getAddonsTotal()).isEqualByComparingTo("100");
        assertThat(breakdown.getTotalPrice()).isEqualByComparingTo("359");
    }

    @Test
    void calculate_SimpleItem_BasePlusAddons() {
        UUID cheeseId = UUID.randomUUID();
        MenuItemSnapshot toast = simpleItem("Toast", "120");
        toast.getAddons().add(addon(cheeseId, "Cheese", "30", null, null, true, null));

        PriceBreakdown breakdown = calculator.calculate(toast, List.of(), List.of(new SelectedAddon(cheeseId, 3)));

        assertThat(breakdown.getBasePrice()).isEqualByComparingTo("120");
        assertThat(breakdown.getVariantContributions()).isEmpty();
        assertThat(breakdown.getAddonsTotal()).isEqualByComparingTo("90");
        assertThat(breakdown.getTotalPrice()).isEqualByComparingTo("210");
    }

    @Test
    void calculate_MultipleVariants_AreSummed() {
        PriceBreakdown breakdown = calculator.calculate(bowl, List.of(smallBowlId, largeBowlId), List.of());

        assertThat(breakdown.getTotalPrice()).isEqualByComparingTo("588");
    }

    @Test
    void calculate_NullSelections_TreatedAsEmpty() {
        PriceBreakdown breakdown = calculator.calculate(simpleItem("Tea", "40"), null, null);

        assertThat(breakdown.getTotalPrice()).isEqualByComparingTo("40");
        assertThat(breakdown.getAddonsTotal()).isEqualByComparingTo("0");
    }

    @Test
    void addonPrice_ItemOverrideBeatsCategoryOverride() {
        UUID syrupId = UUID.randomUUID();
        MenuItemSnapshot latte = simpleItem("Latte", "180");
        latte.getAddons().add(addon(syrupId, "Hazelnut", "40", "35", "25", true, null));

        PriceBreakdown breakdown = calculator.calculate(latte, List.of(), List.of(new SelectedAddon(syrupId, 1)));

        assertThat(breakdown.getAddonContributions().get(0).getUnitPrice()).isEqualByComparingTo("25");
        assertThat(breakdown.getTotalPrice()).isEqualByComparingTo("205");
    }

    @Test
    void addonPrice_FallsBackToBasePrice() {
        UUID syrupId = UUID.randomUUID();
        MenuItemSnapshot latte = simpleItem("Latte", "180");
        latte.getAddons().add(addon(syrupId, "Hazelnut", "40", null, null, true, null));

        PriceBreakdown breakdown = calculator.calculate(latte, List.of(), List.of(new SelectedAddon(syrupId, 1)));

        assertThat(breakdown.getAddonContributions().get(0).getUnitPrice()).isEqualByComparingTo("40");
    }

    @Test
    void addonEligibility_ItemLevelRuleAllowsUnlinkedAddon() {
        UUID extraShotId = UUID.randomUUID();
        MenuItemSnapshot latte = simpleItem("Latte", "180");
        latte.getAddons().add(addon(extraShotId, "Extra shot", "50", null, null, false, Boolean.TRUE));

        PriceBreakdown breakdown = calculator.calculate(latte, List.of(), List.of(new SelectedAddon(extraShotId, 1)));

        assertThat(breakdown.getTotalPrice()).isEqualByComparingTo("230");
    }

    @Test
    void addonEligibility_ItemLevelRuleBlocksLinkedAddon() {
        UUID extraShotId = UUID.randomUUID();
        MenuItemSnapshot latte = simpleItem("Latte", "180");
        latte.getAddons().add(addon(extraShotId, "Extra shot", "50", null, null, true, Boolean.FALSE));

        assertThatThrownBy(() -> calculator.calculate(latte, List.of(), List.of(new SelectedAddon(extraShotId, 1))))
                .isInstanceOf(InvalidSelectionException.class)
                .hasMessageContaining("not available for Latte");
    }

    @Test
    void addonEligibility_UnlinkedWithoutItemRule_Fails() {
        UUID extraShotId = UUID.randomUUID();
        MenuItemSnapshot latte = simpleItem("Latte", "180");
        latte.getAddons().add(addon(extraShotId, "Extra shot", "50", null, null, false, null));

        assertThatThrownBy(() -> calculator.calculate(latte, List.of(), List.of(new SelectedAddon(extraShotId, 1))))
                .isInstanceOf(InvalidSelectionException.class);
    }

    @Test
    void addon_UnknownToItem_Fails() {
        assertThatThrownBy(() -> calculator.calculate(bowl, List.of(smallBowlId),
                List.of(new SelectedAddon(UUID.randomUUID(), 1))))
                .isInstanceOf(InvalidSelectionException.class);
    }

    @Test
    void addon_ZeroQuantity_Fails() {
        assertThatThrownBy(() -> calculator.calculate(bowl, List.of(smallBowlId),
                List.of(new SelectedAddon(quinoaId, 0))))
                .isInstanceOf(InvalidSelectionException.class)
                .hasMessageContaining("at least 1");
    }

    @Test
    void addon_AboveMaxQuantity_Fails() {
        bowl.getAddons().get(0).setMaxQuantity(2);

        assertThatThrownBy(() -> calculator.calculate(bowl, List.of(smallBowlId),
                List.of(new SelectedAddon(quinoaId, 3))))
                .isInstanceOf(InvalidSelectionException.class)
                .hasMessageContaining("Maximum quantity");
    }

    @Test
    void addon_Unavailable_Fails() {
        bowl.getAddons().get(0).setAvailable(false);

        assertThatThrownBy(() -> calculator.calculate(bowl, List.of(smallBowlId),
                List.of(new SelectedAddon(quinoaId, 1))))
                .isInstanceOf(InvalidSelectionException.class);
    }

    @Test
    void variant_RequiredButMissing_Fails() {
        assertThatThrownBy(() -> calculator.calculate(bowl, List.of(), List.of()))
                .isInstanceOf(InvalidSelectionException.class)
                .hasMessageContaining("Variant is required");
    }

    @Test
    void variant_FromAnotherItem_Fails() {
        assertThatThrownBy(() -> calculator.calculate(bowl, List.of(UUID.randomUUID()), List.of()))
                .isInstanceOf(InvalidSelectionException.class)
                .hasMessageContaining("does not belong");
    }

    @Test
    void variant_Unavailable_Fails() {
        bowl.getVariants().get(1).setAvailable(false);

        assertThatThrownBy(() -> calculator.calculate(bowl, List.of(largeBowlId), List.of()))
                .isInstanceOf(InvalidSelectionException.class)
                .hasMessageContaining("10oz");
    }

    @Test
    void variant_OnItemWithoutVariants_Fails() {
        assertThatThrownBy(() -> calculator.calculate(simpleItem("Tea", "40"), List.of(smallBowlId), List.of()))
                .isInstanceOf(InvalidSelectionException.class);
    }

    @Test
    void item_Unavailable_Fails() {
        bowl.setAvailable(false);

        assertThatThrownBy(() -> calculator.calculate(bowl, List.of(smallBowlId), List.of()))
                .isInstanceOf(InvalidSelectionException.class)
                .hasMessageContaining("not available");
    }

    @Test
    void item_WithoutPrice_Fails() {
        MenuItemSnapshot broken = simpleItem("Mystery", "1");
        broken.setBasePrice(null);

        assertThatThrownBy(() -> calculator.calculate(broken, List.of(), List.of()))
                .isInstanceOf(InvalidSelectionException.class);
    }

    @Test
    void variant_WithoutPrice_Fails() {
        bowl.getVariants().get(0).setPrice(null);

        assertThatThrownBy(() -> calculator.calculate(bowl, List.of(smallBowlId), List.of()))
                .isInstanceOf(InvalidSelectionException.class)
                .hasMessageContaining("6oz has no price configured");
    }

    @Test
    void addon_WithoutAnyPrice_Fails() {
        AddonSnapshot quinoa = bowl.getAddons().get(0);
        quinoa.setBasePrice(null);
        quinoa.setCategoryPriceOverride(null);

        assertThatThrownBy(() -> calculator.calculate(bowl, List.of(smallBowlId),
                List.of(new SelectedAddon(quinoaId, 1))))
                .isInstanceOf(InvalidSelectionException.class)
                .hasMessageContaining("Quinoa has no price configured");
    }

    // --- helpers ---

    private static MenuItemSnapshot simpleItem(String name, String basePrice) {
        MenuItemSnapshot item = new MenuItemSnapshot();
        item.setMenuItemId(UUID.randomUUID());
        item.setName(name);
        item.setBasePrice(new BigDecimal(basePrice));
        item.setHasVariants(false);
        item.setAvailable(true);
        item.setVariants(new ArrayList<>());
        item.setAddons(new ArrayList<>());
        return item;
    }

    private static MenuItemSnapshot variantItem(String name, VariantSnapshot... variants) {
        MenuItemSnapshot item = simpleItem(name, "1");
        item.setBasePrice(null);
        item.setHasVariants(true);
        item.setVariants(new ArrayList<>(List.of(variants)));
        return item;
    }

    private static VariantSnapshot variant(UUID id, String name, String price, boolean available) {
        return VariantSnapshot.builder().variantId(id).name(name).price(new BigDecimal(price)).available(available).build();
    }

    private static AddonSnapshot addon(UUID id, String name, String basePrice, String categoryOverride,
                                       String itemOverride, boolean categoryLinked, Boolean itemAllowed) {
        return AddonSnapshot.builder()
                .addonId(id)
                .name(name)
                .basePrice(new BigDecimal(basePrice))
                .categoryPriceOverride(categoryOverride == null ? null : new BigDecimal(categoryOverride))
                .itemPriceOverride(itemOverride == null ? null : new BigDecimal(itemOverride))
                .categoryLinked(categoryLinked)
                .itemAllowed(itemAllowed)
                .available(true)
                .build();
    }
}
