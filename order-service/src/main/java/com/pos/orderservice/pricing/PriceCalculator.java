package com.pos.orderservice.pricing;

import com.pos.orderservice.exception.InvalidSelectionException;
import com.pos.orderservice.model.AddonSnapshot;
import com.pos.orderservice.model.MenuItemSnapshot;
import com.pos.orderservice.model.VariantSnapshot;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Prices a single menu item with its variant and addon selections.
 * Pure function of its inputs, no I/O.
 */
@Component
public class PriceCalculator {

    /**
     * @param item       the menu item as currently offered
     * @param variantIds selected variants, may be empty for items without variants
     * @param addons     (addonId, quantity) pairs, may be empty
     * @throws InvalidSelectionException when the selection cannot be priced for this item
     */
    public PriceBreakdown calculate(MenuItemSnapshot item,
                                    Collection<UUID> variantIds,
                                    Collection<SelectedAddon> addons) {
        List<UUID> selectedVariants = variantIds == null ? List.of() : new ArrayList<>(variantIds);
        List<SelectedAddon> selectedAddons = addons == null ? List.of() : new ArrayList<>(addons);

        if (!item.isAvailable()) {
            throw new InvalidSelectionException("Menu item " + item.getName() + " is not available");
        }

        BigDecimal basePrice;
        List<VariantContribution> variantContributions = new ArrayList<>();

        if (item.isHasVariants()) {
            if (selectedVariants.isEmpty()) {
                throw new InvalidSelectionException("Variant is required for " + item.getName());
            }
            // the base price never contributes once variants exist
            basePrice = BigDecimal.ZERO;
            variantContributions = priceVariants(item, selectedVariants);
        } else {
            if (!selectedVariants.isEmpty()) {
                throw new InvalidSelectionException(item.getName() + " has no variants to select");
            }
            if (item.getBasePrice() == null) {
                throw new InvalidSelectionException(item.getName() + " has no price configured");
            }
            basePrice = item.getBasePrice();
        }

        List<AddonContribution> addonContributions = priceAddons(item, selectedAddons);

        BigDecimal variantsTotal = variantContributions.stream()
                .map(VariantContribution::getPrice)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal addonsTotal = addonContributions.stream()
                .map(AddonContribution::getTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return PriceBreakdown.builder()
                .menuItemId(item.getMenuItemId())
                .menuItemName(item.getName())
                .basePrice(basePrice)
                .variantContributions(variantContributions)
                .addonContributions(addonContributions)
                .addonsTotal(addonsTotal)
                .totalPrice(basePrice.add(variantsTotal).add(addonsTotal))
                .build();
    }

    private List<VariantContribution> priceVariants(MenuItemSnapshot item, List<UUID> variantIds) {
        Set<UUID> seen = new HashSet<>();
        List<VariantContribution> contributions = new ArrayList<>();

        for (UUID variantId : variantIds) {
            if (!seen.add(variantId)) {
                throw new InvalidSelectionException("Variant " + variantId + " selected more than once");
            }
            VariantSnapshot variant = item.findVariant(variantId)
                    .orElseThrow(() -> new InvalidSelectionException(
                            "Variant " + variantId + " does not belong to " + item.getName()));
            if (!variant.isAvailable()) {
                throw new InvalidSelectionException("Selected variant " + variant.getName() + " is not available");
            }
            if (variant.getPrice() == null) {
                throw new InvalidSelectionException("Variant " + variant.getName() + " has no price configured");
            }
            contributions.add(VariantContribution.builder()
                    .variantId(variant.getVariantId())
                    .name(variant.getName())
                    .price(variant.getPrice())
                    .build());
        }
        return contributions;
    }

    private List<AddonContribution> priceAddons(MenuItemSnapshot item, List<SelectedAddon> addons) {
        Set<UUID> seen = new HashSet<>();
        List<AddonContribution> contributions = new ArrayList<>();

        for (SelectedAddon selection : addons) {
            UUID addonId = selection.getAddonId();
            if (!seen.add(addonId)) {
                throw new InvalidSelectionException("Add-on " + addonId + " selected more than once");
            }
            if (selection.getQuantity() < 1) {
                throw new InvalidSelectionException("Add-on quantity must be at least 1");
            }

            AddonSnapshot addon = item.findAddon(addonId)
                    .filter(AddonSnapshot::isEligible)
                    .orElseThrow(() -> new InvalidSelectionException(
                            "Add-on " + addonId + " is not available for " + item.getName()));

            if (addon.getMaxQuantity() != null && selection.getQuantity() > addon.getMaxQuantity()) {
                throw new InvalidSelectionException(
                        "Maximum quantity for " + addon.getName() + " is " + addon.getMaxQuantity());
            }

            BigDecimal unitPrice = addon.getEffectivePrice();
            if (unitPrice == null) {
                throw new InvalidSelectionException("Add-on " + addon.getName() + " has no price configured");
            }
            contributions.add(AddonContribution.builder()
                    .addonId(addonId)
                    .name(addon.getName())
                    .unitPrice(unitPrice)
                    .quantity(selection.getQuantity())
                    .total(unitPrice.multiply(BigDecimal.valueOf(selection.getQuantity())))
                    .build());
        }
        return contributions;
    }
}
