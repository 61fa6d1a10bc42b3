package com.pos.orderservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Local read-only copy of a menu item, kept in sync from menu service events.
 */
@Entity
@Table(name = "menu_item_snapshots")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class MenuItemSnapshot {

    @Id // Get id from menu service
    @ToString.Include
    private UUID menuItemId;

    private UUID categoryId;

    @Column(nullable = false)
    @ToString.Include
    private String name;

    // Null when the item is priced by its variants
    private BigDecimal basePrice;

    @Column(nullable = false)
    private boolean hasVariants;

    @Column(nullable = false)
    private boolean isAvailable;

    @Column(columnDefinition = "jsonb", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private List<VariantSnapshot> variants = new ArrayList<>();

    @Column(columnDefinition = "jsonb", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private List<AddonSnapshot> addons = new ArrayList<>();

    @UpdateTimestamp
    private Instant updatedAt;

    public Optional<VariantSnapshot> findVariant(UUID variantId) {
        return variants.stream()
                .filter(v -> v.getVariantId().equals(variantId))
                .findFirst();
    }

    public Optional<AddonSnapshot> findAddon(UUID addonId) {
        return addons.stream()
                .filter(a -> a.getAddonId().equals(addonId))
                .findFirst();
    }
}
