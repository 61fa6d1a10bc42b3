package com.pos.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "order_items")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    // Which order this line belongs to
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false)
    private Order order;

    // Position of the line on the receipt, starting at 1
    @Column(nullable = false)
    private Integer lineNumber;

    // id from the menu service
    @Column(nullable = false)
    private UUID menuItemId;

    // menu item name at the time of the order
    @Column(nullable = false)
    private String itemName;

    @Column(nullable = false)
    private Integer quantity;

    @Column(nullable = false)
    private BigDecimal unitPrice;

    // unitPrice x quantity
    @Column(nullable = false)
    private BigDecimal totalPrice;

    // True when staff entered the unit price by hand
    @Column(nullable = false)
    private boolean priceOverridden;

    @Column(columnDefinition = "jsonb", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private List<UUID> variantIds = new ArrayList<>();

    @Column(columnDefinition = "jsonb", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private List<AddonSelection> addonSelections = new ArrayList<>();

    @Column(length = 500)
    private String specialInstructions;
}
