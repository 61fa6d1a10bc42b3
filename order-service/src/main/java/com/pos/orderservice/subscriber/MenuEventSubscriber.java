package com.pos.orderservice.subscriber;

import com.pos.common.contracts.MenuItemEventDto;
import com.pos.orderservice.config.AmqpConfig;
import com.pos.orderservice.model.AddonSnapshot;
import com.pos.orderservice.model.MenuItemSnapshot;
import com.pos.orderservice.model.VariantSnapshot;
import com.pos.orderservice.repository.MenuItemSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.amqp.support.AmqpHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Keeps the local menu snapshot in sync with the menu service.
 * Orders are priced against this copy only.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MenuEventSubscriber {

    private final MenuItemSnapshotRepository snapshotRepository;

    @RabbitListener(queues = AmqpConfig.Q_MENU_UPDATES)
    @Transactional
    public void handleMenuEvent(@Payload MenuItemEventDto event,
                                @Header(AmqpHeaders.RECEIVED_ROUTING_KEY) String routingKey) {
        if (event.getMenuItemId() == null) {
            // Redelivery would fail the same way, send it to the DLQ
            throw new AmqpRejectAndDontRequeueException("Menu event without menu_item_id, routingKey=" + routingKey);
        }

        switch (routingKey) {
            case AmqpConfig.ROUTING_KEY_MENU_ITEM_UPDATED -> upsert(event);
            case AmqpConfig.ROUTING_KEY_MENU_ITEM_DELETED -> delete(event);
            default -> log.warn("Ignoring menu event with unknown routing key. routingKey={}, menuItemId={}",
                    routingKey, event.getMenuItemId());
        }
    }

    // "upsert" (update or insert) logic
    void upsert(MenuItemEventDto event) {
        MenuItemSnapshot snapshot = snapshotRepository.findById(event.getMenuItemId())
                .orElseGet(MenuItemSnapshot::new);

        snapshot.setMenuItemId(event.getMenuItemId());
        snapshot.setCategoryId(event.getCategoryId());
        snapshot.setName(event.getName());
        snapshot.setHasVariants(event.isHasVariants());
        // a variant item never carries its own price
        snapshot.setBasePrice(event.isHasVariants() ? null : event.getBasePrice());
        snapshot.setAvailable(event.isAvailable());
        snapshot.setVariants(toVariants(event.getVariants()));
        snapshot.setAddons(toAddons(event.getAddons()));

        snapshotRepository.save(snapshot);
        log.info("Menu item snapshot updated. menuItemId={}, available={}, variants={}, addons={}",
                snapshot.getMenuItemId(), snapshot.isAvailable(),
                snapshot.getVariants().size(), snapshot.getAddons().size());
    }

    void delete(MenuItemEventDto event) {
        if (!snapshotRepository.existsById(event.getMenuItemId())) {
            log.debug("Menu item snapshot already absent. menuItemId={}", event.getMenuItemId());
            return;
        }
        snapshotRepository.deleteById(event.getMenuItemId());
        log.info("Menu item snapshot deleted. menuItemId={}", event.getMenuItemId());
    }

    private List<VariantSnapshot> toVariants(List<MenuItemEventDto.Variant> variants) {
        if (variants == null) {
            return new ArrayList<>();
        }
        return variants.stream()
                .map(v -> VariantSnapshot.builder()
                        .variantId(v.getVariantId())
                        .name(v.getName())
                        .price(v.getPrice())
                        .available(v.isAvailable())
                        .build())
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private List<AddonSnapshot> toAddons(List<MenuItemEventDto.Addon> addons) {
        if (addons == null) {
            return new ArrayList<>();
        }
        return addons.stream()
                .map(a -> AddonSnapshot.builder()
                        .addonId(a.getAddonId())
                        .name(a.getName())
                        .basePrice(a.getPrice())
                        .categoryPriceOverride(a.getCategoryPriceOverride())
                        .itemPriceOverride(a.getItemPriceOverride())
                        .categoryLinked(a.isCategoryLinked())
                        .itemAllowed(a.getItemAllowed())
                        .maxQuantity(a.getMaxQuantity())
                        .available(a.isAvailable())
                        .build())
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
