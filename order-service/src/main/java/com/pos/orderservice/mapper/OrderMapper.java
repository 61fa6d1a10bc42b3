package com.pos.orderservice.mapper;

import com.pos.orderservice.dto.AddonSelectionResponse;
import com.pos.orderservice.dto.CancellationInfoResponse;
import com.pos.orderservice.dto.CustomerSummary;
import com.pos.orderservice.dto.OrderItemResponse;
import com.pos.orderservice.dto.OrderResponse;
import com.pos.orderservice.dto.RefundInfoResponse;
import com.pos.orderservice.dto.StatusHistoryResponse;
import com.pos.orderservice.model.AddonSelection;
import com.pos.orderservice.model.CancellationRecord;
import com.pos.orderservice.model.Customer;
import com.pos.orderservice.model.Order;
import com.pos.orderservice.model.OrderItem;
import com.pos.orderservice.model.OrderStatusHistory;
import com.pos.orderservice.model.RefundInfo;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface OrderMapper {

    // Order -> OrderResponse
    @Mapping(source = "items", target = "items")
    @Mapping(source = "cancellation", target = "cancellation")
    OrderResponse toOrderResponse(Order order);

    List<OrderResponse> toOrderResponses(List<Order> orders);

    // (@Mapping not needed here since source and target field names are the same)
    OrderItemResponse toOrderItemResponse(OrderItem orderItem);

    AddonSelectionResponse toAddonSelectionResponse(AddonSelection addonSelection);

    CancellationInfoResponse toCancellationInfoResponse(CancellationRecord cancellation);

    RefundInfoResponse toRefundInfoResponse(RefundInfo refundInfo);

    StatusHistoryResponse toStatusHistoryResponse(OrderStatusHistory entry);

    List<StatusHistoryResponse> toStatusHistoryResponses(List<OrderStatusHistory> entries);

    @Mapping(target = "name", expression = "java(customer.getDisplayName())")
    @Mapping(target = "isNew", source = "isNew")
    CustomerSummary toCustomerSummary(Customer customer, Boolean isNew);
}
