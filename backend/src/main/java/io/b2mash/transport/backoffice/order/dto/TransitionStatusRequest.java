package io.b2mash.transport.backoffice.order.dto;

import io.b2mash.transport.backoffice.order.OrderStatus;
import jakarta.validation.constraints.NotNull;

public record TransitionStatusRequest(@NotNull OrderStatus status) {}
