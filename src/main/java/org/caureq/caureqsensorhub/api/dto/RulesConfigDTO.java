package org.caureq.caureqsensorhub.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

public record RulesConfigDTO(
        @PositiveOrZero Long defaultCooldownSeconds,
        @NotNull List<@Valid RuleDTO> rules
) {}
