package io.b2mash.credits.template.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

public record CreateFromTemplateRequest(
    @NotBlank String templateName, @Valid TemplateOverrides overrides) {}
