package com.library.lending.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateCategoryRequest(

    @NotBlank(message = "Category name must not be blank")
    @Size(max = 100, message = "Category name must not exceed 100 characters")
    String name,

    @Size(max = 5000, message = "Description must not exceed 5000 characters")
    String description
) {}
