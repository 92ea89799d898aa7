package com.library.lending.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record CreateAuthorRequest(

    @NotBlank(message = "First name must not be blank")
    @Size(max = 50, message = "First name must not exceed 50 characters")
    String firstName,

    @NotBlank(message = "Last name must not be blank")
    @Size(max = 50, message = "Last name must not exceed 50 characters")
    String lastName,

    @PastOrPresent(message = "Birth date must not be in the future")
    LocalDate birthDate,

    @Size(max = 50, message = "Nationality must not exceed 50 characters")
    String nationality
) {}
