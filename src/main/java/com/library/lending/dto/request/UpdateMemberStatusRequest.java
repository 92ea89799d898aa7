package com.library.lending.dto.request;

import com.library.lending.entity.MemberStatus;
import jakarta.validation.constraints.NotNull;

public record UpdateMemberStatusRequest(

    @NotNull(message = "Status is required")
    MemberStatus status
) {}
