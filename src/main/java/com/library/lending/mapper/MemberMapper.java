package com.library.lending.mapper;

import com.library.lending.dto.request.CreateMemberRequest;
import com.library.lending.dto.response.MemberResponse;
import com.library.lending.entity.Member;
import com.library.lending.entity.MemberStatus;

import java.time.LocalDate;
import java.util.Locale;

public final class MemberMapper {

    private MemberMapper() {}

    public static Member toEntity(CreateMemberRequest request, LocalDate membershipDate) {
        Member member = new Member();
        member.setFirstName(request.firstName().trim());
        member.setLastName(request.lastName().trim());
        member.setEmail(normalizeEmail(request.email()));
        member.setPhone(request.phone());
        member.setAddress(request.address());
        member.setMembershipDate(membershipDate);
        member.setStatus(MemberStatus.ACTIVE);
        return member;
    }

    public static MemberResponse toResponse(Member member, long totalBorrowings) {
        return new MemberResponse(
            member.getId(),
            member.getFirstName(),
            member.getLastName(),
            member.getFullName(),
            member.getEmail(),
            member.getPhone(),
            member.getAddress(),
            member.getStatus(),
            member.getMembershipDate(),
            totalBorrowings
        );
    }

    public static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
