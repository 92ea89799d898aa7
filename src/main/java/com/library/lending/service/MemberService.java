package com.library.lending.service;

import com.library.lending.dto.request.CreateMemberRequest;
import com.library.lending.dto.response.MemberResponse;
import com.library.lending.entity.Member;
import com.library.lending.entity.MemberStatus;
import com.library.lending.exception.DuplicateEmailException;
import com.library.lending.exception.ResourceNotFoundException;
import com.library.lending.mapper.MemberMapper;
import com.library.lending.repository.BorrowingRepository;
import com.library.lending.repository.MemberRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;

@Service
@RequiredArgsConstructor
public class MemberService {

    private static final Logger log = LoggerFactory.getLogger(MemberService.class);

    private final MemberRepository memberRepository;
    private final BorrowingRepository borrowingRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public MemberResponse findById(Long id) {
        Member member = memberRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Member", id));
        return MemberMapper.toResponse(member, borrowingRepository.countByMemberId(id));
    }

    @Transactional
    public MemberResponse create(CreateMemberRequest request) {
        String email = MemberMapper.normalizeEmail(request.email());
        if (memberRepository.existsByEmail(email)) {
            throw new DuplicateEmailException(email);
        }
        Member saved = memberRepository.save(MemberMapper.toEntity(request, LocalDate.now(clock)));
        return MemberMapper.toResponse(saved, 0);
    }

    /** Open loans are left as they are; an inactive member can still return books. */
    @Transactional
    public MemberResponse updateStatus(Long id, MemberStatus status) {
        Member member = memberRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Member", id));
        if (member.getStatus() != status) {
            log.info("Member {} status {} -> {}", id, member.getStatus(), status);
            member.setStatus(status);
        }
        return MemberMapper.toResponse(memberRepository.save(member), borrowingRepository.countByMemberId(id));
    }
}
