package com.library.lending.repository;

import com.library.lending.entity.Member;
import com.library.lending.entity.MemberStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface MemberRepository extends JpaRepository<Member, Long> {

    boolean existsByEmail(String email);

    long countByStatus(MemberStatus status);

    List<Member> findAllByOrderByLastNameAscFirstNameAscIdAsc();
}
