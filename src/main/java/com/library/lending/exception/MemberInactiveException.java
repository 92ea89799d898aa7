package com.library.lending.exception;

public class MemberInactiveException extends LibraryException {

    public MemberInactiveException(Long memberId) {
        super(ErrorKind.MEMBER_INACTIVE, "Member " + memberId + " is not active and cannot borrow books");
    }
}
