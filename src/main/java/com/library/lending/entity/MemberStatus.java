package com.library.lending.entity;

/**
 * Membership standing. Only {@link #ACTIVE} members may check out books.
 * Stored by name ({@code EnumType.STRING}).
 */
public enum MemberStatus {
    ACTIVE,
    INACTIVE
}
