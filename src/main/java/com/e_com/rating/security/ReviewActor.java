package com.e_com.rating.security;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.ArrayList;
import java.util.List;

/**
 * Authenticated caller with the capabilities the review API checks.
 */
@Getter
@ToString
@AllArgsConstructor
public class ReviewActor {

    public static final String ROLE_CUSTOMER = "CUSTOMER";
    public static final String ROLE_ADMIN = "ADMIN";

    private final Long userId;
    private final String displayName;
    private final boolean customer;
    private final boolean admin;

    public List<GrantedAuthority> getAuthorities() {
        List<GrantedAuthority> authorities = new ArrayList<>();
        if (customer) {
            authorities.add(new SimpleGrantedAuthority("ROLE_" + ROLE_CUSTOMER));
        }
        if (admin) {
            authorities.add(new SimpleGrantedAuthority("ROLE_" + ROLE_ADMIN));
        }
        return authorities;
    }
}
