package com.microfinance.domain.service;

import com.microfinance.domain.model.UserIdentity;

/**
 * Looks up the staff member behind a request. An unknown or absent caller
 * resolves to {@code null}, which every check treats as unrestricted.
 */
public interface IdentityResolver {

    UserIdentity resolve(String email);
}
