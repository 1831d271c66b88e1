package com.microfinance.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;
import java.util.Set;

/**
 * Identity of the staff member issuing a request, as supplied by the
 * identity resolver. Absence of an identity means "no restriction".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserIdentity {

    private static final Set<String> RESTRICTED_ROLES = Set.of("loan officer", "field agent");
    private static final Set<String> APPROVER_ROLES = Set.of("admin", "branch head");

    private String email;
    private String username;
    private String role;
    private String branchName;
    private String branchCode;

    public String normalizedRole() {
        return role == null ? "" : role.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Loan officers and field agents only see and mutate records they created or are assigned to.
     */
    public boolean isRestricted() {
        return RESTRICTED_ROLES.contains(normalizedRole());
    }

    public boolean isApprover() {
        return APPROVER_ROLES.contains(normalizedRole());
    }

    /**
     * Ownership rule shared by loans and groups: creator email (case-insensitive) or assigned officer name.
     */
    public boolean owns(String createdByEmail, String loanOfficerName) {
        boolean byEmail = createdByEmail != null && email != null && createdByEmail.equalsIgnoreCase(email);
        boolean byOfficer = loanOfficerName != null && loanOfficerName.equals(username);
        return byEmail || byOfficer;
    }
}
