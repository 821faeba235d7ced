package io.doers.escrow.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of back-office roles and the money operations each may perform.
 */
public enum AdminRole {
	SUPER_ADMIN(EnumSet.allOf(Permission.class)),
	FINANCE_ADMIN(EnumSet.of(Permission.RELEASE_ESCROW, Permission.REFUND, Permission.CONFIRM_PAYOUT,
			Permission.VIEW_PAYOUTS, Permission.VIEW_RECONCILIATION)),
	SUPPORT(EnumSet.of(Permission.VIEW_PAYOUTS, Permission.MANAGE_DLQ));

	public enum Permission {
		RELEASE_ESCROW,
		REFUND,
		CONFIRM_PAYOUT,
		VIEW_PAYOUTS,
		VIEW_RECONCILIATION,
		MANAGE_DLQ
	}

	private final Set<Permission> permissions;

	AdminRole(Set<Permission> permissions) {
		this.permissions = permissions;
	}

	public boolean has(Permission permission) {
		return permissions.contains(permission);
	}

	/**
	 * Role names (without the ROLE_ prefix) holding the given permission.
	 */
	public static String[] rolesWith(Permission permission) {
		return Arrays.stream(values())
			.filter(role -> role.has(permission))
			.map(Enum::name)
			.toArray(String[]::new);
	}
}
