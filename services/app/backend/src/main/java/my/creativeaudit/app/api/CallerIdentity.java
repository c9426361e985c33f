package my.creativeaudit.app.api;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.web.server.ResponseStatusException;

/**
 * Account id and admin flag of the authenticated caller. The token subject is the account id.
 */
final class CallerIdentity {
	private static final String ADMIN_AUTHORITY = "ROLE_ADMIN";

	private CallerIdentity() {
	}

	static String accountId(Authentication authentication) {
		if (authentication == null || authentication.getName() == null || authentication.getName().isBlank()) {
			throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Caller has no account");
		}
		return authentication.getName();
	}

	static boolean isAdmin(Authentication authentication) {
		if (authentication == null) {
			return false;
		}
		for (GrantedAuthority authority : authentication.getAuthorities()) {
			if (ADMIN_AUTHORITY.equals(authority.getAuthority())) {
				return true;
			}
		}
		return false;
	}
}
