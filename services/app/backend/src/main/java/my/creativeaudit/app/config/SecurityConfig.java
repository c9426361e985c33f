package my.creativeaudit.app.config;

import jakarta.servlet.DispatcherType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtValidators;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationConverter;
import org.springframework.security.web.SecurityFilterChain;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Bearer-token resource server. Tokens are issued elsewhere (HS256, shared secret); the subject is the
 * account id and the {@code roles} claim carries {@code ADMIN} for operators.
 */
@Configuration
public class SecurityConfig {
	private static final Logger logger = LoggerFactory.getLogger(SecurityConfig.class);
	private static final int MIN_SECRET_BYTES = 32;
	private final AppProperties properties;

	public SecurityConfig(AppProperties properties) {
		this.properties = properties;
	}

	@Bean
	public JwtDecoder jwtDecoder() {
		SecretKey key = new SecretKeySpec(resolveJwtSecret(), "HmacSHA256");
		NimbusJwtDecoder decoder = NimbusJwtDecoder.withSecretKey(key).build();
		decoder.setJwtValidator(JwtValidators.createDefaultWithIssuer(properties.jwt().issuer()));
		return decoder;
	}

	@Bean
	public SecurityFilterChain securityFilterChain(HttpSecurity http, JwtAuthenticationConverter jwtAuthenticationConverter) throws Exception {
		http
			.csrf(csrf -> csrf.disable())
			.sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
			.authorizeHttpRequests(auth -> auth
				.dispatcherTypeMatchers(DispatcherType.ASYNC, DispatcherType.ERROR).permitAll()
				.requestMatchers(HttpMethod.POST, "/webhooks/payments").permitAll()
				.requestMatchers("/swagger-ui/**", "/swagger-ui.html", "/v3/api-docs/**").permitAll()
				.requestMatchers("/api/admin/**").hasRole("ADMIN")
				.requestMatchers("/api/**").authenticated()
				.anyRequest().denyAll()
			)
			.oauth2ResourceServer(oauth -> oauth.jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthenticationConverter)));

		return http.build();
	}

	@Bean
	public JwtAuthenticationConverter jwtAuthenticationConverter() {
		JwtAuthenticationConverter converter = new JwtAuthenticationConverter();
		converter.setJwtGrantedAuthoritiesConverter(jwt -> {
			List<GrantedAuthority> authorities = new ArrayList<>();
			addRoles(authorities, jwt.getClaim("roles"));
			return authorities;
		});
		return converter;
	}

	private void addRoles(List<GrantedAuthority> authorities, Object rolesClaim) {
		if (rolesClaim instanceof String rolesString) {
			for (String role : rolesString.split("[,\\s]+")) {
				addRole(authorities, role);
			}
		} else if (rolesClaim instanceof Collection<?> rolesCollection) {
			for (Object role : rolesCollection) {
				addRole(authorities, role == null ? null : role.toString());
			}
		}
	}

	private void addRole(List<GrantedAuthority> authorities, String role) {
		if (role == null || role.isBlank()) {
			return;
		}
		String normalized = role.trim().toUpperCase(Locale.ROOT);
		authorities.add(new SimpleGrantedAuthority(normalized.startsWith("ROLE_") ? normalized : "ROLE_" + normalized));
	}

	private byte[] resolveJwtSecret() {
		String configured = properties.jwt().secret();
		if (configured == null || configured.isBlank()) {
			logger.warn("JWT secret not configured. Generating a runtime secret; no external token will validate.");
			return generateSecret();
		}
		byte[] secret = configured.getBytes(StandardCharsets.UTF_8);
		if (secret.length < MIN_SECRET_BYTES) {
			logger.warn("Configured JWT secret is shorter than {} bytes. Generating a runtime secret.", MIN_SECRET_BYTES);
			return generateSecret();
		}
		return secret;
	}

	private byte[] generateSecret() {
		byte[] secret = new byte[MIN_SECRET_BYTES];
		new SecureRandom().nextBytes(secret);
		return secret;
	}
}
