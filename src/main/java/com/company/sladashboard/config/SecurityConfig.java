package com.company.sladashboard.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationConverter;
import org.springframework.security.oauth2.server.resource.authentication.JwtGrantedAuthoritiesConverter;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * JWT resource server for the dashboard API.
 * <ul>
 *   <li>{@code UI_READER}: dashboard reads and cache status</li>
 *   <li>{@code EDITOR}: entity, team, tenant and task writes; poller notifications</li>
 *   <li>{@code ADMIN}: everything, including forced cache refreshes and actuator</li>
 * </ul>
 * The bus upgrade endpoint is public; the bus only carries cache keys.
 */
@Configuration
@EnableWebSecurity
@EnableMethodSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    public static final String READER = "UI_READER";
    public static final String EDITOR = "EDITOR";
    public static final String ADMIN = "ADMIN";

    private static final String ROLES_CLAIM = "roles";

    private final SlaDashboardProperties properties;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        String busPath = properties.getBus().getPath();

        http
                .csrf(csrf -> csrf.disable())
                .cors(cors -> cors.configurationSource(corsConfigurationSource()))
                .sessionManagement(session ->
                        session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))

                .authorizeHttpRequests(authz -> authz
                        .requestMatchers("/actuator/health/**", "/actuator/prometheus").permitAll()
                        .requestMatchers("/api/v1/health", busPath, busPath + "/**").permitAll()
                        .requestMatchers("/swagger-ui/**", "/v3/api-docs/**").hasAnyRole(READER, ADMIN)

                        .requestMatchers(HttpMethod.POST, "/api/v1/cache/refresh").hasRole(ADMIN)
                        .requestMatchers(HttpMethod.POST, "/api/v1/cache/incremental-update").hasAnyRole(EDITOR, ADMIN)
                        .requestMatchers(HttpMethod.GET, "/api/v1/**").hasAnyRole(READER, ADMIN)
                        .requestMatchers("/api/v1/**").hasAnyRole(EDITOR, ADMIN)

                        .requestMatchers("/actuator/**").hasRole(ADMIN)
                        .anyRequest().authenticated()
                )

                .oauth2ResourceServer(oauth2 -> oauth2
                        .jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthenticationConverter()))
                );

        return http.build();
    }

    @Bean
    public JwtAuthenticationConverter jwtAuthenticationConverter() {
        JwtAuthenticationConverter converter = new JwtAuthenticationConverter();
        converter.setJwtGrantedAuthoritiesConverter(rolesAndScopes());
        return converter;
    }

    /**
     * {@code roles} claim entries become {@code ROLE_} authorities; scopes are kept as {@code SCOPE_}.
     */
    static Converter<Jwt, Collection<GrantedAuthority>> rolesAndScopes() {
        JwtGrantedAuthoritiesConverter scopes = new JwtGrantedAuthoritiesConverter();
        return jwt -> {
            List<GrantedAuthority> authorities = new ArrayList<>();
            List<String> roles = jwt.getClaimAsStringList(ROLES_CLAIM);
            if (roles != null) {
                roles.forEach(role -> authorities.add(new SimpleGrantedAuthority("ROLE_" + role)));
            }
            Collection<GrantedAuthority> scopeAuthorities = scopes.convert(jwt);
            if (scopeAuthorities != null) {
                authorities.addAll(scopeAuthorities);
            }
            return authorities;
        };
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOriginPatterns(properties.getBus().getAllowedOrigins());
        configuration.setAllowedMethods(List.of("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS"));
        configuration.setAllowedHeaders(List.of("*"));
        configuration.setExposedHeaders(List.of("X-Request-ID", "Cache-Control"));
        configuration.setAllowCredentials(true);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/**", configuration);
        source.registerCorsConfiguration(properties.getBus().getPath(), configuration);
        return source;
    }
}
