package jobtrack.gmail.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.web.SecurityFilterChain;

@Configuration
public class SecurityConfig {

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .authorizeHttpRequests(authorize -> authorize
                        .requestMatchers("/", "/login", "/error").permitAll()
                        .anyRequest().authenticated()
                )

                // Sign-in with Google is the identity provider; the Gmail connection has its own OAuth flow
                .oauth2Login(oauth2 -> oauth2
                        .defaultSuccessUrl("/networking", false)
                        .failureUrl("/login?error=true")
                )

                // JSON API is called from the same-origin frontend with the session cookie
                .csrf(csrf -> csrf.ignoringRequestMatchers("/api/**"))

                .logout(logout -> logout
                        .logoutUrl("/logout")
                        .logoutSuccessUrl("/login?logout=true")
                        .invalidateHttpSession(true)
                        .clearAuthentication(true)
                        .permitAll()
                );

        return http.build();
    }
}
