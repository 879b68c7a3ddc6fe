package com.scaffold.backend.global.config;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;

import com.scaffold.backend.modules.auth.application.AuthProperties;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
public class AuthConfig {

    @Bean
    public PasswordEncoder passwordEncoder(AuthProperties properties) {
        return new BCryptPasswordEncoder(properties.bcryptStrength());
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    /**
     * UTC clock shared by token expiry, cleanup and auditing.
     */
    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }
}
